package com.sealpost;

import com.sealpost.session.SessionManager;
import com.sealpost.store.SyncCacheRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledIfEnvironmentVariable;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ContextConfiguration;

import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest
@ContextConfiguration(initializers = CassandraContainerInitializer.class)
@DisabledIfEnvironmentVariable(named = "SKIP_DB_TESTS", matches = "true")
class SealpostApplicationTests {

	@Autowired
	private SessionManager sessionManager;

	@Autowired
	private SyncCacheRepository syncCacheRepository;

	@Test
	void contextLoads() {
		assertNotNull(sessionManager);
		assertNotNull(syncCacheRepository);
	}

}
