package com.sealpost;

import com.datastax.oss.driver.api.core.CqlSession;
import org.springframework.boot.test.util.TestPropertyValues;
import org.springframework.context.ApplicationContextInitializer;
import org.springframework.context.ConfigurableApplicationContext;
import org.testcontainers.containers.CassandraContainer;
import org.testcontainers.utility.DockerImageName;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Starts one shared Cassandra container for context tests and creates the dm_cache schema in it.
 */
public class CassandraContainerInitializer
        implements ApplicationContextInitializer<ConfigurableApplicationContext> {

    static final CassandraContainer<?> CASSANDRA =
            new CassandraContainer<>(DockerImageName.parse("cassandra:4.1"))
                    .withStartupTimeout(Duration.ofMinutes(3));

    private static boolean started;

    private static synchronized void ensureStarted() {
        if (started) {
            return;
        }
        CASSANDRA.start();
        applySchema();
        started = true;
    }

    private static void applySchema() {
        String schema;
        try (InputStream schemaStream = CassandraContainerInitializer.class.getResourceAsStream("/schema.cql")) {
            if (schemaStream == null) {
                throw new IllegalStateException("schema.cql not found on classpath");
            }
            schema = new String(schemaStream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read schema.cql", e);
        }
        try (CqlSession session = CqlSession.builder()
                .addContactPoint(new InetSocketAddress(CASSANDRA.getHost(), CASSANDRA.getMappedPort(9042)))
                .withLocalDatacenter(CASSANDRA.getLocalDatacenter())
                .build()) {
            for (String statement : schema.split(";")) {
                String trimmed = statement.trim();
                if (!trimmed.isEmpty()) {
                    session.execute(trimmed);
                }
            }
        }
    }

    @Override
    public void initialize(ConfigurableApplicationContext ctx) {
        ensureStarted();
        TestPropertyValues.of(
                "spring.cassandra.contact-points=" + CASSANDRA.getHost() + ":" + CASSANDRA.getMappedPort(9042),
                "spring.cassandra.local-datacenter=" + CASSANDRA.getLocalDatacenter(),
                "spring.cassandra.keyspace-name=sealpost"
        ).applyTo(ctx.getEnvironment());
    }
}
