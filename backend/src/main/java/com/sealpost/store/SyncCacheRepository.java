package com.sealpost.store;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SyncCacheRepository extends ReactiveCassandraRepository<SyncCacheEntity, String> {
}
