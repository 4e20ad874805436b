package com.tariffwise.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Clock;

/**
 * Provides the {@link AttemptRecordStore}.
 * <p>
 * When a {@link DataSource} is available (i.e. PostgreSQL is configured), a
 * {@link JdbcAttemptRecordStore} is created and its table ensured. Otherwise an in-memory store
 * is used as a fallback -- suitable for development and testing but neither durable across
 * restarts nor shared between instances.
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Bean
    public AttemptRecordStore attemptRecordStore(ObjectProvider<DataSource> dataSource,
                                                 ObjectMapper objectMapper) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds != null) {
            log.info("Configuring JDBC attempt record store");
            var store = new JdbcAttemptRecordStore(ds, objectMapper, Clock.systemUTC());
            store.createTables();
            return store;
        }
        log.info("No DataSource available; using in-memory attempt record store (loop detection will not persist across restarts)");
        return new InMemoryAttemptRecordStore();
    }
}
