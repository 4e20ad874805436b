package com.tariffwise.core.reference;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.sql.SQLException;

/**
 * Chooses the reference dataset implementation.
 * <p>
 * With {@code tariffwise.reference.source=jdbc} and a {@link DataSource} available, codes are
 * read from the database. Otherwise the bundled JSON resource is loaded into memory.
 */
@Configuration
public class ReferenceConfig {

    private static final Logger log = LoggerFactory.getLogger(ReferenceConfig.class);

    @Bean
    public ReferenceDataset referenceDataset(ReferenceProperties props,
                                             ObjectProvider<DataSource> dataSource,
                                             ResourceLoader resourceLoader,
                                             ObjectMapper objectMapper) throws IOException, SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if ("jdbc".equalsIgnoreCase(props.getSource())) {
            if (ds != null) {
                log.info("Using JDBC reference dataset");
                var dataset = new JdbcReferenceDataset(ds);
                dataset.createTables();
                return dataset;
            }
            log.warn("Reference source 'jdbc' requested but no DataSource is configured; falling back to {}",
                    props.getResource());
        }
        Resource resource = resourceLoader.getResource(props.getResource());
        try (InputStream in = resource.getInputStream()) {
            log.info("Loading reference dataset from {}", props.getResource());
            return InMemoryReferenceDataset.load(in, objectMapper);
        }
    }
}
