package com.foresight.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Chooses the analysis store from {@code foresight.persistence.store}.
 * <p>
 * {@code jdbc} (the default) persists to the configured {@link DataSource} and
 * creates the schema on startup. {@code memory} keeps everything in process,
 * which is suitable for development but not durable across restarts.
 */
@Configuration
public class RepositoryConfig {

    private static final Logger log = LoggerFactory.getLogger(RepositoryConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "foresight.persistence", name = "store", havingValue = "jdbc", matchIfMissing = true)
    public AnalysisRepository jdbcAnalysisRepository(DataSource dataSource) throws Exception {
        log.info("Configuring JDBC analysis repository");
        var repository = new JdbcAnalysisRepository(dataSource);
        repository.createTables();
        return repository;
    }

    @Bean
    @ConditionalOnProperty(prefix = "foresight.persistence", name = "store", havingValue = "memory")
    public AnalysisRepository inMemoryAnalysisRepository() {
        log.info("Using in-memory analysis repository (analyses will not persist across restarts)");
        return new InMemoryAnalysisRepository();
    }
}
