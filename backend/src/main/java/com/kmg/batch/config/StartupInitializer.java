package com.kmg.batch.config;

import com.kmg.batch.repo.CostRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.nio.file.Files;

/**
 * Prepares the run directory and the cost database before any command runs.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class StartupInitializer implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StartupInitializer.class);

    private final BatchProperties properties;
    private final JdbcTemplate jdbcTemplate;
    private final CostRepository costRepository;

    public StartupInitializer(BatchProperties properties, JdbcTemplate jdbcTemplate, CostRepository costRepository) {
        this.properties = properties;
        this.jdbcTemplate = jdbcTemplate;
        this.costRepository = costRepository;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        Files.createDirectories(properties.outputDirPath());
        configureSqlitePragmas();
        costRepository.initializeSchema();
        log.debug("Run directory {} ready", properties.outputDirPath().toAbsolutePath());
    }

    private void configureSqlitePragmas() {
        try {
            jdbcTemplate.queryForObject("PRAGMA journal_mode=WAL", String.class);
            jdbcTemplate.execute("PRAGMA synchronous=NORMAL");
            jdbcTemplate.execute("PRAGMA busy_timeout=30000");
        } catch (DataAccessException e) {
            log.warn("Failed to configure SQLite pragmas: {}", e.getMessage());
        }
    }
}
