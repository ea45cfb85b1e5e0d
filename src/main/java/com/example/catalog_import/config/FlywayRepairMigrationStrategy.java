package com.example.catalog_import.config;

import org.flywaydb.core.Flyway;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Repairs the schema history (checksums of edited migrations, failed entries) before migrating.
 */
@Configuration
public class FlywayRepairMigrationStrategy {

    /**
     * @return strategy that invokes {@link Flyway#repair()} prior to {@link Flyway#migrate()}.
     */
    @Bean
    public FlywayMigrationStrategy repairThenMigrateStrategy() {
        return flyway -> {
            flyway.repair();
            flyway.migrate();
        };
    }
}
