package com.tenantoptions.database;

import com.tenantoptions.database.migration.FlywayMigrationRunner;
import com.tenantoptions.database.migration.JdbcMigrationHistory;
import com.tenantoptions.database.migration.MigrationHistory;
import com.tenantoptions.database.migration.MigrationLocations;
import com.tenantoptions.database.migration.MigrationProperties;
import com.tenantoptions.database.trigger.TriggerMigrationGenerator;
import com.tenantoptions.database.trigger.TriggerRemovalGenerator;
import com.tenantoptions.model.ModelRegistry;
import com.tenantoptions.store.StoreContext;
import java.time.Clock;
import javax.sql.DataSource;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Trigger generators and Flyway support.
 * <p>
 * Spring Boot's own Flyway auto-configuration migrates a single location into a single history
 * table; applications using this module should disable it ({@code spring.flyway.enabled: false})
 * and migrate per app through {@link FlywayMigrationRunner}.
 */
@Configuration
@EnableConfigurationProperties(MigrationProperties.class)
public class DatabaseConfiguration {

    @Bean
    public MigrationLocations migrationLocations(MigrationProperties properties) {
        return new MigrationLocations(properties);
    }

    @Bean
    public MigrationHistory migrationHistory(StoreContext tenantOptionsStoreContext, MigrationLocations locations) {
        return new JdbcMigrationHistory(tenantOptionsStoreContext.jdbc(), locations);
    }

    @Bean
    public TriggerMigrationGenerator triggerMigrationGenerator(
            ModelRegistry registry, MigrationHistory history, MigrationLocations locations, Clock clock) {
        return new TriggerMigrationGenerator(registry, history, locations, clock);
    }

    @Bean
    public TriggerRemovalGenerator triggerRemovalGenerator(
            ModelRegistry registry, MigrationHistory history, MigrationLocations locations, Clock clock) {
        return new TriggerRemovalGenerator(registry, history, locations, clock);
    }

    @Bean
    public FlywayMigrationRunner flywayMigrationRunner(DataSource dataSource, MigrationLocations locations) {
        return new FlywayMigrationRunner(dataSource, locations);
    }
}
