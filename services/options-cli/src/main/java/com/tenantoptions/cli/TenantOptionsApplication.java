package com.tenantoptions.cli;

import com.tenantoptions.database.DatabaseConfiguration;
import com.tenantoptions.store.config.TenantOptionsConfiguration;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.context.annotation.Import;

/**
 * Entry point of the {@code tenant-options} operator command line.
 *
 * <p>The Spring context carries the model registry, the repositories and the migration tooling;
 * picocli parses the arguments and runs one subcommand against it.
 *
 * <pre>{@code
 * java -jar tenant-options.jar sync-options
 * java -jar tenant-options.jar make-triggers --app tasks --dry-run
 * java -jar tenant-options.jar validate-options
 * }</pre>
 *
 * <p>Spring Boot's Flyway auto-configuration is excluded: migrations are applied per app by the
 * {@code migrate} command.
 */
@SpringBootApplication(exclude = FlywayAutoConfiguration.class)
@Import({TenantOptionsConfiguration.class, DatabaseConfiguration.class})
public class TenantOptionsApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TenantOptionsApplication.class, args)));
    }
}
