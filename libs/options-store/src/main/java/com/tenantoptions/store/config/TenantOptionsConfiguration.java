package com.tenantoptions.store.config;

import com.tenantoptions.model.ModelRegistry;
import com.tenantoptions.model.OptionModel;
import com.tenantoptions.model.OptionType;
import com.tenantoptions.model.SelectionModel;
import com.tenantoptions.store.DatabaseVendorResolver;
import com.tenantoptions.store.LifecyclePolicy;
import com.tenantoptions.store.OptionCatalog;
import com.tenantoptions.store.StoreContext;
import com.tenantoptions.store.TenantOptionsExceptionTranslator;
import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import javax.sql.DataSource;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Wires the model registry, the store context and the option catalog from
 * {@link TenantOptionsProperties}.
 * <p>
 * The catalog's {@link JdbcClient} runs on its own {@link JdbcTemplate} carrying the
 * {@link TenantOptionsExceptionTranslator}, so constraint and trigger failures of every vendor
 * surface as {@code DataIntegrityViolationException}.
 */
@Configuration
@EnableConfigurationProperties(TenantOptionsProperties.class)
public class TenantOptionsConfiguration {

    @Bean
    public ModelRegistry tenantOptionsModelRegistry(TenantOptionsProperties properties) {
        return buildRegistry(properties);
    }

    @Bean
    public Clock tenantOptionsClock() {
        return Clock.systemUTC();
    }

    @Bean
    public DatabaseVendorResolver databaseVendorResolver(DataSource dataSource, TenantOptionsProperties properties) {
        return new DatabaseVendorResolver(dataSource, properties.dbVendorOverride());
    }

    @Bean
    public StoreContext tenantOptionsStoreContext(
            DataSource dataSource,
            PlatformTransactionManager transactionManager,
            Clock tenantOptionsClock,
            DatabaseVendorResolver vendorResolver,
            TenantOptionsProperties properties) {
        var template = new JdbcTemplate(dataSource);
        template.setExceptionTranslator(new TenantOptionsExceptionTranslator());
        return new StoreContext(
                JdbcClient.create(template),
                new TransactionTemplate(transactionManager),
                tenantOptionsClock,
                new LifecyclePolicy(properties.allowDeletedOptionSelection()),
                vendorResolver.resolve());
    }

    @Bean
    public OptionCatalog optionCatalog(ModelRegistry tenantOptionsModelRegistry, StoreContext tenantOptionsStoreContext) {
        return OptionCatalog.create(tenantOptionsModelRegistry, tenantOptionsStoreContext);
    }

    /**
     * Builds and initializes a registry from configuration.
     *
     * @throws IllegalArgumentException if a default option declares an unknown type
     */
    public static ModelRegistry buildRegistry(TenantOptionsProperties properties) {
        var registry = new ModelRegistry();
        for (TenantOptionsProperties.ModelProperties pair : properties.models()) {
            String tenantModel = pair.tenantModel() != null ? pair.tenantModel() : properties.tenantModel();
            String tenantTable = pair.tenantTable() != null ? pair.tenantTable() : properties.tenantTable();

            var option = OptionModel.builder(pair.option())
                    .table(pair.table())
                    .tenantModel(tenantModel)
                    .tenantTable(tenantTable)
                    .selectionModel(pair.selection());
            for (Map.Entry<String, TenantOptionsProperties.DefaultOptionProperties> entry
                    : pair.defaultOptions().entrySet()) {
                String declared = entry.getValue() == null ? null : entry.getValue().optionType();
                option.defaultOption(entry.getKey(), parseOptionType(declared));
            }
            if (pair.constraints() != null) {
                option.constraints(new LinkedHashSet<>(pair.constraints()));
            }
            registry.register(option.build());

            if (pair.selection() != null) {
                var selection = SelectionModel.builder(pair.selection())
                        .table(pair.selectionTable())
                        .tenantModel(tenantModel)
                        .tenantTable(tenantTable)
                        .optionModel(pair.option());
                if (pair.selectionConstraints() != null) {
                    selection.constraints(new LinkedHashSet<>(pair.selectionConstraints()));
                }
                registry.register(selection.build());
            }
        }
        registry.initialize();
        return registry;
    }

    /** Accepts an enum name in any case or a persisted code; null means MANDATORY. */
    static OptionType parseOptionType(String value) {
        if (value == null || value.isBlank()) {
            return OptionType.MANDATORY;
        }
        String trimmed = value.trim();
        return OptionType.fromCode(trimmed.toLowerCase(Locale.ROOT)).orElseGet(() -> {
            try {
                return OptionType.valueOf(trimmed.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown option type '%s'".formatted(value), e);
            }
        });
    }
}
