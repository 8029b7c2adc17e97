package com.tenantoptions.store;

import com.tenantoptions.model.DatabaseVendor;
import java.sql.DatabaseMetaData;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.jdbc.support.MetaDataAccessException;

/**
 * Decides which vendor SQL is generated for: an explicit override first, then the configured
 * {@code tenant-options.db-vendor-override}, then the connected database's product name.
 */
public class DatabaseVendorResolver {

    private static final Logger log = LoggerFactory.getLogger(DatabaseVendorResolver.class);

    private final DataSource dataSource;
    private final String configuredOverride;

    public DatabaseVendorResolver(DataSource dataSource, String configuredOverride) {
        this.dataSource = dataSource;
        this.configuredOverride = configuredOverride;
    }

    public DatabaseVendor resolve() {
        return resolve(null);
    }

    /**
     * @param override vendor key given on the command line, may be null
     * @throws IllegalArgumentException if the chosen vendor is not supported
     */
    public DatabaseVendor resolve(String override) {
        if (override != null && !override.isBlank()) {
            return DatabaseVendor.fromKey(override);
        }
        if (configuredOverride != null && !configuredOverride.isBlank()) {
            return DatabaseVendor.fromKey(configuredOverride);
        }
        if (dataSource == null) {
            throw new IllegalArgumentException("No database vendor override and no data source to inspect");
        }
        try {
            String product = JdbcUtils.extractDatabaseMetaData(dataSource, DatabaseMetaData::getDatabaseProductName);
            log.debug("Detected database product '{}'", product);
            return DatabaseVendor.fromProductName(product);
        } catch (MetaDataAccessException e) {
            throw new IllegalStateException("Could not read database metadata to detect the vendor", e);
        }
    }
}
