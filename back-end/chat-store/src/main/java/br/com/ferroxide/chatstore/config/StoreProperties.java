package br.com.ferroxide.chatstore.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Location and connection settings of the SQLite store.
 *
 * <pre>{@code
 * ferroxide:
 *   store:
 *     data-dir: ${user.home}/.ferroxide
 *     database-file: database.sqlite3
 *     pool-size: 4
 *     busy-timeout: 5s
 * }</pre>
 *
 * @see StoreDataSourceConfig
 */
@ConfigurationProperties(prefix = "ferroxide.store")
public record StoreProperties(
        Path dataDir,
        @DefaultValue("database.sqlite3") String databaseFile,
        @DefaultValue("4") int poolSize,
        @DefaultValue("5s") Duration busyTimeout) {

    public StoreProperties {
        if (dataDir == null) {
            throw new IllegalArgumentException("ferroxide.store.data-dir must be set");
        }
        if (databaseFile == null || databaseFile.isBlank()) {
            throw new IllegalArgumentException("ferroxide.store.database-file must not be blank");
        }
        if (poolSize <= 0) {
            throw new IllegalArgumentException(
                    "ferroxide.store.pool-size must be positive, got: " + poolSize);
        }
        if (busyTimeout.isNegative()) {
            throw new IllegalArgumentException("ferroxide.store.busy-timeout must not be negative");
        }
    }

    /** The database file under {@link #dataDir()}; leading slashes are ignored. */
    public Path databasePath() {
        String relative = databaseFile.replaceFirst("^/+", "");
        return dataDir.resolve(relative);
    }
}
