package br.com.ferroxide.chatstore.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteConfig;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Pool of SQLite connections with foreign-key enforcement switched on for each of them.
 * <p>
 * SQLite keeps {@code foreign_keys} per connection and defaults it to off, and the cascades
 * are the only thing removing dependent rows, so the pragma is set both as a driver property
 * and as the pool's connection init statement.
 * <p>
 * The database runs in WAL mode: open read transactions keep their snapshot while writers
 * commit. Writers queue on the busy timeout. Write transactions must start with a write
 * statement, otherwise the lock upgrade fails with {@code SQLITE_BUSY_SNAPSHOT} instead of waiting.
 */
@Configuration
public class StoreDataSourceConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreDataSourceConfig.class);

    static final String FOREIGN_KEYS_ON = "PRAGMA foreign_keys = ON";

    @Bean
    public DataSource dataSource(StoreProperties props) throws IOException {
        Path database = props.databasePath().toAbsolutePath();
        Files.createDirectories(database.getParent());

        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.enforceForeignKeys(true);
        sqlite.setJournalMode(SQLiteConfig.JournalMode.WAL);
        sqlite.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        sqlite.setBusyTimeout((int) props.busyTimeout().toMillis());

        HikariConfig config = new HikariConfig();
        config.setPoolName("ChatStorePool");
        config.setDriverClassName("org.sqlite.JDBC");
        config.setJdbcUrl("jdbc:sqlite:" + database);
        config.setDataSourceProperties(sqlite.toProperties());
        config.setConnectionInitSql(FOREIGN_KEYS_ON);
        config.setMaximumPoolSize(props.poolSize());
        config.setMinimumIdle(1);

        log.info("Opening chat store at {} (pool size: {})", database, props.poolSize());
        return new HikariDataSource(config);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
