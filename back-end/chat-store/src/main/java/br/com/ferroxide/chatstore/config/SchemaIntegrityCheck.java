package br.com.ferroxide.chatstore.config;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Refuses to start when the pool hands out connections without foreign-key enforcement.
 */
@Component
@RequiredArgsConstructor
public class SchemaIntegrityCheck implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SchemaIntegrityCheck.class);

    private final JdbcTemplate jdbc;

    @Override
    public void run(ApplicationArguments args) {
        verifyForeignKeys();

        log.info("Chat store ready: {} users, {} rooms, {} messages",
                count("users"), count("rooms"), count("messages"));
    }

    public void verifyForeignKeys() {
        Integer enabled = jdbc.queryForObject("PRAGMA foreign_keys", Integer.class);
        if (enabled == null || enabled != 1) {
            throw new IllegalStateException("SQLite foreign key enforcement is off; cascading deletes would not run");
        }
        log.debug("Foreign key enforcement active");
    }

    private long count(String table) {
        Long n = jdbc.queryForObject("select count(*) from " + table, Long.class);
        return n == null ? 0 : n;
    }
}
