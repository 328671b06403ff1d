package br.com.ferroxide.chatstore.error;

import br.com.ferroxide.chatstore.error.exception.ConstraintViolationException;
import br.com.ferroxide.chatstore.error.exception.ReferentialIntegrityException;
import br.com.ferroxide.chatstore.error.exception.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

/**
 * Turns integrity failures reported by SQLite into {@link StoreException}s.
 * <p>
 * The extended result code of the {@link SQLiteException} in the cause chain decides the type;
 * a bare {@code SQLITE_CONSTRAINT} falls back to the SQLite error text. Anything that is not an
 * integrity failure is handed back unchanged.
 */
@Component
public class StoreExceptionTranslator {

    private static final Logger log = LoggerFactory.getLogger(StoreExceptionTranslator.class);

    static final String FOREIGN_KEY_FAILED = "FOREIGN KEY constraint failed";

    public RuntimeException translate(DataAccessException ex, String operation) {
        StoreException translated = classify(ex, operation);
        if (translated == null) {
            log.error("{} failed", operation, ex);
            return ex;
        }
        log.warn("{} rejected: {}", operation, translated.getMessage());
        return translated;
    }

    private StoreException classify(DataAccessException ex, String operation) {
        SQLiteException sqlite = findSqliteCause(ex);
        if (sqlite != null) {
            SQLiteErrorCode code = sqlite.getResultCode();
            switch (code) {
                case SQLITE_CONSTRAINT_FOREIGNKEY:
                    return new ReferentialIntegrityException(operation, ex);
                case SQLITE_CONSTRAINT_UNIQUE:
                case SQLITE_CONSTRAINT_PRIMARYKEY:
                case SQLITE_CONSTRAINT_CHECK:
                case SQLITE_CONSTRAINT_NOTNULL:
                    return new ConstraintViolationException(operation, ex);
                case SQLITE_CONSTRAINT:
                    return byMessage(sqlite.getMessage(), ex, operation);
                default:
                    return null;
            }
        }
        if (ex instanceof DataIntegrityViolationException) {
            return byMessage(ex.getMostSpecificCause().getMessage(), ex, operation);
        }
        return null;
    }

    private static StoreException byMessage(String text, DataAccessException ex, String operation) {
        if (text != null && text.contains(FOREIGN_KEY_FAILED)) {
            return new ReferentialIntegrityException(operation, ex);
        }
        return new ConstraintViolationException(operation, ex);
    }

    private static SQLiteException findSqliteCause(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof SQLiteException sqlite) {
                return sqlite;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }
}
