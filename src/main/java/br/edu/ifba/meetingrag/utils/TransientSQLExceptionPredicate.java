package br.edu.ifba.meetingrag.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Predicate to determine if an exception represents a transient SQL error
 * that should be retried.
 *
 * <p>The store is SQLite, so the primary signal is the SQLite result code:
 * {@code SQLITE_BUSY*} and {@code SQLITE_LOCKED*} mean another connection holds
 * the lock and the statement can succeed later. Generic SQLSTATE classes and
 * message patterns are checked as well so the predicate keeps working behind
 * wrapping exceptions.</p>
 *
 * <h2>Transient (will retry):</h2>
 * <ul>
 *   <li>SQLITE_BUSY, SQLITE_LOCKED and their extended codes</li>
 *   <li>{@link SQLTransientException} and {@link SQLTimeoutException}</li>
 *   <li><b>08xxx</b> connection exceptions, <b>40xxx</b> transaction rollback</li>
 *   <li>Messages such as "database is locked" or "connection reset"</li>
 * </ul>
 *
 * <h2>Permanent (will NOT retry):</h2>
 * <ul>
 *   <li>Constraint violations, syntax errors, corrupt database files</li>
 *   <li>Everything else</li>
 * </ul>
 */
public final class TransientSQLExceptionPredicate implements Predicate<Throwable> {

    private static final Logger logger = LoggerFactory.getLogger(TransientSQLExceptionPredicate.class);

    private static final Set<String> TRANSIENT_SQLSTATE_PREFIXES = Set.of(
        "08", // Connection Exception
        "40"  // Transaction Rollback
    );

    private static final Pattern TRANSIENT_MESSAGE_PATTERN = Pattern.compile(
        "(?i)(" +
        "database\\s+(is\\s+locked|table\\s+is\\s+locked)" +
        "|sqlite_busy" +
        "|sqlite_locked" +
        "|connection\\s+(refused|reset|closed|timed\\s*out|lost)" +
        "|lock\\s+wait\\s+timeout" +
        "|deadlock\\s+detected" +
        "|i/o\\s+error" +
        "|try\\s+(again|later)" +
        "|temporarily\\s+unavailable" +
        ")"
    );

    /**
     * Tests whether the given exception, or anything in its cause chain,
     * represents a transient SQL error.
     *
     * @param throwable the exception to test (may be null)
     * @return {@code true} if the failure is transient and should be retried
     */
    @Override
    public boolean test(final Throwable throwable) {
        Throwable current = throwable;
        int depth = 0;
        while (current != null && depth < 16) {
            if (isTransient(current)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }

    private boolean isTransient(final Throwable throwable) {
        if (throwable instanceof SQLTransientException) {
            logger.debug("Transient SQL exception type detected: {}", throwable.getClass().getSimpleName());
            return true;
        }

        if (throwable instanceof SQLiteException sqliteException && isBusyOrLocked(sqliteException.getResultCode())) {
            logger.debug("SQLite lock contention detected: {}", sqliteException.getResultCode());
            return true;
        }

        if (throwable instanceof SQLException sqlException) {
            if (isTransientSqlState(sqlException.getSQLState())) {
                return true;
            }
            SQLException next = sqlException.getNextException();
            while (next != null) {
                if (isTransientSqlState(next.getSQLState()) || isTransientByMessage(next.getMessage())) {
                    return true;
                }
                next = next.getNextException();
            }
        }

        return isTransientByMessage(throwable.getMessage());
    }

    private boolean isBusyOrLocked(final SQLiteErrorCode code) {
        if (code == null) {
            return false;
        }
        final String name = code.name();
        return name.startsWith("SQLITE_BUSY") || name.startsWith("SQLITE_LOCKED");
    }

    private boolean isTransientSqlState(final String sqlState) {
        if (sqlState == null || sqlState.length() < 2) {
            return false;
        }
        final String prefix = sqlState.substring(0, 2);
        if (TRANSIENT_SQLSTATE_PREFIXES.contains(prefix)) {
            logger.debug("Transient SQLSTATE detected: {}", sqlState);
            return true;
        }
        return false;
    }

    private boolean isTransientByMessage(final String message) {
        if (message == null || message.isEmpty()) {
            return false;
        }
        if (TRANSIENT_MESSAGE_PATTERN.matcher(message).find()) {
            logger.debug("Transient error detected by message pattern: {}",
                message.length() > 100 ? message.substring(0, 100) + "..." : message);
            return true;
        }
        return false;
    }
}
