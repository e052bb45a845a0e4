package com.ivamare.workflow.exception;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Classifies database exceptions as transient (the store is unavailable or the
 * transaction lost a race and may be retried) or not.
 *
 * <p>Used by the transactional services to map failures to
 * {@link StoreUnavailableException} and by workers to decide between backing off
 * and logging an error.
 *
 * @see <a href="https://www.postgresql.org/docs/current/errcodes-appendix.html">PostgreSQL Error Codes</a>
 */
public final class DatabaseExceptionClassifier {

    private static final String UNKNOWN = "Unknown";

    private DatabaseExceptionClassifier() {
    }

    /**
     * Exception types considered transient, most specific first.
     */
    private static final Map<Class<? extends Throwable>, String> TRANSIENT_TYPES = new LinkedHashMap<>();

    static {
        TRANSIENT_TYPES.put(CannotGetJdbcConnectionException.class, "Spring CannotGetJdbcConnectionException");
        TRANSIENT_TYPES.put(TransientDataAccessException.class, "Spring TransientDataAccessException");
        TRANSIENT_TYPES.put(RecoverableDataAccessException.class, "Spring RecoverableDataAccessException");
        TRANSIENT_TYPES.put(DataAccessResourceFailureException.class, "Spring DataAccessResourceFailureException");
        TRANSIENT_TYPES.put(SQLTimeoutException.class, "JDBC SQLTimeoutException");
        TRANSIENT_TYPES.put(SQLTransientException.class, "JDBC SQLTransientException");
        TRANSIENT_TYPES.put(SQLRecoverableException.class, "JDBC SQLRecoverableException");
        // A closed or broken connection can be retried on a fresh one
        TRANSIENT_TYPES.put(SQLNonTransientConnectionException.class, "JDBC SQLNonTransientConnectionException");
    }

    /**
     * PostgreSQL SQL states for connection loss (08), resource exhaustion (53),
     * operator intervention (57) and transaction rollback (40).
     */
    private static final Set<String> TRANSIENT_SQL_STATES = Set.of(
        "08000", "08001", "08003", "08004", "08006", "08007", "08P01",
        "53000", "53100", "53200", "53300",
        "57P01", "57P02", "57P03", "57P04",
        "40001", "40002", "40003", "40P01"
    );

    /**
     * Lower-case message fragments that indicate an unreachable or overloaded store.
     */
    private static final List<String> TRANSIENT_MESSAGE_PATTERNS = List.of(
        "connection refused",
        "connection reset",
        "connection timed out",
        "socket timeout",
        "read timed out",
        "connect timed out",
        "connection is not available",
        "pool exhausted",
        "cannot acquire connection",
        "connection closed",
        "broken pipe",
        "no route to host",
        "terminating connection",
        "server closed the connection",
        "could not connect to server",
        "the database system is starting up",
        "the database system is shutting down"
    );

    /**
     * Determine if the exception, or any cause in its chain, is transient.
     *
     * @param ex the exception to classify
     * @return true if the failed operation can be retried
     */
    public static boolean isTransient(Throwable ex) {
        return !UNKNOWN.equals(getTransientReason(ex));
    }

    /**
     * Get the SQL state from an exception chain if available.
     *
     * @param ex the exception to inspect
     * @return the SQL state code, or null if not available
     */
    public static String getSqlState(Throwable ex) {
        for (Throwable current = ex; current != null; current = next(current)) {
            if (current instanceof SQLException sqlEx && sqlEx.getSQLState() != null) {
                return sqlEx.getSQLState();
            }
        }
        return null;
    }

    /**
     * Brief description of why the exception was classified as transient.
     *
     * @param ex the exception to describe
     * @return a description, or "Unknown" if the exception is not transient
     */
    public static String getTransientReason(Throwable ex) {
        for (Throwable current = ex; current != null; current = next(current)) {
            String reason = directReason(current);
            if (reason != null) {
                return reason;
            }
        }
        return UNKNOWN;
    }

    /**
     * Translate a data access failure raised inside a store operation.
     *
     * @param operation name of the operation, for the message
     * @param ex the failure
     * @return a {@link StoreUnavailableException} for transient failures, otherwise {@code ex} itself
     */
    public static RuntimeException translate(String operation, RuntimeException ex) {
        if (ex instanceof DataAccessException && isTransient(ex)) {
            return new StoreUnavailableException(operation, ex);
        }
        return ex;
    }

    private static String directReason(Throwable ex) {
        for (Map.Entry<Class<? extends Throwable>, String> entry : TRANSIENT_TYPES.entrySet()) {
            if (entry.getKey().isInstance(ex)) {
                return entry.getValue();
            }
        }
        if (ex instanceof SQLException sqlEx) {
            String sqlState = sqlEx.getSQLState();
            if (sqlState != null && TRANSIENT_SQL_STATES.contains(sqlState)) {
                return "SQL state " + sqlState;
            }
        }
        String message = ex.getMessage();
        if (message != null) {
            String lowerMessage = message.toLowerCase();
            for (String pattern : TRANSIENT_MESSAGE_PATTERNS) {
                if (lowerMessage.contains(pattern)) {
                    return "Message pattern: " + pattern;
                }
            }
        }
        return null;
    }

    private static Throwable next(Throwable ex) {
        Throwable cause = ex.getCause();
        return cause != ex ? cause : null;
    }
}
