package com.evidex.core.repository;

import java.sql.SQLException;
import java.sql.SQLTransientException;

/**
 * Classifies database failures by the SQLState found in an exception's
 * cause chain. Jdbi wraps the driver's {@link SQLException}, so the state is
 * never on the top-level exception.
 */
public final class SqlStates {

    public static final String UNIQUE_VIOLATION = "23505";
    public static final String FK_CHILD_EXISTS = "23503";
    public static final String FK_PARENT_MISSING = "23506";
    /** H2 lock timeout. */
    public static final String LOCK_TIMEOUT = "HYT00";

    private SqlStates() {
    }

    /** First SQLState in the cause chain, or null. */
    public static String sqlState(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql && sql.getSQLState() != null) {
                return sql.getSQLState();
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return null;
    }

    public static boolean isUniqueViolation(Throwable error) {
        return UNIQUE_VIOLATION.equals(sqlState(error));
    }

    public static boolean isForeignKeyViolation(Throwable error) {
        String state = sqlState(error);
        return FK_CHILD_EXISTS.equals(state) || FK_PARENT_MISSING.equals(state);
    }

    /**
     * True for failures worth retrying: transient driver exceptions,
     * serialization/deadlock states (class 40) and lock timeouts.
     */
    public static boolean isTransient(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SQLTransientException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        String state = sqlState(error);
        return state != null && (state.startsWith("40") || LOCK_TIMEOUT.equals(state));
    }
}
