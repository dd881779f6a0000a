package com.di.poolguard.exception;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Coarse classification of query executor failures, used for log lines and metric tags.
 *
 * <p>The category is informational only: retry and circuit breaker decisions treat every
 * failure the same, whatever its category.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 */
public enum ErrorCategory {

    CONNECTION_ERROR("Connection error", "Could not obtain or keep a database connection"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded its time limit"),
    AUTHENTICATION_ERROR("Authentication error", "Credentials rejected or access denied"),
    SQL_SYNTAX_ERROR("SQL syntax error", "Statement could not be parsed or resolved"),
    CONSTRAINT_VIOLATION("Constraint violation", "A database constraint check failed"),
    TRANSACTION_ROLLBACK("Transaction rollback", "Transaction was rolled back by the database"),
    DATABASE_ERROR("Database error", "Other error reported by the database"),
    CIRCUIT_OPEN("Circuit open", "Operation rejected while the circuit breaker is open"),
    CONFIGURATION_ERROR("Configuration error", "Invalid pool configuration"),
    APPLICATION_ERROR("Application error", "Failure raised by application code"),
    UNKNOWN("Unknown error", "Unclassified failure");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** First match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof CircuitOpenException, CIRCUIT_OPEN);
        MATCHERS.put(t -> t instanceof PoolConfigException, CONFIGURATION_ERROR);
        MATCHERS.put(ErrorCategory::isTimeout, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isConnectionFailure, CONNECTION_ERROR);
        MATCHERS.put(ErrorCategory::isAuthenticationFailure, AUTHENTICATION_ERROR);
    }

    private static final Map<String, ErrorCategory> SQL_STATE_CLASS = Map.of(
            "08", CONNECTION_ERROR,
            "28", AUTHENTICATION_ERROR,
            "23", CONSTRAINT_VIOLATION,
            "42", SQL_SYNTAX_ERROR,
            "40", TRANSACTION_ROLLBACK,
            "57", CONNECTION_ERROR
    );

    /**
     * Classifies a failure. Wrapped exceptions (e.g. Spring's {@code DataAccessException}
     * around a {@link SQLException}) are unwrapped to the first SQL exception in the chain.
     */
    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        if (exception instanceof OperationFailedException && exception.getCause() != null) {
            return categorize(exception.getCause());
        }
        SQLException sql = findSqlException(exception);
        if (sql != null) {
            return categorizeSql(sql);
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    private static ErrorCategory categorizeSql(SQLException sqlEx) {
        String sqlState = sqlEx.getSQLState();
        if (sqlState != null && sqlState.length() >= 2) {
            ErrorCategory byState = SQL_STATE_CLASS.get(sqlState.substring(0, 2));
            if (byState != null) {
                return byState;
            }
        }
        if (isTimeout(sqlEx)) return TIMEOUT_ERROR;
        if (isConnectionFailure(sqlEx)) return CONNECTION_ERROR;
        if (isAuthenticationFailure(sqlEx)) return AUTHENTICATION_ERROR;
        if (messageContains(sqlEx, "syntax", "parse error")) return SQL_SYNTAX_ERROR;
        if (messageContains(sqlEx, "constraint", "unique", "foreign key")) return CONSTRAINT_VIOLATION;
        return DATABASE_ERROR;
    }

    private static SQLException findSqlException(Throwable t) {
        Throwable current = t;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (current instanceof SQLException sql) {
                return sql;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }

    private static boolean isTimeout(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException
                || t instanceof java.sql.SQLTimeoutException
                || messageContains(t, "timeout", "timed out");
    }

    private static boolean isConnectionFailure(Throwable t) {
        return t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketException
                || t instanceof java.sql.SQLTransientConnectionException
                || t instanceof java.sql.SQLNonTransientConnectionException
                || messageContains(t, "connection refused", "connection reset", "connection is closed",
                        "could not connect", "broken pipe");
    }

    private static boolean isAuthenticationFailure(Throwable t) {
        return t instanceof java.sql.SQLInvalidAuthorizationSpecException
                || messageContains(t, "authentication", "password", "access denied", "permission denied");
    }

    private static boolean messageContains(Throwable t, String... keywords) {
        String msg = t.getMessage();
        if (msg == null) return false;
        String lower = msg.toLowerCase();
        for (String k : keywords) {
            if (lower.contains(k)) return true;
        }
        return false;
    }

    /** Lower-case tag value for metrics. */
    public String tag() {
        return name().toLowerCase();
    }

    @Override
    public String toString() {
        return name();
    }
}
