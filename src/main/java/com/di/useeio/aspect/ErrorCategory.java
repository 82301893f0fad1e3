package com.di.useeio.aspect;

import org.springframework.dao.DataAccessException;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Error categories attached to failed store-operation events.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>Spring {@link DataAccessException}s are categorized by the {@link SQLException} they wrap,
 * so a duplicate primary key reads as {@link #CONSTRAINT_VIOLATION} whichever layer reports it.
 */
public enum ErrorCategory {

    CONNECTION_ERROR("Database connection error", "Failed to establish or maintain database connection"),
    CONSTRAINT_VIOLATION("Database constraint violation", "Primary key, not-null or other constraint check failed"),
    UNDEFINED_TABLE("Undefined table", "Referenced table does not exist; schema migrations have not been applied"),
    SQL_SYNTAX_ERROR("SQL syntax error", "Invalid SQL syntax or semantic error"),
    TRANSACTION_ROLLBACK("Transaction rollback", "Transaction was rolled back"),
    PERMISSION_ERROR("Permission denied", "Insufficient permissions to perform operation"),
    DATABASE_ERROR("Database error", "General database operation error"),
    MIGRATION_ERROR("Migration error", "Schema migration failed or is in an invalid state"),
    NETWORK_ERROR("Network error", "Network communication failure"),
    VALIDATION_ERROR("Validation error", "Invalid argument or state"),
    CONFIGURATION_ERROR("Configuration error", "Application configuration issue"),
    RESOURCE_ERROR("Resource error", "Missing resource or system resource exhaustion"),
    SERIALIZATION_ERROR("Serialization error", "Reference data could not be parsed"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    /** PostgreSQL SQL state for {@code undefined_table}. */
    public static final String UNDEFINED_TABLE_STATE = "42P01";

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

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(ErrorCategory::isMigrationError, MIGRATION_ERROR);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(ErrorCategory::isSerializationError, SERIALIZATION_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
        MATCHERS.put(ErrorCategory::isResourceError, RESOURCE_ERROR);
    }

    private static final Map<String, ErrorCategory> SQL_STATE_PREFIX = Map.of(
            "08", CONNECTION_ERROR,
            "23", CONSTRAINT_VIOLATION,
            "42", SQL_SYNTAX_ERROR,
            "40", TRANSACTION_ROLLBACK
    );

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        SQLException sqlEx = findSqlException(exception);
        if (sqlEx != null) {
            return categorizeSqlException(sqlEx);
        }
        if (exception instanceof DataAccessException) {
            return DATABASE_ERROR;
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    /**
     * True when the failure (or anything it wraps) is PostgreSQL's "relation does not exist".
     */
    public static boolean isUndefinedTable(Throwable exception) {
        SQLException sqlEx = findSqlException(exception);
        return sqlEx != null && UNDEFINED_TABLE_STATE.equals(sqlEx.getSQLState());
    }

    private static SQLException findSqlException(Throwable exception) {
        Throwable current = exception;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (current instanceof SQLException) {
                return (SQLException) current;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }

    private static ErrorCategory categorizeSqlException(SQLException sqlEx) {
        String sqlState = sqlEx.getSQLState();
        if (UNDEFINED_TABLE_STATE.equals(sqlState)) {
            return UNDEFINED_TABLE;
        }
        if (sqlState != null) {
            ErrorCategory byState = SQL_STATE_PREFIX.get(sqlState.substring(0, Math.min(2, sqlState.length())));
            if (byState != null) {
                return byState;
            }
        }
        String msg = sqlEx.getMessage();
        if (msg != null) {
            String lower = msg.toLowerCase();
            if (containsAny(lower, "connection", "timeout", "refused", "closed")) return CONNECTION_ERROR;
            if (containsAny(lower, "permission", "access denied", "unauthorized", "forbidden")) return PERMISSION_ERROR;
            if (containsAny(lower, "constraint", "unique", "duplicate key", "null value")) return CONSTRAINT_VIOLATION;
            if (containsAny(lower, "does not exist")) return UNDEFINED_TABLE;
            if (containsAny(lower, "syntax", "parse error")) return SQL_SYNTAX_ERROR;
        }
        return DATABASE_ERROR;
    }

    // --- Matcher helpers ---

    private static boolean isMigrationError(Throwable t) {
        return t.getClass().getName().startsWith("org.flywaydb.");
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException
                || messageContains(t, "timeout", "timed out");
    }

    private static boolean isNetworkError(Throwable t) {
        return t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketException;
    }

    private static boolean isSerializationError(Throwable t) {
        return t instanceof com.fasterxml.jackson.core.JsonProcessingException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof java.util.NoSuchElementException;
    }

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof org.springframework.beans.factory.BeanCreationException
                || t instanceof org.springframework.context.ApplicationContextException
                || t instanceof org.springframework.boot.context.properties.bind.BindException;
    }

    private static boolean isResourceError(Throwable t) {
        return t instanceof java.io.FileNotFoundException
                || t instanceof java.nio.file.NoSuchFileException
                || t instanceof OutOfMemoryError;
    }

    private static boolean messageContains(Throwable t, String... keywords) {
        String msg = t.getMessage();
        return msg != null && containsAny(msg.toLowerCase(), keywords);
    }

    private static boolean containsAny(String text, String... keywords) {
        if (text == null) return false;
        for (String k : keywords) {
            if (text.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
