package com.starscape.mediacatalog.common.persistence;

import org.springframework.dao.DataIntegrityViolationException;

import java.sql.SQLException;

/**
 * Tells constraint violations apart by SQLSTATE, which H2 and PostgreSQL report alike.
 */
public final class IntegrityViolations {

    private static final String UNIQUE_VIOLATION = "23505";
    private static final String FOREIGN_KEY_VIOLATION = "23503";

    private IntegrityViolations() {
    }

    public static boolean isUniqueViolation(DataIntegrityViolationException e) {
        return UNIQUE_VIOLATION.equals(sqlState(e));
    }

    public static boolean isForeignKeyViolation(DataIntegrityViolationException e) {
        return FOREIGN_KEY_VIOLATION.equals(sqlState(e));
    }

    private static String sqlState(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException) {
                return ((SQLException) cause).getSQLState();
            }
        }
        return null;
    }
}
