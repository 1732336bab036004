package com.activity.resolution.store;

import com.activity.resolution.core.exception.ConsistencyException;
import com.activity.resolution.core.exception.ResolutionException;
import com.activity.resolution.core.exception.SetupException;

import java.sql.SQLException;
import java.util.Locale;

/**
 * Translates JDBC failures into the engine's exception hierarchy at the store boundary.
 */
final class SqlErrors {

    private static final int SQLITE_CORRUPT = 11;
    private static final int SQLITE_CANTOPEN = 14;
    private static final int SQLITE_CONSTRAINT = 19;
    private static final int SQLITE_NOTADB = 26;

    private SqlErrors() {
    }

    static ResolutionException translate(String operation, SQLException e) {
        String message = e.getMessage() == null ? "" : e.getMessage();
        String lower = message.toLowerCase(Locale.ROOT);
        int primaryCode = e.getErrorCode() & 0xff;

        if (lower.contains("no such table") || lower.contains("no such column")
                || primaryCode == SQLITE_CANTOPEN || primaryCode == SQLITE_NOTADB
                || primaryCode == SQLITE_CORRUPT) {
            return new SetupException("Store unusable during " + operation + ": " + message, e);
        }
        if (primaryCode == SQLITE_CONSTRAINT || (e.getSQLState() != null && e.getSQLState().startsWith("23"))) {
            return new ConsistencyException("Constraint violated during " + operation + ": " + message, e);
        }
        return new ConsistencyException("Store operation failed during " + operation + ": " + message, e);
    }
}
