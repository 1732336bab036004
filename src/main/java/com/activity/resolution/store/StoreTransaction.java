package com.activity.resolution.store;

import com.activity.resolution.core.exception.ConsistencyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Unit of work on the store. Rolls back on close unless marked successful.
 *
 * <p>Usage:</p>
 * <pre>
 * try (StoreTransaction tx = store.begin()) {
 *     long id = activities.insert(activity);
 *     sourceLinks.insert(link);
 *     tx.markSuccess();
 * }
 * // If markSuccess() was not called, everything since begin() is rolled back
 * </pre>
 */
public class StoreTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StoreTransaction.class);

    private final Connection connection;
    private final Runnable onClose;
    private boolean success = false;
    private boolean closed = false;

    StoreTransaction(Connection connection, Runnable onClose) {
        this.connection = connection;
        this.onClose = onClose;
    }

    /**
     * Marks the transaction as successful.
     * If called before close(), the work is committed instead of rolled back.
     */
    public void markSuccess() {
        this.success = true;
    }

    /**
     * Returns whether the transaction was marked as successful.
     */
    public boolean isSuccess() {
        return success;
    }

    /**
     * Commits if marked successful, otherwise rolls back.
     *
     * @throws ConsistencyException if the commit itself fails; the work is rolled back
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (success) {
                commit();
            } else {
                log.debug("StoreTransaction closed without success - rolling back");
                rollback();
            }
        } finally {
            onClose.run();
        }
    }

    private void commit() {
        try {
            connection.commit();
        } catch (SQLException e) {
            rollback();
            throw SqlErrors.translate("commit", e);
        }
    }

    private void rollback() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.error("store.rollback.failed reason={}", e.getMessage());
            throw SqlErrors.translate("rollback", e);
        }
    }
}
