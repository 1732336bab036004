package com.activity.resolution.store;

import java.util.List;
import java.util.Map;

/**
 * Connection to the activity store.
 * Abstracts the underlying JDBC database so services can be tested without one.
 */
public interface StoreConnection extends AutoCloseable {

    /**
     * Executes a statement that modifies the store.
     *
     * @param sql    the SQL statement with {@code ?} placeholders
     * @param params positional parameters
     * @return number of affected rows
     */
    int execute(String sql, Object... params);

    /**
     * Executes an insert and returns the generated row id.
     *
     * @param sql    the insert statement
     * @param params positional parameters
     * @return the generated key
     */
    long insert(String sql, Object... params);

    /**
     * Executes a query and returns the rows keyed by column label.
     *
     * @param sql    the query
     * @param params positional parameters
     * @return list of result rows as maps
     */
    List<Map<String, Object>> query(String sql, Object... params);

    /**
     * Starts a transaction. Everything executed until the transaction is closed belongs to it.
     *
     * @return the transaction, to be used with try-with-resources
     */
    StoreTransaction begin();

    /**
     * Gets the location of the store, for diagnostics.
     */
    String getLocation();

    @Override
    void close();
}
