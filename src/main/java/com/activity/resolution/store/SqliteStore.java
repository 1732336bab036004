package com.activity.resolution.store;

import com.activity.resolution.core.exception.SetupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SQLite implementation of {@link StoreConnection} over a single JDBC connection
 * with foreign keys enforced. Follows the single-writer batch model: one thread
 * issues statements; at most one transaction is open at a time.
 */
public class SqliteStore implements StoreConnection {
    private static final Logger log = LoggerFactory.getLogger(SqliteStore.class);

    private final Connection connection;
    private final String location;
    private StoreTransaction activeTransaction;

    private SqliteStore(Connection connection, String location) {
        this.connection = connection;
        this.location = location;
    }

    /**
     * Opens an existing database file.
     *
     * @throws SetupException if the file does not exist or cannot be opened
     */
    public static SqliteStore open(Path databaseFile) {
        if (!Files.isRegularFile(databaseFile)) {
            throw new SetupException("Database not found: " + databaseFile);
        }
        return connect(databaseFile.toAbsolutePath().toString(), false);
    }

    /**
     * Opens a database file, creating an empty one if it does not exist.
     */
    public static SqliteStore openOrCreate(Path databaseFile) {
        return connect(databaseFile.toAbsolutePath().toString(), false);
    }

    /**
     * Opens an existing database file for queries only.
     *
     * @throws SetupException if the file does not exist or cannot be opened
     */
    public static SqliteStore openReadOnly(Path databaseFile) {
        if (!Files.isRegularFile(databaseFile)) {
            throw new SetupException("Database not found: " + databaseFile);
        }
        return connect(databaseFile.toAbsolutePath().toString(), true);
    }

    private static SqliteStore connect(String path, boolean readOnly) {
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        config.setReadOnly(readOnly);
        try {
            Connection connection = DriverManager.getConnection("jdbc:sqlite:" + path, config.toProperties());
            log.info("store.opened path={} readOnly={}", path, readOnly);
            return new SqliteStore(connection, path);
        } catch (SQLException e) {
            throw new SetupException("Cannot open database " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public int execute(String sql, Object... params) {
        try (PreparedStatement statement = prepare(sql, params)) {
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw SqlErrors.translate(describe(sql), e);
        }
    }

    @Override
    public long insert(String sql, Object... params) {
        try (PreparedStatement statement = prepare(sql, params)) {
            statement.executeUpdate();
        } catch (SQLException e) {
            throw SqlErrors.translate(describe(sql), e);
        }
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery("SELECT last_insert_rowid()")) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw SqlErrors.translate("last_insert_rowid", e);
        }
    }

    @Override
    public List<Map<String, Object>> query(String sql, Object... params) {
        try (PreparedStatement statement = prepare(sql, params);
             ResultSet rs = statement.executeQuery()) {
            ResultSetMetaData meta = rs.getMetaData();
            int columns = meta.getColumnCount();
            List<Map<String, Object>> rows = new ArrayList<>();
            while (rs.next()) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 1; i <= columns; i++) {
                    row.put(meta.getColumnLabel(i), rs.getObject(i));
                }
                rows.add(row);
            }
            return rows;
        } catch (SQLException e) {
            throw SqlErrors.translate(describe(sql), e);
        }
    }

    /**
     * Runs a script of {@code ;}-separated statements outside any transaction.
     */
    public void executeScript(String script) {
        try (Statement statement = connection.createStatement()) {
            for (String sql : script.split(";")) {
                String trimmed = stripComments(sql);
                if (!trimmed.isEmpty()) {
                    statement.execute(trimmed);
                }
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("script", e);
        }
    }

    @Override
    public StoreTransaction begin() {
        if (activeTransaction != null) {
            throw new IllegalStateException("A transaction is already open on " + location);
        }
        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            throw SqlErrors.translate("begin", e);
        }
        activeTransaction = new StoreTransaction(connection, this::endTransaction);
        return activeTransaction;
    }

    private void endTransaction() {
        activeTransaction = null;
        try {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            throw SqlErrors.translate("end transaction", e);
        }
    }

    @Override
    public String getLocation() {
        return location;
    }

    @Override
    public void close() {
        try {
            connection.close();
            log.debug("store.closed path={}", location);
        } catch (SQLException e) {
            log.warn("store.close.failed path={} reason={}", location, e.getMessage());
        }
    }

    private PreparedStatement prepare(String sql, Object[] params) throws SQLException {
        PreparedStatement statement = connection.prepareStatement(sql);
        try {
            for (int i = 0; i < params.length; i++) {
                statement.setObject(i + 1, params[i]);
            }
            return statement;
        } catch (SQLException e) {
            statement.close();
            throw e;
        }
    }

    private static String describe(String sql) {
        String flat = sql.strip().replaceAll("\\s+", " ");
        return flat.length() > 60 ? flat.substring(0, 60) + "..." : flat;
    }

    private static String stripComments(String sql) {
        StringBuilder kept = new StringBuilder();
        for (String line : sql.split("\n")) {
            if (!line.strip().startsWith("--")) {
                kept.append(line).append('\n');
            }
        }
        return kept.toString().strip();
    }
}
