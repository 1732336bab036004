package com.activity.resolution.store;

import com.activity.resolution.core.exception.SetupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Creates missing tables from the bundled {@code db/schema.sql}. Existing tables are left untouched.
 */
public class SchemaManager {
    private static final Logger log = LoggerFactory.getLogger(SchemaManager.class);

    static final String SCHEMA_RESOURCE = "/db/schema.sql";

    private final SqliteStore store;

    public SchemaManager(SqliteStore store) {
        this.store = store;
    }

    public void createSchema() {
        store.executeScript(loadSchema());
        log.info("schema.ensured path={}", store.getLocation());
    }

    static String loadSchema() {
        try (InputStream in = SchemaManager.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new SetupException("Schema resource missing: " + SCHEMA_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SetupException("Cannot read schema resource " + SCHEMA_RESOURCE, e);
        }
    }
}
