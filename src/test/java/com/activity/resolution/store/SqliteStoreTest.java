package com.activity.resolution.store;

import com.activity.resolution.core.exception.ConsistencyException;
import com.activity.resolution.core.exception.SetupException;
import com.activity.resolution.core.model.SourceSystem;
import com.activity.resolution.testing.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SqliteStore Tests")
class SqliteStoreTest {

    @TempDir
    Path tempDir;

    private TestDatabase db;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create(tempDir);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Nested
    @DisplayName("Transactions")
    class Transactions {

        @Test
        @DisplayName("Work is committed when marked successful")
        void commit() {
            try (StoreTransaction tx = db.store().begin()) {
                db.activity("2024-06-01T10:00:00Z", 3600, 10000.0, "Run");
                tx.markSuccess();
            }
            assertEquals(1, db.count("activity"));
        }

        @Test
        @DisplayName("Work is rolled back when not marked successful")
        void rollback() {
            try (StoreTransaction tx = db.store().begin()) {
                db.activity("2024-06-01T10:00:00Z", 3600, 10000.0, "Run");
                assertFalse(tx.isSuccess());
            }
            assertEquals(0, db.count("activity"));
        }

        @Test
        @DisplayName("A failing statement rolls back the earlier statements of the unit")
        void partialFailure() {
            long existing = db.activity("2024-06-01T10:00:00Z", 3600, 10000.0, "Run");
            db.link(existing, SourceSystem.GPS_PLATFORM, "100");

            assertThrows(ConsistencyException.class, () -> {
                try (StoreTransaction tx = db.store().begin()) {
                    long created = db.activity("2024-06-02T10:00:00Z", 3600, 10000.0, "Run");
                    db.link(created, SourceSystem.GPS_PLATFORM, "100");
                    tx.markSuccess();
                }
            });
            assertEquals(1, db.count("activity"));
            assertEquals(1, db.count("activity_source"));
        }

        @Test
        @DisplayName("Only one transaction may be open")
        void nested() {
            try (StoreTransaction tx = db.store().begin()) {
                assertThrows(IllegalStateException.class, () -> db.store().begin());
            }
        }

        @Test
        @DisplayName("Links to missing activities violate the foreign key")
        void foreignKey() {
            assertThrows(ConsistencyException.class, () -> db.link(999L, SourceSystem.DESKTOP_LOG, "7"));
        }
    }

    @Nested
    @DisplayName("Opening and schema")
    class Opening {

        @Test
        @DisplayName("Missing file is a setup error")
        void missingFile() {
            assertThrows(SetupException.class, () -> SqliteStore.open(tempDir.resolve("absent.db")));
            assertThrows(SetupException.class, () -> SqliteStore.openReadOnly(tempDir.resolve("absent.db")));
        }

        @Test
        @DisplayName("Creating the schema twice is harmless")
        void schemaIdempotent() {
            new SchemaManager(db.store()).createSchema();
            new SchemaVerifier(db.store()).require(Tables.ACTIVITY, Tables.ACTIVITY_SOURCE, Tables.TRAINING_LOG);
        }

        @Test
        @DisplayName("Verifier lists missing tables")
        void verifierReportsMissing() {
            try (SqliteStore empty = SqliteStore.openOrCreate(tempDir.resolve("empty.db"))) {
                SetupException e = assertThrows(SetupException.class,
                        () -> new SchemaVerifier(empty).require(Tables.ACTIVITY, Tables.CATEGORY));
                assertTrue(e.getMessage().contains("missing table activity"));
                assertTrue(e.getMessage().contains("missing table category"));
            }
        }

        @Test
        @DisplayName("Verifier reports missing columns")
        void verifierReportsColumns() {
            try (SqliteStore partial = SqliteStore.openOrCreate(tempDir.resolve("partial.db"))) {
                partial.execute("CREATE TABLE category (id INTEGER PRIMARY KEY)");
                SetupException e = assertThrows(SetupException.class,
                        () -> new SchemaVerifier(partial).require(Tables.CATEGORY));
                assertTrue(e.getMessage().contains("category missing columns"));
            }
        }
    }

    @Nested
    @DisplayName("Row helpers")
    class RowHelpers {

        @Test
        @DisplayName("Values are coerced from SQLite types")
        void coercion() {
            Map<String, Object> row = Map.<String, Object>of("n", 5, "d", "2.5", "t", "x", "flag", 1);
            assertEquals(5L, Rows.longValue(row, "n"));
            assertEquals(2.5, Rows.doubleValue(row, "d"));
            assertEquals(2L, Rows.longValue(row, "d"));
            assertTrue(Rows.flag(row, "flag"));
            assertNull(Rows.text(row, "missing"));
        }
    }
}
