package com.activity.resolution.store;

import com.activity.resolution.core.exception.SetupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Checks that the tables and columns an operation needs exist before it mutates anything.
 */
public class SchemaVerifier {
    private static final Logger log = LoggerFactory.getLogger(SchemaVerifier.class);

    private final StoreConnection store;

    public SchemaVerifier(StoreConnection store) {
        this.store = store;
    }

    /**
     * Verifies the given tables.
     *
     * @throws SetupException listing every missing table and column
     */
    public void require(String... tables) {
        List<String> problems = new ArrayList<>();
        for (String table : tables) {
            List<String> required = Tables.REQUIRED_COLUMNS.get(table);
            if (required == null) {
                throw new IllegalArgumentException("Unknown table " + table);
            }
            Set<String> present = columnsOf(table);
            if (present.isEmpty()) {
                problems.add("missing table " + table);
                continue;
            }
            List<String> missing = required.stream()
                    .filter(column -> !present.contains(column))
                    .toList();
            if (!missing.isEmpty()) {
                problems.add(table + " missing columns " + missing);
            }
        }
        if (!problems.isEmpty()) {
            log.error("schema.invalid path={} problems={}", store.getLocation(), problems);
            throw new SetupException("Store " + store.getLocation() + " is not usable: " + String.join("; ", problems));
        }
    }

    private Set<String> columnsOf(String table) {
        List<Map<String, Object>> rows = store.query("PRAGMA table_info(" + table + ")");
        Set<String> columns = new HashSet<>();
        for (Map<String, Object> row : rows) {
            columns.add(Rows.text(row, "name").toLowerCase(Locale.ROOT));
        }
        return columns;
    }
}
