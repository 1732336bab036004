package com.activity.resolution.merge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads merge pairs from CSV.
 *
 * <pre>
 * keep_id,drop_id
 * 17,42
 * "18","43"
 * </pre>
 *
 * <p>Blank lines are ignored. Rows that are malformed, or name the same id twice,
 * are reported as errors and left out.</p>
 */
public class MergePairCsvReader {
    private static final Logger log = LoggerFactory.getLogger(MergePairCsvReader.class);

    static final String HEADER = "keep_id,drop_id";

    public Result read(Reader reader) throws IOException {
        List<MergePair> pairs = new ArrayList<>();
        List<RowError> errors = new ArrayList<>();

        BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        String header = br.readLine();
        if (header == null) {
            return new Result(List.of(), List.of());
        }
        if (!HEADER.equals(stripBom(header).trim().toLowerCase(Locale.ROOT).replace(" ", ""))) {
            throw new IllegalArgumentException("Merge CSV must start with header '" + HEADER + "', got: " + header);
        }

        String line;
        long lineNumber = 1;
        while ((line = br.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            String[] fields = line.split(",", -1);
            if (fields.length != 2) {
                errors.add(new RowError(lineNumber, line, "expected 2 columns, got " + fields.length));
                log.warn("merge.csv.invalid line={} row='{}' reason=columns", lineNumber, line);
                continue;
            }
            try {
                pairs.add(new MergePair(parseId(fields[0]), parseId(fields[1])));
            } catch (IllegalArgumentException e) {
                errors.add(new RowError(lineNumber, line, e.getMessage()));
                log.warn("merge.csv.invalid line={} row='{}' reason={}", lineNumber, line, e.getMessage());
            }
        }
        log.info("merge.csv.read pairs={} errors={}", pairs.size(), errors.size());
        return new Result(pairs, errors);
    }

    private static long parseId(String field) {
        String value = parseCsvField(field.trim());
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not an activity id: '" + value + "'", e);
        }
    }

    private static String parseCsvField(String field) {
        if (field.length() >= 2 && field.startsWith("\"") && field.endsWith("\"")) {
            return field.substring(1, field.length() - 1).replace("\"\"", "\"").trim();
        }
        return field;
    }

    private static String stripBom(String header) {
        return header.startsWith("\uFEFF") ? header.substring(1) : header;
    }

    /**
     * Pairs read from a CSV plus the rows that were rejected.
     */
    public record Result(List<MergePair> pairs, List<RowError> errors) {
        public Result {
            pairs = List.copyOf(pairs);
            errors = List.copyOf(errors);
        }
    }

    public record RowError(long lineNumber, String row, String message) {
    }
}
