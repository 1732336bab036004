package com.activity.resolution.merge;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MergePairCsvReader Tests")
class MergePairCsvReaderTest {

    private final MergePairCsvReader reader = new MergePairCsvReader();

    private MergePairCsvReader.Result read(String csv) throws IOException {
        return reader.read(new StringReader(csv));
    }

    @Test
    @DisplayName("Reads plain and quoted pairs and skips blank lines")
    void readsPairs() throws IOException {
        MergePairCsvReader.Result result = read("keep_id,drop_id\n17,42\n\n\"18\",\"43\"\n");

        assertEquals(List.of(new MergePair(17, 42), new MergePair(18, 43)), result.pairs());
        assertTrue(result.errors().isEmpty());
    }

    @Test
    @DisplayName("Byte order mark and header spacing are tolerated")
    void bomHeader() throws IOException {
        MergePairCsvReader.Result result = read("﻿Keep_Id, Drop_Id\r\n1,2\r\n");

        assertEquals(List.of(new MergePair(1, 2)), result.pairs());
    }

    @Test
    @DisplayName("Bad rows are reported with their line number and left out")
    void badRows() throws IOException {
        MergePairCsvReader.Result result = read("keep_id,drop_id\n1,2\nx,3\n4,4\n5,6,7\n8,9\n");

        assertEquals(List.of(new MergePair(1, 2), new MergePair(8, 9)), result.pairs());
        assertEquals(3, result.errors().size());
        assertEquals(3, result.errors().get(0).lineNumber());
        assertTrue(result.errors().get(0).message().contains("not an activity id"));
        assertTrue(result.errors().get(1).message().contains("must differ"));
        assertTrue(result.errors().get(2).message().contains("expected 2 columns"));
    }

    @Test
    @DisplayName("Wrong header is rejected and empty input yields nothing")
    void header() throws IOException {
        assertThrows(IllegalArgumentException.class, () -> read("a,b\n1,2\n"));
        assertTrue(read("").pairs().isEmpty());
    }
}
