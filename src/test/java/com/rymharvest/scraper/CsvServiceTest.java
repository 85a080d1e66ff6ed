package com.rymharvest.scraper;

import com.opencsv.CSVReader;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CsvServiceTest {
    @TempDir
    Path tempDir;

    @Test
    void testWritesHeaderAndRows() throws Exception {
        Path target = tempDir.resolve("track").resolve("data.csv");
        new CsvService().writeRows(target, List.of("energy", "tempo"), List.of(List.of(0.5, 120.0), List.of(1.0, 0.0)));

        try (CSVReader reader = new CSVReader(new FileReader(target.toFile(), StandardCharsets.UTF_8))) {
            List<String[]> lines = reader.readAll();
            assertEquals(3, lines.size());
            assertArrayEquals(new String[]{"energy", "tempo"}, lines.get(0));
            assertArrayEquals(new String[]{"0.5", "120.0"}, lines.get(1));
            assertArrayEquals(new String[]{"1.0", "0.0"}, lines.get(2));
        }
    }

    @Test
    void testRejectsMismatchedRows() {
        CsvService service = new CsvService();
        Path target = tempDir.resolve("bad.csv");
        assertThrows(IllegalArgumentException.class,
            () -> service.writeRows(target, List.of("a", "b"), List.of(List.of(1.0))));
        assertThrows(IllegalArgumentException.class,
            () -> service.writeRows(target, List.of(), List.of()));
        assertThrows(IllegalArgumentException.class,
            () -> service.writeRows(null, List.of("a"), List.of()));
    }
}
