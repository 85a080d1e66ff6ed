package com.rymharvest.aggregation;

import com.opencsv.CSVReader;
import com.rymharvest.scraper.ArtistEntity;
import com.rymharvest.scraper.CsvService;
import com.rymharvest.scraper.InMemoryEntityStore;
import com.rymharvest.scraper.LocalCacheService;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AggregationExporterTest {
    @TempDir
    Path tempDir;

    private InMemoryEntityStore store;
    private AggregationExporter exporter;

    @BeforeEach
    void setUp() {
        store = new InMemoryEntityStore();
        exporter = new AggregationExporter(new AggregationContext(new LocalCacheService(), store, new CsvService()));
    }

    @Test
    void testExportsEveryStoredArtist() throws Exception {
        store.saveArtist(new ArtistEntity(null, "https://rateyourmusic.com/artist/a", "A", true, 4, false, 10, 5, 2, List.of()));
        store.saveArtist(new ArtistEntity(null, "https://rateyourmusic.com/artist/b", "B", false, 1, true, 0, 1, 0, List.of()));

        int rows = exporter.export(AggregationType.ARTIST, false, "artists", tempDir.toString());
        assertEquals(2, rows);

        try (CSVReader reader = new CSVReader(new FileReader(tempDir.resolve("artist/artists.csv").toFile(), StandardCharsets.UTF_8))) {
            List<String[]> lines = reader.readAll();
            assertEquals(3, lines.size());
            assertArrayEquals(ArtistAggregator.FIELDS.toArray(String[]::new), lines.get(0));
            assertEquals("4.0", lines.get(1)[ArtistAggregator.FIELDS.indexOf("members")]);
            assertEquals("1.0", lines.get(2)[ArtistAggregator.FIELDS.indexOf("soloPerformer")]);
        }
    }

    @Test
    void testEmptyStoreWritesHeaderOnly() throws Exception {
        assertEquals(0, exporter.export(AggregationType.ALBUM, true, "albums", tempDir.toString()));

        Path file = tempDir.resolve("album/albums.csv");
        assertTrue(Files.exists(file));
        try (CSVReader reader = new CSVReader(new FileReader(file.toFile(), StandardCharsets.UTF_8))) {
            List<String[]> lines = reader.readAll();
            assertEquals(1, lines.size());
            assertArrayEquals(AlbumAggregator.FIELDS.toArray(String[]::new), lines.get(0));
        }
    }

    @Test
    void testAggregatorForUnknownIdIsEmpty() {
        assertTrue(exporter.aggregatorFor(AggregationType.TRACK, 99).isEmpty());
    }

    @Test
    void testAggregationTypeKeys() {
        assertEquals(AggregationType.ALBUM, AggregationType.fromKey("Album"));
        assertThrows(IllegalArgumentException.class, () -> AggregationType.fromKey("review"));
    }
}
