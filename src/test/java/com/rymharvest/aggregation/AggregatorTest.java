package com.rymharvest.aggregation;

import com.opencsv.CSVReader;
import com.rymharvest.scraper.ArtistEntity;
import com.rymharvest.scraper.CsvService;
import com.rymharvest.scraper.GenreEntity;
import com.rymharvest.scraper.InMemoryEntityStore;
import com.rymharvest.scraper.LocalCacheService;
import com.rymharvest.scraper.TrackEntity;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class AggregatorTest {
    @TempDir
    Path tempDir;

    private LocalCacheService cache;
    private InMemoryEntityStore store;
    private AggregationContext context;

    @BeforeEach
    void setUp() {
        cache = new LocalCacheService();
        store = new InMemoryEntityStore();
        context = new AggregationContext(cache, store, new CsvService());
    }

    static TrackEntity track(Integer id, int timeSignature) {
        return new TrackEntity(id, 1, "Track " + id, 0.2, 0.5, 300_000, 0.8, true, 0.1, 0.3, -30, 1, 0.05, 125, timeSignature, 0.6);
    }

    @Test
    void testTrackAggregationCarriesRawValues() {
        Aggregation raw = new TrackAggregator(track(5, 7), context).aggregate(false);

        assertEquals(TrackAggregator.FIELDS, raw.fields());
        assertEquals(300_000, raw.get("duration"));
        assertEquals(1.0, raw.get("explicit"));
        assertEquals(-30, raw.get("loudness"));
        assertEquals(1.0, raw.get("timeSignatureVariation"));
        assertEquals(0.0, new TrackAggregator(track(6, 4), context).aggregate(false).get("timeSignatureVariation"));
    }

    @Test
    void testTrackNormalisation() {
        Aggregation normalized = new TrackAggregator(track(5, 4), context).aggregate();

        assertEquals(0.5, normalized.get("duration"), 1e-9);
        assertEquals(0.5, normalized.get("loudness"), 1e-9);
        assertEquals(0.5, normalized.get("tempo"), 1e-9);
        assertEquals(0.8, normalized.get("energy"), 1e-9);
    }

    @Test
    void testSecondAggregateIsServedFromCache() {
        TrackAggregator aggregator = spy(new TrackAggregator(track(5, 4), context));

        Aggregation first = aggregator.aggregate();
        Aggregation second = aggregator.aggregate();

        assertEquals(first, second);
        verify(aggregator, times(1)).generateAggregate(true);
    }

    @Test
    void testRawAndNormalisedAreCachedSeparately() {
        TrackAggregator aggregator = new TrackAggregator(track(5, 4), context);
        Aggregation raw = aggregator.aggregate(false);
        Aggregation normalized = aggregator.aggregate(true);

        assertEquals(raw, cache.getObject("track_5", Aggregation.class).orElseThrow());
        assertEquals(normalized, cache.getObject("track_5_normalized", Aggregation.class).orElseThrow());
        assertNotEquals(raw, normalized);
    }

    @Test
    void testEntityWithoutIdIsNeverCached() {
        TrackAggregator aggregator = spy(new TrackAggregator(track(null, 4), context));
        assertNull(aggregator.redisKey(true));
        assertNull(aggregator.redisKey(false));

        aggregator.aggregate();
        aggregator.aggregate();
        verify(aggregator, times(2)).generateAggregate(true);
    }

    @Test
    void testRedisKeyFormat() {
        ArtistEntity artist = new ArtistEntity(12, "u", "A", true, 1, true, 0, 0, 0, List.of());
        ArtistAggregator aggregator = new ArtistAggregator(artist, context);
        assertEquals("artist_12", aggregator.redisKey(false));
        assertEquals("artist_12_normalized", aggregator.redisKey(true));
    }

    @Test
    void testArtistGenresLoadedFromStore() {
        GenreEntity rock = store.saveGenre(new GenreEntity(null, "Rock"));
        GenreEntity jazz = store.saveGenre(new GenreEntity(null, "Jazz"));
        ArtistEntity stored = store.saveArtist(new ArtistEntity(null, "https://rateyourmusic.com/artist/talk-talk",
            "Talk Talk", false, 3, false, 1204, 12, 28, List.of(rock, jazz)));

        Aggregation raw = new ArtistAggregator(stored.withGenres(null), context).aggregate(false);
        assertEquals(2.0, raw.get("genreCount"));
        assertEquals(0.0, raw.get("active"));
        assertEquals(3.0, raw.get("members"));
        assertEquals(1204.0, raw.get("artistLists"));
    }

    @Test
    void testNormalisedValuesStayInUnitRange() {
        ArtistEntity huge = new ArtistEntity(1, "u", "Huge", true, 400, false, 1_000_000, 99_999, 50_000, List.of());
        Aggregation first = new ArtistAggregator(huge, new AggregationContext(new LocalCacheService(), store, new CsvService())).aggregate();
        Aggregation second = new ArtistAggregator(huge, new AggregationContext(new LocalCacheService(), store, new CsvService())).aggregate();

        assertEquals(first, second);
        for (double value : first.getValues().values()) {
            assertTrue(value >= 0 && value <= 1, "out of range: " + value);
        }
    }

    @Test
    void testFieldsMatchAggregationAndHeaders() {
        TrackAggregator aggregator = new TrackAggregator(track(5, 4), context);
        assertEquals(aggregator.fields(), aggregator.aggregate(false).fields());
        assertEquals(aggregator.fields(), aggregator.aggregate(true).fields());
        assertArrayEquals(TrackAggregator.FIELDS.toArray(String[]::new), aggregator.csvHeaders());
        assertEquals(aggregator.fields(), aggregator.template(-1).fields());
    }

    @Test
    void testWriteAggregationsToCsv() throws Exception {
        TrackAggregator first = new TrackAggregator(track(5, 4), context);
        TrackAggregator second = new TrackAggregator(track(6, 3), context);
        first.writeAggregationsToCsv(List.of(first.aggregate(), second.aggregate()), "tracks", tempDir.toString());

        Path written = tempDir.resolve("track").resolve("tracks.csv");
        try (CSVReader reader = new CSVReader(new FileReader(written.toFile(), StandardCharsets.UTF_8))) {
            List<String[]> lines = reader.readAll();
            assertEquals(3, lines.size());
            assertArrayEquals(first.csvHeaders(), lines.get(0));
            assertEquals(TrackAggregator.FIELDS.size(), lines.get(1).length);
            assertEquals("1.0", lines.get(2)[TrackAggregator.FIELDS.indexOf("timeSignatureVariation")]);
        }
    }

    @Test
    void testCsvRejectsOtherAggregationTypes() {
        TrackAggregator aggregator = new TrackAggregator(track(5, 4), context);
        Aggregation artist = Aggregation.filled(AggregationType.ARTIST, ArtistAggregator.FIELDS, 0);
        assertThrows(IllegalArgumentException.class,
            () -> aggregator.writeAggregationsToCsv(List.of(artist), "mixed", tempDir.toString()));
    }

    @Test
    void testNullEntityRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TrackAggregator(null, context));
    }

    @Test
    void testStripLabelsKeepsFieldOrder() {
        Aggregation aggregation = Aggregation.filled(AggregationType.ARTIST, ArtistAggregator.FIELDS, 0).with("members", 4);
        List<Double> values = Aggregator.stripLabels(aggregation);
        assertEquals(ArtistAggregator.FIELDS.size(), values.size());
        assertEquals(4.0, values.get(ArtistAggregator.FIELDS.indexOf("members")));
    }
}
