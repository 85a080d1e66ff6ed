package com.rymharvest.aggregation;

import com.rymharvest.scraper.AlbumEntity;
import com.rymharvest.scraper.ArtistEntity;
import com.rymharvest.scraper.CsvService;
import com.rymharvest.scraper.GenreEntity;
import com.rymharvest.scraper.InMemoryEntityStore;
import com.rymharvest.scraper.LocalCacheService;
import com.rymharvest.scraper.TrackEntity;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AlbumAggregatorTest {
    private LocalCacheService cache;
    private InMemoryEntityStore store;
    private AggregationContext context;
    private AlbumEntity album;

    @BeforeEach
    void setUp() {
        cache = new LocalCacheService();
        store = new InMemoryEntityStore();
        context = new AggregationContext(cache, store, new CsvService());

        GenreEntity rock = store.saveGenre(new GenreEntity(null, "Rock"));
        ArtistEntity band = store.saveArtist(new ArtistEntity(null, "https://rateyourmusic.com/artist/talk-talk",
            "Talk Talk", false, 3, false, 1000, 12, 28, List.of(rock)));
        ArtistEntity solo = store.saveArtist(new ArtistEntity(null, "https://rateyourmusic.com/artist/mark-hollis",
            "Mark Hollis", false, 1, true, 200, 2, 0, List.of()));
        album = store.saveAlbum(new AlbumEntity(null, "https://rateyourmusic.com/release/album/talk-talk/laughing-stock/",
            "Laughing Stock", 1991, 4, 2000, 80, 2, 4.0, 20000, 300, List.of(band, solo), List.of(rock), null));

        store.saveTrack(track(album.id(), "Myrrhman", 0.8, 100, 3));
        store.saveTrack(track(album.id(), "Ascension Day", 0.4, 120, 3));
        store.saveTrack(track(album.id(), "After the Flood", 0.6, 140, 4));
    }

    private static TrackEntity track(int albumId, String name, double energy, double tempo, int timeSignature) {
        return new TrackEntity(null, albumId, name, 0.5, 0.3, 400_000, energy, false, 0.7, 0.1, -20, 1, 0.03, tempo, timeSignature, 0.2);
    }

    @Test
    void testFieldOrderIsAlbumThenArtistThenTrack() {
        List<String> expected = new ArrayList<>(AlbumAggregator.ALBUM_FIELDS);
        expected.addAll(ArtistAggregator.FIELDS);
        expected.addAll(TrackAggregator.FIELDS);

        AlbumAggregator aggregator = new AlbumAggregator(album, context);
        assertEquals(expected, aggregator.fields());
        assertEquals(expected, aggregator.aggregate(false).fields());
    }

    @Test
    void testTracksAreLoadedFromStoreAndAveraged() {
        assertNull(album.tracks());
        Aggregation raw = new AlbumAggregator(album, context).aggregate(false);

        assertEquals(0.6, raw.get("energy"), 1e-9);
        assertEquals(120, raw.get("tempo"), 1e-9);
        assertEquals(400_000, raw.get("duration"), 1e-9);
        // two tracks in 3/4, one in 4/4
        assertEquals(1.0 / 3, raw.get("timeSignatureVariation"), 1e-9);
    }

    @Test
    void testArtistFieldsAreMeans() {
        Aggregation raw = new AlbumAggregator(album, context).aggregate(false);

        assertEquals(2.0, raw.get("members"), 1e-9);
        assertEquals(0.5, raw.get("soloPerformer"), 1e-9);
        assertEquals(600.0, raw.get("artistLists"), 1e-9);
        assertEquals(0.5, raw.get("genreCount"), 1e-9);
        assertEquals(4.0, raw.get("rating"));
        assertEquals(1991.0, raw.get("releaseYear"));
    }

    @Test
    void testArtistsLoadedWhenAlbumCarriesNone() {
        AlbumEntity withoutArtists = new AlbumEntity(album.id(), album.urlRym(), album.name(), album.releaseYear(),
            album.issueCount(), album.listCountRym(), album.overallRank(), album.yearRank(), album.rating(),
            album.ratingCount(), album.reviewCount(), null, album.genres(), null);

        Aggregation raw = new AlbumAggregator(withoutArtists, context).aggregate(false);
        assertEquals(2.0, raw.get("members"), 1e-9);
    }

    @Test
    void testNestedAggregationsAreCachedRaw() {
        new AlbumAggregator(album, context).aggregate();

        assertTrue(cache.getObject("album_" + album.id() + "_normalized", Aggregation.class).isPresent());
        for (ArtistEntity artist : album.artists()) {
            assertTrue(cache.getObject("artist_" + artist.id(), Aggregation.class).isPresent());
        }
        for (Integer trackId : store.listTrackIds()) {
            assertTrue(cache.getObject("track_" + trackId, Aggregation.class).isPresent());
        }
    }

    @Test
    void testNormalisedAlbumInUnitRange() {
        Aggregation normalized = new AlbumAggregator(album, context).aggregate();

        assertEquals(0.8, normalized.get("rating"), 1e-9);
        assertEquals(998.0 / 999, normalized.get("yearRank"), 1e-9);
        for (double value : normalized.getValues().values()) {
            assertTrue(value >= 0 && value <= 1, "out of range: " + value);
        }
    }

    @Test
    void testEmptyAlbumDefaultsToZero() {
        AlbumEntity empty = new AlbumEntity(null, "https://rateyourmusic.com/release/album/x/y/", "Y", 2001, 1, 0, 0, 0,
            0, 0, 0, List.of(), List.of(), List.of());
        Aggregation raw = new AlbumAggregator(empty, context).aggregate(false);

        assertEquals(0.0, raw.get("members"));
        assertEquals(0.0, raw.get("energy"));
        assertEquals(0.0, raw.get("timeSignatureVariation"));
    }

    @Test
    void testTimeSignatureVariation() {
        assertEquals(0.0, AlbumAggregator.timeSignatureVariation(List.of()));
        assertEquals(0.0, AlbumAggregator.timeSignatureVariation(List.of(
            track(1, "a", 0, 0, 3), track(1, "b", 0, 0, 3))));
        assertEquals(0.5, AlbumAggregator.timeSignatureVariation(List.of(
            track(1, "a", 0, 0, 3), track(1, "b", 0, 0, 4), track(1, "c", 0, 0, 5), track(1, "d", 0, 0, 4))));
    }
}
