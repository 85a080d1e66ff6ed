package com.rymharvest.aggregation;

import com.rymharvest.scraper.AlbumEntity;
import com.rymharvest.scraper.ArtistEntity;
import com.rymharvest.scraper.TrackEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * Aggregates an album: its own RYM facts, the mean of its artists' aggregations and the mean of its tracks'
 * aggregations.
 * <p>
 * Artists and tracks are aggregated raw through {@link ArtistAggregator} and {@link TrackAggregator}, so their
 * aggregations are cached on their own. Tracks are loaded from the store when the album does not carry them.
 * An album without artists or tracks gets 0 for the corresponding fields.
 */
public class AlbumAggregator extends Aggregator<AlbumEntity> {
    private static final Logger logger = LoggerFactory.getLogger(AlbumAggregator.class);

    public static final List<String> ALBUM_FIELDS = List.of(
        "issues",
        "albumLists",
        "overallRank",
        "rating",
        "ratings",
        "reviews",
        "yearRank",
        "releaseYear"
    );

    public static final List<String> FIELDS = concat(ALBUM_FIELDS, ArtistAggregator.FIELDS, TrackAggregator.FIELDS);

    static final Map<String, DoubleUnaryOperator> NORMALIZERS = albumNormalizers();

    public AlbumAggregator(AlbumEntity album, AggregationContext context) {
        super(album, AggregationType.ALBUM, context);
    }

    private static List<String> concat(List<String> first, List<String> second, List<String> third) {
        List<String> all = new ArrayList<>(first);
        all.addAll(second);
        all.addAll(third);
        return List.copyOf(all);
    }

    private static Map<String, DoubleUnaryOperator> albumNormalizers() {
        Map<String, DoubleUnaryOperator> rules = new HashMap<>();
        rules.put("issues", Normalizers.logScale(200));
        rules.put("albumLists", Normalizers.logScale(5_000));
        rules.put("overallRank", Normalizers.inverseRank(10_000));
        rules.put("rating", Normalizers.range(0, 5));
        rules.put("ratings", Normalizers.logScale(100_000));
        rules.put("reviews", Normalizers.logScale(5_000));
        rules.put("yearRank", Normalizers.inverseRank(1_000));
        rules.put("releaseYear", Normalizers.range(1900, 2030));
        rules.putAll(ArtistAggregator.NORMALIZERS);
        rules.putAll(TrackAggregator.NORMALIZERS);
        return Map.copyOf(rules);
    }

    @Override
    protected Integer entityId() {
        return entity.id();
    }

    @Override
    protected Aggregation generateAggregate(boolean normalized) {
        Aggregation aggregation = template(0)
            .with("issues", entity.issueCount())
            .with("albumLists", entity.listCountRym())
            .with("overallRank", entity.overallRank())
            .with("rating", entity.rating())
            .with("ratings", entity.ratingCount())
            .with("reviews", entity.reviewCount())
            .with("yearRank", entity.yearRank())
            .with("releaseYear", entity.releaseYear());

        List<Aggregation> artistAggregations = new ArrayList<>();
        for (ArtistEntity artist : artists()) {
            artistAggregations.add(new ArtistAggregator(artist, context).aggregate(false));
        }
        aggregation = applyMeans(aggregation, ArtistAggregator.FIELDS, artistAggregations);

        List<TrackEntity> tracks = tracks();
        List<Aggregation> trackAggregations = new ArrayList<>();
        for (TrackEntity track : tracks) {
            trackAggregations.add(new TrackAggregator(track, context).aggregate(false));
        }
        aggregation = applyMeans(aggregation, TrackAggregator.FIELDS, trackAggregations);
        return aggregation.with("timeSignatureVariation", timeSignatureVariation(tracks));
    }

    private List<ArtistEntity> artists() {
        if (entity.artists() != null) return entity.artists();
        if (entity.id() == null) return List.of();
        return context.store().findAlbumById(entity.id())
            .map(AlbumEntity::artists)
            .orElse(List.of());
    }

    private List<TrackEntity> tracks() {
        if (entity.tracks() != null) return entity.tracks();
        if (entity.id() == null) {
            logger.warn("Album {} has no tracks loaded and no id to load them with", entity.urlRym());
            return List.of();
        }
        List<TrackEntity> loaded = context.store().findTracksByAlbum(entity.id());
        logger.debug("Loaded {} tracks for album {}", loaded.size(), entity.id());
        return loaded;
    }

    private static Aggregation applyMeans(Aggregation target, List<String> fields, List<Aggregation> parts) {
        if (parts.isEmpty()) return target;
        Aggregation result = target;
        for (String field : fields) {
            double sum = 0;
            for (Aggregation part : parts) sum += part.get(field);
            result = result.with(field, sum / parts.size());
        }
        return result;
    }

    /**
     * Share of tracks whose time signature differs from the album's most common one.
     */
    static double timeSignatureVariation(List<TrackEntity> tracks) {
        if (tracks.isEmpty()) return 0;
        Map<Integer, Integer> counts = new LinkedHashMap<>();
        for (TrackEntity track : tracks) counts.merge(track.timeSignature(), 1, Integer::sum);
        int mostCommon = Collections.max(counts.values());
        return (double) (tracks.size() - mostCommon) / tracks.size();
    }

    @Override
    protected Map<String, DoubleUnaryOperator> normalizers() {
        return NORMALIZERS;
    }

    @Override
    public Aggregation template(double defaultVal) {
        return Aggregation.filled(AggregationType.ALBUM, FIELDS, defaultVal);
    }
}
