package com.rymharvest.aggregation;

import com.rymharvest.scraper.TrackEntity;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * Aggregates the audio features of a single track.
 * <p>
 * {@code timeSignatureVariation} is 1 for a track outside common time (4 beats per bar) and 0 otherwise;
 * album aggregations reuse the field for the share of tracks that differ from the album's usual signature.
 */
public class TrackAggregator extends Aggregator<TrackEntity> {
    static final int COMMON_TIME = 4;

    public static final List<String> FIELDS = List.of(
        "acousticness",
        "danceability",
        "duration",
        "energy",
        "explicit",
        "instrumentalness",
        "liveness",
        "loudness",
        "mode",
        "speechiness",
        "tempo",
        "timeSignatureVariation",
        "valence"
    );

    static final Map<String, DoubleUnaryOperator> NORMALIZERS = trackNormalizers();

    public TrackAggregator(TrackEntity track, AggregationContext context) {
        super(track, AggregationType.TRACK, context);
    }

    private static Map<String, DoubleUnaryOperator> trackNormalizers() {
        Map<String, DoubleUnaryOperator> rules = new LinkedHashMap<>();
        for (String field : FIELDS) rules.put(field, Normalizers.unit());
        rules.put("duration", Normalizers.range(0, 600_000));
        rules.put("loudness", Normalizers.range(-60, 0));
        rules.put("tempo", Normalizers.range(0, 250));
        return Map.copyOf(rules);
    }

    @Override
    protected Integer entityId() {
        return entity.id();
    }

    @Override
    protected Aggregation generateAggregate(boolean normalized) {
        return template(0)
            .with("acousticness", entity.acousticness())
            .with("danceability", entity.danceability())
            .with("duration", entity.durationMs())
            .with("energy", entity.energy())
            .with("explicit", entity.explicit() ? 1 : 0)
            .with("instrumentalness", entity.instrumentalness())
            .with("liveness", entity.liveness())
            .with("loudness", entity.loudness())
            .with("mode", entity.mode())
            .with("speechiness", entity.speechiness())
            .with("tempo", entity.tempo())
            .with("timeSignatureVariation", entity.timeSignature() == COMMON_TIME ? 0 : 1)
            .with("valence", entity.valence());
    }

    @Override
    protected Map<String, DoubleUnaryOperator> normalizers() {
        return NORMALIZERS;
    }

    @Override
    public Aggregation template(double defaultVal) {
        return Aggregation.filled(AggregationType.TRACK, FIELDS, defaultVal);
    }
}
