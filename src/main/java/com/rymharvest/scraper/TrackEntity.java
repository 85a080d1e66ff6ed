package com.rymharvest.scraper;

/**
 * Immutable record representing one track of an album together with its audio features.
 * <p>
 * Tracks are not scraped from RYM pages; they are imported into the store from an audio-feature
 * catalogue and keyed by {@code (albumId, name)}. Feature ranges follow the usual catalogue
 * conventions: 0-1 for the perceptual features, decibels for loudness, BPM for tempo,
 * beats per bar for the time signature.
 */
public record TrackEntity(
    Integer id,
    int albumId,
    String name,
    double acousticness,
    double danceability,
    int durationMs,
    double energy,
    boolean explicit,
    double instrumentalness,
    double liveness,
    double loudness,
    int mode,
    double speechiness,
    double tempo,
    int timeSignature,
    double valence
) {
    public TrackEntity withId(int newId) {
        return new TrackEntity(newId, albumId, name, acousticness, danceability, durationMs, energy, explicit,
            instrumentalness, liveness, loudness, mode, speechiness, tempo, timeSignature, valence);
    }
}
