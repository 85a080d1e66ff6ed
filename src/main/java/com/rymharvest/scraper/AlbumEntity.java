package com.rymharvest.scraper;

import java.util.List;

/**
 * Immutable record representing an album scraped from Rate Your Music.
 * <p>
 * Relations:
 * <ul>
 *   <li>{@code artists} and {@code genres} are written together with the album.</li>
 *   <li>{@code tracks} are imported separately and are {@code null} until loaded
 *   (see {@link EntityStoreInterface#findTracksByAlbum(int)}).</li>
 * </ul>
 * Ranks use 0 for "not ranked".
 *
 * @author RYM Harvest Team
 * @since 1.0
 */
public record AlbumEntity(
    Integer id,
    String urlRym,
    String name,
    int releaseYear,
    int issueCount,
    int listCountRym,
    int overallRank,
    int yearRank,
    double rating,
    int ratingCount,
    int reviewCount,
    List<ArtistEntity> artists,
    List<GenreEntity> genres,
    List<TrackEntity> tracks
) {
    public AlbumEntity withId(int newId) {
        return new AlbumEntity(newId, urlRym, name, releaseYear, issueCount, listCountRym, overallRank,
            yearRank, rating, ratingCount, reviewCount, artists, genres, tracks);
    }

    public AlbumEntity withTracks(List<TrackEntity> newTracks) {
        return new AlbumEntity(id, urlRym, name, releaseYear, issueCount, listCountRym, overallRank,
            yearRank, rating, ratingCount, reviewCount, artists, genres, newTracks);
    }
}
