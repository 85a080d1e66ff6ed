package com.rymharvest.scraper;

import java.util.List;

/**
 * Immutable record representing an artist scraped from Rate Your Music.
 * <p>
 * The RYM page URL is the natural key. {@code genres} holds the artist's genre relations
 * and is {@code null} when the row was loaded without them.
 *
 * @author RYM Harvest Team
 * @since 1.0
 */
public record ArtistEntity(
    Integer id,
    String urlRym,
    String name,
    boolean active,
    int memberCount,
    boolean soloPerformer,
    int listCountRym,
    int discographyCountRym,
    int showCountRym,
    List<GenreEntity> genres
) {
    public ArtistEntity withId(int newId) {
        return new ArtistEntity(newId, urlRym, name, active, memberCount, soloPerformer,
            listCountRym, discographyCountRym, showCountRym, genres);
    }

    public ArtistEntity withGenres(List<GenreEntity> newGenres) {
        return new ArtistEntity(id, urlRym, name, active, memberCount, soloPerformer,
            listCountRym, discographyCountRym, showCountRym, newGenres);
    }
}
