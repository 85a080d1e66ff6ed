package com.rymharvest.scraper;

/**
 * Immutable record representing a genre stored in the database.
 * The genre name is its natural key.
 *
 * @author RYM Harvest Team
 * @since 1.0
 */
public record GenreEntity(Integer id, String name) {

    public GenreEntity withId(int newId) {
        return new GenreEntity(newId, name);
    }
}
