package com.rymharvest.scraper;

import java.util.List;
import java.util.Optional;

/**
 * Interface for the relational store holding scraped entities.
 * <p>
 * Lookups by natural key back the find-or-create step of every scraper. Saves are upserts on the
 * natural key, so two saves of the same key yield one row and the same id.
 * All methods throw {@link PersistenceException} when the store fails.
 */
public interface EntityStoreInterface {
    /**
     * Creates the necessary tables if they don't already exist.
     */
    void createTables();

    /**
     * Finds a genre by name.
     * @param name genre name (natural key)
     * @return the stored genre, or empty if not stored yet
     */
    Optional<GenreEntity> findGenre(String name);

    /**
     * Inserts a genre, or returns the existing row for its name.
     * @param genre genre to store
     * @return the genre with its assigned id
     */
    GenreEntity saveGenre(GenreEntity genre);

    /**
     * Finds an artist by RYM URL, with its genres loaded.
     * @param urlRym artist page URL (natural key)
     * @return the stored artist, or empty if not stored yet
     */
    Optional<ArtistEntity> findArtist(String urlRym);

    Optional<ArtistEntity> findArtistById(int id);

    /**
     * Stores an artist and its genre relations. Genres must already have ids.
     * @param artist artist to store
     * @return the artist with its assigned id
     */
    ArtistEntity saveArtist(ArtistEntity artist);

    /**
     * Finds an album by RYM URL, with artists and genres loaded. Tracks are left unloaded.
     * @param urlRym album page URL (natural key)
     * @return the stored album, or empty if not stored yet
     */
    Optional<AlbumEntity> findAlbum(String urlRym);

    Optional<AlbumEntity> findAlbumById(int id);

    /**
     * Stores an album with its artist and genre relations. Related entities must already have ids.
     * @param album album to store
     * @return the album with its assigned id
     */
    AlbumEntity saveAlbum(AlbumEntity album);

    Optional<TrackEntity> findTrackById(int id);

    /**
     * Loads all tracks of an album, ordered by id.
     * @param albumId album id
     * @return tracks of the album, empty if none were imported
     */
    List<TrackEntity> findTracksByAlbum(int albumId);

    TrackEntity saveTrack(TrackEntity track);

    List<Integer> listArtistIds();

    List<Integer> listAlbumIds();

    List<Integer> listTrackIds();
}
