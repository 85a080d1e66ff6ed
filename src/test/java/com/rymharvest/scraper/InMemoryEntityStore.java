package com.rymharvest.scraper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Map-backed store for tests. Mirrors the upsert semantics of {@link PostgresService}: saving an entity
 * whose natural key is already stored returns the stored entity.
 */
public class InMemoryEntityStore implements EntityStoreInterface {
    private final Map<String, GenreEntity> genres = new LinkedHashMap<>();
    private final Map<String, ArtistEntity> artists = new LinkedHashMap<>();
    private final Map<String, AlbumEntity> albums = new LinkedHashMap<>();
    private final Map<Integer, TrackEntity> tracks = new LinkedHashMap<>();
    private int nextId = 1;

    int saveCalls;

    @Override
    public void createTables() {
    }

    @Override
    public Optional<GenreEntity> findGenre(String name) {
        return Optional.ofNullable(genres.get(name));
    }

    @Override
    public GenreEntity saveGenre(GenreEntity genre) {
        saveCalls++;
        return genres.computeIfAbsent(genre.name(), k -> genre.withId(nextId++));
    }

    @Override
    public Optional<ArtistEntity> findArtist(String urlRym) {
        return Optional.ofNullable(artists.get(urlRym));
    }

    @Override
    public Optional<ArtistEntity> findArtistById(int id) {
        return artists.values().stream().filter(a -> a.id() == id).findFirst();
    }

    @Override
    public ArtistEntity saveArtist(ArtistEntity artist) {
        saveCalls++;
        for (GenreEntity genre : artist.genres()) requirePersisted(genre.id());
        return artists.computeIfAbsent(artist.urlRym(), k -> artist.withId(nextId++));
    }

    @Override
    public Optional<AlbumEntity> findAlbum(String urlRym) {
        return Optional.ofNullable(albums.get(urlRym)).map(a -> a.withTracks(null));
    }

    @Override
    public Optional<AlbumEntity> findAlbumById(int id) {
        return albums.values().stream().filter(a -> a.id() == id).findFirst().map(a -> a.withTracks(null));
    }

    @Override
    public AlbumEntity saveAlbum(AlbumEntity album) {
        saveCalls++;
        for (ArtistEntity artist : album.artists()) requirePersisted(artist.id());
        for (GenreEntity genre : album.genres()) requirePersisted(genre.id());
        return albums.computeIfAbsent(album.urlRym(), k -> album.withId(nextId++));
    }

    @Override
    public Optional<TrackEntity> findTrackById(int id) {
        return Optional.ofNullable(tracks.get(id));
    }

    @Override
    public List<TrackEntity> findTracksByAlbum(int albumId) {
        List<TrackEntity> found = new ArrayList<>();
        for (TrackEntity track : tracks.values()) if (track.albumId() == albumId) found.add(track);
        return found;
    }

    @Override
    public TrackEntity saveTrack(TrackEntity track) {
        saveCalls++;
        for (TrackEntity existing : tracks.values()) {
            if (existing.albumId() == track.albumId() && existing.name().equals(track.name())) return existing;
        }
        TrackEntity stored = track.withId(nextId++);
        tracks.put(stored.id(), stored);
        return stored;
    }

    @Override
    public List<Integer> listArtistIds() {
        return artists.values().stream().map(ArtistEntity::id).sorted().toList();
    }

    @Override
    public List<Integer> listAlbumIds() {
        return albums.values().stream().map(AlbumEntity::id).sorted().toList();
    }

    @Override
    public List<Integer> listTrackIds() {
        return tracks.keySet().stream().sorted().toList();
    }

    public int genreCount() {
        return genres.size();
    }

    public int artistCount() {
        return artists.size();
    }

    private static void requirePersisted(Integer id) {
        if (id == null) throw new PersistenceException("Relation points at an entity without id");
    }
}
