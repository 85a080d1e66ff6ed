package com.rymharvest.scraper;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Service for interacting with the PostgreSQL database holding scraped entities.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Creates the genre, artist, album and track tables plus the relation tables.</li>
 *   <li>Looks rows up by natural key (genre name, RYM URL, album id + track name).</li>
 *   <li>Saves with {@code INSERT ... ON CONFLICT ... RETURNING id}, so a save of an existing natural key
 *   returns the existing id and leaves the row as it was.</li>
 *   <li>Writes an entity and its relation rows in a single transaction. Relation rows are only written
 *   by the save that created the entity; a later save of the same key leaves them untouched.</li>
 * </ul>
 * Every {@link SQLException} is logged and rethrown as {@link PersistenceException}.
 *
 * @author RYM Harvest Team
 * @since 1.0
 */
@SuppressWarnings("SqlResolve")
public class PostgresService implements EntityStoreInterface {
    private static final Logger logger = LoggerFactory.getLogger(PostgresService.class);
    private final String url;
    private final String user;
    private final String password;

    private static final String ARTIST_COLUMNS =
        "id, url_rym, name, active, member_count, solo_performer, list_count_rym, discography_count_rym, show_count_rym";
    private static final String ALBUM_COLUMNS =
        "id, url_rym, name, release_year, issue_count, list_count_rym, overall_rank, year_rank, rating, rating_count, review_count";
    private static final String TRACK_COLUMNS =
        "id, album_id, name, acousticness, danceability, duration_ms, energy, explicit, instrumentalness, liveness, " +
        "loudness, mode, speechiness, tempo, time_signature, valence";

    /**
     * Constructs a PostgresService with the given connection parameters.
     * @param url JDBC URL
     * @param user Database user
     * @param password Database password
     */
    public PostgresService(String url, String user, String password) {
        this.url = url;
        this.user = user;
        this.password = password;
    }

    /**
     * Opens a new database connection.
     * @return Connection
     * @throws SQLException if connection fails
     */
    public Connection connect() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    public void createTables() {
        String[] ddl = {
            "CREATE TABLE IF NOT EXISTS genres (" +
                "id SERIAL PRIMARY KEY, " +
                "name TEXT NOT NULL UNIQUE" +
                ")",
            "CREATE TABLE IF NOT EXISTS artists (" +
                "id SERIAL PRIMARY KEY, " +
                "url_rym TEXT NOT NULL UNIQUE, name TEXT, active BOOLEAN NOT NULL, member_count INTEGER NOT NULL, " +
                "solo_performer BOOLEAN NOT NULL, list_count_rym INTEGER NOT NULL, " +
                "discography_count_rym INTEGER NOT NULL, show_count_rym INTEGER NOT NULL" +
                ")",
            "CREATE TABLE IF NOT EXISTS artist_genres (" +
                "artist_id INTEGER NOT NULL REFERENCES artists(id), " +
                "genre_id INTEGER NOT NULL REFERENCES genres(id), " +
                "position INTEGER NOT NULL, " +
                "PRIMARY KEY (artist_id, genre_id)" +
                ")",
            "CREATE TABLE IF NOT EXISTS albums (" +
                "id SERIAL PRIMARY KEY, " +
                "url_rym TEXT NOT NULL UNIQUE, name TEXT, release_year INTEGER NOT NULL, issue_count INTEGER NOT NULL, " +
                "list_count_rym INTEGER NOT NULL, overall_rank INTEGER NOT NULL, year_rank INTEGER NOT NULL, " +
                "rating DOUBLE PRECISION NOT NULL, rating_count INTEGER NOT NULL, review_count INTEGER NOT NULL" +
                ")",
            "CREATE TABLE IF NOT EXISTS album_artists (" +
                "album_id INTEGER NOT NULL REFERENCES albums(id), " +
                "artist_id INTEGER NOT NULL REFERENCES artists(id), " +
                "position INTEGER NOT NULL, " +
                "PRIMARY KEY (album_id, artist_id)" +
                ")",
            "CREATE TABLE IF NOT EXISTS album_genres (" +
                "album_id INTEGER NOT NULL REFERENCES albums(id), " +
                "genre_id INTEGER NOT NULL REFERENCES genres(id), " +
                "position INTEGER NOT NULL, " +
                "PRIMARY KEY (album_id, genre_id)" +
                ")",
            "CREATE TABLE IF NOT EXISTS tracks (" +
                "id SERIAL PRIMARY KEY, " +
                "album_id INTEGER NOT NULL REFERENCES albums(id), name TEXT NOT NULL, " +
                "acousticness DOUBLE PRECISION, danceability DOUBLE PRECISION, duration_ms INTEGER, " +
                "energy DOUBLE PRECISION, explicit BOOLEAN, instrumentalness DOUBLE PRECISION, " +
                "liveness DOUBLE PRECISION, loudness DOUBLE PRECISION, mode INTEGER, speechiness DOUBLE PRECISION, " +
                "tempo DOUBLE PRECISION, time_signature INTEGER, valence DOUBLE PRECISION, " +
                "UNIQUE (album_id, name)" +
                ")"
        };
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            for (String sql : ddl) stmt.execute(sql);
            logger.info("Ensured genre, artist, album and track tables exist.");
        } catch (SQLException e) {
            throw failure("creating tables", e);
        }
    }

    // --- Genres ---

    public Optional<GenreEntity> findGenre(String name) {
        String sql = "SELECT id, name FROM genres WHERE name = ?";
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(new GenreEntity(rs.getInt("id"), rs.getString("name"))) : Optional.empty();
            }
        } catch (SQLException e) {
            throw failure("finding genre '" + name + "'", e);
        }
    }

    public GenreEntity saveGenre(GenreEntity genre) {
        if (genre == null || genre.name() == null || genre.name().isBlank()) {
            logger.warn("Invalid genre for DB insert: {}", genre);
            throw new IllegalArgumentException("Genre name cannot be null or blank");
        }
        String sql = "INSERT INTO genres (name) VALUES (?) ON CONFLICT (name) DO UPDATE SET name = EXCLUDED.name RETURNING id";
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, genre.name());
            int id = returningId(ps);
            logger.debug("Inserted/found genre '{}' (id={})", genre.name(), id);
            return genre.withId(id);
        } catch (SQLException e) {
            throw failure("saving genre '" + genre.name() + "'", e);
        }
    }

    // --- Artists ---

    public Optional<ArtistEntity> findArtist(String urlRym) {
        return findArtistWhere("url_rym = ?", urlRym);
    }

    public Optional<ArtistEntity> findArtistById(int id) {
        return findArtistWhere("id = ?", id);
    }

    private Optional<ArtistEntity> findArtistWhere(String condition, Object param) {
        String sql = "SELECT " + ARTIST_COLUMNS + " FROM artists WHERE " + condition;
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                ArtistEntity artist = mapArtist(rs);
                return Optional.of(artist.withGenres(loadGenres(conn, "artist_genres", "artist_id", artist.id())));
            }
        } catch (SQLException e) {
            throw failure("finding artist by " + condition + " " + param, e);
        }
    }

    public ArtistEntity saveArtist(ArtistEntity artist) {
        if (artist == null || artist.urlRym() == null || artist.urlRym().isBlank()) {
            logger.warn("Invalid artist for DB insert: {}", artist);
            throw new IllegalArgumentException("Artist URL cannot be null or blank");
        }
        String sql = "INSERT INTO artists (url_rym, name, active, member_count, solo_performer, list_count_rym, " +
            "discography_count_rym, show_count_rym) VALUES (?, ?, ?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT (url_rym) DO UPDATE SET url_rym = EXCLUDED.url_rym RETURNING id, (xmax = 0) AS inserted";
        List<Integer> genreIds = genreIds(artist.genres());
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, artist.urlRym());
                ps.setString(2, artist.name());
                ps.setBoolean(3, artist.active());
                ps.setInt(4, artist.memberCount());
                ps.setBoolean(5, artist.soloPerformer());
                ps.setInt(6, artist.listCountRym());
                ps.setInt(7, artist.discographyCountRym());
                ps.setInt(8, artist.showCountRym());
                Upsert row = upsert(ps);
                int id = row.id();
                if (row.inserted()) {
                    insertRelations(conn, "artist_genres", "artist_id", "genre_id", id, genreIds);
                } else {
                    logger.info("Artist {} already stored; keeping its existing genres", artist.urlRym());
                }
                conn.commit();
                logger.info("Inserted/found artist '{}' (id={})", artist.name(), id);
                return artist.withId(id);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw failure("saving artist " + artist.urlRym(), e);
        }
    }

    // --- Albums ---

    public Optional<AlbumEntity> findAlbum(String urlRym) {
        return findAlbumWhere("url_rym = ?", urlRym);
    }

    public Optional<AlbumEntity> findAlbumById(int id) {
        return findAlbumWhere("id = ?", id);
    }

    private Optional<AlbumEntity> findAlbumWhere(String condition, Object param) {
        String sql = "SELECT " + ALBUM_COLUMNS + " FROM albums WHERE " + condition;
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                int id = rs.getInt("id");
                List<ArtistEntity> artists = loadAlbumArtists(conn, id);
                List<GenreEntity> genres = loadGenres(conn, "album_genres", "album_id", id);
                return Optional.of(new AlbumEntity(
                    id,
                    rs.getString("url_rym"),
                    rs.getString("name"),
                    rs.getInt("release_year"),
                    rs.getInt("issue_count"),
                    rs.getInt("list_count_rym"),
                    rs.getInt("overall_rank"),
                    rs.getInt("year_rank"),
                    rs.getDouble("rating"),
                    rs.getInt("rating_count"),
                    rs.getInt("review_count"),
                    artists,
                    genres,
                    null
                ));
            }
        } catch (SQLException e) {
            throw failure("finding album by " + condition + " " + param, e);
        }
    }

    public AlbumEntity saveAlbum(AlbumEntity album) {
        if (album == null || album.urlRym() == null || album.urlRym().isBlank()) {
            logger.warn("Invalid album for DB insert: {}", album);
            throw new IllegalArgumentException("Album URL cannot be null or blank");
        }
        String sql = "INSERT INTO albums (url_rym, name, release_year, issue_count, list_count_rym, overall_rank, " +
            "year_rank, rating, rating_count, review_count) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT (url_rym) DO UPDATE SET url_rym = EXCLUDED.url_rym RETURNING id, (xmax = 0) AS inserted";
        List<Integer> artistIds = new ArrayList<>();
        if (album.artists() != null) {
            for (ArtistEntity artist : album.artists()) artistIds.add(requireId(artist.id(), "artist " + artist.urlRym()));
        }
        List<Integer> genreIds = genreIds(album.genres());
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, album.urlRym());
                ps.setString(2, album.name());
                ps.setInt(3, album.releaseYear());
                ps.setInt(4, album.issueCount());
                ps.setInt(5, album.listCountRym());
                ps.setInt(6, album.overallRank());
                ps.setInt(7, album.yearRank());
                ps.setDouble(8, album.rating());
                ps.setInt(9, album.ratingCount());
                ps.setInt(10, album.reviewCount());
                Upsert row = upsert(ps);
                int id = row.id();
                if (row.inserted()) {
                    insertRelations(conn, "album_artists", "album_id", "artist_id", id, artistIds);
                    insertRelations(conn, "album_genres", "album_id", "genre_id", id, genreIds);
                } else {
                    logger.info("Album {} already stored; keeping its existing artists and genres", album.urlRym());
                }
                conn.commit();
                logger.info("Inserted/found album '{}' (id={})", album.name(), id);
                return album.withId(id);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw failure("saving album " + album.urlRym(), e);
        }
    }

    // --- Tracks ---

    public Optional<TrackEntity> findTrackById(int id) {
        String sql = "SELECT " + TRACK_COLUMNS + " FROM tracks WHERE id = ?";
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapTrack(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw failure("finding track " + id, e);
        }
    }

    public List<TrackEntity> findTracksByAlbum(int albumId) {
        String sql = "SELECT " + TRACK_COLUMNS + " FROM tracks WHERE album_id = ? ORDER BY id";
        List<TrackEntity> tracks = new ArrayList<>();
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, albumId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) tracks.add(mapTrack(rs));
            }
            return tracks;
        } catch (SQLException e) {
            throw failure("loading tracks of album " + albumId, e);
        }
    }

    public TrackEntity saveTrack(TrackEntity track) {
        if (track == null || track.name() == null || track.name().isBlank()) {
            logger.warn("Invalid track for DB insert: {}", track);
            throw new IllegalArgumentException("Track name cannot be null or blank");
        }
        String sql = "INSERT INTO tracks (album_id, name, acousticness, danceability, duration_ms, energy, explicit, " +
            "instrumentalness, liveness, loudness, mode, speechiness, tempo, time_signature, valence) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT (album_id, name) DO UPDATE SET name = EXCLUDED.name RETURNING id";
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, track.albumId());
            ps.setString(2, track.name());
            ps.setDouble(3, track.acousticness());
            ps.setDouble(4, track.danceability());
            ps.setInt(5, track.durationMs());
            ps.setDouble(6, track.energy());
            ps.setBoolean(7, track.explicit());
            ps.setDouble(8, track.instrumentalness());
            ps.setDouble(9, track.liveness());
            ps.setDouble(10, track.loudness());
            ps.setInt(11, track.mode());
            ps.setDouble(12, track.speechiness());
            ps.setDouble(13, track.tempo());
            ps.setInt(14, track.timeSignature());
            ps.setDouble(15, track.valence());
            int id = returningId(ps);
            logger.debug("Inserted/found track '{}' of album {} (id={})", track.name(), track.albumId(), id);
            return track.withId(id);
        } catch (SQLException e) {
            throw failure("saving track '" + track.name() + "'", e);
        }
    }

    // --- Listings ---

    public List<Integer> listArtistIds() {
        return listIds("artists");
    }

    public List<Integer> listAlbumIds() {
        return listIds("albums");
    }

    public List<Integer> listTrackIds() {
        return listIds("tracks");
    }

    private List<Integer> listIds(String table) {
        List<Integer> ids = new ArrayList<>();
        try (Connection conn = connect(); Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT id FROM " + table + " ORDER BY id")) {
            while (rs.next()) ids.add(rs.getInt(1));
            return ids;
        } catch (SQLException e) {
            throw failure("listing ids of " + table, e);
        }
    }

    // --- Helpers ---

    /** Id of an upserted row and whether this statement created it. */
    private record Upsert(int id, boolean inserted) {}

    private static Upsert upsert(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) throw new SQLException("Upsert returned no id");
            return new Upsert(rs.getInt("id"), rs.getBoolean("inserted"));
        }
    }

    private static int returningId(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) throw new SQLException("Upsert returned no id");
            return rs.getInt(1);
        }
    }

    private static void insertRelations(Connection conn, String table, String ownerColumn, String targetColumn,
                                        int ownerId, List<Integer> targetIds) throws SQLException {
        if (targetIds.isEmpty()) return;
        String sql = "INSERT INTO " + table + " (" + ownerColumn + ", " + targetColumn + ", position) VALUES (?, ?, ?) " +
            "ON CONFLICT DO NOTHING";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int position = 0;
            for (Integer targetId : targetIds) {
                ps.setInt(1, ownerId);
                ps.setInt(2, targetId);
                ps.setInt(3, position++);
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private static List<Integer> genreIds(List<GenreEntity> genres) {
        List<Integer> ids = new ArrayList<>();
        if (genres == null) return ids;
        for (GenreEntity genre : genres) ids.add(requireId(genre.id(), "genre " + genre.name()));
        return ids;
    }

    private static int requireId(Integer id, String what) {
        if (id == null) throw new PersistenceException("Related " + what + " has not been persisted");
        return id;
    }

    private static List<GenreEntity> loadGenres(Connection conn, String table, String ownerColumn, int ownerId) throws SQLException {
        String sql = "SELECT g.id, g.name FROM genres g JOIN " + table + " r ON r.genre_id = g.id " +
            "WHERE r." + ownerColumn + " = ? ORDER BY r.position";
        List<GenreEntity> genres = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, ownerId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) genres.add(new GenreEntity(rs.getInt("id"), rs.getString("name")));
            }
        }
        return genres;
    }

    private static List<ArtistEntity> loadAlbumArtists(Connection conn, int albumId) throws SQLException {
        String sql = "SELECT a." + ARTIST_COLUMNS.replace(", ", ", a.") + " FROM artists a " +
            "JOIN album_artists r ON r.artist_id = a.id WHERE r.album_id = ? ORDER BY r.position";
        List<ArtistEntity> artists = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, albumId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) artists.add(mapArtist(rs));
            }
        }
        List<ArtistEntity> withGenres = new ArrayList<>();
        for (ArtistEntity artist : artists) {
            withGenres.add(artist.withGenres(loadGenres(conn, "artist_genres", "artist_id", artist.id())));
        }
        return withGenres;
    }

    private static ArtistEntity mapArtist(ResultSet rs) throws SQLException {
        return new ArtistEntity(
            rs.getInt("id"),
            rs.getString("url_rym"),
            rs.getString("name"),
            rs.getBoolean("active"),
            rs.getInt("member_count"),
            rs.getBoolean("solo_performer"),
            rs.getInt("list_count_rym"),
            rs.getInt("discography_count_rym"),
            rs.getInt("show_count_rym"),
            null
        );
    }

    private static TrackEntity mapTrack(ResultSet rs) throws SQLException {
        return new TrackEntity(
            rs.getInt("id"),
            rs.getInt("album_id"),
            rs.getString("name"),
            rs.getDouble("acousticness"),
            rs.getDouble("danceability"),
            rs.getInt("duration_ms"),
            rs.getDouble("energy"),
            rs.getBoolean("explicit"),
            rs.getDouble("instrumentalness"),
            rs.getDouble("liveness"),
            rs.getDouble("loudness"),
            rs.getInt("mode"),
            rs.getDouble("speechiness"),
            rs.getDouble("tempo"),
            rs.getInt("time_signature"),
            rs.getDouble("valence")
        );
    }

    private static PersistenceException failure(String action, SQLException e) {
        logger.error("Error {}: {}", action, e.getMessage());
        return new PersistenceException("Error " + action, e);
    }

    /**
     * Starts an embedded PostgreSQL instance for local use and returns it.
     * @param dataDir directory under which to store DB data
     * @param port port number for the Postgres server
     * @return EmbeddedPostgres instance
     */
    public static EmbeddedPostgres startEmbedded(String dataDir, int port) {
        try {
            EmbeddedPostgres postgres = EmbeddedPostgres.builder()
                .setDataDirectory(Paths.get(dataDir))
                .setCleanDataDirectory(false)
                .setPort(port)
                .start();
            logger.info("Embedded PostgreSQL started at {} on port {}", dataDir, port);
            return postgres;
        } catch (Exception e) {
            logger.error("Failed to start embedded PostgreSQL on port {}: {}", port, e.getMessage());
            throw new PersistenceException("Failed to start embedded PostgreSQL on port " + port, e);
        }
    }
}
