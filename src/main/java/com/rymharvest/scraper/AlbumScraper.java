package com.rymharvest.scraper;

import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Manages scraping and storage of a single album on Rate Your Music.
 * <p>
 * The album info table is read row by row, switching on the row header:
 * <ul>
 *   <li>{@code Artist}: one {@link ArtistScraper} per linked artist;</li>
 *   <li>{@code Released}: release year;</li>
 *   <li>{@code Ranked}: year rank ({@code #1 for 1997}) and overall rank ({@code #12 overall});</li>
 *   <li>{@code RYM Rating}: average rating and number of ratings;</li>
 *   <li>{@code Genres}: one {@link GenreScraper} per primary genre.</li>
 * </ul>
 * Title, review count, list count and issue count come from the rest of the page.
 * Artists are resolved before genres.
 *
 * @author RYM Harvest Team
 * @since 1.0
 */
public class AlbumScraper extends AbstractScraper<AlbumEntity> {

    private String name;
    private int releaseYear;
    private int issueCount;
    private int listCountRym;
    private int overallRank;
    private int yearRank;
    private double rating;
    private int ratingCount;
    private int reviewCount;
    private List<ArtistScraper> artistScrapers = new ArrayList<>();
    private List<GenreScraper> genreScrapers = new ArrayList<>();

    public AlbumScraper(String url, ScrapeContext context) {
        super(url, "RYM album", context);
    }

    /**
     * Creates one scraper per album URL, in input order.
     */
    public static List<AlbumScraper> createScrapers(List<String> urls, ScrapeContext context) {
        List<AlbumScraper> scrapers = new ArrayList<>();
        for (String albumUrl : urls) scrapers.add(new AlbumScraper(albumUrl, context));
        return scrapers;
    }

    @Override
    protected Optional<AlbumEntity> lookup() {
        return context.store().findAlbum(url);
    }

    @Override
    protected void extractInfo() {
        runExtraction("album.name", () -> name = extractString("album.name", null));
        runExtraction("album.infoRows", this::extractInfoRows);
        runExtraction("album.reviewCount", () -> reviewCount = extractNumber("album.reviewCount", 0, HtmlExtractor::parseHeaderNumber));
        runExtraction("album.listCount", () -> listCountRym = extractNumber("album.listCount", 0, HtmlExtractor::parseHeaderNumber));
        runExtraction("album.issues", this::extractIssueCount);
    }

    private void extractInfoRows() {
        Elements rows = HtmlExtractor.firstMatch(document, MetadataFieldRegistry.getField("album.infoRows"));
        if (rows.isEmpty()) {
            degrade("album.infoRows", "not found", "no artists, genres, ranks or rating");
            return;
        }
        boolean ratingSeen = false;
        boolean releasedSeen = false;
        for (Element row : rows) {
            String header = HtmlExtractor.safeText(row.selectFirst("th"));
            Element value = row.selectFirst("td");
            if (value == null) continue;
            switch (header) {
                case "Artist" -> artistScrapers = ArtistScraper.createScrapers(HtmlExtractor.allLinks(value, "a.artist"), context);
                case "Released" -> {
                    releasedSeen = true;
                    releaseYear = orDegrade("album.releaseYear", HtmlExtractor.parseYear(HtmlExtractor.safeText(value)));
                }
                case "Ranked" -> {
                    String ranks = HtmlExtractor.safeText(value);
                    yearRank = HtmlExtractor.parseRank(ranks, "for").orElse(0);
                    overallRank = HtmlExtractor.parseRank(ranks, "overall").orElse(0);
                }
                case "RYM Rating" -> {
                    ratingSeen = true;
                    extractRating(value);
                }
                case "Genres" -> genreScrapers = GenreScraper.createScrapers(
                    HtmlExtractor.allTexts(value, "span.release_pri_genres a.genre"), context);
                default -> {
                }
            }
        }
        if (!releasedSeen) degrade("album.releaseYear", "not found", 0);
        if (!ratingSeen) degrade("album.rating", "not found", 0);
    }

    private void extractRating(Element value) {
        OptionalDouble avg = HtmlExtractor.parseDecimal(HtmlExtractor.safeText(value.selectFirst("span.avg_rating")));
        if (avg.isPresent()) {
            rating = avg.getAsDouble();
        } else {
            degrade("album.rating", "could not parse average", 0);
        }
        ratingCount = orDegrade("album.ratingCount",
            HtmlExtractor.parseNumber(HtmlExtractor.safeText(value.selectFirst("span.num_ratings"))));
    }

    private void extractIssueCount() {
        Elements issues = HtmlExtractor.firstMatch(document, MetadataFieldRegistry.getField("album.issues"));
        // the page itself is always one issue
        issueCount = Math.max(1, issues.size());
    }

    private int orDegrade(String fieldName, OptionalInt parsed) {
        if (parsed.isPresent()) return parsed.getAsInt();
        degrade(fieldName, "could not parse", 0);
        return 0;
    }

    @Override
    protected List<Scraper<?>> dependencies() {
        List<Scraper<?>> dependencies = new ArrayList<>(artistScrapers);
        dependencies.addAll(genreScrapers);
        return dependencies;
    }

    @Override
    protected AlbumEntity saveToDB() {
        AlbumEntity album = new AlbumEntity(
            null,
            url,
            name,
            releaseYear,
            issueCount,
            listCountRym,
            overallRank,
            yearRank,
            rating,
            ratingCount,
            reviewCount,
            completedEntities(artistScrapers),
            completedEntities(genreScrapers),
            null
        );
        return context.store().saveAlbum(album);
    }

    @Override
    protected Integer idOf(AlbumEntity stored) {
        return stored.id();
    }

    @Override
    protected void onFoundInDatabase(AlbumEntity stored) {
        name = stored.name();
    }

    @Override
    protected List<String> describeScrape() {
        return List.of(
            "Album Scrape Successful: " + name,
            "Released: " + releaseYear,
            "Artist Count: " + usableDependencyCount(artistScrapers),
            "Genre Count: " + usableDependencyCount(genreScrapers),
            "Rating: " + rating + " from " + ratingCount + " ratings",
            "Reviews: " + reviewCount,
            "Rank: #" + overallRank + " overall, #" + yearRank + " for the year",
            "Issues: " + issueCount,
            "RYM List Features: " + listCountRym
        );
    }

    @Override
    protected String label() {
        return name == null ? url : name;
    }

    public String getName() {
        return name;
    }

    public int getReleaseYear() {
        return releaseYear;
    }

    public int getIssueCount() {
        return issueCount;
    }

    public int getListCountRym() {
        return listCountRym;
    }

    public int getOverallRank() {
        return overallRank;
    }

    public int getYearRank() {
        return yearRank;
    }

    public double getRating() {
        return rating;
    }

    public int getRatingCount() {
        return ratingCount;
    }

    public int getReviewCount() {
        return reviewCount;
    }

    public List<ArtistScraper> getArtistScrapers() {
        return List.copyOf(artistScrapers);
    }

    public List<GenreScraper> getGenreScrapers() {
        return List.copyOf(genreScrapers);
    }
}
