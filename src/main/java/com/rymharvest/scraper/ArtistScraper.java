package com.rymharvest.scraper;

import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Manages scraping and storage of a single artist on Rate Your Music.
 * <p>
 * Extraction steps, each independent:
 * <ul>
 *   <li>name from the page header;</li>
 *   <li>the info blocks, switching on each block's header: {@code Members} gives the member count,
 *   {@code Genres} creates one {@link GenreScraper} per genre link, {@code Disbanded} marks the artist
 *   inactive, {@code Born} marks a solo performer, {@code Died} marks a solo performer and inactive;</li>
 *   <li>discography size, list appearances and past live shows.</li>
 * </ul>
 * Counts that cannot be read default to 0.
 *
 * @author RYM Harvest Team
 * @since 1.0
 */
public class ArtistScraper extends AbstractScraper<ArtistEntity> {

    private String name;
    private boolean active = true;
    private int memberCount;
    private boolean soloPerformer;
    private List<GenreScraper> genreScrapers = new ArrayList<>();
    private int listCountRym;
    private int discographyCountRym;
    private int showCountRym;

    public ArtistScraper(String url, ScrapeContext context) {
        super(url, "RYM artist", context);
    }

    /**
     * Creates one scraper per artist URL, in input order.
     */
    public static List<ArtistScraper> createScrapers(List<String> urls, ScrapeContext context) {
        List<ArtistScraper> scrapers = new ArrayList<>();
        for (String artistUrl : urls) scrapers.add(new ArtistScraper(artistUrl, context));
        return scrapers;
    }

    @Override
    protected Optional<ArtistEntity> lookup() {
        return context.store().findArtist(url);
    }

    @Override
    protected void extractInfo() {
        runExtraction("artist.name", this::extractArtistName);
        runExtraction("artist.infoBlocks", this::extractMainInfoBlocks);
        runExtraction("artist.discographyCount", this::extractDiscographyCount);
        runExtraction("artist.listCount", this::extractListCount);
        runExtraction("artist.pastShowCount", this::extractPastShowCount);
    }

    private void extractArtistName() {
        name = extractString("artist.name", null);
    }

    /**
     * Walks the artist info blocks. Every {@code info_content} block is interpreted by the header block
     * directly before it.
     */
    private void extractMainInfoBlocks() {
        Elements infoBlocks = HtmlExtractor.firstMatch(document, MetadataFieldRegistry.getField("artist.infoBlocks"));
        if (infoBlocks.isEmpty()) {
            degrade("artist.infoBlocks", "not found", "band, active, no genres");
            return;
        }
        boolean membersSeen = false;
        for (int i = 1; i < infoBlocks.size(); i++) {
            Element block = infoBlocks.get(i);
            if (!block.hasClass("info_content")) continue;
            String header = HtmlExtractor.safeText(infoBlocks.get(i - 1));
            switch (header) {
                case "Members" -> {
                    memberCount = HtmlExtractor.countMembers(HtmlExtractor.safeText(block), 1);
                    membersSeen = true;
                }
                case "Genres" -> genreScrapers = GenreScraper.createScrapers(HtmlExtractor.allTexts(block, "a"), context);
                case "Disbanded" -> active = false;
                case "Born" -> soloPerformer = true;
                case "Died" -> {
                    soloPerformer = true;
                    active = false;
                }
                default -> {
                }
            }
        }
        if (!membersSeen && soloPerformer) memberCount = 1;
    }

    private void extractDiscographyCount() {
        discographyCountRym = extractNumber("artist.discographyCount", 0);
    }

    private void extractListCount() {
        listCountRym = extractNumber("artist.listCount", 0, HtmlExtractor::parseHeaderNumber);
    }

    /**
     * Element text looks like {@code Show past shows [28]}.
     */
    private void extractPastShowCount() {
        showCountRym = extractNumber("artist.pastShowCount", 0, HtmlExtractor::parseBracketedNumber);
    }

    @Override
    protected List<GenreScraper> dependencies() {
        return genreScrapers;
    }

    @Override
    protected ArtistEntity saveToDB() {
        List<GenreEntity> genres = completedEntities(genreScrapers);
        ArtistEntity artist = new ArtistEntity(
            null,
            url,
            name,
            active,
            memberCount,
            soloPerformer,
            listCountRym,
            discographyCountRym,
            showCountRym,
            genres
        );
        return context.store().saveArtist(artist);
    }

    @Override
    protected Integer idOf(ArtistEntity stored) {
        return stored.id();
    }

    @Override
    protected void onFoundInDatabase(ArtistEntity stored) {
        name = stored.name();
        active = stored.active();
        memberCount = stored.memberCount();
        soloPerformer = stored.soloPerformer();
        listCountRym = stored.listCountRym();
        discographyCountRym = stored.discographyCountRym();
        showCountRym = stored.showCountRym();
    }

    @Override
    protected List<String> describeScrape() {
        return List.of(
            "Artist Scrape Successful: " + name,
            "Type: " + (soloPerformer ? "Solo Performer" : "Band"),
            "Status: " + (active ? "active" : "disbanded"),
            "Members: " + memberCount,
            "Genre Count: " + usableDependencyCount(genreScrapers),
            "RYM List Features: " + listCountRym,
            "Discography Count: " + discographyCountRym,
            "Live Shows: " + showCountRym
        );
    }

    @Override
    protected String label() {
        return name == null ? url : name;
    }

    public String getName() {
        return name;
    }

    public boolean isActive() {
        return active;
    }

    public int getMemberCount() {
        return memberCount;
    }

    public boolean isSoloPerformer() {
        return soloPerformer;
    }

    public List<GenreScraper> getGenreScrapers() {
        return List.copyOf(genreScrapers);
    }

    public int getListCountRym() {
        return listCountRym;
    }

    public int getDiscographyCountRym() {
        return discographyCountRym;
    }

    public int getShowCountRym() {
        return showCountRym;
    }
}
