package com.rymharvest.scraper;

import org.jsoup.nodes.Document;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Stores a single genre by name. Genres carry no page data of their own, so nothing is fetched or extracted.
 */
public class GenreScraper extends AbstractScraper<GenreEntity> {
    private static final String GENRE_URL = "https://rateyourmusic.com/genre/";

    private final String name;

    public GenreScraper(String name, ScrapeContext context) {
        super(genreUrl(name), "RYM genre", context);
        this.name = name.trim();
    }

    static String genreUrl(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Genre name cannot be null or blank");
        return GENRE_URL + URLEncoder.encode(name.trim(), StandardCharsets.UTF_8).replace("+", "%20");
    }

    /**
     * Creates one scraper per genre name, in input order.
     */
    public static List<GenreScraper> createScrapers(List<String> genres, ScrapeContext context) {
        List<GenreScraper> scrapers = new ArrayList<>();
        for (String genre : genres) scrapers.add(new GenreScraper(genre, context));
        return scrapers;
    }

    public String getName() {
        return name;
    }

    @Override
    protected Optional<GenreEntity> lookup() {
        return context.store().findGenre(name);
    }

    @Override
    protected Document requestScrape() {
        return Document.createShell(url);
    }

    @Override
    protected void extractInfo() {
    }

    @Override
    protected GenreEntity saveToDB() {
        return context.store().saveGenre(new GenreEntity(null, name));
    }

    @Override
    protected Integer idOf(GenreEntity stored) {
        return stored.id();
    }

    @Override
    protected List<String> describeScrape() {
        return List.of("Genre: " + name);
    }

    @Override
    protected String label() {
        return name;
    }
}
