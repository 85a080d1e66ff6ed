package com.rymharvest.scraper;

import java.util.*;

/**
 * Central registry of the Rate Your Music page fields and their selectors.
 * Field names are prefixed by page type ({@code artist.}, {@code album.}).
 * When RYM changes its markup, add the new selector in front of the old one here.
 */
public final class MetadataFieldRegistry {
    private MetadataFieldRegistry() {}

    private static final List<MetadataField> FIELDS = List.of(
        // artist page
        new MetadataField("artist.name", List.of(
            "h1.artist_name_hdr", "div.artist_name_hdr", "[itemprop=name]"
        )),
        new MetadataField("artist.infoBlocks", List.of(
            ".artist_info > div"
        )),
        new MetadataField("artist.discographyCount", List.of(
            "div.artist_page_section_active_music > span.subtext", "#discography .subtext"
        )),
        new MetadataField("artist.listCount", List.of(
            "div.section_lists > div.release_page_header > h2", "div.section_lists h2"
        )),
        new MetadataField("artist.pastShowCount", List.of(
            "#disco_expand_prev", "a.disco_expand_prev"
        )),

        // album page
        new MetadataField("album.name", List.of(
            "div.album_title", "h1.album_title", "[itemprop=name]"
        )),
        new MetadataField("album.infoRows", List.of(
            "table.album_info tr"
        )),
        new MetadataField("album.reviewCount", List.of(
            "div.section_reviews > div.release_page_header > h2", "div.section_reviews h2"
        )),
        new MetadataField("album.listCount", List.of(
            "div.section_lists > div.release_page_header > h2", "div.section_lists h2"
        )),
        new MetadataField("album.issues", List.of(
            "div.section_issues div.issue_info", "div.issues div.issue_info"
        ))
    );

    public static List<MetadataField> getFields() {
        return FIELDS;
    }

    /**
     * Returns the MetadataField for a given field name, or null if not found.
     */
    public static MetadataField getField(String name) {
        for (MetadataField f : FIELDS) if (f.fieldName.equals(name)) return f;
        return null;
    }
}
