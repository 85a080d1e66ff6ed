package com.rymharvest.scraper;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

public class HtmlExtractorTest {

    @Test
    void testFirstTextFallsBackToLaterSelector() {
        Document doc = Jsoup.parse("<div class='artist_name_hdr'>  Slint </div>");
        assertEquals("Slint", HtmlExtractor.firstText(doc, MetadataFieldRegistry.getField("artist.name")).orElseThrow());
    }

    @Test
    void testFirstTextHandlesNulls() {
        assertTrue(HtmlExtractor.firstText(null, MetadataFieldRegistry.getField("artist.name")).isEmpty());
        assertTrue(HtmlExtractor.firstText(Jsoup.parse("<p>x</p>"), null).isEmpty());
        assertEquals("", HtmlExtractor.safeText(null));
    }

    @Test
    void testAllLinksResolvesRelativeHrefs() {
        Document doc = Jsoup.parse("<a class='artist' href='/artist/slint'>Slint</a><a class='artist' href='https://rateyourmusic.com/artist/tortoise'>T</a>",
            "https://rateyourmusic.com/release/album/slint/spiderland/");
        assertEquals(List.of("https://rateyourmusic.com/artist/slint", "https://rateyourmusic.com/artist/tortoise"),
            HtmlExtractor.allLinks(doc, "a.artist"));
    }

    @Test
    void testNumberParsers() {
        assertEquals(OptionalInt.of(68123), HtmlExtractor.parseNumber("68,123 ratings"));
        assertEquals(OptionalInt.of(20), HtmlExtractor.parseHeaderNumber("Lists 20"));
        assertEquals(OptionalInt.of(28), HtmlExtractor.parseBracketedNumber("Show past shows [28]"));
        assertTrue(HtmlExtractor.parseBracketedNumber("Show past shows").isEmpty());
        assertTrue(HtmlExtractor.parseNumber("none").isEmpty());
        assertTrue(HtmlExtractor.parseNumber("99999999999").isEmpty());
        assertEquals(3.87, HtmlExtractor.parseDecimal("3.87 / 5.0").getAsDouble(), 1e-9);
    }

    @Test
    void testParseYearAndRank() {
        assertEquals(OptionalInt.of(1991), HtmlExtractor.parseYear("27 March 1991"));
        assertTrue(HtmlExtractor.parseYear("unknown").isEmpty());
        assertEquals(OptionalInt.of(3), HtmlExtractor.parseRank("#3 for 1991, #57 overall", "for"));
        assertEquals(OptionalInt.of(57), HtmlExtractor.parseRank("#3 for 1991, #57 overall", "overall"));
        assertTrue(HtmlExtractor.parseRank("#3 for 1991", "overall").isEmpty());
    }

    @Test
    void testCountMembersIgnoresCommasInParentheses() {
        assertEquals(2, HtmlExtractor.countMembers("Thom Yorke (vocals, guitar), Jonny Greenwood (guitar)", 1));
        assertEquals(3, HtmlExtractor.countMembers("A, B [2001, 2004], C", 1));
        assertEquals(1, HtmlExtractor.countMembers("   ", 1));
        assertEquals(1, HtmlExtractor.countMembers(",,", 1));
    }
}
