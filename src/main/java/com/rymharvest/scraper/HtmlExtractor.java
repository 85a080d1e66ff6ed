package com.rymharvest.scraper;

import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Null-safe helpers for reading values out of parsed pages.
 * <p>
 * Selector lookups try every selector of a {@link MetadataField} in order and use the first one that yields
 * something. Number parsers accept the formats RYM prints: thousands separators ({@code 68,123}),
 * header/number pairs ({@code Lists 20}) and bracketed counters ({@code Show past shows [28]}).
 *
 * @author RYM Harvest Team
 * @since 1.0
 */
public final class HtmlExtractor {
    private static final Logger logger = LoggerFactory.getLogger(HtmlExtractor.class);
    private static final Pattern NUMBER = Pattern.compile("\\d[\\d,]*");
    private static final Pattern DECIMAL = Pattern.compile("\\d+(?:\\.\\d+)?");
    private static final Pattern BRACKETED = Pattern.compile("\\[\\s*(\\d[\\d,]*)\\s*]");
    private static final Pattern YEAR = Pattern.compile("\\b(1[89]\\d\\d|20\\d\\d)\\b");

    private HtmlExtractor() {}

    /**
     * Returns the trimmed text of the first element matched by any of the field's selectors.
     * @param root element to search below (may be null)
     * @param field field and selectors (may be null)
     * @return first non-blank text, or empty
     */
    public static Optional<String> firstText(Element root, MetadataField field) {
        for (Element element : firstMatch(root, field)) {
            String text = safeText(element);
            if (!text.isEmpty()) return Optional.of(text);
        }
        return Optional.empty();
    }

    /**
     * Returns the elements matched by the first selector of the field that matches anything.
     * @param root element to search below (may be null)
     * @param field field and selectors (may be null)
     * @return matched elements, empty if no selector matched
     */
    public static Elements firstMatch(Element root, MetadataField field) {
        if (root == null || field == null) {
            logger.debug("firstMatch called with null root or field ({}).", field == null ? null : field.fieldName);
            return new Elements();
        }
        for (String selector : field.selectors) {
            if (selector == null || selector.isBlank()) continue;
            try {
                Elements found = root.select(selector);
                if (!found.isEmpty()) return found;
            } catch (RuntimeException e) {
                logger.warn("Error evaluating selector '{}' for {}: {}", selector, field.fieldName, e.getMessage());
            }
        }
        logger.debug("No selector matched for {}", field.fieldName);
        return new Elements();
    }

    /**
     * Texts of all elements below {@code root} matching {@code selector}, blanks dropped, in document order.
     */
    public static List<String> allTexts(Element root, String selector) {
        List<String> texts = new ArrayList<>();
        if (root == null) return texts;
        for (Element element : root.select(selector)) {
            String text = safeText(element);
            if (!text.isEmpty()) texts.add(text);
        }
        return texts;
    }

    /**
     * Absolute {@code href}s of all elements below {@code root} matching {@code selector}, in document order.
     */
    public static List<String> allLinks(Element root, String selector) {
        List<String> links = new ArrayList<>();
        if (root == null) return links;
        for (Element element : root.select(selector)) {
            String href = element.absUrl("href");
            if (href.isEmpty()) href = element.attr("href");
            if (!href.isBlank()) links.add(href.trim());
        }
        return links;
    }

    public static String safeText(Element element) {
        if (element == null) return "";
        String text = element.text();
        return text == null ? "" : text.trim();
    }

    /**
     * First integer in the text, thousands separators removed.
     */
    public static OptionalInt parseNumber(String raw) {
        if (raw == null) return OptionalInt.empty();
        Matcher m = NUMBER.matcher(raw);
        return m.find() ? toInt(m.group()) : OptionalInt.empty();
    }

    /**
     * Last integer in the text, for "header number" pairs such as {@code Lists 20}.
     */
    public static OptionalInt parseHeaderNumber(String raw) {
        if (raw == null) return OptionalInt.empty();
        Matcher m = NUMBER.matcher(raw);
        String last = null;
        while (m.find()) last = m.group();
        return last == null ? OptionalInt.empty() : toInt(last);
    }

    /**
     * Integer inside square brackets, e.g. {@code Show past shows [28]}.
     */
    public static OptionalInt parseBracketedNumber(String raw) {
        if (raw == null) return OptionalInt.empty();
        Matcher m = BRACKETED.matcher(raw);
        return m.find() ? toInt(m.group(1)) : OptionalInt.empty();
    }

    public static OptionalDouble parseDecimal(String raw) {
        if (raw == null) return OptionalDouble.empty();
        Matcher m = DECIMAL.matcher(raw.replace(",", ""));
        return m.find() ? OptionalDouble.of(Double.parseDouble(m.group())) : OptionalDouble.empty();
    }

    /**
     * Four digit year in a release date such as {@code 16 June 1997}.
     */
    public static OptionalInt parseYear(String raw) {
        if (raw == null) return OptionalInt.empty();
        Matcher m = YEAR.matcher(raw);
        return m.find() ? OptionalInt.of(Integer.parseInt(m.group(1))) : OptionalInt.empty();
    }

    /**
     * Number following {@code #} and preceding the given suffix, e.g. {@code "#12 overall"} for suffix
     * {@code "overall"} in {@code "#1 for 1997, #12 overall"}.
     */
    public static OptionalInt parseRank(String raw, String suffixRegex) {
        if (raw == null) return OptionalInt.empty();
        Matcher m = Pattern.compile("#\\s*(\\d[\\d,]*)\\s+" + suffixRegex, Pattern.CASE_INSENSITIVE).matcher(raw);
        return m.find() ? toInt(m.group(1)) : OptionalInt.empty();
    }

    /**
     * Counts the members in a comma separated member list. Commas inside parentheses (instruments, years)
     * do not separate members.
     * @param raw member list text, e.g. {@code "Thom Yorke (vocals, guitar), Jonny Greenwood (guitar)"}
     * @param defaultVal value returned for a blank list
     * @return number of members
     */
    public static int countMembers(String raw, int defaultVal) {
        if (raw == null || raw.isBlank()) return defaultVal;
        int depth = 0;
        int count = 0;
        boolean sawContent = false;
        for (char c : raw.toCharArray()) {
            if (c == '(' || c == '[') depth++;
            else if ((c == ')' || c == ']') && depth > 0) depth--;
            if (c == ',' && depth == 0) {
                if (sawContent) count++;
                sawContent = false;
            } else if (!Character.isWhitespace(c)) {
                sawContent = true;
            }
        }
        if (sawContent) count++;
        return count == 0 ? defaultVal : count;
    }

    private static OptionalInt toInt(String digits) {
        try {
            return OptionalInt.of(Integer.parseInt(digits.replace(",", "")));
        } catch (NumberFormatException e) {
            logger.debug("Number out of range: {}", digits);
            return OptionalInt.empty();
        }
    }
}
