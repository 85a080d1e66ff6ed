package com.rymharvest.scraper;

import java.util.List;

/**
 * A page field to extract, with the CSS selectors that may hold it in order of preference.
 */
public class MetadataField {
    public final String fieldName;
    public final List<String> selectors;

    public MetadataField(String fieldName, List<String> selectors) {
        this.fieldName = fieldName;
        this.selectors = selectors;
    }
}
