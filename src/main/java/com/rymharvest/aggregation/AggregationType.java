package com.rymharvest.aggregation;

/**
 * Kind of entity an aggregation describes. The key is used in cache keys and export directories.
 */
public enum AggregationType {
    ARTIST("artist"),
    ALBUM("album"),
    TRACK("track");

    private final String key;

    AggregationType(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static AggregationType fromKey(String key) {
        for (AggregationType type : values()) {
            if (type.key.equalsIgnoreCase(key)) return type;
        }
        throw new IllegalArgumentException("Unknown aggregation type: " + key);
    }
}
