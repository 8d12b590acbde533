package com.piratebomb.cache.core;

/**
 * A key/value pair produced by a cache warming loader.
 */
public class WarmEntry {
    private final String key;
    private final Object value;

    public WarmEntry(String key, Object value) {
        this.key = key;
        this.value = value;
    }

    public static WarmEntry of(String key, Object value) {
        return new WarmEntry(key, value);
    }

    public String getKey() {
        return key;
    }

    public Object getValue() {
        return value;
    }
}
