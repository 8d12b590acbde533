package com.piratebomb.cache.core;

/**
 * Rough footprint of one namespace: key count and the length of its key list
 * rendered as a JSON array.
 */
public class MemoryUsage {
    private final int keys;
    private final long size;

    public MemoryUsage(int keys, long size) {
        this.keys = keys;
        this.size = size;
    }

    public int getKeys() {
        return keys;
    }

    public long getSize() {
        return size;
    }
}
