package com.piratebomb.cache.core;

public class CacheEntry<V> {
    public final V value;
    public final long expiryTime;   // absolute timestamp in millis when TTL expires

    public CacheEntry(V value, long expiryTime) {
        this.value = value;
        this.expiryTime = expiryTime;
    }

    public boolean isExpired(long nowMillis) {
        return nowMillis >= expiryTime;
    }
}
