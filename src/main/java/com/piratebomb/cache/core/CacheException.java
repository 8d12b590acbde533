package com.piratebomb.cache.core;

/**
 * Failure inside the cache layer. Never escapes {@link NamespacedCache}; callers
 * only ever see absent, {@code false} or zero results.
 */
public class CacheException extends RuntimeException {

    private final CacheErrorKind kind;

    public CacheException(CacheErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CacheException(CacheErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public CacheErrorKind getKind() {
        return kind;
    }
}
