package com.piratebomb.cache.core;

public enum CacheErrorKind {
    INVALID_NAMESPACE,
    CAPACITY_EXCEEDED,
    LOADER_FAILURE
}
