package com.perimeter.sync.service;

/**
 * Which store operation failed.
 */
public enum StoreErrorKind {
    PRODUCTION_READ,
    PRODUCTION_WRITE,
    CACHE_READ,
    CACHE_WRITE
}
