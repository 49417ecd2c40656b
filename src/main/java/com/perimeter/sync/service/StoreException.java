package com.perimeter.sync.service;

import lombok.Getter;

/**
 * Failure of a read or write against the production store or the cache store.
 *
 * Store adapters translate Spring's {@code DataAccessException} into this
 * type so the reconciliation loop can decide on rollback by {@link #getKind()}
 * without knowing which persistence technology sits behind a store.
 */
@Getter
public class StoreException extends RuntimeException {

    private final StoreErrorKind kind;

    public StoreException(StoreErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public StoreException(StoreErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
}
