package com.tyron.apphost.api.service;

/**
 * An object that owns resources which must be released explicitly.
 * <p>
 * Implementations should make {@link #dispose()} idempotent.
 */
public interface Disposable {

    void dispose();
}
