package com.tyron.apphost.core.resolution;

/**
 * A globally registered resolver whose state can be cleared.
 */
public interface Resolver {

    /**
     * Clears the resolved value and detaches this resolver from global state.
     */
    void resetCurrent();
}
