package com.tyron.apphost.core.resolution;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-wide resolution state.
 * <p>
 * Resolvers are configured while resolution is open and become readable once it is frozen. The
 * boot sequence freezes resolution right before the application is marked ready.
 */
public final class Resolution {

    private static final Logger LOG = Logger.getLogger(Resolution.class.getName());

    private static final AtomicBoolean FROZEN = new AtomicBoolean(false);

    private Resolution() {
    }

    public static boolean isFrozen() {
        return FROZEN.get();
    }

    /**
     * Freezes resolution.
     *
     * @throws IllegalStateException if resolution is already frozen.
     */
    public static void freeze() {
        if (!FROZEN.compareAndSet(false, true)) {
            throw new IllegalStateException("Resolution is already frozen");
        }
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Resolution frozen");
        }
    }

    public static void ensureIsFrozen() {
        if (!FROZEN.get()) {
            throw new IllegalStateException("Resolution is not frozen, values cannot be resolved yet");
        }
    }

    public static void ensureIsNotFrozen() {
        if (FROZEN.get()) {
            throw new IllegalStateException("Resolution is frozen, resolvers can no longer be configured");
        }
    }

    /**
     * Returns resolution to the open state.
     */
    public static void reset() {
        FROZEN.set(false);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Resolution reset");
        }
    }
}
