package com.tyron.apphost.core.resolution;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Registry of every live {@link Resolver}, so they can be reset together.
 */
public final class ResolverCollection {

    private static final Logger LOG = Logger.getLogger(ResolverCollection.class.getName());

    private static final List<Resolver> RESOLVERS = new ArrayList<>();

    private ResolverCollection() {
    }

    public static void add(Resolver resolver) {
        if (resolver == null) throw new IllegalArgumentException("resolver == null");
        synchronized (RESOLVERS) {
            RESOLVERS.add(resolver);
        }
    }

    public static int size() {
        synchronized (RESOLVERS) {
            return RESOLVERS.size();
        }
    }

    /**
     * Resets every registered resolver and empties the collection.
     */
    public static void resetAll() {
        List<Resolver> snapshot;
        synchronized (RESOLVERS) {
            snapshot = new ArrayList<>(RESOLVERS);
            RESOLVERS.clear();
        }
        for (Resolver resolver : snapshot) {
            resolver.resetCurrent();
        }
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Reset " + snapshot.size() + " resolver(s)");
        }
    }
}
