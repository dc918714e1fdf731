package com.tyron.apphost.core.cache;

import com.tyron.apphost.api.cache.CacheProvider;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The application wide cache facility.
 * <p>
 * Any caching done across the application should go through this helper. It holds two providers:
 * <ul>
 *   <li>the <b>runtime cache</b> for values that may be invalidated while the application runs,</li>
 *   <li>the <b>static cache</b> for values that live until the application is torn down.</li>
 * </ul>
 */
public class CacheHelper {

    private static final Logger LOG = Logger.getLogger(CacheHelper.class.getName());

    private final CacheProvider runtimeCache;
    private final CacheProvider staticCache;

    public CacheHelper() {
        this(new ConcurrentCacheProvider(), new ConcurrentCacheProvider());
    }

    public CacheHelper(CacheProvider runtimeCache, CacheProvider staticCache) {
        if (runtimeCache == null) throw new IllegalArgumentException("runtimeCache == null");
        if (staticCache == null) throw new IllegalArgumentException("staticCache == null");
        this.runtimeCache = runtimeCache;
        this.staticCache = staticCache;
    }

    /**
     * A cache helper that never stores anything. Useful when caching must be switched off.
     */
    public static CacheHelper createDisabledCache() {
        return new CacheHelper(NullCacheProvider.INSTANCE, NullCacheProvider.INSTANCE);
    }

    public CacheProvider getRuntimeCache() {
        return runtimeCache;
    }

    public CacheProvider getStaticCache() {
        return staticCache;
    }

    /**
     * Clears every entry of both caches.
     */
    public void clearAllCache() {
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Clearing application cache (runtime=" + runtimeCache.size()
                    + ", static=" + staticCache.size() + ")");
        }
        runtimeCache.clearAll();
        staticCache.clearAll();
    }
}
