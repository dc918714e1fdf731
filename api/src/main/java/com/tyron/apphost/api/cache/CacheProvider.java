package com.tyron.apphost.api.cache;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.function.Supplier;

/**
 * A keyed cache.
 * <p>
 * Implementations must be safe for concurrent use. {@code null} values are never stored.
 */
public interface CacheProvider {

    @Nullable
    Object get(@NotNull String key);

    /**
     * Returns the cached value for {@code key}, creating and caching it with {@code factory} when absent.
     * A {@code null} result from the factory is returned but not cached.
     */
    @Nullable
    Object getOrCreate(@NotNull String key, @NotNull Supplier<?> factory);

    void put(@NotNull String key, @NotNull Object value);

    void remove(@NotNull String key);

    /**
     * Removes every entry whose key starts with {@code prefix}.
     */
    void removeByPrefix(@NotNull String prefix);

    /**
     * Removes every entry.
     */
    void clearAll();

    int size();
}
