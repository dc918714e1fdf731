package com.tyron.apphost.core.cache;

import com.tyron.apphost.api.cache.CacheProvider;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.function.Supplier;

/**
 * A {@link CacheProvider} that stores nothing. Every lookup runs its factory.
 */
public final class NullCacheProvider implements CacheProvider {

    public static final NullCacheProvider INSTANCE = new NullCacheProvider();

    private NullCacheProvider() {
    }

    @Override
    public @Nullable Object get(@NotNull String key) {
        return null;
    }

    @Override
    public @Nullable Object getOrCreate(@NotNull String key, @NotNull Supplier<?> factory) {
        return factory.get();
    }

    @Override
    public void put(@NotNull String key, @NotNull Object value) {
    }

    @Override
    public void remove(@NotNull String key) {
    }

    @Override
    public void removeByPrefix(@NotNull String prefix) {
    }

    @Override
    public void clearAll() {
    }

    @Override
    public int size() {
        return 0;
    }
}
