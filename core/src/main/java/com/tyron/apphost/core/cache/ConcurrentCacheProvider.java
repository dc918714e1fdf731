package com.tyron.apphost.core.cache;

import com.tyron.apphost.api.cache.CacheProvider;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * In-memory {@link CacheProvider} backed by a {@link ConcurrentHashMap}.
 */
public class ConcurrentCacheProvider implements CacheProvider {

    private final Map<String, Object> entries = new ConcurrentHashMap<>();

    @Override
    public @Nullable Object get(@NotNull String key) {
        Objects.requireNonNull(key, "key");
        return entries.get(key);
    }

    @Override
    public @Nullable Object getOrCreate(@NotNull String key, @NotNull Supplier<?> factory) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(factory, "factory");

        Object existing = entries.get(key);
        if (existing != null) {
            return existing;
        }

        // computeIfAbsent leaves the map untouched when the factory returns null.
        return entries.computeIfAbsent(key, k -> factory.get());
    }

    @Override
    public void put(@NotNull String key, @NotNull Object value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        entries.put(key, value);
    }

    @Override
    public void remove(@NotNull String key) {
        Objects.requireNonNull(key, "key");
        entries.remove(key);
    }

    @Override
    public void removeByPrefix(@NotNull String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        entries.keySet().removeIf(k -> k.startsWith(prefix));
    }

    @Override
    public void clearAll() {
        entries.clear();
    }

    @Override
    public int size() {
        return entries.size();
    }
}
