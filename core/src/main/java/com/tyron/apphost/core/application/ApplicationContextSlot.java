package com.tyron.apphost.core.application;

import com.tyron.apphost.api.database.DatabaseContext;
import com.tyron.apphost.core.cache.CacheHelper;
import com.tyron.apphost.core.service.ServiceRegistry;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current {@link ApplicationContext}.
 * <p>
 * {@link #global()} is the process-wide slot behind {@link ApplicationContext#getCurrent()}. Tests can
 * create their own slot to keep contexts isolated.
 * <p>
 * Reads never lock. The {@code ensureContext} methods are <b>not</b> thread safe: they check and then
 * install without holding anything, so callers must serialize them. They are meant for startup and
 * test setup, which run a handful of times per process.
 */
public final class ApplicationContextSlot {

    private static final ApplicationContextSlot GLOBAL = new ApplicationContextSlot();

    private final AtomicReference<ApplicationContext> current = new AtomicReference<>();

    public static ApplicationContextSlot global() {
        return GLOBAL;
    }

    /**
     * @return the installed context, or null if none was installed yet.
     */
    @Nullable
    public ApplicationContext get() {
        return current.get();
    }

    public void set(@Nullable ApplicationContext context) {
        current.set(context);
    }

    /**
     * Installs {@code context} unless a context is already present and {@code replaceContext} is false.
     *
     * @return the context that is current afterwards.
     */
    public ApplicationContext ensureContext(ApplicationContext context, boolean replaceContext) {
        if (context == null) throw new IllegalArgumentException("context == null");
        ApplicationContext existing = current.get();
        if (existing != null && !replaceContext) {
            return existing;
        }
        current.set(context);
        return context;
    }

    /**
     * Creates a context from the given collaborators and installs it, following the same
     * keep-or-replace rule as {@link #ensureContext(ApplicationContext, boolean)}. No context is
     * created when the existing one is kept.
     */
    public ApplicationContext ensureContext(DatabaseContext databaseContext, ServiceRegistry services,
                                            CacheHelper cache, boolean replaceContext) {
        ApplicationContext existing = current.get();
        if (existing != null && !replaceContext) {
            return existing;
        }
        ApplicationContext created = new ApplicationContext(databaseContext, services, cache);
        current.set(created);
        return created;
    }

    /**
     * Empties the slot. The removed context is not disposed.
     */
    public void clear() {
        current.set(null);
    }
}
