package com.tyron.apphost.core.application;

import com.tyron.apphost.api.database.DatabaseContext;
import com.tyron.apphost.api.service.Disposable;
import com.tyron.apphost.api.version.Version;
import com.tyron.apphost.core.cache.CacheHelper;
import com.tyron.apphost.core.config.ApplicationSettings;
import com.tyron.apphost.core.resolution.GlobalStateReset;
import com.tyron.apphost.core.service.ServiceRegistry;
import com.tyron.apphost.core.util.MemoizedValue;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The application context: one per process, it gates access to the shared cache, the database and
 * the service registry.
 * <p>
 * The boot sequence assigns the collaborators and marks the context ready exactly once. Code that
 * depends on content being loaded calls {@link #waitForReady(long)} first.
 * <p>
 * Collaborator reads are not synchronized with {@link #dispose()}. Disposal is a shutdown or test
 * teardown operation and must not race active use; a reader may otherwise observe a handle going
 * away mid-read.
 */
public class ApplicationContext implements Disposable {

    private static final Logger LOG = Logger.getLogger(ApplicationContext.class.getName());

    /**
     * Timeout value for {@link #waitForReady(long)} that waits without bound.
     */
    public static final long INFINITE_TIMEOUT = -1L;

    private final ConfigurationStatusSource configurationStatus;
    private final Version currentVersion;
    private final Supplier<ApplicationSettings> settings;
    private final ApplicationUrlResolver urlResolver;
    private final GlobalStateReset globalStateReset;

    private volatile CacheHelper applicationCache;
    private volatile DatabaseContext databaseContext;
    private volatile ServiceRegistry services;

    private final AtomicBoolean ready = new AtomicBoolean(false);
    private final CountDownLatch readySignal = new CountDownLatch(1);

    private final MemoizedValue<Boolean> configured;

    // Last write wins. Concurrent first resolutions produce the same value.
    private String applicationUrl;

    private volatile boolean disposed;
    private final ReentrantReadWriteLock disposalLock = new ReentrantReadWriteLock();

    /**
     * Creates a fully populated context.
     */
    public ApplicationContext(DatabaseContext databaseContext, ServiceRegistry services, CacheHelper cache) {
        this(databaseContext, services, cache, ApplicationContextOptions.defaults());
    }

    public ApplicationContext(DatabaseContext databaseContext, ServiceRegistry services, CacheHelper cache,
                              ApplicationContextOptions options) {
        this(cache, options);
        if (databaseContext == null) throw new IllegalArgumentException("databaseContext == null");
        if (services == null) throw new IllegalArgumentException("services == null");
        this.databaseContext = databaseContext;
        this.services = services;
    }

    /**
     * Creates a basic context without database or services.
     */
    public ApplicationContext(CacheHelper cache) {
        this(cache, ApplicationContextOptions.defaults());
    }

    public ApplicationContext(CacheHelper cache, ApplicationContextOptions options) {
        if (cache == null) throw new IllegalArgumentException("cache == null");
        if (options == null) throw new IllegalArgumentException("options == null");
        this.applicationCache = cache;
        this.configurationStatus = options.getConfigurationStatus();
        this.currentVersion = options.getCurrentVersion();
        this.settings = options.getSettings();
        this.urlResolver = options.getUrlResolver();
        this.globalStateReset = options.getGlobalStateReset();
        this.configured = new MemoizedValue<>(this::computeConfigured);
    }

    // --- Process-wide singleton ---

    /**
     * @return the process-wide context, or null before one has been installed.
     */
    @Nullable
    public static ApplicationContext getCurrent() {
        return ApplicationContextSlot.global().get();
    }

    /**
     * Installs {@code context} as the process-wide context.
     * <p>
     * Not thread safe; see {@link ApplicationContextSlot}.
     *
     * @param replaceContext if true, an existing context is replaced; otherwise it is kept and returned.
     */
    public static ApplicationContext ensureContext(ApplicationContext context, boolean replaceContext) {
        return ApplicationContextSlot.global().ensureContext(context, replaceContext);
    }

    /**
     * Creates and installs a process-wide context from raw collaborators.
     * <p>
     * Not thread safe; see {@link ApplicationContextSlot}. Only tests, or a startup that does not use
     * {@link ApplicationBootstrap}, should pass {@code replaceContext = true}.
     */
    public static ApplicationContext ensureContext(DatabaseContext databaseContext, ServiceRegistry services,
                                                   CacheHelper cache, boolean replaceContext) {
        return ApplicationContextSlot.global().ensureContext(databaseContext, services, cache, replaceContext);
    }

    // --- Collaborators ---

    /**
     * The application wide cache. Null once the context is disposed.
     */
    @Nullable
    public CacheHelper getApplicationCache() {
        return applicationCache;
    }

    /**
     * @throws ContextNotSetException if no database context was assigned.
     */
    public DatabaseContext getDatabaseContext() {
        DatabaseContext db = databaseContext;
        if (db == null) {
            throw new ContextNotSetException("DatabaseContext");
        }
        return db;
    }

    void setDatabaseContext(@Nullable DatabaseContext databaseContext) {
        this.databaseContext = databaseContext;
    }

    /**
     * @throws ContextNotSetException if no service registry was assigned.
     */
    public ServiceRegistry getServices() {
        ServiceRegistry s = services;
        if (s == null) {
            throw new ContextNotSetException("ServiceRegistry");
        }
        return s;
    }

    void setServices(@Nullable ServiceRegistry services) {
        this.services = services;
    }

    // --- Readiness ---

    public boolean isReady() {
        return ready.get();
    }

    /**
     * Marks the context ready and releases every thread waiting in {@link #waitForReady(long)}.
     *
     * @throws IllegalStateException if the context is already ready or has been disposed.
     */
    void markReady() {
        if (disposed) {
            throw new IllegalStateException("ApplicationContext has been disposed.");
        }
        if (!ready.compareAndSet(false, true)) {
            throw new IllegalStateException("ApplicationContext has already been initialized.");
        }
        readySignal.countDown();
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("ApplicationContext is ready");
        }
    }

    /**
     * Blocks until the context is ready or the timeout elapses.
     *
     * @param timeoutMillis maximum time to wait; {@link #INFINITE_TIMEOUT} (any negative value) waits without bound.
     * @return true if the context became ready within the timeout.
     */
    public boolean waitForReady(long timeoutMillis) {
        try {
            if (timeoutMillis < 0) {
                readySignal.await();
                return true;
            }
            return readySignal.await(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ready.get();
        }
    }

    /**
     * Waits for as long as the {@code boot.readyTimeoutMs} setting allows.
     */
    public boolean waitForReady() {
        return waitForReady(currentSettings().getReadyTimeoutMillis());
    }

    // --- Configuration ---

    /**
     * @return true if the configured version matches the current version. Computed on first call and
     * never re-evaluated for this context.
     */
    public boolean isConfigured() {
        return configured.get();
    }

    private boolean computeConfigured() {
        String status = readConfigurationStatus();
        String current = currentVersion.toString(3);
        boolean ok = current.equals(status);
        if (!ok && LOG.isLoggable(Level.FINE)) {
            LOG.fine("CurrentVersion different from configStatus: '" + current + "','" + status + "'");
        }
        return ok;
    }

    private String readConfigurationStatus() {
        try {
            String status = configurationStatus.read();
            return status != null ? status : "";
        } catch (Exception e) {
            // Missing or unreadable configuration means "not configured".
            if (LOG.isLoggable(Level.FINE)) {
                LOG.log(Level.FINE, "Failed to read configuration status", e);
            }
            return "";
        }
    }

    // --- Application url ---

    /**
     * The url services use to call back into the application (keep-alive, scheduled publishing).
     * <p>
     * Format: has a scheme, includes the backoffice path, no trailing slash. Resolved from settings on
     * first access; if settings do not provide one, the first inbound request fills it in via
     * {@link ServerEnvironment#ensureApplicationUrl}. May be null until then.
     */
    @Nullable
    public String getApplicationUrl() {
        String url = applicationUrl;
        if (url != null) {
            return url;
        }
        urlResolver.trySetApplicationUrlFromSettings(this, currentSettings());
        return applicationUrl;
    }

    void setApplicationUrl(@Nullable String applicationUrl) {
        this.applicationUrl = applicationUrl;
    }

    ApplicationSettings currentSettings() {
        ApplicationSettings s = settings.get();
        return s != null ? s : ApplicationSettings.empty();
    }

    // --- Disposal ---

    public boolean isDisposed() {
        return disposed;
    }

    /**
     * Clears the cache, resets global resolution state, releases the database and drops every
     * collaborator. Later calls do nothing.
     * <p>
     * Never dispose a context the application still needs. This is for shutdown and test teardown.
     */
    @Override
    public void dispose() {
        if (disposed) return;

        ReentrantReadWriteLock.WriteLock lock = disposalLock.writeLock();
        lock.lock();
        try {
            if (disposed) return;

            CacheHelper cache = applicationCache;
            if (cache != null) {
                cache.clearAllCache();
            }
            globalStateReset.resetAllResolvers();
            globalStateReset.resetResolution();

            applicationCache = null;
            DatabaseContext db = databaseContext;
            if (db != null && db.isDatabaseConfigured()) {
                db.getDatabase().dispose();
            }
            databaseContext = null;
            services = null;
            ready.set(false);

            disposed = true;
        } finally {
            lock.unlock();
        }

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("ApplicationContext disposed");
        }
    }
}
