package com.tyron.apphost.core.application;

import com.tyron.apphost.core.cache.CacheHelper;
import com.tyron.apphost.core.config.ApplicationConfig;
import com.tyron.apphost.core.config.ApplicationSettings;
import com.tyron.apphost.core.database.DatabaseFactory;
import com.tyron.apphost.core.database.DefaultDatabaseContext;
import com.tyron.apphost.core.resolution.Resolution;
import com.tyron.apphost.core.service.DefaultServiceRegistry;
import com.tyron.apphost.core.service.ServiceRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Boots the application in three ordered phases.
 * <ol>
 *   <li>{@link #initialize()} builds the collaborators and installs the context</li>
 *   <li>{@link #startup()} lets handlers configure resolvers</li>
 *   <li>{@link #complete()} freezes resolution and marks the context ready</li>
 * </ol>
 * Each phase runs once. Calling a phase out of order throws {@link IllegalStateException}.
 * <p>
 * Typical usage:
 * <pre>
 * ApplicationContext context = new ApplicationBootstrap(settings, databaseFactory)
 *         .withEventHandler(MyHandler.class)
 *         .boot();
 * </pre>
 */
public final class ApplicationBootstrap {

    private static final Logger LOG = Logger.getLogger(ApplicationBootstrap.class.getName());

    private enum Phase {
        NEW, INITIALIZED, STARTED, COMPLETE
    }

    private final ApplicationSettings settings;
    private final DatabaseFactory databaseFactory;

    private ApplicationContextSlot slot = ApplicationContextSlot.global();
    private ApplicationContextOptions options = ApplicationContextOptions.defaults();
    private boolean replaceContext = true;
    private final List<Class<? extends ApplicationEventHandler>> eventHandlers = new ArrayList<>();
    private final List<Consumer<ServiceRegistry>> serviceConfigurators = new ArrayList<>();

    private Phase phase = Phase.NEW;
    private boolean keptExisting;
    private ApplicationContext context;

    public ApplicationBootstrap(ApplicationSettings settings, DatabaseFactory databaseFactory) {
        if (settings == null) throw new IllegalArgumentException("settings == null");
        if (databaseFactory == null) throw new IllegalArgumentException("databaseFactory == null");
        this.settings = settings;
        this.databaseFactory = databaseFactory;
    }

    public ApplicationBootstrap withSlot(ApplicationContextSlot slot) {
        if (slot == null) throw new IllegalArgumentException("slot == null");
        requirePhase(Phase.NEW, "withSlot");
        this.slot = slot;
        return this;
    }

    public ApplicationBootstrap withOptions(ApplicationContextOptions options) {
        if (options == null) throw new IllegalArgumentException("options == null");
        requirePhase(Phase.NEW, "withOptions");
        this.options = options;
        return this;
    }

    /**
     * @param replaceContext whether an already installed context is replaced. Defaults to true.
     */
    public ApplicationBootstrap replaceContext(boolean replaceContext) {
        requirePhase(Phase.NEW, "replaceContext");
        this.replaceContext = replaceContext;
        return this;
    }

    public ApplicationBootstrap withEventHandler(Class<? extends ApplicationEventHandler> handlerClass) {
        if (handlerClass == null) throw new IllegalArgumentException("handlerClass == null");
        requirePhase(Phase.NEW, "withEventHandler");
        eventHandlers.add(handlerClass);
        return this;
    }

    /**
     * Registers bindings or instances on the service registry before the context is created.
     */
    public ApplicationBootstrap configureServices(Consumer<ServiceRegistry> configurator) {
        if (configurator == null) throw new IllegalArgumentException("configurator == null");
        requirePhase(Phase.NEW, "configureServices");
        serviceConfigurators.add(configurator);
        return this;
    }

    /**
     * Runs all three phases. When an installed context is kept, it is returned as is.
     */
    public ApplicationContext boot() {
        initialize();
        startup();
        complete();
        return context;
    }

    /**
     * Builds the collaborators and installs a new context.
     * <p>
     * If a context is already installed and {@link #replaceContext(boolean)} is false, that context is
     * kept untouched: no settings are installed, no collaborators are built, no handler runs, and the
     * later phases do nothing. Otherwise the previous context is disposed before the new one is
     * installed, which reopens resolution for the new boot.
     */
    public ApplicationContext initialize() {
        requirePhase(Phase.NEW, "initialize");

        ApplicationContext existing = slot.get();
        if (existing != null && !replaceContext) {
            if (LOG.isLoggable(Level.INFO)) {
                LOG.info("An ApplicationContext is already installed, keeping it");
            }
            context = existing;
            keptExisting = true;
            phase = Phase.COMPLETE;
            return context;
        }
        if (existing != null && !existing.isDisposed()) {
            if (LOG.isLoggable(Level.INFO)) {
                LOG.info("Replacing the installed ApplicationContext, disposing it");
            }
            existing.dispose();
        }

        ApplicationConfig.setSettings(settings);

        CacheHelper cache = new CacheHelper();
        DefaultDatabaseContext databaseContext =
                new DefaultDatabaseContext(settings.getConnectionString(), databaseFactory);
        ServiceRegistry services = new DefaultServiceRegistry();
        for (Class<? extends ApplicationEventHandler> handler : eventHandlers) {
            services.registerExtension(ApplicationEventHandler.class, handler);
        }
        for (Consumer<ServiceRegistry> configurator : serviceConfigurators) {
            configurator.accept(services);
        }

        context = slot.ensureContext(new ApplicationContext(databaseContext, services, cache, options), true);

        phase = Phase.INITIALIZED;
        fire("applicationInitialized", h -> h.applicationInitialized(context));
        return context;
    }

    public void startup() {
        if (keptExisting) return;
        requirePhase(Phase.INITIALIZED, "startup");
        phase = Phase.STARTED;
        fire("applicationStarting", h -> h.applicationStarting(context));
    }

    public void complete() {
        if (keptExisting) return;
        requirePhase(Phase.STARTED, "complete");

        Resolution.freeze();
        context.markReady();
        phase = Phase.COMPLETE;

        if (LOG.isLoggable(Level.INFO)) {
            LOG.info("Application booted, configured=" + context.isConfigured());
        }
        fire("applicationStarted", h -> h.applicationStarted(context));
    }

    /**
     * @return true if {@link #initialize()} kept an already installed context instead of creating one.
     */
    public boolean isKeptExisting() {
        return keptExisting;
    }

    /**
     * @throws IllegalStateException before {@link #initialize()} has run.
     */
    public ApplicationContext getContext() {
        if (context == null) {
            throw new IllegalStateException("The application has not been initialized");
        }
        return context;
    }

    private void fire(String event, Consumer<ApplicationEventHandler> action) {
        List<ApplicationEventHandler> handlers = context.getServices().getExtensions(ApplicationEventHandler.class);
        for (ApplicationEventHandler handler : handlers) {
            try {
                action.accept(handler);
            } catch (Throwable t) {
                LOG.log(Level.SEVERE, "Event handler " + handler.getClass().getName() + " failed in " + event, t);
            }
        }
    }

    private void requirePhase(Phase expected, String operation) {
        if (phase != expected) {
            throw new IllegalStateException("Cannot " + operation + " while the bootstrap is " + phase
                    + " (expected " + expected + ")");
        }
    }
}
