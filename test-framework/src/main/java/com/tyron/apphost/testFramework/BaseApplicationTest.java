package com.tyron.apphost.testFramework;

import com.tyron.apphost.core.application.ApplicationBootstrap;
import com.tyron.apphost.core.application.ApplicationContext;
import com.tyron.apphost.core.application.ApplicationContextSlot;
import com.tyron.apphost.core.application.ApplicationVersion;
import com.tyron.apphost.core.config.ApplicationConfig;
import com.tyron.apphost.core.config.ApplicationSettings;
import com.tyron.apphost.core.config.ApplicationSettingsBuilder;
import com.tyron.apphost.core.config.ApplicationSettingsLoader;
import com.tyron.apphost.core.resolution.Resolution;
import com.tyron.apphost.core.resolution.ResolverCollection;
import com.tyron.apphost.core.test.MockDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Base class for tests that need a booted application.
 * <p>
 * - Starts every test from an empty global slot, no settings and open resolution.
 * - Boots a context over a {@link MockDatabase} through {@link ApplicationBootstrap}.
 * - Disposes the context and resets global state after every test.
 */
public abstract class BaseApplicationTest {

    public static final String TEST_CONNECTION_STRING = "mock://apphost-test";

    @TempDir
    public Path temporaryFolder;

    protected ApplicationSettings settings;
    protected MockDatabase database;
    protected ApplicationBootstrap bootstrap;
    protected ApplicationContext context;

    @BeforeEach
    public final void baseSetUp() throws Exception {
        TestLogging.configureOnce();
        resetGlobalState();

        ApplicationSettingsBuilder builder = ApplicationSettings.builder()
                .configurationStatus(ApplicationVersion.CURRENT.toString(3))
                .connectionString(TEST_CONNECTION_STRING);
        configureSettings(builder);
        settings = builder.build();

        database = new MockDatabase(TEST_CONNECTION_STRING);
        bootstrap = new ApplicationBootstrap(settings, connectionString -> database);
        configureBootstrap(bootstrap);

        if (bootOnSetUp()) {
            context = bootstrap.boot();
        }

        beforeEach();
    }

    @AfterEach
    public final void baseTearDown() {
        try {
            afterEach();
        } finally {
            ApplicationContext current = ApplicationContext.getCurrent();
            if (context != null) {
                context.dispose();
            }
            if (current != null && current != context) {
                current.dispose();
            }
            resetGlobalState();
        }
    }

    /**
     * Subclasses override to adjust the settings the application boots with.
     */
    protected void configureSettings(ApplicationSettingsBuilder settings) {
    }

    /**
     * Subclasses override to register handlers or services before boot.
     */
    protected void configureBootstrap(ApplicationBootstrap bootstrap) {
    }

    /**
     * Subclasses return false to drive the boot phases themselves.
     */
    protected boolean bootOnSetUp() {
        return true;
    }

    /**
     * Subclasses override for per-test setup. Called after the application booted.
     */
    protected void beforeEach() throws Exception {
    }

    /**
     * Subclasses override for per-test teardown. Called before the application is disposed.
     */
    protected void afterEach() {
    }

    /**
     * Writes {@code apphost.yaml} into a fresh directory and loads it, ignoring system properties.
     */
    protected ApplicationSettings loadSettings(String yaml) throws IOException {
        Path dir = Files.createTempDirectory(temporaryFolder, "settings");
        Files.writeString(dir.resolve("apphost.yaml"), yaml, StandardCharsets.UTF_8);
        return new ApplicationSettingsLoader(new Properties()).loadFromDirectory(dir);
    }

    private static void resetGlobalState() {
        ApplicationContextSlot.global().clear();
        ApplicationConfig.reset();
        ResolverCollection.resetAll();
        Resolution.reset();
    }
}
