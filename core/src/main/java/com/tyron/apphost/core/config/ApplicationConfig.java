package com.tyron.apphost.core.config;

import org.jetbrains.annotations.TestOnly;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Global holder for the active {@link ApplicationSettings}.
 * <p>
 * The boot sequence installs the settings it loaded; tests install their own.
 */
public final class ApplicationConfig {

    private static final AtomicReference<ApplicationSettings> SETTINGS = new AtomicReference<>();

    private ApplicationConfig() {
    }

    public static void setSettings(ApplicationSettings settings) {
        if (settings == null) throw new IllegalArgumentException("settings == null");
        SETTINGS.set(settings);
    }

    public static ApplicationSettings getSettings() {
        ApplicationSettings settings = SETTINGS.get();
        if (settings == null) {
            throw new IllegalStateException("Settings are not set. Call ApplicationConfig.setSettings(...) during startup.");
        }
        return settings;
    }

    public static boolean hasSettings() {
        return SETTINGS.get() != null;
    }

    @TestOnly
    public static void reset() {
        SETTINGS.set(null);
    }
}
