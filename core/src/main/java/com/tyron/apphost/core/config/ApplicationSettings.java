package com.tyron.apphost.core.config;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable application settings.
 * <p>
 * Nested configuration is flattened into dotted keys, e.g. {@code web.routing.applicationUrl}.
 */
public final class ApplicationSettings {

    public static final String CONFIGURATION_STATUS_KEY = "configurationStatus";
    public static final String APPLICATION_URL_KEY = "web.routing.applicationUrl";
    public static final String SCHEDULED_TASKS_BASE_URL_KEY = "scheduledTasks.baseUrl";
    public static final String USE_SSL_KEY = "security.useSsl";
    public static final String BACKOFFICE_PATH_KEY = "paths.backoffice";
    public static final String CONNECTION_STRING_KEY = "database.connectionString";
    public static final String READY_TIMEOUT_MS_KEY = "boot.readyTimeoutMs";

    public static final String DEFAULT_BACKOFFICE_PATH = "/backoffice";
    public static final long DEFAULT_READY_TIMEOUT_MS = 30_000L;

    private static final ApplicationSettings EMPTY = new ApplicationSettings(Map.of());

    private final Map<String, String> values;

    ApplicationSettings(Map<String, String> values) {
        this.values = Map.copyOf(Objects.requireNonNull(values, "values"));
    }

    public static ApplicationSettings empty() {
        return EMPTY;
    }

    public static ApplicationSettingsBuilder builder() {
        return new ApplicationSettingsBuilder();
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Nullable
    public String get(String key) {
        return values.get(key);
    }

    public String get(String key, String defaultValue) {
        String v = values.get(key);
        return v != null ? v : defaultValue;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String v = values.get(key);
        if (v == null) return defaultValue;
        return Boolean.parseBoolean(v.trim());
    }

    public int getInt(String key, int defaultValue) {
        String v = values.get(key);
        if (v == null) return defaultValue;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String v = values.get(key);
        if (v == null) return defaultValue;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
    }

    /**
     * The version the installation was last configured for. Empty when never configured.
     */
    public String getConfigurationStatus() {
        return get(CONFIGURATION_STATUS_KEY, "");
    }

    @Nullable
    public String getApplicationUrl() {
        return get(APPLICATION_URL_KEY);
    }

    @Nullable
    public String getScheduledTasksBaseUrl() {
        return get(SCHEDULED_TASKS_BASE_URL_KEY);
    }

    public boolean isUseSsl() {
        return getBoolean(USE_SSL_KEY, false);
    }

    /**
     * @return the backoffice path, always starting with {@code /}.
     */
    public String getBackofficePath() {
        String path = get(BACKOFFICE_PATH_KEY, DEFAULT_BACKOFFICE_PATH).trim();
        if (path.isEmpty()) return DEFAULT_BACKOFFICE_PATH;
        return path.startsWith("/") ? path : "/" + path;
    }

    @Nullable
    public String getConnectionString() {
        return get(CONNECTION_STRING_KEY);
    }

    public long getReadyTimeoutMillis() {
        return getLong(READY_TIMEOUT_MS_KEY, DEFAULT_READY_TIMEOUT_MS);
    }

    @Override
    public String toString() {
        return "ApplicationSettings" + values.keySet();
    }
}
