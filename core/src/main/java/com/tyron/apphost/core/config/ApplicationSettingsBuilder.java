package com.tyron.apphost.core.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builder for {@link ApplicationSettings}.
 */
public final class ApplicationSettingsBuilder {

    private final Map<String, String> values = new LinkedHashMap<>();

    ApplicationSettingsBuilder() {
    }

    public ApplicationSettingsBuilder put(String key, String value) {
        if (key == null || key.isBlank()) return this;
        if (value == null) {
            values.remove(key);
            return this;
        }
        values.put(key, value);
        return this;
    }

    public ApplicationSettingsBuilder putBoolean(String key, boolean value) {
        return put(key, Boolean.toString(value));
    }

    public ApplicationSettingsBuilder putLong(String key, long value) {
        return put(key, Long.toString(value));
    }

    public ApplicationSettingsBuilder putAll(Map<String, String> entries) {
        for (Map.Entry<String, String> e : entries.entrySet()) {
            put(e.getKey(), e.getValue());
        }
        return this;
    }

    public ApplicationSettingsBuilder configurationStatus(String status) {
        return put(ApplicationSettings.CONFIGURATION_STATUS_KEY, status);
    }

    public ApplicationSettingsBuilder applicationUrl(String url) {
        return put(ApplicationSettings.APPLICATION_URL_KEY, url);
    }

    public ApplicationSettingsBuilder scheduledTasksBaseUrl(String baseUrl) {
        return put(ApplicationSettings.SCHEDULED_TASKS_BASE_URL_KEY, baseUrl);
    }

    public ApplicationSettingsBuilder useSsl(boolean useSsl) {
        return putBoolean(ApplicationSettings.USE_SSL_KEY, useSsl);
    }

    public ApplicationSettingsBuilder backofficePath(String path) {
        return put(ApplicationSettings.BACKOFFICE_PATH_KEY, path);
    }

    public ApplicationSettingsBuilder connectionString(String connectionString) {
        return put(ApplicationSettings.CONNECTION_STRING_KEY, connectionString);
    }

    public ApplicationSettings build() {
        return new ApplicationSettings(values);
    }
}
