package com.tyron.apphost.core.config;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads {@link ApplicationSettings} from {@code apphost.yaml} (or {@code apphost.yml}).
 * <p>
 * Nested maps are flattened into dotted keys:
 * <pre>
 * web:
 *   routing:
 *     applicationUrl: https://example.org/backoffice
 * </pre>
 * becomes {@code web.routing.applicationUrl}. System properties prefixed with {@code apphost.}
 * override file values ({@code -Dapphost.security.useSsl=true}).
 */
public final class ApplicationSettingsLoader {

    private static final Logger LOG = Logger.getLogger(ApplicationSettingsLoader.class.getName());

    public static final String SYSTEM_PROPERTY_PREFIX = "apphost.";
    public static final List<String> FILE_NAMES = List.of("apphost.yaml", "apphost.yml");

    private final Properties systemProperties;

    public ApplicationSettingsLoader() {
        this(System.getProperties());
    }

    public ApplicationSettingsLoader(Properties systemProperties) {
        if (systemProperties == null) throw new IllegalArgumentException("systemProperties == null");
        this.systemProperties = systemProperties;
    }

    /**
     * Loads the first settings file found in {@code directory}. A directory without one yields
     * settings built from system properties only.
     */
    public ApplicationSettings loadFromDirectory(Path directory) {
        if (directory == null) throw new IllegalArgumentException("directory == null");
        for (String name : FILE_NAMES) {
            Path candidate = directory.resolve(name);
            if (Files.isRegularFile(candidate)) {
                return loadFile(candidate);
            }
        }
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("No settings file in " + directory + ", using defaults");
        }
        return build(Map.of());
    }

    public ApplicationSettings loadFile(Path file) {
        if (file == null) throw new IllegalArgumentException("file == null");
        try (InputStream in = Files.newInputStream(file)) {
            ApplicationSettings settings = build(parse(in, file.toString()));
            if (LOG.isLoggable(Level.INFO)) {
                LOG.info("Loaded settings from " + file);
            }
            return settings;
        } catch (IOException e) {
            throw new SettingsException("Failed to read settings file " + file, e);
        }
    }

    /**
     * Loads a settings document from the classpath. A missing resource yields settings built from
     * system properties only.
     */
    public ApplicationSettings loadResource(ClassLoader loader, String resource) {
        if (loader == null) throw new IllegalArgumentException("loader == null");
        if (resource == null) throw new IllegalArgumentException("resource == null");
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("Settings resource not found: " + resource);
                }
                return build(Map.of());
            }
            return build(parse(in, resource));
        } catch (IOException e) {
            throw new SettingsException("Failed to read settings resource " + resource, e);
        }
    }

    private Map<String, String> parse(InputStream in, String source) {
        Object doc;
        try {
            doc = new Yaml().load(in);
        } catch (YAMLException e) {
            throw new SettingsException("Malformed settings document " + source, e);
        }
        if (doc == null) {
            return Map.of();
        }
        if (!(doc instanceof Map<?, ?> map)) {
            throw new SettingsException("Settings document " + source + " must be a mapping", null);
        }
        Map<String, String> flat = new LinkedHashMap<>();
        flatten("", map, flat);
        return flat;
    }

    private static void flatten(String prefix, Map<?, ?> map, Map<String, String> out) {
        for (Map.Entry<?, ?> e : map.entrySet()) {
            if (e.getKey() == null) continue;
            String key = prefix + e.getKey();
            Object value = e.getValue();
            if (value instanceof Map<?, ?> nested) {
                flatten(key + ".", nested, out);
            } else if (value instanceof List<?> list) {
                StringBuilder joined = new StringBuilder();
                for (Object item : list) {
                    if (item == null) continue;
                    if (!joined.isEmpty()) joined.append(',');
                    joined.append(item);
                }
                out.put(key, joined.toString());
            } else {
                out.put(key, value != null ? String.valueOf(value) : "");
            }
        }
    }

    private ApplicationSettings build(Map<String, String> fileValues) {
        ApplicationSettingsBuilder builder = ApplicationSettings.builder().putAll(fileValues);
        for (String name : systemProperties.stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PROPERTY_PREFIX) && name.length() > SYSTEM_PROPERTY_PREFIX.length()) {
                builder.put(name.substring(SYSTEM_PROPERTY_PREFIX.length()), systemProperties.getProperty(name));
            }
        }
        return builder.build();
    }
}
