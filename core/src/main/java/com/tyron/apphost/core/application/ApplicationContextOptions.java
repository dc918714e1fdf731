package com.tyron.apphost.core.application;

import com.tyron.apphost.api.version.Version;
import com.tyron.apphost.core.config.ApplicationConfig;
import com.tyron.apphost.core.config.ApplicationSettings;
import com.tyron.apphost.core.resolution.DefaultGlobalStateReset;
import com.tyron.apphost.core.resolution.GlobalStateReset;

import java.util.function.Supplier;

/**
 * The process-wide facilities an {@link ApplicationContext} talks to besides its three collaborators.
 * <p>
 * {@link #defaults()} wires everything to global state. Tests replace individual pieces.
 */
public final class ApplicationContextOptions {

    private static final ApplicationContextOptions DEFAULTS = builder().build();

    private final ConfigurationStatusSource configurationStatus;
    private final Version currentVersion;
    private final Supplier<ApplicationSettings> settings;
    private final ApplicationUrlResolver urlResolver;
    private final GlobalStateReset globalStateReset;

    private ApplicationContextOptions(Builder builder) {
        this.configurationStatus = builder.configurationStatus;
        this.currentVersion = builder.currentVersion;
        this.settings = builder.settings;
        this.urlResolver = builder.urlResolver;
        this.globalStateReset = builder.globalStateReset;
    }

    public static ApplicationContextOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ConfigurationStatusSource getConfigurationStatus() {
        return configurationStatus;
    }

    public Version getCurrentVersion() {
        return currentVersion;
    }

    public Supplier<ApplicationSettings> getSettings() {
        return settings;
    }

    public ApplicationUrlResolver getUrlResolver() {
        return urlResolver;
    }

    public GlobalStateReset getGlobalStateReset() {
        return globalStateReset;
    }

    public static final class Builder {

        private ConfigurationStatusSource configurationStatus = ConfigurationStatusSource.fromApplicationConfig();
        private Version currentVersion = ApplicationVersion.CURRENT;
        private Supplier<ApplicationSettings> settings =
                () -> ApplicationConfig.hasSettings() ? ApplicationConfig.getSettings() : ApplicationSettings.empty();
        private ApplicationUrlResolver urlResolver = ServerEnvironment.INSTANCE;
        private GlobalStateReset globalStateReset = DefaultGlobalStateReset.INSTANCE;

        private Builder() {
        }

        public Builder configurationStatus(ConfigurationStatusSource source) {
            if (source == null) throw new IllegalArgumentException("source == null");
            this.configurationStatus = source;
            return this;
        }

        public Builder currentVersion(Version version) {
            if (version == null) throw new IllegalArgumentException("version == null");
            this.currentVersion = version;
            return this;
        }

        public Builder settings(Supplier<ApplicationSettings> settings) {
            if (settings == null) throw new IllegalArgumentException("settings == null");
            this.settings = settings;
            return this;
        }

        public Builder settings(ApplicationSettings settings) {
            if (settings == null) throw new IllegalArgumentException("settings == null");
            this.settings = () -> settings;
            return this;
        }

        public Builder urlResolver(ApplicationUrlResolver resolver) {
            if (resolver == null) throw new IllegalArgumentException("resolver == null");
            this.urlResolver = resolver;
            return this;
        }

        public Builder globalStateReset(GlobalStateReset reset) {
            if (reset == null) throw new IllegalArgumentException("reset == null");
            this.globalStateReset = reset;
            return this;
        }

        public ApplicationContextOptions build() {
            return new ApplicationContextOptions(this);
        }
    }
}
