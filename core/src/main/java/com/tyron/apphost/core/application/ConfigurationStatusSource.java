package com.tyron.apphost.core.application;

import com.tyron.apphost.core.config.ApplicationConfig;

/**
 * Reads the persisted configuration status, i.e. the version the installation was last configured for.
 */
@FunctionalInterface
public interface ConfigurationStatusSource {

    String read() throws Exception;

    /**
     * Reads {@code configurationStatus} from the installed {@link ApplicationConfig} settings.
     */
    static ConfigurationStatusSource fromApplicationConfig() {
        return () -> ApplicationConfig.getSettings().getConfigurationStatus();
    }
}
