package com.tyron.apphost.core.application;

import com.tyron.apphost.core.config.ApplicationSettings;

/**
 * Derives the application url from settings.
 */
@FunctionalInterface
public interface ApplicationUrlResolver {

    /**
     * Assigns the application url of {@code context} when the settings determine one.
     *
     * @return true if a url was assigned.
     */
    boolean trySetApplicationUrlFromSettings(ApplicationContext context, ApplicationSettings settings);
}
