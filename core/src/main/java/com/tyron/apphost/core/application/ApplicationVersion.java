package com.tyron.apphost.core.application;

import com.tyron.apphost.api.version.Version;

/**
 * The version of this application build.
 */
public final class ApplicationVersion {

    public static final Version CURRENT = new Version(7, 3, 1, 0);

    private ApplicationVersion() {
    }
}
