package com.tyron.apphost.core.resolution;

/**
 * Resets process-wide resolution state. Invoked when an application context is disposed.
 */
public interface GlobalStateReset {

    void resetAllResolvers();

    void resetResolution();
}
