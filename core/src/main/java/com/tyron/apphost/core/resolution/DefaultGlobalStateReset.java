package com.tyron.apphost.core.resolution;

/**
 * {@link GlobalStateReset} over {@link ResolverCollection} and {@link Resolution}.
 */
public final class DefaultGlobalStateReset implements GlobalStateReset {

    public static final DefaultGlobalStateReset INSTANCE = new DefaultGlobalStateReset();

    private DefaultGlobalStateReset() {
    }

    @Override
    public void resetAllResolvers() {
        ResolverCollection.resetAll();
    }

    @Override
    public void resetResolution() {
        Resolution.reset();
    }
}
