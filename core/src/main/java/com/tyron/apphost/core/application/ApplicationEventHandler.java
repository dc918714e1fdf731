package com.tyron.apphost.core.application;

/**
 * Boot sequence callback.
 * <p>
 * Implementations are registered as {@code ApplicationEventHandler} extensions of the service registry
 * and are notified by {@link ApplicationBootstrap} in phase order.
 */
public interface ApplicationEventHandler {

    /**
     * Called once the context exists and is installed. Collaborators are available; the context is not ready.
     */
    default void applicationInitialized(ApplicationContext context) {
    }

    /**
     * Called while resolution is still open. Resolvers should be configured here.
     */
    default void applicationStarting(ApplicationContext context) {
    }

    /**
     * Called after the context has been marked ready.
     */
    default void applicationStarted(ApplicationContext context) {
    }
}
