package com.tyron.apphost.core.service;

import com.tyron.apphost.api.service.ServiceHost;

import java.util.List;

/**
 * The application service registry.
 * <p>
 * Services are singletons created lazily from bindings (or registered as ready-made instances).
 * Extension points hold any number of implementations, instantiated together on first lookup.
 */
public interface ServiceRegistry extends ServiceHost {

    <T, I extends T> void registerBinding(Class<T> interfaceClass, Class<I> implementationClass);

    <T, I extends T> void registerBindingIfAbsent(Class<T> interfaceClass, Class<I> implementationClass);

    <T> void registerInstance(Class<T> serviceClass, T instance);

    <E, I extends E> void registerExtension(Class<E> extensionPoint, Class<I> extensionImpl);

    /**
     * Disposes all cached services and extensions and forgets every registration.
     */
    void disposeAll();
}
