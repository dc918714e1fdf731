package com.tyron.apphost.api.service;

import java.util.List;

/**
 * A host that can provide application services and extensions.
 */
public interface ServiceHost {

    <T> T getService(Class<T> serviceClass);

    <E> List<E> getExtensions(Class<E> extensionPoint);
}
