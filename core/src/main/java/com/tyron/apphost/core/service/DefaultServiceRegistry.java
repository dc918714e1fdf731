package com.tyron.apphost.core.service;

import com.tyron.apphost.api.service.Disposable;
import com.tyron.apphost.api.service.ServiceHost;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The registry the application boots with.
 * <p>
 * Services and extension lists are created on first lookup. A lookup that arrives while another
 * thread creates the same key waits for it; a lookup from inside its own creation fails with
 * {@link ServiceInstantiationException}. Implementations are built through a public
 * {@code (ServiceHost)} constructor when they have one, otherwise through the no-arg constructor.
 */
public class DefaultServiceRegistry implements ServiceRegistry {

    private static final Logger LOG = Logger.getLogger(DefaultServiceRegistry.class.getName());

    private final Map<Class<?>, Object> instances = new ConcurrentHashMap<>();
    private final Map<Class<?>, Class<?>> bindings = new ConcurrentHashMap<>();
    private final Map<Class<?>, List<Class<?>>> extensionClasses = new ConcurrentHashMap<>();
    // Pending while the list is being built, then an unmodifiable List<Object>.
    private final Map<Class<?>, Object> extensions = new ConcurrentHashMap<>();

    private final ThreadLocal<Deque<Class<?>>> creating = ThreadLocal.withInitial(ArrayDeque::new);

    private static final class Pending {
        final CompletableFuture<Object> result = new CompletableFuture<>();
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> T getService(Class<T> serviceClass) {
        if (serviceClass == null) throw new IllegalArgumentException("serviceClass == null");
        return (T) lookup(instances, serviceClass, this::createService);
    }

    @Override
    public <T, I extends T> void registerBinding(Class<T> interfaceClass, Class<I> implementationClass) {
        if (instances.containsKey(interfaceClass)) {
            throw new IllegalStateException(interfaceClass.getName() + " is already instantiated and cannot be rebound");
        }
        bindings.put(interfaceClass, implementationClass);
    }

    @Override
    public <T, I extends T> void registerBindingIfAbsent(Class<T> interfaceClass, Class<I> implementationClass) {
        if (!instances.containsKey(interfaceClass)) {
            bindings.putIfAbsent(interfaceClass, implementationClass);
        }
    }

    @Override
    public <T> void registerInstance(Class<T> serviceClass, T instance) {
        if (serviceClass == null) throw new IllegalArgumentException("serviceClass == null");
        if (instance == null) throw new IllegalArgumentException("instance == null");
        instances.put(serviceClass, instance);
    }

    @Override
    public <E, I extends E> void registerExtension(Class<E> extensionPoint, Class<I> extensionImpl) {
        extensions.remove(extensionPoint);
        extensionClasses.computeIfAbsent(extensionPoint, k -> Collections.synchronizedList(new ArrayList<>()))
                .add(extensionImpl);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <E> List<E> getExtensions(Class<E> extensionPoint) {
        Object built = extensions.get(extensionPoint);
        if (built instanceof List<?> list) {
            return (List<E>) list;
        }
        return (List<E>) lookup(extensions, extensionPoint, this::createExtensions);
    }

    private Object lookup(Map<Class<?>, Object> store, Class<?> key, Function<Class<?>, ?> factory) {
        Object existing = store.get(key);
        if (existing != null) {
            return awaitIfPending(existing, key);
        }

        Pending pending = new Pending();
        Object raced = store.putIfAbsent(key, pending);
        if (raced != null) {
            return awaitIfPending(raced, key);
        }

        Deque<Class<?>> stack = creating.get();
        stack.push(key);
        try {
            Object created = factory.apply(key);
            pending.result.complete(created);
            store.put(key, created);
            return created;
        } catch (Throwable t) {
            pending.result.completeExceptionally(t);
            store.remove(key, pending);
            if (t instanceof RuntimeException re) {
                throw re;
            }
            throw new ServiceInstantiationException("Failed to create: " + key.getName(), t);
        } finally {
            stack.pop();
        }
    }

    private Object awaitIfPending(Object value, Class<?> key) {
        if (!(value instanceof Pending pending)) {
            return value;
        }
        if (creating.get().contains(key)) {
            throw new ServiceInstantiationException("Cyclic dependency while creating: " + key.getName(), null);
        }
        return pending.result.join();
    }

    private Object createService(Class<?> serviceClass) {
        Class<?> implementation = bindings.getOrDefault(serviceClass, serviceClass);
        if (implementation.isInterface()) {
            throw new ServiceInstantiationException("No binding registered for " + serviceClass.getName(), null);
        }
        return instantiate(implementation);
    }

    private List<Object> createExtensions(Class<?> extensionPoint) {
        List<Class<?>> registered = extensionClasses.get(extensionPoint);
        if (registered == null) {
            return Collections.emptyList();
        }
        List<Class<?>> snapshot;
        synchronized (registered) {
            snapshot = new ArrayList<>(registered);
        }
        List<Object> created = new ArrayList<>(snapshot.size());
        for (Class<?> impl : snapshot) {
            created.add(instantiate(impl));
        }
        return Collections.unmodifiableList(created);
    }

    private Object instantiate(Class<?> implementation) {
        Constructor<?> constructor;
        Object[] args;
        try {
            constructor = implementation.getConstructor(ServiceHost.class);
            args = new Object[]{this};
        } catch (NoSuchMethodException noHostConstructor) {
            try {
                constructor = implementation.getConstructor();
                args = new Object[0];
            } catch (NoSuchMethodException e) {
                throw new ServiceInstantiationException(implementation.getName()
                        + " needs a public (ServiceHost) or no-arg constructor", e);
            }
        }

        try {
            return constructor.newInstance(args);
        } catch (InvocationTargetException e) {
            throw new ServiceInstantiationException(
                    implementation.getName() + " failed during construction", e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new ServiceInstantiationException("Failed to instantiate " + implementation.getName(), e);
        }
    }

    @Override
    public void disposeAll() {
        for (Object service : instances.values()) {
            disposeQuietly(service);
        }
        instances.clear();
        bindings.clear();

        for (Object built : extensions.values()) {
            if (built instanceof List<?> list) {
                for (Object extension : list) {
                    disposeQuietly(extension);
                }
            }
        }
        extensions.clear();
        extensionClasses.clear();
    }

    private static void disposeQuietly(Object candidate) {
        if (candidate instanceof Disposable disposable) {
            try {
                disposable.dispose();
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Error disposing " + candidate.getClass().getName(), e);
            }
        }
    }
}
