package com.tyron.apphost.core.util;

import java.util.function.Supplier;

/**
 * Computes a value once, on first access, and returns the same value afterwards.
 * <p>
 * The first caller runs the supplier; concurrent callers wait for it. If the supplier throws,
 * nothing is cached and the next access tries again.
 */
public final class MemoizedValue<T> implements Supplier<T> {

    private final Object lock = new Object();
    private Supplier<? extends T> supplier;
    private volatile boolean computed;
    private T value;

    public MemoizedValue(Supplier<? extends T> supplier) {
        if (supplier == null) throw new IllegalArgumentException("supplier == null");
        this.supplier = supplier;
    }

    @Override
    public T get() {
        if (computed) {
            return value;
        }
        synchronized (lock) {
            if (!computed) {
                value = supplier.get();
                computed = true;
                // Release whatever the supplier captured.
                supplier = null;
            }
            return value;
        }
    }

    public boolean isComputed() {
        return computed;
    }
}
