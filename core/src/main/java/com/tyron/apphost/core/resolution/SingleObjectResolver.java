package com.tyron.apphost.core.resolution;

import org.jetbrains.annotations.Nullable;

/**
 * Resolves a single object.
 * <p>
 * The value may only be replaced while {@link Resolution} is open and, unless the resolver allows
 * it, only read once resolution is frozen. Each resolver registers itself with
 * {@link ResolverCollection} on construction.
 *
 * @param <T> the resolved type
 */
public class SingleObjectResolver<T> implements Resolver {

    private final boolean canResolveBeforeFrozen;
    private volatile T value;

    public SingleObjectResolver() {
        this(null, false);
    }

    public SingleObjectResolver(@Nullable T value) {
        this(value, false);
    }

    public SingleObjectResolver(@Nullable T value, boolean canResolveBeforeFrozen) {
        this.value = value;
        this.canResolveBeforeFrozen = canResolveBeforeFrozen;
        ResolverCollection.add(this);
    }

    public boolean hasValue() {
        return value != null;
    }

    /**
     * @throws IllegalStateException if resolution is not frozen and this resolver does not allow early reads,
     *                               or if no value has been set.
     */
    public T getValue() {
        if (!canResolveBeforeFrozen) {
            Resolution.ensureIsFrozen();
        }
        T v = value;
        if (v == null) {
            throw new IllegalStateException(getClass().getSimpleName() + " has no value");
        }
        return v;
    }

    /**
     * @throws IllegalStateException if resolution is frozen.
     */
    public void setValue(T value) {
        if (value == null) throw new IllegalArgumentException("value == null");
        Resolution.ensureIsNotFrozen();
        this.value = value;
    }

    @Override
    public void resetCurrent() {
        value = null;
    }
}
