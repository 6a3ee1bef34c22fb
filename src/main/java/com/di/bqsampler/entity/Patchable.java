package com.di.bqsampler.entity;

/**
 * Null-filling composition of two instances of the same value type.
 *
 * <p>Most value types patch by <em>substitution</em>: an empty instance is replaced
 * whole by the fallback, a non-empty one is kept as-is. {@link Policy} is the
 * exception and merges field by field.
 *
 * @param <T> the implementing value type
 */
public interface Patchable<T> {

    /**
     * @return {@code true} when every field is absent
     */
    boolean isEmpty();

    /**
     * Returns the result of patching this instance with {@code fallback}.
     * Neither instance is modified.
     */
    T patchWith(T fallback);

    /**
     * Substitution rule shared by the value types that do not merge.
     */
    static <T extends Patchable<T>> T substitute(T self, T fallback) {
        return self.isEmpty() && fallback != null ? fallback : self;
    }
}
