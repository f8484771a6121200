/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trie.util;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

public final class Optionals
{
    private Optionals() {}

    /**
     * Returns the first parameter if it is non-null, otherwise invoke {@code second}
     * and return the result of that invocation.
     */
    public static <T> T or(T first, Supplier<? extends T> second) {
        return first != null ? first : second.get();
    }

    /**
     * Adapts a {@link Function} to return optional value where the invocation
     * of function may return null value or throws a runtime exception.
     *
     * @return an adapted function
     */
    public static <T, R> Function<T, Optional<R>> of(Function<? super T, ? extends R> f) {
        return t -> {
            try {
                return Optional.ofNullable(f.apply(t));
            } catch (RuntimeException ex) {
                return Optional.empty();
            }
        };
    }
}
