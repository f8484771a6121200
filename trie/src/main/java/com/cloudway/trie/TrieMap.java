/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trie;

import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.PrimitiveIterator;

/**
 * <p>An ordered map keyed by unsigned integers, implemented as a radix trie
 * with 16-way branching.</p>
 *
 * <p>Keys are decomposed into 4-bit chunks, most significant first, and each
 * chunk selects a child slot at one trie level. The trie therefore has a fixed
 * depth determined by the {@link KeyWidth}, every operation costs at most that
 * many steps regardless of the key distribution, and an in-order walk visits
 * keys in ascending unsigned order without any comparison.</p>
 *
 * <p>The map is not thread safe. Iterators fail fast with a
 * {@link java.util.ConcurrentModificationException} when the map is
 * structurally modified after they are created.</p>
 *
 * @param <V> the type of mapped values
 */
public interface TrieMap<V> extends Iterable<TrieMap.Entry<V>> {
    /**
     * Construct an empty map with the default key width.
     *
     * @see KeyWidth#getDefault()
     */
    static <V> TrieMap<V> empty() {
        return new TrieMapImpl<>(KeyWidth.getDefault());
    }

    /**
     * Construct an empty map with the given key width.
     */
    static <V> TrieMap<V> empty(KeyWidth width) {
        return new TrieMapImpl<>(width);
    }

    /**
     * A map entry. The key determines the position of the entry in the trie
     * so only the value can be replaced.
     */
    interface Entry<V> extends Map.Entry<Long, V> {
        /**
         * Returns the unboxed key of this entry.
         */
        long key();
    }

    /**
     * A visitor of map entries.
     */
    @FunctionalInterface
    interface Visitor<V> {
        /**
         * Visits an entry.
         *
         * @return {@code true} to continue the traversal, {@code false} to stop
         */
        boolean visit(long key, V value);
    }

    /**
     * Returns the key width of this map.
     */
    KeyWidth keyWidth();

    /**
     * Returns the number of mappings in this map.
     */
    int size();

    /**
     * Returns {@code true} if this map contains no mappings.
     */
    boolean isEmpty();

    /**
     * Returns {@code true} if this map contains a mapping for the given key.
     *
     * @throws IllegalArgumentException if the key exceeds the key width
     */
    boolean containsKey(long key);

    /**
     * Returns the value to which the specified key is mapped, or an empty
     * {@code Optional} if this map contains no mapping for the key.
     */
    Optional<V> lookup(long key);

    /**
     * Returns the value to which the specified key is mapped.
     *
     * @throws NoSuchElementException if this map contains no mapping for the key
     */
    V get(long key);

    /**
     * Returns the value to which the specified key is mapped, or the default
     * value if this map contains no mapping for the key.
     */
    V getOrDefault(long key, V def);

    /**
     * Associates the value with the key. An existing value is replaced in
     * place without changing the shape of the trie.
     *
     * @return the previous value, or an empty {@code Optional} if the key was absent
     * @throws NullPointerException if the value is null
     * @throws IllegalArgumentException if the key exceeds the key width
     */
    Optional<V> put(long key, V value);

    /**
     * Removes the mapping for the key. Branches left empty by the removal are
     * released up to the root.
     *
     * @return the removed value, or an empty {@code Optional} if the key was absent
     */
    Optional<V> remove(long key);

    /**
     * Removes all of the mappings from this map.
     */
    void clear();

    /**
     * Visits all entries in descending key order. Aborts the traversal when
     * the visitor returns {@code false}.
     *
     * @return {@code true} if the visitor returned {@code true} for every entry
     */
    boolean eachReverse(Visitor<? super V> visitor);

    /**
     * Returns an iterator over the entries in ascending key order. Values can
     * be replaced through {@link Entry#setValue}.
     */
    @Override
    Iterator<Entry<V>> iterator();

    /**
     * Returns an iterator over the keys in ascending order.
     */
    PrimitiveIterator.OfLong keys();

    /**
     * Returns an iterator over the values in ascending key order.
     */
    Iterator<V> values();

    /**
     * Returns an iterator over the entries whose key is not less than the
     * given key, in ascending order.
     */
    Iterator<Entry<V>> lowerBound(long key);

    /**
     * Returns an iterator over the entries whose key is greater than the
     * given key, in ascending order.
     */
    Iterator<Entry<V>> upperBound(long key);
}
