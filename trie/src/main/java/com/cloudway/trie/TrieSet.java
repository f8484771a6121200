/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trie;

import java.util.PrimitiveIterator;
import java.util.function.LongPredicate;

/**
 * <p>An ordered set of unsigned integers backed by a {@link TrieMap}.</p>
 *
 * <p>Elements are always iterated in ascending unsigned order. The set
 * algebra operations ({@link #union}, {@link #intersection},
 * {@link #difference} and {@link #symmetricDifference}) are lazy merge-joins
 * over the ascending iterators of both operands and produce strictly
 * ascending results.</p>
 *
 * <pre>{@code
 * TrieSet set = TrieSet.empty();
 * set.add(6);
 * set.add(28);
 * set.add(6);
 * assert set.size() == 2;
 * }</pre>
 */
public interface TrieSet extends Iterable<Long>, Comparable<TrieSet> {
    // Construction

    /**
     * Construct an empty set with the default key width.
     *
     * @see KeyWidth#getDefault()
     */
    static TrieSet empty() {
        return new TrieSetImpl(KeyWidth.getDefault());
    }

    /**
     * Construct an empty set with the given key width.
     */
    static TrieSet empty(KeyWidth width) {
        return new TrieSetImpl(width);
    }

    /**
     * Construct a set with given elements and the default key width.
     */
    static TrieSet of(long... elements) {
        TrieSet res = empty();
        for (long e : elements) {
            res.add(e);
        }
        return res;
    }

    /**
     * Construct a set from the elements produced by an iterator, typically
     * the result of a set algebra operation.
     */
    static TrieSet copyOf(KeyWidth width, PrimitiveIterator.OfLong elements) {
        TrieSet res = empty(width);
        res.addAll(elements);
        return res;
    }

    // Query

    KeyWidth keyWidth();

    int size();

    boolean isEmpty();

    /**
     * Returns {@code true} if this set contains the given element.
     */
    boolean contains(long value);

    /**
     * Returns {@code true} if this set has no elements in common with
     * {@code other}.
     */
    boolean isDisjoint(TrieSet other);

    /**
     * Returns {@code true} if every element of this set is contained in
     * {@code other}.
     */
    boolean isSubset(TrieSet other);

    /**
     * Returns {@code true} if this set contains every element of {@code other}.
     */
    boolean isSuperset(TrieSet other);

    // Modification

    /**
     * Adds a value to this set.
     *
     * @return {@code true} if the value was not already present
     * @throws IllegalArgumentException if the value exceeds the key width
     */
    boolean add(long value);

    /**
     * Adds all values produced by the iterator.
     *
     * @return {@code true} if this set changed
     */
    boolean addAll(PrimitiveIterator.OfLong values);

    /**
     * Removes a value from this set.
     *
     * @return {@code true} if the value was present
     */
    boolean remove(long value);

    void clear();

    // Traversal

    /**
     * Returns an iterator over the elements in ascending order.
     */
    @Override
    PrimitiveIterator.OfLong iterator();

    /**
     * Returns an iterator starting at the first element that is not less
     * than {@code value}.
     */
    PrimitiveIterator.OfLong lowerBound(long value);

    /**
     * Returns an iterator starting at the first element that is greater
     * than {@code value}.
     */
    PrimitiveIterator.OfLong upperBound(long value);

    /**
     * Visits all elements in descending order. Aborts the traversal when the
     * predicate returns {@code false}.
     *
     * @return {@code true} if the predicate returned {@code true} for every element
     */
    boolean eachReverse(LongPredicate visitor);

    // Set algebra

    /**
     * Returns the elements of this set that are not in {@code other}, in
     * ascending order.
     *
     * @throws IllegalArgumentException if the sets have different key widths
     */
    PrimitiveIterator.OfLong difference(TrieSet other);

    /**
     * Returns the elements that are in exactly one of the two sets, in
     * ascending order.
     *
     * @throws IllegalArgumentException if the sets have different key widths
     */
    PrimitiveIterator.OfLong symmetricDifference(TrieSet other);

    /**
     * Returns the elements that are in both sets, in ascending order.
     *
     * @throws IllegalArgumentException if the sets have different key widths
     */
    PrimitiveIterator.OfLong intersection(TrieSet other);

    /**
     * Returns the elements that are in either set, in ascending order.
     *
     * @throws IllegalArgumentException if the sets have different key widths
     */
    PrimitiveIterator.OfLong union(TrieSet other);
}
