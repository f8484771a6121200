/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trie;

import java.util.PrimitiveIterator;
import java.util.StringJoiner;
import java.util.function.LongPredicate;

import com.google.common.base.Preconditions;
import com.google.common.primitives.UnsignedLongs;

final class TrieSetImpl implements TrieSet {
    private final TrieMapImpl<Unit> map;

    TrieSetImpl(KeyWidth width) {
        this.map = new TrieMapImpl<>(width);
    }

    @Override
    public KeyWidth keyWidth() {
        return map.keyWidth();
    }

    @Override
    public int size() {
        return map.size();
    }

    @Override
    public boolean isEmpty() {
        return map.isEmpty();
    }

    @Override
    public boolean contains(long value) {
        return map.containsKey(value);
    }

    @Override
    public boolean add(long value) {
        return !map.put(value, Unit.U).isPresent();
    }

    @Override
    public boolean addAll(PrimitiveIterator.OfLong values) {
        boolean changed = false;
        while (values.hasNext()) {
            changed |= add(values.nextLong());
        }
        return changed;
    }

    @Override
    public boolean remove(long value) {
        return map.remove(value).isPresent();
    }

    @Override
    public void clear() {
        map.clear();
    }

    @Override
    public PrimitiveIterator.OfLong iterator() {
        return map.keys();
    }

    @Override
    public PrimitiveIterator.OfLong lowerBound(long value) {
        return map.keys(value, true);
    }

    @Override
    public PrimitiveIterator.OfLong upperBound(long value) {
        return map.keys(value, false);
    }

    @Override
    public boolean eachReverse(LongPredicate visitor) {
        return map.eachReverse((k, v) -> visitor.test(k));
    }

    @Override
    public boolean isDisjoint(TrieSet other) {
        for (PrimitiveIterator.OfLong it = iterator(); it.hasNext(); ) {
            if (other.contains(it.nextLong()))
                return false;
        }
        return true;
    }

    @Override
    public boolean isSubset(TrieSet other) {
        for (PrimitiveIterator.OfLong it = iterator(); it.hasNext(); ) {
            if (!other.contains(it.nextLong()))
                return false;
        }
        return true;
    }

    @Override
    public boolean isSuperset(TrieSet other) {
        return other.isSubset(this);
    }

    private PrimitiveIterator.OfLong checkWidth(TrieSet other) {
        Preconditions.checkArgument(keyWidth() == other.keyWidth(),
                                    "cannot combine %s and %s sets", keyWidth(), other.keyWidth());
        return other.iterator();
    }

    @Override
    public PrimitiveIterator.OfLong difference(TrieSet other) {
        return SetAlgebra.difference(iterator(), checkWidth(other));
    }

    @Override
    public PrimitiveIterator.OfLong symmetricDifference(TrieSet other) {
        return SetAlgebra.symmetricDifference(iterator(), checkWidth(other));
    }

    @Override
    public PrimitiveIterator.OfLong intersection(TrieSet other) {
        return SetAlgebra.intersection(iterator(), checkWidth(other));
    }

    @Override
    public PrimitiveIterator.OfLong union(TrieSet other) {
        return SetAlgebra.union(iterator(), checkWidth(other));
    }

    boolean valid() {
        return map.valid();
    }

    @Override
    public int compareTo(TrieSet other) {
        PrimitiveIterator.OfLong i = iterator(), j = other.iterator();
        while (i.hasNext() && j.hasNext()) {
            int c = UnsignedLongs.compare(i.nextLong(), j.nextLong());
            if (c != 0)
                return c;
        }
        return Boolean.compare(i.hasNext(), j.hasNext());
    }

    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof TrieSet))
            return false;
        TrieSet that = (TrieSet)obj;
        return size() == that.size() && compareTo(that) == 0;
    }

    public int hashCode() {
        int h = 0;
        for (PrimitiveIterator.OfLong it = iterator(); it.hasNext(); ) {
            h += Long.hashCode(it.nextLong());
        }
        return h;
    }

    public String toString() {
        StringJoiner sj = new StringJoiner(", ", "{", "}");
        for (PrimitiveIterator.OfLong it = iterator(); it.hasNext(); ) {
            sj.add(UnsignedLongs.toString(it.nextLong()));
        }
        return sj.toString();
    }
}
