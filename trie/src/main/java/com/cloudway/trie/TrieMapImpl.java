/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trie;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.PrimitiveIterator;
import java.util.StringJoiner;

import com.cloudway.trie.TrieNodes.Branch;
import com.cloudway.trie.TrieNodes.Leaf;
import com.cloudway.trie.TrieNodes.Node;

final class TrieMapImpl<V> implements TrieMap<V> {
    final KeyWidth width;

    // null when the map is empty
    Branch root;

    int size;

    // bumped on every structural change, checked by iterators
    int modCount;

    TrieMapImpl(KeyWidth width) {
        this.width = Objects.requireNonNull(width);
    }

    @Override
    public KeyWidth keyWidth() {
        return width;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public boolean isEmpty() {
        return size == 0;
    }

    @SuppressWarnings("unchecked")
    private Leaf<V> find(long key) {
        width.check(key);
        int last = width.levels() - 1;
        Branch branch = root;
        for (int level = 0; branch != null; level++) {
            Node child = branch.get(width.chunk(key, level));
            if (level == last) {
                return (Leaf<V>)child;
            }
            branch = (Branch)child;
        }
        return null;
    }

    @Override
    public boolean containsKey(long key) {
        return find(key) != null;
    }

    @Override
    public Optional<V> lookup(long key) {
        Leaf<V> leaf = find(key);
        return leaf != null ? Optional.of(leaf.value) : Optional.empty();
    }

    @Override
    public V get(long key) {
        Leaf<V> leaf = find(key);
        if (leaf == null)
            throw new NoSuchElementException();
        return leaf.value;
    }

    @Override
    public V getOrDefault(long key, V def) {
        Leaf<V> leaf = find(key);
        return leaf != null ? leaf.value : def;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Optional<V> put(long key, V value) {
        Objects.requireNonNull(value);
        width.check(key);

        if (root == null) {
            root = new Branch();
        }

        int last = width.levels() - 1;
        Branch branch = root;
        for (int level = 0; level < last; level++) {
            int index = width.chunk(key, level);
            Branch child = (Branch)branch.get(index);
            if (child == null) {
                child = new Branch();
                branch.set(index, child);
            }
            branch = child;
        }

        int index = width.chunk(key, last);
        Leaf<V> leaf = (Leaf<V>)branch.get(index);
        if (leaf != null) {
            V old = leaf.value;
            leaf.value = value;
            return Optional.of(old);
        }

        branch.set(index, new Leaf<>(key, value));
        size++;
        modCount++;
        return Optional.empty();
    }

    @Override
    @SuppressWarnings("unchecked")
    public Optional<V> remove(long key) {
        width.check(key);

        int levels = width.levels();
        Branch[] path = new Branch[levels];
        Branch branch = root;
        for (int level = 0; level < levels - 1 && branch != null; level++) {
            path[level] = branch;
            branch = (Branch)branch.get(width.chunk(key, level));
        }
        if (branch == null) {
            return Optional.empty();
        }

        int index = width.chunk(key, levels - 1);
        Leaf<V> leaf = (Leaf<V>)branch.get(index);
        if (leaf == null) {
            return Optional.empty();
        }

        // collapse emptied branches toward the root
        branch.clear(index);
        for (int level = levels - 2; level >= 0 && branch.isEmpty(); level--) {
            Branch parent = path[level];
            parent.clear(width.chunk(key, level));
            branch = parent;
        }
        if (root.isEmpty()) {
            root = null;
        }

        size--;
        modCount++;
        return Optional.of(leaf.value);
    }

    @Override
    public void clear() {
        root = null;
        size = 0;
        modCount++;
    }

    @Override
    public boolean eachReverse(Visitor<? super V> visitor) {
        Objects.requireNonNull(visitor);
        return root == null || eachReverse(root, visitor);
    }

    @SuppressWarnings("unchecked")
    private boolean eachReverse(Branch branch, Visitor<? super V> visitor) {
        for (int i = KeyWidth.FANOUT - 1; i >= 0; i--) {
            Node child = branch.get(i);
            if (child instanceof Branch) {
                if (!eachReverse((Branch)child, visitor))
                    return false;
            } else if (child != null) {
                Leaf<V> leaf = (Leaf<V>)child;
                if (!visitor.visit(leaf.key, leaf.value))
                    return false;
            }
        }
        return true;
    }

    @Override
    public Iterator<Entry<V>> iterator() {
        PathIterator.Entries<V> it = new PathIterator.Entries<>(this);
        it.seekFirst();
        return it;
    }

    @Override
    public PrimitiveIterator.OfLong keys() {
        PathIterator.Keys<V> it = new PathIterator.Keys<>(this);
        it.seekFirst();
        return it;
    }

    @Override
    public Iterator<V> values() {
        PathIterator.Values<V> it = new PathIterator.Values<>(this);
        it.seekFirst();
        return it;
    }

    @Override
    public Iterator<Entry<V>> lowerBound(long key) {
        return bounded(key, true);
    }

    @Override
    public Iterator<Entry<V>> upperBound(long key) {
        return bounded(key, false);
    }

    private Iterator<Entry<V>> bounded(long key, boolean inclusive) {
        PathIterator.Entries<V> it = new PathIterator.Entries<>(this);
        seek(it, key, inclusive);
        return it;
    }

    PrimitiveIterator.OfLong keys(long key, boolean inclusive) {
        PathIterator.Keys<V> it = new PathIterator.Keys<>(this);
        seek(it, key, inclusive);
        return it;
    }

    private void seek(PathIterator<V> it, long key, boolean inclusive) {
        // a bound wider than the trie lies beyond every stored key
        if (width.accepts(key)) {
            it.seek(key, inclusive);
        }
    }

    /**
     * Checks the internal structure of the trie: every branch is non-empty and
     * counts its children correctly, leaves only occur at the last level along
     * their own key path, and the size matches the number of leaves.
     */
    boolean valid() {
        if (root == null)
            return size == 0;
        int[] count = new int[1];
        return valid(root, 0, 0L, count) && count[0] == size;
    }

    @SuppressWarnings("unchecked")
    private boolean valid(Branch branch, int level, long prefix, int[] count) {
        int live = 0;
        for (int i = 0; i < KeyWidth.FANOUT; i++) {
            Node child = branch.get(i);
            if (child == null)
                continue;
            live++;

            long path = (prefix << KeyWidth.SHIFT) | i;
            if (level == width.levels() - 1) {
                if (!(child instanceof Leaf) || ((Leaf<V>)child).key != path)
                    return false;
                count[0]++;
            } else {
                if (!(child instanceof Branch) || !valid((Branch)child, level + 1, path, count))
                    return false;
            }
        }
        return live > 0 && live == branch.live;
    }

    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof TrieMap))
            return false;
        TrieMap<?> that = (TrieMap<?>)obj;
        if (size() != that.size())
            return false;

        Iterator<Entry<V>> i = iterator();
        Iterator<? extends Entry<?>> j = that.iterator();
        while (i.hasNext() && j.hasNext()) {
            if (!i.next().equals(j.next()))
                return false;
        }
        return !i.hasNext() && !j.hasNext();
    }

    public int hashCode() {
        int h = 0;
        for (Entry<V> e : this) {
            h += e.hashCode();
        }
        return h;
    }

    public String toString() {
        StringJoiner sj = new StringJoiner(", ", "{", "}");
        for (Entry<V> e : this) {
            sj.add(e.toString());
        }
        return sj.toString();
    }
}
