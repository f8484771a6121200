/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trie;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;

import com.cloudway.trie.TrieNodes.Branch;
import com.cloudway.trie.TrieNodes.Leaf;
import com.cloudway.trie.TrieNodes.Node;

/**
 * An ascending cursor over the leaves of a trie. The cursor keeps an explicit
 * stack of (branch, next child index) frames, one per level at most, so it can
 * be positioned at an arbitrary key with a single descent and then resumed
 * like a full traversal.
 */
abstract class PathIterator<V> {
    private final TrieMapImpl<V> map;
    private final Branch[] nodes;
    private final int[] next;
    private int depth = -1;
    private Leaf<V> pending;
    private final int expectedModCount;

    PathIterator(TrieMapImpl<V> map) {
        int levels = map.width.levels();
        this.map = map;
        this.nodes = new Branch[levels];
        this.next = new int[levels];
        this.expectedModCount = map.modCount;
    }

    private void push(Branch branch, int index) {
        depth++;
        nodes[depth] = branch;
        next[depth] = index;
    }

    /**
     * Positions the cursor before the smallest key.
     */
    final void seekFirst() {
        if (map.root != null) {
            push(map.root, 0);
        }
    }

    /**
     * Positions the cursor before the first key that is not less than (when
     * inclusive) or greater than (when exclusive) the given key. Each frame
     * resumes right after the slot the key descends through, so everything
     * left on the stack is beyond the key.
     */
    final void seek(long key, boolean inclusive) {
        KeyWidth width = map.width;
        int last = width.levels() - 1;
        Branch branch = map.root;
        for (int level = 0; branch != null; level++) {
            int index = width.chunk(key, level);
            if (level == last) {
                push(branch, inclusive ? index : index + 1);
                break;
            }
            push(branch, index + 1);
            Node child = branch.get(index);
            branch = child instanceof Branch ? (Branch)child : null;
        }
    }

    public final boolean hasNext() {
        if (map.modCount != expectedModCount)
            throw new ConcurrentModificationException();
        if (pending == null)
            pending = advance();
        return pending != null;
    }

    final Leaf<V> nextLeaf() {
        if (!hasNext())
            throw new NoSuchElementException();
        Leaf<V> leaf = pending;
        pending = null;
        return leaf;
    }

    @SuppressWarnings("unchecked")
    private Leaf<V> advance() {
        while (depth >= 0) {
            Branch branch = nodes[depth];
            int i = next[depth];
            while (i < KeyWidth.FANOUT && branch.get(i) == null) {
                i++;
            }
            if (i == KeyWidth.FANOUT) {
                nodes[depth--] = null;
                continue;
            }

            next[depth] = i + 1;
            Node child = branch.get(i);
            if (child instanceof Branch) {
                push((Branch)child, 0);
            } else {
                return (Leaf<V>)child;
            }
        }
        return null;
    }

    static final class Entries<V> extends PathIterator<V> implements Iterator<TrieMap.Entry<V>> {
        Entries(TrieMapImpl<V> map) {
            super(map);
        }

        @Override
        public TrieMap.Entry<V> next() {
            return nextLeaf();
        }
    }

    static final class Keys<V> extends PathIterator<V> implements PrimitiveIterator.OfLong {
        Keys(TrieMapImpl<V> map) {
            super(map);
        }

        @Override
        public long nextLong() {
            return nextLeaf().key;
        }
    }

    static final class Values<V> extends PathIterator<V> implements Iterator<V> {
        Values(TrieMapImpl<V> map) {
            super(map);
        }

        @Override
        public V next() {
            return nextLeaf().value;
        }
    }
}
