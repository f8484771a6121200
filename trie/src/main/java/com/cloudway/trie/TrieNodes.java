/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trie;

import java.util.Objects;

import com.google.common.primitives.UnsignedLongs;

/**
 * Node types of the radix trie. An empty slot is represented by {@code null}.
 */
final class TrieNodes {
    private TrieNodes() {}

    interface Node {}

    static final class Branch implements Node {
        final Node[] children = new Node[KeyWidth.FANOUT];

        // number of non-null children
        int live;

        Node get(int index) {
            return children[index];
        }

        void set(int index, Node child) {
            if (children[index] == null) {
                live++;
            }
            children[index] = child;
        }

        void clear(int index) {
            if (children[index] != null) {
                children[index] = null;
                live--;
            }
        }

        boolean isEmpty() {
            return live == 0;
        }
    }

    static final class Leaf<V> implements Node, TrieMap.Entry<V> {
        final long key;
        V value;

        Leaf(long key, V value) {
            this.key = key;
            this.value = value;
        }

        @Override
        public long key() {
            return key;
        }

        @Override
        public Long getKey() {
            return key;
        }

        @Override
        public V getValue() {
            return value;
        }

        @Override
        public V setValue(V value) {
            V old = this.value;
            this.value = Objects.requireNonNull(value);
            return old;
        }

        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof Leaf))
                return false;
            Leaf<?> e = (Leaf<?>)obj;
            return key == e.key && value.equals(e.value);
        }

        public int hashCode() {
            return 31 * Long.hashCode(key) + value.hashCode();
        }

        public String toString() {
            return UnsignedLongs.toString(key) + "=" + value;
        }
    }
}
