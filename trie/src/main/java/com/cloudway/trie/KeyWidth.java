/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trie;

import com.google.common.base.Preconditions;
import com.google.common.primitives.UnsignedLongs;

import com.cloudway.trie.util.TrieConfig;

/**
 * The bit width of the unsigned keys stored in a trie. Keys are decomposed
 * into 4-bit chunks, most significant first, so a width yields
 * {@code bits / 4} trie levels.
 */
public enum KeyWidth {
    BITS_32(32),
    BITS_64(64);

    /**
     * The number of key bits consumed at each trie level.
     */
    public static final int SHIFT = 4;

    /**
     * The number of child slots in a branch node.
     */
    public static final int FANOUT = 1 << SHIFT;

    static final int MASK = FANOUT - 1;

    private final int bits;
    private final int levels;

    KeyWidth(int bits) {
        this.bits = bits;
        this.levels = bits / SHIFT;
    }

    public int bits() {
        return bits;
    }

    public int levels() {
        return levels;
    }

    /**
     * Returns the slot index of the key at the given level, where level 0 is
     * the root and addresses the most significant chunk.
     */
    public int chunk(long key, int level) {
        return (int)(key >>> (bits - SHIFT * (level + 1))) & MASK;
    }

    /**
     * Returns {@code true} if the key fits in this width.
     */
    public boolean accepts(long key) {
        return bits == 64 || (key >>> bits) == 0;
    }

    /**
     * Validates a key against this width.
     *
     * @return the given key
     * @throws IllegalArgumentException if the key has bits set above this width
     */
    public long check(long key) {
        Preconditions.checkArgument(accepts(key), "key %s exceeds %s-bit width",
                                    UnsignedLongs.toString(key), bits);
        return key;
    }

    /**
     * Returns the width matching the data model of the running JVM.
     */
    public static KeyWidth nativeWidth() {
        return "32".equals(System.getProperty("sun.arch.data.model")) ? BITS_32 : BITS_64;
    }

    /**
     * Returns the configured default width.
     *
     * @see TrieConfig#keyWidth()
     */
    public static KeyWidth getDefault() {
        return TrieConfig.getDefault().keyWidth();
    }

    /**
     * Returns the width with the given number of bits.
     *
     * @throws IllegalArgumentException if no width has that many bits
     */
    public static KeyWidth ofBits(int bits) {
        for (KeyWidth w : values()) {
            if (w.bits == bits)
                return w;
        }
        throw new IllegalArgumentException("unsupported key width: " + bits);
    }
}
