/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trie;

/**
 * The value stored for every element of a {@link TrieSet}. Only the presence
 * of a mapping carries information.
 */
public enum Unit {
    U;

    public String toString() {
        return "()";
    }
}
