/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trie;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;
import java.util.Random;
import java.util.stream.IntStream;

import org.junit.Before;
import org.junit.Test;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class TrieMapTest {
    private TrieMapImpl<Integer> tm;
    private Integer[] data;

    private static final long KEY = 42;

    @Before
    public void initialize() {
        data = shuffle(1000);
        tm = new TrieMapImpl<>(KeyWidth.BITS_64);
        for (Integer x : data) {
            put(x, x);
        }
    }

    private static Integer[] shuffle(int len) {
        Random rnd = new Random();
        return IntStream.generate(() -> rnd.nextInt(len))
                        .distinct().limit(len)
                        .boxed().toArray(Integer[]::new);
    }

    private <V> TrieMapImpl<V> validate(TrieMapImpl<V> tm) {
        if (!tm.valid()) {
            fail("Internal trie structure corrupted\n\nSample Data: \n" + Arrays.toString(data));
        }
        return tm;
    }

    private void assertGetFail(long key) {
        try {
            tm.get(key);
            fail("Removed mapping still exist");
        } catch (NoSuchElementException ex) {
            // ok
        }
    }

    private void put(long key, Integer value) {
        tm.put(key, value);
        validate(tm);
    }

    private void remove(long key) {
        tm.remove(key);
        validate(tm);
    }

    private static <V> List<Long> keysOf(Iterator<TrieMap.Entry<V>> it) {
        List<Long> keys = new ArrayList<>();
        it.forEachRemaining(e -> keys.add(e.key()));
        return keys;
    }

    @Test
    public void test_empty() {
        TrieMap<String> m = TrieMap.empty();
        assertTrue(m.isEmpty());
        assertEquals(0, m.size());
        assertFalse(m.containsKey(KEY));
        assertFalse(m.iterator().hasNext());
        assertFalse(m.lowerBound(0).hasNext());
        assertTrue(m.eachReverse((k, v) -> false));
    }

    @Test
    public void test_containsKey() {
        assertTrue(tm.containsKey(KEY));
        assertFalse(tm.containsKey(-1L));
        assertFalse(tm.containsKey(data.length));
    }

    @Test
    public void test_get() {
        assertSame(data[42], tm.get(data[42]));
        assertEquals(Integer.valueOf(7), tm.lookup(7).get());
        assertFalse(tm.lookup(-1L).isPresent());
        assertEquals(Integer.valueOf(-5), tm.getOrDefault(5000, -5));
        assertGetFail(-1L);
    }

    @Test
    public void test_put() {
        Integer o1 = 1984;
        assertEquals(Integer.valueOf(42), tm.put(KEY, o1).get());
        assertEquals(data.length, tm.size());
        assertSame(o1, tm.get(KEY));

        Integer o2 = 2046;
        assertFalse(tm.put(1984, o2).isPresent());
        assertEquals(data.length + 1, tm.size());
        assertEquals(o2, tm.get(1984));
        validate(tm);
    }

    @Test
    public void test_put_same_value_twice() {
        TrieMapImpl<String> m = new TrieMapImpl<>(KeyWidth.BITS_32);
        m.put(3, "a");
        m.put(1, "b");
        String before = m.toString();
        assertEquals("a", m.put(3, "a").get());
        assertEquals(2, m.size());
        assertEquals(before, m.toString());
    }

    @Test(expected = NullPointerException.class)
    public void test_put_null_value() {
        tm.put(1, null);
    }

    @Test
    public void test_remove() {
        assertEquals(Integer.valueOf(42), tm.remove(KEY).get());
        validate(tm);
        assertEquals(data.length - 1, tm.size());
        assertFalse(tm.containsKey(KEY));
        assertFalse(tm.lookup(KEY).isPresent());
        assertGetFail(KEY);
    }

    @Test
    public void test_remove_not_exists() {
        assertFalse(tm.remove(-1L).isPresent());
        assertFalse(tm.remove(data.length).isPresent());
        assertFalse(tm.remove(1L << 40).isPresent());
        assertEquals(data.length, tm.size());
    }

    @Test
    public void validate_remove() {
        for (Integer x : data) {
            remove(x);
        }
        assertTrue(tm.isEmpty());
        assertEquals(0, tm.size());
        assertNull(tm.root);
        assertFalse(tm.iterator().hasNext());
        assertEquals(new TrieMapImpl<Integer>(KeyWidth.BITS_64), tm);
    }

    @Test
    public void test_remove_collapses_sibling_paths() {
        TrieMapImpl<String> m = new TrieMapImpl<>(KeyWidth.BITS_64);
        m.put(0x10L, "a");
        m.put(0x1000_0000_0000_0000L, "b");
        m.put(0x11L, "c");
        validate(m);

        m.remove(0x1000_0000_0000_0000L);
        validate(m);
        assertEquals(1, m.root.live);

        m.remove(0x10L);
        validate(m);
        m.remove(0x11L);
        assertNull(m.root);
        assertTrue(m.valid());
    }

    @Test
    public void test_clear() {
        tm.clear();
        assertTrue(tm.isEmpty());
        assertEquals(0, tm.size());
        assertFalse(tm.containsKey(KEY));
        assertTrue(tm.valid());

        put(KEY, 1);
        assertEquals(1, tm.size());
    }

    @Test
    public void test_iterator() {
        List<Long> keys = keysOf(tm.iterator());
        assertEquals(data.length, keys.size());
        for (int i = 0; i < keys.size(); i++) {
            assertEquals(Long.valueOf(i), keys.get(i));
        }
    }

    @Test
    public void test_keys_and_values() {
        PrimitiveIterator.OfLong keys = tm.keys();
        Iterator<Integer> values = tm.values();
        long expected = 0;
        while (keys.hasNext()) {
            assertEquals(expected, keys.nextLong());
            assertEquals(Integer.valueOf((int)expected), values.next());
            expected++;
        }
        assertFalse(values.hasNext());
        assertEquals(data.length, expected);
    }

    @Test
    public void test_iterator_exhausted() {
        TrieMap<String> m = TrieMap.empty(KeyWidth.BITS_32);
        m.put(5, "x");
        Iterator<TrieMap.Entry<String>> it = m.iterator();
        assertEquals(5L, it.next().key());
        assertFalse(it.hasNext());
        try {
            it.next();
            fail();
        } catch (NoSuchElementException ex) {
            // ok
        }
    }

    @Test
    public void test_setValue_through_iterator() {
        for (TrieMap.Entry<Integer> e : tm) {
            e.setValue(e.getValue() * 2);
        }
        validate(tm);
        assertEquals(Integer.valueOf(84), tm.get(KEY));
        assertEquals(data.length, tm.size());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void test_iterator_remove_unsupported() {
        Iterator<TrieMap.Entry<Integer>> it = tm.iterator();
        it.next();
        it.remove();
    }

    @Test(expected = ConcurrentModificationException.class)
    public void test_put_while_iterating() {
        Iterator<TrieMap.Entry<Integer>> it = tm.iterator();
        it.next();
        tm.put(5000, 5000);
        it.hasNext();
    }

    @Test(expected = ConcurrentModificationException.class)
    public void test_remove_while_iterating() {
        PrimitiveIterator.OfLong it = tm.keys();
        it.nextLong();
        tm.remove(KEY);
        it.nextLong();
    }

    @Test
    public void test_replace_while_iterating() {
        Iterator<TrieMap.Entry<Integer>> it = tm.iterator();
        it.next();
        tm.put(KEY, 0);
        assertTrue(it.hasNext());
    }

    @Test
    public void test_full_width_keys() {
        TrieMapImpl<String> m = new TrieMapImpl<>(KeyWidth.BITS_64);
        long top = 1L << 63;
        m.put(-1L, "max");
        m.put(top, "top");
        m.put(1, "one");
        m.put(0, "zero");
        validate(m);

        assertEquals(Arrays.asList(0L, 1L, top, -1L), keysOf(m.iterator()));
        assertEquals("{0=zero, 1=one, 9223372036854775808=top, 18446744073709551615=max}",
                     m.toString());
        assertEquals(Arrays.asList(top, -1L), keysOf(m.lowerBound(2)));
        assertEquals(Arrays.asList(-1L), keysOf(m.upperBound(top)));
        assertFalse(m.upperBound(-1L).hasNext());
    }

    @Test
    public void test_lowerBound() {
        TrieMapImpl<String> m = new TrieMapImpl<>(KeyWidth.BITS_64);
        for (long k : new long[]{2, 4, 6, 8}) {
            m.put(k, "v" + k);
        }
        assertEquals(Arrays.asList(4L, 6L, 8L), keysOf(m.lowerBound(4)));
        assertEquals(Arrays.asList(6L, 8L), keysOf(m.lowerBound(5)));
        assertEquals(Arrays.asList(2L, 4L, 6L, 8L), keysOf(m.lowerBound(0)));
        assertFalse(m.lowerBound(10).hasNext());
        assertEquals("v4", m.lowerBound(4).next().getValue());
    }

    @Test
    public void test_upperBound() {
        TrieMapImpl<String> m = new TrieMapImpl<>(KeyWidth.BITS_64);
        for (long k : new long[]{2, 4, 6, 8}) {
            m.put(k, "v" + k);
        }
        assertEquals(Arrays.asList(6L, 8L), keysOf(m.upperBound(4)));
        assertEquals(Arrays.asList(6L, 8L), keysOf(m.upperBound(5)));
        assertFalse(m.upperBound(8).hasNext());
        assertFalse(m.upperBound(10).hasNext());
    }

    @Test
    public void test_bounds_random() {
        Random rnd = new Random();
        for (int n = 0; n < 200; n++) {
            long x = rnd.nextInt(data.length + 10) - 5;
            long lo = Math.max(0, x);
            List<Long> lower = keysOf(tm.lowerBound(x));
            List<Long> upper = keysOf(tm.upperBound(x));
            if (x < 0) {
                // negative keys are huge unsigned values
                assertTrue(lower.isEmpty());
                assertTrue(upper.isEmpty());
            } else {
                assertEquals(Math.max(0, data.length - lo), lower.size());
                assertEquals(Math.max(0, data.length - lo - 1), upper.size());
                if (!lower.isEmpty())
                    assertEquals(Long.valueOf(lo), lower.get(0));
                if (!upper.isEmpty())
                    assertEquals(Long.valueOf(lo + 1), upper.get(0));
            }
        }
    }

    @Test
    public void test_bounds_across_branches() {
        TrieMapImpl<String> m = new TrieMapImpl<>(KeyWidth.BITS_32);
        m.put(0x0fff_ffffL, "a");
        m.put(0x1000_0000L, "b");
        m.put(0xffff_ffffL, "c");

        assertEquals(Arrays.asList(0x1000_0000L, 0xffff_ffffL), keysOf(m.upperBound(0x0fff_ffffL)));
        assertEquals(Arrays.asList(0x1000_0000L, 0xffff_ffffL), keysOf(m.lowerBound(0x0fff_fff0L + 0x10)));
        assertEquals(Arrays.asList(0xffff_ffffL), keysOf(m.lowerBound(0x1000_0001L)));
        assertFalse(m.upperBound(0xffff_ffffL).hasNext());
        assertFalse(m.lowerBound(1L << 32).hasNext());
    }

    @Test
    public void test_eachReverse() {
        List<Long> visited = new ArrayList<>();
        assertTrue(tm.eachReverse((k, v) -> {
            assertEquals(k, (long)v);
            return visited.add(k);
        }));
        assertEquals(data.length, visited.size());
        for (int i = 0; i < visited.size(); i++) {
            assertEquals(Long.valueOf(data.length - 1 - i), visited.get(i));
        }
    }

    @Test
    public void test_eachReverse_stop() {
        List<Long> visited = new ArrayList<>();
        assertFalse(tm.eachReverse((k, v) -> {
            visited.add(k);
            return k != 500;
        }));
        assertEquals(data.length - 500, visited.size());
        assertThat(visited.get(visited.size() - 1), is(500L));
    }

    @Test(expected = IllegalArgumentException.class)
    public void test_key_too_wide() {
        TrieMap<String> m = TrieMap.empty(KeyWidth.BITS_32);
        m.put(1L << 32, "x");
    }

    @Test
    public void test_equals() {
        TrieMapImpl<Integer> other = new TrieMapImpl<>(KeyWidth.BITS_64);
        for (int i = data.length - 1; i >= 0; i--) {
            other.put(i, i);
        }
        assertEquals(tm, other);
        assertEquals(tm.hashCode(), other.hashCode());

        other.put(KEY, 0);
        assertNotEquals(tm, other);
    }
}
