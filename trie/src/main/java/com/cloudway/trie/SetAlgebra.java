/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trie;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;

import com.google.common.collect.Iterators;
import com.google.common.collect.PeekingIterator;
import com.google.common.primitives.UnsignedLongs;

/**
 * Merge-join iterators over two ascending sequences of unsigned keys.
 *
 * <p>Each step compares the heads of both sequences. An exhausted sequence
 * compares as a fixed ordering chosen per operation, so the loop falls into
 * the right branch (stop or drain the other side) without special cases.</p>
 */
final class SetAlgebra {
    private SetAlgebra() {}

    static final int LESS = -1;
    static final int GREATER = 1;

    /**
     * Compares the heads of two iterators, returning {@code whenAExhausted} if
     * {@code a} has no more elements and {@code whenBExhausted} if {@code b}
     * has none.
     */
    static int compare(PeekingIterator<Long> a, PeekingIterator<Long> b,
                       int whenAExhausted, int whenBExhausted) {
        if (!a.hasNext())
            return whenAExhausted;
        if (!b.hasNext())
            return whenBExhausted;
        return UnsignedLongs.compare(a.peek(), b.peek());
    }

    static PrimitiveIterator.OfLong difference(Iterator<Long> a, Iterator<Long> b) {
        return new Difference(a, b);
    }

    static PrimitiveIterator.OfLong symmetricDifference(Iterator<Long> a, Iterator<Long> b) {
        return new SymmetricDifference(a, b);
    }

    static PrimitiveIterator.OfLong intersection(Iterator<Long> a, Iterator<Long> b) {
        return new Intersection(a, b);
    }

    static PrimitiveIterator.OfLong union(Iterator<Long> a, Iterator<Long> b) {
        return new Union(a, b);
    }

    static abstract class Merge implements PrimitiveIterator.OfLong {
        final PeekingIterator<Long> a, b;

        private long next;
        private boolean ready, done;

        Merge(Iterator<Long> a, Iterator<Long> b) {
            this.a = Iterators.peekingIterator(a);
            this.b = Iterators.peekingIterator(b);
        }

        /**
         * Advances the inputs until an output element is found.
         *
         * @return {@code false} when the merge is complete
         */
        abstract boolean computeNext();

        /**
         * Takes the head of the given input as the next output element.
         */
        final boolean emit(PeekingIterator<Long> it) {
            if (!it.hasNext())
                return false;
            next = it.next();
            return true;
        }

        @Override
        public final boolean hasNext() {
            if (!ready && !done) {
                if (computeNext()) {
                    ready = true;
                } else {
                    done = true;
                }
            }
            return ready;
        }

        @Override
        public final long nextLong() {
            if (!hasNext())
                throw new NoSuchElementException();
            ready = false;
            return next;
        }
    }

    static final class Difference extends Merge {
        Difference(Iterator<Long> a, Iterator<Long> b) {
            super(a, b);
        }

        @Override
        boolean computeNext() {
            for (;;) {
                int c = compare(a, b, LESS, LESS);
                if (c < 0) {
                    return emit(a);
                } else if (c == 0) {
                    a.next();
                    b.next();
                } else {
                    b.next();
                }
            }
        }
    }

    static final class SymmetricDifference extends Merge {
        SymmetricDifference(Iterator<Long> a, Iterator<Long> b) {
            super(a, b);
        }

        @Override
        boolean computeNext() {
            for (;;) {
                int c = compare(a, b, GREATER, LESS);
                if (c < 0) {
                    return emit(a);
                } else if (c == 0) {
                    a.next();
                    b.next();
                } else {
                    return emit(b);
                }
            }
        }
    }

    static final class Intersection extends Merge {
        Intersection(Iterator<Long> a, Iterator<Long> b) {
            super(a, b);
        }

        @Override
        boolean computeNext() {
            while (a.hasNext() && b.hasNext()) {
                int c = UnsignedLongs.compare(a.peek(), b.peek());
                if (c < 0) {
                    a.next();
                } else if (c == 0) {
                    b.next();
                    return emit(a);
                } else {
                    b.next();
                }
            }
            return false;
        }
    }

    static final class Union extends Merge {
        Union(Iterator<Long> a, Iterator<Long> b) {
            super(a, b);
        }

        @Override
        boolean computeNext() {
            int c = compare(a, b, GREATER, LESS);
            if (c < 0) {
                return emit(a);
            } else if (c == 0) {
                b.next();
                return emit(a);
            } else {
                return emit(b);
            }
        }
    }
}
