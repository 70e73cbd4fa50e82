/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.ordinal.data;

import java.util.NoSuchElementException;
import java.util.function.Function;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * The shape of an ordinal: it is either zero, the successor of a smaller
 * ordinal, or a limit ordinal.
 */
public abstract class Classification {
    private static final class Zero extends Classification {
        @Override
        public boolean isZero() {
            return true;
        }

        @Override
        public <R> R fold(Supplier<? extends R> zero,
                          Function<? super Ordinal, ? extends R> succ,
                          Function<? super Ordinal, ? extends R> limit) {
            return zero.get();
        }

        public String toString() {
            return "Zero";
        }
    }

    private static final class Succ extends Classification {
        private final Ordinal pred;

        Succ(Ordinal pred) {
            this.pred = pred;
        }

        @Override
        public boolean isSucc() {
            return true;
        }

        @Override
        public Ordinal pred() {
            return pred;
        }

        @Override
        public <R> R fold(Supplier<? extends R> zero,
                          Function<? super Ordinal, ? extends R> succ,
                          Function<? super Ordinal, ? extends R> limit) {
            return succ.apply(pred);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Succ && pred.equals(((Succ)obj).pred);
        }

        @Override
        public int hashCode() {
            return pred.hashCode() + 1;
        }

        public String toString() {
            return "Succ(" + pred + ")";
        }
    }

    private static final class Limit extends Classification {
        private final Ordinal value;

        Limit(Ordinal value) {
            this.value = value;
        }

        @Override
        public boolean isLimit() {
            return true;
        }

        @Override
        public <R> R fold(Supplier<? extends R> zero,
                          Function<? super Ordinal, ? extends R> succ,
                          Function<? super Ordinal, ? extends R> limit) {
            return limit.apply(value);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Limit && value.equals(((Limit)obj).value);
        }

        @Override
        public int hashCode() {
            return ~value.hashCode();
        }

        public String toString() {
            return "Limit(" + value + ")";
        }
    }

    private static final Classification ZERO = new Zero();

    /**
     * The classification of the ordinal zero.
     */
    public static Classification zero() {
        return ZERO;
    }

    /**
     * The classification of {@code succ pred}.
     */
    public static Classification succ(Ordinal pred) {
        return new Succ(requireNonNull(pred));
    }

    /**
     * The classification of the given limit ordinal.
     */
    public static Classification limit(Ordinal value) {
        return new Limit(requireNonNull(value));
    }

    public boolean isZero() {
        return false;
    }

    public boolean isSucc() {
        return false;
    }

    public boolean isLimit() {
        return false;
    }

    /**
     * Returns the predecessor of a successor ordinal.
     *
     * @throws NoSuchElementException if the classified ordinal is not a successor
     */
    public Ordinal pred() {
        throw new NoSuchElementException(this + " has no predecessor");
    }

    /**
     * Case analysis on the shape. The successor branch receives the
     * predecessor, the limit branch receives the limit ordinal itself.
     */
    public abstract <R> R fold(Supplier<? extends R> zero,
                               Function<? super Ordinal, ? extends R> succ,
                               Function<? super Ordinal, ? extends R> limit);
}
