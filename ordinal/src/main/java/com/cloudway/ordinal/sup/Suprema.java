/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.ordinal.sup;

import java.util.HashSet;
import java.util.Set;
import java.util.function.Function;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;

import com.cloudway.ordinal.NonComputableException;
import com.cloudway.ordinal.arith.OrdinalFunction;
import com.cloudway.ordinal.data.Ordinal;

import static java.util.Objects.requireNonNull;
import static com.cloudway.ordinal.data.Ordinal.ZERO;

/**
 * Suprema, least strict upper bounds and minimum excluded values of ordinal
 * families.
 *
 * <p>A family is either a function on an index collection, or a function on
 * the ordinals below a bound. An empty family has supremum, least strict
 * upper bound and minimum excluded value zero.</p>
 *
 * <p>For a bound {@code o = δ + n}, with {@code δ} zero or a limit and
 * {@code n} finite, the ordinals {@code δ, δ+1, ..., δ+n-1} are enumerated
 * as an index collection. The ordinals below {@code δ} are covered by the
 * family's limit witness (see {@link OrdinalFunction#supBelow}).</p>
 */
public final class Suprema {
    private Suprema() {}

    /**
     * Returns the least ordinal that is {@code ≥ f(i)} for every index.
     */
    public static <I> Ordinal sup(Iterable<? extends I> index, Function<? super I, Ordinal> f) {
        Ordinal result = ZERO;
        for (I i : index) {
            result = Ordinal.max(result, f.apply(i));
        }
        return result;
    }

    /**
     * Returns the least ordinal that is {@code ≥} every given value.
     */
    public static Ordinal sup(Iterable<Ordinal> values) {
        return sup(values, Function.identity());
    }

    /**
     * Returns the least ordinal that is {@code >} {@code f(i)} for every
     * index, i.e. {@code sup (succ ∘ f)}.
     */
    public static <I> Ordinal lsub(Iterable<? extends I> index, Function<? super I, Ordinal> f) {
        return Suprema.<I>sup(index, i -> f.apply(i).succ());
    }

    /**
     * Returns the least ordinal that is {@code >} every given value.
     */
    public static Ordinal lsub(Iterable<Ordinal> values) {
        return lsub(values, Function.identity());
    }

    /**
     * Returns the supremum of {@code f(a)} over all {@code a < o}.
     *
     * @throws NonComputableException if {@code o} is infinite and {@code f}
     * has no limit witness
     */
    public static Ordinal bsup(Ordinal o, OrdinalFunction f) {
        Ordinal base = o.limitPart();
        Ordinal tail = sup(run(base, o.finitePart()), f);
        return base.isZero() ? tail : Ordinal.max(f.supBelow(base), tail);
    }

    /**
     * Returns the least strict upper bound of {@code f(a)} over all {@code a < o}.
     *
     * @throws NonComputableException if {@code o} is infinite and {@code f}
     * has no limit witness
     */
    public static Ordinal blsub(Ordinal o, OrdinalFunction f) {
        return bsup(o, f.thenSucc());
    }

    /**
     * Returns the least ordinal that is not a value of {@code f}.
     */
    public static <I> Ordinal mex(Iterable<? extends I> index, Function<? super I, Ordinal> f) {
        Set<Ordinal> range = new HashSet<>();
        for (I i : index) {
            range.add(f.apply(i));
        }

        // a finite range always misses a natural number
        Ordinal a = ZERO;
        while (range.contains(a)) {
            a = a.succ();
        }
        return a;
    }

    /**
     * Returns the least ordinal that is not among the given values.
     */
    public static Ordinal mex(Iterable<Ordinal> values) {
        return mex(values, Function.identity());
    }

    /**
     * Returns the least ordinal that is not {@code f(a)} for any {@code a < o}.
     *
     * @throws NonComputableException if {@code o} is infinite
     */
    public static Ordinal bmex(Ordinal o, Function<? super Ordinal, Ordinal> f) {
        return mex(familyOf(o), f);
    }

    /**
     * Returns the ordinals below a finite bound in increasing order, the
     * index collection that carries a bounded family.
     *
     * @throws NonComputableException if {@code o} is infinite
     */
    public static ImmutableList<Ordinal> familyOf(Ordinal o) {
        if (!o.isFinite())
            throw new NonComputableException("infinitely many ordinals below " + o);
        return ImmutableList.copyOf(run(ZERO, o.natValue()));
    }

    /**
     * Returns the ordinals {@code base, base+1, ..., base+n-1}.
     */
    static Iterable<Ordinal> run(Ordinal base, long n) {
        requireNonNull(base);
        return () -> new AbstractIterator<Ordinal>() {
            private Ordinal next = base;
            private long remaining = n;

            @Override
            protected Ordinal computeNext() {
                if (remaining <= 0)
                    return endOfData();
                Ordinal result = next;
                remaining--;
                if (remaining > 0)
                    next = next.succ();
                return result;
            }
        };
    }
}
