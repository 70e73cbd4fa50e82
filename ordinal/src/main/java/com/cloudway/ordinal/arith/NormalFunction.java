/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.ordinal.arith;

import java.util.Iterator;
import java.util.function.Function;

import com.cloudway.ordinal.data.Ordinal;
import com.cloudway.ordinal.sup.Suprema;

import static java.util.Objects.requireNonNull;

/**
 * A normal function is strictly increasing and continuous at limits:
 *
 * <pre>
 *     f(a) < f(succ a)
 *     f(o) = sup { f(a) | a < o }      for limit o
 * </pre>
 *
 * <p>Normality is a property of the wrapped function, it is not checked.
 * Continuity gives every normal function a limit witness: the supremum
 * below a limit is the value at the limit, and it is never attained.</p>
 */
public abstract class NormalFunction implements OrdinalFunction {
    private final String name;

    protected NormalFunction(String name) {
        this.name = requireNonNull(name);
    }

    /**
     * Wrap a function that is known to be normal.
     */
    public static NormalFunction of(String name, Function<? super Ordinal, Ordinal> f) {
        requireNonNull(f);
        return new NormalFunction(name) {
            @Override
            public Ordinal apply(Ordinal a) {
                return f.apply(a);
            }
        };
    }

    private static final NormalFunction IDENTITY = of("x ↦ x", x -> x);

    private static final NormalFunction OMEGA_POW = of("x ↦ ω^x", Ordinal::omegaPow);

    public static NormalFunction identity() {
        return IDENTITY;
    }

    /**
     * Returns {@code x ↦ a + x}.
     */
    public static NormalFunction add(Ordinal a) {
        requireNonNull(a);
        return of("x ↦ " + a + " + x", x -> OrdinalArithmetic.add(a, x));
    }

    /**
     * Returns {@code x ↦ a * x}.
     *
     * @throws IllegalArgumentException if {@code a} is zero
     */
    public static NormalFunction mul(Ordinal a) {
        if (a.isZero())
            throw new IllegalArgumentException("multiplication by zero is not normal");
        return of("x ↦ " + a + " * x", x -> OrdinalArithmetic.mul(a, x));
    }

    /**
     * Returns {@code x ↦ ω^x}.
     */
    public static NormalFunction omegaPow() {
        return OMEGA_POW;
    }

    @Override
    public final Ordinal supBelow(Ordinal limit) {
        if (!limit.isLimit())
            throw new IllegalArgumentException("not a limit: " + limit);
        return apply(limit);
    }

    @Override
    public final boolean attainsSupBelow(Ordinal limit) {
        return false;
    }

    /**
     * Returns {@code this ∘ g}, which is normal again.
     */
    public NormalFunction compose(NormalFunction g) {
        NormalFunction f = this;
        return of(f.name + " ∘ " + g.name, x -> f.apply(g.apply(x)));
    }

    /**
     * Returns true if {@code f(a) = a}.
     */
    public boolean isFixedPoint(Ordinal a) {
        return apply(a).equals(a);
    }

    /**
     * Returns true if {@code f(a) ≤ a}. Since a normal function satisfies
     * {@code a ≤ f(a)}, this holds exactly at fixed points.
     */
    public boolean isBoundedBySelf(Ordinal a) {
        return apply(a).lessOrEqual(a);
    }

    /**
     * Returns {@code f(sup g)}, which equals {@code sup (f ∘ g)} for a
     * nonempty family {@code g}.
     *
     * @throws IllegalArgumentException if the index is empty
     */
    public <I> Ordinal applySup(Iterable<? extends I> index, Function<? super I, Ordinal> g) {
        Iterator<? extends I> it = index.iterator();
        if (!it.hasNext())
            throw new IllegalArgumentException("empty family");
        return apply(Suprema.<I>sup(index, g));
    }

    public String toString() {
        return name;
    }
}
