/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.ordinal.arith;

import java.util.function.Function;

import com.cloudway.ordinal.NonComputableException;
import com.cloudway.ordinal.data.Ordinal;

import static java.util.Objects.requireNonNull;

/**
 * A function from ordinals to ordinals, used as a family indexed by the
 * ordinals below some bound.
 *
 * <p>A family over an infinite bound needs a limit witness: the supremum of
 * its values below a limit ordinal, and whether that supremum is attained.
 * A plain lambda has no witness and can only be used over finite bounds.</p>
 */
@FunctionalInterface
public interface OrdinalFunction extends Function<Ordinal, Ordinal> {
    @Override
    Ordinal apply(Ordinal a);

    /**
     * Returns {@code sup { f(a) | a < limit }} for a limit ordinal.
     *
     * @throws NonComputableException if this function has no limit witness
     */
    default Ordinal supBelow(Ordinal limit) {
        throw new NonComputableException("no limit witness for the supremum below " + limit);
    }

    /**
     * Returns true if {@link #supBelow(Ordinal)} equals {@code f(a)} for some
     * {@code a < limit}.
     *
     * @throws NonComputableException if this function has no limit witness
     */
    default boolean attainsSupBelow(Ordinal limit) {
        throw new NonComputableException("no limit witness for the supremum below " + limit);
    }

    /**
     * Returns {@code succ ∘ f}, carrying over the limit witness.
     */
    default OrdinalFunction thenSucc() {
        OrdinalFunction f = this;
        return new OrdinalFunction() {
            @Override
            public Ordinal apply(Ordinal a) {
                return f.apply(a).succ();
            }

            @Override
            public Ordinal supBelow(Ordinal limit) {
                Ordinal s = f.supBelow(limit);
                return f.attainsSupBelow(limit) ? s.succ() : s;
            }

            @Override
            public boolean attainsSupBelow(Ordinal limit) {
                return f.attainsSupBelow(limit);
            }
        };
    }

    /**
     * Returns a function that always yields {@code c}.
     */
    static OrdinalFunction constant(Ordinal c) {
        requireNonNull(c);
        return new OrdinalFunction() {
            @Override
            public Ordinal apply(Ordinal a) {
                return c;
            }

            @Override
            public Ordinal supBelow(Ordinal limit) {
                return c;
            }

            @Override
            public boolean attainsSupBelow(Ordinal limit) {
                return true;
            }

            public String toString() {
                return "const " + c;
            }
        };
    }

    /**
     * Adapts a plain function. The result has no limit witness.
     */
    static OrdinalFunction of(Function<? super Ordinal, Ordinal> f) {
        requireNonNull(f);
        return f::apply;
    }

    /**
     * Adapts a monotone function together with its limit witness.
     *
     * @param f the function
     * @param supBelow the supremum of {@code f} below a limit ordinal
     * @param attained true if that supremum is a value of {@code f} below the limit
     */
    static OrdinalFunction of(Function<? super Ordinal, Ordinal> f,
                              Function<? super Ordinal, Ordinal> supBelow,
                              boolean attained) {
        requireNonNull(f);
        requireNonNull(supBelow);
        return new OrdinalFunction() {
            @Override
            public Ordinal apply(Ordinal a) {
                return f.apply(a);
            }

            @Override
            public Ordinal supBelow(Ordinal limit) {
                return supBelow.apply(limit);
            }

            @Override
            public boolean attainsSupBelow(Ordinal limit) {
                return attained;
            }
        };
    }
}
