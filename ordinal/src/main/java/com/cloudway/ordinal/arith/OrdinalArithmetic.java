/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.ordinal.arith;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.math.LongMath;

import com.cloudway.ordinal.control.LimitRecursion;
import com.cloudway.ordinal.control.LimitRecursion.LimitCase;
import com.cloudway.ordinal.control.LimitRecursion.SuccCase;
import com.cloudway.ordinal.data.Ordinal;
import com.cloudway.ordinal.data.Ordinal.Term;
import com.cloudway.ordinal.data.OrdinalClassifier;

import static java.util.Objects.requireNonNull;
import static com.cloudway.ordinal.data.Ordinal.ZERO;

/**
 * Ordinal arithmetic. Addition and multiplication are defined by limit
 * recursion on the right operand; subtraction, division and remainder are
 * defined as least solutions of their defining inequalities.
 *
 * <p>All operations are total: {@code a - b = 0} when {@code b ≥ a},
 * {@code a / 0 = 0} and {@code a % 0 = a}.</p>
 */
public final class OrdinalArithmetic {
    private OrdinalArithmetic() {}

    private static <R> LimitRecursion<R> recursion(R zero, SuccCase<R> succ, LimitCase<R> limit) {
        // each limit step asks for a single smaller value, nothing to memoize
        return new LimitRecursion<>(zero, succ, limit, false, 0);
    }

    public static Ordinal succ(Ordinal a) {
        return a.succ();
    }

    /**
     * Returns the predecessor of a successor ordinal, or the ordinal itself
     * when it is zero or a limit.
     */
    public static Ordinal pred(Ordinal a) {
        return OrdinalClassifier.pred(a);
    }

    /**
     * Returns {@code a + b}.
     *
     * <pre>
     *     a + 0      = a
     *     a + succ b = succ (a + b)
     *     a + b      = sup { a + b' | b' < b }     for limit b
     * </pre>
     *
     * The limit case splits {@code b = β + ω^γ·c} and evaluates
     * {@code (a + β) + ω^γ·c}, which is that supremum.
     */
    public static Ordinal add(Ordinal a, Ordinal b) {
        requireNonNull(a);
        SuccCase<Ordinal> step = new SuccCase<Ordinal>() {
            @Override
            public Ordinal apply(Ordinal pred, Ordinal result) {
                return result.succ();
            }

            @Override
            public Ordinal iterate(Ordinal pred, Ordinal result, long n) {
                return result.plusOmegaPower(ZERO, n);
            }
        };

        return recursion(a, step, (o, below) -> {
            Term t = o.lastTerm();
            return below.apply(o.dropLastTerm()).plusOmegaPower(t.exponent(), t.coefficient());
        }).apply(b);
    }

    /**
     * Returns the least {@code o} such that {@code b + o ≥ a}. The result is
     * zero when {@code b ≥ a}, and otherwise the unique {@code o} with
     * {@code b + o = a}, read off the normal forms of both operands.
     */
    public static Ordinal sub(Ordinal a, Ordinal b) {
        if (b.compareTo(a) >= 0)
            return ZERO;

        List<Term> at = a.terms(), bt = b.terms();
        int k = 0;
        while (k < bt.size() && at.get(k).equals(bt.get(k)))
            k++;
        if (k == bt.size())
            return Ordinal.fromTerms(at.subList(k, at.size()));

        // b < a, so the first differing term of a is the larger one
        Term x = at.get(k), y = bt.get(k);
        if (x.exponent().equals(y.exponent())) {
            return Ordinal.fromTerms(ImmutableList.<Term>builder()
                .add(Ordinal.term(x.exponent(), x.coefficient() - y.coefficient()))
                .addAll(at.subList(k + 1, at.size()))
                .build());
        } else {
            return Ordinal.fromTerms(at.subList(k, at.size()));
        }
    }

    /**
     * Returns {@code a * b}.
     *
     * <pre>
     *     a * 0      = 0
     *     a * succ b = a * b + a
     *     a * b      = sup { a * b' | b' < b }      for limit b
     * </pre>
     *
     * The limit case splits {@code b = β + ω^γ·c} and evaluates
     * {@code a * β + ω^(e + γ)·c}, where {@code ω^e} is the leading power
     * of a nonzero {@code a}.
     */
    public static Ordinal mul(Ordinal a, Ordinal b) {
        requireNonNull(a);
        SuccCase<Ordinal> step = new SuccCase<Ordinal>() {
            @Override
            public Ordinal apply(Ordinal pred, Ordinal result) {
                return add(result, a);
            }

            @Override
            public Ordinal iterate(Ordinal pred, Ordinal result, long n) {
                return add(result, timesNat(a, n));
            }
        };

        return recursion(ZERO, step, (o, below) -> {
            Ordinal prefix = below.apply(o.dropLastTerm());
            if (a.isZero())
                return prefix;
            Term t = o.lastTerm();
            return add(prefix, Ordinal.omegaPow(add(a.leadingExponent(), t.exponent()), t.coefficient()));
        }).apply(b);
    }

    // a + a + ... + a (n times) = ω^e·(c*n) + rest
    private static Ordinal timesNat(Ordinal a, long n) {
        if (a.isZero() || n == 0)
            return ZERO;
        List<Term> ts = a.terms();
        Term lead = ts.get(0);
        return Ordinal.fromTerms(ImmutableList.<Term>builder()
            .add(Ordinal.term(lead.exponent(), LongMath.checkedMultiply(lead.coefficient(), n)))
            .addAll(ts.subList(1, ts.size()))
            .build());
    }

    /**
     * Returns the least {@code o} such that {@code a < b * succ(o)}, or zero
     * when {@code b} is zero.
     */
    public static Ordinal div(Ordinal a, Ordinal b) {
        if (b.isZero() || a.lessThan(b))
            return ZERO;

        Ordinal alpha = a.leadingExponent();
        Ordinal beta = b.leadingExponent();
        if (alpha.compareTo(beta) > 0) {
            // b * ω^ε·c = ω^α·c when β + ε = α and ε > 0
            Ordinal eps = sub(alpha, beta);
            return add(Ordinal.omegaPow(eps, a.leadingCoefficient()), div(a.dropLeadingTerm(), b));
        }

        long k = a.leadingCoefficient() / b.leadingCoefficient();
        if (mul(b, Ordinal.of(k)).compareTo(a) > 0)
            k--;
        return Ordinal.of(k);
    }

    /**
     * Returns {@code a - b * (a / b)}, which is {@code a} when {@code b} is zero.
     */
    public static Ordinal mod(Ordinal a, Ordinal b) {
        if (b.isZero())
            return a;
        return sub(a, mul(b, div(a, b)));
    }

    /**
     * Returns true if {@code a = b * c} for some ordinal {@code c}.
     */
    public static boolean dvd(Ordinal b, Ordinal a) {
        return b.isZero() ? a.isZero() : mod(a, b).isZero();
    }
}
