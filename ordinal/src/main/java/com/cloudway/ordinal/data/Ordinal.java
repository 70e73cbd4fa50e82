/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.ordinal.data;

import java.io.Serializable;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import com.google.common.collect.ImmutableList;
import com.google.common.math.LongMath;

import com.cloudway.ordinal.arith.OrdinalArithmetic;

import static java.util.Objects.requireNonNull;

/**
 * This class represents an ordinal number below epsilon-zero, written in
 * Cantor normal form:
 *
 * <pre>
 *     ω^e1·c1 + ω^e2·c2 + ... + ω^ek·ck      (e1 > e2 > ... > ek, ci ≥ 1)
 * </pre>
 *
 * <p>The exponents are themselves ordinals and the coefficients are positive
 * {@code long} values. Ordinals are immutable values; the natural ordering
 * is the ordinal ordering, which is a well-order.</p>
 */
public final class Ordinal implements Comparable<Ordinal>, Serializable {
    private static final long serialVersionUID = -3188504321873447126L;

    /**
     * A single term {@code ω^exponent·coefficient} of the normal form.
     */
    public static final class Term implements Serializable {
        private static final long serialVersionUID = 4719936870253513016L;

        private final Ordinal exponent;
        private final long coefficient;

        Term(Ordinal exponent, long coefficient) {
            this.exponent = exponent;
            this.coefficient = coefficient;
        }

        public Ordinal exponent() {
            return exponent;
        }

        public long coefficient() {
            return coefficient;
        }

        Term withCoefficient(long c) {
            return new Term(exponent, c);
        }

        int compareTo(Term that) {
            int c = this.exponent.compareTo(that.exponent);
            return c != 0 ? c : Long.compare(this.coefficient, that.coefficient);
        }

        @Override
        public boolean equals(Object obj) {
            if (obj instanceof Term) {
                Term that = (Term)obj;
                return coefficient == that.coefficient && exponent.equals(that.exponent);
            } else {
                return false;
            }
        }

        @Override
        public int hashCode() {
            return exponent.hashCode() * 31 + Long.hashCode(coefficient);
        }

        @Override
        public String toString() {
            return show(exponent, coefficient);
        }
    }

    /**
     * The ordinal zero, the empty sum.
     */
    public static final Ordinal ZERO = new Ordinal(ImmutableList.of());

    /**
     * The ordinal one ({@code ω^0}).
     */
    public static final Ordinal ONE = new Ordinal(ImmutableList.of(new Term(ZERO, 1)));

    /**
     * The least infinite ordinal ({@code ω^1}).
     */
    public static final Ordinal OMEGA = new Ordinal(ImmutableList.of(new Term(ONE, 1)));

    // terms in strictly decreasing exponent order, all coefficients positive
    private final ImmutableList<Term> terms;

    private transient int hash;

    private Ordinal(ImmutableList<Term> terms) {
        this.terms = terms;
    }

    /**
     * Returns the finite ordinal for the given natural number.
     *
     * @param n the natural number
     * @return the finite ordinal {@code n}
     * @throws IllegalArgumentException if {@code n} is negative
     */
    public static Ordinal of(long n) {
        if (n < 0)
            throw new IllegalArgumentException("negative ordinal: " + n);
        if (n == 0)
            return ZERO;
        if (n == 1)
            return ONE;
        return new Ordinal(ImmutableList.of(new Term(ZERO, n)));
    }

    /**
     * Returns {@code ω^exponent}.
     */
    public static Ordinal omegaPow(Ordinal exponent) {
        return omegaPow(exponent, 1);
    }

    /**
     * Returns {@code ω^exponent·coefficient}.
     *
     * @throws IllegalArgumentException if {@code coefficient} is negative
     */
    public static Ordinal omegaPow(Ordinal exponent, long coefficient) {
        requireNonNull(exponent);
        if (coefficient < 0)
            throw new IllegalArgumentException("negative coefficient: " + coefficient);
        if (coefficient == 0)
            return ZERO;
        return new Ordinal(ImmutableList.of(new Term(exponent, coefficient)));
    }

    /**
     * Returns {@code ω^n} for a natural number {@code n}.
     */
    public static Ordinal omegaPow(long n) {
        return omegaPow(of(n));
    }

    /**
     * Builds an ordinal from the given terms, which must already be in Cantor
     * normal form order.
     *
     * @throws IllegalArgumentException if the terms are not in strictly
     * decreasing exponent order or a coefficient is not positive
     */
    public static Ordinal fromTerms(List<Term> terms) {
        ImmutableList<Term> ts = ImmutableList.copyOf(terms);
        for (int i = 0; i < ts.size(); i++) {
            Term t = ts.get(i);
            if (t.coefficient <= 0)
                throw new IllegalArgumentException("coefficient must be positive: " + t);
            if (i > 0 && ts.get(i - 1).exponent.compareTo(t.exponent) <= 0)
                throw new IllegalArgumentException("terms are not in normal form: " + ts);
        }
        return ts.isEmpty() ? ZERO : new Ordinal(ts);
    }

    /**
     * Creates a single term, to be used with {@link #fromTerms(List)}.
     */
    public static Term term(Ordinal exponent, long coefficient) {
        return new Term(requireNonNull(exponent), coefficient);
    }

    /**
     * Returns the terms of the normal form, highest exponent first.
     */
    public ImmutableList<Term> terms() {
        return terms;
    }

    public boolean isZero() {
        return terms.isEmpty();
    }

    /**
     * Returns true if this ordinal is a natural number.
     */
    public boolean isFinite() {
        return terms.isEmpty() || (terms.size() == 1 && terms.get(0).exponent.isZero());
    }

    /**
     * Returns true if this ordinal is the successor of another ordinal.
     */
    public boolean isSuccessor() {
        return !terms.isEmpty() && last().exponent.isZero();
    }

    /**
     * Returns true if this ordinal is neither zero nor a successor.
     */
    public boolean isLimit() {
        return !terms.isEmpty() && !last().exponent.isZero();
    }

    /**
     * Returns the natural number value of a finite ordinal.
     *
     * @throws NoSuchElementException if this ordinal is infinite
     */
    public long natValue() {
        if (!isFinite())
            throw new NoSuchElementException("infinite ordinal: " + this);
        return terms.isEmpty() ? 0 : terms.get(0).coefficient;
    }

    /**
     * Returns the successor {@code this + 1}.
     */
    public Ordinal succ() {
        if (isSuccessor()) {
            Term t = last();
            return replaceLast(t.withCoefficient(LongMath.checkedAdd(t.coefficient, 1)));
        } else {
            return append(new Term(ZERO, 1));
        }
    }

    /**
     * Returns the immediate predecessor of a successor ordinal.
     *
     * @throws NoSuchElementException if this ordinal is zero or a limit
     */
    public Ordinal predecessor() {
        if (!isSuccessor())
            throw new NoSuchElementException("not a successor: " + this);
        Term t = last();
        return t.coefficient == 1 ? dropLast() : replaceLast(t.withCoefficient(t.coefficient - 1));
    }

    /**
     * Returns the part of this ordinal above its finite tail, which is zero
     * or a limit ordinal.
     */
    public Ordinal limitPart() {
        return isSuccessor() ? dropLast() : this;
    }

    /**
     * Returns the finite tail {@code n} such that {@code this = limitPart() + n}.
     */
    public long finitePart() {
        return isSuccessor() ? last().coefficient : 0;
    }

    /**
     * Returns the exponent of the leading term, zero for the ordinal zero.
     */
    public Ordinal leadingExponent() {
        return terms.isEmpty() ? ZERO : terms.get(0).exponent;
    }

    /**
     * Returns the coefficient of the leading term, zero for the ordinal zero.
     */
    public long leadingCoefficient() {
        return terms.isEmpty() ? 0 : terms.get(0).coefficient;
    }

    /**
     * Returns this ordinal with its leading term removed.
     */
    public Ordinal dropLeadingTerm() {
        return terms.size() <= 1 ? ZERO : new Ordinal(terms.subList(1, terms.size()));
    }

    /**
     * Returns the exponent {@code γ > 0} of the last term of a limit ordinal.
     *
     * @throws NoSuchElementException if this ordinal is not a limit
     */
    public Ordinal lastExponent() {
        if (!isLimit())
            throw new NoSuchElementException("not a limit: " + this);
        return last().exponent;
    }

    /**
     * Returns the last term of the normal form.
     *
     * @throws NoSuchElementException if this ordinal is zero
     */
    public Term lastTerm() {
        if (terms.isEmpty())
            throw new NoSuchElementException("zero has no terms");
        return last();
    }

    /**
     * Returns this ordinal with its last term removed. For a limit ordinal
     * {@code o = β + ω^γ·c}, this is {@code β} and {@code β < o}.
     */
    public Ordinal dropLastTerm() {
        return terms.isEmpty() ? ZERO : dropLast();
    }

    /**
     * Returns {@code this + ω^e}. Terms with an exponent below {@code e}
     * are absorbed.
     */
    public Ordinal plusOmegaPower(Ordinal e) {
        requireNonNull(e);
        ImmutableList.Builder<Term> b = ImmutableList.builder();
        for (Term t : terms) {
            int c = t.exponent.compareTo(e);
            if (c > 0) {
                b.add(t);
            } else {
                if (c == 0) {
                    return new Ordinal(b.add(t.withCoefficient(LongMath.checkedAdd(t.coefficient, 1))).build());
                }
                break;
            }
        }
        return new Ordinal(b.add(new Term(e, 1)).build());
    }

    /**
     * Returns {@code this + ω^e·c}, absorbing lower terms.
     */
    public Ordinal plusOmegaPower(Ordinal e, long c) {
        if (c <= 0)
            return this;
        Ordinal r = plusOmegaPower(e);
        Term t = r.last();
        return r.replaceLast(t.withCoefficient(LongMath.checkedAdd(t.coefficient, c - 1)));
    }

    // Arithmetic shortcuts

    public Ordinal add(Ordinal that) {
        return OrdinalArithmetic.add(this, that);
    }

    public Ordinal subtract(Ordinal that) {
        return OrdinalArithmetic.sub(this, that);
    }

    public Ordinal multiply(Ordinal that) {
        return OrdinalArithmetic.mul(this, that);
    }

    public Ordinal divide(Ordinal that) {
        return OrdinalArithmetic.div(this, that);
    }

    public Ordinal remainder(Ordinal that) {
        return OrdinalArithmetic.mod(this, that);
    }

    public Ordinal add(long n) {
        return add(of(n));
    }

    public Ordinal multiply(long n) {
        return multiply(of(n));
    }

    public static Ordinal max(Ordinal a, Ordinal b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static Ordinal min(Ordinal a, Ordinal b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public boolean lessThan(Ordinal that) {
        return compareTo(that) < 0;
    }

    public boolean lessOrEqual(Ordinal that) {
        return compareTo(that) <= 0;
    }

    private Term last() {
        return terms.get(terms.size() - 1);
    }

    private Ordinal dropLast() {
        return terms.size() == 1 ? ZERO : new Ordinal(terms.subList(0, terms.size() - 1));
    }

    private Ordinal replaceLast(Term t) {
        return new Ordinal(ImmutableList.<Term>builder()
                               .addAll(terms.subList(0, terms.size() - 1))
                               .add(t)
                               .build());
    }

    private Ordinal append(Term t) {
        return new Ordinal(ImmutableList.<Term>builder().addAll(terms).add(t).build());
    }

    /**
     * Compares two ordinals lexicographically on their terms.
     */
    @Override
    public int compareTo(Ordinal that) {
        if (this == that)
            return 0;
        Iterator<Term> i = this.terms.iterator();
        Iterator<Term> j = that.terms.iterator();
        while (i.hasNext() && j.hasNext()) {
            int c = i.next().compareTo(j.next());
            if (c != 0)
                return c;
        }
        return i.hasNext() ? 1 : j.hasNext() ? -1 : 0;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj instanceof Ordinal) {
            Ordinal that = (Ordinal)obj;
            return this.hashCode() == that.hashCode() && this.terms.equals(that.terms);
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0 && !terms.isEmpty()) {
            h = terms.hashCode();
            hash = h;
        }
        return h;
    }

    /**
     * Returns the normal form, e.g. {@code ω^ω·2 + ω + 3}.
     */
    @Override
    public String toString() {
        if (terms.isEmpty())
            return "0";
        StringBuilder buf = new StringBuilder();
        for (Term t : terms) {
            if (buf.length() != 0)
                buf.append(" + ");
            buf.append(show(t.exponent, t.coefficient));
        }
        return buf.toString();
    }

    static String show(Ordinal exponent, long coefficient) {
        if (exponent.isZero())
            return Long.toString(coefficient);

        String base;
        if (exponent.equals(ONE)) {
            base = "ω";
        } else if (exponent.terms.size() == 1 && exponent.isFinite() || exponent.equals(OMEGA)) {
            base = "ω^" + exponent;
        } else {
            base = "ω^(" + exponent + ")";
        }
        return coefficient == 1 ? base : base + "·" + coefficient;
    }
}
