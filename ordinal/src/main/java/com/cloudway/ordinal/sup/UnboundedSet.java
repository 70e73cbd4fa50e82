/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.ordinal.sup;

import java.util.function.Predicate;
import java.util.logging.Logger;

import com.cloudway.ordinal.NonComputableException;
import com.cloudway.ordinal.arith.OrdinalArithmetic;
import com.cloudway.ordinal.data.Ordinal;
import com.cloudway.ordinal.util.Config;

import static java.util.Objects.requireNonNull;
import static com.cloudway.ordinal.data.Ordinal.ONE;
import static com.cloudway.ordinal.data.Ordinal.OMEGA;

/**
 * A set of ordinals that no ordinal bounds from above: for every {@code a}
 * there is a member {@code s ≥ a}. Unboundedness cannot be checked and is
 * a precondition of every implementation.
 */
public abstract class UnboundedSet {
    private static final Logger logger = Logger.getLogger(UnboundedSet.class.getName());

    /**
     * Returns true if {@code a} is a member of this set.
     */
    public abstract boolean contains(Ordinal a);

    /**
     * Returns the least member that is {@code ≥ a}.
     */
    public abstract Ordinal ceiling(Ordinal a);

    /**
     * Returns the supremum of the first {@code limit} members of this set,
     * for a limit ordinal {@code limit}.
     *
     * @throws NonComputableException if this set does not know its
     * enumeration at limits
     */
    public Ordinal enumerationLimit(Ordinal limit) {
        throw new NonComputableException(this + " cannot be enumerated up to " + limit);
    }

    /**
     * Returns the set of ordinals satisfying the given predicate. Members are
     * found by successor search from the requested lower bound, taking at
     * most the configured number of steps.
     */
    public static UnboundedSet of(String name, Predicate<? super Ordinal> predicate) {
        return of(name, predicate, Config.getDefault().getSearchLimit());
    }

    public static UnboundedSet of(String name, Predicate<? super Ordinal> predicate, int searchLimit) {
        return new PredicateSet(requireNonNull(name), requireNonNull(predicate), searchLimit);
    }

    /**
     * Returns the set {@code { m * k | k }} of left multiples of {@code m}.
     *
     * @throws IllegalArgumentException if {@code m} is zero
     */
    public static UnboundedSet multiplesOf(Ordinal m) {
        if (m.isZero())
            throw new IllegalArgumentException("multiples of zero are bounded");
        return new Multiples(m);
    }

    /**
     * Returns the set of limit ordinals.
     */
    public static UnboundedSet limits() {
        return LIMITS;
    }

    /**
     * Returns the set of successor ordinals.
     */
    public static UnboundedSet successors() {
        return SUCCESSORS;
    }

    /**
     * Returns the set {@code { ω^a | a }}, the ordinals that are closed under
     * addition.
     */
    public static UnboundedSet additivePrincipals() {
        return PRINCIPALS;
    }

    private static final class PredicateSet extends UnboundedSet {
        private final String name;
        private final Predicate<? super Ordinal> predicate;
        private final int searchLimit;

        PredicateSet(String name, Predicate<? super Ordinal> predicate, int searchLimit) {
            this.name = name;
            this.predicate = predicate;
            this.searchLimit = searchLimit;
        }

        @Override
        public boolean contains(Ordinal a) {
            return predicate.test(a);
        }

        @Override
        public Ordinal ceiling(Ordinal a) {
            Ordinal x = a;
            for (long steps = 0; steps <= searchLimit; steps++) {
                if (predicate.test(x)) {
                    Ordinal found = x;
                    logger.finer(() -> "ceiling of " + a + " in " + name + " is " + found);
                    return found;
                }
                x = x.succ();
            }
            throw new NonComputableException("no member of " + name + " within " +
                                             searchLimit + " successors of " + a);
        }

        public String toString() {
            return name;
        }
    }

    private static final class Multiples extends UnboundedSet {
        private final Ordinal m;

        Multiples(Ordinal m) {
            this.m = m;
        }

        @Override
        public boolean contains(Ordinal a) {
            return OrdinalArithmetic.dvd(m, a);
        }

        @Override
        public Ordinal ceiling(Ordinal a) {
            // a = m * q + r with r < m, and m * succ q is the next multiple
            return contains(a) ? a : OrdinalArithmetic.mul(m, OrdinalArithmetic.div(a, m).succ());
        }

        @Override
        public Ordinal enumerationLimit(Ordinal limit) {
            return OrdinalArithmetic.mul(m, limit);
        }

        public String toString() {
            return "multiples of " + m;
        }
    }

    private static final UnboundedSet LIMITS = new UnboundedSet() {
        @Override
        public boolean contains(Ordinal a) {
            return a.isLimit();
        }

        @Override
        public Ordinal ceiling(Ordinal a) {
            return a.isLimit() ? a : a.limitPart().plusOmegaPower(ONE);
        }

        @Override
        public Ordinal enumerationLimit(Ordinal limit) {
            // the members are ω * (1 + a), and 1 + λ = λ
            return OrdinalArithmetic.mul(OMEGA, limit);
        }

        public String toString() {
            return "limits";
        }
    };

    private static final UnboundedSet SUCCESSORS = new UnboundedSet() {
        @Override
        public boolean contains(Ordinal a) {
            return a.isSuccessor();
        }

        @Override
        public Ordinal ceiling(Ordinal a) {
            return a.isSuccessor() ? a : a.succ();
        }

        @Override
        public Ordinal enumerationLimit(Ordinal limit) {
            // the members are a + 1
            return limit;
        }

        public String toString() {
            return "successors";
        }
    };

    private static final UnboundedSet PRINCIPALS = new UnboundedSet() {
        @Override
        public boolean contains(Ordinal a) {
            return a.terms().size() == 1 && a.leadingCoefficient() == 1;
        }

        @Override
        public Ordinal ceiling(Ordinal a) {
            if (a.isZero())
                return ONE;
            return contains(a) ? a : Ordinal.omegaPow(a.leadingExponent().succ());
        }

        @Override
        public Ordinal enumerationLimit(Ordinal limit) {
            return Ordinal.omegaPow(limit);
        }

        public String toString() {
            return "additive principals";
        }
    };
}
