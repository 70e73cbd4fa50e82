/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.ordinal.sup;

import java.util.logging.Logger;

import com.cloudway.ordinal.arith.OrdinalFunction;
import com.cloudway.ordinal.control.LimitRecursion;
import com.cloudway.ordinal.data.Ordinal;
import com.cloudway.ordinal.util.Config;

import static java.util.Objects.requireNonNull;
import static com.cloudway.ordinal.data.Ordinal.ZERO;

/**
 * The enumeration of an unbounded set: the unique strictly increasing
 * function from the ordinals onto the set.
 *
 * <pre>
 *     enumOrd(o) = least s ∈ S with s ≥ blsub(o, enumOrd restricted below o)
 * </pre>
 *
 * <p>At a successor {@code succ p} the bound is {@code succ(enumOrd(p))},
 * because the enumeration is strictly increasing. At a limit the bound is
 * the set's {@link UnboundedSet#enumerationLimit enumeration limit}.</p>
 */
public final class EnumOrd implements OrdinalFunction {
    private static final Logger logger = Logger.getLogger(EnumOrd.class.getName());

    private final UnboundedSet set;
    private final LimitRecursion<Ordinal> recursion;

    public EnumOrd(UnboundedSet set) {
        this(set, Config.getDefault());
    }

    public EnumOrd(UnboundedSet set, Config config) {
        this.set = requireNonNull(set);
        this.recursion = new LimitRecursion<Ordinal>(
            set.ceiling(ZERO),
            (pred, value) -> set.ceiling(value.succ()),
            (limit, below) -> set.ceiling(
                Suprema.blsub(limit, OrdinalFunction.of(below, set::enumerationLimit, false))),
            config);
        logger.fine(() -> "enumerating " + set);
    }

    /**
     * Returns the enumeration of the given set.
     */
    public static EnumOrd enumOrd(UnboundedSet set) {
        return new EnumOrd(set);
    }

    public UnboundedSet set() {
        return set;
    }

    /**
     * Returns the member of the set at position {@code o}.
     */
    @Override
    public Ordinal apply(Ordinal o) {
        return recursion.apply(o);
    }

    @Override
    public Ordinal supBelow(Ordinal limit) {
        return set.enumerationLimit(limit);
    }

    @Override
    public boolean attainsSupBelow(Ordinal limit) {
        return false;
    }

    /**
     * Checks on the given positions that {@code f} is a strictly increasing
     * function into the set that skips no member: {@code f(0)} is the least
     * member and {@code f(succ a)} is the least member above {@code f(a)}.
     * By uniqueness of the enumeration, a function passing this check on all
     * ordinals is this enumeration.
     *
     * @param f the function to check
     * @param positions the positions to check, in increasing order
     */
    public boolean isEnumerationOn(OrdinalFunction f, Iterable<Ordinal> positions) {
        Ordinal previous = null;
        for (Ordinal a : positions) {
            Ordinal v = f.apply(a);
            if (!set.contains(v))
                return false;
            if (previous != null && !previous.lessThan(v))
                return false;
            if (a.isZero() && !v.equals(set.ceiling(ZERO)))
                return false;
            if (!f.apply(a.succ()).equals(set.ceiling(v.succ())))
                return false;
            previous = v;
        }
        return true;
    }

    public String toString() {
        return "enumOrd(" + set + ")";
    }
}
