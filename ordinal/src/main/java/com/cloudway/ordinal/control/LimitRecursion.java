/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.ordinal.control;

import java.util.function.Function;
import java.util.logging.Logger;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;

import com.cloudway.ordinal.data.Ordinal;
import com.cloudway.ordinal.util.Config;

import static java.util.Objects.requireNonNull;

/**
 * Well-founded recursion on ordinals, branching on the zero, successor and
 * limit shape of the argument.
 *
 * <p>The result satisfies the equations:</p>
 * <pre>
 *     limitRecOn(0)      = zeroCase
 *     limitRecOn(succ a) = succCase(a, limitRecOn(a))
 *     limitRecOn(o)      = limitCase(o, below)      if o is a limit
 * </pre>
 *
 * <p>where {@code below} answers {@code limitRecOn(a)} for every {@code a < o}.
 * Termination rests on the well-foundedness of the ordinal order: every
 * recursive call is made on a strictly smaller ordinal. A successor chain
 * {@code δ+1, ..., δ+n} is evaluated iteratively through
 * {@link SuccCase#iterate}, so only nested limit cases consume stack.</p>
 *
 * <p>Results at limit ordinals may be memoized within one recursion object.
 * Memoization never changes a result.</p>
 *
 * @param <R> the type of recursion result
 */
public final class LimitRecursion<R> implements Function<Ordinal, R> {
    private static final Logger logger = Logger.getLogger(LimitRecursion.class.getName());

    /**
     * The successor step, receiving the predecessor and the result at the
     * predecessor.
     */
    @FunctionalInterface
    public interface SuccCase<R> {
        R apply(Ordinal pred, R result);

        /**
         * Apply the successor step {@code n} times, starting at {@code pred}.
         * An override must agree with the repeated application.
         */
        default R iterate(Ordinal pred, R result, long n) {
            for (long k = 0; k < n; k++) {
                result = apply(pred, result);
                pred = pred.succ();
            }
            return result;
        }
    }

    /**
     * The limit step, receiving the limit ordinal and the results at all
     * smaller ordinals.
     */
    @FunctionalInterface
    public interface LimitCase<R> {
        R apply(Ordinal limit, Below<R> below);
    }

    /**
     * The results of the recursion at the ordinals strictly below a bound.
     */
    public static final class Below<R> implements Function<Ordinal, R> {
        private final Ordinal bound;
        private final LimitRecursion<R> recursion;

        Below(Ordinal bound, LimitRecursion<R> recursion) {
            this.bound = bound;
            this.recursion = recursion;
        }

        public Ordinal bound() {
            return bound;
        }

        /**
         * Returns the recursion result at {@code a}.
         *
         * @throws IllegalArgumentException if {@code a} is not below the bound
         */
        @Override
        public R apply(Ordinal a) {
            if (!a.lessThan(bound))
                throw new IllegalArgumentException(a + " is not below " + bound);
            return recursion.apply(a);
        }
    }

    private final R zeroCase;
    private final SuccCase<R> succCase;
    private final LimitCase<R> limitCase;

    // results at limit ordinals, absent when memoization is disabled
    private final Cache<Ordinal, Object> memo;

    public LimitRecursion(R zeroCase, SuccCase<R> succCase, LimitCase<R> limitCase) {
        this(zeroCase, succCase, limitCase, Config.getDefault());
    }

    public LimitRecursion(R zeroCase, SuccCase<R> succCase, LimitCase<R> limitCase, Config config) {
        this(zeroCase, succCase, limitCase, config.isMemoizing(), config.getCacheSize());
    }

    public LimitRecursion(R zeroCase, SuccCase<R> succCase, LimitCase<R> limitCase,
                          boolean memoize, int cacheSize) {
        this.zeroCase = zeroCase;
        this.succCase = requireNonNull(succCase);
        this.limitCase = requireNonNull(limitCase);
        if (memoize) {
            this.memo = CacheBuilder.newBuilder().maximumSize(cacheSize).recordStats().build();
        } else {
            this.memo = null;
        }
    }

    /**
     * Compute a result for the ordinal {@code o} by limit recursion.
     */
    public static <R> R limitRecOn(Ordinal o, R zeroCase, SuccCase<R> succCase, LimitCase<R> limitCase) {
        return new LimitRecursion<>(zeroCase, succCase, limitCase).apply(o);
    }

    @Override
    public R apply(Ordinal o) {
        Ordinal base = o.limitPart();
        long n = o.finitePart();

        R result = base.isZero() ? zeroCase : atLimit(base);
        return n == 0 ? result : succCase.iterate(base, result, n);
    }

    @SuppressWarnings("unchecked")
    private R atLimit(Ordinal o) {
        if (memo != null) {
            Object cached = memo.getIfPresent(o);
            if (cached != null) {
                return (R)cached;
            }
        }

        R result = limitCase.apply(o, new Below<>(o, this));
        if (memo != null && result != null) {
            memo.put(o, result);
        }
        return result;
    }

    /**
     * Returns the statistics of the memo cache, or empty statistics when
     * memoization is disabled.
     */
    public CacheStats stats() {
        if (memo == null)
            return new CacheStats(0, 0, 0, 0, 0, 0);
        CacheStats stats = memo.stats();
        logger.fine("limit recursion cache: " + stats);
        return stats;
    }
}
