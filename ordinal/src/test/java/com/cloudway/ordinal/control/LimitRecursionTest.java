/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.ordinal.control;

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import com.cloudway.ordinal.data.Ordinal;
import com.cloudway.ordinal.util.Config;

import static com.cloudway.ordinal.Samples.*;
import static com.cloudway.ordinal.control.LimitRecursion.limitRecOn;
import static com.cloudway.ordinal.data.Ordinal.*;

public class LimitRecursionTest
{
    private static String trace(Ordinal o) {
        return limitRecOn(o, "z", (p, r) -> "s(" + r + ")", (l, below) -> "lim " + l);
    }

    // a recursion that rebuilds its argument, visiting every limit below it
    private static LimitRecursion<Ordinal> rebuild(boolean memoize) {
        return new LimitRecursion<>(
            ZERO,
            (p, r) -> r.succ(),
            (l, below) -> {
                Ordinal t = l.lastTerm().exponent();
                return below.apply(l.dropLastTerm()).plusOmegaPower(t, l.lastTerm().coefficient());
            },
            memoize, 64);
    }

    @Test
    public void zeroEquation() {
        assertThat(trace(ZERO), is("z"));
    }

    @Test
    public void successorEquation() {
        assertThat(trace(nat(3)), is("s(s(s(z)))"));
        assertThat(trace(OMEGA.add(2)), is("s(s(lim ω))"));
    }

    @Test
    public void limitEquation() {
        assertThat(trace(OMEGA), is("lim ω"));
        assertThat(trace(w(2).add(OMEGA)), is("lim ω^2 + ω"));
    }

    @Test
    public void successorEquationOnSamples() {
        LimitRecursion<Ordinal> rec = rebuild(false);
        for (Ordinal a : ORDINALS) {
            assertThat(rec.apply(a), is(a));
            assertThat(rec.apply(a.succ()), is(rec.apply(a).succ()));
        }
    }

    @Test
    public void successorChainIsIterated() {
        AtomicInteger steps = new AtomicInteger();
        List<Ordinal> preds = new ArrayList<>();
        int result = limitRecOn(OMEGA.add(4), 0,
            (p, r) -> { steps.incrementAndGet(); preds.add(p); return r + 1; },
            (l, below) -> 100);

        assertThat(result, is(104));
        assertThat(steps.get(), is(4));
        assertThat(preds.get(0), is(OMEGA));
        assertThat(preds.get(3), is(OMEGA.add(3)));
    }

    @Test
    public void belowAnswersSmallerOrdinals() {
        String r = limitRecOn(OMEGA.multiply(2), "z",
            (p, s) -> "s(" + s + ")",
            (l, below) -> {
                assertThat(below.bound(), is(l));
                return l.equals(OMEGA) ? "lim ω" : "[" + below.apply(OMEGA.succ()) + "]";
            });
        assertThat(r, is("[s(lim ω)]"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void belowRejectsBound() {
        limitRecOn(OMEGA, ZERO, (p, r) -> r, (l, below) -> below.apply(l));
    }

    @Test(expected = IllegalArgumentException.class)
    public void belowRejectsLarger() {
        limitRecOn(OMEGA, ZERO, (p, r) -> r, (l, below) -> below.apply(l.succ()));
    }

    @Test
    public void memoizationAgrees() {
        LimitRecursion<Ordinal> memo = rebuild(true);
        LimitRecursion<Ordinal> plain = rebuild(false);
        for (Ordinal a : ORDINALS) {
            assertThat(memo.apply(a), is(plain.apply(a)));
            assertThat(memo.apply(a), is(plain.apply(a)));
        }
    }

    @Test
    public void memoizedLimitIsReused() {
        AtomicInteger calls = new AtomicInteger();
        LimitRecursion<Ordinal> rec = new LimitRecursion<>(
            ZERO, (p, r) -> r.succ(), (l, below) -> { calls.incrementAndGet(); return l; },
            true, 16);

        assertThat(rec.apply(OMEGA.add(1)), is(OMEGA.add(1)));
        assertThat(rec.apply(OMEGA.add(2)), is(OMEGA.add(2)));
        assertThat(calls.get(), is(1));
        assertThat(rec.stats().hitCount(), is(1L));
        assertThat(rec.stats().missCount(), is(1L));
    }

    @Test
    public void negativeCacheSizeFallsBack() {
        Properties props = new Properties();
        props.setProperty(Config.CACHE_SIZE_KEY, "-1");
        LimitRecursion<Ordinal> rec = new LimitRecursion<>(
            ZERO, (p, r) -> r.succ(), (l, below) -> l, new Config(props));
        assertThat(rec.apply(OMEGA.add(3)), is(OMEGA.add(3)));
    }

    @Test
    public void noMemoWithoutConfig() {
        Properties props = new Properties();
        props.setProperty(Config.MEMOIZE_KEY, "false");
        AtomicInteger calls = new AtomicInteger();
        LimitRecursion<Ordinal> rec = new LimitRecursion<>(
            ZERO, (p, r) -> r.succ(), (l, below) -> { calls.incrementAndGet(); return l; },
            new Config(props));

        rec.apply(OMEGA);
        rec.apply(OMEGA);
        assertThat(calls.get(), is(2));
        assertThat(rec.stats().requestCount(), is(0L));
    }
}
