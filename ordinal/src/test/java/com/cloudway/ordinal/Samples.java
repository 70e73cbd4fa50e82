/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.ordinal;

import com.google.common.collect.ImmutableList;

import com.cloudway.ordinal.data.Ordinal;

import static com.cloudway.ordinal.data.Ordinal.*;

/**
 * Sample ordinals shared by the property tests, in increasing order.
 */
public final class Samples {
    private Samples() {}

    public static Ordinal nat(long n) {
        return Ordinal.of(n);
    }

    public static Ordinal w(long k) {
        return Ordinal.omegaPow(k);
    }

    public static final ImmutableList<Ordinal> ORDINALS = ImmutableList.of(
        ZERO,
        ONE,
        nat(2),
        nat(3),
        nat(7),
        OMEGA,
        OMEGA.succ(),
        OMEGA.add(5),
        OMEGA.multiply(2),
        OMEGA.multiply(2).add(3),
        w(2),
        w(2).add(OMEGA.multiply(3)).add(1),
        w(3).multiply(2).add(OMEGA),
        omegaPow(OMEGA),
        omegaPow(OMEGA).add(OMEGA),
        omegaPow(OMEGA.succ()).multiply(2).add(4)
    );
}
