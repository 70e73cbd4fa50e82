/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.ordinal.data;

import static java.util.Objects.requireNonNull;

/**
 * Decides whether an ordinal is zero, a successor or a limit.
 */
public final class OrdinalClassifier {
    private OrdinalClassifier() {}

    /**
     * Classify the given ordinal. Exactly one of {@code isZero()},
     * {@code isSucc()} and {@code isLimit()} holds for the result.
     */
    public static Classification classify(Ordinal o) {
        requireNonNull(o);
        if (o.isZero()) {
            return Classification.zero();
        } else if (o.isSuccessor()) {
            return Classification.succ(o.predecessor());
        } else {
            return Classification.limit(o);
        }
    }

    /**
     * Returns the predecessor of a successor ordinal, and the ordinal itself
     * when it is zero or a limit.
     */
    public static Ordinal pred(Ordinal o) {
        return o.isSuccessor() ? o.predecessor() : o;
    }
}
