/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.ordinal;

/**
 * Thrown when an operation is asked for a value outside the computable
 * fragment, such as a supremum over an infinite bound of a family that
 * carries no limit witness.
 */
@SuppressWarnings("serial")
public class NonComputableException extends UnsupportedOperationException {
    public NonComputableException(String message) {
        super(message);
    }
}
