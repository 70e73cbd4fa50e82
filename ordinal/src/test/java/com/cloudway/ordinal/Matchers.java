/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.ordinal;

import java.util.function.Predicate;

import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;

import com.cloudway.ordinal.data.Ordinal;

public final class Matchers {
    private Matchers() {}

    public static <T> Matcher<T> matches(String describeText, Predicate<T> predicate) {
        return new TypeSafeMatcher<T>() {
            @Override
            protected boolean matchesSafely(T item) {
                return predicate.test(item);
            }

            @Override
            public void describeTo(Description description) {
                description.appendText(describeText);
            }
        };
    }

    public static Matcher<Ordinal> below(Ordinal bound) {
        return matches("an ordinal below " + bound, (Ordinal a) -> a.lessThan(bound));
    }

    public static Matcher<Ordinal> atMost(Ordinal bound) {
        return matches("an ordinal at most " + bound, (Ordinal a) -> a.lessOrEqual(bound));
    }
}
