package com.xpdustry.tokentrie.core.string;

import com.google.common.base.CharMatcher;

public final class TokenBoundary {

    private static final CharMatcher NON_BOUNDARY =
            CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('A', 'Z')).precomputed();

    private TokenBoundary() {}

    public static boolean isNonBoundary(final CharSequence data, final int index) {
        return NON_BOUNDARY.matches(data.charAt(index));
    }
}
