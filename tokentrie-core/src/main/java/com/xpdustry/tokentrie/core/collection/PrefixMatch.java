package com.xpdustry.tokentrie.core.collection;

sealed interface PrefixMatch {

    PrefixMatch FULL = new Full();

    PrefixMatch NONE = new None();

    static PrefixMatch partial(final int index) {
        return new Partial(index);
    }

    record Full() implements PrefixMatch {}

    record Partial(int index) implements PrefixMatch {}

    record None() implements PrefixMatch {}
}
