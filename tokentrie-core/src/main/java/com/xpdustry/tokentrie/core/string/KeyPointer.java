package com.xpdustry.tokentrie.core.string;

import com.google.common.base.Preconditions;

public final class KeyPointer implements CharSequence {

    private final CharSequence data;
    private int pos;
    private int posMax;

    private KeyPointer(final CharSequence data, final int pos, final int posMax) {
        this.data = data;
        this.pos = pos;
        this.posMax = posMax;
    }

    public static KeyPointer of(final CharSequence data) {
        Preconditions.checkNotNull(data, "data");
        return new KeyPointer(data, 0, data.length());
    }

    public static KeyPointer of(final CharSequence data, final int pos, final int posMax) {
        Preconditions.checkNotNull(data, "data");
        Preconditions.checkPositionIndexes(pos, posMax, data.length());
        return new KeyPointer(data, pos, posMax);
    }

    public static KeyPointer wrap(final CharSequence key) {
        return key instanceof KeyPointer pointer ? pointer : of(key);
    }

    public CharSequence data() {
        return this.data;
    }

    public int pos() {
        return this.pos;
    }

    public void setPos(final int pos) {
        this.pos = pos;
    }

    public int posMax() {
        return this.posMax;
    }

    public void setPosMax(final int posMax) {
        this.posMax = posMax;
    }

    @Override
    public int length() {
        return this.posMax - this.pos;
    }

    @Override
    public char charAt(final int index) {
        return this.data.charAt(this.pos + index);
    }

    @Override
    public CharSequence subSequence(final int start, final int end) {
        Preconditions.checkPositionIndexes(start, end, this.length());
        return new KeyPointer(this.data, this.pos + start, this.pos + end);
    }

    @Override
    public String toString() {
        return this.data.subSequence(this.pos, this.posMax).toString();
    }
}
