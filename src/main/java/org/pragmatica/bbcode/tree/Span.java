package org.pragmatica.bbcode.tree;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Half-open range of UTF-8 byte offsets into the original input.
 */
public record Span(int start, int end) {

    public Span {
        checkArgument(start >= 0, "span start must not be negative: %s", start);
        checkArgument(start <= end, "span start %s is after end %s", start, end);
    }

    public static Span of(int start, int end) {
        return new Span(start, end);
    }

    public int length() {
        return end - start;
    }

    public boolean contains(Span other) {
        return start <= other.start && other.end <= end;
    }

    /**
     * Span from this span's start to the other span's end.
     */
    public Span extendTo(Span other) {
        return new Span(start, other.end);
    }

    /**
     * Bytes covered by this span in the UTF-8 encoding of the input.
     */
    public byte[] slice(byte[] utf8) {
        return Arrays.copyOfRange(utf8, start, end);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
