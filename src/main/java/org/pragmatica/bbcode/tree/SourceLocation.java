package org.pragmatica.bbcode.tree;

/**
 * A position in source text.
 *
 * @param line   1-based line number, lines are terminated by {@code '\n'}
 * @param column 1-based column, counted in Unicode code points
 * @param offset UTF-8 byte offset from the start of input
 * @param index  UTF-16 index into the Java string holding the input
 */
public record SourceLocation(int line, int column, int offset, int index) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0, 0);

    public static SourceLocation at(int line, int column, int offset, int index) {
        return new SourceLocation(line, column, offset, index);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
