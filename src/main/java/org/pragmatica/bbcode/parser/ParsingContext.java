package org.pragmatica.bbcode.parser;

import org.pragmatica.bbcode.tree.SourceLocation;
import org.pragmatica.bbcode.tree.SourceSpan;

/**
 * Mutable state of a single tokenizer run.
 *
 * <p>Tracks four coordinates at once: UTF-16 index (for slicing the Java string),
 * UTF-8 byte offset (for spans), line and code-point column (for diagnostics).
 */
public final class ParsingContext {

    private final String input;

    private int index;
    private int offset;
    private int line;
    private int column;
    private SourceLocation furthest;
    private String furthestExpected;

    private ParsingContext(String input) {
        this.input = input;
        this.index = 0;
        this.offset = 0;
        this.line = 1;
        this.column = 1;
        this.furthest = SourceLocation.START;
        this.furthestExpected = "";
    }

    public static ParsingContext create(String input) {
        return new ParsingContext(input);
    }

    // === Position Management ===

    public int index() {
        return index;
    }

    public SourceLocation location() {
        return SourceLocation.at(line, column, offset, index);
    }

    public void restoreLocation(SourceLocation loc) {
        this.index = loc.index();
        this.offset = loc.offset();
        this.line = loc.line();
        this.column = loc.column();
    }

    public boolean isAtEnd() {
        return index >= input.length();
    }

    public int remaining() {
        return input.length() - index;
    }

    // === Character Access ===

    public char peek() {
        return input.charAt(index);
    }

    public char peek(int ahead) {
        return input.charAt(index + ahead);
    }

    public boolean startsWith(String literal) {
        return input.startsWith(literal, index);
    }

    /**
     * Consume one code point and return it. A surrogate pair is consumed whole.
     */
    public int advance() {
        char c = input.charAt(index++);
        if (c == '\n') {
            line++;
            column = 1;
            offset++;
            return c;
        }
        column++;
        if (Character.isHighSurrogate(c) && !isAtEnd() && Character.isLowSurrogate(input.charAt(index))) {
            char low = input.charAt(index++);
            offset += 4;
            return Character.toCodePoint(c, low);
        }
        offset += utf8Length(c);
        return c;
    }

    public String substring(int start, int end) {
        return input.substring(start, end);
    }

    // === Error Tracking ===

    public void updateFurthest(String expected) {
        if (index > furthest.index()) {
            furthest = location();
            furthestExpected = expected;
        } else if (index == furthest.index() && !furthestExpected.contains(expected)) {
            furthestExpected = furthestExpected.isEmpty()
                ? expected
                : furthestExpected + " or " + expected;
        }
    }

    public SourceLocation furthestLocation() {
        return furthest;
    }

    public String furthestExpected() {
        return furthestExpected;
    }

    /**
     * Human-readable description of what sits at the given location.
     */
    public String describeAt(SourceLocation loc) {
        if (loc.index() >= input.length()) {
            return "end of input";
        }
        return "'" + new String(Character.toChars(input.codePointAt(loc.index()))) + "'";
    }

    // === Span Creation ===

    public SourceSpan spanFrom(SourceLocation start) {
        return SourceSpan.of(start, location());
    }

    /**
     * UTF-8 length of a char that is not part of a surrogate pair. A lone surrogate
     * is encoded as a single replacement byte.
     */
    private static int utf8Length(char c) {
        if (c < 0x80 || Character.isSurrogate(c)) {
            return 1;
        }
        return c < 0x800 ? 2 : 3;
    }
}
