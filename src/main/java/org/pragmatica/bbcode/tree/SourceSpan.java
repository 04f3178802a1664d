package org.pragmatica.bbcode.tree;

/**
 * A range in source text from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public String extract(String source) {
        return source.substring(start.index(), end.index());
    }

    /**
     * Byte-offset view of this span, as exposed on AST nodes.
     */
    public Span toSpan() {
        return Span.of(start.offset(), end.offset());
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
