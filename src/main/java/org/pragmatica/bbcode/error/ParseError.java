package org.pragmatica.bbcode.error;

import org.pragmatica.bbcode.tree.SourceLocation;
import org.pragmatica.bbcode.tree.Span;

/**
 * Reason a parse was aborted. No partial tree is produced for any of these.
 */
public sealed interface ParseError {
    String message();

    /**
     * Input longer than {@code max} UTF-8 bytes; rejected before tokenization.
     */
    record InputSizeExceeded(int max, int actual) implements ParseError {
        @Override
        public String message() {
            return "Input size exceeded limit (max " + max + " bytes)";
        }
    }

    /**
     * More than {@code maxTags} tag-like constructs were encountered.
     */
    record TagCountExceeded(int maxTags) implements ParseError {
        @Override
        public String message() {
            return "Parsed tag count exceeded limit (max " + maxTags + ")";
        }
    }

    /**
     * A tag block would nest deeper than {@code maxDepth}.
     *
     * @param maxDepth configured limit
     * @param near     source text of the offending tag block
     * @param span     byte range of the offending tag block
     * @param line     1-based line of the block start
     * @param column   1-based column of the block start, in code points
     */
    record NestDepthExceeded(
    int maxDepth,
    String near,
    Span span,
    int line,
    int column) implements ParseError {
        @Override
        public String message() {
            return "Nest depth exceeded limit (max " + maxDepth + ") at line " + line + ", col " + column
                   + ". Near: \"" + near + "\"";
        }
    }

    /**
     * Input that no grammar rule can classify, such as a stray {@code [}.
     */
    record SyntaxError(
    SourceLocation location,
    String found,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Failed to parse input: unexpected " + found + " at " + location + ", expected " + expected;
        }
    }
}
