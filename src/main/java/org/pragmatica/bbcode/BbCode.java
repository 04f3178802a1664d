package org.pragmatica.bbcode;

import org.pragmatica.bbcode.error.BbCodeException;
import org.pragmatica.bbcode.parser.BbCodeEngine;
import org.pragmatica.bbcode.parser.ParseOptions;
import org.pragmatica.bbcode.parser.Parser;
import org.pragmatica.bbcode.render.HtmlRenderer;
import org.pragmatica.bbcode.tree.Node;

import java.util.List;

/**
 * Entry point for converting BBCode to HTML.
 *
 * <p>Example usage:
 * <pre>{@code
 * var html = BbCode.convert("[b]Bold[/b] and [color=red]red[/color]");
 *
 * var strict = BbCode.builder()
 *                    .maxDepth(1)
 *                    .maxTags(20)
 *                    .build();
 * var nodes = strict.parse(userInput);
 * }</pre>
 */
public final class BbCode {
    private BbCode() {}

    /**
     * Parse input with default limits.
     */
    public static List<Node> parse(String input) throws BbCodeException {
        return parse(input, ParseOptions.DEFAULT);
    }

    /**
     * Parse input with the given limits.
     */
    public static List<Node> parse(String input, ParseOptions options) throws BbCodeException {
        return BbCodeEngine.create(options)
                           .parse(input);
    }

    /**
     * Render a parsed tree to HTML. Never fails.
     */
    public static String render(List<Node> nodes) {
        return HtmlRenderer.render(nodes);
    }

    /**
     * Parse and render with default limits.
     */
    public static String convert(String input) throws BbCodeException {
        return convert(input, ParseOptions.DEFAULT);
    }

    /**
     * Parse and render with the given limits.
     */
    public static String convert(String input, ParseOptions options) throws BbCodeException {
        return render(parse(input, options));
    }

    /**
     * Create a parser bound to the given limits.
     */
    public static Parser parser(ParseOptions options) {
        return BbCodeEngine.create(options);
    }

    /**
     * Create a builder for a parser with custom limits.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxDepth = ParseOptions.DEFAULT_MAX_DEPTH;
        private int maxTags = ParseOptions.DEFAULT_MAX_TAGS;
        private int maxInputSize = ParseOptions.DEFAULT_MAX_INPUT_SIZE;

        private Builder() {}

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder maxTags(int maxTags) {
            this.maxTags = maxTags;
            return this;
        }

        public Builder maxInputSize(int maxInputSize) {
            this.maxInputSize = maxInputSize;
            return this;
        }

        public ParseOptions options() {
            return new ParseOptions(maxDepth, maxTags, maxInputSize);
        }

        public Parser build() {
            return parser(options());
        }
    }
}
