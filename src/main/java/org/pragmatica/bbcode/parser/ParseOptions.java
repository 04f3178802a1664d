package org.pragmatica.bbcode.parser;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Resource limits applied to a single parse.
 *
 * @param maxDepth     deepest permitted tag nesting, top-level tags are at depth 1
 * @param maxTags      most tag blocks and unclosed tags a document may contain
 * @param maxInputSize largest accepted input, in UTF-8 bytes
 */
public record ParseOptions(
    int maxDepth,
    int maxTags,
    int maxInputSize
) {
    public static final int DEFAULT_MAX_DEPTH = 3;
    public static final int DEFAULT_MAX_TAGS = 500;
    public static final int DEFAULT_MAX_INPUT_SIZE = 50 * 1024;

    public static final ParseOptions DEFAULT = new ParseOptions(
        DEFAULT_MAX_DEPTH,
        DEFAULT_MAX_TAGS,
        DEFAULT_MAX_INPUT_SIZE
    );

    public ParseOptions {
        checkArgument(maxDepth >= 0, "maxDepth must not be negative: %s", maxDepth);
        checkArgument(maxTags >= 0, "maxTags must not be negative: %s", maxTags);
        checkArgument(maxInputSize >= 0, "maxInputSize must not be negative: %s", maxInputSize);
    }

    public ParseOptions withMaxDepth(int value) {
        return new ParseOptions(value, maxTags, maxInputSize);
    }

    public ParseOptions withMaxTags(int value) {
        return new ParseOptions(maxDepth, value, maxInputSize);
    }

    public ParseOptions withMaxInputSize(int value) {
        return new ParseOptions(maxDepth, maxTags, value);
    }
}
