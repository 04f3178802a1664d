package org.pragmatica.bbcode.parser;

import com.google.common.base.Utf8;
import org.pragmatica.bbcode.error.BbCodeException;
import org.pragmatica.bbcode.error.ParseError;
import org.pragmatica.bbcode.render.HtmlRenderer;
import org.pragmatica.bbcode.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * The conversion pipeline: size guard, tokenizer, AST builder, text merging and,
 * for {@link #convert(String)}, HTML rendering.
 */
public final class BbCodeEngine implements Parser {
    private static final Logger log = LoggerFactory.getLogger(BbCodeEngine.class);

    private final ParseOptions options;

    private BbCodeEngine(ParseOptions options) {
        this.options = options;
    }

    public static BbCodeEngine create(ParseOptions options) {
        return new BbCodeEngine(options);
    }

    @Override
    public List<Node> parse(String input) throws BbCodeException {
        try {
            checkSize(input);
            var document = Tokenizer.tokenize(input);
            var nodes = AstBuilder.build(document, input, options);
            return TextNodeMerger.merge(nodes);
        } catch (BbCodeException e) {
            log.debug("Rejected input of {} chars with {}: {}",
                      input.length(),
                      options,
                      e.error()
                       .getClass()
                       .getSimpleName());
            throw e;
        }
    }

    @Override
    public String convert(String input) throws BbCodeException {
        return HtmlRenderer.render(parse(input));
    }

    @Override
    public ParseOptions options() {
        return options;
    }

    private void checkSize(String input) throws BbCodeException {
        int actual = byteLength(input);
        if (actual > options.maxInputSize()) {
            throw new BbCodeException(new ParseError.InputSizeExceeded(options.maxInputSize(), actual));
        }
    }

    /**
     * UTF-8 length of the input. Unpaired surrogates count as the single replacement
     * byte the encoder writes for them.
     */
    static int byteLength(String input) {
        try {
            return Utf8.encodedLength(input);
        } catch (IllegalArgumentException unpairedSurrogate) {
            return input.getBytes(StandardCharsets.UTF_8).length;
        }
    }
}
