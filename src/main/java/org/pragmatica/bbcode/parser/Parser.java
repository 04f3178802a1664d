package org.pragmatica.bbcode.parser;

import org.pragmatica.bbcode.error.BbCodeException;
import org.pragmatica.bbcode.tree.Node;

import java.util.List;

/**
 * Parser interface - converts BBCode under a fixed set of limits. Implementations are
 * stateless between calls and safe to share across threads.
 */
public interface Parser {

    /**
     * Parse input into a normalized AST.
     *
     * @throws BbCodeException if a limit is exceeded or the input cannot be tokenized
     */
    List<Node> parse(String input) throws BbCodeException;

    /**
     * Parse input and render it to HTML.
     *
     * @throws BbCodeException if a limit is exceeded or the input cannot be tokenized
     */
    String convert(String input) throws BbCodeException;

    /**
     * Limits applied by this parser.
     */
    ParseOptions options();
}
