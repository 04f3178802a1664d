package org.pragmatica.bbcode.parser;

import org.pragmatica.bbcode.error.BbCodeException;
import org.pragmatica.bbcode.error.ParseError;
import org.pragmatica.bbcode.registry.ColorValue;
import org.pragmatica.bbcode.registry.TagRegistry;
import org.pragmatica.bbcode.tree.Attribute;
import org.pragmatica.bbcode.tree.CstNode;
import org.pragmatica.bbcode.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the tokenizer's parse tree into the AST, enforcing depth and tag count limits.
 *
 * <p>Tag blocks that cannot be interpreted structurally (mismatched close name,
 * unknown tag, rejected attribute) become a single text node holding the block's
 * source verbatim. The builder recurses into a known tag's content before the
 * attribute is checked, so a depth violation inside a block that is later rejected
 * still fails the parse.
 */
final class AstBuilder {
    private static final Logger log = LoggerFactory.getLogger(AstBuilder.class);

    private final String input;
    private final ParseOptions options;
    private int tagCount;

    private AstBuilder(String input, ParseOptions options) {
        this.input = input;
        this.options = options;
        this.tagCount = 0;
    }

    /**
     * Build the un-normalized AST for a tokenized document.
     */
    static List<Node> build(CstNode.Document document, String input, ParseOptions options) throws BbCodeException {
        return new AstBuilder(input, options).buildAll(document.content(), 0);
    }

    private List<Node> buildAll(List<CstNode> content, int depth) throws BbCodeException {
        var nodes = new ArrayList<Node>(content.size());
        for (var node : content) {
            nodes.add(buildNode(node, depth));
        }
        return nodes;
    }

    private Node buildNode(CstNode node, int depth) throws BbCodeException {
        if (node instanceof CstNode.TagBlock block) {
            return buildTagBlock(block, depth);
        }
        if (node instanceof CstNode.UnclosedTag) {
            countTag();
            return verbatim(node);
        }
        if (node instanceof CstNode.EscapedBracket escaped) {
            return Node.text(escaped.span()
                                    .toSpan(), "[");
        }
        return verbatim(node);
    }

    private Node buildTagBlock(CstNode.TagBlock block, int depth) throws BbCodeException {
        checkDepth(block, depth);
        countTag();

        var openName = TagRegistry.normalize(block.name()
                                                  .text());
        var closeName = TagRegistry.normalize(block.closeName()
                                                   .text());
        var value = block.attribute()
                         .map(CstNode.Token::text);

        if (!openName.equals(closeName)) {
            return fallback(block, openName, "close tag [/" + closeName + "] does not match");
        }

        var spec = TagRegistry.lookup(openName);
        if (spec.isEmpty()) {
            return fallback(block, openName, "unknown tag");
        }

        var children = buildAll(block.content(), depth + 1);

        if (value.isPresent() && !spec.get()
                                       .accepts(value.get())) {
            return fallback(block, openName, "attribute value rejected");
        }

        var element = new Node.Element(openName, block.span()
                                                      .toSpan(), List.of(), children);
        return value.map(v -> element.withAttr(Attribute.VALUE, ColorValue.trim(v)))
                    .orElse(element);
    }

    private void checkDepth(CstNode.TagBlock block, int depth) throws BbCodeException {
        if (depth + 1 > options.maxDepth()) {
            var span = block.span();
            throw new BbCodeException(new ParseError.NestDepthExceeded(options.maxDepth(),
                                                                       span.extract(input),
                                                                       span.toSpan(),
                                                                       span.start()
                                                                           .line(),
                                                                       span.start()
                                                                           .column()));
        }
    }

    private void countTag() throws BbCodeException {
        tagCount++;
        if (tagCount > options.maxTags()) {
            throw new BbCodeException(new ParseError.TagCountExceeded(options.maxTags()));
        }
    }

    private Node fallback(CstNode.TagBlock block, String name, String reason) {
        log.debug("Tag block [{}] at {} kept as text: {}", name, block.span()
                                                                      .toSpan(), reason);
        return verbatim(block);
    }

    private Node verbatim(CstNode node) {
        var span = node.span();
        return Node.text(span.toSpan(), span.extract(input));
    }
}
