package org.pragmatica.bbcode.tree;

import java.util.List;
import java.util.Optional;

/**
 * Concrete Syntax Tree node produced by the tokenizer - lossless, every node knows the
 * exact source range it was matched from.
 */
public sealed interface CstNode {
    /**
     * The source span covered by this node.
     */
    SourceSpan span();

    /**
     * Root of the tree: all top-level content up to end of input.
     */
    record Document(SourceSpan span, List<CstNode> content) implements CstNode {
        public Document {
            content = List.copyOf(content);
        }
    }

    /**
     * {@code [name=attr]content[/close]}. The close name is whatever name closed the
     * block and may differ from the open name.
     */
    record TagBlock(
    SourceSpan span,
    Token name,
    Optional<Token> attribute,
    List<CstNode> content,
    Token closeName) implements CstNode {
        public TagBlock {
            content = List.copyOf(content);
        }
    }

    /**
     * Opening tag without a reachable close tag.
     */
    record UnclosedTag(
    SourceSpan span,
    Token name,
    Optional<Token> attribute) implements CstNode {}

    /**
     * {@code \[} - stands for a literal bracket.
     */
    record EscapedBracket(SourceSpan span) implements CstNode {}

    /**
     * Run of plain characters.
     */
    record Text(SourceSpan span, String text) implements CstNode {}

    /**
     * Terminal captured inside a tag: tag name, attribute value or close tag name.
     */
    record Token(SourceSpan span, String text) implements CstNode {}
}
