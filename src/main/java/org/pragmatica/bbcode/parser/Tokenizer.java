package org.pragmatica.bbcode.parser;

import org.pragmatica.bbcode.error.BbCodeException;
import org.pragmatica.bbcode.error.ParseError;
import org.pragmatica.bbcode.tree.CstNode;
import org.pragmatica.bbcode.tree.SourceLocation;
import org.pragmatica.bbcode.tree.SourceSpan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * PEG matcher for the BBCode grammar:
 *
 * <pre>
 * Document       &lt;- Content* EOF
 * Content        &lt;- TagBlock / EscapedBracket / UnclosedTag / Text
 * TagBlock       &lt;- OpenTag Content* '[/' TagName ']'
 * UnclosedTag    &lt;- OpenTag
 * OpenTag        &lt;- '[' TagName ('=' AttrValue)? ']'
 * TagName        &lt;- [A-Za-z] [A-Za-z0-9]*
 * AttrValue      &lt;- (![\]\r\n] .)*
 * EscapedBracket &lt;- '\['
 * Text           &lt;- (!'[' !'\[' .)+
 * </pre>
 *
 * <p>Close tag names are not required to match the open name; the AST builder decides
 * what a mismatch means.
 *
 * <p>Tag blocks are matched with an explicit stack of open tags instead of recursion.
 * Content parsing does not depend on the enclosing block, so a block whose close tag
 * is missing can only fail where every enclosing block fails too. At end of input each
 * open tag on the stack becomes an {@link CstNode.UnclosedTag} followed by its content;
 * anywhere else the whole document fails.
 */
public final class Tokenizer {
    private Tokenizer() {}

    public static CstNode.Document tokenize(String input) throws BbCodeException {
        var ctx = ParsingContext.create(input);
        var document = new ArrayList<CstNode>();
        Deque<OpenBlock> open = new ArrayDeque<>();

        while (true) {
            var content = open.isEmpty() ? document : open.peek().content();
            var startLoc = ctx.location();

            var openTag = parseOpenTag(ctx);
            if (openTag.isPresent()) {
                open.push(new OpenBlock(startLoc, ctx.spanFrom(startLoc), openTag.get(), new ArrayList<>()));
                continue;
            }
            var leaf = parseEscapedBracket(ctx).or(() -> parseText(ctx));
            if (leaf.isPresent()) {
                content.add(leaf.get());
                continue;
            }
            if (open.isEmpty()) {
                break;
            }
            var closeName = parseCloseTag(ctx);
            if (closeName.isEmpty()) {
                break;
            }
            var block = open.pop();
            var node = new CstNode.TagBlock(ctx.spanFrom(block.start()),
                                            block.tag().name(),
                                            block.tag().attribute(),
                                            block.content(),
                                            closeName.get());
            (open.isEmpty() ? document : open.peek().content()).add(node);
        }

        if (!ctx.isAtEnd()) {
            ctx.updateFurthest("end of input");
            var furthest = ctx.furthestLocation();
            throw new BbCodeException(new ParseError.SyntaxError(furthest,
                                                                 ctx.describeAt(furthest),
                                                                 ctx.furthestExpected()));
        }

        // outermost first
        var unclosed = open.descendingIterator();
        while (unclosed.hasNext()) {
            var block = unclosed.next();
            document.add(new CstNode.UnclosedTag(block.openSpan(), block.tag().name(), block.tag().attribute()));
            document.addAll(block.content());
        }
        return new CstNode.Document(ctx.spanFrom(SourceLocation.START), document);
    }

    // === Tag Rules ===

    /**
     * '[' TagName ('=' AttrValue)? ']' - restores the location on failure.
     */
    private static Optional<OpenTag> parseOpenTag(ParsingContext ctx) {
        var startLoc = ctx.location();
        if (!matchChar(ctx, '[', "'['")) {
            return Optional.empty();
        }
        var name = parseTagName(ctx);
        if (name.isEmpty()) {
            ctx.restoreLocation(startLoc);
            return Optional.empty();
        }

        Optional<CstNode.Token> attribute = Optional.empty();
        if (!ctx.isAtEnd() && ctx.peek() == '=') {
            ctx.advance();
            attribute = Optional.of(parseAttrValue(ctx));
        }

        if (!matchChar(ctx, ']', "']'")) {
            ctx.restoreLocation(startLoc);
            return Optional.empty();
        }
        return Optional.of(new OpenTag(name.get(), attribute));
    }

    /**
     * '[/' TagName ']' - restores the location on failure.
     */
    private static Optional<CstNode.Token> parseCloseTag(ParsingContext ctx) {
        var startLoc = ctx.location();
        if (!ctx.startsWith("[/")) {
            ctx.updateFurthest("'[/'");
            return Optional.empty();
        }
        ctx.advance();
        ctx.advance();

        var name = parseTagName(ctx);
        if (name.isEmpty() || !matchChar(ctx, ']', "']'")) {
            ctx.restoreLocation(startLoc);
            return Optional.empty();
        }
        return name;
    }

    private static Optional<CstNode.Token> parseTagName(ParsingContext ctx) {
        var startLoc = ctx.location();
        if (ctx.isAtEnd() || !isAsciiLetter(ctx.peek())) {
            ctx.updateFurthest("tag name");
            return Optional.empty();
        }
        ctx.advance();
        while (!ctx.isAtEnd() && isAsciiLetterOrDigit(ctx.peek())) {
            ctx.advance();
        }
        var text = ctx.substring(startLoc.index(), ctx.index());
        return Optional.of(new CstNode.Token(ctx.spanFrom(startLoc), text));
    }

    private static CstNode.Token parseAttrValue(ParsingContext ctx) {
        var startLoc = ctx.location();
        while (!ctx.isAtEnd()) {
            char c = ctx.peek();
            if (c == ']' || c == '\n' || c == '\r') {
                break;
            }
            ctx.advance();
        }
        var text = ctx.substring(startLoc.index(), ctx.index());
        return new CstNode.Token(ctx.spanFrom(startLoc), text);
    }

    // === Text Rules ===

    private static Optional<CstNode> parseEscapedBracket(ParsingContext ctx) {
        var startLoc = ctx.location();
        if (!ctx.startsWith("\\[")) {
            return Optional.empty();
        }
        ctx.advance();
        ctx.advance();
        return Optional.of(new CstNode.EscapedBracket(ctx.spanFrom(startLoc)));
    }

    private static Optional<CstNode> parseText(ParsingContext ctx) {
        var startLoc = ctx.location();
        while (!ctx.isAtEnd() && !startsMarkup(ctx)) {
            ctx.advance();
        }
        if (ctx.index() == startLoc.index()) {
            ctx.updateFurthest("text");
            return Optional.empty();
        }
        var text = ctx.substring(startLoc.index(), ctx.index());
        return Optional.of(new CstNode.Text(ctx.spanFrom(startLoc), text));
    }

    private static boolean startsMarkup(ParsingContext ctx) {
        char c = ctx.peek();
        return c == '[' || (c == '\\' && ctx.remaining() > 1 && ctx.peek(1) == '[');
    }

    // === Terminals ===

    private static boolean matchChar(ParsingContext ctx, char expected, String description) {
        if (!ctx.isAtEnd() && ctx.peek() == expected) {
            ctx.advance();
            return true;
        }
        ctx.updateFurthest(description);
        return false;
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isAsciiLetterOrDigit(char c) {
        return isAsciiLetter(c) || (c >= '0' && c <= '9');
    }

    private record OpenTag(CstNode.Token name, Optional<CstNode.Token> attribute) {}

    /**
     * Open tag still waiting for its close tag, with the content collected so far.
     */
    private record OpenBlock(SourceLocation start, SourceSpan openSpan, OpenTag tag, List<CstNode> content) {}
}
