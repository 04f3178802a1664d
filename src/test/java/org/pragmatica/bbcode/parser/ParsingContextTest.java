package org.pragmatica.bbcode.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.bbcode.tree.SourceLocation;
import org.pragmatica.bbcode.tree.Span;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ParsingContext, focusing on location tracking and furthest-failure reporting.
 */
class ParsingContextTest {

    // === Location Tracking ===

    @Test
    void advance_asciiAndNewline_tracksAllCoordinates() {
        var ctx = ParsingContext.create("a\nb");

        ctx.advance();
        ctx.advance();
        ctx.advance();

        assertEquals(SourceLocation.at(2, 2, 3, 3), ctx.location());
        assertTrue(ctx.isAtEnd());
    }

    @Test
    void advance_multibyte_countsBytesAndCodePoints() {
        var ctx = ParsingContext.create("éあ😀x");

        assertEquals('é', ctx.advance());
        assertEquals('あ', ctx.advance());
        assertEquals(0x1F600, ctx.advance());

        assertEquals(SourceLocation.at(1, 4, 9, 4), ctx.location());
        assertEquals('x', ctx.peek());
    }

    @Test
    void advance_loneSurrogate_countsOneByte() {
        var ctx = ParsingContext.create("\uD800x");

        ctx.advance();

        assertEquals(SourceLocation.at(1, 2, 1, 1), ctx.location());
    }

    @Test
    void restoreLocation_rewindsEverything() {
        var ctx = ParsingContext.create("ab\ncd");
        var start = ctx.location();

        ctx.advance();
        ctx.advance();
        ctx.advance();
        ctx.restoreLocation(start);

        assertEquals(SourceLocation.START, ctx.location());
        assertEquals(5, ctx.remaining());
    }

    @Test
    void spanFrom_extractsConsumedText() {
        var input = "[é]x";
        var ctx = ParsingContext.create(input);
        var start = ctx.location();

        ctx.advance();
        ctx.advance();
        ctx.advance();
        var span = ctx.spanFrom(start);

        assertEquals("[é]", span.extract(input));
        assertEquals(Span.of(0, 4), span.toSpan());
    }

    // === Error Tracking ===

    @Test
    void updateFurthest_keepsFurthestAndJoinsAlternatives() {
        var ctx = ParsingContext.create("abc");
        ctx.updateFurthest("x");
        ctx.advance();
        ctx.updateFurthest("tag name");
        ctx.updateFurthest("']'");
        ctx.updateFurthest("tag name");
        ctx.restoreLocation(SourceLocation.START);
        ctx.updateFurthest("text");

        assertEquals(1, ctx.furthestLocation()
                           .index());
        assertEquals("tag name or ']'", ctx.furthestExpected());
    }

    @Test
    void describeAt_quotesCodePointOrNamesEnd() {
        var ctx = ParsingContext.create("😀");

        assertEquals("'😀'", ctx.describeAt(SourceLocation.START));
        assertEquals("end of input", ctx.describeAt(SourceLocation.at(1, 2, 4, 2)));
    }
}
