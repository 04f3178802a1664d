package org.pragmatica.bbcode.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.bbcode.error.BbCodeException;
import org.pragmatica.bbcode.error.ParseError;

import static org.junit.jupiter.api.Assertions.*;

class BbCodeEngineTest {

    @Test
    void byteLength_countsUtf8() {
        assertEquals(0, BbCodeEngine.byteLength(""));
        assertEquals(3, BbCodeEngine.byteLength("abc"));
        assertEquals(2, BbCodeEngine.byteLength("é"));
        assertEquals(3, BbCodeEngine.byteLength("あ"));
        assertEquals(4, BbCodeEngine.byteLength("😀"));
    }

    @Test
    void byteLength_unpairedSurrogate_countsReplacementByte() {
        assertEquals(2, BbCodeEngine.byteLength("\uD800a"));
    }

    @Test
    void inputAtExactLimit_isAccepted() throws BbCodeException {
        var engine = BbCodeEngine.create(ParseOptions.DEFAULT.withMaxInputSize(6));

        assertEquals("ああ", engine.convert("ああ"));
    }

    @Test
    void zeroSizeLimit_acceptsOnlyEmptyInput() throws BbCodeException {
        var engine = BbCodeEngine.create(ParseOptions.DEFAULT.withMaxInputSize(0));

        assertTrue(engine.parse("")
                         .isEmpty());
        var thrown = assertThrows(BbCodeException.class, () -> engine.parse("x"));
        assertEquals(new ParseError.InputSizeExceeded(0, 1), thrown.error());
    }

    @Test
    void options_areExposed() {
        var options = ParseOptions.DEFAULT.withMaxTags(7);

        assertSame(options, BbCodeEngine.create(options)
                                        .options());
    }
}
