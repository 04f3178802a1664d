package org.pragmatica.bbcode.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.bbcode.tree.Node;
import org.pragmatica.bbcode.tree.Span;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextNodeMergerTest {

    @Test
    void merge_adjacentTexts_joinsTextAndSpans() {
        var merged = TextNodeMerger.merge(List.of(
            Node.text(Span.of(0, 2), "ab"),
            Node.text(Span.of(2, 4), "["),
            Node.text(Span.of(4, 5), "c")));

        assertEquals(List.of(Node.text(Span.of(0, 5), "ab[c")), merged);
    }

    @Test
    void merge_elementBetweenTexts_keepsThemApart() {
        var bold = Node.element("b", Span.of(1, 8));
        var merged = TextNodeMerger.merge(List.of(
            Node.text(Span.of(0, 1), "a"),
            bold,
            Node.text(Span.of(8, 9), "b"),
            Node.text(Span.of(9, 10), "c")));

        assertEquals(List.of(Node.text(Span.of(0, 1), "a"), bold, Node.text(Span.of(8, 10), "bc")), merged);
    }

    @Test
    void merge_recursesIntoChildren() {
        var italic = Node.element("i", Span.of(3, 12))
                         .withChildren(List.of(Node.text(Span.of(6, 7), "x"), Node.text(Span.of(7, 8), "y")));
        var bold = Node.element("b", Span.of(0, 16))
                       .withChildren(List.of(italic));

        var merged = TextNodeMerger.merge(List.of(bold));

        var mergedItalic = (Node.Element) ((Node.Element) merged.get(0)).children()
                                                                        .get(0);
        assertEquals(List.of(Node.text(Span.of(6, 8), "xy")), mergedItalic.children());
    }

    @Test
    void merge_preservesAttributes() {
        var color = Node.element("color", Span.of(0, 20))
                        .withAttr("value", "red")
                        .withChildren(List.of(Node.text(Span.of(11, 12), "x"), Node.text(Span.of(12, 13), "y")));

        var merged = (Node.Element) TextNodeMerger.merge(List.of(color))
                                                  .get(0);

        assertEquals(color.attrs(), merged.attrs());
        assertEquals(1, merged.children()
                              .size());
    }

    @Test
    void merge_emptyList_staysEmpty() {
        assertTrue(TextNodeMerger.merge(List.of())
                                 .isEmpty());
    }
}
