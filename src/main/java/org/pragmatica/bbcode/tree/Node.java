package org.pragmatica.bbcode.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Normalized BBCode tree handed to renderers. Immutable.
 */
public sealed interface Node {
    /**
     * Byte range of the input this node was built from.
     */
    Span span();

    static Text text(Span span, String text) {
        return new Text(span, text);
    }

    static Element element(String name, Span span) {
        return new Element(name, span, List.of(), List.of());
    }

    /**
     * Literal content. For fallback nodes the text equals the source slice verbatim.
     */
    record Text(Span span, String text) implements Node {}

    /**
     * Recognized tag. {@code name} is always lowercase and {@code span} covers both
     * the open and the close tag.
     */
    record Element(
    String name,
    Span span,
    List<Attribute> attrs,
    List<Node> children) implements Node {
        public Element {
            attrs = List.copyOf(attrs);
            children = List.copyOf(children);
        }

        public Optional<String> attr(String key) {
            return attrs.stream()
                        .filter(attribute -> attribute.key()
                                                      .equals(key))
                        .map(Attribute::value)
                        .findFirst();
        }

        public Element withAttr(String key, String value) {
            var newAttrs = new ArrayList<>(attrs);
            newAttrs.add(new Attribute(key, value));
            return new Element(name, span, newAttrs, children);
        }

        public Element withChildren(List<Node> newChildren) {
            return new Element(name, span, attrs, newChildren);
        }
    }
}
