package org.pragmatica.bbcode.render;

import org.pragmatica.bbcode.registry.TagRegistry;
import org.pragmatica.bbcode.registry.ValuePolicy;
import org.pragmatica.bbcode.tree.Attribute;
import org.pragmatica.bbcode.tree.Node;

import java.util.List;

/**
 * Renders an AST to HTML. Never fails: anything that does not check out is rendered
 * as its children only.
 *
 * <p>Color values are validated again here even though the builder already did so,
 * so a tree assembled by other means still cannot inject markup.
 */
public final class HtmlRenderer {
    private HtmlRenderer() {}

    public static String render(List<Node> nodes) {
        var out = new StringBuilder();
        renderAll(nodes, out);
        return out.toString();
    }

    private static void renderAll(List<Node> nodes, StringBuilder out) {
        for (var node : nodes) {
            renderNode(node, out);
        }
    }

    private static void renderNode(Node node, StringBuilder out) {
        if (node instanceof Node.Element element) {
            renderElement(element, out);
            return;
        }
        var text = (Node.Text) node;
        out.append(HtmlEscaping.lineBreaks(HtmlEscaping.escape(text.text())));
    }

    private static void renderElement(Node.Element element, StringBuilder out) {
        if (!TagRegistry.isKnown(element.name())) {
            renderAll(element.children(), out);
            return;
        }
        switch (element.name()) {
            case TagRegistry.BOLD -> wrap("b", element, out);
            case TagRegistry.ITALIC -> wrap("i", element, out);
            case TagRegistry.COLOR -> renderColor(element, out);
            default -> renderAll(element.children(), out);
        }
    }

    private static void renderColor(Node.Element element, StringBuilder out) {
        var value = element.attr(Attribute.VALUE);
        if (value.isEmpty() || !ValuePolicy.COLOR.accepts(value.get())) {
            renderAll(element.children(), out);
            return;
        }
        out.append("<span style=\"color:")
           .append(HtmlEscaping.escape(value.get()))
           .append("\">");
        renderAll(element.children(), out);
        out.append("</span>");
    }

    private static void wrap(String htmlTag, Node.Element element, StringBuilder out) {
        out.append('<').append(htmlTag).append('>');
        renderAll(element.children(), out);
        out.append("</").append(htmlTag).append('>');
    }
}
