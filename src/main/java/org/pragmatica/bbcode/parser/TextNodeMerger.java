package org.pragmatica.bbcode.parser;

import org.pragmatica.bbcode.tree.Node;
import org.pragmatica.bbcode.tree.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges adjacent text siblings at every level of the tree. The merged span runs
 * from the first node's start to the last node's end.
 */
public final class TextNodeMerger {
    private TextNodeMerger() {}

    public static List<Node> merge(List<Node> nodes) {
        var out = new ArrayList<Node>(nodes.size());
        var run = new TextRun();

        for (var node : nodes) {
            if (node instanceof Node.Element element) {
                run.flushTo(out);
                out.add(element.withChildren(merge(element.children())));
            } else {
                run.append((Node.Text) node);
            }
        }
        run.flushTo(out);
        return List.copyOf(out);
    }

    private static final class TextRun {
        private final StringBuilder text = new StringBuilder();
        private Span span;

        void append(Node.Text node) {
            span = span == null
                   ? node.span()
                   : span.extendTo(node.span());
            text.append(node.text());
        }

        void flushTo(List<Node> out) {
            if (span == null) {
                return;
            }
            out.add(Node.text(span, text.toString()));
            span = null;
            text.setLength(0);
        }
    }
}
