package org.pragmatica.bbcode.render;

import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;

/**
 * Text transformations applied to literal content before it is written as HTML.
 */
public final class HtmlEscaping {
    private static final Escaper HTML_TEXT = Escapers.builder()
                                                     .addEscape('&', "&amp;")
                                                     .addEscape('<', "&lt;")
                                                     .addEscape('>', "&gt;")
                                                     .addEscape('"', "&quot;")
                                                     .build();

    private HtmlEscaping() {}

    /**
     * Escape {@code & < > "}. Nothing else is touched.
     */
    public static String escape(String text) {
        return HTML_TEXT.escape(text);
    }

    /**
     * Normalize CRLF and CR to LF, then replace every LF with {@code <br>}.
     */
    public static String lineBreaks(String text) {
        return text.replace("\r\n", "\n")
                   .replace('\r', '\n')
                   .replace("\n", "<br>");
    }
}
