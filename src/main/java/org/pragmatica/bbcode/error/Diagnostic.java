package org.pragmatica.bbcode.error;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Compiler-style report for a rejected input.
 *
 * <p>Example output:
 * <pre>
 * error[E0003]: Nest depth exceeded limit (max 2) at line 1, col 7. Near: "[color=red]x[/color]"
 *   --> 1:7
 *   |
 * 1 | [b][i][color=red]x[/color][/i][/b]
 *   |       ^^^^^^^^^^^^^^^^^^^^ nested too deep
 *   |
 *   = help: flatten the markup or raise maxDepth
 * </pre>
 *
 * @param severity severity level
 * @param code     stable error code
 * @param message  primary message
 * @param marker   position to point at, if the error has one
 * @param notes    additional notes or suggestions
 */
public record Diagnostic(
    Severity severity,
    String code,
    String message,
    Optional<Marker> marker,
    List<String> notes
) {
    public enum Severity {
        ERROR("error");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    /**
     * Underlined region on a single line.
     *
     * @param line   1-based line
     * @param column 1-based column in code points
     * @param width  number of code points to underline
     * @param label  text printed after the underline, may be empty
     */
    public record Marker(int line, int column, int width, String label) {}

    public Diagnostic {
        notes = List.copyOf(notes);
    }

    public static Diagnostic error(String code, String message) {
        return new Diagnostic(Severity.ERROR, code, message, Optional.empty(), List.of());
    }

    /**
     * Build the report for a parse failure.
     */
    public static Diagnostic of(ParseError error) {
        if (error instanceof ParseError.InputSizeExceeded size) {
            return error("E0001", size.message())
                .withNote("input is " + size.actual() + " bytes")
                .withHelp("shorten the input or raise maxInputSize");
        }
        if (error instanceof ParseError.TagCountExceeded count) {
            return error("E0002", count.message())
                .withHelp("use fewer tags or raise maxTags");
        }
        if (error instanceof ParseError.NestDepthExceeded depth) {
            var firstLine = depth.near()
                                 .split("\n", -1)[0];
            return error("E0003", depth.message())
                .withMarker(new Marker(depth.line(), depth.column(), codePoints(firstLine), "nested too deep"))
                .withHelp("flatten the markup or raise maxDepth");
        }
        var syntax = (ParseError.SyntaxError) error;
        return error("E0004", syntax.message())
            .withMarker(new Marker(syntax.location()
                                         .line(),
                                   syntax.location()
                                         .column(),
                                   1,
                                   "expected " + syntax.expected()))
            .withHelp("write \\[ for a literal bracket");
    }

    public Diagnostic withMarker(Marker newMarker) {
        return new Diagnostic(severity, code, message, Optional.of(newMarker), notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(severity, code, message, marker, newNotes);
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic against the source it was produced for.
     */
    public String format(String source) {
        var sb = new StringBuilder();

        sb.append(severity.display());
        if (code != null) {
            sb.append("[").append(code).append("]");
        }
        sb.append(": ").append(message).append("\n");

        int gutterWidth = marker.map(m -> String.valueOf(m.line())
                                                .length())
                                .orElse(1);
        var gutter = " ".repeat(gutterWidth + 1);

        marker.ifPresent(m -> {
            var lines = source.split("\n", -1);
            sb.append(gutter).append("--> ").append(m.line()).append(":").append(m.column()).append("\n");
            if (m.line() >= 1 && m.line() <= lines.length) {
                var lineContent = lines[m.line() - 1];
                sb.append(gutter).append("|\n");
                sb.append(String.format("%" + gutterWidth + "d", m.line()))
                  .append(" | ")
                  .append(lineContent)
                  .append("\n");
                sb.append(gutter).append("| ").append(underline(m, lineContent)).append("\n");
                sb.append(gutter).append("|\n");
            }
        });

        for (var note : notes) {
            sb.append(gutter).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    /**
     * Single-line form for logs.
     */
    public String formatSimple() {
        return marker.map(m -> String.format("input:%d:%d: %s[%s]: %s",
                                             m.line(), m.column(), severity.display(), code, message))
                     .orElseGet(() -> String.format("input: %s[%s]: %s", severity.display(), code, message));
    }

    private static String underline(Marker m, String lineContent) {
        int available = Math.max(1, codePoints(lineContent) - m.column() + 1);
        int width = Math.max(1, Math.min(m.width(), available));
        var sb = new StringBuilder();
        sb.append(" ".repeat(Math.max(0, m.column() - 1)));
        sb.append("^".repeat(width));
        if (!m.label().isEmpty()) {
            sb.append(" ").append(m.label());
        }
        return sb.toString();
    }

    private static int codePoints(String text) {
        return text.codePointCount(0, text.length());
    }
}
