package org.pragmatica.bbcode.error;

/**
 * Thrown when input is rejected. Carries the structured reason.
 */
public final class BbCodeException extends Exception {
    private static final long serialVersionUID = 1L;

    private final transient ParseError error;

    public BbCodeException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }

    /**
     * Render the failure as a diagnostic report against the rejected input.
     */
    public String format(String source) {
        return Diagnostic.of(error)
                         .format(source);
    }
}
