package org.pragmatica.bbcode.tree;

/**
 * Element attribute. The only key the builder ever produces is {@link #VALUE}.
 */
public record Attribute(String key, String value) {
    public static final String VALUE = "value";

    public static Attribute value(String value) {
        return new Attribute(VALUE, value);
    }
}
