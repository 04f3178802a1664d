package org.pragmatica.bbcode.registry;

/**
 * How a tag's value attribute is checked.
 */
public enum ValuePolicy {
    /**
     * Any value is accepted as long as the tag allows one.
     */
    NONE,

    /**
     * Value must be a color, see {@link ColorValue}.
     */
    COLOR;

    public boolean accepts(String value) {
        return switch (this) {
            case NONE -> true;
            case COLOR -> ColorValue.isValid(value);
        };
    }
}
