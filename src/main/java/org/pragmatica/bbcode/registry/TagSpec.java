package org.pragmatica.bbcode.registry;

/**
 * What a known tag may carry.
 *
 * @param allowValueAttr whether {@code [tag=value]} is permitted
 * @param policy         check applied to the value when present
 */
public record TagSpec(boolean allowValueAttr, ValuePolicy policy) {

    public static final TagSpec SIMPLE = new TagSpec(false, ValuePolicy.NONE);

    public static TagSpec withValue(ValuePolicy policy) {
        return new TagSpec(true, policy);
    }

    /**
     * Whether a present attribute value is acceptable for this tag. A tag without a
     * value attribute is always acceptable.
     */
    public boolean accepts(String value) {
        return allowValueAttr && policy.accepts(value);
    }
}
