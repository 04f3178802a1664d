package org.pragmatica.bbcode.registry;

import com.google.common.collect.ImmutableMap;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Static table of structural tags. Shared read-only by every parse and render.
 *
 * <p>Adding a tag means adding one entry here and, if it renders differently from
 * its children, one branch in the HTML renderer.
 */
public final class TagRegistry {
    public static final String BOLD = "b";
    public static final String ITALIC = "i";
    public static final String COLOR = "color";

    private static final ImmutableMap<String, TagSpec> TAGS = ImmutableMap.of(
        BOLD, TagSpec.SIMPLE,
        ITALIC, TagSpec.SIMPLE,
        COLOR, TagSpec.withValue(ValuePolicy.COLOR));

    private TagRegistry() {}

    /**
     * Get the spec for a tag name, matched case-insensitively.
     */
    public static Optional<TagSpec> lookup(String tagName) {
        return Optional.ofNullable(TAGS.get(normalize(tagName)));
    }

    public static boolean isKnown(String tagName) {
        return TAGS.containsKey(normalize(tagName));
    }

    public static Set<String> tagNames() {
        return TAGS.keySet();
    }

    public static String normalize(String tagName) {
        return tagName.toLowerCase(Locale.ROOT);
    }
}
