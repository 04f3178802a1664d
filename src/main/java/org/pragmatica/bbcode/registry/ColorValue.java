package org.pragmatica.bbcode.registry;

import com.google.common.base.CharMatcher;

import java.util.regex.Pattern;

/**
 * Color attribute format: an alphabetic keyword, {@code #RGB} or {@code #RRGGBB}.
 */
public final class ColorValue {
    private static final Pattern COLOR = Pattern.compile("^([A-Za-z]+|#[0-9A-Fa-f]{3}([0-9A-Fa-f]{3})?)$");

    private ColorValue() {}

    /**
     * Check the value after trimming surrounding whitespace.
     */
    public static boolean isValid(String value) {
        return COLOR.matcher(trim(value))
                    .matches();
    }

    /**
     * Remove leading and trailing Unicode whitespace, including no-break space and NEL.
     */
    public static String trim(String value) {
        return CharMatcher.whitespace()
                          .trimFrom(value);
    }
}
