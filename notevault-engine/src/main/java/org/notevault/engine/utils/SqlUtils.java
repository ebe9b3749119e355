package org.notevault.engine.utils;

import lombok.experimental.UtilityClass;

import java.util.Locale;

@UtilityClass
public class SqlUtils {

    public static final String LIKE_ESCAPE = " ESCAPE '\\'";

    /**
     * Upper-cased LIKE pattern matching {@code value} anywhere, with wildcards in the value escaped.
     */
    public static String containsPattern(String value) {
        String escaped = value.toUpperCase(Locale.ROOT)
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
        return "%" + escaped + "%";
    }
}
