package org.example.questionnaire.style;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Parses draw.io style strings such as
 * {@code "rhombus;whiteSpace=wrap;html=1;fillColor=#f8cecc"}.
 */
public final class StyleParser {

    private StyleParser() {
    }

    /**
     * Splits on {@code ;} and then on the first {@code =}. A token without a
     * value is a flag and maps to itself. Keys keep their order of appearance;
     * a repeated key keeps its last value.
     */
    public static Map<String, String> parse(String style) {
        Map<String, String> out = new LinkedHashMap<>();
        if (style == null) return out;
        for (String token : style.split(";")) {
            String t = token.trim();
            if (t.isEmpty()) continue;
            int eq = t.indexOf('=');
            if (eq < 0) {
                out.put(t, t);
            } else {
                String key = t.substring(0, eq).trim();
                if (key.isEmpty()) continue;
                out.put(key, t.substring(eq + 1).trim());
            }
        }
        return out;
    }

    /** Inverse of {@link #parse(String)}; flags are written without a value. */
    public static String format(Map<String, String> style) {
        StringJoiner joiner = new StringJoiner(";");
        style.forEach((key, value) -> joiner.add(key.equals(value) ? key : key + "=" + value));
        return joiner.toString();
    }
}
