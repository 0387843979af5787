package org.example.questionnaire.build;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Turns draw.io HTML labels into plain text. */
public final class LabelText {

    private static final Pattern LINE_BREAK = Pattern.compile("(?i)<br\\s*/?>|<div[^>]*>|</p>");
    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern NUMERIC_ENTITY = Pattern.compile("&#([xX][0-9a-fA-F]+|[0-9]+);");
    private static final Map<String, String> ENTITIES = Map.of(
        "&nbsp;", " ",
        "&lt;", "<",
        "&gt;", ">",
        "&quot;", "\"",
        "&apos;", "'");

    private LabelText() {
    }

    /**
     * Line-breaking tags become newlines, all other tags are dropped and
     * entities decoded. Lines are trimmed and blank lines removed.
     */
    public static String clean(String raw) {
        if (raw == null || raw.isEmpty()) return "";
        String text = LINE_BREAK.matcher(raw).replaceAll("\n");
        text = TAG.matcher(text).replaceAll("");
        for (Map.Entry<String, String> e : ENTITIES.entrySet()) {
            text = text.replace(e.getKey(), e.getValue());
        }
        text = decodeNumeric(text);
        // Last, so "&amp;lt;" stays "&lt;".
        text = text.replace("&amp;", "&");

        StringBuilder out = new StringBuilder();
        for (String line : text.split("\n")) {
            String l = line.replace('\u00A0', ' ').trim();
            if (l.isEmpty()) continue;
            if (out.length() > 0) out.append('\n');
            out.append(l);
        }
        return out.toString();
    }

    private static String decodeNumeric(String text) {
        Matcher m = NUMERIC_ENTITY.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String code = m.group(1);
            String replacement;
            try {
                int cp = (code.charAt(0) == 'x' || code.charAt(0) == 'X') ? Integer.parseInt(code.substring(1), 16) : Integer.parseInt(code);
                replacement = new String(Character.toChars(cp));
            } catch (IllegalArgumentException e) {
                // not a code point, keep as written
                replacement = m.group();
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
