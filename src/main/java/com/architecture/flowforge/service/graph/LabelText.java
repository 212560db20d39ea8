package com.architecture.flowforge.service.graph;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns draw.io cell values (often HTML when the style has html=1) into plain label text.
 */
public final class LabelText {

    // Line breaks and block-level tags separate words
    private static final Pattern BREAK_TAG_PATTERN = Pattern.compile(
            "<\\s*(br|/?div|/?p|/?li|/?tr|/?h[1-6])\\b[^>]*>", Pattern.CASE_INSENSITIVE);

    private static final Pattern TAG_PATTERN = Pattern.compile("<[^>]*>");

    private static final Pattern NUMERIC_ENTITY_PATTERN = Pattern.compile("&#(x?)([0-9a-fA-F]+);");

    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");

    private LabelText() {
    }

    /**
     * Strip markup, decode common entities and collapse whitespace.
     * Examples:
     * - "Should&nbsp;Run?" -> "Should Run?"
     * - "&lt;b&gt;" -> "<b>"
     * - "Line 1<br>Line 2" -> "Line 1 Line 2"
     */
    public static String toPlainText(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }

        String text = BREAK_TAG_PATTERN.matcher(value).replaceAll(" ");
        text = TAG_PATTERN.matcher(text).replaceAll("");
        text = decodeEntities(text);
        text = text.replace('\u00A0', ' ');
        return WHITESPACE_PATTERN.matcher(text).replaceAll(" ").trim();
    }

    private static String decodeEntities(String text) {
        if (text.indexOf('&') < 0) {
            return text;
        }

        Matcher matcher = NUMERIC_ENTITY_PATTERN.matcher(text);
        StringBuilder decoded = new StringBuilder();
        while (matcher.find()) {
            int radix = matcher.group(1).isEmpty() ? 10 : 16;
            String replacement;
            try {
                replacement = new String(Character.toChars(Integer.parseInt(matcher.group(2), radix)));
            } catch (IllegalArgumentException e) {
                replacement = matcher.group();
            }
            matcher.appendReplacement(decoded, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(decoded);

        // &amp; last so "&amp;lt;" stays "&lt;"
        return decoded.toString()
                .replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&apos;", "'")
                .replace("&amp;", "&");
    }
}
