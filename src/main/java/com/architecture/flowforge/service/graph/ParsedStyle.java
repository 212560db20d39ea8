package com.architecture.flowforge.service.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Tokenised draw.io style string: bare flags plus key=value pairs.
 * Flags are stored lower-case; keys keep their case (draw.io keys are camelCase). Later keys win.
 */
public final class ParsedStyle {

    private final Set<String> flags;
    private final Map<String, String> values;

    private ParsedStyle(Set<String> flags, Map<String, String> values) {
        this.flags = Collections.unmodifiableSet(flags);
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * Parse a style string.
     * Example: "ellipse;whiteSpace=wrap;html=1" -> flags [ellipse], values {whiteSpace=wrap, html=1}
     */
    public static ParsedStyle parse(String style) {
        Set<String> flags = new LinkedHashSet<>();
        Map<String, String> values = new LinkedHashMap<>();
        if (style != null) {
            for (String rawToken : style.split(";")) {
                String token = rawToken.trim();
                if (token.isEmpty()) continue;

                int eq = token.indexOf('=');
                if (eq < 0) {
                    flags.add(token.toLowerCase(Locale.ROOT));
                } else {
                    String key = token.substring(0, eq).trim();
                    if (!key.isEmpty()) {
                        values.put(key, token.substring(eq + 1).trim());
                    }
                }
            }
        }
        return new ParsedStyle(flags, values);
    }

    public boolean hasFlag(String flag) {
        return flags.contains(flag);
    }

    public String get(String key) {
        return values.get(key);
    }

    /**
     * Lower-cased shape= value, or null.
     */
    public String shape() {
        String shape = values.get("shape");
        return shape == null || shape.isEmpty() ? null : shape.toLowerCase(Locale.ROOT);
    }

    /**
     * True for a "key=1" / "key=true" value or a bare "key" flag.
     */
    public boolean isOn(String key) {
        String value = values.get(key);
        if (value == null) {
            return flags.contains(key.toLowerCase(Locale.ROOT));
        }
        return "1".equals(value) || "true".equalsIgnoreCase(value);
    }

    public double getDouble(String key, double defaultValue) {
        String value = values.get(key);
        if (value == null) return defaultValue;
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * True when the marker appears as a bare flag or as the shape= value.
     */
    public boolean hasMarker(String marker) {
        String normalized = marker.toLowerCase(Locale.ROOT);
        return flags.contains(normalized) || normalized.equals(shape());
    }

    public Set<String> getFlags() {
        return flags;
    }

    public Map<String, String> getValues() {
        return values;
    }
}
