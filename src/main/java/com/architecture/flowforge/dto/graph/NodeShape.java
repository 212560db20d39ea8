package com.architecture.flowforge.dto.graph;

import java.util.Locale;

/**
 * Mermaid flowchart node shapes and the bracket pair each one wraps a label with.
 */
public enum NodeShape {
    RECTANGLE("[", "]"),
    ROUNDED("(", ")"),
    STADIUM("([", "])"),
    SUBROUTINE("[[", "]]"),
    DATABASE("[(", ")]"),
    CIRCLE("((", "))"),
    DOUBLE_CIRCLE("(((", ")))"),
    ASYMMETRIC(">", "]"),
    DIAMOND("{", "}"),
    HEXAGON("{{", "}}"),
    PARALLELOGRAM("[/", "/]"),
    PARALLELOGRAM_ALT("[\\", "\\]"),
    TRAPEZOID("[/", "\\]"),
    TRAPEZOID_ALT("[\\", "/]");

    private final String open;
    private final String close;

    NodeShape(String open, String close) {
        this.open = open;
        this.close = close;
    }

    public String getOpen() {
        return open;
    }

    public String getClose() {
        return close;
    }

    /**
     * Resolve a shape from its enum name (case-insensitive) or from its full bracket pair,
     * e.g. "DATABASE", "database" or "[()]".
     */
    public static NodeShape fromToken(String token) {
        if (token == null) return null;
        String trimmed = token.trim();
        if (trimmed.isEmpty()) return null;
        try {
            return valueOf(trimmed.toUpperCase(Locale.ROOT).replace(' ', '_'));
        } catch (IllegalArgumentException e) {
            String compact = trimmed.replaceAll("\\s+", "");
            for (NodeShape shape : values()) {
                if ((shape.open + shape.close).equals(compact)) {
                    return shape;
                }
            }
            return null;
        }
    }
}
