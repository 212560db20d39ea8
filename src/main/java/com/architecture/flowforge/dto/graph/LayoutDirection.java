package com.architecture.flowforge.dto.graph;

/**
 * Flowchart layout direction written in the header line.
 */
public enum LayoutDirection {
    TD,
    LR;

    /**
     * Get the enum value from a string, case-insensitive. "TB" is accepted as an alias of TD.
     */
    public static LayoutDirection fromString(String value) {
        if (value == null || value.isBlank()) return null;
        String normalized = value.trim().toUpperCase();
        if ("TB".equals(normalized)) return TD;
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
