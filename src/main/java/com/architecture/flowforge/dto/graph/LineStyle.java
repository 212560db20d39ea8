package com.architecture.flowforge.dto.graph;

/**
 * Connector line styles and their Mermaid tokens.
 *
 * Unlabelled: {@code a --> b}, {@code a --- b}.
 * Labelled: {@code a -- "text" --> b}, {@code a -- "text" --- b}.
 */
public enum LineStyle {
    SOLID("-->", "---", "--", "-->", "---"),
    DASHED("-.->", "-.-", "-.", ".->", ".-"),
    THICK("==>", "===", "==", "==>", "===");

    private final String arrow;
    private final String line;
    private final String labelOpen;
    private final String labelArrowClose;
    private final String labelLineClose;

    LineStyle(String arrow, String line, String labelOpen, String labelArrowClose, String labelLineClose) {
        this.arrow = arrow;
        this.line = line;
        this.labelOpen = labelOpen;
        this.labelArrowClose = labelArrowClose;
        this.labelLineClose = labelLineClose;
    }

    public String connector(boolean directed) {
        return directed ? arrow : line;
    }

    public String labelOpen() {
        return labelOpen;
    }

    public String labelClose(boolean directed) {
        return directed ? labelArrowClose : labelLineClose;
    }
}
