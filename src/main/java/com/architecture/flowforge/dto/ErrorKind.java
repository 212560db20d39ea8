package com.architecture.flowforge.dto;

/**
 * Diagnostic kinds raised while converting a page.
 */
public enum ErrorKind {
    CYCLIC_HIERARCHY(true, false),
    DANGLING_EDGE_REFERENCE(false, false),
    UNSUPPORTED_ELEMENT(false, false),
    RESERVED_WORD_COLLISION(false, true),
    UNRECOGNIZED_STYLE_MARKER(false, false),
    UNRESOLVED_PARENT(false, false),
    MALFORMED_PAGE(true, false);

    private final boolean fatal;
    private final boolean informational;

    ErrorKind(boolean fatal, boolean informational) {
        this.fatal = fatal;
        this.informational = informational;
    }

    /**
     * Fatal kinds abort the page in every mode.
     */
    public boolean isFatal() {
        return fatal;
    }

    /**
     * Informational kinds are always resolved automatically and never abort, even in strict mode.
     */
    public boolean isInformational() {
        return informational;
    }
}
