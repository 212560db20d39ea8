package com.architecture.flowforge.exception;

import com.architecture.flowforge.dto.ErrorKind;

/**
 * Aborts the conversion of a single page. Raised for fatal kinds in every mode and for
 * recoverable kinds in strict mode.
 */
public class ConversionException extends RuntimeException {

    private final ErrorKind kind;
    private final String sourceId;

    public ConversionException(ErrorKind kind, String sourceId, String message) {
        super(message);
        this.kind = kind;
        this.sourceId = sourceId;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getSourceId() {
        return sourceId;
    }
}
