package com.architecture.flowforge.exception;

/**
 * The input could not be turned into diagram pages: unreadable XML, no diagram content,
 * or a payload that none of the known encodings decode.
 */
public class DiagramLoadException extends RuntimeException {

    public DiagramLoadException(String message) {
        super(message);
    }

    public DiagramLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
