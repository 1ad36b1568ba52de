package com.probnet.xdsl.io;

/**
 * Thrown when the raw XDSL text is not well-formed markup. No partial result
 * exists when this is raised.
 */
public class MalformedDocumentException extends RuntimeException {

    public MalformedDocumentException(String message) {
        super(message);
    }

    public MalformedDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
