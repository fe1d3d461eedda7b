package org.dxworks.codeflow.ast;

/**
 * Raised when a front end cannot produce a usable syntax tree.
 */
public class FrontEndException extends Exception {

    public FrontEndException(String message) {
        super(message);
    }

    public FrontEndException(String message, Throwable cause) {
        super(message, cause);
    }
}
