package org.astx.api;

/**
 * Raised by a visitor that has no handling routine for the node variant it was given.
 */
public class UnhandledNodeException extends AstException {

    public UnhandledNodeException(String message) {
        super(ErrorKind.NOT_IMPLEMENTED, message);
    }
}
