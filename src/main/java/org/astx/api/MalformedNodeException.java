package org.astx.api;

/**
 * Raised when a node would be structurally invalid, for example an augmented
 * assignment whose target is not a variable.
 */
public class MalformedNodeException extends AstException {

    public MalformedNodeException(String message) {
        super(ErrorKind.SYNTAX, message);
    }
}
