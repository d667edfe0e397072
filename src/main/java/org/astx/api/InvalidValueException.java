package org.astx.api;

/**
 * Raised when a value cannot be represented by its declared type,
 * or when a serialized structure holds a value that cannot be decoded.
 */
public class InvalidValueException extends AstException {

    public InvalidValueException(String message) {
        super(ErrorKind.VALUE, message);
    }

    public InvalidValueException(String message, Throwable cause) {
        super(ErrorKind.VALUE, message, cause);
    }
}
