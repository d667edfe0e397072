package org.astx.api;

/**
 * Raised when operand or element types have no entry in the promotion rules.
 */
public class TypeMismatchException extends AstException {

    public TypeMismatchException(String message) {
        super(ErrorKind.TYPE, message);
    }
}
