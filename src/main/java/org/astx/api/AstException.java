package org.astx.api;

/**
 * Base of all failures raised while building, indexing, serializing or visiting a tree.
 * <p>
 * Every subclass fixes its {@link ErrorKind}, so callers may either catch the concrete
 * type or inspect {@link #kind()}.
 */
public abstract class AstException extends RuntimeException {

    private final ErrorKind kind;

    protected AstException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected AstException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * @return The category of this failure.
     */
    public ErrorKind kind() {
        return kind;
    }
}
