package org.astx.api;

/**
 * Raised when an ordered container is indexed outside {@code [0, size)}.
 */
public class NodeIndexException extends AstException {

    private final int index;
    private final int size;

    public NodeIndexException(int index, int size) {
        super(ErrorKind.INDEX, String.format("Index %d out of range for container of size %d", index, size));
        this.index = index;
        this.size = size;
    }

    public int index() {
        return index;
    }

    public int size() {
        return size;
    }
}
