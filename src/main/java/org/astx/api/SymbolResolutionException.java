package org.astx.api;

/**
 * Raised on a same-scope redefinition or when a name is not visible from the requested scope.
 */
public class SymbolResolutionException extends AstException {

    private final String symbolName;

    public SymbolResolutionException(String symbolName, String message) {
        super(ErrorKind.KEY, message);
        this.symbolName = symbolName;
    }

    /**
     * @return The name that failed to define or resolve.
     */
    public String symbolName() {
        return symbolName;
    }
}
