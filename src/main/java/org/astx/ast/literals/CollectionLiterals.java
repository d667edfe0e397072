package org.astx.ast.literals;

import org.astx.api.InvalidValueException;
import org.astx.api.TypeMismatchException;
import org.astx.ast.Expr;
import org.astx.ast.types.DataType;
import org.astx.ast.types.DataTypes;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Element type inference and validation shared by the collection literals.
 */
final class CollectionLiterals {

    private CollectionLiterals() {}

    /**
     * @return The common element type, or {@code Any} when the list is empty or mixed.
     */
    static DataType commonType(List<? extends Expr> elements) {
        if (elements.isEmpty()) {
            return DataTypes.any();
        }
        DataType first = elements.get(0).type();
        for (Expr element : elements) {
            if (!element.type().equals(first)) {
                return DataTypes.any();
            }
        }
        return first;
    }

    /**
     * Every element must be storable as {@code declared} without loss, unless it is {@code Any}.
     */
    static void requireElementsOf(DataType declared, List<? extends Expr> elements, String role) {
        for (Expr element : elements) {
            if (!DataTypes.isAssignable(declared, element.type())) {
                throw new TypeMismatchException(String.format(
                        "%s %s of type %s does not match declared %s", role, element, element.type(), declared));
            }
        }
    }

    static void requireDistinct(List<? extends Expr> elements, String what) {
        Set<Expr> seen = new HashSet<>();
        for (Expr element : elements) {
            if (!seen.add(element)) {
                throw new InvalidValueException("Duplicate " + what + ": " + element);
            }
        }
    }
}
