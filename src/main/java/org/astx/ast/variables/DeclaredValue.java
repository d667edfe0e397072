package org.astx.ast.variables;

import org.astx.api.MalformedNodeException;
import org.astx.api.TypeMismatchException;
import org.astx.ast.Expr;
import org.astx.ast.modifiers.MutabilityKind;
import org.astx.ast.types.DataType;
import org.astx.ast.types.DataTypes;

final class DeclaredValue {

    private DeclaredValue() {}

    static void check(String name, DataType type, MutabilityKind mutability, Expr value) {
        if (value == null) {
            if (mutability == MutabilityKind.CONSTANT) {
                throw new MalformedNodeException("Constant '" + name + "' requires an initializer");
            }
            return;
        }
        if (!DataTypes.isCompatible(type, value.type())) {
            throw new TypeMismatchException(String.format(
                    "Initializer of '%s' has type %s, which is not compatible with %s",
                    name, value.type(), type));
        }
    }
}
