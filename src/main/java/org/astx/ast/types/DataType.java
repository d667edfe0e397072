package org.astx.ast.types;

import org.astx.ast.AstNode;

/**
 * Base of all type descriptors. Type descriptors are immutable: all parameters are
 * fixed by the constructor and none of them can be replaced afterwards.
 * <p>
 * Types are compared structurally, so {@code new IntegerType(32, true)} equals
 * {@link DataTypes#int32()} no matter which instance is used.
 */
public abstract class DataType extends AstNode {

    public abstract TypeFamily family();

    public boolean isNumeric() {
        return family().isNumeric();
    }
}
