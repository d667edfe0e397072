package org.astx.ast.literals;

import org.astx.ast.types.DataTypes;

/**
 * A 32-bit floating point literal.
 */
public final class LiteralFloat32 extends LiteralFloat {

    public LiteralFloat32(double value) {
        super(DataTypes.float32(), value);
    }
}
