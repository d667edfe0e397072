package org.astx.ast.literals;

import org.astx.ast.types.DataTypes;

/**
 * A 64-bit floating point literal.
 */
public final class LiteralFloat64 extends LiteralFloat {

    public LiteralFloat64(double value) {
        super(DataTypes.float64(), value);
    }
}
