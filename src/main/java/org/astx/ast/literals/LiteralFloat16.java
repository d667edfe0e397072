package org.astx.ast.literals;

import org.astx.ast.types.DataTypes;

/**
 * A 16-bit floating point literal.
 */
public final class LiteralFloat16 extends LiteralFloat {

    public LiteralFloat16(double value) {
        super(DataTypes.float16(), value);
    }
}
