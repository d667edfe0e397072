package org.astx.ast.literals;

import org.astx.ast.types.DataTypes;

import java.math.BigInteger;

/**
 * A signed 16-bit integer literal.
 */
public final class LiteralInt16 extends LiteralInteger {

    public LiteralInt16(long value) {
        super(DataTypes.int16(), BigInteger.valueOf(value));
    }
}
