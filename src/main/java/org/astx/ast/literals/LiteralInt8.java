package org.astx.ast.literals;

import org.astx.ast.types.DataTypes;

import java.math.BigInteger;

/**
 * A signed 8-bit integer literal.
 */
public final class LiteralInt8 extends LiteralInteger {

    public LiteralInt8(long value) {
        super(DataTypes.int8(), BigInteger.valueOf(value));
    }
}
