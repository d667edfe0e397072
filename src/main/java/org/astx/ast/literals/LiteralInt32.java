package org.astx.ast.literals;

import org.astx.ast.types.DataTypes;

import java.math.BigInteger;

/**
 * A signed 32-bit integer literal.
 */
public final class LiteralInt32 extends LiteralInteger {

    public LiteralInt32(long value) {
        super(DataTypes.int32(), BigInteger.valueOf(value));
    }
}
