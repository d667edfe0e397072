package org.astx.ast.literals;

import org.astx.ast.types.DataTypes;

import java.math.BigInteger;

/**
 * A signed 64-bit integer literal.
 */
public final class LiteralInt64 extends LiteralInteger {

    public LiteralInt64(long value) {
        super(DataTypes.int64(), BigInteger.valueOf(value));
    }
}
