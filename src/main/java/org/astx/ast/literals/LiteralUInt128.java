package org.astx.ast.literals;

import org.astx.ast.types.DataTypes;

import java.math.BigInteger;

/**
 * An unsigned 128-bit integer literal.
 */
public final class LiteralUInt128 extends LiteralInteger {

    public LiteralUInt128(long value) {
        this(BigInteger.valueOf(value));
    }

    public LiteralUInt128(BigInteger value) {
        super(DataTypes.uint128(), value);
    }
}
