package org.astx.ast.literals;

import org.astx.ast.types.DataTypes;

import java.math.BigInteger;

/**
 * A signed 128-bit integer literal.
 */
public final class LiteralInt128 extends LiteralInteger {

    public LiteralInt128(long value) {
        this(BigInteger.valueOf(value));
    }

    public LiteralInt128(BigInteger value) {
        super(DataTypes.int128(), value);
    }
}
