package org.astx.ast.literals;

import org.astx.ast.types.DataTypes;

import java.math.BigInteger;

/**
 * An unsigned 64-bit integer literal. Values above {@link Long#MAX_VALUE} need the {@link BigInteger} constructor.
 */
public final class LiteralUInt64 extends LiteralInteger {

    public LiteralUInt64(long value) {
        this(BigInteger.valueOf(value));
    }

    public LiteralUInt64(BigInteger value) {
        super(DataTypes.uint64(), value);
    }
}
