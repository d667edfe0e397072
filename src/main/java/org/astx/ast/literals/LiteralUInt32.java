package org.astx.ast.literals;

import org.astx.ast.types.DataTypes;

import java.math.BigInteger;

/**
 * An unsigned 32-bit integer literal.
 */
public final class LiteralUInt32 extends LiteralInteger {

    public LiteralUInt32(long value) {
        super(DataTypes.uint32(), BigInteger.valueOf(value));
    }
}
