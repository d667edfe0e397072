package org.astx.ast.literals;

import org.astx.ast.types.DataTypes;

import java.math.BigInteger;

/**
 * An unsigned 8-bit integer literal.
 */
public final class LiteralUInt8 extends LiteralInteger {

    public LiteralUInt8(long value) {
        super(DataTypes.uint8(), BigInteger.valueOf(value));
    }
}
