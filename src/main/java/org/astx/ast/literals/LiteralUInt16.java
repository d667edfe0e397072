package org.astx.ast.literals;

import org.astx.ast.types.DataTypes;

import java.math.BigInteger;

/**
 * An unsigned 16-bit integer literal.
 */
public final class LiteralUInt16 extends LiteralInteger {

    public LiteralUInt16(long value) {
        super(DataTypes.uint16(), BigInteger.valueOf(value));
    }
}
