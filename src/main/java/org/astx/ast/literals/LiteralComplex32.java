package org.astx.ast.literals;

import org.astx.ast.types.DataTypes;

/**
 * A complex literal with Float32 components.
 */
public final class LiteralComplex32 extends LiteralComplex {

    public LiteralComplex32(double real, double imag) {
        super(DataTypes.complex32(), real, imag);
    }
}
