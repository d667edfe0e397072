package org.astx.ast.literals;

import org.astx.ast.types.DataTypes;

/**
 * A complex literal with Float64 components.
 */
public final class LiteralComplex64 extends LiteralComplex {

    public LiteralComplex64(double real, double imag) {
        super(DataTypes.complex64(), real, imag);
    }
}
