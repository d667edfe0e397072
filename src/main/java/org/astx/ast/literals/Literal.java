package org.astx.ast.literals;

import org.astx.ast.Expr;
import org.astx.ast.types.DataType;

import java.util.Objects;

/**
 * A typed leaf holding a concrete value. The value is validated against the
 * declared type when the literal is constructed.
 */
public abstract class Literal extends Expr {

    private final DataType type;

    protected Literal(DataType type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    @Override
    public DataType type() {
        return type;
    }
}
