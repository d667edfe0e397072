package org.astx.ast;

import org.astx.ast.types.DataType;
import org.astx.ast.types.DataTypes;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.Objects;

/**
 * A bare name, for example a goto label or a qualified attribute path.
 * Unlike {@link org.astx.ast.variables.Variable} it is not an assignment target.
 */
public class Identifier extends Expr {

    private final String value;

    public Identifier(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public String value() {
        return value;
    }

    @Override
    public DataType type() {
        return DataTypes.any();
    }

    @Override
    public AstKind kind() {
        return AstKind.IDENTIFIER;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.attr("value", value);
    }

    @Override
    public String toString() {
        return "Identifier[" + value + "]";
    }
}
