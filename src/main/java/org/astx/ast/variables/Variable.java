package org.astx.ast.variables;

import org.astx.ast.AstKind;
import org.astx.ast.Expr;
import org.astx.ast.Names;
import org.astx.ast.types.DataType;
import org.astx.ast.types.DataTypes;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.Objects;

/**
 * A reference to a named storage location. Variables are the only addressable
 * expressions: assignment operators require one as their target.
 */
public final class Variable extends Expr {

    private final String name;
    private final DataType type;

    /**
     * Creates an untyped reference; its type is {@code Any}.
     */
    public Variable(String name) {
        this(name, DataTypes.any());
    }

    public Variable(String name, DataType type) {
        this.name = Names.require(name, "Variable");
        this.type = Objects.requireNonNull(type, "type");
    }

    public String name() {
        return name;
    }

    @Override
    public DataType type() {
        return type;
    }

    @Override
    public AstKind kind() {
        return AstKind.VARIABLE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.attr("name", name).child("type", type);
    }

    @Override
    public String toString() {
        return "Variable[" + name + "]";
    }
}
