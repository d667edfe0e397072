package org.astx.ast.callables;

import org.astx.api.TypeMismatchException;
import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Expr;
import org.astx.ast.Names;
import org.astx.ast.types.DataType;
import org.astx.ast.types.DataTypes;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;
import java.util.Objects;

/**
 * A formal parameter: name, type and an optional default value.
 */
public final class Argument extends AstNode {

    private final String name;
    private final DataType type;
    private final Expr defaultValue;

    public Argument(String name, DataType type) {
        this(name, type, null);
    }

    public Argument(String name, DataType type, Expr defaultValue) {
        this.name = Names.require(name, "Argument");
        this.type = Objects.requireNonNull(type, "type");
        if (defaultValue != null && !DataTypes.isCompatible(type, defaultValue.type())) {
            throw new TypeMismatchException(String.format(
                    "Default of argument '%s' has type %s, expected %s", name, defaultValue.type(), type));
        }
        this.defaultValue = adopt(defaultValue);
    }

    public String name() {
        return name;
    }

    public DataType type() {
        return type;
    }

    /**
     * @return The default value, or {@code null} when the argument is required.
     */
    public Expr defaultValue() {
        return defaultValue;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    @Override
    public List<AstNode> getChildren() {
        return defaultValue == null ? List.of() : List.of(defaultValue);
    }

    @Override
    public AstKind kind() {
        return AstKind.ARGUMENT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitArgument(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.attr("name", name).child("type", type).optionalChild("default", defaultValue);
    }

    @Override
    public String toString() {
        return "Argument[" + name + ", " + type + "]";
    }
}
