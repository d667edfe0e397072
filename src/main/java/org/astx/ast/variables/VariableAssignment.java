package org.astx.ast.variables;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Expr;
import org.astx.ast.Names;
import org.astx.ast.Statement;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;
import java.util.Objects;

/**
 * Stores a new value into an already declared name.
 */
public final class VariableAssignment extends Statement {

    private final String name;
    private final Expr value;

    public VariableAssignment(String name, Expr value) {
        this.name = Names.require(name, "Assignment");
        this.value = adopt(Objects.requireNonNull(value, "value"));
    }

    public String name() {
        return name;
    }

    public Expr value() {
        return value;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }

    @Override
    public AstKind kind() {
        return AstKind.VARIABLE_ASSIGNMENT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitVariableAssignment(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.attr("name", name).child("value", value);
    }

    @Override
    public String toString() {
        return "VariableAssignment[" + name + "]";
    }
}
