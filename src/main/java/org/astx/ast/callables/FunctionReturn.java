package org.astx.ast.callables;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Expr;
import org.astx.ast.Statement;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;

public final class FunctionReturn extends Statement {

    private final Expr value;

    public FunctionReturn() {
        this(null);
    }

    public FunctionReturn(Expr value) {
        this.value = adopt(value);
    }

    /**
     * @return The returned value, or {@code null} for a bare return.
     */
    public Expr value() {
        return value;
    }

    @Override
    public List<AstNode> getChildren() {
        return value == null ? List.of() : List.of(value);
    }

    @Override
    public AstKind kind() {
        return AstKind.FUNCTION_RETURN;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunctionReturn(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.optionalChild("value", value);
    }

    @Override
    public String toString() {
        return "FunctionReturn";
    }
}
