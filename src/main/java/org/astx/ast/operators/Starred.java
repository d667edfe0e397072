package org.astx.ast.operators;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Expr;
import org.astx.ast.types.DataType;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;

/**
 * An unpacking marker, {@code *value}, in call arguments or assignment targets.
 */
public final class Starred extends Expr {

    private final Expr value;

    public Starred(Expr value) {
        this.value = adopt(value);
    }

    public Expr value() {
        return value;
    }

    @Override
    public DataType type() {
        return value.type();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }

    @Override
    public AstKind kind() {
        return AstKind.STARRED;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitStarred(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("value", value);
    }

    @Override
    public String toString() {
        return "Starred";
    }
}
