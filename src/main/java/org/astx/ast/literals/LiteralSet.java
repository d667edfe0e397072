package org.astx.ast.literals;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Expr;
import org.astx.ast.types.DataTypes;
import org.astx.ast.types.SetType;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;

/**
 * A set of element expressions in source order. Structurally equal elements are rejected.
 */
public final class LiteralSet extends Literal {

    private final List<Expr> elements;

    public LiteralSet(List<? extends Expr> elements) {
        this(elements, DataTypes.set(CollectionLiterals.commonType(elements)));
    }

    public LiteralSet(List<? extends Expr> elements, SetType type) {
        super(type);
        CollectionLiterals.requireElementsOf(type.elementType(), elements, "Element");
        CollectionLiterals.requireDistinct(elements, "set element");
        this.elements = adoptAll(elements);
    }

    public List<Expr> elements() {
        return elements;
    }

    @Override
    public SetType type() {
        return (SetType) super.type();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(elements);
    }

    @Override
    public AstKind kind() {
        return AstKind.LITERAL_SET;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLiteralSet(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("type", type()).children("elements", elements);
    }

    @Override
    public String toString() {
        return "LiteralSet";
    }
}
