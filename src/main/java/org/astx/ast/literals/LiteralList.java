package org.astx.ast.literals;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Expr;
import org.astx.ast.types.DataTypes;
import org.astx.ast.types.ListType;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;

/**
 * An ordered list of element expressions. Without a declared type the element type is
 * inferred; mixed elements give a heterogeneous list.
 */
public final class LiteralList extends Literal {

    private final List<Expr> elements;

    public LiteralList(List<? extends Expr> elements) {
        this(elements, DataTypes.list(CollectionLiterals.commonType(elements)));
    }

    public LiteralList(List<? extends Expr> elements, ListType type) {
        super(type);
        CollectionLiterals.requireElementsOf(type.elementType(), elements, "Element");
        this.elements = adoptAll(elements);
    }

    public List<Expr> elements() {
        return elements;
    }

    @Override
    public ListType type() {
        return (ListType) super.type();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(elements);
    }

    @Override
    public AstKind kind() {
        return AstKind.LITERAL_LIST;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLiteralList(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("type", type()).children("elements", elements);
    }

    @Override
    public String toString() {
        return "LiteralList";
    }
}
