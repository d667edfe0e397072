package org.astx.ast.literals;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Expr;
import org.astx.ast.types.DataType;
import org.astx.ast.types.TupleType;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A fixed-length sequence; its type records the type of every position.
 */
public final class LiteralTuple extends Literal {

    private final List<Expr> elements;

    public LiteralTuple(List<? extends Expr> elements) {
        super(new TupleType(elements.stream().map(Expr::type).collect(Collectors.<DataType>toList())));
        this.elements = adoptAll(elements);
    }

    public List<Expr> elements() {
        return elements;
    }

    @Override
    public TupleType type() {
        return (TupleType) super.type();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(elements);
    }

    @Override
    public AstKind kind() {
        return AstKind.LITERAL_TUPLE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLiteralTuple(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.children("elements", elements);
    }

    @Override
    public String toString() {
        return "LiteralTuple";
    }
}
