package org.astx.ast.comprehensions;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Expr;
import org.astx.ast.types.DataType;
import org.astx.ast.types.DataTypes;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lazily yields the element expression. Its type is the list of elements it would produce.
 */
public final class GeneratorExpr extends Comprehension {

    private final Expr element;

    public GeneratorExpr(Expr element, List<ComprehensionClause> clauses) {
        super(clauses);
        this.element = adopt(Objects.requireNonNull(element, "element"));
    }

    public Expr element() {
        return element;
    }

    @Override
    public DataType type() {
        return DataTypes.list(element.type());
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(element);
        children.addAll(clauses());
        return children;
    }

    @Override
    public AstKind kind() {
        return AstKind.GENERATOR_EXPR;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitGeneratorExpr(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("element", element).children("clauses", clauses());
    }
}
