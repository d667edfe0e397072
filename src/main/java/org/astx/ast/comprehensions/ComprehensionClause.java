package org.astx.ast.comprehensions;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Expr;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One {@code for target in iterable if c1 if c2} clause. The filter conditions are ANDed.
 */
public final class ComprehensionClause extends AstNode {

    private final Expr target;
    private final Expr iterable;
    private final List<Expr> conditions;
    private final boolean isAsync;

    public ComprehensionClause(Expr target, Expr iterable) {
        this(target, iterable, List.of(), false);
    }

    public ComprehensionClause(Expr target, Expr iterable, List<? extends Expr> conditions, boolean isAsync) {
        this.target = adopt(Objects.requireNonNull(target, "target"));
        this.iterable = adopt(Objects.requireNonNull(iterable, "iterable"));
        this.conditions = adoptAll(conditions);
        this.isAsync = isAsync;
    }

    public Expr target() {
        return target;
    }

    public Expr iterable() {
        return iterable;
    }

    public List<Expr> conditions() {
        return conditions;
    }

    public boolean isAsync() {
        return isAsync;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(List.of(target, iterable));
        children.addAll(conditions);
        return children;
    }

    @Override
    public AstKind kind() {
        return AstKind.COMPREHENSION_CLAUSE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitComprehensionClause(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.attr("async", isAsync)
                .child("target", target)
                .child("iterable", iterable)
                .children("conditions", conditions);
    }

    @Override
    public String toString() {
        return isAsync ? "ComprehensionClause[async]" : "ComprehensionClause";
    }
}
