package org.astx.ast.flows;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Block;
import org.astx.ast.Expr;
import org.astx.ast.Statement;
import org.astx.ast.variables.InlineVariableDeclaration;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Iterates a variable from {@code start} (inclusive) to {@code end} (exclusive) by {@code step}.
 * A literal zero step is rejected; a missing step means one.
 */
public final class ForRangeLoopStmt extends Statement {

    private final InlineVariableDeclaration variable;
    private final Expr start;
    private final Expr end;
    private final Expr step;
    private final Block body;

    public ForRangeLoopStmt(InlineVariableDeclaration variable, Expr start, Expr end, Expr step, Block body) {
        LoopChecks.requireNumeric(start, "start");
        LoopChecks.requireNumeric(end, "end");
        LoopChecks.requireNumeric(step, "step");
        LoopChecks.requireNonZeroStep(step);
        this.variable = adopt(Objects.requireNonNull(variable, "variable"));
        this.start = adopt(Objects.requireNonNull(start, "start"));
        this.end = adopt(Objects.requireNonNull(end, "end"));
        this.step = adopt(step);
        this.body = adopt(Objects.requireNonNull(body, "body"));
    }

    public InlineVariableDeclaration variable() {
        return variable;
    }

    public Expr start() {
        return start;
    }

    public Expr end() {
        return end;
    }

    /**
     * @return The step, or {@code null} for the default of one.
     */
    public Expr step() {
        return step;
    }

    public Block body() {
        return body;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(List.of(variable, start, end));
        if (step != null) {
            children.add(step);
        }
        children.add(body);
        return children;
    }

    @Override
    public AstKind kind() {
        return AstKind.FOR_RANGE_LOOP_STMT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitForRangeLoopStmt(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("variable", variable)
                .child("start", start)
                .child("end", end)
                .optionalChild("step", step)
                .child("body", body);
    }

    @Override
    public String toString() {
        return "ForRangeLoopStmt[" + variable.name() + "]";
    }
}
