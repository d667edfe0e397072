package org.astx.ast.flows;

import org.astx.api.MalformedNodeException;
import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Block;
import org.astx.ast.Expr;
import org.astx.ast.types.DataType;
import org.astx.ast.types.DataTypes;
import org.astx.ast.variables.InlineVariableDeclaration;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Expression form of an asynchronous range loop. The body holds the single value
 * produced per iteration.
 */
public final class AsyncForRangeLoopExpr extends Expr {

    private final InlineVariableDeclaration variable;
    private final Expr start;
    private final Expr end;
    private final Expr step;
    private final Block body;

    public AsyncForRangeLoopExpr(InlineVariableDeclaration variable, Expr start, Expr end, Expr step, Block body) {
        LoopChecks.requireNumeric(start, "start");
        LoopChecks.requireNumeric(end, "end");
        LoopChecks.requireNumeric(step, "step");
        LoopChecks.requireNonZeroStep(step);
        if (Objects.requireNonNull(body, "body").size() > 1) {
            throw new MalformedNodeException("An async range loop expression takes one body node, got " + body.size());
        }
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
    public DataType type() {
        return DataTypes.any();
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
        return AstKind.ASYNC_FOR_RANGE_LOOP_EXPR;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAsyncForRangeLoopExpr(this);
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
        return "AsyncForRangeLoopExpr[" + variable.name() + "]";
    }
}
