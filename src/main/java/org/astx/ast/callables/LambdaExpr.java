package org.astx.ast.callables;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Expr;
import org.astx.ast.types.DataType;
import org.astx.ast.types.FunctionType;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An anonymous single-expression function.
 */
public final class LambdaExpr extends Expr {

    private final Arguments params;
    private final Expr body;

    public LambdaExpr(Arguments params, Expr body) {
        this.params = adopt(Objects.requireNonNull(params, "params"));
        this.body = adopt(Objects.requireNonNull(body, "body"));
    }

    public Arguments params() {
        return params;
    }

    public Expr body() {
        return body;
    }

    @Override
    public DataType type() {
        List<DataType> parameterTypes = new ArrayList<>();
        for (Argument param : params) {
            parameterTypes.add(param.type());
        }
        return new FunctionType(parameterTypes, body.type());
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(params, body);
    }

    @Override
    public AstKind kind() {
        return AstKind.LAMBDA_EXPR;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLambdaExpr(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("params", params).child("body", body);
    }

    @Override
    public String toString() {
        return "LambdaExpr";
    }
}
