package org.astx.ast.callables;

import org.astx.api.MalformedNodeException;
import org.astx.api.TypeMismatchException;
import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Expr;
import org.astx.ast.types.DataType;
import org.astx.ast.types.DataTypes;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;
import java.util.Objects;

/**
 * A call of a known function. The callee prototype is referenced, not owned.
 * <p>
 * The number of arguments must lie between the count of required parameters and the
 * count of all parameters, and each argument must be compatible with its parameter.
 * The call's type is the callee's return type.
 */
public final class FunctionCall extends Expr {

    private final FunctionPrototype callee;
    private final List<Expr> args;

    public FunctionCall(FunctionPrototype callee, List<? extends Expr> args) {
        this.callee = Objects.requireNonNull(callee, "callee");
        Arguments params = callee.args();
        if (args.size() < params.requiredCount() || args.size() > params.size()) {
            throw new MalformedNodeException(String.format(
                    "Function '%s' takes %s arguments, got %d", callee.name(),
                    params.requiredCount() == params.size()
                            ? String.valueOf(params.size())
                            : params.requiredCount() + " to " + params.size(),
                    args.size()));
        }
        for (int i = 0; i < args.size(); i++) {
            Argument param = params.get(i);
            Expr arg = args.get(i);
            if (!DataTypes.isCompatible(param.type(), arg.type())) {
                throw new TypeMismatchException(String.format(
                        "Argument '%s' of '%s' expects %s, got %s", param.name(), callee.name(), param.type(), arg.type()));
            }
        }
        this.args = adoptAll(args);
    }

    public FunctionPrototype callee() {
        return callee;
    }

    public List<Expr> args() {
        return args;
    }

    @Override
    public DataType type() {
        return callee.returnType();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(args);
    }

    @Override
    public AstKind kind() {
        return AstKind.FUNCTION_CALL;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("callee", callee).children("args", args);
    }

    @Override
    public String toString() {
        return "FunctionCall[" + callee.name() + "]";
    }
}
