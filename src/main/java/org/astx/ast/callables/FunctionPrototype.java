package org.astx.ast.callables;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Names;
import org.astx.ast.Statement;
import org.astx.ast.modifiers.ScopeKind;
import org.astx.ast.modifiers.VisibilityKind;
import org.astx.ast.types.DataType;
import org.astx.ast.types.FunctionType;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A function signature: name, parameters and return type. On its own it declares an
 * external or forward function; a {@link FunctionDef} adds the body.
 */
public final class FunctionPrototype extends Statement {

    private final String name;
    private final Arguments args;
    private final DataType returnType;
    private final ScopeKind scope;
    private final VisibilityKind visibility;

    public FunctionPrototype(String name, Arguments args, DataType returnType) {
        this(name, args, returnType, ScopeKind.GLOBAL, VisibilityKind.PUBLIC);
    }

    public FunctionPrototype(String name, Arguments args, DataType returnType,
                             ScopeKind scope, VisibilityKind visibility) {
        this.name = Names.require(name, "Function prototype");
        Names.requireUnique(Objects.requireNonNull(args, "args").nodes(), Argument::name, "argument", name);
        this.args = adopt(args);
        this.returnType = Objects.requireNonNull(returnType, "returnType");
        this.scope = Objects.requireNonNull(scope, "scope");
        this.visibility = Objects.requireNonNull(visibility, "visibility");
    }

    public String name() {
        return name;
    }

    public Arguments args() {
        return args;
    }

    public DataType returnType() {
        return returnType;
    }

    public ScopeKind scope() {
        return scope;
    }

    public VisibilityKind visibility() {
        return visibility;
    }

    /**
     * @return The type of a reference to this function.
     */
    public FunctionType functionType() {
        List<DataType> parameterTypes = new ArrayList<>();
        for (Argument argument : args) {
            parameterTypes.add(argument.type());
        }
        return new FunctionType(parameterTypes, returnType);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(args);
    }

    @Override
    public AstKind kind() {
        return AstKind.FUNCTION_PROTOTYPE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunctionPrototype(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.attr("name", name)
                .attr("scope", scope.label())
                .attr("visibility", visibility.label())
                .child("args", args)
                .child("return-type", returnType);
    }

    @Override
    public String toString() {
        return "FunctionPrototype[" + name + "]";
    }
}
