package org.astx.ast.callables;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Block;
import org.astx.ast.Statement;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;
import java.util.Objects;

/**
 * A function with a body. Return paths are not checked against the declared return type.
 */
public class FunctionDef extends Statement {

    private final FunctionPrototype prototype;
    private final Block body;

    public FunctionDef(FunctionPrototype prototype, Block body) {
        this.prototype = adopt(Objects.requireNonNull(prototype, "prototype"));
        this.body = adopt(Objects.requireNonNull(body, "body"));
    }

    public FunctionPrototype prototype() {
        return prototype;
    }

    public Block body() {
        return body;
    }

    public String name() {
        return prototype.name();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(prototype, body);
    }

    @Override
    public AstKind kind() {
        return AstKind.FUNCTION_DEF;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunctionDef(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("prototype", prototype).child("body", body);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + prototype.name() + "]";
    }
}
