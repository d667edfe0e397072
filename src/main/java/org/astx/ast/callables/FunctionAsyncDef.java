package org.astx.ast.callables;

import org.astx.ast.AstKind;
import org.astx.ast.Block;
import org.astx.ast.visitor.AstVisitor;

/**
 * A coroutine definition; its body may contain {@link AwaitExpr}.
 */
public final class FunctionAsyncDef extends FunctionDef {

    public FunctionAsyncDef(FunctionPrototype prototype, Block body) {
        super(prototype, body);
    }

    @Override
    public AstKind kind() {
        return AstKind.FUNCTION_ASYNC_DEF;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunctionAsyncDef(this);
    }
}
