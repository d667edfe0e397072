package org.astx.ast.packages;

import org.astx.ast.AstKind;
import org.astx.ast.Block;
import org.astx.ast.visitor.AstVisitor;

/**
 * A named compilation unit: a top-level block of statements.
 */
public final class Module extends Block {

    public Module() {
        this("main");
    }

    public Module(String name) {
        super(name);
    }

    @Override
    public AstKind kind() {
        return AstKind.MODULE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitModule(this);
    }
}
