package org.astx.ast.flows;

import org.astx.ast.AstKind;
import org.astx.ast.Statement;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

/**
 * Skips to the next iteration of the innermost loop.
 */
public final class ContinueStmt extends Statement {

    @Override
    public AstKind kind() {
        return AstKind.CONTINUE_STMT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitContinueStmt(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        // no content
    }

    @Override
    public String toString() {
        return "ContinueStmt";
    }
}
