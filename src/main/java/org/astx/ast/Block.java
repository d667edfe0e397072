package org.astx.ast;

import org.astx.ast.visitor.AstVisitor;

/**
 * An ordered sequence of statements. Bodies of functions, loops, branches and handlers are blocks.
 */
public class Block extends AstNodes<AstNode> {

    public Block() {
        this("entry");
    }

    public Block(String name) {
        super(name);
    }

    @Override
    public AstKind kind() {
        return AstKind.BLOCK;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}
