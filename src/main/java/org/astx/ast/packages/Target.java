package org.astx.ast.packages;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.Objects;

/**
 * Code generation target of a {@link Program}: data layout string and target triple.
 * Both may be empty when the program is not bound to a machine.
 */
public final class Target extends AstNode {

    private final String dataLayout;
    private final String triple;

    public Target() {
        this("", "");
    }

    public Target(String dataLayout, String triple) {
        this.dataLayout = Objects.requireNonNull(dataLayout, "dataLayout");
        this.triple = Objects.requireNonNull(triple, "triple");
    }

    public String dataLayout() {
        return dataLayout;
    }

    public String triple() {
        return triple;
    }

    @Override
    public AstKind kind() {
        return AstKind.TARGET;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitTarget(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.attr("data-layout", dataLayout).attr("triple", triple);
    }

    @Override
    public String toString() {
        return "Target";
    }
}
