package org.astx.ast.packages;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;
import java.util.Objects;

/**
 * The root of a whole program: packages and modules plus the code generation target.
 */
public final class Program extends Package {

    private final Target target;

    public Program(String name, Target target, List<Module> modules, List<Package> packages) {
        super(name, modules, packages);
        this.target = adopt(Objects.requireNonNull(target, "target"));
    }

    public Target target() {
        return target;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = super.getChildren();
        children.add(0, target);
        return children;
    }

    @Override
    public AstKind kind() {
        return AstKind.PROGRAM;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitProgram(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        super.buildStruct(struct);
        struct.child("target", target);
    }
}
