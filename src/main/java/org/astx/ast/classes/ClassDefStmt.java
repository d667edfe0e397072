package org.astx.ast.classes;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Expr;
import org.astx.ast.callables.FunctionDef;
import org.astx.ast.modifiers.VisibilityKind;
import org.astx.ast.variables.VariableDeclaration;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;

/**
 * A class declaration with its attributes and methods. Two members may share a name
 * only when their visibility differs.
 */
public final class ClassDefStmt extends ClassDeclStmt {

    private final List<VariableDeclaration> attributes;
    private final List<FunctionDef> methods;

    public ClassDefStmt(String name, List<VariableDeclaration> attributes, List<? extends FunctionDef> methods) {
        this(name, List.of(), List.of(), VisibilityKind.PUBLIC, false, null, attributes, methods);
    }

    public ClassDefStmt(String name, List<? extends Expr> bases, List<? extends Expr> decorators,
                        VisibilityKind visibility, boolean isAbstract, Expr metaclass,
                        List<VariableDeclaration> attributes, List<? extends FunctionDef> methods) {
        super(name, bases, decorators, visibility, isAbstract, metaclass);
        Members.requireUnique(name, attributes, methods);
        this.attributes = adoptAll(attributes);
        this.methods = adoptAll(methods);
    }

    public List<VariableDeclaration> attributes() {
        return attributes;
    }

    public List<FunctionDef> methods() {
        return methods;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = super.getChildren();
        children.addAll(attributes);
        children.addAll(methods);
        return children;
    }

    @Override
    public AstKind kind() {
        return AstKind.CLASS_DEF_STMT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitClassDefStmt(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        super.buildStruct(struct);
        struct.children("attributes", attributes).children("methods", methods);
    }
}
