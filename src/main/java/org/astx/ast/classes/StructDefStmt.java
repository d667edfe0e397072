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
 * A struct with methods attached.
 */
public final class StructDefStmt extends StructDeclStmt {

    private final List<FunctionDef> methods;

    public StructDefStmt(String name, List<VariableDeclaration> attributes, List<? extends FunctionDef> methods) {
        this(name, attributes, List.of(), VisibilityKind.PUBLIC, methods);
    }

    public StructDefStmt(String name, List<VariableDeclaration> attributes, List<? extends Expr> decorators,
                         VisibilityKind visibility, List<? extends FunctionDef> methods) {
        super(name, attributes, decorators, visibility);
        Members.requireUnique(name, attributes, methods);
        this.methods = adoptAll(methods);
    }

    public List<FunctionDef> methods() {
        return methods;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = super.getChildren();
        children.addAll(methods);
        return children;
    }

    @Override
    public AstKind kind() {
        return AstKind.STRUCT_DEF_STMT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitStructDefStmt(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        super.buildStruct(struct);
        struct.children("methods", methods);
    }
}
