package org.astx.ast.classes;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Expr;
import org.astx.ast.Names;
import org.astx.ast.Statement;
import org.astx.ast.modifiers.VisibilityKind;
import org.astx.ast.types.DataTypes;
import org.astx.ast.types.NamedType;
import org.astx.ast.variables.VariableDeclaration;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Declares a plain data structure by its attribute declarations.
 */
public class StructDeclStmt extends Statement {

    private final String name;
    private final List<VariableDeclaration> attributes;
    private final List<Expr> decorators;
    private final VisibilityKind visibility;

    public StructDeclStmt(String name, List<VariableDeclaration> attributes) {
        this(name, attributes, List.of(), VisibilityKind.PUBLIC);
    }

    public StructDeclStmt(String name, List<VariableDeclaration> attributes, List<? extends Expr> decorators,
                          VisibilityKind visibility) {
        this.name = Names.require(name, "Struct");
        this.visibility = Objects.requireNonNull(visibility, "visibility");
        Members.requireUnique(name, attributes, List.of());
        this.attributes = adoptAll(attributes);
        this.decorators = adoptAll(decorators);
    }

    public String name() {
        return name;
    }

    public List<VariableDeclaration> attributes() {
        return attributes;
    }

    public List<Expr> decorators() {
        return decorators;
    }

    public VisibilityKind visibility() {
        return visibility;
    }

    public NamedType declaredType() {
        return DataTypes.struct(name);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(decorators);
        children.addAll(attributes);
        return children;
    }

    @Override
    public AstKind kind() {
        return AstKind.STRUCT_DECL_STMT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitStructDeclStmt(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.attr("name", name)
                .attr("visibility", visibility.label())
                .children("decorators", decorators)
                .children("attributes", attributes);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
