package org.astx.ast.classes;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Expr;
import org.astx.ast.Names;
import org.astx.ast.Statement;
import org.astx.ast.modifiers.VisibilityKind;
import org.astx.ast.types.DataTypes;
import org.astx.ast.types.NamedType;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Declares a class: its name, bases, decorators, visibility, abstractness and an optional metaclass.
 */
public class ClassDeclStmt extends Statement {

    private final String name;
    private final List<Expr> bases;
    private final List<Expr> decorators;
    private final VisibilityKind visibility;
    private final boolean isAbstract;
    private final Expr metaclass;

    public ClassDeclStmt(String name) {
        this(name, List.of(), List.of(), VisibilityKind.PUBLIC, false, null);
    }

    public ClassDeclStmt(String name, List<? extends Expr> bases, List<? extends Expr> decorators,
                         VisibilityKind visibility, boolean isAbstract, Expr metaclass) {
        this.name = Names.require(name, "Class");
        this.bases = adoptAll(bases);
        this.decorators = adoptAll(decorators);
        this.visibility = Objects.requireNonNull(visibility, "visibility");
        this.isAbstract = isAbstract;
        this.metaclass = adopt(metaclass);
    }

    public String name() {
        return name;
    }

    public List<Expr> bases() {
        return bases;
    }

    public List<Expr> decorators() {
        return decorators;
    }

    public VisibilityKind visibility() {
        return visibility;
    }

    public boolean isAbstract() {
        return isAbstract;
    }

    public Expr metaclass() {
        return metaclass;
    }

    /**
     * @return The type of instances of this class.
     */
    public NamedType declaredType() {
        return DataTypes.classType(name);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(decorators);
        children.addAll(bases);
        if (metaclass != null) {
            children.add(metaclass);
        }
        return children;
    }

    @Override
    public AstKind kind() {
        return AstKind.CLASS_DECL_STMT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitClassDeclStmt(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.attr("name", name)
                .attr("visibility", visibility.label())
                .attr("abstract", isAbstract)
                .children("bases", bases)
                .children("decorators", decorators)
                .optionalChild("metaclass", metaclass);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
