package org.astx.ast.variables;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Expr;
import org.astx.ast.Names;
import org.astx.ast.modifiers.MutabilityKind;
import org.astx.ast.modifiers.ScopeKind;
import org.astx.ast.modifiers.VisibilityKind;
import org.astx.ast.types.DataType;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;
import java.util.Objects;

/**
 * A declaration usable in expression position, such as the variable of a counting loop.
 * Constants must be initialized; an initializer must be compatible with the declared type.
 */
public final class InlineVariableDeclaration extends Expr {

    private final String name;
    private final DataType type;
    private final MutabilityKind mutability;
    private final ScopeKind scope;
    private final VisibilityKind visibility;
    private final Expr value;

    public InlineVariableDeclaration(String name, DataType type, Expr value) {
        this(name, type, MutabilityKind.MUTABLE, ScopeKind.LOCAL, VisibilityKind.PUBLIC, value);
    }

    public InlineVariableDeclaration(String name, DataType type, MutabilityKind mutability,
                                     ScopeKind scope, VisibilityKind visibility, Expr value) {
        this.name = Names.require(name, "Inline variable declaration");
        this.type = Objects.requireNonNull(type, "type");
        this.mutability = Objects.requireNonNull(mutability, "mutability");
        this.scope = Objects.requireNonNull(scope, "scope");
        this.visibility = Objects.requireNonNull(visibility, "visibility");
        DeclaredValue.check(name, type, mutability, value);
        this.value = adopt(value);
    }

    public String name() {
        return name;
    }

    @Override
    public DataType type() {
        return type;
    }

    public MutabilityKind mutability() {
        return mutability;
    }

    public ScopeKind scope() {
        return scope;
    }

    public VisibilityKind visibility() {
        return visibility;
    }

    /**
     * @return The initializer, or {@code null} when the variable is declared without one.
     */
    public Expr value() {
        return value;
    }

    @Override
    public List<AstNode> getChildren() {
        return value == null ? List.of() : List.of(value);
    }

    @Override
    public AstKind kind() {
        return AstKind.INLINE_VARIABLE_DECLARATION;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitInlineVariableDeclaration(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.attr("name", name)
                .attr("mutability", mutability.label())
                .attr("scope", scope.label())
                .attr("visibility", visibility.label())
                .child("type", type)
                .optionalChild("value", value);
    }

    @Override
    public String toString() {
        return "InlineVariableDeclaration[" + name + ", " + type + "]";
    }
}
