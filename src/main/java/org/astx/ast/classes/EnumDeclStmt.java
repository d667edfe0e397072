package org.astx.ast.classes;

import org.astx.api.MalformedNodeException;
import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Names;
import org.astx.ast.Statement;
import org.astx.ast.modifiers.MutabilityKind;
import org.astx.ast.modifiers.VisibilityKind;
import org.astx.ast.types.DataTypes;
import org.astx.ast.types.NamedType;
import org.astx.ast.variables.VariableDeclaration;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;
import java.util.Objects;

/**
 * An enumeration. Its members are constant attributes with distinct names.
 */
public final class EnumDeclStmt extends Statement {

    private final String name;
    private final List<VariableDeclaration> attributes;
    private final VisibilityKind visibility;

    public EnumDeclStmt(String name, List<VariableDeclaration> attributes) {
        this(name, attributes, VisibilityKind.PUBLIC);
    }

    public EnumDeclStmt(String name, List<VariableDeclaration> attributes, VisibilityKind visibility) {
        this.name = Names.require(name, "Enum");
        for (VariableDeclaration attribute : attributes) {
            if (attribute.mutability() != MutabilityKind.CONSTANT) {
                throw new MalformedNodeException(String.format(
                        "Enum member '%s' of %s must be constant", attribute.name(), name));
            }
        }
        Names.requireUnique(attributes, VariableDeclaration::name, "enum member", name);
        this.attributes = adoptAll(attributes);
        this.visibility = Objects.requireNonNull(visibility, "visibility");
    }

    public String name() {
        return name;
    }

    public List<VariableDeclaration> attributes() {
        return attributes;
    }

    public VisibilityKind visibility() {
        return visibility;
    }

    public NamedType declaredType() {
        return DataTypes.enumType(name);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(attributes);
    }

    @Override
    public AstKind kind() {
        return AstKind.ENUM_DECL_STMT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitEnumDeclStmt(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.attr("name", name)
                .attr("visibility", visibility.label())
                .children("attributes", attributes);
    }

    @Override
    public String toString() {
        return "EnumDeclStmt[" + name + "]";
    }
}
