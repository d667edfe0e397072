package org.astx.ast.types;

import org.astx.api.InvalidValueException;
import org.astx.ast.AstKind;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.Objects;

/**
 * A user-defined type referenced by name: a struct, a class or an enum.
 * Two named types are the same type when kind and name match.
 */
public final class NamedType extends DataType {

    /**
     * What kind of declaration introduces the name.
     */
    public enum Kind {
        STRUCT("StructType"),
        CLASS("ClassType"),
        ENUM("EnumType");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final Kind namedKind;
    private final String name;

    public NamedType(Kind namedKind, String name) {
        this.namedKind = Objects.requireNonNull(namedKind, "namedKind");
        if (name == null || name.isBlank()) {
            throw new InvalidValueException("A named type requires a non-blank name");
        }
        this.name = name;
    }

    public Kind namedKind() {
        return namedKind;
    }

    public String name() {
        return name;
    }

    @Override
    public TypeFamily family() {
        return TypeFamily.NAMED;
    }

    @Override
    public AstKind kind() {
        return AstKind.NAMED_TYPE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitNamedType(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.attr("name", name);
    }

    @Override
    public String toString() {
        return namedKind.label() + "[" + name + "]";
    }
}
