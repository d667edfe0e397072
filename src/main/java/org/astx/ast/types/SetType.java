package org.astx.ast.types;

import org.astx.ast.AstKind;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.Objects;

/**
 * An unordered collection of distinct elements of one type.
 */
public final class SetType extends DataType {

    private final DataType elementType;

    public SetType(DataType elementType) {
        this.elementType = Objects.requireNonNull(elementType, "elementType");
    }

    public DataType elementType() {
        return elementType;
    }

    @Override
    public TypeFamily family() {
        return TypeFamily.COLLECTION;
    }

    @Override
    public AstKind kind() {
        return AstKind.SET_TYPE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSetType(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("element-type", elementType);
    }

    @Override
    public String toString() {
        return "SetType[" + elementType + "]";
    }
}
