package org.astx.ast.types;

import org.astx.ast.AstKind;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.Objects;

/**
 * An ordered collection of a single element type. A list whose element type is
 * {@link AnyType} is heterogeneous.
 */
public final class ListType extends DataType {

    private final DataType elementType;

    public ListType(DataType elementType) {
        this.elementType = Objects.requireNonNull(elementType, "elementType");
    }

    public DataType elementType() {
        return elementType;
    }

    public boolean isHeterogeneous() {
        return elementType instanceof AnyType;
    }

    @Override
    public TypeFamily family() {
        return TypeFamily.COLLECTION;
    }

    @Override
    public AstKind kind() {
        return AstKind.LIST_TYPE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitListType(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("element-type", elementType);
    }

    @Override
    public String toString() {
        return "ListType[" + elementType + "]";
    }
}
