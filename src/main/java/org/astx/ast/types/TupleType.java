package org.astx.ast.types;

import org.astx.ast.AstKind;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A fixed-length sequence whose positions each have their own type.
 */
public final class TupleType extends DataType {

    private final List<DataType> elementTypes;

    public TupleType(List<DataType> elementTypes) {
        this.elementTypes = List.copyOf(elementTypes);
    }

    public List<DataType> elementTypes() {
        return elementTypes;
    }

    @Override
    public TypeFamily family() {
        return TypeFamily.COLLECTION;
    }

    @Override
    public AstKind kind() {
        return AstKind.TUPLE_TYPE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitTupleType(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.children("element-types", elementTypes);
    }

    @Override
    public String toString() {
        return elementTypes.stream()
                .map(DataType::toString)
                .collect(Collectors.joining(",", "TupleType[", "]"));
    }
}
