package org.astx.ast.types;

import org.astx.ast.AstKind;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.Objects;

/**
 * A key to value mapping type.
 */
public final class MapType extends DataType {

    private final DataType keyType;
    private final DataType valueType;

    public MapType(DataType keyType, DataType valueType) {
        this.keyType = Objects.requireNonNull(keyType, "keyType");
        this.valueType = Objects.requireNonNull(valueType, "valueType");
    }

    public DataType keyType() {
        return keyType;
    }

    public DataType valueType() {
        return valueType;
    }

    @Override
    public TypeFamily family() {
        return TypeFamily.COLLECTION;
    }

    @Override
    public AstKind kind() {
        return AstKind.MAP_TYPE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitMapType(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("key-type", keyType).child("value-type", valueType);
    }

    @Override
    public String toString() {
        return "MapType[" + keyType + "," + valueType + "]";
    }
}
