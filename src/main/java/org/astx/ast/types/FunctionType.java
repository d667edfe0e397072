package org.astx.ast.types;

import org.astx.ast.AstKind;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The type of a callable: ordered parameter types and a return type.
 */
public final class FunctionType extends DataType {

    private final List<DataType> parameterTypes;
    private final DataType returnType;

    public FunctionType(List<DataType> parameterTypes, DataType returnType) {
        this.parameterTypes = List.copyOf(parameterTypes);
        this.returnType = Objects.requireNonNull(returnType, "returnType");
    }

    public List<DataType> parameterTypes() {
        return parameterTypes;
    }

    public DataType returnType() {
        return returnType;
    }

    @Override
    public TypeFamily family() {
        return TypeFamily.FUNCTION;
    }

    @Override
    public AstKind kind() {
        return AstKind.FUNCTION_TYPE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunctionType(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.children("parameter-types", parameterTypes).child("return-type", returnType);
    }

    @Override
    public String toString() {
        return parameterTypes.stream()
                .map(DataType::toString)
                .collect(Collectors.joining(",", "FunctionType[(", ")->" + returnType + "]"));
    }
}
