package org.astx.serialization;

import org.astx.ast.types.DataType;
import org.astx.ast.types.DataTypes;
import org.astx.ast.types.FunctionType;
import org.astx.ast.types.ListType;
import org.astx.ast.types.MapType;
import org.astx.ast.types.NamedType;
import org.astx.ast.types.SetType;
import org.astx.ast.types.TupleType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Decoders for type descriptors. Scalar types are fully described by their tag.
 */
final class TypeDecoders {

    private static final Map<String, Supplier<DataType>> SCALARS = new LinkedHashMap<>();

    static {
        SCALARS.put("Int8", DataTypes::int8);
        SCALARS.put("Int16", DataTypes::int16);
        SCALARS.put("Int32", DataTypes::int32);
        SCALARS.put("Int64", DataTypes::int64);
        SCALARS.put("Int128", DataTypes::int128);
        SCALARS.put("UInt8", DataTypes::uint8);
        SCALARS.put("UInt16", DataTypes::uint16);
        SCALARS.put("UInt32", DataTypes::uint32);
        SCALARS.put("UInt64", DataTypes::uint64);
        SCALARS.put("UInt128", DataTypes::uint128);
        SCALARS.put("Float16", DataTypes::float16);
        SCALARS.put("Float32", DataTypes::float32);
        SCALARS.put("Float64", DataTypes::float64);
        SCALARS.put("Complex32", DataTypes::complex32);
        SCALARS.put("Complex64", DataTypes::complex64);
        SCALARS.put("Boolean", DataTypes::bool);
        SCALARS.put("UTF8Char", DataTypes::utf8Char);
        SCALARS.put("UTF8String", DataTypes::utf8String);
        SCALARS.put("Date", DataTypes::date);
        SCALARS.put("Time", DataTypes::time);
        SCALARS.put("DateTime", DataTypes::dateTime);
        SCALARS.put("Timestamp", DataTypes::timestamp);
        SCALARS.put("NoneType", DataTypes::none);
        SCALARS.put("Undefined", DataTypes::undefined);
        SCALARS.put("AnyType", DataTypes::any);
    }

    private TypeDecoders() {}

    /**
     * @return The scalar type written as {@code tag}, or {@code null} when the tag is not a scalar type.
     */
    static DataType scalar(String tag) {
        Supplier<DataType> factory = SCALARS.get(tag);
        return factory == null ? null : factory.get();
    }

    static void install(NodeDecoderRegistry reg) {
        SCALARS.forEach((tag, factory) -> reg.register(tag, s -> factory.get()));
        reg.register("ListType", s -> new ListType(s.type("element-type")));
        reg.register("SetType", s -> new SetType(s.type("element-type")));
        reg.register("MapType", s -> new MapType(s.type("key-type"), s.type("value-type")));
        reg.register("TupleType", s -> new TupleType(s.children("element-types", DataType.class)));
        reg.register("FunctionType",
                s -> new FunctionType(s.children("parameter-types", DataType.class), s.type("return-type")));
        for (NamedType.Kind kind : NamedType.Kind.values()) {
            reg.register(kind.label(), s -> new NamedType(kind, s.string("name")));
        }
    }
}
