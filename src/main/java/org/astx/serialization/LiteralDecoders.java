package org.astx.serialization;

import org.astx.api.MalformedNodeException;
import org.astx.ast.Expr;
import org.astx.ast.literals.FormattedValue;
import org.astx.ast.literals.JoinedStr;
import org.astx.ast.literals.LiteralBoolean;
import org.astx.ast.literals.LiteralComplex;
import org.astx.ast.literals.LiteralDate;
import org.astx.ast.literals.LiteralDateTime;
import org.astx.ast.literals.LiteralDict;
import org.astx.ast.literals.LiteralFloat;
import org.astx.ast.literals.LiteralInteger;
import org.astx.ast.literals.LiteralList;
import org.astx.ast.literals.LiteralNone;
import org.astx.ast.literals.LiteralSet;
import org.astx.ast.literals.LiteralTime;
import org.astx.ast.literals.LiteralTimestamp;
import org.astx.ast.literals.LiteralTuple;
import org.astx.ast.literals.LiteralUTF8Char;
import org.astx.ast.literals.LiteralUTF8String;
import org.astx.ast.types.ComplexType;
import org.astx.ast.types.DataType;
import org.astx.ast.types.FloatType;
import org.astx.ast.types.IntegerType;
import org.astx.ast.types.ListType;
import org.astx.ast.types.MapType;
import org.astx.ast.types.SetType;

import java.util.List;

/**
 * Decoders for literals. Numeric literal tags carry the width, e.g. {@code LiteralUInt16}.
 */
final class LiteralDecoders {

    private static final String PREFIX = "Literal";
    private static final List<String> INTEGER_TYPES = List.of(
            "Int8", "Int16", "Int32", "Int64", "Int128", "UInt8", "UInt16", "UInt32", "UInt64", "UInt128");

    private LiteralDecoders() {}

    static void install(NodeDecoderRegistry reg) {
        for (String typeTag : INTEGER_TYPES) {
            reg.register(PREFIX + typeTag,
                    s -> LiteralInteger.of(literalType(s, IntegerType.class), s.bigInteger("value")));
        }
        for (String typeTag : List.of("Float16", "Float32", "Float64")) {
            reg.register(PREFIX + typeTag,
                    s -> LiteralFloat.of(literalType(s, FloatType.class), s.doubleValue("value")));
        }
        for (String typeTag : List.of("Complex32", "Complex64")) {
            reg.register(PREFIX + typeTag, s -> LiteralComplex.of(
                    literalType(s, ComplexType.class), s.doubleValue("real"), s.doubleValue("imag")));
        }
        reg.register("LiteralBoolean", s -> new LiteralBoolean(s.bool("value")));
        reg.register("LiteralUTF8Char", s -> new LiteralUTF8Char(s.string("value")));
        reg.register("LiteralUTF8String", s -> new LiteralUTF8String(s.string("value")));
        reg.register("LiteralNone", s -> new LiteralNone());
        reg.register("JoinedStr", s -> new JoinedStr(s.children("values", Expr.class)));
        reg.register("FormattedValue", s -> new FormattedValue(s.child("value", Expr.class),
                conversion(s.optionalString("conversion")), s.optionalChild("format-spec", Expr.class)));
        reg.register("LiteralDate", s -> new LiteralDate(s.string("value")));
        reg.register("LiteralTime", s -> new LiteralTime(s.string("value")));
        reg.register("LiteralDateTime", s -> new LiteralDateTime(s.string("value")));
        reg.register("LiteralTimestamp", s -> new LiteralTimestamp(s.string("value")));
        reg.register("LiteralList", s -> new LiteralList(
                s.children("elements", Expr.class), collectionType(s, ListType.class)));
        reg.register("LiteralSet", s -> new LiteralSet(
                s.children("elements", Expr.class), collectionType(s, SetType.class)));
        reg.register("LiteralTuple", s -> new LiteralTuple(s.children("elements", Expr.class)));
        reg.register("LiteralDict", s -> new LiteralDict(
                s.children("keys", Expr.class), s.children("values", Expr.class), collectionType(s, MapType.class)));
    }

    private static <T extends DataType> T literalType(StructReader s, Class<T> expected) {
        DataType type = TypeDecoders.scalar(s.tag().substring(PREFIX.length()));
        if (!expected.isInstance(type)) {
            throw new MalformedNodeException("No literal type for tag " + s.tag());
        }
        return expected.cast(type);
    }

    private static Character conversion(String text) {
        if (text == null) {
            return null;
        }
        if (text.length() != 1) {
            throw new MalformedNodeException("Conversion must be a single character, got '" + text + "'");
        }
        return text.charAt(0);
    }

    private static <T extends DataType> T collectionType(StructReader s, Class<T> expected) {
        return s.child("type", expected);
    }
}
