package org.astx.ast.types;

import java.util.Arrays;
import java.util.List;

/**
 * Factory methods for the built-in type descriptors and the type compatibility query.
 * <p>
 * Every factory call returns a fresh instance; instances compare equal structurally.
 */
public final class DataTypes {

    private DataTypes() {}

    public static IntegerType int8() { return new IntegerType(8, true); }
    public static IntegerType int16() { return new IntegerType(16, true); }
    public static IntegerType int32() { return new IntegerType(32, true); }
    public static IntegerType int64() { return new IntegerType(64, true); }
    public static IntegerType int128() { return new IntegerType(128, true); }
    public static IntegerType uint8() { return new IntegerType(8, false); }
    public static IntegerType uint16() { return new IntegerType(16, false); }
    public static IntegerType uint32() { return new IntegerType(32, false); }
    public static IntegerType uint64() { return new IntegerType(64, false); }
    public static IntegerType uint128() { return new IntegerType(128, false); }

    public static FloatType float16() { return new FloatType(16); }
    public static FloatType float32() { return new FloatType(32); }
    public static FloatType float64() { return new FloatType(64); }

    public static ComplexType complex32() { return new ComplexType(32); }
    public static ComplexType complex64() { return new ComplexType(64); }

    public static BooleanType bool() { return new BooleanType(); }
    public static CharType utf8Char() { return new CharType(); }
    public static StringType utf8String() { return new StringType(); }

    public static TemporalType date() { return new TemporalType(TemporalType.Kind.DATE); }
    public static TemporalType time() { return new TemporalType(TemporalType.Kind.TIME); }
    public static TemporalType dateTime() { return new TemporalType(TemporalType.Kind.DATE_TIME); }
    public static TemporalType timestamp() { return new TemporalType(TemporalType.Kind.TIMESTAMP); }

    public static ListType list(DataType elementType) { return new ListType(elementType); }
    public static SetType set(DataType elementType) { return new SetType(elementType); }
    public static MapType map(DataType keyType, DataType valueType) { return new MapType(keyType, valueType); }
    public static TupleType tuple(DataType... elementTypes) { return new TupleType(Arrays.asList(elementTypes)); }

    public static NamedType struct(String name) { return new NamedType(NamedType.Kind.STRUCT, name); }
    public static NamedType classType(String name) { return new NamedType(NamedType.Kind.CLASS, name); }
    public static NamedType enumType(String name) { return new NamedType(NamedType.Kind.ENUM, name); }

    public static FunctionType function(DataType returnType, DataType... parameterTypes) {
        return new FunctionType(Arrays.asList(parameterTypes), returnType);
    }

    public static NoneType none() { return new NoneType(); }
    public static UndefinedType undefined() { return new UndefinedType(); }
    public static AnyType any() { return new AnyType(); }

    /**
     * Decides whether values of the two types may meet in one operation.
     * <p>
     * The relation is reflexive and symmetric but not transitive:
     * {@code Any} bridges every pair, yet text and integers are never compatible directly.
     * <ul>
     *     <li>{@code Any} is compatible with everything.</li>
     *     <li>All numeric families (integer, float, complex) are mutually compatible.</li>
     *     <li>Chars and strings are mutually compatible.</li>
     *     <li>Booleans, none and undefined are only compatible with themselves.</li>
     *     <li>Temporal and named types require an identical descriptor.</li>
     *     <li>Collections require the same shape and pairwise compatible parameters.</li>
     *     <li>Function types require equal arity, compatible parameters and return types.</li>
     * </ul>
     */
    public static boolean isCompatible(DataType a, DataType b) {
        TypeFamily fa = a.family();
        TypeFamily fb = b.family();
        if (fa == TypeFamily.ANY || fb == TypeFamily.ANY) {
            return true;
        }
        if (fa.isNumeric() && fb.isNumeric()) {
            return true;
        }
        if (fa != fb) {
            return false;
        }
        return switch (fa) {
            case TEXT, BOOLEAN, NONE, UNDEFINED -> true;
            case TEMPORAL, NAMED -> a.equals(b);
            case COLLECTION -> collectionsCompatible(a, b);
            case FUNCTION -> {
                FunctionType fnA = (FunctionType) a;
                FunctionType fnB = (FunctionType) b;
                yield allCompatible(fnA.parameterTypes(), fnB.parameterTypes())
                        && isCompatible(fnA.returnType(), fnB.returnType());
            }
            default -> false;
        };
    }

    private static boolean collectionsCompatible(DataType a, DataType b) {
        if (a instanceof ListType la && b instanceof ListType lb) {
            return isCompatible(la.elementType(), lb.elementType());
        }
        if (a instanceof SetType sa && b instanceof SetType sb) {
            return isCompatible(sa.elementType(), sb.elementType());
        }
        if (a instanceof MapType ma && b instanceof MapType mb) {
            return isCompatible(ma.keyType(), mb.keyType()) && isCompatible(ma.valueType(), mb.valueType());
        }
        if (a instanceof TupleType ta && b instanceof TupleType tb) {
            return allCompatible(ta.elementTypes(), tb.elementTypes());
        }
        return false;
    }

    private static boolean allCompatible(List<DataType> as, List<DataType> bs) {
        if (as.size() != bs.size()) {
            return false;
        }
        for (int i = 0; i < as.size(); i++) {
            if (!isCompatible(as.get(i), bs.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Decides whether a value of type {@code source} can be stored as {@code target}
     * without losing range or precision. Stricter than {@link #isCompatible}.
     * <ul>
     *     <li>{@code Any} on either side is assignable.</li>
     *     <li>Integers widen within their signedness; an unsigned value fits a strictly wider signed type.</li>
     *     <li>An integer fits a float whose significand holds all of its bits.</li>
     *     <li>Floats widen to wider floats, and reals widen to complex through the component type.</li>
     *     <li>A char is assignable to a string.</li>
     *     <li>Collections apply the rule to their parameters; everything else requires equality.</li>
     * </ul>
     */
    public static boolean isAssignable(DataType target, DataType source) {
        if (target.family() == TypeFamily.ANY || source.family() == TypeFamily.ANY || target.equals(source)) {
            return true;
        }
        if (target instanceof IntegerType t && source instanceof IntegerType s) {
            if (t.isSigned() == s.isSigned()) {
                return t.bits() >= s.bits();
            }
            return t.isSigned() && t.bits() > s.bits();
        }
        if (target instanceof FloatType t) {
            if (source instanceof IntegerType s) {
                return s.bits() < t.significandBits();
            }
            return source instanceof FloatType s && t.bits() >= s.bits();
        }
        if (target instanceof ComplexType t) {
            if (source instanceof ComplexType s) {
                return t.bits() >= s.bits();
            }
            return isAssignable(t.componentType(), source);
        }
        if (target instanceof StringType) {
            return source instanceof CharType;
        }
        if (target instanceof ListType t && source instanceof ListType s) {
            return isAssignable(t.elementType(), s.elementType());
        }
        if (target instanceof SetType t && source instanceof SetType s) {
            return isAssignable(t.elementType(), s.elementType());
        }
        if (target instanceof MapType t && source instanceof MapType s) {
            return isAssignable(t.keyType(), s.keyType()) && isAssignable(t.valueType(), s.valueType());
        }
        if (target instanceof TupleType t && source instanceof TupleType s) {
            if (t.elementTypes().size() != s.elementTypes().size()) {
                return false;
            }
            for (int i = 0; i < t.elementTypes().size(); i++) {
                if (!isAssignable(t.elementTypes().get(i), s.elementTypes().get(i))) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }
}
