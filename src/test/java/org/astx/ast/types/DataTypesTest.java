package org.astx.ast.types;

import org.astx.api.InvalidValueException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DataTypesTest {

    @Test
    @Tag("unit")
    void testTypesCompareStructurally() {
        assertThat(new IntegerType(32, true)).isEqualTo(DataTypes.int32());
        assertThat(DataTypes.int32()).isNotEqualTo(DataTypes.uint32());
        assertThat(DataTypes.list(DataTypes.int8())).isEqualTo(DataTypes.list(DataTypes.int8()));
        assertThat(DataTypes.struct("Point")).isNotEqualTo(DataTypes.classType("Point"));
    }

    @Test
    @Tag("unit")
    void testKeysNameWidthAndParameters() {
        assertThat(DataTypes.uint128()).hasToString("UInt128");
        assertThat(DataTypes.complex64()).hasToString("Complex64");
        assertThat(DataTypes.map(DataTypes.utf8String(), DataTypes.float32())).hasToString("MapType[UTF8String,Float32]");
        assertThat(DataTypes.function(DataTypes.bool(), DataTypes.int32(), DataTypes.int64()))
                .hasToString("FunctionType[(Int32,Int64)->Boolean]");
        assertThat(DataTypes.enumType("Color")).hasToString("EnumType[Color]");
    }

    @Test
    @Tag("unit")
    void testIntegerBounds() {
        assertThat(DataTypes.int8().min()).isEqualTo(BigInteger.valueOf(-128));
        assertThat(DataTypes.uint64().max()).isEqualTo(new BigInteger("18446744073709551615"));
        assertThatThrownBy(() -> new IntegerType(24, true)).isInstanceOf(InvalidValueException.class);
    }

    /**
     * Compatibility is symmetric, bridged by Any, and never mixes text with numbers.
     */
    @Test
    @Tag("unit")
    void testCompatibility() {
        assertThat(DataTypes.isCompatible(DataTypes.int8(), DataTypes.float64())).isTrue();
        assertThat(DataTypes.isCompatible(DataTypes.complex32(), DataTypes.uint16())).isTrue();
        assertThat(DataTypes.isCompatible(DataTypes.utf8Char(), DataTypes.utf8String())).isTrue();
        assertThat(DataTypes.isCompatible(DataTypes.utf8String(), DataTypes.int32())).isFalse();
        assertThat(DataTypes.isCompatible(DataTypes.bool(), DataTypes.int32())).isFalse();
        assertThat(DataTypes.isCompatible(DataTypes.any(), DataTypes.utf8String())).isTrue();
        assertThat(DataTypes.isCompatible(DataTypes.date(), DataTypes.dateTime())).isFalse();
        assertThat(DataTypes.isCompatible(DataTypes.list(DataTypes.int8()), DataTypes.list(DataTypes.float32()))).isTrue();
        assertThat(DataTypes.isCompatible(DataTypes.list(DataTypes.int8()), DataTypes.set(DataTypes.int8()))).isFalse();
        assertThat(DataTypes.isCompatible(
                DataTypes.tuple(DataTypes.int8(), DataTypes.bool()), DataTypes.tuple(DataTypes.int8()))).isFalse();
    }

    /**
     * Assignability only admits widening that keeps every value of the source type.
     */
    @Test
    @Tag("unit")
    void testAssignability() {
        assertThat(DataTypes.isAssignable(DataTypes.int32(), DataTypes.int8())).isTrue();
        assertThat(DataTypes.isAssignable(DataTypes.int8(), DataTypes.int32())).isFalse();
        assertThat(DataTypes.isAssignable(DataTypes.int16(), DataTypes.uint8())).isTrue();
        assertThat(DataTypes.isAssignable(DataTypes.int16(), DataTypes.uint16())).isFalse();
        assertThat(DataTypes.isAssignable(DataTypes.uint32(), DataTypes.int8())).isFalse();
        assertThat(DataTypes.isAssignable(DataTypes.float64(), DataTypes.int32())).isTrue();
        assertThat(DataTypes.isAssignable(DataTypes.float64(), DataTypes.int64())).isFalse();
        assertThat(DataTypes.isAssignable(DataTypes.int64(), DataTypes.float16())).isFalse();
        assertThat(DataTypes.isAssignable(DataTypes.complex64(), DataTypes.float32())).isTrue();
        assertThat(DataTypes.isAssignable(DataTypes.utf8String(), DataTypes.utf8Char())).isTrue();
        assertThat(DataTypes.isAssignable(DataTypes.utf8Char(), DataTypes.utf8String())).isFalse();
        assertThat(DataTypes.isAssignable(DataTypes.int8(), DataTypes.any())).isTrue();
        assertThat(DataTypes.isAssignable(
                DataTypes.list(DataTypes.int64()), DataTypes.list(DataTypes.int8()))).isTrue();
        assertThat(DataTypes.isAssignable(
                DataTypes.list(DataTypes.int8()), DataTypes.list(DataTypes.float32()))).isFalse();
    }

    @Test
    @Tag("unit")
    void testFamilies() {
        assertThat(DataTypes.float16().isNumeric()).isTrue();
        assertThat(DataTypes.bool().isNumeric()).isFalse();
        assertThat(DataTypes.timestamp().family()).isEqualTo(TypeFamily.TEMPORAL);
    }
}
