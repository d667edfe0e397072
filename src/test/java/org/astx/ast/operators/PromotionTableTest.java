package org.astx.ast.operators;

import org.astx.api.TypeMismatchException;
import org.astx.ast.types.DataType;
import org.astx.ast.types.DataTypes;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Table-driven checks of operator result types.
 */
public class PromotionTableTest {

    static Stream<Arguments> binaryResults() {
        return Stream.of(
                Arguments.of("+", DataTypes.int8(), DataTypes.int32(), DataTypes.int32()),
                Arguments.of("*", DataTypes.uint8(), DataTypes.uint64(), DataTypes.uint64()),
                Arguments.of("-", DataTypes.int32(), DataTypes.uint16(), DataTypes.int32()),
                Arguments.of("+", DataTypes.int32(), DataTypes.uint32(), DataTypes.int64()),
                Arguments.of("+", DataTypes.uint64(), DataTypes.int8(), DataTypes.int128()),
                Arguments.of("/", DataTypes.int32(), DataTypes.int32(), DataTypes.float64()),
                Arguments.of("+", DataTypes.int64(), DataTypes.float16(), DataTypes.float16()),
                Arguments.of("*", DataTypes.float32(), DataTypes.float64(), DataTypes.float64()),
                Arguments.of("+", DataTypes.complex32(), DataTypes.float32(), DataTypes.complex32()),
                Arguments.of("+", DataTypes.complex32(), DataTypes.float64(), DataTypes.complex64()),
                Arguments.of("+", DataTypes.utf8Char(), DataTypes.utf8String(), DataTypes.utf8String()),
                Arguments.of("*", DataTypes.utf8String(), DataTypes.int32(), DataTypes.utf8String()),
                Arguments.of("&", DataTypes.uint8(), DataTypes.uint16(), DataTypes.uint16()),
                Arguments.of("<<", DataTypes.int8(), DataTypes.int64(), DataTypes.int8()),
                Arguments.of("^", DataTypes.bool(), DataTypes.bool(), DataTypes.bool()),
                Arguments.of("==", DataTypes.int8(), DataTypes.float64(), DataTypes.bool()),
                Arguments.of("<", DataTypes.utf8String(), DataTypes.utf8Char(), DataTypes.bool()),
                Arguments.of("<=", DataTypes.date(), DataTypes.date(), DataTypes.bool()),
                Arguments.of("and", DataTypes.bool(), DataTypes.bool(), DataTypes.bool()),
                Arguments.of("+", DataTypes.any(), DataTypes.int32(), DataTypes.any()),
                Arguments.of(">", DataTypes.any(), DataTypes.utf8String(), DataTypes.bool()));
    }

    @ParameterizedTest(name = "{1} {0} {2} -> {3}")
    @MethodSource("binaryResults")
    @Tag("unit")
    void testBinaryResultType(String op, DataType lhs, DataType rhs, DataType expected) {
        assertThat(PromotionTable.binary(op, lhs, rhs)).isEqualTo(expected);
    }

    static Stream<Arguments> binaryMismatches() {
        return Stream.of(
                Arguments.of("+", DataTypes.bool(), DataTypes.int32()),
                Arguments.of("+", DataTypes.uint128(), DataTypes.int8()),
                Arguments.of("%", DataTypes.complex32(), DataTypes.int32()),
                Arguments.of("-", DataTypes.utf8String(), DataTypes.utf8String()),
                Arguments.of("<", DataTypes.complex64(), DataTypes.int32()),
                Arguments.of("<", DataTypes.date(), DataTypes.time()),
                Arguments.of("==", DataTypes.utf8String(), DataTypes.int32()),
                Arguments.of("and", DataTypes.int32(), DataTypes.bool()),
                Arguments.of("<<", DataTypes.float32(), DataTypes.int8()),
                Arguments.of("@", DataTypes.int32(), DataTypes.int32()));
    }

    @ParameterizedTest(name = "{1} {0} {2} fails")
    @MethodSource("binaryMismatches")
    @Tag("unit")
    void testBinaryMismatchIsATypeError(String op, DataType lhs, DataType rhs) {
        assertThatThrownBy(() -> PromotionTable.binary(op, lhs, rhs)).isInstanceOf(TypeMismatchException.class);
    }

    @Test
    @Tag("unit")
    void testUnaryOperators() {
        assertThat(PromotionTable.unary("-", DataTypes.float32())).isEqualTo(DataTypes.float32());
        assertThat(PromotionTable.unary("~", DataTypes.uint8())).isEqualTo(DataTypes.uint8());
        assertThat(PromotionTable.unary("not", DataTypes.bool())).isEqualTo(DataTypes.bool());
        assertThatThrownBy(() -> PromotionTable.unary("-", DataTypes.uint32())).isInstanceOf(TypeMismatchException.class);
        assertThatThrownBy(() -> PromotionTable.unary("~", DataTypes.float64())).isInstanceOf(TypeMismatchException.class);
        assertThatThrownBy(() -> PromotionTable.unary("!", DataTypes.int8())).isInstanceOf(TypeMismatchException.class);
    }

    @Test
    @Tag("unit")
    void testPromotionIsSymmetric() {
        assertThat(PromotionTable.promoteIntegers(DataTypes.uint16(), DataTypes.int8()))
                .isEqualTo(PromotionTable.promoteIntegers(DataTypes.int8(), DataTypes.uint16()))
                .isEqualTo(DataTypes.int32());
    }
}
