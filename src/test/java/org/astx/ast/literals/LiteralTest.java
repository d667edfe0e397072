package org.astx.ast.literals;

import org.astx.api.ErrorKind;
import org.astx.api.InvalidValueException;
import org.astx.api.MalformedNodeException;
import org.astx.api.TypeMismatchException;
import org.astx.ast.types.DataTypes;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the scalar, temporal and collection literals.
 * They verify range checks against the declared type, inferred collection types
 * and the rejection of duplicate set elements and dict keys.
 */
public class LiteralTest {

    @Test
    @Tag("unit")
    void testIntegerLiteralsAcceptTheirFullRange() {
        assertThat(new LiteralInt8(-128).value()).isEqualTo(BigInteger.valueOf(-128));
        assertThat(new LiteralInt8(127).value()).isEqualTo(BigInteger.valueOf(127));
        assertThat(new LiteralUInt8(255).type()).isEqualTo(DataTypes.uint8());
        assertThat(new LiteralUInt128(BigInteger.TWO.pow(128).subtract(BigInteger.ONE)).value().bitLength())
                .isEqualTo(128);
    }

    @Test
    @Tag("unit")
    void testIntegerLiteralOutOfRangeIsRejected() {
        assertThatThrownBy(() -> new LiteralInt8(128))
                .isInstanceOf(InvalidValueException.class)
                .hasMessageContaining("out of range");
        assertThatThrownBy(() -> new LiteralUInt16(-1)).isInstanceOf(InvalidValueException.class);
        assertThatThrownBy(() -> new LiteralInt128(BigInteger.TWO.pow(127)))
                .satisfies(e -> assertThat(((InvalidValueException) e).kind()).isEqualTo(ErrorKind.VALUE));
    }

    /**
     * Verifies that the factory range-checks before narrowing, so a huge value
     * reports a value error instead of an arithmetic overflow.
     */
    @Test
    @Tag("unit")
    void testIntegerFactoryPicksWidthAndChecksRange() {
        assertThat(LiteralInteger.of(DataTypes.uint32(), BigInteger.TEN)).isInstanceOf(LiteralUInt32.class);
        assertThat(LiteralInteger.of(DataTypes.int128(), BigInteger.ONE)).isInstanceOf(LiteralInt128.class);
        assertThatThrownBy(() -> LiteralInteger.of(DataTypes.int8(), BigInteger.TEN.pow(30)))
                .isInstanceOf(InvalidValueException.class);
    }

    @Test
    @Tag("unit")
    void testFloatOverflowIsRejectedButSpecialValuesAreKept() {
        assertThatThrownBy(() -> new LiteralFloat16(70000.0)).isInstanceOf(InvalidValueException.class);
        assertThat(new LiteralFloat16(65504.0).value()).isEqualTo(65504.0);
        assertThat(new LiteralFloat32(Double.NaN).value()).isNaN();
        assertThat(new LiteralFloat64(Double.POSITIVE_INFINITY).value()).isInfinite();
    }

    @Test
    @Tag("unit")
    void testComplexLiteralKeyShowsBothParts() {
        assertThat(new LiteralComplex32(1.0, 2.0)).hasToString("LiteralComplex32[1.0+2.0j]");
        assertThat(new LiteralComplex64(1.0, -2.0)).hasToString("LiteralComplex64[1.0-2.0j]");
    }

    @Test
    @Tag("unit")
    void testCharLiteralRequiresExactlyOneCodePoint() {
        assertThat(new LiteralUTF8Char("😀").codePoint()).isEqualTo(0x1F600);
        assertThatThrownBy(() -> new LiteralUTF8Char("ab")).isInstanceOf(InvalidValueException.class);
        assertThatThrownBy(() -> new LiteralUTF8Char("")).isInstanceOf(InvalidValueException.class);
    }

    @Test
    @Tag("unit")
    void testTextLiteralsRejectUnpairedSurrogates() {
        assertThatThrownBy(() -> new LiteralUTF8String("\uD800"))
                .isInstanceOf(InvalidValueException.class)
                .hasMessageContaining("U+D800");
        assertThatThrownBy(() -> new LiteralUTF8String("ok\uDC00"))
                .isInstanceOf(InvalidValueException.class)
                .hasMessageContaining("index 2");
        assertThatThrownBy(() -> new LiteralUTF8Char("\uDC00")).isInstanceOf(InvalidValueException.class);
        assertThat(new LiteralUTF8String("a😀b").value()).hasSize(4);
    }

    @Test
    @Tag("unit")
    void testTemporalLiteralsParseIsoText() {
        assertThat(new LiteralDate("2024-02-29").value()).isEqualTo(LocalDate.of(2024, 2, 29));
        assertThat(new LiteralTime("10:30").value()).isEqualTo(LocalTime.of(10, 30));
        assertThat(new LiteralDateTime("2024-01-02T03:04:05").value())
                .isEqualTo(LocalDateTime.of(2024, 1, 2, 3, 4, 5));
        assertThat(new LiteralTimestamp("2024-01-02 03:04:05.5").value())
                .isEqualTo(LocalDateTime.of(2024, 1, 2, 3, 4, 5, 500_000_000));
    }

    @Test
    @Tag("unit")
    void testMalformedTemporalTextIsAValueError() {
        assertThatThrownBy(() -> new LiteralDate("2023-02-30"))
                .isInstanceOf(InvalidValueException.class)
                .hasMessageContaining("Date");
        assertThatThrownBy(() -> new LiteralTime("25:00")).isInstanceOf(InvalidValueException.class);
    }

    @Test
    @Tag("unit")
    void testListTypeIsInferredFromElements() {
        LiteralList same = new LiteralList(List.of(new LiteralInt32(1), new LiteralInt32(2)));
        LiteralList mixed = new LiteralList(List.of(new LiteralInt32(1), new LiteralUTF8String("a")));
        LiteralList empty = new LiteralList(List.of());

        assertThat(same.type()).isEqualTo(DataTypes.list(DataTypes.int32()));
        assertThat(mixed.type()).isEqualTo(DataTypes.list(DataTypes.any()));
        assertThat(empty.type()).isEqualTo(DataTypes.list(DataTypes.any()));
        assertThat(same.getChildren()).hasSize(2);
    }

    @Test
    @Tag("unit")
    void testDeclaredElementTypeIsEnforced() {
        assertThatThrownBy(() -> new LiteralList(List.of(new LiteralUTF8String("x")), DataTypes.list(DataTypes.int32())))
                .isInstanceOf(TypeMismatchException.class);
    }

    @Test
    @Tag("unit")
    void testDeclaredElementTypeRejectsLossyNumbers() {
        assertThatThrownBy(() -> new LiteralList(List.of(new LiteralFloat64(1.5)), DataTypes.list(DataTypes.int8())))
                .isInstanceOf(TypeMismatchException.class);
        assertThatThrownBy(() -> new LiteralList(
                List.of(new LiteralInt64(100_000_000_000L)), DataTypes.list(DataTypes.int8())))
                .isInstanceOf(TypeMismatchException.class);
        assertThatThrownBy(() -> new LiteralSet(List.of(new LiteralInt32(1)), DataTypes.set(DataTypes.uint32())))
                .isInstanceOf(TypeMismatchException.class);
        assertThatThrownBy(() -> new LiteralDict(
                List.of(new LiteralUTF8String("a")), List.of(new LiteralFloat64(0.5)),
                DataTypes.map(DataTypes.utf8String(), DataTypes.float32())))
                .isInstanceOf(TypeMismatchException.class);

        LiteralList widened = new LiteralList(List.of(new LiteralInt8(1), new LiteralInt16(2)),
                DataTypes.list(DataTypes.int32()));
        assertThat(widened.type()).isEqualTo(DataTypes.list(DataTypes.int32()));
    }

    @Test
    @Tag("unit")
    void testSetRejectsStructurallyEqualElements() {
        assertThatThrownBy(() -> new LiteralSet(List.of(new LiteralInt32(1), new LiteralInt32(1))))
                .isInstanceOf(InvalidValueException.class)
                .hasMessageContaining("Duplicate");
        assertThat(new LiteralSet(List.of(new LiteralInt32(1), new LiteralInt64(1))).elements()).hasSize(2);
    }

    @Test
    @Tag("unit")
    void testDictChecksKeysAndSizes() {
        LiteralDict dict = new LiteralDict(
                List.of(new LiteralUTF8String("a"), new LiteralUTF8String("b")),
                List.of(new LiteralInt32(1), new LiteralInt32(2)));

        assertThat(dict.type()).isEqualTo(DataTypes.map(DataTypes.utf8String(), DataTypes.int32()));
        assertThat(dict.getChildren()).hasSize(4);
        assertThatThrownBy(() -> new LiteralDict(List.of(new LiteralInt32(1)), List.of()))
                .isInstanceOf(InvalidValueException.class);
        assertThatThrownBy(() -> new LiteralDict(
                List.of(new LiteralInt32(1), new LiteralInt32(1)),
                List.of(new LiteralInt32(1), new LiteralInt32(2))))
                .isInstanceOf(InvalidValueException.class);
    }

    @Test
    @Tag("unit")
    void testJoinedStringParts() {
        FormattedValue field = new FormattedValue(new LiteralInt32(3), 'r', new LiteralUTF8String(">4"));
        JoinedStr joined = new JoinedStr(List.of(new LiteralUTF8String("n="), field));

        assertThat(joined.type()).isEqualTo(DataTypes.utf8String());
        assertThat(joined.getChildren()).hasSize(2);
        assertThat(field.getChildren()).hasSize(2);
        assertThat(field.conversion()).isEqualTo('r');
        assertThatThrownBy(() -> new JoinedStr(List.of(new LiteralInt32(1))))
                .isInstanceOf(MalformedNodeException.class);
        assertThatThrownBy(() -> new FormattedValue(new LiteralInt32(1), 'x', null))
                .isInstanceOf(InvalidValueException.class);
        assertThatThrownBy(() -> new FormattedValue(new LiteralInt32(1), null, new LiteralInt32(2)))
                .isInstanceOf(MalformedNodeException.class);
    }

    @Test
    @Tag("unit")
    void testTupleTypeFollowsElementTypes() {
        LiteralTuple tuple = new LiteralTuple(List.of(new LiteralInt32(1), new LiteralBoolean(true)));
        assertThat(tuple.type()).isEqualTo(DataTypes.tuple(DataTypes.int32(), DataTypes.bool()));
    }
}
