package org.astx.ast.operators;

import org.astx.api.TypeMismatchException;
import org.astx.ast.types.AnyType;
import org.astx.ast.types.ComplexType;
import org.astx.ast.types.DataType;
import org.astx.ast.types.DataTypes;
import org.astx.ast.types.FloatType;
import org.astx.ast.types.IntegerType;
import org.astx.ast.types.ListType;
import org.astx.ast.types.TemporalType;
import org.astx.ast.types.TypeFamily;

import java.util.Set;

/**
 * Resolves the result type of an operator from its operator code and operand types.
 * <p>
 * Every lookup either returns a type or fails with {@link TypeMismatchException}.
 * The full table:
 * <ul>
 *     <li>Arithmetic {@code + - * / // % **}: two integers of the same signedness give the
 *     wider one; mixed signedness gives the signed type when it is strictly wider, otherwise
 *     the signed type of twice the unsigned width ({@code UInt128} has no such type and fails);
 *     {@code /} on two integers gives {@code Float64}; an integer with a float gives the float;
 *     two floats give the wider; a complex operand gives a complex result, widened to
 *     {@code Complex64} when the other side is {@code Float64} or {@code Complex64};
 *     {@code %} and {@code //} reject complex operands.</li>
 *     <li>Text: {@code +} on chars or strings gives {@code UTF8String}; {@code *} of text and an
 *     integer gives {@code UTF8String}. Lists: {@code +} on compatible lists gives a list.</li>
 *     <li>Bitwise {@code & | ^} on integers follow the integer rule above, on booleans give
 *     {@code Boolean}; shifts {@code << >>} take two integers and give the left type.</li>
 *     <li>Equality {@code == !=} on compatible operands gives {@code Boolean}; ordering
 *     {@code < <= > >=} accepts non-complex numerics, text, or two identical temporal types.</li>
 *     <li>Boolean {@code and or xor nand nor xnor} (and {@code && ||}) take two booleans.</li>
 *     <li>Unary {@code + -} keep a numeric type ({@code -} rejects unsigned integers),
 *     {@code ~} keeps an integer type, {@code not !} map a boolean to {@code Boolean}.</li>
 *     <li>{@code Any} on either side of an arithmetic or bitwise operator gives {@code Any};
 *     for comparisons and boolean operators it gives {@code Boolean}.</li>
 * </ul>
 * Booleans never take part in arithmetic.
 */
public final class PromotionTable {

    public static final Set<String> ARITHMETIC = Set.of("+", "-", "*", "/", "//", "%", "**");
    public static final Set<String> BITWISE = Set.of("&", "|", "^", "<<", ">>");
    public static final Set<String> EQUALITY = Set.of("==", "!=");
    public static final Set<String> ORDERING = Set.of("<", "<=", ">", ">=");
    public static final Set<String> BOOLEAN = Set.of("and", "or", "xor", "nand", "nor", "xnor", "&&", "||");
    public static final Set<String> UNARY = Set.of("+", "-", "~", "not", "!");

    private PromotionTable() {}

    public static boolean isComparison(String op) {
        return EQUALITY.contains(op) || ORDERING.contains(op);
    }

    public static boolean isBoolean(String op) {
        return BOOLEAN.contains(op);
    }

    /**
     * Resolves any binary operator code.
     */
    public static DataType binary(String op, DataType lhs, DataType rhs) {
        if (isComparison(op)) {
            return compare(op, lhs, rhs);
        }
        if (isBoolean(op)) {
            return bool(op, lhs, rhs);
        }
        if (!ARITHMETIC.contains(op) && !BITWISE.contains(op)) {
            throw new TypeMismatchException("Unknown binary operator '" + op + "'");
        }
        if (isAny(lhs) || isAny(rhs)) {
            return DataTypes.any();
        }
        if (BITWISE.contains(op)) {
            return bitwise(op, lhs, rhs);
        }
        TypeFamily fl = lhs.family();
        TypeFamily fr = rhs.family();
        if (fl == TypeFamily.TEXT && fr == TypeFamily.TEXT && op.equals("+")) {
            return DataTypes.utf8String();
        }
        if (op.equals("*") && (fl == TypeFamily.TEXT && fr == TypeFamily.INTEGER
                || fl == TypeFamily.INTEGER && fr == TypeFamily.TEXT)) {
            return DataTypes.utf8String();
        }
        if (op.equals("+") && lhs instanceof ListType ll && rhs instanceof ListType lr
                && DataTypes.isCompatible(ll.elementType(), lr.elementType())) {
            return ll.elementType().equals(lr.elementType()) ? ll : DataTypes.list(DataTypes.any());
        }
        if (lhs.isNumeric() && rhs.isNumeric()) {
            return arithmetic(op, lhs, rhs);
        }
        throw mismatch(op, lhs, rhs);
    }

    public static DataType compare(String op, DataType lhs, DataType rhs) {
        if (!isComparison(op)) {
            throw new TypeMismatchException("Unknown comparison operator '" + op + "'");
        }
        if (EQUALITY.contains(op)) {
            if (DataTypes.isCompatible(lhs, rhs)) {
                return DataTypes.bool();
            }
            throw mismatch(op, lhs, rhs);
        }
        if (isAny(lhs) || isAny(rhs)) {
            return DataTypes.bool();
        }
        boolean orderedNumbers = lhs.isNumeric() && rhs.isNumeric()
                && !(lhs instanceof ComplexType) && !(rhs instanceof ComplexType);
        boolean orderedText = lhs.family() == TypeFamily.TEXT && rhs.family() == TypeFamily.TEXT;
        boolean orderedTime = lhs instanceof TemporalType && lhs.equals(rhs);
        if (orderedNumbers || orderedText || orderedTime) {
            return DataTypes.bool();
        }
        throw mismatch(op, lhs, rhs);
    }

    public static DataType bool(String op, DataType lhs, DataType rhs) {
        if (!isBoolean(op)) {
            throw new TypeMismatchException("Unknown boolean operator '" + op + "'");
        }
        if (isBooleanLike(lhs) && isBooleanLike(rhs)) {
            return DataTypes.bool();
        }
        throw mismatch(op, lhs, rhs);
    }

    public static DataType unary(String op, DataType operand) {
        switch (op) {
            case "not", "!" -> {
                if (isBooleanLike(operand)) {
                    return DataTypes.bool();
                }
            }
            case "+" -> {
                if (isAny(operand) || operand.isNumeric()) {
                    return operand;
                }
            }
            case "-" -> {
                if (operand instanceof IntegerType it && !it.isSigned()) {
                    throw new TypeMismatchException("Unary '-' is not defined for unsigned " + operand);
                }
                if (isAny(operand) || operand.isNumeric()) {
                    return operand;
                }
            }
            case "~" -> {
                if (isAny(operand) || operand instanceof IntegerType) {
                    return operand;
                }
            }
            default -> throw new TypeMismatchException("Unknown unary operator '" + op + "'");
        }
        throw new TypeMismatchException(String.format("Unary '%s' is not defined for %s", op, operand));
    }

    /**
     * Common integer type of two integer operands.
     */
    public static IntegerType promoteIntegers(IntegerType a, IntegerType b) {
        if (a.isSigned() == b.isSigned()) {
            return a.bits() >= b.bits() ? a : b;
        }
        IntegerType signed = a.isSigned() ? a : b;
        IntegerType unsigned = a.isSigned() ? b : a;
        if (signed.bits() > unsigned.bits()) {
            return signed;
        }
        if (unsigned.bits() == 128) {
            throw new TypeMismatchException(String.format(
                    "No signed integer type can hold both %s and %s", a, b));
        }
        return new IntegerType(unsigned.bits() * 2, true);
    }

    private static DataType arithmetic(String op, DataType lhs, DataType rhs) {
        if (lhs instanceof ComplexType || rhs instanceof ComplexType) {
            if (op.equals("%") || op.equals("//")) {
                throw mismatch(op, lhs, rhs);
            }
            return complexResult(lhs, rhs);
        }
        if (lhs instanceof FloatType fl && rhs instanceof FloatType fr) {
            return fl.bits() >= fr.bits() ? fl : fr;
        }
        if (lhs instanceof FloatType) {
            return lhs;
        }
        if (rhs instanceof FloatType) {
            return rhs;
        }
        if (op.equals("/")) {
            return DataTypes.float64();
        }
        return promoteIntegers((IntegerType) lhs, (IntegerType) rhs);
    }

    private static ComplexType complexResult(DataType lhs, DataType rhs) {
        int bits = 32;
        for (DataType side : new DataType[] {lhs, rhs}) {
            if (side instanceof ComplexType c && c.bits() == 64 || side instanceof FloatType f && f.bits() == 64) {
                bits = 64;
            }
        }
        return new ComplexType(bits);
    }

    private static DataType bitwise(String op, DataType lhs, DataType rhs) {
        if (lhs instanceof IntegerType il && rhs instanceof IntegerType ir) {
            return op.equals("<<") || op.equals(">>") ? il : promoteIntegers(il, ir);
        }
        boolean logical = op.equals("&") || op.equals("|") || op.equals("^");
        if (logical && lhs.family() == TypeFamily.BOOLEAN && rhs.family() == TypeFamily.BOOLEAN) {
            return DataTypes.bool();
        }
        throw mismatch(op, lhs, rhs);
    }

    private static boolean isAny(DataType type) {
        return type instanceof AnyType;
    }

    private static boolean isBooleanLike(DataType type) {
        return isAny(type) || type.family() == TypeFamily.BOOLEAN;
    }

    private static TypeMismatchException mismatch(String op, DataType lhs, DataType rhs) {
        return new TypeMismatchException(String.format(
                "Operator '%s' is not defined for %s and %s", op, lhs, rhs));
    }
}
