package org.astx.ast.literals;

import org.astx.api.InvalidValueException;
import org.astx.api.MalformedNodeException;
import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Expr;
import org.astx.ast.types.DataType;
import org.astx.ast.types.DataTypes;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A replacement field of a {@link JoinedStr}, such as {@code {price!r:.2f}}.
 * <p>
 * The conversion is one of {@code s}, {@code r} or {@code a}, or absent. The format spec,
 * when present, is a plain string or a nested {@link JoinedStr}.
 */
public final class FormattedValue extends Expr {

    private static final String CONVERSIONS = "sra";

    private final Expr value;
    private final Character conversion;
    private final Expr formatSpec;

    public FormattedValue(Expr value) {
        this(value, null, null);
    }

    public FormattedValue(Expr value, Character conversion, Expr formatSpec) {
        if (conversion != null && CONVERSIONS.indexOf(conversion) < 0) {
            throw new InvalidValueException("Unknown conversion '!" + conversion + "', expected one of !s, !r, !a");
        }
        if (formatSpec != null && !(formatSpec instanceof LiteralUTF8String || formatSpec instanceof JoinedStr)) {
            throw new MalformedNodeException("Format spec must be a string or a joined string, got " + formatSpec);
        }
        this.value = adopt(Objects.requireNonNull(value, "value"));
        this.conversion = conversion;
        this.formatSpec = adopt(formatSpec);
    }

    public Expr value() {
        return value;
    }

    /**
     * @return The conversion character, or {@code null}.
     */
    public Character conversion() {
        return conversion;
    }

    /**
     * @return The format spec, or {@code null}.
     */
    public Expr formatSpec() {
        return formatSpec;
    }

    @Override
    public DataType type() {
        return DataTypes.utf8String();
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(List.of(value));
        if (formatSpec != null) {
            children.add(formatSpec);
        }
        return children;
    }

    @Override
    public AstKind kind() {
        return AstKind.FORMATTED_VALUE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFormattedValue(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("value", value)
                .optionalAttr("conversion", conversion == null ? null : conversion.toString())
                .optionalChild("format-spec", formatSpec);
    }

    @Override
    public String toString() {
        return conversion == null ? "FormattedValue" : "FormattedValue[!" + conversion + "]";
    }
}
