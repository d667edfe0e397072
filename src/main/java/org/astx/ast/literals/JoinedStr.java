package org.astx.ast.literals;

import org.astx.api.MalformedNodeException;
import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Expr;
import org.astx.ast.types.DataType;
import org.astx.ast.types.DataTypes;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;
import java.util.Objects;

/**
 * An interpolated string literal ({@code f'total: {n}'}) made of plain string parts and
 * {@link FormattedValue} fields, in source order.
 */
public final class JoinedStr extends Expr {

    private final List<Expr> values;

    public JoinedStr(List<? extends Expr> values) {
        Objects.requireNonNull(values, "values");
        for (Expr part : values) {
            if (!(part instanceof LiteralUTF8String || part instanceof FormattedValue)) {
                throw new MalformedNodeException("Joined string parts must be strings or formatted values, got " + part);
            }
        }
        this.values = adoptAll(values);
    }

    public List<Expr> values() {
        return values;
    }

    @Override
    public DataType type() {
        return DataTypes.utf8String();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(values);
    }

    @Override
    public AstKind kind() {
        return AstKind.JOINED_STR;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitJoinedStr(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.children("values", values);
    }

    @Override
    public String toString() {
        return "JoinedStr[" + values.size() + "]";
    }
}
