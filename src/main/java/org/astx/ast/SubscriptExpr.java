package org.astx.ast;

import org.astx.api.MalformedNodeException;
import org.astx.ast.literals.LiteralInteger;
import org.astx.ast.types.DataType;
import org.astx.ast.types.DataTypes;
import org.astx.ast.types.ListType;
import org.astx.ast.types.MapType;
import org.astx.ast.types.TupleType;
import org.astx.ast.types.TypeFamily;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Element access {@code value[index]} or slicing {@code value[lower:upper:step]}.
 * <p>
 * An index and slice bounds are mutually exclusive. Use {@link #index(Expr, Expr)} and
 * {@link #slice(Expr, Expr, Expr, Expr)}; any slice bound may be absent.
 */
public final class SubscriptExpr extends Expr {

    private final Expr value;
    private final Expr index;
    private final Expr lower;
    private final Expr upper;
    private final Expr step;

    private SubscriptExpr(Expr value, Expr index, Expr lower, Expr upper, Expr step) {
        if (value == null) {
            throw new MalformedNodeException("Subscript requires a subscripted value");
        }
        if (index != null && (lower != null || upper != null || step != null)) {
            throw new MalformedNodeException("Subscript cannot combine an index with slice bounds");
        }
        this.value = adopt(value);
        this.index = adopt(index);
        this.lower = adopt(lower);
        this.upper = adopt(upper);
        this.step = adopt(step);
    }

    public static SubscriptExpr index(Expr value, Expr index) {
        if (index == null) {
            throw new MalformedNodeException("Index subscript requires an index");
        }
        return new SubscriptExpr(value, index, null, null, null);
    }

    public static SubscriptExpr slice(Expr value, Expr lower, Expr upper, Expr step) {
        return new SubscriptExpr(value, null, lower, upper, step);
    }

    public Expr value() {
        return value;
    }

    public Expr indexExpr() {
        return index;
    }

    public Expr lower() {
        return lower;
    }

    public Expr upper() {
        return upper;
    }

    public Expr step() {
        return step;
    }

    public boolean isSlice() {
        return index == null;
    }

    /**
     * Slices keep the container type; element access yields the element type where it is known.
     */
    @Override
    public DataType type() {
        DataType container = value.type();
        if (isSlice()) {
            return container;
        }
        if (container instanceof ListType list) {
            return list.elementType();
        }
        if (container instanceof MapType map) {
            return map.valueType();
        }
        if (container instanceof TupleType tuple && index instanceof LiteralInteger position) {
            int i = position.value().intValue();
            if (i >= 0 && i < tuple.elementTypes().size()) {
                return tuple.elementTypes().get(i);
            }
        }
        if (container.family() == TypeFamily.TEXT) {
            return DataTypes.utf8Char();
        }
        return DataTypes.any();
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        for (Expr part : new Expr[] {value, index, lower, upper, step}) {
            if (part != null) {
                children.add(part);
            }
        }
        return children;
    }

    @Override
    public AstKind kind() {
        return AstKind.SUBSCRIPT_EXPR;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSubscriptExpr(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("value", value)
                .optionalChild("index", index)
                .optionalChild("lower", lower)
                .optionalChild("upper", upper)
                .optionalChild("step", step);
    }

    @Override
    public String toString() {
        return isSlice() ? "SubscriptExpr[slice]" : "SubscriptExpr";
    }
}
