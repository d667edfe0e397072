package org.astx.ast.literals;

import org.astx.api.InvalidValueException;
import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Expr;
import org.astx.ast.types.DataTypes;
import org.astx.ast.types.MapType;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * A mapping literal held as parallel key and value lists in source order.
 * Structurally equal keys are rejected.
 */
public final class LiteralDict extends Literal {

    private final List<Expr> keys;
    private final List<Expr> values;

    public LiteralDict(List<? extends Expr> keys, List<? extends Expr> values) {
        this(keys, values, DataTypes.map(CollectionLiterals.commonType(keys), CollectionLiterals.commonType(values)));
    }

    public LiteralDict(List<? extends Expr> keys, List<? extends Expr> values, MapType type) {
        super(type);
        if (keys.size() != values.size()) {
            throw new InvalidValueException(String.format(
                    "Dict literal has %d keys but %d values", keys.size(), values.size()));
        }
        CollectionLiterals.requireElementsOf(type.keyType(), keys, "Key");
        CollectionLiterals.requireElementsOf(type.valueType(), values, "Value");
        CollectionLiterals.requireDistinct(keys, "dict key");
        this.keys = adoptAll(keys);
        this.values = adoptAll(values);
    }

    public List<Expr> keys() {
        return keys;
    }

    public List<Expr> values() {
        return values;
    }

    public int size() {
        return keys.size();
    }

    @Override
    public MapType type() {
        return (MapType) super.type();
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(keys.size() * 2);
        for (int i = 0; i < keys.size(); i++) {
            children.add(keys.get(i));
            children.add(values.get(i));
        }
        return children;
    }

    @Override
    public AstKind kind() {
        return AstKind.LITERAL_DICT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLiteralDict(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("type", type()).children("keys", keys).children("values", values);
    }

    @Override
    public String toString() {
        return "LiteralDict";
    }
}
