package org.astx.ast.comprehensions;

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
 * Builds a mapping from a key and a value expression.
 */
public final class DictComprehension extends Comprehension {

    private final Expr key;
    private final Expr value;

    public DictComprehension(Expr key, Expr value, List<ComprehensionClause> clauses) {
        super(clauses);
        this.key = adopt(Objects.requireNonNull(key, "key"));
        this.value = adopt(Objects.requireNonNull(value, "value"));
    }

    public Expr key() {
        return key;
    }

    public Expr value() {
        return value;
    }

    @Override
    public DataType type() {
        return DataTypes.map(key.type(), value.type());
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(List.of(key, value));
        children.addAll(clauses());
        return children;
    }

    @Override
    public AstKind kind() {
        return AstKind.DICT_COMPREHENSION;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitDictComprehension(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.child("key", key).child("value", value).children("clauses", clauses());
    }
}
