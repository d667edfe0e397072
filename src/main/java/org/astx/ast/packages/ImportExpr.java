package org.astx.ast.packages;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Expr;
import org.astx.ast.types.DataType;
import org.astx.ast.types.DataTypes;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;

/**
 * The expression form of an import.
 */
public final class ImportExpr extends Expr {

    private final List<AliasExpr> names;

    public ImportExpr(List<AliasExpr> names) {
        ImportNames.requireNames(names, "ImportExpr");
        this.names = adoptAll(names);
    }

    public List<AliasExpr> names() {
        return names;
    }

    @Override
    public DataType type() {
        return DataTypes.any();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(names);
    }

    @Override
    public AstKind kind() {
        return AstKind.IMPORT_EXPR;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitImportExpr(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.children("names", names);
    }

    @Override
    public String toString() {
        return "ImportExpr";
    }
}
