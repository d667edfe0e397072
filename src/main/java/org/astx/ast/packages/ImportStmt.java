package org.astx.ast.packages;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Statement;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;

/**
 * Imports modules by name. No module resolution takes place.
 */
public final class ImportStmt extends Statement {

    private final List<AliasExpr> names;

    public ImportStmt(List<AliasExpr> names) {
        ImportNames.requireNames(names, "ImportStmt");
        this.names = adoptAll(names);
    }

    public List<AliasExpr> names() {
        return names;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(names);
    }

    @Override
    public AstKind kind() {
        return AstKind.IMPORT_STMT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitImportStmt(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.children("names", names);
    }

    @Override
    public String toString() {
        return "ImportStmt";
    }
}
