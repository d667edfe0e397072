package org.astx.ast.packages;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Statement;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.List;

/**
 * Imports names from a module. A positive level makes the import relative, one parent package per level.
 */
public final class ImportFromStmt extends Statement {

    private final String module;
    private final List<AliasExpr> names;
    private final int level;

    public ImportFromStmt(String module, List<AliasExpr> names) {
        this(module, names, 0);
    }

    public ImportFromStmt(String module, List<AliasExpr> names, int level) {
        this.module = ImportNames.requireSource(module, level, "ImportFromStmt");
        ImportNames.requireNames(names, "ImportFromStmt");
        this.names = adoptAll(names);
        this.level = level;
    }

    /**
     * @return The module name without leading dots; empty for a bare relative import.
     */
    public String module() {
        return module;
    }

    public List<AliasExpr> names() {
        return names;
    }

    public int level() {
        return level;
    }

    public String qualifiedModule() {
        return ImportNames.qualified(module, level);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(names);
    }

    @Override
    public AstKind kind() {
        return AstKind.IMPORT_FROM_STMT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitImportFromStmt(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.attr("module", module).attr("level", level).children("names", names);
    }

    @Override
    public String toString() {
        return "ImportFromStmt[" + qualifiedModule() + "]";
    }
}
