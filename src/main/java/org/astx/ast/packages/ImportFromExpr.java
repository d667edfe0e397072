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
 * The expression form of a from-import.
 */
public final class ImportFromExpr extends Expr {

    private final String module;
    private final List<AliasExpr> names;
    private final int level;

    public ImportFromExpr(String module, List<AliasExpr> names) {
        this(module, names, 0);
    }

    public ImportFromExpr(String module, List<AliasExpr> names, int level) {
        this.module = ImportNames.requireSource(module, level, "ImportFromExpr");
        ImportNames.requireNames(names, "ImportFromExpr");
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
    public DataType type() {
        return DataTypes.any();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(names);
    }

    @Override
    public AstKind kind() {
        return AstKind.IMPORT_FROM_EXPR;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitImportFromExpr(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.attr("module", module).attr("level", level).children("names", names);
    }

    @Override
    public String toString() {
        return "ImportFromExpr[" + qualifiedModule() + "]";
    }
}
