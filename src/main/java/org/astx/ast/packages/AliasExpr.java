package org.astx.ast.packages;

import org.astx.ast.AstKind;
import org.astx.ast.Expr;
import org.astx.ast.Names;
import org.astx.ast.types.DataType;
import org.astx.ast.types.DataTypes;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

/**
 * An imported name with an optional local rename ({@code name as asname}).
 */
public final class AliasExpr extends Expr {

    private final String name;
    private final String asname;

    public AliasExpr(String name) {
        this(name, null);
    }

    public AliasExpr(String name, String asname) {
        this.name = Names.require(name, "Alias");
        this.asname = asname == null || asname.isEmpty() ? null : asname;
    }

    public String name() {
        return name;
    }

    /**
     * @return The rename, or {@code null}.
     */
    public String asname() {
        return asname;
    }

    /**
     * @return The name the import binds locally.
     */
    public String boundName() {
        if (asname != null) {
            return asname;
        }
        int dot = name.indexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }

    @Override
    public DataType type() {
        return DataTypes.any();
    }

    @Override
    public AstKind kind() {
        return AstKind.ALIAS_EXPR;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAliasExpr(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.attr("name", name).optionalAttr("asname", asname);
    }

    @Override
    public String toString() {
        return asname == null ? "AliasExpr[" + name + "]" : "AliasExpr[" + name + ", " + asname + "]";
    }
}
