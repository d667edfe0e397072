package org.astx.ast.packages;

import org.astx.ast.AstKind;
import org.astx.ast.AstNode;
import org.astx.ast.Names;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * A named group of modules and nested packages.
 */
public class Package extends AstNode {

    private final String name;
    private final List<Module> modules;
    private final List<Package> packages;

    public Package(String name, List<Module> modules) {
        this(name, modules, List.of());
    }

    public Package(String name, List<Module> modules, List<Package> packages) {
        this.name = Names.require(name, getClass().getSimpleName());
        Names.requireUnique(modules, Module::name, "module", name);
        Names.requireUnique(packages, Package::name, "package", name);
        this.modules = adoptAll(modules);
        this.packages = adoptAll(packages);
    }

    public String name() {
        return name;
    }

    public List<Module> modules() {
        return modules;
    }

    public List<Package> packages() {
        return packages;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(modules);
        children.addAll(packages);
        return children;
    }

    @Override
    public AstKind kind() {
        return AstKind.PACKAGE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitPackage(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        struct.attr("name", name).children("modules", modules).children("packages", packages);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
