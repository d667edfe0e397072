package org.astx.ast.packages;

import org.astx.api.InvalidValueException;
import org.astx.api.MalformedNodeException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PackageTest {

    @Test
    @Tag("unit")
    void testAliasBindsItsLocalName() {
        assertThat(new AliasExpr("numpy", "np").boundName()).isEqualTo("np");
        assertThat(new AliasExpr("os").boundName()).isEqualTo("os");
    }

    @Test
    @Tag("unit")
    void testImportRequiresNames() {
        assertThatThrownBy(() -> new ImportStmt(List.of())).isInstanceOf(MalformedNodeException.class);
        assertThatThrownBy(() -> new ImportFromStmt("os", List.of())).isInstanceOf(MalformedNodeException.class);
    }

    /**
     * A from-import needs a module unless it is relative, and a level is never negative.
     */
    @Test
    @Tag("unit")
    void testImportFromSource() {
        ImportFromStmt relative = new ImportFromStmt("", List.of(new AliasExpr("sibling")), 2);
        ImportFromStmt named = new ImportFromStmt("pkg.mod", List.of(new AliasExpr("x")), 1);

        assertThat(relative.qualifiedModule()).isEqualTo("..");
        assertThat(named.qualifiedModule()).isEqualTo(".pkg.mod");
        assertThatThrownBy(() -> new ImportFromStmt(null, List.of(new AliasExpr("x"))))
                .isInstanceOf(MalformedNodeException.class);
        assertThatThrownBy(() -> new ImportFromExpr("os", List.of(new AliasExpr("path")), -1))
                .isInstanceOf(InvalidValueException.class);
    }

    @Test
    @Tag("unit")
    void testPackageNamesAreUnique() {
        assertThatThrownBy(() -> new Package("app", List.of(new Module("a"), new Module("a"))))
                .isInstanceOf(MalformedNodeException.class);
        assertThatThrownBy(() -> new Package("app", List.of(), List.of(new Package("x", List.of()), new Package("x", List.of()))))
                .isInstanceOf(MalformedNodeException.class);
    }

    @Test
    @Tag("unit")
    void testProgramListsTargetFirst() {
        Module main = new Module();
        Package lib = new Package("lib", List.of(new Module("util")));
        Target target = new Target("e-m:e", "x86_64-pc-linux-gnu");

        Program program = new Program("demo", target, List.of(main), List.of(lib));

        assertThat(program.getChildren()).containsExactly(target, main, lib);
        assertThat(program.target().triple()).isEqualTo("x86_64-pc-linux-gnu");
        assertThat(main.name()).isEqualTo("main");
        assertThat(main.getParent()).containsSame(program);
        assertThat(program).hasToString("Program[demo]");
    }
}
