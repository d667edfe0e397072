package org.astx.ast.comprehensions;

import org.astx.api.MalformedNodeException;
import org.astx.ast.literals.LiteralInt32;
import org.astx.ast.literals.LiteralList;
import org.astx.ast.operators.CompareOp;
import org.astx.ast.types.DataTypes;
import org.astx.ast.variables.Variable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ComprehensionTest {

    private static ComprehensionClause clause() {
        Variable x = new Variable("x", DataTypes.int32());
        return new ComprehensionClause(x, new LiteralList(List.of(new LiteralInt32(1), new LiteralInt32(2))),
                List.of(new CompareOp(">", new Variable("x", DataTypes.int32()), new LiteralInt32(0))), false);
    }

    @Test
    @Tag("unit")
    void testComprehensionRequiresAClause() {
        Variable x = new Variable("x", DataTypes.int32());
        assertThatThrownBy(() -> new ListComprehension(x, List.of()))
                .isInstanceOf(MalformedNodeException.class)
                .hasMessageContaining("ListComprehension");
        assertThatThrownBy(() -> new DictComprehension(x, x, List.of()))
                .isInstanceOf(MalformedNodeException.class);
    }

    @Test
    @Tag("unit")
    void testComprehensionTypes() {
        Variable x = new Variable("x", DataTypes.int32());

        assertThat(new ListComprehension(x, List.of(clause())).type()).isEqualTo(DataTypes.list(DataTypes.int32()));
        assertThat(new SetComprehension(new Variable("x", DataTypes.int32()), List.of(clause())).type())
                .isEqualTo(DataTypes.set(DataTypes.int32()));
        assertThat(new DictComprehension(new Variable("x", DataTypes.int32()), new Variable("s", DataTypes.utf8String()),
                List.of(clause())).type())
                .isEqualTo(DataTypes.map(DataTypes.int32(), DataTypes.utf8String()));
    }

    @Test
    @Tag("unit")
    void testClauseChildren() {
        ComprehensionClause clause = clause();
        assertThat(clause.getChildren()).hasSize(3);
        assertThat(new ListComprehension(new Variable("x"), List.of(clause)).getChildren()).hasSize(2);
    }
}
