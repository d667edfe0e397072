package org.astx.ast;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.astx.api.ErrorKind;
import org.astx.api.NodeIndexException;
import org.astx.ast.literals.LiteralInt32;
import org.astx.ast.operators.BinaryOp;
import org.astx.ast.types.DataTypes;
import org.astx.ast.variables.Variable;
import org.astx.serialization.StructMode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the node base contract: identity, parent links,
 * structural equality, the structural forms and indexed containers.
 */
public class AstNodeTest {

    @Test
    @Tag("unit")
    void testIdentityTokensAreUnique() {
        LiteralInt32 a = new LiteralInt32(1);
        LiteralInt32 b = new LiteralInt32(1);
        assertThat(a.id()).isNotEqualTo(b.id());
        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
    }

    /**
     * Verifies that location and comment take no part in equality.
     */
    @Test
    @Tag("unit")
    void testEqualityIgnoresMetadata() {
        LiteralInt32 a = new LiteralInt32(7);
        a.setLoc(new SourceLocation(3, 4));
        a.setComment("seven");
        assertThat(a).isEqualTo(new LiteralInt32(7));
        assertThat(a).isNotEqualTo(new LiteralInt32(8));
    }

    @Test
    @Tag("unit")
    void testChildrenKnowTheirParent() {
        LiteralInt32 lhs = new LiteralInt32(1);
        BinaryOp sum = new BinaryOp("+", lhs, new LiteralInt32(2));
        assertThat(lhs.getParent()).containsSame(sum);
        assertThat(sum.getParent()).isEmpty();
        assertThat(sum.getChildren()).containsExactly(lhs, sum.rhs());
    }

    @Test
    @Tag("unit")
    void testFullStructCarriesMetadataOnlyWhenSet() {
        LiteralInt32 plain = new LiteralInt32(5);
        LiteralInt32 annotated = new LiteralInt32(5);
        annotated.setLoc(new SourceLocation(1, 2));
        annotated.setComment("note");

        ObjectNode plainStruct = plain.getStruct(false);
        ObjectNode annotatedStruct = annotated.getStruct(false);

        assertThat(plainStruct.get("LiteralInt32[5]").has("loc")).isFalse();
        assertThat(annotatedStruct.get("LiteralInt32[5]").get("loc").get("line").asInt()).isEqualTo(1);
        assertThat(annotatedStruct.get("LiteralInt32[5]").get("comment").asText()).isEqualTo("note");
        assertThat(annotated.getStruct(StructMode.SEMANTIC).get("LiteralInt32[5]").has("comment")).isFalse();
    }

    /**
     * Two structurally identical siblings must still get distinct keys in the visualization form.
     */
    @Test
    @Tag("unit")
    void testSimplifiedKeysStayUniqueForIdenticalSiblings() {
        Block block = new Block();
        LiteralInt32 first = new LiteralInt32(1);
        LiteralInt32 second = new LiteralInt32(1);
        block.append(first);
        block.append(second);

        ObjectNode struct = block.getStruct(true);
        String blockKey = "Block[entry]#" + block.id();
        List<String> childKeys = new ArrayList<>();
        struct.get(blockKey).get("nodes").forEach(n -> n.fieldNames().forEachRemaining(childKeys::add));

        assertThat(childKeys).containsExactly("LiteralInt32[1]#" + first.id(), "LiteralInt32[1]#" + second.id());
    }

    @Test
    @Tag("unit")
    void testBlockIndexing() {
        Block block = new Block("body");
        assertThat(block.append(new Variable("x", DataTypes.int32()))).isEqualTo(1);
        block.insert(0, new LiteralInt32(3));

        assertThat(block.get(0)).isInstanceOf(LiteralInt32.class);
        assertThat(block.size()).isEqualTo(2);
        assertThatThrownBy(() -> block.get(2))
                .isInstanceOfSatisfying(NodeIndexException.class, e -> {
                    assertThat(e.index()).isEqualTo(2);
                    assertThat(e.size()).isEqualTo(2);
                    assertThat(e.kind()).isEqualTo(ErrorKind.INDEX);
                });
        assertThatThrownBy(() -> block.get(-1)).isInstanceOf(NodeIndexException.class);
        assertThatThrownBy(() -> block.insert(5, new LiteralInt32(1))).isInstanceOf(NodeIndexException.class);
    }

    @Test
    @Tag("unit")
    void testSubscriptAndCast() {
        Variable items = new Variable("items", DataTypes.list(DataTypes.float32()));
        SubscriptExpr index = SubscriptExpr.index(items, new LiteralInt32(0));
        assertThat(index.type()).isEqualTo(DataTypes.float32());
        assertThat(index).hasToString("SubscriptExpr");

        SubscriptExpr slice = SubscriptExpr.slice(new Variable("s", DataTypes.utf8String()), null, new LiteralInt32(2), null);
        assertThat(slice.isSlice()).isTrue();
        assertThat(slice).hasToString("SubscriptExpr[slice]");

        TypeCastExpr cast = new TypeCastExpr(new LiteralInt32(1), DataTypes.float64());
        assertThat(cast.type()).isEqualTo(DataTypes.float64());
        assertThat(cast).hasToString("TypeCastExpr[Float64]");
    }
}
