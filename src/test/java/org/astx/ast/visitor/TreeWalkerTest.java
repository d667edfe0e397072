package org.astx.ast.visitor;

import org.astx.ast.AstNode;
import org.astx.ast.Block;
import org.astx.ast.flows.IfStmt;
import org.astx.ast.literals.LiteralBoolean;
import org.astx.ast.literals.LiteralInt32;
import org.astx.ast.variables.VariableAssignment;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;

public class TreeWalkerTest {

    @Test
    @Tag("unit")
    void testEnterAndExitOrder() {
        // Arrange
        Block then = new Block();
        then.append(new VariableAssignment("x", new LiteralInt32(1)));
        IfStmt stmt = new IfStmt(new LiteralBoolean(true), then);
        List<String> events = new ArrayList<>();
        Map<Class<? extends AstNode>, Consumer<AstNode>> enter = Map.of(
                IfStmt.class, n -> events.add("enter if"),
                Block.class, n -> events.add("enter block"),
                LiteralInt32.class, n -> events.add("literal"));
        Map<Class<? extends AstNode>, Consumer<AstNode>> exit = Map.of(
                IfStmt.class, n -> events.add("exit if"),
                Block.class, n -> events.add("exit block"));

        // Act
        new TreeWalker(enter, exit).walk(stmt);

        // Assert
        assertThat(events).containsExactly("enter if", "enter block", "literal", "exit block", "exit if");
    }

    @Test
    @Tag("unit")
    void testHandlersMatchExactClass() {
        List<AstNode> seen = new ArrayList<>();
        Block block = new Block();
        block.append(new Block("inner"));

        new TreeWalker(Map.of(Block.class, seen::add)).walk(List.of(block, new LiteralInt32(5)));
        new TreeWalker(Map.of()).walk((AstNode) null);

        assertThat(seen).hasSize(2);
        assertThat(seen.get(1)).isEqualTo(new Block("inner"));
    }
}
