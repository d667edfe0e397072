package org.astx.ast.visitor;

import org.astx.api.ErrorKind;
import org.astx.api.UnhandledNodeException;
import org.astx.ast.Block;
import org.astx.ast.Identifier;
import org.astx.ast.flows.GotoStmt;
import org.astx.ast.literals.LiteralBoolean;
import org.astx.ast.literals.LiteralInt32;
import org.astx.ast.literals.LiteralInt64;
import org.astx.ast.literals.LiteralInteger;
import org.astx.ast.operators.BinaryOp;
import org.astx.ast.types.DataTypes;
import org.astx.ast.types.IntegerType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

/**
 * Contains unit tests for double dispatch through {@link AstVisitor} and the
 * fail-fast default of {@link AbstractAstVisitor}.
 */
public class AstVisitorTest {

    @Test
    @Tag("unit")
    @SuppressWarnings("unchecked")
    void testNodesDispatchToTheirVariantMethod() {
        AstVisitor<String> visitor = mock(AstVisitor.class);
        LiteralInt32 literal = new LiteralInt32(3);
        BinaryOp sum = new BinaryOp("+", new LiteralInt32(1), new LiteralInt32(2));
        IntegerType type = DataTypes.int16();
        when(visitor.visitBinaryOp(sum)).thenReturn("sum");

        assertThat(sum.accept(visitor)).isEqualTo("sum");
        literal.accept(visitor);
        type.accept(visitor);

        verify(visitor).visitBinaryOp(sum);
        verify(visitor).visitLiteralInteger(literal);
        verify(visitor).visitIntegerType(type);
        verifyNoMoreInteractions(visitor);
    }

    @Test
    @Tag("unit")
    void testUnhandledVariantFails() {
        AbstractAstVisitor<String> visitor = new AbstractAstVisitor<>() {
            @Override
            public String visitLiteralInteger(LiteralInteger node) {
                return node.value().toString();
            }
        };

        assertThat(visitor.visit(new LiteralInt64(42))).isEqualTo("42");
        assertThatThrownBy(() -> visitor.visit(new LiteralBoolean(true)))
                .isInstanceOf(UnhandledNodeException.class)
                .hasMessageContaining("LiteralBoolean")
                .satisfies(e -> assertThat(((UnhandledNodeException) e).kind()).isEqualTo(ErrorKind.NOT_IMPLEMENTED));
        assertThatThrownBy(() -> visitor.visit(new GotoStmt(new Identifier("end"))))
                .isInstanceOf(UnhandledNodeException.class);
        assertThatThrownBy(() -> visitor.visit(new Block()))
                .isInstanceOf(UnhandledNodeException.class);
    }
}
