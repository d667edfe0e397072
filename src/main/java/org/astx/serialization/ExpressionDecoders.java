package org.astx.serialization;

import org.astx.ast.Block;
import org.astx.ast.Expr;
import org.astx.ast.Identifier;
import org.astx.ast.ParenthesizedExpr;
import org.astx.ast.SubscriptExpr;
import org.astx.ast.TypeCastExpr;
import org.astx.ast.callables.Arguments;
import org.astx.ast.callables.AwaitExpr;
import org.astx.ast.callables.FunctionCall;
import org.astx.ast.callables.FunctionPrototype;
import org.astx.ast.callables.LambdaExpr;
import org.astx.ast.callables.YieldExpr;
import org.astx.ast.callables.YieldFromExpr;
import org.astx.ast.comprehensions.ComprehensionClause;
import org.astx.ast.comprehensions.DictComprehension;
import org.astx.ast.comprehensions.GeneratorExpr;
import org.astx.ast.comprehensions.ListComprehension;
import org.astx.ast.comprehensions.SetComprehension;
import org.astx.ast.flows.DoWhileExpr;
import org.astx.ast.flows.ForCountLoopExpr;
import org.astx.ast.flows.AsyncForRangeLoopExpr;
import org.astx.ast.flows.ForRangeLoopExpr;
import org.astx.ast.flows.IfExpr;
import org.astx.ast.flows.WhileExpr;
import org.astx.ast.modifiers.MutabilityKind;
import org.astx.ast.modifiers.ScopeKind;
import org.astx.ast.modifiers.VisibilityKind;
import org.astx.ast.operators.AugAssign;
import org.astx.ast.operators.BinaryOp;
import org.astx.ast.operators.BoolBinaryOp;
import org.astx.ast.operators.CompareOp;
import org.astx.ast.operators.Starred;
import org.astx.ast.operators.UnaryOp;
import org.astx.ast.operators.WalrusOp;
import org.astx.ast.packages.AliasExpr;
import org.astx.ast.packages.ImportExpr;
import org.astx.ast.packages.ImportFromExpr;
import org.astx.ast.variables.InlineVariableDeclaration;
import org.astx.ast.variables.Variable;

/**
 * Decoders for nodes that produce a value.
 */
final class ExpressionDecoders {

    private ExpressionDecoders() {}

    static void install(NodeDecoderRegistry reg) {
        // generic
        reg.register("Identifier", s -> new Identifier(s.string("value")));
        reg.register("ParenthesizedExpr", s -> new ParenthesizedExpr(s.child("value", Expr.class)));
        reg.register("TypeCastExpr", s -> new TypeCastExpr(s.child("expr", Expr.class), s.type("target-type")));
        reg.register("SubscriptExpr", s -> "slice".equals(s.keyArgument())
                ? SubscriptExpr.slice(s.child("value", Expr.class), s.optionalChild("lower", Expr.class),
                        s.optionalChild("upper", Expr.class), s.optionalChild("step", Expr.class))
                : SubscriptExpr.index(s.child("value", Expr.class), s.child("index", Expr.class)));

        // operators
        reg.register("UnaryOp", s -> new UnaryOp(s.string("op-code"), s.child("operand", Expr.class)));
        reg.register("BinaryOp", s -> new BinaryOp(s.string("op-code"), lhs(s), rhs(s)));
        reg.register("CompareOp", s -> new CompareOp(s.string("op-code"), lhs(s), rhs(s)));
        reg.register("BoolBinaryOp", s -> new BoolBinaryOp(s.string("op-code"), lhs(s), rhs(s)));
        reg.register("AugAssign", s -> new AugAssign(
                s.string("op-code"), s.child("target", Expr.class), s.child("value", Expr.class)));
        reg.register("WalrusOp", s -> new WalrusOp(lhs(s), rhs(s)));
        reg.register("Starred", s -> new Starred(s.child("value", Expr.class)));

        // variables
        reg.register("Variable", s -> new Variable(s.string("name"), s.type("type")));
        reg.register("InlineVariableDeclaration", ExpressionDecoders::inlineDeclaration);

        // comprehensions
        reg.register("ComprehensionClause", s -> new ComprehensionClause(
                s.child("target", Expr.class), s.child("iterable", Expr.class),
                s.children("conditions", Expr.class), s.bool("async")));
        reg.register("ListComprehension", s -> new ListComprehension(
                s.child("element", Expr.class), s.children("clauses", ComprehensionClause.class)));
        reg.register("SetComprehension", s -> new SetComprehension(
                s.child("element", Expr.class), s.children("clauses", ComprehensionClause.class)));
        reg.register("GeneratorExpr", s -> new GeneratorExpr(
                s.child("element", Expr.class), s.children("clauses", ComprehensionClause.class)));
        reg.register("DictComprehension", s -> new DictComprehension(
                s.child("key", Expr.class), s.child("value", Expr.class),
                s.children("clauses", ComprehensionClause.class)));

        // callables
        reg.register("FunctionCall", s -> new FunctionCall(
                s.child("callee", FunctionPrototype.class), s.children("args", Expr.class)));
        reg.register("LambdaExpr", s -> new LambdaExpr(s.child("params", Arguments.class), s.child("body", Expr.class)));
        reg.register("AwaitExpr", s -> new AwaitExpr(s.child("value", Expr.class)));
        reg.register("YieldExpr", s -> new YieldExpr(s.optionalChild("value", Expr.class)));
        reg.register("YieldFromExpr", s -> new YieldFromExpr(s.child("value", Expr.class)));

        // flows
        reg.register("IfExpr", s -> new IfExpr(s.child("condition", Expr.class),
                s.child("then-block", Block.class), s.optionalChild("else-block", Block.class)));
        reg.register("ForRangeLoopExpr", s -> new ForRangeLoopExpr(
                s.child("variable", InlineVariableDeclaration.class), s.child("start", Expr.class),
                s.child("end", Expr.class), s.optionalChild("step", Expr.class), s.child("body", Block.class)));
        reg.register("AsyncForRangeLoopExpr", s -> new AsyncForRangeLoopExpr(
                s.child("variable", InlineVariableDeclaration.class), s.child("start", Expr.class),
                s.child("end", Expr.class), s.optionalChild("step", Expr.class), s.child("body", Block.class)));
        reg.register("ForCountLoopExpr", s -> new ForCountLoopExpr(
                s.child("initializer", InlineVariableDeclaration.class), s.child("condition", Expr.class),
                s.child("update", Expr.class), s.child("body", Block.class)));
        reg.register("WhileExpr", s -> new WhileExpr(s.child("condition", Expr.class), s.child("body", Block.class)));
        reg.register("DoWhileExpr", s -> new DoWhileExpr(s.child("body", Block.class), s.child("condition", Expr.class)));

        // packages
        reg.register("AliasExpr", s -> new AliasExpr(s.string("name"), s.optionalString("asname")));
        reg.register("ImportExpr", s -> new ImportExpr(s.children("names", AliasExpr.class)));
        reg.register("ImportFromExpr", s -> new ImportFromExpr(
                s.string("module"), s.children("names", AliasExpr.class), s.intValue("level")));
    }

    private static Expr lhs(StructReader s) {
        return s.child("lhs", Expr.class);
    }

    private static Expr rhs(StructReader s) {
        return s.child("rhs", Expr.class);
    }

    private static InlineVariableDeclaration inlineDeclaration(StructReader s) {
        return new InlineVariableDeclaration(s.string("name"), s.type("type"),
                s.label("mutability", MutabilityKind::fromLabel),
                s.label("scope", ScopeKind::fromLabel),
                s.label("visibility", VisibilityKind::fromLabel),
                s.optionalChild("value", Expr.class));
    }
}
