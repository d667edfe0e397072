package org.astx.ast.visitor;

import org.astx.api.UnhandledNodeException;
import org.astx.ast.AstNode;
import org.astx.ast.Block;
import org.astx.ast.Identifier;
import org.astx.ast.ParenthesizedExpr;
import org.astx.ast.SubscriptExpr;
import org.astx.ast.TypeCastExpr;
import org.astx.ast.callables.Argument;
import org.astx.ast.callables.Arguments;
import org.astx.ast.callables.AwaitExpr;
import org.astx.ast.callables.FunctionAsyncDef;
import org.astx.ast.callables.FunctionCall;
import org.astx.ast.callables.FunctionDef;
import org.astx.ast.callables.FunctionPrototype;
import org.astx.ast.callables.FunctionReturn;
import org.astx.ast.callables.LambdaExpr;
import org.astx.ast.callables.YieldExpr;
import org.astx.ast.callables.YieldFromExpr;
import org.astx.ast.classes.ClassDeclStmt;
import org.astx.ast.classes.ClassDefStmt;
import org.astx.ast.classes.EnumDeclStmt;
import org.astx.ast.classes.StructDeclStmt;
import org.astx.ast.classes.StructDefStmt;
import org.astx.ast.comprehensions.ComprehensionClause;
import org.astx.ast.comprehensions.DictComprehension;
import org.astx.ast.comprehensions.GeneratorExpr;
import org.astx.ast.comprehensions.ListComprehension;
import org.astx.ast.comprehensions.SetComprehension;
import org.astx.ast.flows.BreakStmt;
import org.astx.ast.flows.CaseStmt;
import org.astx.ast.flows.CatchHandlerStmt;
import org.astx.ast.flows.ContinueStmt;
import org.astx.ast.flows.DoWhileExpr;
import org.astx.ast.flows.DoWhileStmt;
import org.astx.ast.flows.ExceptionHandlerStmt;
import org.astx.ast.flows.FinallyHandlerStmt;
import org.astx.ast.flows.ForCountLoopExpr;
import org.astx.ast.flows.ForCountLoopStmt;
import org.astx.ast.flows.AsyncForRangeLoopExpr;
import org.astx.ast.flows.AsyncForRangeLoopStmt;
import org.astx.ast.flows.ForRangeLoopExpr;
import org.astx.ast.flows.ForRangeLoopStmt;
import org.astx.ast.flows.GotoStmt;
import org.astx.ast.flows.IfExpr;
import org.astx.ast.flows.IfStmt;
import org.astx.ast.flows.SwitchStmt;
import org.astx.ast.flows.ThrowStmt;
import org.astx.ast.flows.WhileExpr;
import org.astx.ast.flows.WhileStmt;
import org.astx.ast.flows.WithItem;
import org.astx.ast.flows.WithStmt;
import org.astx.ast.literals.LiteralBoolean;
import org.astx.ast.literals.LiteralComplex;
import org.astx.ast.literals.LiteralDate;
import org.astx.ast.literals.LiteralDateTime;
import org.astx.ast.literals.LiteralDict;
import org.astx.ast.literals.LiteralFloat;
import org.astx.ast.literals.LiteralInteger;
import org.astx.ast.literals.LiteralList;
import org.astx.ast.literals.LiteralNone;
import org.astx.ast.literals.LiteralSet;
import org.astx.ast.literals.LiteralTime;
import org.astx.ast.literals.LiteralTimestamp;
import org.astx.ast.literals.LiteralTuple;
import org.astx.ast.literals.FormattedValue;
import org.astx.ast.literals.JoinedStr;
import org.astx.ast.literals.LiteralUTF8Char;
import org.astx.ast.literals.LiteralUTF8String;
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
import org.astx.ast.packages.ImportFromStmt;
import org.astx.ast.packages.ImportStmt;
import org.astx.ast.packages.Module;
import org.astx.ast.packages.Package;
import org.astx.ast.packages.Program;
import org.astx.ast.packages.Target;
import org.astx.ast.types.AnyType;
import org.astx.ast.types.BooleanType;
import org.astx.ast.types.CharType;
import org.astx.ast.types.ComplexType;
import org.astx.ast.types.FloatType;
import org.astx.ast.types.FunctionType;
import org.astx.ast.types.IntegerType;
import org.astx.ast.types.ListType;
import org.astx.ast.types.MapType;
import org.astx.ast.types.NamedType;
import org.astx.ast.types.NoneType;
import org.astx.ast.types.SetType;
import org.astx.ast.types.StringType;
import org.astx.ast.types.TemporalType;
import org.astx.ast.types.TupleType;
import org.astx.ast.types.UndefinedType;
import org.astx.ast.variables.InlineVariableDeclaration;
import org.astx.ast.variables.Variable;
import org.astx.ast.variables.DeleteStmt;
import org.astx.ast.variables.VariableAssignment;
import org.astx.ast.variables.VariableDeclaration;

/**
 * Base for generators that implement a subset of the variants. Every method it does not
 * override fails with {@link UnhandledNodeException} naming the node, so coverage gaps
 * surface on first use instead of producing partial output.
 *
 * @param <R> The result produced per node.
 */
public abstract class AbstractAstVisitor<R> implements AstVisitor<R> {

    /**
     * Entry point: dispatches on the runtime variant of {@code node}.
     */
    public R visit(AstNode node) {
        return node.accept(this);
    }

    /**
     * Called for every variant the subclass does not handle.
     */
    protected R unhandled(AstNode node) {
        throw new UnhandledNodeException(String.format(
                "%s does not handle %s (%s)", getClass().getSimpleName(), node, node.kind()));
    }

    @Override
    public R visitBlock(Block node) {
        return unhandled(node);
    }

    @Override
    public R visitIdentifier(Identifier node) {
        return unhandled(node);
    }

    @Override
    public R visitParenthesizedExpr(ParenthesizedExpr node) {
        return unhandled(node);
    }

    @Override
    public R visitSubscriptExpr(SubscriptExpr node) {
        return unhandled(node);
    }

    @Override
    public R visitTypeCastExpr(TypeCastExpr node) {
        return unhandled(node);
    }

    @Override
    public R visitAnyType(AnyType node) {
        return unhandled(node);
    }

    @Override
    public R visitBooleanType(BooleanType node) {
        return unhandled(node);
    }

    @Override
    public R visitCharType(CharType node) {
        return unhandled(node);
    }

    @Override
    public R visitComplexType(ComplexType node) {
        return unhandled(node);
    }

    @Override
    public R visitFloatType(FloatType node) {
        return unhandled(node);
    }

    @Override
    public R visitFunctionType(FunctionType node) {
        return unhandled(node);
    }

    @Override
    public R visitIntegerType(IntegerType node) {
        return unhandled(node);
    }

    @Override
    public R visitListType(ListType node) {
        return unhandled(node);
    }

    @Override
    public R visitMapType(MapType node) {
        return unhandled(node);
    }

    @Override
    public R visitNamedType(NamedType node) {
        return unhandled(node);
    }

    @Override
    public R visitNoneType(NoneType node) {
        return unhandled(node);
    }

    @Override
    public R visitSetType(SetType node) {
        return unhandled(node);
    }

    @Override
    public R visitStringType(StringType node) {
        return unhandled(node);
    }

    @Override
    public R visitTemporalType(TemporalType node) {
        return unhandled(node);
    }

    @Override
    public R visitTupleType(TupleType node) {
        return unhandled(node);
    }

    @Override
    public R visitUndefinedType(UndefinedType node) {
        return unhandled(node);
    }

    @Override
    public R visitLiteralBoolean(LiteralBoolean node) {
        return unhandled(node);
    }

    @Override
    public R visitLiteralComplex(LiteralComplex node) {
        return unhandled(node);
    }

    @Override
    public R visitLiteralDate(LiteralDate node) {
        return unhandled(node);
    }

    @Override
    public R visitLiteralDateTime(LiteralDateTime node) {
        return unhandled(node);
    }

    @Override
    public R visitLiteralDict(LiteralDict node) {
        return unhandled(node);
    }

    @Override
    public R visitLiteralFloat(LiteralFloat node) {
        return unhandled(node);
    }

    @Override
    public R visitLiteralInteger(LiteralInteger node) {
        return unhandled(node);
    }

    @Override
    public R visitLiteralList(LiteralList node) {
        return unhandled(node);
    }

    @Override
    public R visitLiteralNone(LiteralNone node) {
        return unhandled(node);
    }

    @Override
    public R visitLiteralSet(LiteralSet node) {
        return unhandled(node);
    }

    @Override
    public R visitLiteralTime(LiteralTime node) {
        return unhandled(node);
    }

    @Override
    public R visitLiteralTimestamp(LiteralTimestamp node) {
        return unhandled(node);
    }

    @Override
    public R visitLiteralTuple(LiteralTuple node) {
        return unhandled(node);
    }

    @Override
    public R visitLiteralUTF8Char(LiteralUTF8Char node) {
        return unhandled(node);
    }

    @Override
    public R visitLiteralUTF8String(LiteralUTF8String node) {
        return unhandled(node);
    }

    @Override
    public R visitFormattedValue(FormattedValue node) {
        return unhandled(node);
    }

    @Override
    public R visitJoinedStr(JoinedStr node) {
        return unhandled(node);
    }

    @Override
    public R visitAugAssign(AugAssign node) {
        return unhandled(node);
    }

    @Override
    public R visitBinaryOp(BinaryOp node) {
        return unhandled(node);
    }

    @Override
    public R visitBoolBinaryOp(BoolBinaryOp node) {
        return unhandled(node);
    }

    @Override
    public R visitCompareOp(CompareOp node) {
        return unhandled(node);
    }

    @Override
    public R visitStarred(Starred node) {
        return unhandled(node);
    }

    @Override
    public R visitUnaryOp(UnaryOp node) {
        return unhandled(node);
    }

    @Override
    public R visitWalrusOp(WalrusOp node) {
        return unhandled(node);
    }

    @Override
    public R visitInlineVariableDeclaration(InlineVariableDeclaration node) {
        return unhandled(node);
    }

    @Override
    public R visitVariable(Variable node) {
        return unhandled(node);
    }

    @Override
    public R visitDeleteStmt(DeleteStmt node) {
        return unhandled(node);
    }

    @Override
    public R visitVariableAssignment(VariableAssignment node) {
        return unhandled(node);
    }

    @Override
    public R visitVariableDeclaration(VariableDeclaration node) {
        return unhandled(node);
    }

    @Override
    public R visitBreakStmt(BreakStmt node) {
        return unhandled(node);
    }

    @Override
    public R visitCaseStmt(CaseStmt node) {
        return unhandled(node);
    }

    @Override
    public R visitCatchHandlerStmt(CatchHandlerStmt node) {
        return unhandled(node);
    }

    @Override
    public R visitContinueStmt(ContinueStmt node) {
        return unhandled(node);
    }

    @Override
    public R visitDoWhileExpr(DoWhileExpr node) {
        return unhandled(node);
    }

    @Override
    public R visitDoWhileStmt(DoWhileStmt node) {
        return unhandled(node);
    }

    @Override
    public R visitExceptionHandlerStmt(ExceptionHandlerStmt node) {
        return unhandled(node);
    }

    @Override
    public R visitFinallyHandlerStmt(FinallyHandlerStmt node) {
        return unhandled(node);
    }

    @Override
    public R visitForCountLoopExpr(ForCountLoopExpr node) {
        return unhandled(node);
    }

    @Override
    public R visitForCountLoopStmt(ForCountLoopStmt node) {
        return unhandled(node);
    }

    @Override
    public R visitAsyncForRangeLoopExpr(AsyncForRangeLoopExpr node) {
        return unhandled(node);
    }

    @Override
    public R visitAsyncForRangeLoopStmt(AsyncForRangeLoopStmt node) {
        return unhandled(node);
    }

    @Override
    public R visitForRangeLoopExpr(ForRangeLoopExpr node) {
        return unhandled(node);
    }

    @Override
    public R visitForRangeLoopStmt(ForRangeLoopStmt node) {
        return unhandled(node);
    }

    @Override
    public R visitGotoStmt(GotoStmt node) {
        return unhandled(node);
    }

    @Override
    public R visitIfExpr(IfExpr node) {
        return unhandled(node);
    }

    @Override
    public R visitIfStmt(IfStmt node) {
        return unhandled(node);
    }

    @Override
    public R visitSwitchStmt(SwitchStmt node) {
        return unhandled(node);
    }

    @Override
    public R visitThrowStmt(ThrowStmt node) {
        return unhandled(node);
    }

    @Override
    public R visitWhileExpr(WhileExpr node) {
        return unhandled(node);
    }

    @Override
    public R visitWhileStmt(WhileStmt node) {
        return unhandled(node);
    }

    @Override
    public R visitWithItem(WithItem node) {
        return unhandled(node);
    }

    @Override
    public R visitWithStmt(WithStmt node) {
        return unhandled(node);
    }

    @Override
    public R visitComprehensionClause(ComprehensionClause node) {
        return unhandled(node);
    }

    @Override
    public R visitDictComprehension(DictComprehension node) {
        return unhandled(node);
    }

    @Override
    public R visitGeneratorExpr(GeneratorExpr node) {
        return unhandled(node);
    }

    @Override
    public R visitListComprehension(ListComprehension node) {
        return unhandled(node);
    }

    @Override
    public R visitSetComprehension(SetComprehension node) {
        return unhandled(node);
    }

    @Override
    public R visitArgument(Argument node) {
        return unhandled(node);
    }

    @Override
    public R visitArguments(Arguments node) {
        return unhandled(node);
    }

    @Override
    public R visitAwaitExpr(AwaitExpr node) {
        return unhandled(node);
    }

    @Override
    public R visitFunctionAsyncDef(FunctionAsyncDef node) {
        return unhandled(node);
    }

    @Override
    public R visitFunctionCall(FunctionCall node) {
        return unhandled(node);
    }

    @Override
    public R visitFunctionDef(FunctionDef node) {
        return unhandled(node);
    }

    @Override
    public R visitFunctionPrototype(FunctionPrototype node) {
        return unhandled(node);
    }

    @Override
    public R visitFunctionReturn(FunctionReturn node) {
        return unhandled(node);
    }

    @Override
    public R visitLambdaExpr(LambdaExpr node) {
        return unhandled(node);
    }

    @Override
    public R visitYieldExpr(YieldExpr node) {
        return unhandled(node);
    }

    @Override
    public R visitYieldFromExpr(YieldFromExpr node) {
        return unhandled(node);
    }

    @Override
    public R visitClassDeclStmt(ClassDeclStmt node) {
        return unhandled(node);
    }

    @Override
    public R visitClassDefStmt(ClassDefStmt node) {
        return unhandled(node);
    }

    @Override
    public R visitEnumDeclStmt(EnumDeclStmt node) {
        return unhandled(node);
    }

    @Override
    public R visitStructDeclStmt(StructDeclStmt node) {
        return unhandled(node);
    }

    @Override
    public R visitStructDefStmt(StructDefStmt node) {
        return unhandled(node);
    }

    @Override
    public R visitAliasExpr(AliasExpr node) {
        return unhandled(node);
    }

    @Override
    public R visitImportExpr(ImportExpr node) {
        return unhandled(node);
    }

    @Override
    public R visitImportFromExpr(ImportFromExpr node) {
        return unhandled(node);
    }

    @Override
    public R visitImportFromStmt(ImportFromStmt node) {
        return unhandled(node);
    }

    @Override
    public R visitImportStmt(ImportStmt node) {
        return unhandled(node);
    }

    @Override
    public R visitModule(Module node) {
        return unhandled(node);
    }

    @Override
    public R visitPackage(Package node) {
        return unhandled(node);
    }

    @Override
    public R visitProgram(Program node) {
        return unhandled(node);
    }

    @Override
    public R visitTarget(Target node) {
        return unhandled(node);
    }
}
