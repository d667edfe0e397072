package org.astx.ast.visitor;

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
 * Double-dispatch contract of code generators and other per-variant tree consumers.
 * <p>
 * Every concrete node variant has exactly one method here and calls it from
 * {@link org.astx.ast.AstNode#accept(AstVisitor)}. Adding a variant adds a method, so
 * implementations that do not extend {@link AbstractAstVisitor} fail to compile until
 * they handle it. Literal and operator families whose members only differ in width
 * share one method, for example {@link #visitLiteralInteger(LiteralInteger)}.
 *
 * @param <R> The result produced per node, for example emitted source text.
 */
public interface AstVisitor<R> {

    // region Containers and generic expressions
    R visitBlock(Block node);
    R visitIdentifier(Identifier node);
    R visitParenthesizedExpr(ParenthesizedExpr node);
    R visitSubscriptExpr(SubscriptExpr node);
    R visitTypeCastExpr(TypeCastExpr node);
    // endregion

    // region Data types
    R visitAnyType(AnyType node);
    R visitBooleanType(BooleanType node);
    R visitCharType(CharType node);
    R visitComplexType(ComplexType node);
    R visitFloatType(FloatType node);
    R visitFunctionType(FunctionType node);
    R visitIntegerType(IntegerType node);
    R visitListType(ListType node);
    R visitMapType(MapType node);
    R visitNamedType(NamedType node);
    R visitNoneType(NoneType node);
    R visitSetType(SetType node);
    R visitStringType(StringType node);
    R visitTemporalType(TemporalType node);
    R visitTupleType(TupleType node);
    R visitUndefinedType(UndefinedType node);
    // endregion

    // region Literals
    R visitLiteralBoolean(LiteralBoolean node);
    R visitLiteralComplex(LiteralComplex node);
    R visitLiteralDate(LiteralDate node);
    R visitLiteralDateTime(LiteralDateTime node);
    R visitLiteralDict(LiteralDict node);
    R visitLiteralFloat(LiteralFloat node);
    R visitLiteralInteger(LiteralInteger node);
    R visitLiteralList(LiteralList node);
    R visitLiteralNone(LiteralNone node);
    R visitLiteralSet(LiteralSet node);
    R visitLiteralTime(LiteralTime node);
    R visitLiteralTimestamp(LiteralTimestamp node);
    R visitLiteralTuple(LiteralTuple node);
    R visitLiteralUTF8Char(LiteralUTF8Char node);
    R visitLiteralUTF8String(LiteralUTF8String node);
    R visitFormattedValue(FormattedValue node);
    R visitJoinedStr(JoinedStr node);
    // endregion

    // region Operators
    R visitAugAssign(AugAssign node);
    R visitBinaryOp(BinaryOp node);
    R visitBoolBinaryOp(BoolBinaryOp node);
    R visitCompareOp(CompareOp node);
    R visitStarred(Starred node);
    R visitUnaryOp(UnaryOp node);
    R visitWalrusOp(WalrusOp node);
    // endregion

    // region Variables
    R visitInlineVariableDeclaration(InlineVariableDeclaration node);
    R visitVariable(Variable node);
    R visitVariableAssignment(VariableAssignment node);
    R visitDeleteStmt(DeleteStmt node);
    R visitVariableDeclaration(VariableDeclaration node);
    // endregion

    // region Control flow
    R visitAsyncForRangeLoopExpr(AsyncForRangeLoopExpr node);
    R visitAsyncForRangeLoopStmt(AsyncForRangeLoopStmt node);
    R visitBreakStmt(BreakStmt node);
    R visitCaseStmt(CaseStmt node);
    R visitCatchHandlerStmt(CatchHandlerStmt node);
    R visitContinueStmt(ContinueStmt node);
    R visitDoWhileExpr(DoWhileExpr node);
    R visitDoWhileStmt(DoWhileStmt node);
    R visitExceptionHandlerStmt(ExceptionHandlerStmt node);
    R visitFinallyHandlerStmt(FinallyHandlerStmt node);
    R visitForCountLoopExpr(ForCountLoopExpr node);
    R visitForCountLoopStmt(ForCountLoopStmt node);
    R visitForRangeLoopExpr(ForRangeLoopExpr node);
    R visitForRangeLoopStmt(ForRangeLoopStmt node);
    R visitGotoStmt(GotoStmt node);
    R visitIfExpr(IfExpr node);
    R visitIfStmt(IfStmt node);
    R visitSwitchStmt(SwitchStmt node);
    R visitThrowStmt(ThrowStmt node);
    R visitWhileExpr(WhileExpr node);
    R visitWhileStmt(WhileStmt node);
    R visitWithItem(WithItem node);
    R visitWithStmt(WithStmt node);
    // endregion

    // region Comprehensions
    R visitComprehensionClause(ComprehensionClause node);
    R visitDictComprehension(DictComprehension node);
    R visitGeneratorExpr(GeneratorExpr node);
    R visitListComprehension(ListComprehension node);
    R visitSetComprehension(SetComprehension node);
    // endregion

    // region Callables
    R visitArgument(Argument node);
    R visitArguments(Arguments node);
    R visitAwaitExpr(AwaitExpr node);
    R visitFunctionAsyncDef(FunctionAsyncDef node);
    R visitFunctionCall(FunctionCall node);
    R visitFunctionDef(FunctionDef node);
    R visitFunctionPrototype(FunctionPrototype node);
    R visitFunctionReturn(FunctionReturn node);
    R visitLambdaExpr(LambdaExpr node);
    R visitYieldExpr(YieldExpr node);
    R visitYieldFromExpr(YieldFromExpr node);
    // endregion

    // region Classes
    R visitClassDeclStmt(ClassDeclStmt node);
    R visitClassDefStmt(ClassDefStmt node);
    R visitEnumDeclStmt(EnumDeclStmt node);
    R visitStructDeclStmt(StructDeclStmt node);
    R visitStructDefStmt(StructDefStmt node);
    // endregion

    // region Packages
    R visitAliasExpr(AliasExpr node);
    R visitImportExpr(ImportExpr node);
    R visitImportFromExpr(ImportFromExpr node);
    R visitImportFromStmt(ImportFromStmt node);
    R visitImportStmt(ImportStmt node);
    R visitModule(Module node);
    R visitPackage(Package node);
    R visitProgram(Program node);
    R visitTarget(Target node);
    // endregion
}
