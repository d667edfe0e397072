package org.astx.transpiler.python;

import org.astx.api.MalformedNodeException;
import org.astx.ast.AstNode;
import org.astx.ast.Block;
import org.astx.ast.Expr;
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
import org.astx.ast.comprehensions.Comprehension;
import org.astx.ast.comprehensions.ComprehensionClause;
import org.astx.ast.comprehensions.DictComprehension;
import org.astx.ast.comprehensions.GeneratorExpr;
import org.astx.ast.comprehensions.ListComprehension;
import org.astx.ast.comprehensions.SetComprehension;
import org.astx.ast.flows.AsyncForRangeLoopExpr;
import org.astx.ast.flows.AsyncForRangeLoopStmt;
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
import org.astx.ast.flows.ForRangeLoopExpr;
import org.astx.ast.flows.ForRangeLoopStmt;
import org.astx.ast.flows.IfExpr;
import org.astx.ast.flows.IfStmt;
import org.astx.ast.flows.SwitchStmt;
import org.astx.ast.flows.ThrowStmt;
import org.astx.ast.flows.WhileExpr;
import org.astx.ast.flows.WhileStmt;
import org.astx.ast.flows.WithItem;
import org.astx.ast.flows.WithStmt;
import org.astx.ast.literals.FormattedValue;
import org.astx.ast.literals.JoinedStr;
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
import org.astx.ast.variables.DeleteStmt;
import org.astx.ast.variables.InlineVariableDeclaration;
import org.astx.ast.variables.Variable;
import org.astx.ast.variables.VariableAssignment;
import org.astx.ast.variables.VariableDeclaration;
import org.astx.ast.visitor.AbstractAstVisitor;
import org.astx.config.AstxConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a tree as Python source text.
 * <p>
 * Statements come out one per line without leading indentation; nested blocks are
 * indented by the configured indent and an empty block becomes {@code pass}.
 * Operators are fully parenthesized, so the output never depends on Python precedence.
 * {@code GotoStmt}, {@code DoWhileExpr} and {@code ForCountLoopExpr} have no Python form and stay unhandled.
 */
public class PythonTranspiler extends AbstractAstVisitor<String> {

    private static final Logger LOG = LoggerFactory.getLogger(PythonTranspiler.class);

    private static final String DO_WHILE_FLAG = "_do_first";

    private final String indent;

    public PythonTranspiler() {
        this(AstxConfig.defaults());
    }

    public PythonTranspiler(AstxConfig config) {
        this.indent = config.transpilerIndent();
    }

    /**
     * Entry point: renders {@code root} and everything below it.
     */
    public String transpile(AstNode root) {
        LOG.debug("Transpiling {} to Python", root);
        return visit(root);
    }

    // region Containers and generic expressions

    @Override
    public String visitBlock(Block node) {
        return lines(node.nodes());
    }

    @Override
    public String visitIdentifier(Identifier node) {
        return node.value();
    }

    @Override
    public String visitParenthesizedExpr(ParenthesizedExpr node) {
        return "(" + visit(node.value()) + ")";
    }

    @Override
    public String visitSubscriptExpr(SubscriptExpr node) {
        if (!node.isSlice()) {
            return visit(node.value()) + "[" + visit(node.indexExpr()) + "]";
        }
        StringBuilder slice = new StringBuilder(visit(node.value())).append('[');
        slice.append(optional(node.lower())).append(':').append(optional(node.upper()));
        if (node.step() != null) {
            slice.append(':').append(visit(node.step()));
        }
        return slice.append(']').toString();
    }

    @Override
    public String visitTypeCastExpr(TypeCastExpr node) {
        return "cast(" + visit(node.targetType()) + ", " + visit(node.expr()) + ")";
    }

    // endregion

    // region Data types

    @Override
    public String visitAnyType(AnyType node) {
        return "Any";
    }

    @Override
    public String visitBooleanType(BooleanType node) {
        return "bool";
    }

    @Override
    public String visitCharType(CharType node) {
        return "str";
    }

    @Override
    public String visitComplexType(ComplexType node) {
        return "complex";
    }

    @Override
    public String visitFloatType(FloatType node) {
        return "float";
    }

    @Override
    public String visitFunctionType(FunctionType node) {
        return "Callable[[" + joined(node.parameterTypes()) + "], " + visit(node.returnType()) + "]";
    }

    @Override
    public String visitIntegerType(IntegerType node) {
        return "int";
    }

    @Override
    public String visitListType(ListType node) {
        return "list[" + visit(node.elementType()) + "]";
    }

    @Override
    public String visitMapType(MapType node) {
        return "dict[" + visit(node.keyType()) + ", " + visit(node.valueType()) + "]";
    }

    @Override
    public String visitNamedType(NamedType node) {
        return node.name();
    }

    @Override
    public String visitNoneType(NoneType node) {
        return "None";
    }

    @Override
    public String visitSetType(SetType node) {
        return "set[" + visit(node.elementType()) + "]";
    }

    @Override
    public String visitStringType(StringType node) {
        return "str";
    }

    @Override
    public String visitTemporalType(TemporalType node) {
        return switch (node.temporalKind()) {
            case DATE -> "date";
            case TIME -> "time";
            case DATE_TIME, TIMESTAMP -> "datetime";
        };
    }

    @Override
    public String visitTupleType(TupleType node) {
        return "tuple[" + joined(node.elementTypes()) + "]";
    }

    @Override
    public String visitUndefinedType(UndefinedType node) {
        return "Any";
    }

    // endregion

    // region Literals

    @Override
    public String visitLiteralBoolean(LiteralBoolean node) {
        return node.value() ? "True" : "False";
    }

    @Override
    public String visitLiteralComplex(LiteralComplex node) {
        return "complex(" + number(node.real()) + ", " + number(node.imag()) + ")";
    }

    @Override
    public String visitLiteralDate(LiteralDate node) {
        return "date.fromisoformat(" + quote(node.value().toString()) + ")";
    }

    @Override
    public String visitLiteralDateTime(LiteralDateTime node) {
        return "datetime.fromisoformat(" + quote(node.value().toString()) + ")";
    }

    @Override
    public String visitLiteralDict(LiteralDict node) {
        List<String> items = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            items.add(visit(node.keys().get(i)) + ": " + visit(node.values().get(i)));
        }
        return "{" + String.join(", ", items) + "}";
    }

    @Override
    public String visitLiteralFloat(LiteralFloat node) {
        return number(node.value());
    }

    @Override
    public String visitLiteralInteger(LiteralInteger node) {
        return node.value().toString();
    }

    @Override
    public String visitLiteralList(LiteralList node) {
        return "[" + joined(node.elements()) + "]";
    }

    @Override
    public String visitLiteralNone(LiteralNone node) {
        return "None";
    }

    @Override
    public String visitLiteralSet(LiteralSet node) {
        return node.elements().isEmpty() ? "set()" : "{" + joined(node.elements()) + "}";
    }

    @Override
    public String visitLiteralTime(LiteralTime node) {
        return "time.fromisoformat(" + quote(node.value().toString()) + ")";
    }

    @Override
    public String visitLiteralTimestamp(LiteralTimestamp node) {
        return "datetime.fromisoformat(" + quote(node.value().toString()) + ")";
    }

    @Override
    public String visitLiteralTuple(LiteralTuple node) {
        List<Expr> elements = node.elements();
        return elements.size() == 1 ? "(" + visit(elements.get(0)) + ",)" : "(" + joined(elements) + ")";
    }

    @Override
    public String visitLiteralUTF8Char(LiteralUTF8Char node) {
        return quote(node.value());
    }

    @Override
    public String visitLiteralUTF8String(LiteralUTF8String node) {
        return quote(node.value());
    }

    @Override
    public String visitJoinedStr(JoinedStr node) {
        return formattedString(node.values());
    }

    /**
     * A lone field is written as a one-field f-string.
     */
    @Override
    public String visitFormattedValue(FormattedValue node) {
        return formattedString(List.of(node));
    }

    // endregion

    // region Operators

    @Override
    public String visitAugAssign(AugAssign node) {
        return visit(node.target()) + " " + node.opCode() + " " + visit(node.value());
    }

    @Override
    public String visitBinaryOp(BinaryOp node) {
        return binary(node.opCode(), visit(node.lhs()), visit(node.rhs()));
    }

    @Override
    public String visitBoolBinaryOp(BoolBinaryOp node) {
        return binary(node.opCode(), visit(node.lhs()), visit(node.rhs()));
    }

    @Override
    public String visitCompareOp(CompareOp node) {
        return binary(node.opCode(), visit(node.lhs()), visit(node.rhs()));
    }

    @Override
    public String visitStarred(Starred node) {
        return "*" + visit(node.value());
    }

    @Override
    public String visitUnaryOp(UnaryOp node) {
        String operand = visit(node.operand());
        return switch (node.opCode()) {
            case "not", "!" -> "(not " + operand + ")";
            default -> "(" + node.opCode() + operand + ")";
        };
    }

    @Override
    public String visitWalrusOp(WalrusOp node) {
        return "(" + visit(node.lhs()) + " := " + visit(node.rhs()) + ")";
    }

    // endregion

    // region Variables

    @Override
    public String visitInlineVariableDeclaration(InlineVariableDeclaration node) {
        return declaration(node.name(), visit(node.type()), node.value());
    }

    @Override
    public String visitVariable(Variable node) {
        return node.name();
    }

    @Override
    public String visitVariableAssignment(VariableAssignment node) {
        return node.name() + " = " + visit(node.value());
    }

    @Override
    public String visitDeleteStmt(DeleteStmt node) {
        return "del " + joined(node.targets());
    }

    @Override
    public String visitVariableDeclaration(VariableDeclaration node) {
        return declaration(node.name(), visit(node.type()), node.value());
    }

    // endregion

    // region Control flow

    @Override
    public String visitAsyncForRangeLoopExpr(AsyncForRangeLoopExpr node) {
        return "[" + blockValue(node.body()) + " async for " + node.variable().name() + " in "
                + range(node.start(), node.end(), node.step()) + "]";
    }

    @Override
    public String visitAsyncForRangeLoopStmt(AsyncForRangeLoopStmt node) {
        return "async for " + node.variable().name() + " in " + range(node.start(), node.end(), node.step()) + ":\n"
                + body(node.body());
    }

    @Override
    public String visitBreakStmt(BreakStmt node) {
        return "break";
    }

    @Override
    public String visitCaseStmt(CaseStmt node) {
        return "case " + casePattern(node) + ":\n" + body(node.body());
    }

    @Override
    public String visitCatchHandlerStmt(CatchHandlerStmt node) {
        StringBuilder header = new StringBuilder("except");
        if (node.types().size() == 1) {
            header.append(' ').append(visit(node.types().get(0)));
        } else if (!node.types().isEmpty()) {
            header.append(" (").append(joined(node.types())).append(')');
        }
        if (node.name() != null) {
            header.append(" as ").append(node.name());
        }
        return header.append(":\n").append(body(node.body())).toString();
    }

    @Override
    public String visitContinueStmt(ContinueStmt node) {
        return "continue";
    }

    @Override
    public String visitDoWhileStmt(DoWhileStmt node) {
        if (continuesLoop(node.body())) {
            // continue has to reach the condition, so the first pass is forced by a flag
            return DO_WHILE_FLAG + " = True\nwhile " + DO_WHILE_FLAG + " or " + visit(node.condition()) + ":\n"
                    + indent(DO_WHILE_FLAG + " = False") + "\n" + body(node.body());
        }
        return "while True:\n" + body(node.body()) + "\n"
                + indent("if not " + visit(node.condition()) + ":\n" + indent("break"));
    }

    @Override
    public String visitExceptionHandlerStmt(ExceptionHandlerStmt node) {
        List<String> parts = new ArrayList<>();
        parts.add("try:\n" + body(node.body()));
        node.handlers().forEach(handler -> parts.add(visit(handler)));
        if (node.finallyHandler() != null) {
            parts.add(visit(node.finallyHandler()));
        }
        return String.join("\n", parts);
    }

    @Override
    public String visitFinallyHandlerStmt(FinallyHandlerStmt node) {
        return "finally:\n" + body(node.body());
    }

    @Override
    public String visitForCountLoopStmt(ForCountLoopStmt node) {
        return countLoop(node.initializer(), node.condition(), node.update(), node.body());
    }

    @Override
    public String visitForRangeLoopExpr(ForRangeLoopExpr node) {
        return "[" + blockValue(node.body()) + " for " + node.variable().name() + " in "
                + range(node.start(), node.end(), node.step()) + "]";
    }

    @Override
    public String visitForRangeLoopStmt(ForRangeLoopStmt node) {
        return "for " + node.variable().name() + " in " + range(node.start(), node.end(), node.step()) + ":\n"
                + body(node.body());
    }

    @Override
    public String visitIfExpr(IfExpr node) {
        return "(" + blockValue(node.thenBlock()) + " if " + visit(node.condition()) + " else "
                + (node.elseBlock() == null ? "None" : blockValue(node.elseBlock())) + ")";
    }

    @Override
    public String visitIfStmt(IfStmt node) {
        String text = "if " + visit(node.condition()) + ":\n" + body(node.thenBlock());
        if (node.elseBlock() != null) {
            text += "\nelse:\n" + body(node.elseBlock());
        }
        return text;
    }

    @Override
    public String visitSwitchStmt(SwitchStmt node) {
        if (node.cases().isEmpty()) {
            return "match " + visit(node.value()) + ":\n" + indent("case _:\n" + indent("pass"));
        }
        return "match " + visit(node.value()) + ":\n"
                + node.cases().stream().map(this::visit).map(this::indent).collect(Collectors.joining("\n"));
    }

    @Override
    public String visitThrowStmt(ThrowStmt node) {
        return node.exception() == null ? "raise" : "raise " + visit(node.exception());
    }

    @Override
    public String visitWhileExpr(WhileExpr node) {
        return "[" + blockValue(node.body()) + " for _ in iter(lambda: " + visit(node.condition()) + ", False)]";
    }

    @Override
    public String visitWhileStmt(WhileStmt node) {
        return "while " + visit(node.condition()) + ":\n" + body(node.body());
    }

    @Override
    public String visitWithItem(WithItem node) {
        String context = visit(node.contextExpr());
        return node.instanceName() == null ? context : context + " as " + node.instanceName();
    }

    @Override
    public String visitWithStmt(WithStmt node) {
        return "with " + joined(node.items()) + ":\n" + body(node.body());
    }

    // endregion

    // region Comprehensions

    @Override
    public String visitComprehensionClause(ComprehensionClause node) {
        StringBuilder clause = new StringBuilder(node.isAsync() ? "async for " : "for ");
        clause.append(visit(node.target())).append(" in ").append(visit(node.iterable()));
        for (Expr condition : node.conditions()) {
            clause.append(" if ").append(visit(condition));
        }
        return clause.toString();
    }

    @Override
    public String visitDictComprehension(DictComprehension node) {
        return "{" + visit(node.key()) + ": " + visit(node.value()) + " " + clauses(node) + "}";
    }

    @Override
    public String visitGeneratorExpr(GeneratorExpr node) {
        return "(" + visit(node.element()) + " " + clauses(node) + ")";
    }

    @Override
    public String visitListComprehension(ListComprehension node) {
        return "[" + visit(node.element()) + " " + clauses(node) + "]";
    }

    @Override
    public String visitSetComprehension(SetComprehension node) {
        return "{" + visit(node.element()) + " " + clauses(node) + "}";
    }

    // endregion

    // region Callables

    @Override
    public String visitArgument(Argument node) {
        String text = node.name() + ": " + visit(node.type());
        return node.hasDefault() ? text + " = " + visit(node.defaultValue()) : text;
    }

    @Override
    public String visitArguments(Arguments node) {
        return joined(node.nodes());
    }

    @Override
    public String visitAwaitExpr(AwaitExpr node) {
        return "await " + visit(node.value());
    }

    @Override
    public String visitFunctionAsyncDef(FunctionAsyncDef node) {
        return "async " + visitFunctionDef(node);
    }

    @Override
    public String visitFunctionCall(FunctionCall node) {
        return node.callee().name() + "(" + joined(node.args()) + ")";
    }

    @Override
    public String visitFunctionDef(FunctionDef node) {
        return signature(node.prototype()) + ":\n" + body(node.body());
    }

    /**
     * A prototype without a body is written as a stub.
     */
    @Override
    public String visitFunctionPrototype(FunctionPrototype node) {
        return signature(node) + ": ...";
    }

    @Override
    public String visitFunctionReturn(FunctionReturn node) {
        return node.value() == null ? "return" : "return " + visit(node.value());
    }

    @Override
    public String visitLambdaExpr(LambdaExpr node) {
        // lambda parameters cannot carry annotations
        String params = node.params().nodes().stream().map(Argument::name).collect(Collectors.joining(", "));
        return params.isEmpty() ? "lambda: " + visit(node.body()) : "lambda " + params + ": " + visit(node.body());
    }

    @Override
    public String visitYieldExpr(YieldExpr node) {
        return node.value() == null ? "yield" : "yield " + visit(node.value());
    }

    @Override
    public String visitYieldFromExpr(YieldFromExpr node) {
        return "yield from " + visit(node.value());
    }

    // endregion

    // region Classes

    @Override
    public String visitClassDeclStmt(ClassDeclStmt node) {
        return classHeader(node) + "\n" + indent("pass");
    }

    @Override
    public String visitClassDefStmt(ClassDefStmt node) {
        List<AstNode> members = new ArrayList<>(node.attributes());
        members.addAll(node.methods());
        return classHeader(node) + "\n" + members(members);
    }

    @Override
    public String visitEnumDeclStmt(EnumDeclStmt node) {
        List<String> lines = new ArrayList<>();
        node.attributes().forEach(attr -> lines.add(attr.name() + " = " + visit(attr.value())));
        String body = lines.isEmpty() ? indent("pass") : indent(String.join("\n", lines));
        return "class " + node.name() + "(Enum):\n" + body;
    }

    @Override
    public String visitStructDeclStmt(StructDeclStmt node) {
        return structHeader(node) + "\n" + members(new ArrayList<>(node.attributes()));
    }

    @Override
    public String visitStructDefStmt(StructDefStmt node) {
        List<AstNode> members = new ArrayList<>(node.attributes());
        members.addAll(node.methods());
        return structHeader(node) + "\n" + members(members);
    }

    // endregion

    // region Packages

    @Override
    public String visitAliasExpr(AliasExpr node) {
        return node.asname() == null ? node.name() : node.name() + " as " + node.asname();
    }

    @Override
    public String visitImportExpr(ImportExpr node) {
        List<String> modules = node.names().stream()
                .map(alias -> "__import__(" + quote(alias.name()) + ")")
                .collect(Collectors.toList());
        return modules.size() == 1 ? modules.get(0) : "(" + String.join(", ", modules) + ")";
    }

    @Override
    public String visitImportFromExpr(ImportFromExpr node) {
        List<String> values = new ArrayList<>();
        for (AliasExpr alias : node.names()) {
            values.add("getattr(__import__(" + quote(node.module()) + ", fromlist=[" + quote(alias.name())
                    + "], level=" + node.level() + "), " + quote(alias.name()) + ")");
        }
        return values.size() == 1 ? values.get(0) : "(" + String.join(", ", values) + ")";
    }

    @Override
    public String visitImportFromStmt(ImportFromStmt node) {
        return "from " + node.qualifiedModule() + " import " + joined(node.names());
    }

    @Override
    public String visitImportStmt(ImportStmt node) {
        return "import " + joined(node.names());
    }

    @Override
    public String visitModule(Module node) {
        return "# module: " + node.name() + "\n" + lines(node.nodes());
    }

    @Override
    public String visitPackage(Package node) {
        List<String> parts = new ArrayList<>();
        parts.add("# package: " + node.name());
        node.modules().forEach(module -> parts.add(visit(module)));
        node.packages().forEach(pkg -> parts.add(visit(pkg)));
        return String.join("\n\n", parts);
    }

    @Override
    public String visitProgram(Program node) {
        return visit(node.target()) + "\n" + visitPackage(node);
    }

    @Override
    public String visitTarget(Target node) {
        return "# target: " + node.triple() + " (" + node.dataLayout() + ")";
    }

    // endregion

    /**
     * Indents every non-empty line of {@code text} by one level.
     */
    protected final String indent(String text) {
        return text.lines()
                .map(line -> line.isEmpty() ? line : indent + line)
                .collect(Collectors.joining("\n"));
    }

    /**
     * A nested block, indented one level; {@code pass} when empty.
     */
    protected final String body(Block block) {
        return block.isEmpty() ? indent("pass") : indent(visit(block));
    }

    private String lines(List<? extends AstNode> nodes) {
        return nodes.stream().map(this::visit).collect(Collectors.joining("\n"));
    }

    private String joined(List<? extends AstNode> nodes) {
        return nodes.stream().map(this::visit).collect(Collectors.joining(", "));
    }

    private String optional(AstNode node) {
        return node == null ? "" : visit(node);
    }

    /**
     * The value of a block used as an expression: its last node, or {@code None} when empty.
     */
    private String blockValue(Block block) {
        return block.isEmpty() ? "None" : visit(block.get(block.size() - 1));
    }

    private String declaration(String name, String type, Expr value) {
        return value == null ? name + ": " + type : name + ": " + type + " = " + visit(value);
    }

    private String range(Expr start, Expr end, Expr step) {
        String bounds = visit(start) + ", " + visit(end);
        return step == null ? "range(" + bounds + ")" : "range(" + bounds + ", " + visit(step) + ")";
    }

    private String countLoop(InlineVariableDeclaration initializer, Expr condition, Expr update, Block body) {
        String loopBody;
        if (body.isEmpty()) {
            loopBody = visit(update);
        } else if (continuesLoop(body)) {
            // the update must also run when the body continues
            loopBody = "try:\n" + body(body) + "\nfinally:\n" + indent(visit(update));
        } else {
            loopBody = visit(body) + "\n" + visit(update);
        }
        return visit(initializer) + "\nwhile " + visit(condition) + ":\n" + indent(loopBody);
    }

    /**
     * Whether a {@code continue} in {@code node} belongs to the loop enclosing it.
     * Nested loops and function or class bodies are not searched.
     */
    private static boolean continuesLoop(AstNode node) {
        for (AstNode child : node.getChildren()) {
            if (child instanceof ContinueStmt) {
                return true;
            }
            if (!opensOwnLoopScope(child) && continuesLoop(child)) {
                return true;
            }
        }
        return false;
    }

    private static boolean opensOwnLoopScope(AstNode node) {
        return node instanceof WhileStmt || node instanceof WhileExpr
                || node instanceof ForRangeLoopStmt || node instanceof ForRangeLoopExpr
                || node instanceof AsyncForRangeLoopStmt || node instanceof AsyncForRangeLoopExpr
                || node instanceof ForCountLoopStmt || node instanceof ForCountLoopExpr
                || node instanceof DoWhileStmt || node instanceof DoWhileExpr
                || node instanceof FunctionDef || node instanceof LambdaExpr || node instanceof ClassDefStmt;
    }

    /**
     * Literal conditions become value patterns. Any other condition would be read by Python as a
     * capture pattern, so it is matched through a guard comparing it with the switch subject.
     */
    private String casePattern(CaseStmt node) {
        if (node.isDefault()) {
            return "_";
        }
        Expr condition = node.condition();
        if (isValuePattern(condition)) {
            return visit(condition);
        }
        SwitchStmt owner = node.getParent()
                .filter(SwitchStmt.class::isInstance)
                .map(SwitchStmt.class::cast)
                .orElseThrow(() -> new MalformedNodeException(
                        "Case " + condition + " is not a literal and has no enclosing switch to compare with"));
        return "_ if " + visit(owner.value()) + " == " + visit(condition);
    }

    private static boolean isValuePattern(Expr condition) {
        if (condition instanceof LiteralFloat literal) {
            return Double.isFinite(literal.value());
        }
        return condition instanceof LiteralInteger || condition instanceof LiteralBoolean
                || condition instanceof LiteralNone || condition instanceof LiteralUTF8String
                || condition instanceof LiteralUTF8Char;
    }

    /**
     * Fields that render a single-quoted string switch the whole literal to double quotes,
     * since a field may not reuse the enclosing quote.
     */
    private String formattedString(List<Expr> parts) {
        char quote = fieldsContain(parts, '\'') ? '"' : '\'';
        return "f" + quote + formattedBody(parts, quote) + quote;
    }

    private String formattedBody(List<Expr> parts, char quote) {
        StringBuilder out = new StringBuilder();
        for (Expr part : parts) {
            if (part instanceof LiteralUTF8String text) {
                out.append(escape(text.value(), quote).replace("{", "{{").replace("}", "}}"));
                continue;
            }
            FormattedValue field = (FormattedValue) part;
            String value = visit(field.value());
            // "{{" would read as an escaped brace
            out.append('{').append(value.startsWith("{") ? " " + value : value);
            if (field.conversion() != null) {
                out.append('!').append(field.conversion());
            }
            if (field.formatSpec() instanceof JoinedStr nested) {
                out.append(':').append(formattedBody(nested.values(), quote));
            } else if (field.formatSpec() != null) {
                out.append(':').append(formattedBody(List.of(field.formatSpec()), quote));
            }
            out.append('}');
        }
        return out.toString();
    }

    private boolean fieldsContain(List<Expr> parts, char c) {
        for (Expr part : parts) {
            if (part instanceof FormattedValue field) {
                if (visit(field.value()).indexOf(c) >= 0) {
                    return true;
                }
                if (field.formatSpec() instanceof JoinedStr nested && fieldsContain(nested.values(), c)) {
                    return true;
                }
            }
        }
        return false;
    }

    private String clauses(Comprehension node) {
        return node.clauses().stream().map(this::visit).collect(Collectors.joining(" "));
    }

    private String signature(FunctionPrototype prototype) {
        return "def " + prototype.name() + "(" + visit(prototype.args()) + ") -> " + visit(prototype.returnType());
    }

    private String members(List<AstNode> members) {
        if (members.isEmpty()) {
            return indent("pass");
        }
        return members.stream().map(this::visit).map(this::indent).collect(Collectors.joining("\n"));
    }

    private String classHeader(ClassDeclStmt node) {
        List<String> bases = new ArrayList<>();
        node.bases().forEach(base -> bases.add(visit(base)));
        if (node.isAbstract()) {
            bases.add("ABC");
        }
        if (node.metaclass() != null) {
            bases.add("metaclass=" + visit(node.metaclass()));
        }
        StringBuilder header = new StringBuilder(decorators(node.decorators()));
        header.append("class ").append(node.name());
        if (!bases.isEmpty()) {
            header.append('(').append(String.join(", ", bases)).append(')');
        }
        return header.append(':').toString();
    }

    private String structHeader(StructDeclStmt node) {
        return "@dataclass\n" + decorators(node.decorators()) + "class " + node.name() + ":";
    }

    private String decorators(List<Expr> decorators) {
        StringBuilder text = new StringBuilder();
        decorators.forEach(decorator -> text.append('@').append(visit(decorator)).append('\n'));
        return text.toString();
    }

    private static String binary(String op, String lhs, String rhs) {
        return switch (op) {
            case "and", "&&" -> "(" + lhs + " and " + rhs + ")";
            case "or", "||" -> "(" + lhs + " or " + rhs + ")";
            case "xor" -> "(" + lhs + " ^ " + rhs + ")";
            case "nand" -> "(not (" + lhs + " and " + rhs + "))";
            case "nor" -> "(not (" + lhs + " or " + rhs + "))";
            case "xnor" -> "(not (" + lhs + " ^ " + rhs + "))";
            default -> "(" + lhs + " " + op + " " + rhs + ")";
        };
    }

    private static String number(double value) {
        if (Double.isNaN(value)) {
            return "float('nan')";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "float('inf')" : "float('-inf')";
        }
        return Double.toString(value);
    }

    /**
     * A single-quoted Python string literal with the escapes {@code repr} would use.
     */
    static String quote(String value) {
        return "'" + escape(value, '\'') + "'";
    }

    private static String escape(String value, char quote) {
        StringBuilder out = new StringBuilder();
        value.codePoints().forEach(cp -> {
            if (cp == quote) {
                out.append('\\').append(quote);
                return;
            }
            switch (cp) {
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (cp < 0x20 || cp == 0x7f) {
                        out.append(String.format("\\x%02x", cp));
                    } else {
                        out.appendCodePoint(cp);
                    }
                }
            }
        });
        return out.toString();
    }
}
