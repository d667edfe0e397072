package org.astx.serialization;

import org.astx.ast.AstNode;
import org.astx.ast.AstNodes;
import org.astx.ast.Block;
import org.astx.ast.Expr;
import org.astx.ast.Identifier;
import org.astx.ast.callables.Argument;
import org.astx.ast.callables.Arguments;
import org.astx.ast.callables.FunctionAsyncDef;
import org.astx.ast.callables.FunctionDef;
import org.astx.ast.callables.FunctionPrototype;
import org.astx.ast.callables.FunctionReturn;
import org.astx.ast.classes.ClassDeclStmt;
import org.astx.ast.classes.ClassDefStmt;
import org.astx.ast.classes.EnumDeclStmt;
import org.astx.ast.classes.StructDeclStmt;
import org.astx.ast.classes.StructDefStmt;
import org.astx.ast.flows.BreakStmt;
import org.astx.ast.flows.CaseStmt;
import org.astx.ast.flows.CatchHandlerStmt;
import org.astx.ast.flows.ContinueStmt;
import org.astx.ast.flows.DoWhileStmt;
import org.astx.ast.flows.ExceptionHandlerStmt;
import org.astx.ast.flows.FinallyHandlerStmt;
import org.astx.ast.flows.ForCountLoopStmt;
import org.astx.ast.flows.AsyncForRangeLoopStmt;
import org.astx.ast.flows.ForRangeLoopStmt;
import org.astx.ast.flows.GotoStmt;
import org.astx.ast.flows.IfStmt;
import org.astx.ast.flows.SwitchStmt;
import org.astx.ast.flows.ThrowStmt;
import org.astx.ast.flows.WhileStmt;
import org.astx.ast.flows.WithItem;
import org.astx.ast.flows.WithStmt;
import org.astx.ast.modifiers.MutabilityKind;
import org.astx.ast.modifiers.ScopeKind;
import org.astx.ast.modifiers.VisibilityKind;
import org.astx.ast.packages.AliasExpr;
import org.astx.ast.packages.ImportFromStmt;
import org.astx.ast.packages.ImportStmt;
import org.astx.ast.packages.Module;
import org.astx.ast.packages.Package;
import org.astx.ast.packages.Program;
import org.astx.ast.packages.Target;
import org.astx.ast.variables.InlineVariableDeclaration;
import org.astx.ast.variables.DeleteStmt;
import org.astx.ast.variables.VariableAssignment;
import org.astx.ast.variables.VariableDeclaration;

/**
 * Decoders for containers, statements, declarations and program structure.
 */
final class StatementDecoders {

    private StatementDecoders() {}

    static void install(NodeDecoderRegistry reg) {
        // containers
        reg.register("Block", s -> fill(new Block(s.string("name")), s));
        reg.register("Module", s -> fill(new Module(s.string("name")), s));
        reg.register("Arguments", s -> new Arguments(s.children("nodes", Argument.class)));

        // variables
        reg.register("VariableDeclaration", s -> new VariableDeclaration(s.string("name"), s.type("type"),
                s.label("mutability", MutabilityKind::fromLabel),
                s.label("scope", ScopeKind::fromLabel),
                s.label("visibility", VisibilityKind::fromLabel),
                s.optionalChild("value", Expr.class)));
        reg.register("VariableAssignment", s -> new VariableAssignment(s.string("name"), s.child("value", Expr.class)));
        reg.register("DeleteStmt", s -> new DeleteStmt(s.children("targets", Expr.class)));

        // flows
        reg.register("IfStmt", s -> new IfStmt(s.child("condition", Expr.class),
                s.child("then-block", Block.class), s.optionalChild("else-block", Block.class)));
        reg.register("ForRangeLoopStmt", s -> new ForRangeLoopStmt(
                s.child("variable", InlineVariableDeclaration.class), s.child("start", Expr.class),
                s.child("end", Expr.class), s.optionalChild("step", Expr.class), s.child("body", Block.class)));
        reg.register("AsyncForRangeLoopStmt", s -> new AsyncForRangeLoopStmt(
                s.child("variable", InlineVariableDeclaration.class), s.child("start", Expr.class),
                s.child("end", Expr.class), s.optionalChild("step", Expr.class), s.child("body", Block.class)));
        reg.register("ForCountLoopStmt", s -> new ForCountLoopStmt(
                s.child("initializer", InlineVariableDeclaration.class), s.child("condition", Expr.class),
                s.child("update", Expr.class), s.child("body", Block.class)));
        reg.register("WhileStmt", s -> new WhileStmt(s.child("condition", Expr.class), s.child("body", Block.class)));
        reg.register("DoWhileStmt", s -> new DoWhileStmt(s.child("body", Block.class), s.child("condition", Expr.class)));
        reg.register("BreakStmt", s -> new BreakStmt());
        reg.register("ContinueStmt", s -> new ContinueStmt());
        reg.register("GotoStmt", s -> new GotoStmt(s.child("label", Identifier.class)));
        reg.register("CaseStmt", s -> new CaseStmt(
                s.optionalChild("condition", Expr.class), s.child("body", Block.class), s.bool("default")));
        reg.register("SwitchStmt", s -> new SwitchStmt(s.child("value", Expr.class), s.children("cases", CaseStmt.class)));
        reg.register("ThrowStmt", s -> new ThrowStmt(s.optionalChild("exception", Expr.class)));
        reg.register("CatchHandlerStmt", s -> new CatchHandlerStmt(
                s.child("body", Block.class), s.optionalString("name"), s.children("types", Identifier.class)));
        reg.register("FinallyHandlerStmt", s -> new FinallyHandlerStmt(s.child("body", Block.class)));
        reg.register("ExceptionHandlerStmt", s -> new ExceptionHandlerStmt(s.child("body", Block.class),
                s.children("handlers", CatchHandlerStmt.class),
                s.optionalChild("finally-handler", FinallyHandlerStmt.class)));
        reg.register("WithItem", s -> new WithItem(s.child("context-expr", Expr.class), s.optionalString("instance-name")));
        reg.register("WithStmt", s -> new WithStmt(s.children("items", WithItem.class), s.child("body", Block.class)));

        // callables
        reg.register("Argument", s -> new Argument(
                s.string("name"), s.type("type"), s.optionalChild("default", Expr.class)));
        reg.register("FunctionPrototype", s -> new FunctionPrototype(s.string("name"),
                s.child("args", Arguments.class), s.type("return-type"),
                s.label("scope", ScopeKind::fromLabel), s.label("visibility", VisibilityKind::fromLabel)));
        reg.register("FunctionDef", s -> new FunctionDef(
                s.child("prototype", FunctionPrototype.class), s.child("body", Block.class)));
        reg.register("FunctionAsyncDef", s -> new FunctionAsyncDef(
                s.child("prototype", FunctionPrototype.class), s.child("body", Block.class)));
        reg.register("FunctionReturn", s -> new FunctionReturn(s.optionalChild("value", Expr.class)));

        // classes
        reg.register("ClassDeclStmt", s -> new ClassDeclStmt(s.string("name"),
                s.children("bases", Expr.class), s.children("decorators", Expr.class),
                s.label("visibility", VisibilityKind::fromLabel), s.bool("abstract"),
                s.optionalChild("metaclass", Expr.class)));
        reg.register("ClassDefStmt", s -> new ClassDefStmt(s.string("name"),
                s.children("bases", Expr.class), s.children("decorators", Expr.class),
                s.label("visibility", VisibilityKind::fromLabel), s.bool("abstract"),
                s.optionalChild("metaclass", Expr.class),
                s.children("attributes", VariableDeclaration.class), s.children("methods", FunctionDef.class)));
        reg.register("StructDeclStmt", s -> new StructDeclStmt(s.string("name"),
                s.children("attributes", VariableDeclaration.class), s.children("decorators", Expr.class),
                s.label("visibility", VisibilityKind::fromLabel)));
        reg.register("StructDefStmt", s -> new StructDefStmt(s.string("name"),
                s.children("attributes", VariableDeclaration.class), s.children("decorators", Expr.class),
                s.label("visibility", VisibilityKind::fromLabel), s.children("methods", FunctionDef.class)));
        reg.register("EnumDeclStmt", s -> new EnumDeclStmt(s.string("name"),
                s.children("attributes", VariableDeclaration.class), s.label("visibility", VisibilityKind::fromLabel)));

        // packages
        reg.register("ImportStmt", s -> new ImportStmt(s.children("names", AliasExpr.class)));
        reg.register("ImportFromStmt", s -> new ImportFromStmt(s.string("module"),
                s.children("names", AliasExpr.class), s.intValue("level")));
        reg.register("Target", s -> new Target(s.string("data-layout"), s.string("triple")));
        reg.register("Package", s -> new Package(s.string("name"),
                s.children("modules", Module.class), s.children("packages", Package.class)));
        reg.register("Program", s -> new Program(s.string("name"), s.child("target", Target.class),
                s.children("modules", Module.class), s.children("packages", Package.class)));
    }

    private static <T extends AstNodes<AstNode>> T fill(T container, StructReader s) {
        s.children("nodes", AstNode.class).forEach(container::append);
        return container;
    }
}
