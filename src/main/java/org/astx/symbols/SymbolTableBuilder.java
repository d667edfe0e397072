package org.astx.symbols;

import org.astx.ast.AstNode;
import org.astx.ast.callables.Argument;
import org.astx.ast.callables.FunctionAsyncDef;
import org.astx.ast.callables.FunctionDef;
import org.astx.ast.callables.FunctionPrototype;
import org.astx.ast.callables.LambdaExpr;
import org.astx.ast.classes.ClassDeclStmt;
import org.astx.ast.classes.ClassDefStmt;
import org.astx.ast.classes.EnumDeclStmt;
import org.astx.ast.classes.StructDeclStmt;
import org.astx.ast.classes.StructDefStmt;
import org.astx.ast.flows.DoWhileExpr;
import org.astx.ast.flows.DoWhileStmt;
import org.astx.ast.flows.ForCountLoopExpr;
import org.astx.ast.flows.ForCountLoopStmt;
import org.astx.ast.flows.AsyncForRangeLoopExpr;
import org.astx.ast.flows.AsyncForRangeLoopStmt;
import org.astx.ast.flows.ForRangeLoopExpr;
import org.astx.ast.flows.ForRangeLoopStmt;
import org.astx.ast.flows.WhileExpr;
import org.astx.ast.flows.WhileStmt;
import org.astx.ast.modifiers.MutabilityKind;
import org.astx.ast.modifiers.VisibilityKind;
import org.astx.ast.packages.AliasExpr;
import org.astx.ast.packages.Module;
import org.astx.ast.variables.InlineVariableDeclaration;
import org.astx.ast.variables.VariableDeclaration;
import org.astx.ast.visitor.TreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Collects every declaration of a tree into a {@link SymbolTable}.
 * <p>
 * Modules, functions, lambdas, classes, structs, enums and loops open nested scopes; a
 * function's own name is declared in the enclosing scope and its arguments in the new one.
 * A second declaration of a name in one scope fails with
 * {@link org.astx.api.SymbolResolutionException}.
 */
public class SymbolTableBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(SymbolTableBuilder.class);

    private static final List<Class<? extends AstNode>> LOOPS = List.of(
            ForRangeLoopStmt.class, ForRangeLoopExpr.class,
            AsyncForRangeLoopStmt.class, AsyncForRangeLoopExpr.class,
            ForCountLoopStmt.class, ForCountLoopExpr.class,
            WhileStmt.class, WhileExpr.class,
            DoWhileStmt.class, DoWhileExpr.class);

    private final SymbolTable table;
    private final Map<Class<? extends AstNode>, Consumer<AstNode>> enter = new HashMap<>();
    private final Map<Class<? extends AstNode>, Consumer<AstNode>> exit = new HashMap<>();

    public SymbolTableBuilder() {
        this(new SymbolTable());
    }

    /**
     * @param table The table to fill, starting at its current scope.
     */
    public SymbolTableBuilder(SymbolTable table) {
        this.table = table;
        registerHandlers();
    }

    /**
     * Walks {@code root} and declares everything it contains.
     * @return The filled table.
     */
    public SymbolTable build(AstNode root) {
        new TreeWalker(enter, exit).walk(root);
        LOG.debug("Collected symbols of {} into {}", root, table.rootScope());
        return table;
    }

    private void registerHandlers() {
        enter.put(VariableDeclaration.class, n -> {
            VariableDeclaration decl = (VariableDeclaration) n;
            table.define(table.currentScope(), decl.name(), variableKind(decl.mutability()), decl.visibility(), decl);
        });
        enter.put(InlineVariableDeclaration.class, n -> {
            InlineVariableDeclaration decl = (InlineVariableDeclaration) n;
            table.define(table.currentScope(), decl.name(), variableKind(decl.mutability()), decl.visibility(), decl);
        });
        enter.put(Argument.class, n ->
                table.define(table.currentScope(), ((Argument) n).name(), SymbolKind.ARGUMENT, VisibilityKind.PUBLIC, n));
        enter.put(AliasExpr.class, n ->
                table.define(table.currentScope(), ((AliasExpr) n).boundName(), SymbolKind.IMPORT, VisibilityKind.PUBLIC, n));

        // A prototype inside a definition is declared through the definition; a standalone
        // prototype gets its own scope so that its arguments do not leak.
        enter.put(FunctionPrototype.class, n -> {
            if (isStandalone(n)) {
                FunctionPrototype prototype = (FunctionPrototype) n;
                table.define(table.currentScope(), prototype.name(), SymbolKind.FUNCTION, prototype.visibility(), prototype);
                table.enterScope(prototype.name());
            }
        });
        exit.put(FunctionPrototype.class, n -> {
            if (isStandalone(n)) {
                table.leaveScope();
            }
        });
        Consumer<AstNode> functionEnter = n -> {
            FunctionDef def = (FunctionDef) n;
            table.define(table.currentScope(), def.name(), SymbolKind.FUNCTION, def.prototype().visibility(), def);
            table.enterScope(def.name());
        };
        scoped(FunctionDef.class, functionEnter);
        scoped(FunctionAsyncDef.class, functionEnter);
        scoped(LambdaExpr.class, n -> table.enterScope("lambda"));

        enter.put(ClassDeclStmt.class, n -> {
            ClassDeclStmt decl = (ClassDeclStmt) n;
            table.define(table.currentScope(), decl.name(), SymbolKind.CLASS, decl.visibility(), decl);
        });
        scoped(ClassDefStmt.class, n -> {
            ClassDefStmt def = (ClassDefStmt) n;
            table.define(table.currentScope(), def.name(), SymbolKind.CLASS, def.visibility(), def);
            table.enterScope(def.name());
        });
        Consumer<AstNode> structEnter = n -> {
            StructDeclStmt decl = (StructDeclStmt) n;
            table.define(table.currentScope(), decl.name(), SymbolKind.STRUCT, decl.visibility(), decl);
            table.enterScope(decl.name());
        };
        scoped(StructDeclStmt.class, structEnter);
        scoped(StructDefStmt.class, structEnter);
        scoped(EnumDeclStmt.class, n -> {
            EnumDeclStmt decl = (EnumDeclStmt) n;
            table.define(table.currentScope(), decl.name(), SymbolKind.ENUM, decl.visibility(), decl);
            table.enterScope(decl.name());
        });

        scoped(Module.class, n -> table.enterScope(((Module) n).name()));
        for (Class<? extends AstNode> loop : LOOPS) {
            scoped(loop, n -> table.enterScope(n.toString()));
        }
    }

    private void scoped(Class<? extends AstNode> type, Consumer<AstNode> onEnter) {
        enter.put(type, onEnter);
        exit.put(type, n -> table.leaveScope());
    }

    private static boolean isStandalone(AstNode prototype) {
        return prototype.getParent().filter(p -> p instanceof FunctionDef).isEmpty();
    }

    private static SymbolKind variableKind(MutabilityKind mutability) {
        return mutability == MutabilityKind.CONSTANT ? SymbolKind.CONSTANT : SymbolKind.VARIABLE;
    }
}
