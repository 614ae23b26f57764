package org.loxlang.compiler.frontend.semantics;

import org.loxlang.compiler.diagnostics.Diagnostic;
import org.loxlang.compiler.diagnostics.DiagnosticsEngine;
import org.loxlang.compiler.frontend.lexer.Token;
import org.loxlang.compiler.frontend.parser.ast.Expr;
import org.loxlang.compiler.frontend.parser.ast.Stmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Static pass over the parsed tree that runs before any evaluation.
 * <p>
 * It mirrors the environments the interpreter will create at run time, using names only,
 * and records in the {@link ScopeDepthTable} how many scopes separate every local variable
 * reference from its declaration. In the same pass it validates the placement of
 * {@code return}, {@code break}, {@code continue}, {@code this} and {@code super}.
 * All errors are reported to the {@link DiagnosticsEngine}; the pass continues after each one.
 */
public class Resolver implements Expr.Visitor<Void>, Stmt.Visitor<Void> {

    private static final Logger LOG = LoggerFactory.getLogger(Resolver.class);

    private enum FunctionType {
        NONE,
        FUNCTION,
        INITIALIZER,
        METHOD
    }

    private enum ClassType {
        NONE,
        CLASS,
        SUBCLASS
    }

    private final ScopeDepthTable depthTable;
    private final DiagnosticsEngine diagnostics;

    // Innermost scope on top. A name maps to false while its initializer is being resolved.
    private final Deque<Map<String, Boolean>> scopes = new ArrayDeque<>();

    private FunctionType currentFunction = FunctionType.NONE;
    private ClassType currentClass = ClassType.NONE;
    private int loopDepth = 0;

    /**
     * Constructs a new resolver.
     * @param depthTable The side table receiving scope depths.
     * @param diagnostics The engine for reporting resolution errors.
     */
    public Resolver(ScopeDepthTable depthTable, DiagnosticsEngine diagnostics) {
        this.depthTable = depthTable;
        this.diagnostics = diagnostics;
    }

    /**
     * Resolves a list of top-level statements. Top-level declarations are globals and are
     * not tracked.
     * @param statements The statements to resolve.
     */
    public void resolve(List<Stmt> statements) {
        int before = depthTable.size();
        resolveAll(statements);
        LOG.debug("Resolved {} local references", depthTable.size() - before);
    }

    // --- Statements ---

    @Override
    public Void visitBlock(Stmt.Block stmt) {
        enterScope();
        resolveAll(stmt.statements());
        leaveScope();
        return null;
    }

    @Override
    public Void visitClass(Stmt.Class stmt) {
        ClassType enclosingClass = currentClass;
        currentClass = ClassType.CLASS;

        declare(stmt.name());
        define(stmt.name());

        if (stmt.superclass() != null) {
            if (stmt.name().text().equals(stmt.superclass().name().text())) {
                error(stmt.superclass().name(), "A class can't inherit from itself.");
            } else {
                currentClass = ClassType.SUBCLASS;
                resolve(stmt.superclass());
            }
        }

        if (stmt.superclass() != null) {
            enterScope();
            scopes.peek().put("super", true);
        }

        enterScope();
        scopes.peek().put("this", true);

        for (Stmt.Function method : stmt.methods()) {
            FunctionType declaration = method.name().text().equals("init")
                    ? FunctionType.INITIALIZER
                    : FunctionType.METHOD;
            resolveFunction(method, declaration);
        }

        leaveScope();

        if (stmt.superclass() != null) {
            leaveScope();
        }

        currentClass = enclosingClass;
        return null;
    }

    @Override
    public Void visitExpression(Stmt.Expression stmt) {
        resolve(stmt.expression());
        return null;
    }

    @Override
    public Void visitFunction(Stmt.Function stmt) {
        // Defined before the body so the function can refer to itself recursively.
        declare(stmt.name());
        define(stmt.name());

        resolveFunction(stmt, FunctionType.FUNCTION);
        return null;
    }

    @Override
    public Void visitIf(Stmt.If stmt) {
        resolve(stmt.condition());
        resolve(stmt.thenBranch());
        if (stmt.elseBranch() != null) resolve(stmt.elseBranch());
        return null;
    }

    @Override
    public Void visitPrint(Stmt.Print stmt) {
        resolve(stmt.expression());
        return null;
    }

    @Override
    public Void visitReturn(Stmt.Return stmt) {
        if (currentFunction == FunctionType.NONE) {
            error(stmt.keyword(), "Can't return from top-level code.");
        }

        if (stmt.value() != null) {
            if (currentFunction == FunctionType.INITIALIZER) {
                error(stmt.keyword(), "Can't return a value from an initializer.");
            }

            resolve(stmt.value());
        }

        return null;
    }

    @Override
    public Void visitBreak(Stmt.Break stmt) {
        if (loopDepth == 0) {
            error(stmt.keyword(), "Can't use 'break' outside of a loop.");
        }
        return null;
    }

    @Override
    public Void visitContinue(Stmt.Continue stmt) {
        if (loopDepth == 0) {
            error(stmt.keyword(), "Can't use 'continue' outside of a loop.");
        }
        return null;
    }

    @Override
    public Void visitVar(Stmt.Var stmt) {
        declare(stmt.name());
        if (stmt.initializer() != null) {
            resolve(stmt.initializer());
        }
        define(stmt.name());
        return null;
    }

    @Override
    public Void visitWhile(Stmt.While stmt) {
        resolve(stmt.condition());
        loopDepth++;
        resolve(stmt.body());
        if (stmt.increment() != null) {
            resolve(stmt.increment());
        }
        loopDepth--;
        return null;
    }

    // --- Expressions ---

    @Override
    public Void visitAssign(Expr.Assign expr) {
        resolve(expr.value());
        resolveLocal(expr, expr.name());
        return null;
    }

    @Override
    public Void visitBinary(Expr.Binary expr) {
        resolve(expr.left());
        resolve(expr.right());
        return null;
    }

    @Override
    public Void visitCall(Expr.Call expr) {
        resolve(expr.callee());

        for (Expr argument : expr.arguments()) {
            resolve(argument);
        }

        return null;
    }

    @Override
    public Void visitGet(Expr.Get expr) {
        // Property names are looked up dynamically; only the object is resolved.
        resolve(expr.object());
        return null;
    }

    @Override
    public Void visitGrouping(Expr.Grouping expr) {
        resolve(expr.expression());
        return null;
    }

    @Override
    public Void visitLiteral(Expr.Literal expr) {
        return null;
    }

    @Override
    public Void visitLogical(Expr.Logical expr) {
        resolve(expr.left());
        resolve(expr.right());
        return null;
    }

    @Override
    public Void visitSet(Expr.Set expr) {
        resolve(expr.value());
        resolve(expr.object());
        return null;
    }

    @Override
    public Void visitSuper(Expr.Super expr) {
        if (currentClass == ClassType.NONE) {
            error(expr.keyword(), "Can't use 'super' outside of a class.");
        } else if (currentClass != ClassType.SUBCLASS) {
            error(expr.keyword(), "Can't use 'super' in a class with no superclass.");
        }

        resolveLocal(expr, expr.keyword());
        return null;
    }

    @Override
    public Void visitThis(Expr.This expr) {
        if (currentClass == ClassType.NONE) {
            error(expr.keyword(), "Can't use 'this' outside of a class.");
            return null;
        }

        resolveLocal(expr, expr.keyword());
        return null;
    }

    @Override
    public Void visitUnary(Expr.Unary expr) {
        resolve(expr.right());
        return null;
    }

    @Override
    public Void visitVariable(Expr.Variable expr) {
        Map<String, Boolean> scope = scopes.peek();
        if (scope != null && Boolean.FALSE.equals(scope.get(expr.name().text()))) {
            error(expr.name(), "Can't read local variable in its own initializer.");
        }

        resolveLocal(expr, expr.name());
        return null;
    }

    // --- Helpers ---

    private void resolveAll(List<Stmt> statements) {
        for (Stmt statement : statements) {
            resolve(statement);
        }
    }

    private void resolve(Stmt stmt) {
        stmt.accept(this);
    }

    private void resolve(Expr expr) {
        expr.accept(this);
    }

    private void resolveFunction(Stmt.Function function, FunctionType type) {
        FunctionType enclosingFunction = currentFunction;
        int enclosingLoopDepth = loopDepth;
        currentFunction = type;
        // break/continue never cross a function boundary.
        loopDepth = 0;

        enterScope();
        for (Token param : function.params()) {
            declare(param);
            define(param);
        }
        resolveAll(function.body());
        leaveScope();

        loopDepth = enclosingLoopDepth;
        currentFunction = enclosingFunction;
    }

    private void enterScope() {
        scopes.push(new HashMap<>());
    }

    private void leaveScope() {
        scopes.pop();
    }

    private void declare(Token name) {
        Map<String, Boolean> scope = scopes.peek();
        if (scope == null) return;

        if (scope.containsKey(name.text())) {
            error(name, "Already a variable with this name in this scope.");
        }

        scope.put(name.text(), false);
    }

    private void define(Token name) {
        Map<String, Boolean> scope = scopes.peek();
        if (scope == null) return;
        scope.put(name.text(), true);
    }

    private void resolveLocal(Expr expr, Token name) {
        int depth = 0;
        // ArrayDeque iterates from the innermost (top) scope outwards.
        for (Map<String, Boolean> scope : scopes) {
            if (scope.containsKey(name.text())) {
                depthTable.record(expr, depth);
                return;
            }
            depth++;
        }
        // Not found: assumed to be global.
    }

    private void error(Token token, String message) {
        diagnostics.reportError(Diagnostic.Phase.RESOLUTION, message, token.line(), token.column());
    }
}
