package org.loxlang.compiler.frontend.parser.ast;

import org.loxlang.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * The statement and declaration family of the abstract syntax tree.
 * <p>
 * There is no {@code for} node: the parser desugars {@code for} into a {@link Block}
 * holding the initializer and a {@link While} that carries the increment.
 */
public sealed interface Stmt {

    <R> R accept(Visitor<R> visitor);

    /**
     * Dispatch target for every statement kind.
     * @param <R> The result type of the pass.
     */
    interface Visitor<R> {
        R visitExpression(Expression stmt);
        R visitPrint(Print stmt);
        R visitVar(Var stmt);
        R visitBlock(Block stmt);
        R visitIf(If stmt);
        R visitWhile(While stmt);
        R visitBreak(Break stmt);
        R visitContinue(Continue stmt);
        R visitReturn(Return stmt);
        R visitFunction(Function stmt);
        R visitClass(Class stmt);
    }

    record Expression(Expr expression) implements Stmt {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExpression(this);
        }
    }

    record Print(Expr expression) implements Stmt {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPrint(this);
        }
    }

    /**
     * A variable declaration.
     * @param name The declared name.
     * @param initializer The initializer, or {@code null} if absent.
     */
    record Var(Token name, Expr initializer) implements Stmt {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVar(this);
        }
    }

    record Block(List<Stmt> statements) implements Stmt {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBlock(this);
        }
    }

    /**
     * @param elseBranch The else branch, or {@code null} if absent.
     */
    record If(Expr condition, Stmt thenBranch, Stmt elseBranch) implements Stmt {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIf(this);
        }
    }

    /**
     * A loop. For a desugared {@code for} loop the increment belongs to the loop body as
     * far as {@code continue} is concerned: it runs after every iteration that completes
     * normally or by {@code continue}.
     *
     * @param condition The condition re-evaluated before each iteration.
     * @param body The loop body.
     * @param increment The {@code for} increment, or {@code null} for plain {@code while} loops.
     */
    record While(Expr condition, Stmt body, Expr increment) implements Stmt {
        public While(Expr condition, Stmt body) {
            this(condition, body, null);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWhile(this);
        }
    }

    record Break(Token keyword) implements Stmt {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBreak(this);
        }
    }

    record Continue(Token keyword) implements Stmt {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitContinue(this);
        }
    }

    /**
     * @param value The returned expression, or {@code null} for a bare {@code return;}.
     */
    record Return(Token keyword, Expr value) implements Stmt {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReturn(this);
        }
    }

    /**
     * A function or method declaration.
     */
    record Function(Token name, List<Token> params, List<Stmt> body) implements Stmt {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunction(this);
        }
    }

    /**
     * @param superclass The superclass reference, or {@code null} if the class has none.
     */
    record Class(Token name, Expr.Variable superclass, List<Function> methods) implements Stmt {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitClass(this);
        }
    }
}
