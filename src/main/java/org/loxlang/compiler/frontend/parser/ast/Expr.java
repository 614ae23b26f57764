package org.loxlang.compiler.frontend.parser.ast;

import org.loxlang.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * The expression family of the abstract syntax tree.
 * <p>
 * The set of node kinds is closed. Every consumer implements {@link Visitor}, so adding a
 * node kind is a compile error in every pass that does not handle it yet.
 * <p>
 * Nodes are compared by identity wherever a pass attaches information to them: two
 * references to the same name at different positions are distinct nodes, even though
 * their record components may be equal.
 */
public sealed interface Expr {

    <R> R accept(Visitor<R> visitor);

    /**
     * Dispatch target for every expression kind.
     * @param <R> The result type of the pass.
     */
    interface Visitor<R> {
        R visitLiteral(Literal expr);
        R visitGrouping(Grouping expr);
        R visitUnary(Unary expr);
        R visitBinary(Binary expr);
        R visitLogical(Logical expr);
        R visitVariable(Variable expr);
        R visitAssign(Assign expr);
        R visitCall(Call expr);
        R visitGet(Get expr);
        R visitSet(Set expr);
        R visitThis(This expr);
        R visitSuper(Super expr);
    }

    /**
     * A number, string, boolean or nil literal.
     * @param value The runtime value ({@code null} for nil).
     */
    record Literal(Object value) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    record Grouping(Expr expression) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGrouping(this);
        }
    }

    record Unary(Token operator, Expr right) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnary(this);
        }
    }

    record Binary(Expr left, Token operator, Expr right) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    /**
     * A short-circuiting {@code and} / {@code or}.
     */
    record Logical(Expr left, Token operator, Expr right) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLogical(this);
        }
    }

    record Variable(Token name) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVariable(this);
        }
    }

    record Assign(Token name, Expr value) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssign(this);
        }
    }

    /**
     * A call.
     * @param callee The expression producing the callable.
     * @param paren The closing parenthesis, used to locate runtime errors.
     * @param arguments The argument expressions in source order.
     */
    record Call(Expr callee, Token paren, List<Expr> arguments) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }

    record Get(Expr object, Token name) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGet(this);
        }
    }

    record Set(Expr object, Token name, Expr value) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSet(this);
        }
    }

    record This(Token keyword) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitThis(this);
        }
    }

    /**
     * A {@code super.method} reference.
     */
    record Super(Token keyword, Token method) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSuper(this);
        }
    }
}
