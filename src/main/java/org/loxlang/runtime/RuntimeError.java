package org.loxlang.runtime;

import org.loxlang.compiler.frontend.lexer.Token;

/**
 * A fatal error raised while evaluating a program: type mismatch, undefined variable or
 * property, wrong argument count, calling a non-callable, stack overflow.
 * <p>
 * The first runtime error halts the run; it unwinds through the evaluator up to the
 * session, which reports it.
 */
public class RuntimeError extends RuntimeException {

    private final transient Token token;

    /**
     * Creates a runtime error located at the given token.
     * @param token The token whose evaluation failed.
     * @param message The error message.
     */
    public RuntimeError(Token token, String message) {
        super(message);
        this.token = token;
    }

    public Token getToken() {
        return token;
    }

    public int getLine() {
        return token.line();
    }
}
