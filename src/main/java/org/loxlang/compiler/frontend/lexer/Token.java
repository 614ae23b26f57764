package org.loxlang.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type   The lexical category of the token.
 * @param text   The exact lexeme from the source code.
 * @param value  The literal value for {@link TokenType#NUMBER} ({@link Double}) and
 *               {@link TokenType#STRING} ({@link String}) tokens, otherwise {@code null}.
 * @param line   The line number where the token was found.
 * @param column The column number where the token starts.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column
) {

    /**
     * Convenience constructor for tokens without a literal value.
     */
    public Token(TokenType type, String text, int line, int column) {
        this(type, text, null, line, column);
    }

    @Override
    public String toString() {
        return line + ":" + column + " " + type + " " + text;
    }
}
