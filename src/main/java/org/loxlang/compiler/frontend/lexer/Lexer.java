package org.loxlang.compiler.frontend.lexer;

import org.loxlang.compiler.diagnostics.Diagnostic;
import org.loxlang.compiler.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts raw source text into a list of {@link Token}s terminated by an
 * {@link TokenType#END_OF_FILE} token.
 * <p>
 * Lexical errors (unexpected characters, unterminated strings) are reported to the
 * {@link DiagnosticsEngine}; the offending input is skipped and scanning continues.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("and", TokenType.AND),
            Map.entry("break", TokenType.BREAK),
            Map.entry("class", TokenType.CLASS),
            Map.entry("continue", TokenType.CONTINUE),
            Map.entry("else", TokenType.ELSE),
            Map.entry("false", TokenType.FALSE),
            Map.entry("for", TokenType.FOR),
            Map.entry("fun", TokenType.FUN),
            Map.entry("if", TokenType.IF),
            Map.entry("nil", TokenType.NIL),
            Map.entry("or", TokenType.OR),
            Map.entry("print", TokenType.PRINT),
            Map.entry("return", TokenType.RETURN),
            Map.entry("super", TokenType.SUPER),
            Map.entry("this", TokenType.THIS),
            Map.entry("true", TokenType.TRUE),
            Map.entry("var", TokenType.VAR),
            Map.entry("while", TokenType.WHILE)
    );

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;

    // Position of the token being scanned; strings may span lines.
    private int tokenLine = 1;
    private int tokenColumn = 1;

    /**
     * Constructs a new lexer.
     * @param source The source code to scan.
     * @param diagnostics The engine for reporting lexical errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this.source = source;
        this.diagnostics = diagnostics;
    }

    /**
     * Scans the whole source.
     * @return The tokens, always ending with an {@link TokenType#END_OF_FILE} token.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            tokenLine = line;
            tokenColumn = start - lineStart + 1;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", line, current - lineStart + 1));
        LOG.debug("Scanned {} tokens from {}", tokens.size(), diagnostics.getSourceName());
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(' -> addToken(TokenType.LEFT_PAREN);
            case ')' -> addToken(TokenType.RIGHT_PAREN);
            case '{' -> addToken(TokenType.LEFT_BRACE);
            case '}' -> addToken(TokenType.RIGHT_BRACE);
            case ',' -> addToken(TokenType.COMMA);
            case '.' -> addToken(TokenType.DOT);
            case '-' -> addToken(TokenType.MINUS);
            case '+' -> addToken(TokenType.PLUS);
            case ';' -> addToken(TokenType.SEMICOLON);
            case '*' -> addToken(TokenType.STAR);
            case '!' -> addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG);
            case '=' -> addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL);
            case '<' -> addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
            case '>' -> addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
            case '/' -> {
                if (match('/')) {
                    // A comment runs until the end of the line.
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else {
                    addToken(TokenType.SLASH);
                }
            }
            case ' ', '\r', '\t' -> {
                // Ignore whitespace.
            }
            case '\n' -> newLine();
            case '"' -> string();
            default -> {
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    diagnostics.reportError(Diagnostic.Phase.LEXICAL,
                            "Unexpected character '" + c + "'.", tokenLine, tokenColumn);
                }
            }
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        addToken(KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER));
    }

    private void number() {
        while (isDigit(peek())) advance();

        // Look for a fractional part.
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }

        addToken(TokenType.NUMBER, Double.parseDouble(source.substring(start, current)));
    }

    private void string() {
        while (peek() != '"' && !isAtEnd()) {
            if (advance() == '\n') newLine();
        }

        if (isAtEnd()) {
            diagnostics.reportError(Diagnostic.Phase.LEXICAL, "Unterminated string.", tokenLine, tokenColumn);
            return;
        }

        advance(); // The closing ".

        // No escape processing: the value is everything between the quotes.
        addToken(TokenType.STRING, source.substring(start + 1, current - 1));
    }

    private void newLine() {
        line++;
        lineStart = current;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;

        current++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        return source.charAt(current++);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object value) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, value, tokenLine, tokenColumn));
    }
}
