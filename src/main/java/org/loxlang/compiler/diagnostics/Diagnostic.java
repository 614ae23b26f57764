package org.loxlang.compiler.diagnostics;

/**
 * A single error reported by one of the static stages (lexer, parser, resolver).
 *
 * @param phase      The stage that reported the error.
 * @param message    The human-readable description.
 * @param sourceName The name of the source the error was found in (file name, {@code <repl>}, ...).
 * @param line       The 1-based source line.
 * @param column     The 1-based column, or 0 if unknown.
 */
public record Diagnostic(Phase phase, String message, String sourceName, int line, int column) {

    /**
     * The stage of the front end that produced a diagnostic.
     */
    public enum Phase {
        /** Unrecognized character, unterminated string. */
        LEXICAL("lexical"),
        /** Grammar violation found by the parser. */
        SYNTAX("syntax"),
        /** Misplaced return/break/continue/this/super, self-referential initializer, ... */
        RESOLUTION("resolution");

        private final String label;

        Phase(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    @Override
    public String toString() {
        return sourceName + ":" + line + ":" + column + ": " + phase.label() + " error: " + message;
    }
}
