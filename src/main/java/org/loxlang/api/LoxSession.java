package org.loxlang.api;

import org.loxlang.compiler.diagnostics.Diagnostic;
import org.loxlang.compiler.diagnostics.DiagnosticsEngine;
import org.loxlang.compiler.frontend.lexer.Lexer;
import org.loxlang.compiler.frontend.lexer.Token;
import org.loxlang.compiler.frontend.parser.Parser;
import org.loxlang.compiler.frontend.parser.ast.Stmt;
import org.loxlang.compiler.frontend.semantics.Resolver;
import org.loxlang.compiler.frontend.semantics.ScopeDepthTable;
import org.loxlang.runtime.ExitRequest;
import org.loxlang.runtime.Interpreter;
import org.loxlang.runtime.InterpreterOptions;
import org.loxlang.runtime.RuntimeError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.time.Clock;
import java.util.List;

/**
 * Runs Lox source text through the scan, parse, resolve and execute stages.
 * <p>
 * A session owns one interpreter, and with it one global environment, for its whole
 * lifetime. Script mode uses a session for a single {@link #run(String)}; interactive mode
 * calls {@link #run(String)} once per input line so that later lines see the globals of
 * earlier ones. A failed run leaves the session usable.
 * <p>
 * Stages short-circuit: any lexical or syntax error skips resolution, and any resolution
 * error skips execution. A call to {@code exit} or {@code quit} ends the run with
 * {@link RunOutcome.Status#EXIT}.
 */
public class LoxSession {

    private static final Logger LOG = LoggerFactory.getLogger(LoxSession.class);

    private final String sourceName;
    private final Interpreter interpreter;

    /**
     * Creates a session with default runtime options.
     * @param sourceName The name used in error messages, e.g. the script path.
     * @param out The stream {@code print} writes to.
     */
    public LoxSession(String sourceName, PrintWriter out) {
        this(sourceName, out, InterpreterOptions.defaults());
    }

    /**
     * Creates a session.
     * @param sourceName The name used in error messages, e.g. the script path.
     * @param out The stream {@code print} writes to.
     * @param options The runtime options.
     */
    public LoxSession(String sourceName, PrintWriter out, InterpreterOptions options) {
        this(sourceName, out, options, Clock.systemUTC());
    }

    LoxSession(String sourceName, PrintWriter out, InterpreterOptions options, Clock clock) {
        this.sourceName = sourceName;
        this.interpreter = new Interpreter(out, options, clock);
    }

    public String getSourceName() {
        return sourceName;
    }

    /**
     * Runs source text against this session's state.
     * @param source The program text.
     * @return The outcome; never {@code null}.
     */
    public RunOutcome run(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine(sourceName);

        List<Token> tokens = new Lexer(source, diagnostics).scanTokens();
        List<Stmt> statements = new Parser(tokens, diagnostics).parse();
        if (diagnostics.hasErrors()) {
            LOG.debug("{}: {} static error(s) before resolution", sourceName, diagnostics.errorCount());
            return RunOutcome.staticErrors(sourceName, diagnostics.getDiagnostics());
        }

        // Deeply nested trees can exhaust the JVM stack in the later stages. Those errors have
        // no better location than the start of the input.
        Token start = tokens.get(0);
        ScopeDepthTable depths = new ScopeDepthTable();
        try {
            new Resolver(depths, diagnostics).resolve(statements);
        } catch (StackOverflowError e) {
            diagnostics.reportError(Diagnostic.Phase.RESOLUTION, "Too much nesting.", start.line(), start.column());
        }
        if (diagnostics.hasErrors()) {
            LOG.debug("{}: {} resolution error(s)", sourceName, diagnostics.errorCount());
            return RunOutcome.staticErrors(sourceName, diagnostics.getDiagnostics());
        }

        try {
            interpreter.interpret(statements, depths);
            return RunOutcome.success(sourceName);
        } catch (RuntimeError e) {
            LOG.debug("{}: runtime error at line {}: {}", sourceName, e.getLine(), e.getMessage());
            return RunOutcome.runtimeFailure(sourceName, e);
        } catch (ExitRequest e) {
            LOG.debug("{}: program requested exit code {}", sourceName, e.getExitCode());
            return RunOutcome.exit(sourceName, e.getExitCode());
        } catch (StackOverflowError e) {
            LOG.debug("{}: stack exhausted outside of a call", sourceName);
            return RunOutcome.runtimeFailure(sourceName, new RuntimeError(start, "Stack overflow."));
        }
    }
}
