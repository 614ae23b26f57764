package org.loxlang.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.loxlang.api.RunOutcome;
import org.loxlang.cli.CommandLineInterface;
import org.loxlang.compiler.diagnostics.DiagnosticsEngine;
import org.loxlang.compiler.frontend.lexer.Lexer;
import org.loxlang.compiler.frontend.lexer.Token;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Dumps the token stream of a script, one {@code line:column TYPE lexeme} entry per line.
 */
@Command(
    name = "tokens",
    exitCodeOnInvalidInput = 64,
    description = "Print the tokens of a Lox script"
)
public class TokensCommand implements Callable<Integer> {

    @Parameters(
        index = "0",
        paramLabel = "<script>",
        description = "Path of the script to scan"
    )
    private Path script;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        // Applies the configured log levels; scanning itself has no settings.
        parent.getConfig();

        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final String source;
        try {
            source = Files.readString(script);
        } catch (IOException e) {
            err.println("Could not read script '" + script + "': " + e.getMessage());
            err.flush();
            return RunCommand.EXIT_UNREADABLE_INPUT;
        }

        final DiagnosticsEngine diagnostics = new DiagnosticsEngine(script.toString());
        final List<Token> tokens = new Lexer(source, diagnostics).scanTokens();
        for (Token token : tokens) {
            out.println(token.toString().stripTrailing());
        }
        out.flush();

        if (diagnostics.hasErrors()) {
            diagnostics.getDiagnostics().forEach(err::println);
            err.flush();
            return RunOutcome.Status.STATIC_ERROR.exitCode();
        }
        return 0;
    }
}
