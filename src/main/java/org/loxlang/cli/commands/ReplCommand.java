package org.loxlang.cli.commands;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

import org.loxlang.api.LoxSession;
import org.loxlang.api.RunOutcome;
import org.loxlang.cli.CommandLineInterface;
import org.loxlang.runtime.InterpreterOptions;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Interactive mode: every input line runs in one persistent session until end of input or
 * until a line calls {@code exit} or {@code quit}.
 */
@Command(
    name = "repl",
    exitCodeOnInvalidInput = 64,
    description = "Start an interactive Lox session (exit with end of input or quit())"
)
public class ReplCommand implements Callable<Integer> {

    static final String DEFAULT_PROMPT = "> ";

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    private Reader input = new InputStreamReader(System.in, StandardCharsets.UTF_8);

    /**
     * Replaces standard input as the source of lines.
     * @param input The reader to read lines from.
     */
    public void setInput(Reader input) {
        this.input = input;
    }

    @Override
    public Integer call() {
        final Config config = parent.getConfig();
        final String prompt = config.hasPath("lox.repl.prompt") ? config.getString("lox.repl.prompt") : DEFAULT_PROMPT;
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final LoxSession session = new LoxSession("<repl>", out, InterpreterOptions.fromConfig(config));
        final BufferedReader reader = new BufferedReader(input);

        try {
            while (true) {
                out.print(prompt);
                out.flush();

                final String line = reader.readLine();
                if (line == null) {
                    out.println();
                    out.flush();
                    return 0;
                }

                final RunOutcome outcome = session.run(line);
                out.flush();
                if (outcome.isExitRequested()) {
                    return outcome.exitCode();
                }
                outcome.errorMessages().forEach(err::println);
                err.flush();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read interactive input", e);
        }
    }
}
