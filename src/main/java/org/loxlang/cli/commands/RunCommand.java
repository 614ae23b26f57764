package org.loxlang.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.loxlang.api.LoxSession;
import org.loxlang.api.RunOutcome;
import org.loxlang.cli.CommandLineInterface;
import org.loxlang.runtime.InterpreterOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Runs a script file, or source text given inline, in a fresh session.
 */
@Command(
    name = "run",
    exitCodeOnInvalidInput = 64,
    description = "Run a Lox script"
)
public class RunCommand implements Callable<Integer> {

    static final int EXIT_UNREADABLE_INPUT = 66;

    private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

    @Parameters(
        index = "0",
        arity = "0..1",
        paramLabel = "<script>",
        description = "Path of the script to run"
    )
    private Path script;

    @Option(
        names = {"-c", "--command"},
        paramLabel = "<source>",
        description = "Run the given source text instead of a script file"
    )
    private String inlineSource;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        if ((script == null) == (inlineSource == null)) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Specify either a script path or -c <source>, but not both");
        }

        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();
        final InterpreterOptions options = InterpreterOptions.fromConfig(parent.getConfig());

        final String sourceName;
        final String source;
        if (inlineSource != null) {
            sourceName = "<command>";
            source = inlineSource;
        } else {
            sourceName = script.toString();
            try {
                source = Files.readString(script);
            } catch (IOException e) {
                err.println("Could not read script '" + script + "': " + e.getMessage());
                err.flush();
                return EXIT_UNREADABLE_INPUT;
            }
        }

        LOG.debug("Running {} ({} characters)", sourceName, source.length());
        final RunOutcome outcome = new LoxSession(sourceName, out, options).run(source);
        out.flush();

        outcome.errorMessages().forEach(err::println);
        err.flush();
        return outcome.exitCode();
    }
}
