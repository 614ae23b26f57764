package org.loxlang.api;

import org.loxlang.compiler.diagnostics.Diagnostic;
import org.loxlang.runtime.RuntimeError;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The result of running one piece of source text through a {@link LoxSession}.
 *
 * @param status How the run ended.
 * @param sourceName The name used when rendering errors.
 * @param diagnostics The static errors; empty unless the status is {@link Status#STATIC_ERROR}.
 * @param runtimeError The error that halted execution; {@code null} unless the status is
 *                     {@link Status#RUNTIME_ERROR}.
 * @param requestedExitCode The code passed to {@code exit}; only meaningful for {@link Status#EXIT}.
 */
public record RunOutcome(Status status, String sourceName, List<Diagnostic> diagnostics, RuntimeError runtimeError,
                         int requestedExitCode) {

    /**
     * How a run ended, with the process exit code conventionally used for it.
     */
    public enum Status {
        SUCCESS(0),
        STATIC_ERROR(65),
        RUNTIME_ERROR(70),
        /** The program called {@code exit} or {@code quit}; the program chose the code. */
        EXIT(0);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }

    public RunOutcome {
        diagnostics = List.copyOf(diagnostics);
    }

    static RunOutcome success(String sourceName) {
        return new RunOutcome(Status.SUCCESS, sourceName, List.of(), null, 0);
    }

    static RunOutcome staticErrors(String sourceName, List<Diagnostic> diagnostics) {
        return new RunOutcome(Status.STATIC_ERROR, sourceName, diagnostics, null, 0);
    }

    static RunOutcome runtimeFailure(String sourceName, RuntimeError error) {
        return new RunOutcome(Status.RUNTIME_ERROR, sourceName, List.of(), error, 0);
    }

    static RunOutcome exit(String sourceName, int exitCode) {
        return new RunOutcome(Status.EXIT, sourceName, List.of(), null, exitCode);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    /**
     * Gets the process exit code for this outcome.
     * @return The status's conventional code, or the code requested through {@code exit}.
     */
    public int exitCode() {
        return status == Status.EXIT ? requestedExitCode : status.exitCode();
    }

    /**
     * Checks whether the program asked to end the process.
     * @return true after a call to {@code exit} or {@code quit}.
     */
    public boolean isExitRequested() {
        return status == Status.EXIT;
    }

    public Optional<RuntimeError> getRuntimeError() {
        return Optional.ofNullable(runtimeError);
    }

    /**
     * Renders every error of this run for the error stream, one message per entry.
     * @return The diagnostics, or the single runtime error, or an empty list on success.
     */
    public List<String> errorMessages() {
        List<String> messages = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            messages.add(diagnostic.toString());
        }
        if (runtimeError != null) {
            messages.add(sourceName + ":" + runtimeError.getLine() + ": runtime error: " + runtimeError.getMessage());
        }
        return messages;
    }
}
