package org.loxlang.runtime;

/**
 * Raised by the {@code exit} and {@code quit} built-ins. It unwinds the evaluator like a
 * runtime error, but the session reports it as a requested end of the run with the given
 * process exit code rather than as a failure.
 */
public class ExitRequest extends RuntimeException {

    private final int exitCode;

    public ExitRequest(int exitCode) {
        super("exit(" + exitCode + ")", null, false, false);
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
