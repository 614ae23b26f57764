package org.loxlang.runtime;

/**
 * The outcome of executing one statement.
 * <p>
 * {@code break}, {@code continue} and {@code return} are not exceptions: every statement
 * executor returns one of these values and composite statements stop executing their
 * children as soon as a child completes with anything other than {@link Normal}.
 * Loops consume {@link BreakSignal} and {@link ContinueSignal}; call sites consume
 * {@link ReturnSignal}.
 */
public sealed interface ExecutionResult {

    /** Shared instance for statements that complete normally. */
    ExecutionResult NORMAL = new Normal();

    /** Shared instance for {@code break}. */
    ExecutionResult BREAK = new BreakSignal();

    /** Shared instance for {@code continue}. */
    ExecutionResult CONTINUE = new ContinueSignal();

    default boolean isNormal() {
        return this instanceof Normal;
    }

    record Normal() implements ExecutionResult {
    }

    record BreakSignal() implements ExecutionResult {
    }

    record ContinueSignal() implements ExecutionResult {
    }

    /**
     * @param value The returned value ({@code null} for nil, including a bare {@code return;}).
     */
    record ReturnSignal(Object value) implements ExecutionResult {
    }
}
