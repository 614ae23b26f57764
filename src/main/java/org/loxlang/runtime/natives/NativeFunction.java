package org.loxlang.runtime.natives;

import org.loxlang.runtime.Interpreter;
import org.loxlang.runtime.model.LoxCallable;

import java.util.List;

/**
 * A built-in global function implemented in Java.
 *
 * @param name The global name.
 * @param arity The exact number of arguments.
 * @param doc The one-line description printed by {@code help}.
 * @param body The implementation.
 */
public record NativeFunction(String name, int arity, String doc, Body body) implements LoxCallable {

    /**
     * Implementation of a native function.
     */
    @FunctionalInterface
    public interface Body {
        /**
         * @param interpreter The interpreter executing the call; gives access to the output
         *                    stream and the current scope.
         * @param arguments The evaluated arguments; the count matches the arity.
         * @return The result value ({@code null} for nil).
         * @throws ArgumentError if an argument has an unsupported kind or value.
         */
        Object apply(Interpreter interpreter, List<Object> arguments);
    }

    /**
     * Raised by a native body for an invalid argument. The interpreter turns it into a
     * runtime error located at the call.
     */
    public static class ArgumentError extends RuntimeException {
        public ArgumentError(String message) {
            super(message);
        }
    }

    @Override
    public Object call(Interpreter interpreter, List<Object> arguments) {
        return body.apply(interpreter, arguments);
    }

    @Override
    public String toString() {
        return "<native fn " + name + ">";
    }
}
