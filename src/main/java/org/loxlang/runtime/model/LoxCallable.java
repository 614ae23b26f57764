package org.loxlang.runtime.model;

import org.loxlang.runtime.Interpreter;

import java.util.List;

/**
 * A runtime value that can appear as the callee of a call expression:
 * user functions, bound methods, classes and native functions.
 */
public interface LoxCallable {

    /**
     * Gets the exact number of arguments a call must supply.
     * @return The arity.
     */
    int arity();

    /**
     * Invokes the callable. The caller has already checked the argument count.
     * @param interpreter The interpreter executing the call.
     * @param arguments The evaluated arguments, in order.
     * @return The result value ({@code null} for nil).
     */
    Object call(Interpreter interpreter, List<Object> arguments);
}
