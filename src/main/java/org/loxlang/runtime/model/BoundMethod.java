package org.loxlang.runtime.model;

import org.loxlang.runtime.Environment;
import org.loxlang.runtime.Interpreter;

import java.util.List;

/**
 * A method looked up on an instance. Created lazily on every property access that hits a
 * method; each call binds {@code this} in a fresh scope between the method's closure and
 * its parameter scope.
 *
 * @param receiver The instance supplying {@code this}.
 * @param method The unbound method.
 */
public record BoundMethod(LoxInstance receiver, LoxFunction method) implements LoxCallable {

    @Override
    public int arity() {
        return method.arity();
    }

    @Override
    public Object call(Interpreter interpreter, List<Object> arguments) {
        Environment thisScope = new Environment(method.closure());
        thisScope.define("this", receiver);
        return method.invoke(interpreter, arguments, thisScope);
    }

    @Override
    public String toString() {
        return method.toString();
    }
}
