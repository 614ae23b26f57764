package org.loxlang.runtime.model;

import org.loxlang.compiler.frontend.parser.ast.Stmt;
import org.loxlang.compiler.frontend.semantics.ScopeDepthTable;
import org.loxlang.runtime.Environment;
import org.loxlang.runtime.ExecutionResult;
import org.loxlang.runtime.Interpreter;

import java.util.List;

/**
 * A user-defined function or method together with the environment it was declared in.
 * <p>
 * The closure is shared, not copied: every function declared in the same scope sees the same
 * environment, including later assignments to it. Each call creates one new environment for
 * the parameters, parented to the closure rather than to the caller's environment.
 */
public final class LoxFunction implements LoxCallable {

    private final Stmt.Function declaration;
    private final Environment closure;
    private final boolean initializer;
    private final ScopeDepthTable depths;

    /**
     * @param declaration The declaration node.
     * @param closure The environment active where the function was declared.
     * @param initializer Whether this is a class's {@code init} method.
     * @param depths The resolver's depths for the program containing the declaration.
     */
    public LoxFunction(Stmt.Function declaration, Environment closure, boolean initializer, ScopeDepthTable depths) {
        this.declaration = declaration;
        this.closure = closure;
        this.initializer = initializer;
        this.depths = depths;
    }

    public String name() {
        return declaration.name().text();
    }

    public boolean isInitializer() {
        return initializer;
    }

    Environment closure() {
        return closure;
    }

    /**
     * Binds this method to a receiver, supplying {@code this} for calls made through the result.
     * @param receiver The instance the method was looked up on.
     * @return The bound method.
     */
    public BoundMethod bind(LoxInstance receiver) {
        return new BoundMethod(receiver, this);
    }

    @Override
    public int arity() {
        return declaration.params().size();
    }

    @Override
    public Object call(Interpreter interpreter, List<Object> arguments) {
        return invoke(interpreter, arguments, closure);
    }

    /**
     * Runs the body in a new environment parented to {@code parent}.
     * @param parent The closure, or the {@code this} scope of a bound method.
     */
    Object invoke(Interpreter interpreter, List<Object> arguments, Environment parent) {
        Environment environment = new Environment(parent);
        for (int i = 0; i < declaration.params().size(); i++) {
            environment.define(declaration.params().get(i).text(), arguments.get(i));
        }

        ExecutionResult result = interpreter.executeBody(declaration.body(), environment, depths);

        // An initializer always yields its instance, even after a bare "return;".
        if (initializer) {
            return parent.getAt(0, "this");
        }
        if (result instanceof ExecutionResult.ReturnSignal returned) {
            return returned.value();
        }
        return null;
    }

    @Override
    public String toString() {
        return "<fn " + name() + ">";
    }
}
