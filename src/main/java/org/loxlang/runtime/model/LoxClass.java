package org.loxlang.runtime.model;

import org.loxlang.runtime.Interpreter;

import java.util.List;
import java.util.Map;

/**
 * A class value: a name, an optional superclass and a method table captured when the class
 * declaration was executed. Calling a class constructs an instance.
 */
public final class LoxClass implements LoxCallable {

    static final String INITIALIZER = "init";

    private final String name;
    private final LoxClass superclass;
    private final Map<String, LoxFunction> methods;

    /**
     * @param name The class name.
     * @param superclass The superclass, or {@code null}.
     * @param methods The methods declared directly in this class.
     */
    public LoxClass(String name, LoxClass superclass, Map<String, LoxFunction> methods) {
        this.name = name;
        this.superclass = superclass;
        this.methods = Map.copyOf(methods);
    }

    public String name() {
        return name;
    }

    public LoxClass superclass() {
        return superclass;
    }

    /**
     * Finds a method in this class or the nearest ancestor declaring it.
     * @param methodName The method name.
     * @return The method, or {@code null} if no class in the chain declares it.
     */
    public LoxFunction findMethod(String methodName) {
        for (LoxClass klass = this; klass != null; klass = klass.superclass) {
            LoxFunction method = klass.methods.get(methodName);
            if (method != null) {
                return method;
            }
        }
        return null;
    }

    @Override
    public int arity() {
        LoxFunction initializer = findMethod(INITIALIZER);
        return initializer == null ? 0 : initializer.arity();
    }

    @Override
    public Object call(Interpreter interpreter, List<Object> arguments) {
        LoxInstance instance = new LoxInstance(this);
        LoxFunction initializer = findMethod(INITIALIZER);
        if (initializer != null) {
            initializer.bind(instance).call(interpreter, arguments);
        }
        return instance;
    }

    @Override
    public String toString() {
        return "<class " + name + ">";
    }
}
