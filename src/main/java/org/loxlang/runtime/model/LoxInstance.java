package org.loxlang.runtime.model;

import org.loxlang.compiler.frontend.lexer.Token;
import org.loxlang.runtime.RuntimeError;

import java.util.HashMap;
import java.util.Map;

/**
 * An instance of a {@link LoxClass} with its own mutable field map.
 */
public final class LoxInstance {

    private final LoxClass klass;
    private final Map<String, Object> fields = new HashMap<>();

    public LoxInstance(LoxClass klass) {
        this.klass = klass;
    }

    public LoxClass getLoxClass() {
        return klass;
    }

    /**
     * Reads a property: the instance's own fields first, then the methods of its class chain.
     * @param name The property name token.
     * @return The field value, or a method bound to this instance.
     * @throws RuntimeError if neither a field nor a method has that name.
     */
    public Object get(Token name) {
        if (fields.containsKey(name.text())) {
            return fields.get(name.text());
        }

        LoxFunction method = klass.findMethod(name.text());
        if (method != null) {
            return method.bind(this);
        }

        throw new RuntimeError(name, "Undefined property '" + name.text() + "'.");
    }

    /**
     * Writes a field on this instance. Fields never resolve through the class hierarchy.
     * @param name The property name token.
     * @param value The value.
     */
    public void set(Token name, Object value) {
        fields.put(name.text(), value);
    }

    @Override
    public String toString() {
        return "<instance " + klass.name() + ">";
    }
}
