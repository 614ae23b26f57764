package org.loxlang.runtime;

import org.loxlang.compiler.frontend.lexer.Token;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * One lexical scope at run time: a mapping from variable names to values plus a link to the
 * enclosing scope.
 * <p>
 * Environments form a chain from the innermost scope to the global one. A closure keeps a
 * reference to the environment it was declared in, so that environment lives as long as the
 * longest-lived closure that captured it.
 */
public class Environment {

    private final Environment enclosing;
    private final Map<String, Object> values = new HashMap<>();

    /**
     * Creates a global environment.
     */
    public Environment() {
        this(null);
    }

    /**
     * Creates a scope nested in the given one.
     * @param enclosing The enclosing scope, or {@code null} for the global scope.
     */
    public Environment(Environment enclosing) {
        this.enclosing = enclosing;
    }

    public Environment getEnclosing() {
        return enclosing;
    }

    /**
     * Introduces a binding in this scope, replacing any binding of the same name in this scope
     * and shadowing bindings in enclosing scopes.
     * @param name The variable name.
     * @param value The initial value.
     */
    public void define(String name, Object value) {
        values.put(name, value);
    }

    /**
     * Looks a variable up by walking the whole chain, starting at this scope.
     * @param name The variable token, used for error reporting.
     * @return The bound value.
     * @throws RuntimeError if no scope in the chain binds the name.
     */
    public Object get(Token name) {
        for (Environment environment = this; environment != null; environment = environment.enclosing) {
            if (environment.values.containsKey(name.text())) {
                return environment.values.get(name.text());
            }
        }

        throw new RuntimeError(name, "Undefined variable '" + name.text() + "'.");
    }

    /**
     * Looks a variable up in the scope exactly {@code depth} links away.
     * @param depth The resolver-computed scope depth.
     * @param name The variable name.
     * @return The bound value.
     * @throws IllegalStateException if the binding is not where the resolver said it would be.
     */
    public Object getAt(int depth, String name) {
        Map<String, Object> scope = ancestor(depth).values;
        if (!scope.containsKey(name)) {
            throw new IllegalStateException("No binding for '" + name + "' at depth " + depth);
        }
        return scope.get(name);
    }

    /**
     * Assigns to an existing variable found by walking the whole chain.
     * @param name The variable token, used for error reporting.
     * @param value The new value.
     * @throws RuntimeError if no scope in the chain binds the name.
     */
    public void assign(Token name, Object value) {
        for (Environment environment = this; environment != null; environment = environment.enclosing) {
            if (environment.values.containsKey(name.text())) {
                environment.values.put(name.text(), value);
                return;
            }
        }

        throw new RuntimeError(name, "Undefined variable '" + name.text() + "'.");
    }

    /**
     * Assigns to an existing variable in the scope exactly {@code depth} links away.
     * @param depth The resolver-computed scope depth.
     * @param name The variable token.
     * @param value The new value.
     * @throws IllegalStateException if the binding is not where the resolver said it would be.
     */
    public void assignAt(int depth, Token name, Object value) {
        Map<String, Object> scope = ancestor(depth).values;
        if (!scope.containsKey(name.text())) {
            throw new IllegalStateException("No binding for '" + name.text() + "' at depth " + depth);
        }
        scope.put(name.text(), value);
    }

    /**
     * Gets the names bound directly in this scope.
     * @return An unmodifiable view of the names.
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(values.keySet());
    }

    private Environment ancestor(int depth) {
        Environment environment = this;
        for (int i = 0; i < depth; i++) {
            environment = environment.enclosing;
            if (environment == null) {
                throw new IllegalStateException("Scope chain is shorter than resolved depth " + depth);
            }
        }
        return environment;
    }
}
