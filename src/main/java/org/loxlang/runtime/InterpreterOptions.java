package org.loxlang.runtime;

import com.typesafe.config.Config;

import java.util.OptionalLong;

/**
 * Typed view of the {@code lox.runtime} configuration block.
 *
 * @param maxCallDepth The deepest allowed nesting of calls before {@code Stack overflow.} is raised.
 * @param randomSeed   The seed for the random built-ins, or empty for a time-based seed.
 */
public record InterpreterOptions(int maxCallDepth, OptionalLong randomSeed) {

    public static final int DEFAULT_MAX_CALL_DEPTH = 1000;

    public InterpreterOptions {
        if (maxCallDepth < 1) {
            throw new IllegalArgumentException("max-call-depth must be positive, got " + maxCallDepth);
        }
    }

    /**
     * Options used when no configuration is supplied.
     * @return The default options.
     */
    public static InterpreterOptions defaults() {
        return new InterpreterOptions(DEFAULT_MAX_CALL_DEPTH, OptionalLong.empty());
    }

    /**
     * Reads the options from the {@code lox.runtime} block of the given configuration.
     * Missing keys fall back to the defaults.
     *
     * @param config The application configuration.
     * @return The parsed options.
     * @throws com.typesafe.config.ConfigException if a present key has the wrong type.
     */
    public static InterpreterOptions fromConfig(Config config) {
        int maxCallDepth = config.hasPath("lox.runtime.max-call-depth")
                ? config.getInt("lox.runtime.max-call-depth")
                : DEFAULT_MAX_CALL_DEPTH;
        OptionalLong seed = config.hasPath("lox.runtime.random-seed")
                ? OptionalLong.of(config.getLong("lox.runtime.random-seed"))
                : OptionalLong.empty();
        return new InterpreterOptions(maxCallDepth, seed);
    }
}
