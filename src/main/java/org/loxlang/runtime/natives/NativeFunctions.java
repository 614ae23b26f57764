package org.loxlang.runtime.natives;

import org.loxlang.runtime.Environment;
import org.loxlang.runtime.ExitRequest;
import org.loxlang.runtime.Interpreter;
import org.loxlang.runtime.InterpreterOptions;
import org.loxlang.runtime.model.BoundMethod;
import org.loxlang.runtime.model.LoxClass;
import org.loxlang.runtime.model.LoxFunction;
import org.loxlang.runtime.model.LoxInstance;
import org.loxlang.runtime.model.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;

/**
 * Registry of the built-in global functions: {@code clock}, {@code type}, {@code rand},
 * {@code randint}, {@code round}, {@code help}, {@code dir}, {@code exit} and {@code quit}.
 */
public final class NativeFunctions {

    private static final Logger LOG = LoggerFactory.getLogger(NativeFunctions.class);

    /**
     * Upper bound for the digits of {@code round}. A double has no decimal digits beyond
     * this many places, so larger values could not change the result.
     */
    static final int MAX_ROUND_DIGITS = 340;

    static final String NO_DOCUMENTATION = "No documentation available.";

    private NativeFunctions() {
    }

    /**
     * Defines every built-in in the given global environment.
     *
     * @param globals The global environment of an interpreter.
     * @param options The runtime options; the random seed is taken from here.
     * @param clock The time source for {@code clock()}.
     */
    public static void registerAll(Environment globals, InterpreterOptions options, Clock clock) {
        Random random = options.randomSeed().isPresent()
                ? new Random(options.randomSeed().getAsLong())
                : new Random();

        List<NativeFunction> natives = List.of(
                new NativeFunction("clock", 0, "Returns the seconds elapsed since the Unix epoch.",
                        (interpreter, args) -> clock.millis() / 1000.0),
                new NativeFunction("type", 1, "Returns the name of the type of the given value.",
                        (interpreter, args) -> Values.typeName(args.get(0))),
                new NativeFunction("rand", 0, "Returns a number between 0 (inclusive) and 1 (exclusive).",
                        (interpreter, args) -> random.nextDouble()),
                new NativeFunction("randint", 2, "Returns an integer between the two given bounds, both inclusive.",
                        (interpreter, args) -> randint(random, args.get(0), args.get(1))),
                new NativeFunction("round", 2, "Rounds a number to the given number of decimal digits.",
                        (interpreter, args) -> round(args.get(0), args.get(1))),
                new NativeFunction("help", 1, "Prints the documentation of the given value.",
                        (interpreter, args) -> help(interpreter, args.get(0))),
                new NativeFunction("dir", 0, "Prints the names bound in the current scope.",
                        (interpreter, args) -> dir(interpreter)),
                new NativeFunction("exit", 1, "Ends the program with the given exit code.",
                        (interpreter, args) -> {
                            throw new ExitRequest(exitCode(args.get(0)));
                        }),
                new NativeFunction("quit", 0, "Ends the program with exit code 0.",
                        (interpreter, args) -> {
                            throw new ExitRequest(0);
                        })
        );

        for (NativeFunction function : natives) {
            globals.define(function.name(), function);
        }
        LOG.debug("Registered {} native functions", natives.size());
    }

    /**
     * Describes a value for {@code help}: the callable's name followed by a tab-indented
     * description line.
     * @param value Any runtime value.
     * @return The lines to print.
     */
    static List<String> documentation(Object value) {
        if (value instanceof NativeFunction function) {
            return List.of(function.name(), "\t" + function.doc());
        }
        if (value instanceof LoxFunction function) {
            return List.of(function.name(), "\t" + NO_DOCUMENTATION);
        }
        if (value instanceof BoundMethod method) {
            return List.of(method.method().name(), "\t" + NO_DOCUMENTATION);
        }
        if (value instanceof LoxClass klass) {
            return List.of(klass.name(), "\t" + NO_DOCUMENTATION);
        }
        if (value instanceof LoxInstance instance) {
            return List.of(instance.getLoxClass().name(), "\tA class instance.");
        }
        return List.of(NO_DOCUMENTATION);
    }

    private static Object help(Interpreter interpreter, Object value) {
        documentation(value).forEach(interpreter::printLine);
        return null;
    }

    private static Object dir(Interpreter interpreter) {
        new TreeSet<>(interpreter.currentEnvironment().names()).forEach(interpreter::printLine);
        return null;
    }

    private static int exitCode(Object code) {
        long value = requireInteger("exit", code);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new NativeFunction.ArgumentError("exit: code " + Values.stringify(code) + " is out of range.");
        }
        return (int) value;
    }

    private static Object randint(Random random, Object low, Object high) {
        long lower = requireInteger("randint", low);
        long upper = requireInteger("randint", high);
        if (lower > upper) {
            throw new NativeFunction.ArgumentError(
                    "randint: lower bound " + Values.stringify(low) + " exceeds upper bound " + Values.stringify(high) + ".");
        }
        return (double) (lower + (long) (random.nextDouble() * (upper - lower + 1)));
    }

    private static Object round(Object value, Object digits) {
        if (!(value instanceof Double number)) {
            throw new NativeFunction.ArgumentError("round: value must be a number.");
        }
        long places = requireInteger("round", digits);
        if (places < 0) {
            throw new NativeFunction.ArgumentError("round: digits must not be negative.");
        }
        if (places > MAX_ROUND_DIGITS) {
            throw new NativeFunction.ArgumentError("round: digits must be at most " + MAX_ROUND_DIGITS + ".");
        }
        if (number.isNaN() || number.isInfinite()) {
            return number;
        }
        return BigDecimal.valueOf(number).setScale(Math.toIntExact(places), RoundingMode.HALF_UP).doubleValue();
    }

    private static long requireInteger(String function, Object value) {
        if (value instanceof Double number && !number.isInfinite() && number == Math.rint(number)) {
            return number.longValue();
        }
        throw new NativeFunction.ArgumentError(function + ": expected an integer but got " + Values.stringify(value) + ".");
    }
}
