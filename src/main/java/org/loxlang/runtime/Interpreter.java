package org.loxlang.runtime;

import org.loxlang.compiler.frontend.lexer.Token;
import org.loxlang.compiler.frontend.lexer.TokenType;
import org.loxlang.compiler.frontend.parser.ast.Expr;
import org.loxlang.compiler.frontend.parser.ast.Stmt;
import org.loxlang.compiler.frontend.semantics.ScopeDepthTable;
import org.loxlang.runtime.model.LoxCallable;
import org.loxlang.runtime.model.LoxClass;
import org.loxlang.runtime.model.LoxFunction;
import org.loxlang.runtime.model.LoxInstance;
import org.loxlang.runtime.model.Values;
import org.loxlang.runtime.natives.NativeFunction;
import org.loxlang.runtime.natives.NativeFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Tree-walking evaluator for resolved programs.
 * <p>
 * Expressions evaluate to runtime values (see {@link Values}); statements execute to an
 * {@link ExecutionResult} that carries {@code break}, {@code continue} and {@code return}
 * upwards. Variable accesses use the depths recorded by the resolver in the
 * {@link ScopeDepthTable} of the program being run; accesses without a recorded depth go to
 * the global environment. Functions keep the table of the program that declared them, so a
 * table lives only as long as the program or its closures.
 * <p>
 * The global environment lives as long as the interpreter, so an interpreter can run any
 * number of programs in sequence (one per interactive input line) that share globals.
 */
public class Interpreter implements Expr.Visitor<Object>, Stmt.Visitor<ExecutionResult> {

    private static final Logger LOG = LoggerFactory.getLogger(Interpreter.class);

    private final Environment globals = new Environment();
    private final PrintWriter out;
    private final InterpreterOptions options;

    private Environment environment = globals;
    private ScopeDepthTable depths = new ScopeDepthTable();
    private int callDepth = 0;

    /**
     * Creates an interpreter with a system clock.
     * @param out The stream {@code print} writes to.
     * @param options The runtime options.
     */
    public Interpreter(PrintWriter out, InterpreterOptions options) {
        this(out, options, Clock.systemUTC());
    }

    /**
     * Creates an interpreter.
     * @param out The stream {@code print} writes to.
     * @param options The runtime options.
     * @param clock The time source of the {@code clock()} built-in.
     */
    public Interpreter(PrintWriter out, InterpreterOptions options, Clock clock) {
        this.out = out;
        this.options = options;
        NativeFunctions.registerAll(globals, options, clock);
    }

    public Environment getGlobals() {
        return globals;
    }

    /**
     * Gets the scope the interpreter is currently executing in. Native functions run in
     * their caller's scope.
     * @return The innermost active environment.
     */
    public Environment currentEnvironment() {
        return environment;
    }

    /**
     * Writes one line to the program output and flushes it.
     * @param text The line without its terminator.
     */
    public void printLine(String text) {
        out.println(text);
        out.flush();
    }

    /**
     * Executes resolved top-level statements in order.
     * @param statements The statements.
     * @param programDepths The depths the resolver recorded for these statements.
     * @throws RuntimeError on the first runtime error; later statements are not executed.
     */
    public void interpret(List<Stmt> statements, ScopeDepthTable programDepths) {
        LOG.debug("Executing {} top-level statements", statements.size());
        this.depths = programDepths;
        for (Stmt statement : statements) {
            ExecutionResult result = execute(statement);
            if (!result.isNormal()) {
                // The resolver rejects return/break/continue outside of functions and loops.
                throw new IllegalStateException("Control signal escaped to top level: " + result);
            }
        }
    }

    /**
     * Executes statements in the given environment and restores the current one afterwards,
     * also when a control signal or runtime error ends the block early.
     * @param statements The statements.
     * @param blockEnvironment The environment for the block.
     * @return {@link ExecutionResult#NORMAL}, or the first control signal raised.
     */
    public ExecutionResult executeBlock(List<Stmt> statements, Environment blockEnvironment) {
        Environment previous = this.environment;
        try {
            this.environment = blockEnvironment;

            for (Stmt statement : statements) {
                ExecutionResult result = execute(statement);
                if (!result.isNormal()) {
                    return result;
                }
            }
            return ExecutionResult.NORMAL;
        } finally {
            this.environment = previous;
        }
    }

    /**
     * Executes a function body: like {@link #executeBlock(List, Environment)}, but variable
     * depths are looked up in the table of the program that declared the function.
     * @param statements The body.
     * @param bodyEnvironment The parameter scope.
     * @param bodyDepths The declaring program's depth table.
     * @return {@link ExecutionResult#NORMAL}, or the first control signal raised.
     */
    public ExecutionResult executeBody(List<Stmt> statements, Environment bodyEnvironment, ScopeDepthTable bodyDepths) {
        ScopeDepthTable previous = this.depths;
        try {
            this.depths = bodyDepths;
            return executeBlock(statements, bodyEnvironment);
        } finally {
            this.depths = previous;
        }
    }

    private ExecutionResult execute(Stmt stmt) {
        return stmt.accept(this);
    }

    private Object evaluate(Expr expr) {
        return expr.accept(this);
    }

    // --- Statements ---

    @Override
    public ExecutionResult visitBlock(Stmt.Block stmt) {
        return executeBlock(stmt.statements(), new Environment(environment));
    }

    @Override
    public ExecutionResult visitClass(Stmt.Class stmt) {
        LoxClass superclass = null;
        if (stmt.superclass() != null) {
            Object value = evaluate(stmt.superclass());
            if (!(value instanceof LoxClass klass)) {
                throw new RuntimeError(stmt.superclass().name(), "Superclass must be a class.");
            }
            superclass = klass;
        }

        // Methods of a subclass close over an extra scope binding "super".
        Environment methodScope = environment;
        if (superclass != null) {
            methodScope = new Environment(environment);
            methodScope.define("super", superclass);
        }

        Map<String, LoxFunction> methods = new HashMap<>();
        for (Stmt.Function method : stmt.methods()) {
            boolean initializer = method.name().text().equals("init");
            methods.put(method.name().text(), new LoxFunction(method, methodScope, initializer, depths));
        }

        environment.define(stmt.name().text(), new LoxClass(stmt.name().text(), superclass, methods));
        return ExecutionResult.NORMAL;
    }

    @Override
    public ExecutionResult visitExpression(Stmt.Expression stmt) {
        evaluate(stmt.expression());
        return ExecutionResult.NORMAL;
    }

    @Override
    public ExecutionResult visitFunction(Stmt.Function stmt) {
        environment.define(stmt.name().text(), new LoxFunction(stmt, environment, false, depths));
        return ExecutionResult.NORMAL;
    }

    @Override
    public ExecutionResult visitIf(Stmt.If stmt) {
        if (Values.isTruthy(evaluate(stmt.condition()))) {
            return execute(stmt.thenBranch());
        } else if (stmt.elseBranch() != null) {
            return execute(stmt.elseBranch());
        }
        return ExecutionResult.NORMAL;
    }

    @Override
    public ExecutionResult visitPrint(Stmt.Print stmt) {
        Object value = evaluate(stmt.expression());
        printLine(Values.stringify(value));
        return ExecutionResult.NORMAL;
    }

    @Override
    public ExecutionResult visitReturn(Stmt.Return stmt) {
        Object value = stmt.value() == null ? null : evaluate(stmt.value());
        return new ExecutionResult.ReturnSignal(value);
    }

    @Override
    public ExecutionResult visitBreak(Stmt.Break stmt) {
        return ExecutionResult.BREAK;
    }

    @Override
    public ExecutionResult visitContinue(Stmt.Continue stmt) {
        return ExecutionResult.CONTINUE;
    }

    @Override
    public ExecutionResult visitVar(Stmt.Var stmt) {
        Object value = stmt.initializer() == null ? null : evaluate(stmt.initializer());
        environment.define(stmt.name().text(), value);
        return ExecutionResult.NORMAL;
    }

    @Override
    public ExecutionResult visitWhile(Stmt.While stmt) {
        while (Values.isTruthy(evaluate(stmt.condition()))) {
            ExecutionResult result = execute(stmt.body());
            if (result instanceof ExecutionResult.BreakSignal) {
                break;
            }
            if (result instanceof ExecutionResult.ReturnSignal) {
                return result;
            }
            // Normal completion and continue both fall through to the increment.
            if (stmt.increment() != null) {
                evaluate(stmt.increment());
            }
        }
        return ExecutionResult.NORMAL;
    }

    // --- Expressions ---

    @Override
    public Object visitAssign(Expr.Assign expr) {
        Object value = evaluate(expr.value());

        OptionalInt depth = depths.depthOf(expr);
        if (depth.isPresent()) {
            environment.assignAt(depth.getAsInt(), expr.name(), value);
        } else {
            globals.assign(expr.name(), value);
        }

        return value;
    }

    @Override
    public Object visitBinary(Expr.Binary expr) {
        Object left = evaluate(expr.left());
        Object right = evaluate(expr.right());
        Token operator = expr.operator();

        return switch (operator.type()) {
            case BANG_EQUAL -> !Values.isEqual(left, right);
            case EQUAL_EQUAL -> Values.isEqual(left, right);
            case GREATER -> {
                checkNumberOperands(operator, left, right);
                yield (double) left > (double) right;
            }
            case GREATER_EQUAL -> {
                checkNumberOperands(operator, left, right);
                yield (double) left >= (double) right;
            }
            case LESS -> {
                checkNumberOperands(operator, left, right);
                yield (double) left < (double) right;
            }
            case LESS_EQUAL -> {
                checkNumberOperands(operator, left, right);
                yield (double) left <= (double) right;
            }
            case MINUS -> {
                checkNumberOperands(operator, left, right);
                yield (double) left - (double) right;
            }
            case SLASH -> {
                checkNumberOperands(operator, left, right);
                yield (double) left / (double) right;
            }
            case STAR -> {
                checkNumberOperands(operator, left, right);
                yield (double) left * (double) right;
            }
            case PLUS -> {
                if (left instanceof Double x && right instanceof Double y) {
                    yield x + y;
                }
                if (left instanceof String x && right instanceof String y) {
                    yield x + y;
                }
                throw new RuntimeError(operator, "Operands must be two numbers or two strings.");
            }
            default -> throw new IllegalStateException("Unexpected binary operator " + operator.type());
        };
    }

    @Override
    public Object visitCall(Expr.Call expr) {
        Object callee = evaluate(expr.callee());

        List<Object> arguments = new ArrayList<>();
        for (Expr argument : expr.arguments()) {
            arguments.add(evaluate(argument));
        }

        if (!(callee instanceof LoxCallable function)) {
            throw new RuntimeError(expr.paren(), "Can only call functions and classes.");
        }

        if (arguments.size() != function.arity()) {
            throw new RuntimeError(expr.paren(),
                    "Expected " + function.arity() + " arguments but got " + arguments.size() + ".");
        }

        return invoke(function, arguments, expr.paren());
    }

    private Object invoke(LoxCallable function, List<Object> arguments, Token paren) {
        if (callDepth >= options.maxCallDepth()) {
            throw new RuntimeError(paren, "Stack overflow.");
        }

        callDepth++;
        try {
            return function.call(this, arguments);
        } catch (NativeFunction.ArgumentError e) {
            throw new RuntimeError(paren, e.getMessage());
        } catch (StackOverflowError e) {
            // The JVM stack ran out before the configured call depth was reached.
            throw new RuntimeError(paren, "Stack overflow.");
        } finally {
            callDepth--;
        }
    }

    @Override
    public Object visitGet(Expr.Get expr) {
        Object object = evaluate(expr.object());
        if (object instanceof LoxInstance instance) {
            return instance.get(expr.name());
        }

        throw new RuntimeError(expr.name(), "Only instances have properties.");
    }

    @Override
    public Object visitGrouping(Expr.Grouping expr) {
        return evaluate(expr.expression());
    }

    @Override
    public Object visitLiteral(Expr.Literal expr) {
        return expr.value();
    }

    @Override
    public Object visitLogical(Expr.Logical expr) {
        Object left = evaluate(expr.left());

        if (expr.operator().type() == TokenType.OR) {
            if (Values.isTruthy(left)) return left;
        } else {
            if (!Values.isTruthy(left)) return left;
        }

        return evaluate(expr.right());
    }

    @Override
    public Object visitSet(Expr.Set expr) {
        Object object = evaluate(expr.object());

        if (!(object instanceof LoxInstance instance)) {
            throw new RuntimeError(expr.name(), "Only instances have fields.");
        }

        Object value = evaluate(expr.value());
        instance.set(expr.name(), value);
        return value;
    }

    @Override
    public Object visitSuper(Expr.Super expr) {
        int depth = depths.depthOf(expr)
                .orElseThrow(() -> new IllegalStateException("Unresolved 'super' at line " + expr.keyword().line()));
        LoxClass superclass = (LoxClass) environment.getAt(depth, "super");

        // The "this" scope sits directly inside the "super" scope.
        LoxInstance object = (LoxInstance) environment.getAt(depth - 1, "this");

        LoxFunction method = superclass.findMethod(expr.method().text());
        if (method == null) {
            throw new RuntimeError(expr.method(), "Undefined property '" + expr.method().text() + "'.");
        }

        return method.bind(object);
    }

    @Override
    public Object visitThis(Expr.This expr) {
        return lookUpVariable(expr.keyword(), expr);
    }

    @Override
    public Object visitUnary(Expr.Unary expr) {
        Object right = evaluate(expr.right());

        return switch (expr.operator().type()) {
            case BANG -> !Values.isTruthy(right);
            case MINUS -> {
                if (!(right instanceof Double number)) {
                    throw new RuntimeError(expr.operator(), "Operand must be a number.");
                }
                yield -number;
            }
            default -> throw new IllegalStateException("Unexpected unary operator " + expr.operator().type());
        };
    }

    @Override
    public Object visitVariable(Expr.Variable expr) {
        return lookUpVariable(expr.name(), expr);
    }

    private Object lookUpVariable(Token name, Expr expr) {
        OptionalInt depth = depths.depthOf(expr);
        if (depth.isPresent()) {
            return environment.getAt(depth.getAsInt(), name.text());
        }
        return globals.get(name);
    }

    private static void checkNumberOperands(Token operator, Object left, Object right) {
        if (left instanceof Double && right instanceof Double) return;
        throw new RuntimeError(operator, "Operands must be numbers.");
    }
}
