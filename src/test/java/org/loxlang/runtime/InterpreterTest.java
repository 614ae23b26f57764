package org.loxlang.runtime;

import org.loxlang.compiler.diagnostics.DiagnosticsEngine;
import org.loxlang.compiler.frontend.lexer.Lexer;
import org.loxlang.compiler.frontend.parser.Parser;
import org.loxlang.compiler.frontend.parser.ast.Stmt;
import org.loxlang.compiler.frontend.semantics.Resolver;
import org.loxlang.compiler.frontend.semantics.ScopeDepthTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests evaluation semantics on resolved programs.
 */
public class InterpreterTest {

    private StringWriter output;
    private Interpreter interpreter;

    @BeforeEach
    void setUp() {
        output = new StringWriter();
        interpreter = new Interpreter(new PrintWriter(output), InterpreterOptions.defaults());
    }

    private List<String> run(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine("test.lox");
        List<Stmt> statements = new Parser(new Lexer(source, diagnostics).scanTokens(), diagnostics).parse();
        ScopeDepthTable depths = new ScopeDepthTable();
        new Resolver(depths, diagnostics).resolve(statements);
        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();

        interpreter.interpret(statements, depths);
        return output.toString().lines().toList();
    }

    @Test
    @Tag("unit")
    void arithmeticFollowsPrecedenceAndPrintsTrimmedNumbers() {
        assertThat(run("print 1 + 2 * 3; print (1 + 2) * 3; print 7 / 2; print -4 - -1;"))
                .containsExactly("7", "9", "3.5", "-3");
    }

    @Test
    @Tag("unit")
    void largeAndFractionalNumbersPrintInPlainNotation() {
        assertThat(run("print 10000000 * 10; print 0.1 + 0.2; print 1 / 3;"))
                .containsExactly("100000000", "0.30000000000000004", "0.3333333333333333");
    }

    @Test
    @Tag("unit")
    void divisionByZeroFollowsFloatingPoint() {
        assertThat(run("print 1 / 0; print -1 / 0; print 0 / 0 == 0 / 0;"))
                .containsExactly("inf", "-inf", "false");
    }

    @Test
    @Tag("unit")
    void plusAddsNumbersAndConcatenatesStrings() {
        assertThat(run("print 1 + 2; print \"ab\" + \"cd\";")).containsExactly("3", "abcd");
    }

    @Test
    @Tag("unit")
    void plusWithMixedOperandsIsARuntimeError() {
        assertThatThrownBy(() -> run("print \"a\" + 1;"))
                .isInstanceOf(RuntimeError.class)
                .hasMessage("Operands must be two numbers or two strings.");
    }

    @Test
    @Tag("unit")
    void comparisonAndNegationRequireNumbers() {
        assertThatThrownBy(() -> run("print \"a\" < \"b\";"))
                .isInstanceOf(RuntimeError.class)
                .hasMessage("Operands must be numbers.");
        assertThatThrownBy(() -> run("print -\"a\";"))
                .isInstanceOf(RuntimeError.class)
                .hasMessage("Operand must be a number.");
    }

    @Test
    @Tag("unit")
    void onlyNilAndFalseAreFalsy() {
        assertThat(run("""
                if (nil) print "x"; else print "y";
                if (0) print "x"; else print "y";
                if ("") print "x"; else print "y";
                print !false;
                """)).containsExactly("y", "x", "x", "true");
    }

    @Test
    @Tag("unit")
    void equalityNeverCrossesKinds() {
        assertThat(run("""
                print nil == nil;
                print nil == false;
                print 1 == "1";
                print "a" == "a";
                print 2 == 2.0;
                print true != false;
                """)).containsExactly("true", "false", "false", "true", "true", "true");
    }

    @Test
    @Tag("unit")
    void logicalOperatorsReturnTheDecidingOperand() {
        assertThat(run("print nil or \"default\"; print 1 and 2; print false and missing; print \"x\" or missing;"))
                .containsExactly("default", "2", "false", "x");
    }

    @Test
    @Tag("unit")
    void blocksShadowAndRestoreScopes() {
        assertThat(run("""
                var a = "global";
                {
                  var a = "inner";
                  print a;
                }
                print a;
                """)).containsExactly("inner", "global");
    }

    @Test
    @Tag("unit")
    void closuresKeepIndependentState() {
        assertThat(run("""
                fun makeCounter() {
                  var count = 0;
                  fun increment() {
                    count = count + 1;
                    return count;
                  }
                  return increment;
                }
                var first = makeCounter();
                var second = makeCounter();
                print first();
                print first();
                print second();
                """)).containsExactly("1", "2", "1");
    }

    @Test
    @Tag("unit")
    void closureBindsToDeclarationScopeNotLaterShadow() {
        assertThat(run("""
                var a = "global";
                {
                  fun show() { print a; }
                  show();
                  var a = "block";
                  show();
                }
                """)).containsExactly("global", "global");
    }

    @Test
    @Tag("unit")
    void recursionWorks() {
        assertThat(run("""
                fun fib(n) { if (n < 2) return n; return fib(n - 1) + fib(n - 2); }
                print fib(15);
                """)).containsExactly("610");
    }

    @Test
    @Tag("unit")
    void functionWithoutReturnYieldsNil() {
        assertThat(run("fun f() {} print f(); fun g() { return; } print g();")).containsExactly("nil", "nil");
    }

    @Test
    @Tag("unit")
    void whileLoopHonorsBreakAndContinue() {
        assertThat(run("""
                var i = 0;
                while (true) {
                  i = i + 1;
                  if (i == 2) continue;
                  if (i > 4) break;
                  print i;
                }
                """)).containsExactly("1", "3", "4");
    }

    @Test
    @Tag("unit")
    void continueInForLoopStillRunsIncrement() {
        assertThat(run("for (var i = 0; i < 3; i = i + 1) { if (i == 1) continue; print i; }"))
                .containsExactly("0", "2");
    }

    @Test
    @Tag("unit")
    void breakLeavesOnlyTheInnermostLoop() {
        assertThat(run("""
                for (var i = 0; i < 2; i = i + 1) {
                  for (var j = 0; j < 10; j = j + 1) {
                    if (j == 1) break;
                    print i + j;
                  }
                }
                """)).containsExactly("0", "1");
    }

    @Test
    @Tag("unit")
    void returnInsideLoopLeavesTheFunction() {
        assertThat(run("""
                fun find() {
                  for (var i = 0; i < 10; i = i + 1) {
                    while (true) { if (i == 3) return i; break; }
                  }
                  return -1;
                }
                print find();
                """)).containsExactly("3");
    }

    @Test
    @Tag("unit")
    void classesHaveFieldsMethodsAndInitializers() {
        assertThat(run("""
                class Point {
                  init(x, y) { this.x = x; this.y = y; }
                  sum() { return this.x + this.y; }
                }
                var p = Point(1, 2);
                print p.sum();
                p.x = 10;
                print p.sum();
                print p;
                print Point;
                """)).containsExactly("3", "12", "<instance Point>", "<class Point>");
    }

    @Test
    @Tag("unit")
    void boundMethodRemembersItsReceiver() {
        assertThat(run("""
                class Greeter {
                  init(name) { this.name = name; }
                  greet() { print "hi " + this.name; }
                }
                var greet = Greeter("ada").greet;
                greet();
                print greet;
                """)).containsExactly("hi ada", "<fn greet>");
    }

    @Test
    @Tag("unit")
    void fieldsShadowMethods() {
        assertThat(run("""
                class A { m() { return "method"; } }
                var a = A();
                a.m = "field";
                print a.m;
                """)).containsExactly("field");
    }

    @Test
    @Tag("unit")
    void constructorAlwaysYieldsTheInstance() {
        assertThat(run("""
                class A {
                  init() { this.ready = true; return; print "unreachable"; }
                }
                var a = A();
                print a.ready;
                print a.init();
                """)).containsExactly("true", "<instance A>");
    }

    @Test
    @Tag("unit")
    void overridingMethodIsSelectedAndSuperUsesStaticSuperclass() {
        assertThat(run("""
                class A { method() { print "A method"; } }
                class B < A {
                  method() { print "B method"; }
                  test() { super.method(); }
                }
                class C < B {}
                C().test();
                C().method();
                """)).containsExactly("A method", "B method");
    }

    @Test
    @Tag("unit")
    void initializerIsInherited() {
        assertThat(run("""
                class Base { init(v) { this.v = v; } }
                class Derived < Base { show() { print this.v; } }
                Derived(42).show();
                """)).containsExactly("42");
    }

    @Test
    @Tag("unit")
    void undefinedPropertyHaltsExecution() {
        assertThatThrownBy(() -> run("class A {} var a = A(); print \"before\"; print a.missing; print \"after\";"))
                .isInstanceOf(RuntimeError.class)
                .hasMessage("Undefined property 'missing'.");

        assertThat(output.toString().lines().toList()).containsExactly("before");
    }

    @Test
    @Tag("unit")
    void propertyAccessOnNonInstanceIsAnError() {
        assertThatThrownBy(() -> run("var x = 1; print x.y;"))
                .isInstanceOf(RuntimeError.class)
                .hasMessage("Only instances have properties.");
        assertThatThrownBy(() -> run("var s = \"str\"; s.y = 2;"))
                .isInstanceOf(RuntimeError.class)
                .hasMessage("Only instances have fields.");
    }

    @Test
    @Tag("unit")
    void callingANonCallableIsAnError() {
        assertThatThrownBy(() -> run("\"not a function\"();"))
                .isInstanceOf(RuntimeError.class)
                .hasMessage("Can only call functions and classes.");
    }

    @Test
    @Tag("unit")
    void arityMismatchIsAnError() {
        assertThatThrownBy(() -> run("fun f(a, b) {} f(1);"))
                .isInstanceOf(RuntimeError.class)
                .hasMessage("Expected 2 arguments but got 1.");
        assertThatThrownBy(() -> run("class P { init(x) {} } P();"))
                .isInstanceOf(RuntimeError.class)
                .hasMessage("Expected 1 arguments but got 0.");
    }

    @Test
    @Tag("unit")
    void superclassMustBeAClass() {
        assertThatThrownBy(() -> run("var NotAClass = 1; class A < NotAClass {}"))
                .isInstanceOf(RuntimeError.class)
                .hasMessage("Superclass must be a class.");
    }

    @Test
    @Tag("unit")
    void undefinedVariableIsAnErrorWithLine() {
        assertThatThrownBy(() -> run("var a = 1;\nprint b;"))
                .isInstanceOfSatisfying(RuntimeError.class, e -> {
                    assertThat(e.getMessage()).isEqualTo("Undefined variable 'b'.");
                    assertThat(e.getLine()).isEqualTo(2);
                });
    }

    @Test
    @Tag("unit")
    void unboundedRecursionIsReportedAsStackOverflow() {
        interpreter = new Interpreter(new PrintWriter(output), new InterpreterOptions(50, OptionalLong.empty()));

        assertThatThrownBy(() -> run("fun loop(n) { return loop(n + 1); } loop(0);"))
                .isInstanceOf(RuntimeError.class)
                .hasMessage("Stack overflow.");

        // The call depth unwinds, so the interpreter stays usable.
        assertThat(run("fun f() { return 1; } print f();")).containsExactly("1");
    }

    @Test
    @Tag("unit")
    void environmentIsRestoredAfterRuntimeErrorInsideBlock() {
        assertThatThrownBy(() -> run("var x = \"global\"; { var x = \"local\"; nil(); }"))
                .isInstanceOf(RuntimeError.class);

        assertThat(run("print x;")).containsExactly("global");
    }

    @Test
    @Tag("unit")
    void runningTheSameProgramTwiceIsDeterministic() {
        String source = "var total = 0; for (var i = 1; i <= 4; i = i + 1) total = total + i * i; print total;";

        List<String> first = run(source);
        output.getBuffer().setLength(0);
        List<String> second = run(source);

        assertThat(first).containsExactly("30");
        assertThat(second).isEqualTo(first);
    }

    @Test
    @Tag("unit")
    void displayFormsOfCallables() {
        assertThat(run("fun f() {} class K {} print f; print K; print K(); print clock;"))
                .containsExactly("<fn f>", "<class K>", "<instance K>", "<native fn clock>");
    }

    @Test
    @Tag("unit")
    void closuresKeepTheDepthsOfTheProgramThatDeclaredThem() {
        run("""
                fun counter() {
                  var n = 0;
                  fun inc() { n = n + 1; return n; }
                  return inc;
                }
                var c = counter();
                """);

        // Each run resolves into a fresh table; the closure still finds "n" one scope up.
        assertThat(run("{ var n = 100; print c(); print c(); }")).containsExactly("1", "2");
    }

    @Test
    @Tag("unit")
    void recursionBeyondTheJvmStackIsReportedAsStackOverflow() {
        interpreter = new Interpreter(new PrintWriter(output), new InterpreterOptions(Integer.MAX_VALUE, OptionalLong.empty()));

        assertThatThrownBy(() -> run("fun loop(n) { return loop(n + 1); } loop(0);"))
                .isInstanceOfSatisfying(RuntimeError.class, e -> {
                    assertThat(e.getMessage()).isEqualTo("Stack overflow.");
                    assertThat(e.getLine()).isEqualTo(1);
                });

        assertThat(run("{ var local = 1; } fun f() { return 2; } print f();")).containsExactly("2");
    }

    @Test
    @Tag("unit")
    void helpPrintsTheDocumentationOfAValue() {
        assertThat(run("help(round); fun f() {} help(f); help(1);")).containsExactly(
                "round",
                "\tRounds a number to the given number of decimal digits.",
                "f",
                "\tNo documentation available.",
                "No documentation available.");
    }

    @Test
    @Tag("unit")
    void dirListsTheNamesOfTheCallersScope() {
        assertThat(run("fun f(a) { var b = 2; dir(); } f(1);")).containsExactly("a", "b");
        output.getBuffer().setLength(0);

        assertThat(run("dir();")).contains("clock", "dir", "f", "round");
    }

    @Test
    @Tag("unit")
    void exitUnwindsWithTheRequestedCode() {
        assertThatThrownBy(() -> run("print 1; { exit(3); } print 2;"))
                .isInstanceOfSatisfying(ExitRequest.class, e -> assertThat(e.getExitCode()).isEqualTo(3));
        assertThat(output.toString().lines()).containsExactly("1");

        assertThatThrownBy(() -> run("quit();"))
                .isInstanceOfSatisfying(ExitRequest.class, e -> assertThat(e.getExitCode()).isZero());
        assertThatThrownBy(() -> run("exit(1.5);"))
                .isInstanceOf(RuntimeError.class)
                .hasMessage("exit: expected an integer but got 1.5.");
    }
}
