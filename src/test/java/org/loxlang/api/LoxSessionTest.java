package org.loxlang.api;

import org.loxlang.compiler.diagnostics.Diagnostic;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the run pipeline end to end: stage short-circuiting, outcome classification and
 * state kept across runs of one session.
 */
public class LoxSessionTest {

    private StringWriter output;
    private LoxSession session;

    @BeforeEach
    void setUp() {
        output = new StringWriter();
        session = new LoxSession("test.lox", new PrintWriter(output));
    }

    private String printed() {
        return output.toString().replace(System.lineSeparator(), "\n");
    }

    @Test
    @Tag("integration")
    void successfulRunPrintsAndExitsZero() {
        RunOutcome outcome = session.run("print \"hello\";");

        assertThat(outcome.status()).isEqualTo(RunOutcome.Status.SUCCESS);
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.exitCode()).isZero();
        assertThat(outcome.errorMessages()).isEmpty();
        assertThat(printed()).isEqualTo("hello\n");
    }

    @Test
    @Tag("integration")
    void lexicalAndSyntaxErrorsAreReportedTogetherAndNothingRuns() {
        RunOutcome outcome = session.run("print 1;\nvar x = @;");

        assertThat(outcome.status()).isEqualTo(RunOutcome.Status.STATIC_ERROR);
        assertThat(outcome.exitCode()).isEqualTo(65);
        assertThat(outcome.diagnostics())
                .extracting(Diagnostic::phase)
                .containsExactly(Diagnostic.Phase.LEXICAL, Diagnostic.Phase.SYNTAX);
        assertThat(outcome.errorMessages()).containsExactly(
                "test.lox:2:9: lexical error: Unexpected character '@'.",
                "test.lox:2:10: syntax error: at ';': Expect expression.");
        assertThat(printed()).isEmpty();
    }

    @Test
    @Tag("integration")
    void syntaxErrorsSkipResolution() {
        RunOutcome outcome = session.run("return 1; print ;");

        assertThat(outcome.diagnostics()).hasSize(1);
        assertThat(outcome.diagnostics().get(0).phase()).isEqualTo(Diagnostic.Phase.SYNTAX);
    }

    @Test
    @Tag("integration")
    void resolutionErrorPreventsExecution() {
        RunOutcome outcome = session.run("print \"side effect\";\n{ var a = a; }");

        assertThat(outcome.status()).isEqualTo(RunOutcome.Status.STATIC_ERROR);
        assertThat(outcome.errorMessages())
                .containsExactly("test.lox:2:11: resolution error: Can't read local variable in its own initializer.");
        assertThat(printed()).isEmpty();
    }

    @Test
    @Tag("integration")
    void runtimeErrorHaltsAfterEarlierOutput() {
        RunOutcome outcome = session.run("print 1;\nprint nil + 1;\nprint 2;");

        assertThat(outcome.status()).isEqualTo(RunOutcome.Status.RUNTIME_ERROR);
        assertThat(outcome.exitCode()).isEqualTo(70);
        assertThat(outcome.getRuntimeError()).isPresent();
        assertThat(outcome.errorMessages())
                .containsExactly("test.lox:2: runtime error: Operands must be two numbers or two strings.");
        assertThat(printed()).isEqualTo("1\n");
    }

    @Test
    @Tag("integration")
    void nativeArgumentErrorsBecomeRuntimeErrorsAtTheCall() {
        RunOutcome outcome = session.run("var r = 1;\nprint round(r, -1);");

        assertThat(outcome.errorMessages())
                .containsExactly("test.lox:2: runtime error: round: digits must not be negative.");
    }

    @Test
    @Tag("integration")
    void globalsPersistAcrossRuns() {
        assertThat(session.run("var a = 1;").isSuccess()).isTrue();
        assertThat(session.run("fun inc() { a = a + 1; return a; }").isSuccess()).isTrue();
        assertThat(session.run("print inc(); print inc();").isSuccess()).isTrue();

        assertThat(printed()).isEqualTo("2\n3\n");
    }

    @Test
    @Tag("integration")
    void failedRunDoesNotPoisonTheSession() {
        session.run("var a = \"kept\";");

        assertThat(session.run("print missing;").status()).isEqualTo(RunOutcome.Status.RUNTIME_ERROR);
        assertThat(session.run("print (;").status()).isEqualTo(RunOutcome.Status.STATIC_ERROR);
        assertThat(session.run("{ var b = 2; print a + \" \" + \"local\"; }").isSuccess()).isTrue();

        assertThat(printed()).isEqualTo("kept local\n");
    }

    @Test
    @Tag("integration")
    void staticErrorLeavesNoPartialDefinitions() {
        session.run("var z = 1; return;");

        RunOutcome outcome = session.run("print z;");

        assertThat(outcome.errorMessages()).containsExactly("test.lox:1: runtime error: Undefined variable 'z'.");
    }

    @Test
    @Tag("integration")
    void closuresAndClassesDefinedInEarlierRunsKeepWorking() {
        session.run("class Counter { init() { this.n = 0; } tick() { this.n = this.n + 1; return this.n; } }");
        session.run("var c = Counter();");
        session.run("c.tick();");

        session.run("print c.tick();");

        assertThat(printed()).isEqualTo("2\n");
    }

    @Test
    @Tag("integration")
    void deeplyNestedGroupingIsASyntaxError() {
        String source = "print " + "(".repeat(20000) + "1" + ")".repeat(20000) + ";";

        RunOutcome outcome = session.run(source);

        assertThat(outcome.status()).isEqualTo(RunOutcome.Status.STATIC_ERROR);
        assertThat(outcome.diagnostics())
                .extracting(Diagnostic::message)
                .anySatisfy(message -> assertThat(message).endsWith("Too much nesting."));
        assertThat(session.run("print 1;").isSuccess()).isTrue();
    }

    @Test
    @Tag("integration")
    void deepExpressionsNeverEscapeTheSession() {
        RunOutcome outcome = session.run("print " + "-".repeat(50000) + "1;");

        // Depending on the stack size this either runs or fails in one of the stages.
        assertThat(outcome.errorMessages())
                .allSatisfy(message -> assertThat(message).containsAnyOf("Too much nesting.", "Stack overflow."));

        RunOutcome chain = session.run("var x = 1" + " + 1".repeat(100000) + "; print x;");
        assertThat(chain.errorMessages())
                .allSatisfy(message -> assertThat(message).containsAnyOf("Too much nesting.", "Stack overflow."));

        output.getBuffer().setLength(0);
        assertThat(session.run("print 2;").isSuccess()).isTrue();
        assertThat(printed()).isEqualTo("2\n");
    }

    @Test
    @Tag("integration")
    void exitEndsTheRunWithTheRequestedCode() {
        RunOutcome outcome = session.run("print 1;\nexit(4);\nprint 2;");

        assertThat(outcome.status()).isEqualTo(RunOutcome.Status.EXIT);
        assertThat(outcome.isExitRequested()).isTrue();
        assertThat(outcome.exitCode()).isEqualTo(4);
        assertThat(outcome.errorMessages()).isEmpty();
        assertThat(printed()).isEqualTo("1\n");

        assertThat(session.run("quit();").exitCode()).isZero();
    }

    @Test
    @Tag("integration")
    void localClosureFromAnEarlierRunKeepsItsScope() {
        session.run("fun make() { var n = 10; fun get() { return n; } return get; }");
        session.run("var get = make();");

        session.run("{ var n = 99; print get(); }");

        assertThat(printed()).isEqualTo("10\n");
    }
}
