package org.loxlang.compiler.frontend.semantics;

import org.loxlang.compiler.diagnostics.Diagnostic;
import org.loxlang.compiler.diagnostics.DiagnosticsEngine;
import org.loxlang.compiler.frontend.lexer.Lexer;
import org.loxlang.compiler.frontend.parser.Parser;
import org.loxlang.compiler.frontend.parser.ast.Expr;
import org.loxlang.compiler.frontend.parser.ast.Stmt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests static resolution: scope depths recorded per node and every resolution error.
 */
public class ResolverTest {

    private DiagnosticsEngine diagnostics;
    private ScopeDepthTable depths;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine("test.lox");
        depths = new ScopeDepthTable();
    }

    private List<Stmt> resolve(String source) {
        List<Stmt> statements = new Parser(new Lexer(source, diagnostics).scanTokens(), diagnostics).parse();
        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        new Resolver(depths, diagnostics).resolve(statements);
        return statements;
    }

    private List<String> errorsOf(String source) {
        resolve(source);
        return diagnostics.getDiagnostics().stream().map(Diagnostic::message).toList();
    }

    @Test
    @Tag("unit")
    void globalReferencesHaveNoDepth() {
        List<Stmt> statements = resolve("var g = 1; print g;");

        Expr variable = ((Stmt.Print) statements.get(1)).expression();
        assertThat(depths.depthOf(variable)).isEmpty();
        assertThat(depths.size()).isZero();
    }

    @Test
    @Tag("unit")
    void localReferenceRecordsHopsToDeclaringScope() {
        List<Stmt> statements = resolve("{ var a = 1; { print a; } }");

        Stmt.Block outer = (Stmt.Block) statements.get(0);
        Stmt.Block inner = (Stmt.Block) outer.statements().get(1);
        Expr variable = ((Stmt.Print) inner.statements().get(0)).expression();
        assertThat(depths.depthOf(variable)).hasValue(1);
    }

    @Test
    @Tag("unit")
    void closureCaptureCountsFunctionScopes() {
        List<Stmt> statements = resolve("fun f() { var x; fun g() { return x; } }");

        Stmt.Function f = (Stmt.Function) statements.get(0);
        Stmt.Function g = (Stmt.Function) f.body().get(1);
        Expr captured = ((Stmt.Return) g.body().get(0)).value();
        assertThat(depths.depthOf(captured)).hasValue(1);
    }

    @Test
    @Tag("unit")
    void sameNameAtDifferentSitesResolvesIndependently() {
        List<Stmt> statements = resolve("{ var a; print a; { var a; print a; } }");

        Stmt.Block outer = (Stmt.Block) statements.get(0);
        Expr first = ((Stmt.Print) outer.statements().get(1)).expression();
        Stmt.Block inner = (Stmt.Block) outer.statements().get(2);
        Expr second = ((Stmt.Print) inner.statements().get(1)).expression();

        assertThat(depths.depthOf(first)).hasValue(0);
        assertThat(depths.depthOf(second)).hasValue(0);
        assertThat(depths.size()).isEqualTo(2);
    }

    @Test
    @Tag("unit")
    void thisAndSuperResolveToClassScopes() {
        List<Stmt> statements = resolve("class A {} class B < A { m() { super.m(); return this; } }");

        Stmt.Class b = (Stmt.Class) statements.get(1);
        Stmt.Function method = b.methods().get(0);
        Expr.Call call = (Expr.Call) ((Stmt.Expression) method.body().get(0)).expression();
        Expr thisExpr = ((Stmt.Return) method.body().get(1)).value();

        assertThat(depths.depthOf(thisExpr)).hasValue(1);
        assertThat(depths.depthOf(call.callee())).hasValue(2);
    }

    @Test
    @Tag("unit")
    void readingLocalInItsOwnInitializerIsAnError() {
        assertThat(errorsOf("{ var a = 1; { var a = a; } }"))
                .containsExactly("Can't read local variable in its own initializer.");
    }

    @Test
    @Tag("unit")
    void globalMayReferToItselfInInitializer() {
        assertThat(errorsOf("var a = a;")).isEmpty();
    }

    @Test
    @Tag("unit")
    void duplicateLocalIsAnErrorButGlobalRedeclarationIsNot() {
        assertThat(errorsOf("var a; var a; { var b; var b; }"))
                .containsExactly("Already a variable with this name in this scope.");
    }

    @Test
    @Tag("unit")
    void returnAtTopLevelIsAnError() {
        resolve("return 1;");

        assertThat(diagnostics.getDiagnostics()).hasSize(1);
        Diagnostic error = diagnostics.getDiagnostics().get(0);
        assertThat(error.phase()).isEqualTo(Diagnostic.Phase.RESOLUTION);
        assertThat(error.message()).isEqualTo("Can't return from top-level code.");
        assertThat(error.toString()).isEqualTo("test.lox:1:1: resolution error: Can't return from top-level code.");
    }

    @Test
    @Tag("unit")
    void returningValueFromInitializerIsAnError() {
        assertThat(errorsOf("class A { init() { return 1; } }"))
                .containsExactly("Can't return a value from an initializer.");
    }

    @Test
    @Tag("unit")
    void bareReturnInInitializerIsAllowed() {
        assertThat(errorsOf("class A { init() { return; } }")).isEmpty();
    }

    @Test
    @Tag("unit")
    void breakAndContinueOutsideLoopAreErrors() {
        assertThat(errorsOf("break; continue;")).containsExactly(
                "Can't use 'break' outside of a loop.",
                "Can't use 'continue' outside of a loop.");
    }

    @Test
    @Tag("unit")
    void loopContextDoesNotLeakIntoFunctions() {
        assertThat(errorsOf("while (true) { fun f() { break; } }"))
                .containsExactly("Can't use 'break' outside of a loop.");
    }

    @Test
    @Tag("unit")
    void breakAndContinueInsideLoopsAreAllowed() {
        assertThat(errorsOf("while (true) { if (1) break; else continue; } for (;;) { continue; }")).isEmpty();
    }

    @Test
    @Tag("unit")
    void thisOutsideClassIsAnError() {
        assertThat(errorsOf("print this; fun f() { return this; }")).containsExactly(
                "Can't use 'this' outside of a class.",
                "Can't use 'this' outside of a class.");
    }

    @Test
    @Tag("unit")
    void superOutsideClassIsAnError() {
        assertThat(errorsOf("print super.x;")).containsExactly("Can't use 'super' outside of a class.");
    }

    @Test
    @Tag("unit")
    void superWithoutSuperclassIsAnError() {
        assertThat(errorsOf("class A { m() { super.m(); } }"))
                .containsExactly("Can't use 'super' in a class with no superclass.");
    }

    @Test
    @Tag("unit")
    void classInheritingFromItselfIsAnError() {
        assertThat(errorsOf("class A < A {}")).containsExactly("A class can't inherit from itself.");
    }

    @Test
    @Tag("unit")
    void allErrorsAreCollected() {
        assertThat(errorsOf("return 1;\nbreak;\nprint this;")).hasSize(3);
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::line).containsExactly(1, 2, 3);
    }
}
