package org.loxlang.compiler.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DiagnosticsEngineTest {

    @Test
    @Tag("unit")
    void collectsErrorsInReportOrder() {
        DiagnosticsEngine engine = new DiagnosticsEngine("main.lox");

        engine.reportError(Diagnostic.Phase.LEXICAL, "Unexpected character '@'.", 1, 5);
        engine.reportError(Diagnostic.Phase.SYNTAX, "at ';': Expect expression.", 3, 9);

        assertThat(engine.hasErrors()).isTrue();
        assertThat(engine.hasErrors(Diagnostic.Phase.SYNTAX)).isTrue();
        assertThat(engine.hasErrors(Diagnostic.Phase.RESOLUTION)).isFalse();
        assertThat(engine.errorCount()).isEqualTo(2);
        assertThat(engine.summary()).isEqualTo(
                "main.lox:1:5: lexical error: Unexpected character '@'." + System.lineSeparator()
                        + "main.lox:3:9: syntax error: at ';': Expect expression.");
    }

    @Test
    @Tag("unit")
    void diagnosticsListIsReadOnly() {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        engine.reportError(Diagnostic.Phase.RESOLUTION, "Can't return from top-level code.", 1, 1);

        assertThat(engine.getDiagnostics().get(0).sourceName()).isEqualTo("<script>");
        assertThatThrownBy(() -> engine.getDiagnostics().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @Tag("unit")
    void emptyEngineHasNoErrors() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        assertThat(engine.hasErrors()).isFalse();
        assertThat(engine.summary()).isEmpty();
    }
}
