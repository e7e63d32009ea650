package org.asymptote.compiler.analysis.loops;

import org.asymptote.compiler.analysis.magnitude.VariableMagnitudes;
import org.asymptote.compiler.diagnostics.Diagnostic;
import org.asymptote.compiler.diagnostics.DiagnosticCodes;
import org.asymptote.compiler.diagnostics.DiagnosticsEngine;
import org.asymptote.compiler.frontend.lexer.Lexer;
import org.asymptote.compiler.frontend.parser.Parser;
import org.asymptote.compiler.frontend.parser.ast.AstNode;
import org.asymptote.compiler.frontend.parser.ast.LoopNode;
import org.asymptote.compiler.frontend.parser.ast.SequenceNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Counts the iterations of the last loop of small programs.
 */
@Tag("unit")
class IterationCounterTest {

    private DiagnosticsEngine diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
    }

    private IterationCount count(String source) {
        SequenceNode root = new Parser(new Lexer(source).scanTokens()).parse();
        VariableMagnitudes magnitudes = VariableMagnitudes.of(root.statements(), List.of(), Set.of("n", "m"));
        List<AstNode> statements = root.statements();
        LoopNode loop = (LoopNode) statements.get(statements.size() - 1);
        return new IterationCounter(magnitudes, diagnostics).count(loop);
    }

    @Test
    void literalRangeIsCountedExactly() {
        assertThat(count("FOR i ← 1 TO 10 DO\nEND FOR").exact()).hasValue(10);
        assertThat(count("FOR i ← 1 TO 10 STEP 3 DO\nEND FOR").exact()).hasValue(4);
        assertThat(count("FOR i ← 10 DOWNTO 1 STEP -2 DO\nEND FOR").exact()).hasValue(5);
        assertThat(count("FOR i ← 10 TO 1 DO\nEND FOR").exact()).hasValue(0);
    }

    @Test
    void rangeUpToTheInputSizeIsLinear() {
        IterationCount count = count("FOR i ← 1 TO n DO\nEND FOR");

        assertThat(count.count().thetaLabel()).isEqualTo("Θ(n)");
        assertThat(count.exact()).isEmpty();
    }

    @Test
    void descendingRangeFromSquareIsQuadratic() {
        assertThat(count("FOR i ← n * n DOWNTO 1 DO\nEND FOR").count().thetaLabel()).isEqualTo("Θ(n^2)");
    }

    @Test
    void derivedBoundUsesTheVariableMagnitude() {
        assertThat(count("k ← n / 2\nFOR i ← 1 TO k DO\nEND FOR").count().thetaLabel()).isEqualTo("Θ(n)");
    }

    @Test
    void doublingWhileLoopIsLogarithmic() {
        IterationCount count = count("""
                i ← 1
                WHILE i < n DO
                    i ← i * 2
                END WHILE
                """);

        assertThat(count.count().thetaLabel()).isEqualTo("Θ(log n)");
    }

    @Test
    void halvingRepeatLoopIsLogarithmic() {
        IterationCount count = count("""
                i ← n
                REPEAT
                    i ← i DIV 2
                UNTIL i ≤ 1
                """);

        assertThat(count.count().thetaLabel()).isEqualTo("Θ(log n)");
    }

    @Test
    void dataDependentConjunctDropsTheLowerCount() {
        IterationCount count = count("""
                i ← 1
                WHILE i ≤ n AND A[i] ≠ x DO
                    i ← i + 1
                END WHILE
                """);

        assertThat(count.count().upperLabel()).isEqualTo("O(n)");
        assertThat(count.count().lowerLabel()).isEqualTo("Ω(1)");
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    void ungovernedLoopIsUnresolved() {
        IterationCount count = count("""
                WHILE found = FALSE DO
                    found ← check(x)
                END WHILE
                """);

        assertThat(count.count().upper().isDeterminate()).isFalse();
        assertThat(diagnostics.getDiagnostics())
                .extracting(Diagnostic::code)
                .containsExactly(DiagnosticCodes.UNRESOLVED_LOOP_BOUND);
    }

    @Test
    void updateAwayFromTheBoundIsMalformed() {
        IterationCount count = count("""
                i ← 1
                WHILE i < n DO
                    i ← i - 1
                END WHILE
                """);

        assertThat(count.count().upper().isDeterminate()).isFalse();
        assertThat(diagnostics.getDiagnostics()).singleElement()
                .satisfies(d -> {
                    assertThat(d.code()).isEqualTo(DiagnosticCodes.MALFORMED_LOOP_BOUND);
                    assertThat(d.severity()).isEqualTo(Diagnostic.Severity.ERROR);
                });
    }

    @Test
    void shrinkingRangeAndZeroStepAreMalformed() {
        assertThat(count("FOR i ← n TO 1 DO\nEND FOR").count().upper().isDeterminate()).isFalse();
        assertThat(count("FOR i ← 1 TO n STEP 0 DO\nEND FOR").count().upper().isDeterminate()).isFalse();
        assertThat(diagnostics.getDiagnostics())
                .extracting(Diagnostic::code)
                .containsOnly(DiagnosticCodes.MALFORMED_LOOP_BOUND)
                .hasSize(2);
    }
}
