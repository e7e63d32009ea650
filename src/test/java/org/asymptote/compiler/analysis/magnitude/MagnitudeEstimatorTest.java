package org.asymptote.compiler.analysis.magnitude;

import org.asymptote.compiler.analysis.complexity.Bound;
import org.asymptote.compiler.frontend.lexer.Lexer;
import org.asymptote.compiler.frontend.parser.Parser;
import org.asymptote.compiler.frontend.parser.ast.AssignNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class MagnitudeEstimatorTest {

    private final MagnitudeEstimator estimator = new MagnitudeEstimator(Set.of("n", "m"), Map.of("half", Bound.LINEAR));

    private String magnitude(String expression) {
        AssignNode assign = (AssignNode) new Parser(new Lexer("x ← " + expression).scanTokens()).parse().statements().get(0);
        return estimator.estimate(assign.value()).toString();
    }

    @Test
    void arithmeticCombinesMagnitudes() {
        assertThat(magnitude("42")).isEqualTo("1");
        assertThat(magnitude("N")).isEqualTo("n");
        assertThat(magnitude("n + m")).isEqualTo("n");
        assertThat(magnitude("n * m")).isEqualTo("n^2");
        assertThat(magnitude("n / 2")).isEqualTo("n");
        assertThat(magnitude("(n * n) / n")).isEqualTo("n");
        assertThat(magnitude("n ^ 3")).isEqualTo("n^3");
        assertThat(magnitude("2 ^ n")).isEqualTo("2^n");
        assertThat(magnitude("i MOD n")).isEqualTo("n");
        assertThat(magnitude("half - 1")).isEqualTo("n");
    }

    @Test
    void functionsMapToTheirGrowth() {
        assertThat(magnitude("length(A)")).isEqualTo("n");
        assertThat(magnitude("floor(n / 2)")).isEqualTo("n");
        assertThat(magnitude("log(n)")).isEqualTo("log n");
        assertThat(magnitude("sqrt(n)")).isEqualTo("n^0.5");
        assertThat(magnitude("min(n, 10)")).isEqualTo("1");
        assertThat(magnitude("max(n, n * n)")).isEqualTo("n^2");
    }

    @Test
    void unknownShapesAreIndeterminate() {
        assertThat(magnitude("A[i]")).isEqualTo("indeterminate");
        assertThat(magnitude("random(n)")).isEqualTo("indeterminate");
        assertThat(magnitude("1 - n")).isEqualTo("indeterminate");
    }

    @Test
    void nonFiniteExponentsAreIndeterminate() {
        assertThat(magnitude("n ^ 1" + "0".repeat(400))).isEqualTo("indeterminate");
        String huge = "1" + "0".repeat(308);
        assertThat(magnitude("(n ^ " + huge + ") * (n ^ " + huge + ")")).isEqualTo("indeterminate");
    }

    @Test
    void fixpointMarksGrowingCyclesIndeterminate() {
        AssignNode a = (AssignNode) new Parser(new Lexer("a ← b * 2").scanTokens()).parse().statements().get(0);
        AssignNode b = (AssignNode) new Parser(new Lexer("b ← a * n").scanTokens()).parse().statements().get(0);

        VariableMagnitudes magnitudes = VariableMagnitudes.of(List.of(a, b), List.of(), Set.of("n"));

        assertThat(magnitudes.magnitudeOf("a").isDeterminate()).isFalse();
        assertThat(magnitudes.magnitudeOf("n")).isEqualTo(Bound.LINEAR);
        assertThat(magnitudes.isDefined("B")).isTrue();
        assertThat(magnitudes.isDefined("c")).isFalse();
    }

    @Test
    void parametersHaveInputMagnitude() {
        VariableMagnitudes magnitudes = VariableMagnitudes.of(List.of(), List.of("size"), Set.of("n"));

        assertThat(magnitudes.magnitudeOf("size")).isEqualTo(Bound.LINEAR);
        assertThat(magnitudes.isDefined("size")).isTrue();
    }
}
