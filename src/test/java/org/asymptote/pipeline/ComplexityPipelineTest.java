package org.asymptote.pipeline;

import org.asymptote.compiler.analysis.complexity.Complexity;
import org.asymptote.compiler.api.AnalysisCancelledException;
import org.asymptote.compiler.api.AnalysisContext;
import org.asymptote.compiler.api.AnalysisOptions;
import org.asymptote.compiler.api.CancellationSignal;
import org.asymptote.compiler.api.LexicalException;
import org.asymptote.compiler.api.ResourceBudget;
import org.asymptote.compiler.api.ResourceLimitExceededException;
import org.asymptote.compiler.api.SyntaxException;
import org.asymptote.patterns.AlgorithmPattern;
import org.asymptote.patterns.AlgorithmPatternMatcher;
import org.asymptote.validation.ExternalJudgement;
import org.asymptote.validation.ValidationCollaborator;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class ComplexityPipelineTest {

    private static final String LINEAR_SEARCH = """
            found ← FALSE
            FOR i ← 1 TO n DO
                IF A[i] = target THEN
                    found ← TRUE
                END IF
            END FOR
            RETURN found
            """;

    @Mock
    private ValidationCollaborator validator;

    private static AnalysisContext context(ResourceBudget budget) {
        return AnalysisContext.start(AnalysisOptions.DEFAULT.withBudget(budget));
    }

    @Test
    void runsLexerParserAndAnalyzer() {
        AnalysisReport report = new ComplexityPipeline().analyze(LINEAR_SEARCH);

        assertThat(report.complexity().thetaLabel()).isEqualTo("Θ(n)");
        assertThat(report.tokenCount()).isPositive();
        assertThat(report.ast().statements()).hasSize(3);
        assertThat(report.fingerprint()).isEqualTo(ComplexityPipeline.fingerprint(LINEAR_SEARCH)).hasSize(64);
        assertThat(report.algorithmHint()).isEmpty();
        assertThat(report.validation()).isEmpty();
    }

    @Test
    void propagatesLexicalAndSyntaxErrors() {
        ComplexityPipeline pipeline = new ComplexityPipeline();

        assertThatThrownBy(() -> pipeline.analyze("x ← 1 $")).isInstanceOf(LexicalException.class);
        assertThatThrownBy(() -> pipeline.analyze("FOR i ← 1 TO n DO\n x ← 1")).isInstanceOf(SyntaxException.class);
    }

    @Test
    void enforcesTheBudgetOfTheContext() {
        ComplexityPipeline pipeline = new ComplexityPipeline();

        assertThatThrownBy(() -> pipeline.analyze(LINEAR_SEARCH, context(ResourceBudget.DEFAULT.withMaxTokens(10))))
                .isInstanceOfSatisfying(ResourceLimitExceededException.class,
                        e -> assertThat(e.getLimit()).isEqualTo(ResourceLimitExceededException.Limit.TOKENS));
        assertThatThrownBy(() -> pipeline.analyze(LINEAR_SEARCH, context(ResourceBudget.DEFAULT.withTimeout(Duration.ofNanos(1)))))
                .isInstanceOfSatisfying(ResourceLimitExceededException.class,
                        e -> assertThat(e.getLimit()).isEqualTo(ResourceLimitExceededException.Limit.DEADLINE));
    }

    @Test
    void stopsWhenCancelled() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();

        assertThatThrownBy(() -> new ComplexityPipeline().analyze(LINEAR_SEARCH,
                AnalysisContext.start(AnalysisOptions.DEFAULT, signal)))
                .isInstanceOf(AnalysisCancelledException.class);
    }

    @Test
    void sizeVariablesComeFromTheOptions() {
        String source = "FOR i ← 1 TO len DO\nEND FOR";
        ComplexityPipeline pipeline = new ComplexityPipeline();

        AnalysisReport defaults = pipeline.analyze(source);
        AnalysisReport custom = pipeline.analyze(source,
                AnalysisContext.start(new AnalysisOptions(ResourceBudget.DEFAULT, Set.of("LEN"))));

        assertThat(defaults.complexity().thetaLabel()).isEqualTo("Θ(1)");
        assertThat(custom.complexity().thetaLabel()).isEqualTo("Θ(n)");
    }

    @Test
    void cachesReportsByFingerprintAndOptions() {
        AnalysisCache cache = new AnalysisCache(10, Duration.ofMinutes(1));
        ComplexityPipeline pipeline = new ComplexityPipeline(cache, null, null);

        AnalysisReport first = pipeline.analyze(LINEAR_SEARCH);
        AnalysisReport second = pipeline.analyze(LINEAR_SEARCH);
        pipeline.analyze(LINEAR_SEARCH, context(ResourceBudget.DEFAULT.withMaxDepth(32)));

        assertThat(second).isSameAs(first);
        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.stats().hitCount()).isEqualTo(1);
    }

    @Test
    void attachesTheKnownAlgorithmHint() {
        AlgorithmPatternMatcher matcher = new AlgorithmPatternMatcher(List.of(
                new AlgorithmPattern("linear-search", "Linear Search", "Brute force", "O(n)",
                        List.of("found", "target", "for"))));

        AnalysisReport report = new ComplexityPipeline(null, matcher, null).analyze(LINEAR_SEARCH);

        assertThat(report.algorithmHint()).hasValueSatisfying(hint -> {
            assertThat(hint.pattern().id()).isEqualTo("linear-search");
            assertThat(hint.hits()).isEqualTo(3);
        });
    }

    @Test
    void comparesTheValidatorJudgement() {
        when(validator.judge(eq(LINEAR_SEARCH), any(Complexity.class)))
                .thenReturn(new ExternalJudgement("O(n)", "Omega(n)", "Θ(n^2)", "scans every element"));

        AnalysisReport report = new ComplexityPipeline(null, null, validator).analyze(LINEAR_SEARCH);

        assertThat(report.validation()).hasValueSatisfying(comparison -> {
            assertThat(comparison.agreementScore()).isEqualTo(66.67);
            assertThat(comparison.allMatch()).isFalse();
            assertThat(comparison.explanation()).isEqualTo("scans every element");
        });
        assertThat(report.complexity().thetaLabel()).isEqualTo("Θ(n)");
    }

    @Test
    void validatorFailureIsIgnored() {
        when(validator.judge(anyString(), any(Complexity.class))).thenThrow(new IllegalStateException("service down"));

        AnalysisReport report = new ComplexityPipeline(null, null, validator).analyze(LINEAR_SEARCH);

        assertThat(report.validation()).isEmpty();
        assertThat(report.complexity().thetaLabel()).isEqualTo("Θ(n)");
    }

    @Test
    void validationRunsOnCachedReportsToo() {
        when(validator.judge(anyString(), any(Complexity.class)))
                .thenReturn(new ExternalJudgement("O(n)", "Ω(n)", "Θ(n)", null));
        ComplexityPipeline pipeline = new ComplexityPipeline(new AnalysisCache(10, Duration.ofMinutes(1)), null, validator);

        pipeline.analyze(LINEAR_SEARCH);
        AnalysisReport cached = pipeline.analyze(LINEAR_SEARCH);

        verify(validator, times(2)).judge(anyString(), any(Complexity.class));
        assertThat(cached.validation()).hasValueSatisfying(comparison -> {
            assertThat(comparison.agreementScore()).isEqualTo(100.0);
            assertThat(comparison.explanation()).isEqualTo("No explanation provided.");
        });
    }
}
