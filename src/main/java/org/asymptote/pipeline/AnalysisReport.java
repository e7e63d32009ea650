package org.asymptote.pipeline;

import org.asymptote.compiler.analysis.AnalysisResult;
import org.asymptote.compiler.analysis.complexity.Complexity;
import org.asymptote.compiler.diagnostics.Diagnostic;
import org.asymptote.compiler.frontend.parser.ast.SequenceNode;
import org.asymptote.patterns.AlgorithmMatch;
import org.asymptote.validation.ComparisonResult;

import java.util.List;
import java.util.Optional;

/**
 * Everything one analysis request produced. Immutable; consumers serialize it but never change it.
 */
public final class AnalysisReport {

    private final String fingerprint;
    private final int tokenCount;
    private final SequenceNode ast;
    private final AnalysisResult result;
    private final AlgorithmMatch algorithmHint;
    private final ComparisonResult validation;

    AnalysisReport(String fingerprint, int tokenCount, SequenceNode ast, AnalysisResult result,
                   AlgorithmMatch algorithmHint, ComparisonResult validation) {
        this.fingerprint = fingerprint;
        this.tokenCount = tokenCount;
        this.ast = ast;
        this.result = result;
        this.algorithmHint = algorithmHint;
        this.validation = validation;
    }

    AnalysisReport withValidation(ComparisonResult comparison) {
        return new AnalysisReport(fingerprint, tokenCount, ast, result, algorithmHint, comparison);
    }

    /**
     * @return the hex SHA-256 of the analyzed source text.
     */
    public String fingerprint() {
        return fingerprint;
    }

    /**
     * @return the number of tokens, EOF excluded.
     */
    public int tokenCount() {
        return tokenCount;
    }

    public SequenceNode ast() {
        return ast;
    }

    public AnalysisResult result() {
        return result;
    }

    public Complexity complexity() {
        return result.complexity();
    }

    public List<Diagnostic> diagnostics() {
        return result.diagnostics();
    }

    public Optional<AlgorithmMatch> algorithmHint() {
        return Optional.ofNullable(algorithmHint);
    }

    public Optional<ComparisonResult> validation() {
        return Optional.ofNullable(validation);
    }
}
