package org.asymptote.validation;

import org.asymptote.compiler.analysis.complexity.Complexity;

import java.util.List;
import java.util.Locale;

/**
 * Compares a computed complexity with an {@link ExternalJudgement} after normalizing both notations.
 */
public class ComplexityComparator {

    static final String NOT_AVAILABLE = "n/a";

    /**
     * Canonical form of a bound label: lower case, without whitespace, with spelled-out
     * {@code Omega(} and {@code Theta(} mapped to their Greek letters. Blank or absent labels become {@code n/a}.
     */
    public String normalize(String label) {
        if (label == null || label.isBlank() || label.equalsIgnoreCase("absent")) {
            return NOT_AVAILABLE;
        }
        String value = label.strip().toLowerCase(Locale.ROOT).replaceAll("\\s+", "");
        value = value.replace("omega(", "ω(").replace("theta(", "θ(").replace("big-o(", "o(");
        return value.replace("·", "").replace("*", "");
    }

    public ComparisonResult compare(Complexity computed, ExternalJudgement judgement) {
        List<BoundComparison> details = List.of(
                compare("O", computed.upperLabel(), judgement.upper()),
                compare("Omega", computed.lowerLabel(), judgement.lower()),
                compare("Theta", computed.thetaLabel(), judgement.tight()));
        long matches = details.stream().filter(BoundComparison::match).count();
        double score = Math.round(matches * 10000.0 / details.size()) / 100.0;
        String explanation = judgement.explanation() != null ? judgement.explanation() : "No explanation provided.";
        return new ComparisonResult(score, details, explanation);
    }

    private BoundComparison compare(String bound, String computed, String external) {
        String deterministic = normalize(computed);
        String other = normalize(external);
        return new BoundComparison(bound, deterministic, other, deterministic.equals(other));
    }
}
