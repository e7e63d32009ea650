package org.asymptote.validation;

import java.util.List;

/**
 * Agreement between the computed complexity and an external judgement.
 *
 * @param agreementScore Percentage of matching bounds, rounded to two decimals.
 * @param details        The per-bound comparison for O, Omega and Theta.
 * @param explanation    The collaborator's explanation.
 */
public record ComparisonResult(double agreementScore, List<BoundComparison> details, String explanation) {

    public ComparisonResult {
        details = List.copyOf(details);
    }

    public boolean allMatch() {
        return details.stream().allMatch(BoundComparison::match);
    }
}
