package org.asymptote.validation;

/**
 * An independent complexity judgement returned by a validation collaborator.
 * Bounds are free-form labels such as {@code O(n^2)}, {@code Omega(n)} or {@code Θ(n log n)}; any may be null.
 *
 * @param upper       The claimed O bound.
 * @param lower       The claimed Ω bound.
 * @param tight       The claimed Θ bound.
 * @param explanation A narrative explanation.
 */
public record ExternalJudgement(String upper, String lower, String tight, String explanation) {
}
