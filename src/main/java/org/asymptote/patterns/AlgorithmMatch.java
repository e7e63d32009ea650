package org.asymptote.patterns;

/**
 * The best known-algorithm hint for a source text. Informational only: it never changes the computed result.
 *
 * @param pattern The matched pattern.
 * @param hits    How many of its keywords occur in the source.
 */
public record AlgorithmMatch(AlgorithmPattern pattern, int hits) {

    /**
     * @return the share of the pattern's keywords that were found.
     */
    public double density() {
        return (double) hits / pattern.keywords().size();
    }
}
