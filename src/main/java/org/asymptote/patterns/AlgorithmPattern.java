package org.asymptote.patterns;

import java.util.List;

/**
 * A known algorithm recognized by its keyword signature.
 *
 * @param id                 A stable identifier, e.g. {@code merge-sort}.
 * @param name               The display name.
 * @param strategy           The design strategy, e.g. divide and conquer.
 * @param expectedComplexity The textbook complexity, free text.
 * @param keywords           Lower-case fragments searched for in the source.
 */
public record AlgorithmPattern(String id, String name, String strategy, String expectedComplexity, List<String> keywords) {

    public AlgorithmPattern {
        if (keywords.isEmpty()) {
            throw new IllegalArgumentException("Pattern " + id + " needs at least one keyword");
        }
        keywords = List.copyOf(keywords);
    }
}
