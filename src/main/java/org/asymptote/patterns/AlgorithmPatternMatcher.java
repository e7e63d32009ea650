package org.asymptote.patterns;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Matches source text against a catalog of keyword signatures of well-known algorithms.
 * <p>
 * The pattern with most keyword hits wins; ties go to the pattern whose keywords were found
 * with the higher density. At least {@value #MIN_HITS} hits are needed for a match.
 */
public class AlgorithmPatternMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(AlgorithmPatternMatcher.class);

    static final int MIN_HITS = 2;

    private final List<AlgorithmPattern> patterns;

    public AlgorithmPatternMatcher(List<AlgorithmPattern> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    /**
     * Loads the catalog from a list of pattern blocks:
     * <pre>
     * patterns = [
     *   { id = merge-sort, name = "Merge Sort", strategy = "Divide and conquer",
     *     complexity = "Θ(n log n)", keywords = [merge, mid, call, left, right] }
     * ]
     * </pre>
     *
     * @param options The config holding a {@code patterns} list; a missing list gives an empty catalog.
     */
    public static AlgorithmPatternMatcher fromConfig(Config options) {
        List<AlgorithmPattern> patterns = new ArrayList<>();
        if (options.hasPath("patterns")) {
            for (Config pattern : options.getConfigList("patterns")) {
                patterns.add(new AlgorithmPattern(
                        pattern.getString("id"),
                        pattern.getString("name"),
                        pattern.hasPath("strategy") ? pattern.getString("strategy") : "",
                        pattern.getString("complexity"),
                        pattern.getStringList("keywords").stream().map(k -> k.toLowerCase(Locale.ROOT)).toList()));
            }
        }
        LOG.debug("Loaded {} algorithm patterns", patterns.size());
        return new AlgorithmPatternMatcher(patterns);
    }

    public List<AlgorithmPattern> patterns() {
        return patterns;
    }

    /**
     * @param source The pseudocode text.
     * @return the best match with at least {@value #MIN_HITS} keyword hits, or empty.
     */
    public Optional<AlgorithmMatch> match(String source) {
        String text = source.toLowerCase(Locale.ROOT);
        AlgorithmMatch best = null;
        for (AlgorithmPattern pattern : patterns) {
            int hits = 0;
            for (String keyword : pattern.keywords()) {
                if (text.contains(keyword)) {
                    hits++;
                }
            }
            AlgorithmMatch candidate = new AlgorithmMatch(pattern, hits);
            if (best == null || hits > best.hits() || (hits == best.hits() && candidate.density() > best.density())) {
                best = candidate;
            }
        }
        return best != null && best.hits() >= MIN_HITS ? Optional.of(best) : Optional.empty();
    }
}
