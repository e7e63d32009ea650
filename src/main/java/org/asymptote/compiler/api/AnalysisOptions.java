package org.asymptote.compiler.api;

import com.typesafe.config.Config;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable per-request analysis settings. Two requests with equal options and equal
 * source text produce identical results, so the pair is a valid cache key.
 *
 * @param budget        The resource budget.
 * @param sizeVariables Identifiers that denote the input size (stored lower-case).
 */
public record AnalysisOptions(ResourceBudget budget, Set<String> sizeVariables) {

    public static final AnalysisOptions DEFAULT = new AnalysisOptions(ResourceBudget.DEFAULT, Set.of("n", "m"));

    public AnalysisOptions {
        if (budget == null) {
            throw new IllegalArgumentException("budget must not be null");
        }
        if (sizeVariables == null || sizeVariables.isEmpty()) {
            throw new IllegalArgumentException("At least one size variable is required");
        }
        sizeVariables = sizeVariables.stream()
                .map(v -> v.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Reads options from the {@code asymptote.analysis} block.
     * <pre>
     * analysis {
     *   size-variables = [n, m]
     *   budget { max-tokens = 100000, max-depth = 64, max-fan-out = 10000, timeout = 10s }
     * }
     * </pre>
     *
     * @param options The analysis block.
     * @return the options; missing keys fall back to {@link #DEFAULT}.
     */
    public static AnalysisOptions fromConfig(Config options) {
        ResourceBudget budget = options.hasPath("budget")
                ? ResourceBudget.fromConfig(options.getConfig("budget"))
                : ResourceBudget.DEFAULT;
        Set<String> sizeVariables = options.hasPath("size-variables")
                ? Set.copyOf(options.getStringList("size-variables"))
                : DEFAULT.sizeVariables();
        return new AnalysisOptions(budget, sizeVariables);
    }

    public AnalysisOptions withBudget(ResourceBudget value) {
        return new AnalysisOptions(value, sizeVariables);
    }
}
