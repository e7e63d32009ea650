package org.asymptote.compiler.api;

import com.typesafe.config.Config;

import java.time.Duration;

/**
 * Upper limits for one analysis request. Exceeding any of them fails the request fast
 * with {@link ResourceLimitExceededException}.
 *
 * @param maxTokens Maximum number of tokens the lexer may produce (EOF excluded).
 * @param maxDepth  Maximum block and expression nesting depth.
 * @param maxFanOut Maximum number of statements in one block or arguments in one call.
 * @param timeout   Wall-clock budget for the whole request; zero or negative disables it.
 */
public record ResourceBudget(int maxTokens, int maxDepth, int maxFanOut, Duration timeout) {

    public static final ResourceBudget DEFAULT = new ResourceBudget(100_000, 64, 10_000, Duration.ofSeconds(10));

    public ResourceBudget {
        if (maxTokens <= 0 || maxDepth <= 0 || maxFanOut <= 0) {
            throw new IllegalArgumentException("Resource limits must be positive: tokens=" + maxTokens
                    + ", depth=" + maxDepth + ", fan-out=" + maxFanOut);
        }
        if (timeout == null) {
            timeout = Duration.ZERO;
        }
    }

    /**
     * Reads a budget from a config block. Missing keys fall back to {@link #DEFAULT}.
     *
     * @param options The {@code budget} block, e.g. {@code asymptote.analysis.budget}.
     * @return the budget.
     */
    public static ResourceBudget fromConfig(Config options) {
        int maxTokens = options.hasPath("max-tokens") ? options.getInt("max-tokens") : DEFAULT.maxTokens();
        int maxDepth = options.hasPath("max-depth") ? options.getInt("max-depth") : DEFAULT.maxDepth();
        int maxFanOut = options.hasPath("max-fan-out") ? options.getInt("max-fan-out") : DEFAULT.maxFanOut();
        Duration timeout = options.hasPath("timeout") ? options.getDuration("timeout") : DEFAULT.timeout();
        return new ResourceBudget(maxTokens, maxDepth, maxFanOut, timeout);
    }

    public ResourceBudget withMaxTokens(int value) {
        return new ResourceBudget(value, maxDepth, maxFanOut, timeout);
    }

    public ResourceBudget withMaxDepth(int value) {
        return new ResourceBudget(maxTokens, value, maxFanOut, timeout);
    }

    public ResourceBudget withMaxFanOut(int value) {
        return new ResourceBudget(maxTokens, maxDepth, value, timeout);
    }

    public ResourceBudget withTimeout(Duration value) {
        return new ResourceBudget(maxTokens, maxDepth, maxFanOut, value);
    }
}
