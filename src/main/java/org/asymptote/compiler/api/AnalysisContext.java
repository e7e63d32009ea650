package org.asymptote.compiler.api;

/**
 * The explicit context threaded through the lexer, parser and analyzer of one request:
 * options, resource budget, cancellation signal and deadline.
 * <p>
 * Created fresh for each request; there is no ambient global state.
 */
public final class AnalysisContext {

    private final AnalysisOptions options;
    private final CancellationSignal signal;
    private final long deadlineNanos;

    private AnalysisContext(AnalysisOptions options, CancellationSignal signal) {
        this.options = options;
        this.signal = signal;
        long timeoutNanos = options.budget().timeout().toNanos();
        this.deadlineNanos = timeoutNanos > 0 ? System.nanoTime() + timeoutNanos : Long.MAX_VALUE;
    }

    /**
     * Starts the clock for a new request.
     *
     * @param options The request options.
     * @param signal  The cancellation signal the caller keeps.
     * @return a new context whose deadline is now plus the budget timeout.
     */
    public static AnalysisContext start(AnalysisOptions options, CancellationSignal signal) {
        return new AnalysisContext(options, signal);
    }

    /**
     * Starts a request that cannot be cancelled from outside.
     */
    public static AnalysisContext start(AnalysisOptions options) {
        return new AnalysisContext(options, new CancellationSignal());
    }

    /**
     * Starts a request with default options.
     */
    public static AnalysisContext defaults() {
        return start(AnalysisOptions.DEFAULT);
    }

    public AnalysisOptions options() {
        return options;
    }

    public ResourceBudget budget() {
        return options.budget();
    }

    /**
     * Polls cancellation and the deadline.
     *
     * @param stage The stage name used in the exception message.
     * @throws AnalysisCancelledException     if the caller cancelled the request.
     * @throws ResourceLimitExceededException if the deadline has passed.
     */
    public void checkpoint(String stage) {
        if (signal.isCancelled()) {
            throw new AnalysisCancelledException(stage);
        }
        if (deadlineNanos != Long.MAX_VALUE && System.nanoTime() - deadlineNanos > 0) {
            throw new ResourceLimitExceededException(ResourceLimitExceededException.Limit.DEADLINE,
                    options.budget().timeout().toMillis(), "during " + stage);
        }
    }
}
