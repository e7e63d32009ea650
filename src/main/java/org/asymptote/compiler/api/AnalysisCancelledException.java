package org.asymptote.compiler.api;

/**
 * Thrown when the caller cancels a running analysis through its
 * {@link CancellationSignal}.
 */
public class AnalysisCancelledException extends AnalysisException {

    public AnalysisCancelledException(String stage) {
        super("Analysis cancelled during " + stage);
    }
}
