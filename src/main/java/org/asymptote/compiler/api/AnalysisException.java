package org.asymptote.compiler.api;

/**
 * Base class for failures that abort an analysis request.
 * <p>
 * Classification gaps are not failures: they are reported as indeterminate bounds
 * or as diagnostics alongside an otherwise complete result. This is a RuntimeException
 * because a failed request cannot be recovered by the pipeline itself; callers reject
 * or truncate the input.
 */
public class AnalysisException extends RuntimeException {

    /**
     * @param message Description of the failure.
     */
    public AnalysisException(String message) {
        super(message);
    }

    /**
     * @param message Description of the failure.
     * @param cause   The underlying exception.
     */
    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
