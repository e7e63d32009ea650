package org.asymptote.compiler.analysis.recurrence;

/**
 * The rule that resolved a recurrence.
 */
public enum RecurrenceCase {
    /** f(n) polynomially smaller than n^(log_b a). */
    MASTER_CASE_1,
    /** f(n) within a log factor of n^(log_b a). */
    MASTER_CASE_2,
    /** f(n) polynomially larger than n^(log_b a). */
    MASTER_CASE_3,
    /** One subtractive self-call, solved by summation. */
    SUBTRACTIVE_SUMMATION,
    /** Several subtractive self-calls, exponential tree. */
    SUBTRACTIVE_EXPONENTIAL,
    UNSUPPORTED
}
