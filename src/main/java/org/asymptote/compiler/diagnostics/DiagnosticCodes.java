package org.asymptote.compiler.diagnostics;

/**
 * Codes of the semantic diagnostics reported by the analyzer.
 */
public final class DiagnosticCodes {

    /** A variable is read but never assigned, and is neither a parameter, loop variable nor size variable. */
    public static final String UNDEFINED_VARIABLE = "undefined-variable";
    /** A CALL names a routine that is not defined. */
    public static final String UNDEFINED_ROUTINE = "undefined-routine";
    /** A loop bound that can never terminate as written or uses a non-constant or zero step. */
    public static final String MALFORMED_LOOP_BOUND = "malformed-loop-bound";
    /** A loop bound whose shape is not recognized. */
    public static final String UNRESOLVED_LOOP_BOUND = "unresolved-loop-bound";
    /** A recursive routine whose recurrence could not be extracted or solved. */
    public static final String UNRESOLVED_RECURRENCE = "unresolved-recurrence";
    /** Routines that call each other in a cycle. */
    public static final String MUTUAL_RECURSION = "mutual-recursion";

    private DiagnosticCodes() {
    }
}
