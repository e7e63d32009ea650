package org.asymptote.cli.commands;

import org.asymptote.compiler.analysis.complexity.Complexity;
import org.asymptote.validation.ExternalJudgement;
import org.asymptote.validation.ValidationCollaborator;

/**
 * Validation collaborator backed by bounds the user states on the command line.
 * Bounds left out are reported as {@code absent}.
 */
class ExpectationValidator implements ValidationCollaborator {

    private final String upper;
    private final String lower;
    private final String tight;

    ExpectationValidator(String upper, String lower, String tight) {
        this.upper = upper;
        this.lower = lower;
        this.tight = tight;
    }

    static boolean anyGiven(String upper, String lower, String tight) {
        return upper != null || lower != null || tight != null;
    }

    @Override
    public ExternalJudgement judge(String source, Complexity complexity) {
        return new ExternalJudgement(upper, lower, tight, "Bounds given on the command line.");
    }
}
