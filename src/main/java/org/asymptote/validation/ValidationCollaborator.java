package org.asymptote.validation;

import org.asymptote.compiler.analysis.complexity.Complexity;

/**
 * An external service that cross-checks a computed complexity, e.g. an AI assistant.
 * Implementations live outside the core; the computed result never depends on them.
 */
public interface ValidationCollaborator {

    /**
     * @param source     The analyzed pseudocode.
     * @param complexity The computed complexity.
     * @return the collaborator's own judgement.
     * @throws RuntimeException on any failure; callers log and ignore it.
     */
    ExternalJudgement judge(String source, Complexity complexity);
}
