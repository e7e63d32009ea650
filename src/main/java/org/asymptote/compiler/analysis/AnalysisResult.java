package org.asymptote.compiler.analysis;

import org.asymptote.compiler.analysis.complexity.Complexity;
import org.asymptote.compiler.diagnostics.Diagnostic;
import org.asymptote.compiler.frontend.parser.ast.AstNode;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The outcome of one analyzer pass: the program's complexity, the complexity assigned to every
 * statement node, the routine analyses and the semantic diagnostics. Immutable.
 */
public final class AnalysisResult {

    private final Complexity complexity;
    private final Map<AstNode, Complexity> nodeComplexities;
    private final List<RoutineAnalysis> routines;
    private final List<Diagnostic> diagnostics;

    AnalysisResult(Complexity complexity, IdentityHashMap<AstNode, Complexity> nodeComplexities,
                   List<RoutineAnalysis> routines, List<Diagnostic> diagnostics) {
        this.complexity = complexity;
        this.nodeComplexities = Collections.unmodifiableMap(new IdentityHashMap<>(nodeComplexities));
        this.routines = List.copyOf(routines);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public Complexity complexity() {
        return complexity;
    }

    /**
     * @return the complexity assigned to a node of the analyzed tree.
     * @throws IllegalArgumentException if the node was not part of the analyzed tree.
     */
    public Complexity complexityOf(AstNode node) {
        Complexity value = nodeComplexities.get(node);
        if (value == null) {
            throw new IllegalArgumentException("Node was not analyzed: " + node.token());
        }
        return value;
    }

    /**
     * @return node complexities keyed by node identity.
     */
    public Map<AstNode, Complexity> nodeComplexities() {
        return nodeComplexities;
    }

    public List<RoutineAnalysis> routines() {
        return routines;
    }

    /**
     * @return the analysis of the named routine, ignoring case.
     */
    public Optional<RoutineAnalysis> routine(String name) {
        return routines.stream().filter(r -> r.name().equalsIgnoreCase(name)).findFirst();
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    @Override
    public String toString() {
        return complexity.toString();
    }
}
