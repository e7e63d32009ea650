package org.asymptote.compiler.analysis;

import org.asymptote.compiler.analysis.complexity.Complexity;
import org.asymptote.compiler.analysis.loops.IterationCount;
import org.asymptote.compiler.analysis.loops.IterationCounter;
import org.asymptote.compiler.analysis.magnitude.VariableMagnitudes;
import org.asymptote.compiler.analysis.recurrence.RecurrenceDescriptor;
import org.asymptote.compiler.analysis.recurrence.RecurrenceSolution;
import org.asymptote.compiler.analysis.recurrence.RecurrenceSolver;
import org.asymptote.compiler.analysis.recurrence.RecursionTally;
import org.asymptote.compiler.analysis.recurrence.ShrinkExtractor;
import org.asymptote.compiler.api.AnalysisContext;
import org.asymptote.compiler.diagnostics.DiagnosticCodes;
import org.asymptote.compiler.diagnostics.DiagnosticsEngine;
import org.asymptote.compiler.frontend.parser.ast.AssignNode;
import org.asymptote.compiler.frontend.parser.ast.AstNode;
import org.asymptote.compiler.frontend.parser.ast.AstVisitor;
import org.asymptote.compiler.frontend.parser.ast.CallNode;
import org.asymptote.compiler.frontend.parser.ast.ConditionBounds;
import org.asymptote.compiler.frontend.parser.ast.ConditionalNode;
import org.asymptote.compiler.frontend.parser.ast.LoopNode;
import org.asymptote.compiler.frontend.parser.ast.RangeBounds;
import org.asymptote.compiler.frontend.parser.ast.ReturnNode;
import org.asymptote.compiler.frontend.parser.ast.RoutineNode;
import org.asymptote.compiler.frontend.parser.ast.SequenceNode;
import org.asymptote.compiler.frontend.parser.ast.expr.Expression;
import org.asymptote.compiler.frontend.parser.ast.expr.Expressions;
import org.asymptote.compiler.frontend.parser.ast.expr.IndexExpr;
import org.asymptote.compiler.frontend.parser.ast.expr.VariableRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assigns a {@link Complexity} to every statement of a parsed program in one post-order pass.
 * <p>
 * Composition rules:
 * <ul>
 *     <li>assignment and return: Θ(1);</li>
 *     <li>sequence: the dominant child, independently for O and Ω;</li>
 *     <li>loop: the body times the iteration count;</li>
 *     <li>conditional: the worst branch for O, the cheapest for Ω (a missing ELSE counts as Θ(1));</li>
 *     <li>call: the memoized cost of the callee; a self-call costs Θ(1) locally and contributes
 *     a term to the routine's recurrence, which the {@link RecurrenceSolver} resolves.</li>
 * </ul>
 * Classification gaps are local: an unresolved node is indeterminate and only its ancestors are
 * affected. The analyzer never mutates the tree; all per-run state lives in one {@code Run}, so
 * analyzing the same tree twice gives identical results.
 */
public class ComplexityAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(ComplexityAnalyzer.class);

    private final AnalysisContext context;
    private final RecurrenceSolver solver;

    public ComplexityAnalyzer(AnalysisContext context, RecurrenceSolver solver) {
        this.context = context;
        this.solver = solver;
    }

    public ComplexityAnalyzer(AnalysisContext context) {
        this(context, new RecurrenceSolver());
    }

    public ComplexityAnalyzer() {
        this(AnalysisContext.defaults());
    }

    /**
     * Analyzes a program.
     *
     * @param root The root sequence produced by the parser.
     * @return the result; semantic problems are reported as diagnostics, never thrown.
     */
    public AnalysisResult analyze(SequenceNode root) {
        return new Run(root).execute();
    }

    /**
     * The cost of a node together with the self-calls it makes.
     */
    private record NodeCost(Complexity complexity, RecursionTally tally) {
        static final NodeCost CONSTANT = new NodeCost(Complexity.CONSTANT, RecursionTally.NONE);
    }

    /**
     * Variables and diagnostics bookkeeping of the scope being analyzed.
     */
    private record Scope(RoutineNode routine, VariableMagnitudes magnitudes, IterationCounter counter,
                         Set<String> reportedUndefined) {
    }

    private final class Run implements AstVisitor<NodeCost> {

        private final SequenceNode root;
        private final IdentityHashMap<AstNode, Complexity> costs = new IdentityHashMap<>();
        private final Map<String, RoutineNode> routines = new LinkedHashMap<>();
        private final Map<String, RoutineAnalysis> analyzed = new LinkedHashMap<>();
        private final Deque<String> callStack = new ArrayDeque<>();
        private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        private final ShrinkExtractor shrinkExtractor = new ShrinkExtractor(context.options().sizeVariables());
        private Scope scope;

        Run(SequenceNode root) {
            this.root = root;
        }

        AnalysisResult execute() {
            boolean executable = false;
            for (AstNode statement : root.statements()) {
                if (statement instanceof RoutineNode routine) {
                    routines.putIfAbsent(Expressions.key(routine.name()), routine);
                } else {
                    executable = true;
                }
            }
            scope = newScope(null, root.statements(), List.of());

            Complexity program = root.accept(this).complexity();
            for (RoutineNode routine : routines.values()) {
                analyzeRoutine(routine);
            }
            if (!executable && !routines.isEmpty()) {
                program = analyzed.get(routines.keySet().iterator().next()).complexity();
                costs.put(root, program);
            }
            LOG.debug("Analyzed {} nodes and {} routines: {}", costs.size(), analyzed.size(), program);
            return new AnalysisResult(program, costs, new ArrayList<>(analyzed.values()), diagnostics.getDiagnostics());
        }

        private Scope newScope(RoutineNode routine, List<AstNode> statements, List<String> parameters) {
            VariableMagnitudes magnitudes = VariableMagnitudes.of(statements, parameters,
                    context.options().sizeVariables());
            return new Scope(routine, magnitudes, new IterationCounter(magnitudes, diagnostics), new HashSet<>());
        }

        private NodeCost record(AstNode node, NodeCost cost) {
            costs.put(node, cost.complexity());
            return cost;
        }

        @Override
        public NodeCost visitSequence(SequenceNode node) {
            Complexity complexity = Complexity.CONSTANT;
            RecursionTally tally = RecursionTally.NONE;
            for (AstNode statement : node.statements()) {
                if (statement instanceof RoutineNode) {
                    continue;
                }
                context.checkpoint("analysis");
                NodeCost cost = statement.accept(this);
                complexity = complexity.then(cost.complexity());
                tally = tally.then(cost.tally());
            }
            return record(node, new NodeCost(complexity, tally));
        }

        @Override
        public NodeCost visitAssign(AssignNode node) {
            if (node.target() instanceof IndexExpr index) {
                checkVariables(index);
            }
            checkVariables(node.value());
            return record(node, NodeCost.CONSTANT);
        }

        @Override
        public NodeCost visitReturn(ReturnNode node) {
            checkVariables(node.value());
            return record(node, NodeCost.CONSTANT);
        }

        @Override
        public NodeCost visitLoop(LoopNode node) {
            if (node.bounds() instanceof RangeBounds range) {
                checkVariables(range.start());
                checkVariables(range.end());
                checkVariables(range.step());
            } else {
                checkVariables(((ConditionBounds) node.bounds()).condition());
            }
            IterationCount count = scope.counter().count(node);
            NodeCost body = node.body().accept(this);

            RecursionTally tally = body.tally();
            if (!tally.isEmpty()) {
                tally = count.exact().isPresent() ? tally.repeat(count.exact().getAsLong()) : RecursionTally.UNRESOLVABLE;
            }
            return record(node, new NodeCost(body.complexity().times(count.count()), tally));
        }

        @Override
        public NodeCost visitConditional(ConditionalNode node) {
            Complexity complexity = null;
            RecursionTally tally = null;
            for (ConditionalNode.Branch branch : node.branches()) {
                checkVariables(branch.condition());
                NodeCost cost = branch.body().accept(this);
                complexity = complexity == null ? cost.complexity() : complexity.or(cost.complexity());
                tally = tally == null ? cost.tally() : tally.or(cost.tally());
            }
            NodeCost otherwise = node.elseBranch().map(body -> body.accept(this)).orElse(NodeCost.CONSTANT);
            return record(node, new NodeCost(complexity.or(otherwise.complexity()), tally.or(otherwise.tally())));
        }

        @Override
        public NodeCost visitCall(CallNode node) {
            for (Expression argument : node.arguments()) {
                // A plain variable argument may be an input array; only computed arguments are checked.
                if (!(argument instanceof VariableRef)) {
                    checkVariables(argument);
                }
            }
            if (node.recursive() && scope.routine() != null) {
                RecursionTally tally = shrinkExtractor.extract(scope.routine(), node)
                        .map(RecursionTally::of)
                        .orElse(RecursionTally.UNRESOLVABLE);
                return record(node, new NodeCost(Complexity.CONSTANT, tally));
            }
            String key = Expressions.key(node.name());
            RoutineNode callee = routines.get(key);
            if (callee == null) {
                diagnostics.reportError(DiagnosticCodes.UNDEFINED_ROUTINE, "Call to undefined routine " + node.name(),
                        node.line(), node.column());
                return record(node, NodeCost.CONSTANT);
            }
            if (callStack.contains(key)) {
                diagnostics.reportWarning(DiagnosticCodes.MUTUAL_RECURSION, "Routines " + String.join(", ", callStack)
                        + " call each other recursively", node.line(), node.column());
                return record(node, new NodeCost(Complexity.INDETERMINATE, RecursionTally.NONE));
            }
            return record(node, new NodeCost(analyzeRoutine(callee).complexity(), RecursionTally.NONE));
        }

        @Override
        public NodeCost visitRoutine(RoutineNode node) {
            return new NodeCost(analyzeRoutine(node).complexity(), RecursionTally.NONE);
        }

        private RoutineAnalysis analyzeRoutine(RoutineNode routine) {
            String key = Expressions.key(routine.name());
            RoutineAnalysis memo = analyzed.get(key);
            if (memo != null) {
                return memo;
            }
            Scope caller = scope;
            callStack.push(key);
            try {
                scope = newScope(routine, routine.body().statements(), routine.parameters());
                NodeCost body = routine.body().accept(this);
                RoutineAnalysis analysis = summarize(routine, body);
                costs.put(routine, analysis.complexity());
                analyzed.put(key, analysis);
                return analysis;
            } finally {
                callStack.pop();
                scope = caller;
            }
        }

        private RoutineAnalysis summarize(RoutineNode routine, NodeCost body) {
            RecursionTally tally = body.tally();
            if (tally.isEmpty()) {
                return new RoutineAnalysis(routine.name(), body.complexity(), null, null);
            }
            if (tally.unresolvable()) {
                diagnostics.reportWarning(DiagnosticCodes.UNRESOLVED_RECURRENCE, "Cannot derive a recurrence for "
                        + routine.name() + ": a self-call does not shrink a parameter by a constant step or ratio,"
                        + " or its count depends on the input", routine.line(), routine.column());
                return new RoutineAnalysis(routine.name(), Complexity.INDETERMINATE, null, null);
            }
            RecurrenceDescriptor descriptor = new RecurrenceDescriptor(tally.terms(), body.complexity().upper());
            RecurrenceSolution solution = solver.solve(descriptor);
            if (!solution.isSolved()) {
                diagnostics.reportWarning(DiagnosticCodes.UNRESOLVED_RECURRENCE, "Cannot solve " + descriptor.render()
                        + " for " + routine.name() + ": " + solution.explanation(), routine.line(), routine.column());
            }
            return new RoutineAnalysis(routine.name(), Complexity.exact(solution.bound()), descriptor, solution);
        }

        private void checkVariables(Expression expression) {
            for (VariableRef ref : Expressions.variables(expression, false)) {
                String key = Expressions.key(ref.name());
                if (!scope.magnitudes().isDefined(key) && scope.reportedUndefined().add(key)) {
                    diagnostics.reportError(DiagnosticCodes.UNDEFINED_VARIABLE, "Variable " + ref.name()
                            + " is never assigned", ref.line(), ref.column());
                }
            }
        }
    }
}
