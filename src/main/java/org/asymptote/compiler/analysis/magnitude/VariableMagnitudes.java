package org.asymptote.compiler.analysis.magnitude;

import org.asymptote.compiler.analysis.complexity.Bound;
import org.asymptote.compiler.frontend.parser.ast.AssignNode;
import org.asymptote.compiler.frontend.parser.ast.AstNode;
import org.asymptote.compiler.frontend.parser.ast.AstVisitor;
import org.asymptote.compiler.frontend.parser.ast.CallNode;
import org.asymptote.compiler.frontend.parser.ast.ConditionalNode;
import org.asymptote.compiler.frontend.parser.ast.LoopNode;
import org.asymptote.compiler.frontend.parser.ast.RangeBounds;
import org.asymptote.compiler.frontend.parser.ast.ReturnNode;
import org.asymptote.compiler.frontend.parser.ast.RoutineNode;
import org.asymptote.compiler.frontend.parser.ast.SequenceNode;
import org.asymptote.compiler.frontend.parser.ast.expr.Expression;
import org.asymptote.compiler.frontend.parser.ast.expr.Expressions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flow-insensitive magnitudes of the variables of one scope (the program top level or one routine body).
 * <p>
 * A variable takes the largest magnitude of all values assigned to it anywhere in the scope.
 * Self-referential updates such as {@code i ← i + 1} are skipped; they move the value but do not
 * set its scale. A FOR variable ranges over its start and end. Parameters are inputs and have
 * magnitude n. Nested routine definitions are separate scopes and are not entered.
 */
public final class VariableMagnitudes {

    private final Map<String, Bound> magnitudes;
    private final Set<String> definedNames;
    private final Set<String> sizeVariables;
    private final MagnitudeEstimator estimator;

    private VariableMagnitudes(Map<String, Bound> magnitudes, Set<String> definedNames, Set<String> sizeVariables) {
        this.magnitudes = Collections.unmodifiableMap(magnitudes);
        this.sizeVariables = sizeVariables;
        this.definedNames = Collections.unmodifiableSet(definedNames);
        this.estimator = new MagnitudeEstimator(sizeVariables, this.magnitudes);
    }

    /**
     * Computes the magnitudes of a scope.
     *
     * @param statements    The statements of the scope.
     * @param parameters    The routine parameters, empty at top level.
     * @param sizeVariables Lower-cased names that denote the input size.
     */
    public static VariableMagnitudes of(List<AstNode> statements, Collection<String> parameters, Set<String> sizeVariables) {
        Map<String, List<Expression>> sources = new LinkedHashMap<>();
        Set<String> defined = new HashSet<>(sizeVariables);
        DefinitionCollector collector = new DefinitionCollector(sources, defined);
        for (AstNode statement : statements) {
            statement.accept(collector);
        }

        Map<String, Bound> magnitudes = new LinkedHashMap<>();
        for (String parameter : parameters) {
            String key = Expressions.key(parameter);
            defined.add(key);
            magnitudes.put(key, Bound.LINEAR);
            sources.remove(key);
        }
        for (String name : sources.keySet()) {
            magnitudes.put(name, Bound.CONSTANT);
        }
        solve(sources, magnitudes, sizeVariables);
        return new VariableMagnitudes(magnitudes, defined, sizeVariables);
    }

    // Iterates to a fixpoint; variables still growing after the round limit sit on a cycle and are indeterminate.
    private static void solve(Map<String, List<Expression>> sources, Map<String, Bound> magnitudes, Set<String> sizeVariables) {
        MagnitudeEstimator estimator = new MagnitudeEstimator(sizeVariables, magnitudes);
        int rounds = sources.size() + 2;
        Set<String> changed = new HashSet<>(sources.keySet());
        while (!changed.isEmpty() && rounds-- > 0) {
            changed.clear();
            for (Map.Entry<String, List<Expression>> entry : sources.entrySet()) {
                Bound value = null;
                for (Expression source : entry.getValue()) {
                    Bound next = estimator.estimate(source);
                    value = value == null ? next : value.max(next);
                }
                if (value != null && !value.equals(magnitudes.get(entry.getKey()))) {
                    magnitudes.put(entry.getKey(), value);
                    changed.add(entry.getKey());
                }
            }
        }
        for (String name : changed) {
            magnitudes.put(name, Bound.INDETERMINATE);
        }
    }

    public MagnitudeEstimator estimator() {
        return estimator;
    }

    /**
     * @return the magnitude of a variable; size variables are n, unknown names constant.
     */
    public Bound magnitudeOf(String name) {
        String key = Expressions.key(name);
        if (sizeVariables.contains(key)) {
            return Bound.LINEAR;
        }
        return magnitudes.getOrDefault(key, Bound.CONSTANT);
    }

    /**
     * @return true if the name is assigned, a loop variable, a parameter or a size variable in this scope.
     */
    public boolean isDefined(String name) {
        return definedNames.contains(Expressions.key(name));
    }

    public Map<String, Bound> magnitudes() {
        return magnitudes;
    }

    private static final class DefinitionCollector implements AstVisitor<Void> {

        private final Map<String, List<Expression>> sources;
        private final Set<String> defined;

        DefinitionCollector(Map<String, List<Expression>> sources, Set<String> defined) {
            this.sources = sources;
            this.defined = defined;
        }

        private void define(String name, Expression... values) {
            String key = Expressions.key(name);
            defined.add(key);
            List<Expression> list = sources.computeIfAbsent(key, k -> new ArrayList<>());
            for (Expression value : values) {
                if (!Expressions.references(value, name)) {
                    list.add(value);
                }
            }
        }

        @Override
        public Void visitSequence(SequenceNode node) {
            node.statements().forEach(s -> s.accept(this));
            return null;
        }

        @Override
        public Void visitAssign(AssignNode node) {
            String target = node.targetVariable();
            if (target != null) {
                define(target, node.value());
            }
            return null;
        }

        @Override
        public Void visitLoop(LoopNode node) {
            if (node.bounds() instanceof RangeBounds range) {
                define(range.variable(), range.start(), range.end());
            }
            return node.body().accept(this);
        }

        @Override
        public Void visitConditional(ConditionalNode node) {
            node.getChildren().forEach(c -> c.accept(this));
            return null;
        }

        @Override
        public Void visitCall(CallNode node) {
            return null;
        }

        @Override
        public Void visitRoutine(RoutineNode node) {
            return null;
        }

        @Override
        public Void visitReturn(ReturnNode node) {
            return null;
        }
    }
}
