package org.asymptote.export;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import org.asymptote.compiler.analysis.AnalysisResult;
import org.asymptote.compiler.analysis.complexity.Complexity;
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
import org.asymptote.compiler.frontend.parser.ast.expr.ApplyExpr;
import org.asymptote.compiler.frontend.parser.ast.expr.BinaryExpr;
import org.asymptote.compiler.frontend.parser.ast.expr.Expression;
import org.asymptote.compiler.frontend.parser.ast.expr.ExpressionVisitor;
import org.asymptote.compiler.frontend.parser.ast.expr.IndexExpr;
import org.asymptote.compiler.frontend.parser.ast.expr.Literal;
import org.asymptote.compiler.frontend.parser.ast.expr.UnaryExpr;
import org.asymptote.compiler.frontend.parser.ast.expr.VariableRef;

import java.util.List;

/**
 * Converts the AST into a Gson JSON tree for visualization clients. Each statement node
 * carries its kind, position and, when an analysis result is given, its complexity.
 */
public class AstJsonWriter implements AstVisitor<JsonObject> {

    private final AnalysisResult result;
    private final ExpressionWriter expressions = new ExpressionWriter();

    /**
     * @param result The analysis of the tree, or null to omit complexities.
     */
    public AstJsonWriter(AnalysisResult result) {
        this.result = result;
    }

    public JsonObject write(AstNode node) {
        return node.accept(this);
    }

    private JsonObject node(AstNode node, String kind) {
        JsonObject json = new JsonObject();
        json.addProperty("kind", kind);
        json.addProperty("line", node.line());
        json.addProperty("column", node.column());
        if (result != null && result.nodeComplexities().containsKey(node)) {
            json.add("complexity", complexity(result.complexityOf(node)));
        }
        return json;
    }

    static JsonObject complexity(Complexity complexity) {
        JsonObject json = new JsonObject();
        json.addProperty("O", complexity.upperLabel());
        json.addProperty("Omega", complexity.lowerLabel());
        json.addProperty("Theta", complexity.thetaLabel());
        return json;
    }

    private JsonArray statements(List<AstNode> nodes) {
        JsonArray array = new JsonArray();
        nodes.forEach(n -> array.add(n.accept(this)));
        return array;
    }

    private JsonArray expressions(List<Expression> nodes) {
        JsonArray array = new JsonArray();
        nodes.forEach(n -> array.add(expressions.write(n)));
        return array;
    }

    @Override
    public JsonObject visitSequence(SequenceNode node) {
        JsonObject json = node(node, "Sequence");
        json.add("statements", statements(node.statements()));
        return json;
    }

    @Override
    public JsonObject visitAssign(AssignNode node) {
        JsonObject json = node(node, "Assign");
        json.add("target", expressions.write(node.target()));
        json.add("value", expressions.write(node.value()));
        return json;
    }

    @Override
    public JsonObject visitLoop(LoopNode node) {
        JsonObject json = node(node, "Loop");
        json.addProperty("loopKind", node.kind().name());
        if (node.bounds() instanceof RangeBounds range) {
            json.addProperty("variable", range.variable());
            json.add("start", expressions.write(range.start()));
            json.add("end", expressions.write(range.end()));
            json.add("step", expressions.write(range.step()));
            json.addProperty("descending", range.descending());
        } else {
            json.add("condition", expressions.write(((ConditionBounds) node.bounds()).condition()));
        }
        json.add("body", node.body().accept(this));
        return json;
    }

    @Override
    public JsonObject visitConditional(ConditionalNode node) {
        JsonObject json = node(node, "Conditional");
        JsonArray branches = new JsonArray();
        for (ConditionalNode.Branch branch : node.branches()) {
            JsonObject b = new JsonObject();
            b.add("condition", expressions.write(branch.condition()));
            b.add("body", branch.body().accept(this));
            branches.add(b);
        }
        json.add("branches", branches);
        json.add("else", node.elseBranch().<JsonElement>map(e -> e.accept(this)).orElse(JsonNull.INSTANCE));
        return json;
    }

    @Override
    public JsonObject visitCall(CallNode node) {
        JsonObject json = node(node, "Call");
        json.addProperty("name", node.name());
        json.addProperty("recursive", node.recursive());
        json.add("arguments", expressions(node.arguments()));
        return json;
    }

    @Override
    public JsonObject visitRoutine(RoutineNode node) {
        JsonObject json = node(node, "Routine");
        json.addProperty("name", node.name());
        JsonArray parameters = new JsonArray();
        node.parameters().forEach(parameters::add);
        json.add("parameters", parameters);
        json.add("body", node.body().accept(this));
        return json;
    }

    @Override
    public JsonObject visitReturn(ReturnNode node) {
        JsonObject json = node(node, "Return");
        json.add("value", expressions.write(node.value()));
        return json;
    }

    private static final class ExpressionWriter implements ExpressionVisitor<JsonElement> {

        JsonElement write(Expression expression) {
            return expression == null ? JsonNull.INSTANCE : expression.accept(this);
        }

        private static JsonObject expression(Expression expression, String kind) {
            JsonObject json = new JsonObject();
            json.addProperty("kind", kind);
            json.addProperty("line", expression.line());
            json.addProperty("column", expression.column());
            return json;
        }

        @Override
        public JsonObject visitLiteral(Literal literal) {
            JsonObject json = expression(literal, "Literal");
            if (literal.value() instanceof Boolean flag) {
                json.addProperty("value", flag);
            } else {
                json.addProperty("value", (Number) literal.value());
            }
            return json;
        }

        @Override
        public JsonObject visitVariable(VariableRef variable) {
            JsonObject json = expression(variable, "Variable");
            json.addProperty("name", variable.name());
            return json;
        }

        @Override
        public JsonObject visitIndex(IndexExpr index) {
            JsonObject json = expression(index, "Index");
            json.add("target", write(index.target()));
            json.add("index", write(index.index()));
            return json;
        }

        @Override
        public JsonObject visitBinary(BinaryExpr binary) {
            JsonObject json = expression(binary, "Binary");
            json.addProperty("operator", binary.operator().symbol());
            json.add("left", write(binary.left()));
            json.add("right", write(binary.right()));
            return json;
        }

        @Override
        public JsonObject visitUnary(UnaryExpr unary) {
            JsonObject json = expression(unary, "Unary");
            json.addProperty("operator", unary.operator().name());
            json.add("operand", write(unary.operand()));
            return json;
        }

        @Override
        public JsonObject visitApply(ApplyExpr apply) {
            JsonObject json = expression(apply, "Apply");
            json.addProperty("function", apply.function());
            JsonArray arguments = new JsonArray();
            apply.arguments().forEach(a -> arguments.add(write(a)));
            json.add("arguments", arguments);
            return json;
        }
    }
}
