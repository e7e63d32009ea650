package org.asymptote.compiler.frontend.parser.ast.expr;

import java.util.stream.Collectors;

/**
 * Renders expressions back to a compact, fully parenthesized source form for diagnostics and reports.
 */
public final class ExpressionPrinter implements ExpressionVisitor<String> {

    private static final ExpressionPrinter INSTANCE = new ExpressionPrinter();

    private ExpressionPrinter() {
    }

    public static String print(Expression expression) {
        return expression == null ? "" : expression.accept(INSTANCE);
    }

    @Override
    public String visitLiteral(Literal literal) {
        Object value = literal.value();
        if (value instanceof Boolean flag) {
            return flag ? "TRUE" : "FALSE";
        }
        return literal.token().text();
    }

    @Override
    public String visitVariable(VariableRef variable) {
        return variable.name();
    }

    @Override
    public String visitIndex(IndexExpr index) {
        return index.target().accept(this) + "[" + index.index().accept(this) + "]";
    }

    @Override
    public String visitBinary(BinaryExpr binary) {
        return "(" + binary.left().accept(this) + " " + binary.operator().symbol() + " "
                + binary.right().accept(this) + ")";
    }

    @Override
    public String visitUnary(UnaryExpr unary) {
        return unary.operator().symbol() + unary.operand().accept(this);
    }

    @Override
    public String visitApply(ApplyExpr apply) {
        return apply.function() + apply.arguments().stream().map(a -> a.accept(this))
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
