package org.asymptote.compiler.frontend.parser;

import org.asymptote.compiler.api.AnalysisContext;
import org.asymptote.compiler.api.ResourceLimitExceededException;
import org.asymptote.compiler.api.SyntaxException;
import org.asymptote.compiler.frontend.parser.ast.AstNode;
import org.asymptote.compiler.frontend.parser.ast.SequenceNode;
import org.asymptote.compiler.frontend.parser.ast.expr.ApplyExpr;
import org.asymptote.compiler.frontend.parser.ast.expr.BinaryExpr;
import org.asymptote.compiler.frontend.parser.ast.expr.BinaryOperator;
import org.asymptote.compiler.frontend.parser.ast.expr.Expression;
import org.asymptote.compiler.frontend.parser.ast.expr.IndexExpr;
import org.asymptote.compiler.frontend.parser.ast.expr.Literal;
import org.asymptote.compiler.frontend.parser.ast.expr.UnaryExpr;
import org.asymptote.compiler.frontend.parser.ast.expr.UnaryOperator;
import org.asymptote.compiler.frontend.parser.ast.expr.VariableRef;
import org.asymptote.compiler.model.Token;
import org.asymptote.compiler.model.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Recursive-descent parser for the pseudocode dialect.
 * <p>
 * Statements are dispatched on their leading token through the {@link StatementHandlerRegistry};
 * expressions are parsed here by precedence climbing. Parsing stops at the first structural
 * violation with a {@link SyntaxException}: a partial tree is never returned.
 * <p>
 * Block and expression nesting count towards the depth budget, statements per block and
 * arguments per call towards the fan-out budget.
 */
public class Parser implements ParsingContext {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private final List<Token> tokens;
    private final AnalysisContext context;
    private final StatementHandlerRegistry registry;
    private final BlockTracker blocks = new BlockTracker();

    private int current = 0;
    private int depth = 0;
    private String routine;

    /**
     * @param tokens  The token stream, terminated by EOF.
     * @param context The request context supplying budget and cancellation.
     */
    public Parser(List<Token> tokens, AnalysisContext context) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token stream must end with EOF");
        }
        this.tokens = tokens;
        this.context = context;
        this.registry = StatementHandlerRegistry.initialize();
    }

    public Parser(List<Token> tokens) {
        this(tokens, AnalysisContext.defaults());
    }

    /**
     * Parses the whole program.
     *
     * @return the root sequence.
     * @throws SyntaxException                if the input violates the grammar.
     * @throws ResourceLimitExceededException if depth, fan-out or deadline are exceeded.
     */
    public SequenceNode parse() {
        Token first = peek();
        List<AstNode> statements = statements(first);
        if (!isAtEnd()) {
            Token stray = peek();
            throw new SyntaxException("a statement", stray, "unmatched " + stray.text().toUpperCase(Locale.ROOT)
                    + " without an open block");
        }
        LOG.debug("Parsed {} top-level statements", statements.size());
        return new SequenceNode(first, statements);
    }

    private List<AstNode> statements(Token owner) {
        List<AstNode> statements = new ArrayList<>();
        while (!isAtEnd() && !isBlockTerminator(peek().type())) {
            if (match(TokenType.SEMICOLON)) {
                continue;
            }
            context.checkpoint("parsing");
            statements.add(statement());
            checkFanOut(statements.size(), owner);
        }
        return statements;
    }

    private AstNode statement() {
        Token lead = peek();
        IStatementHandler handler = registry.get(lead.type())
                .orElseThrow(() -> new SyntaxException("a statement", lead, null));
        return handler.parse(this);
    }

    private static boolean isBlockTerminator(TokenType type) {
        return type == TokenType.END || type == TokenType.ELSE || type == TokenType.UNTIL;
    }

    // --- Blocks ---

    @Override
    public SequenceNode block(Token opener, String expectedCloser, TokenType... closers) {
        blocks.open(opener);
        enterNesting(opener);
        try {
            List<AstNode> body = statements(opener);
            Token closer = peek();
            if (Arrays.stream(closers).noneMatch(t -> t == closer.type())) {
                throw new SyntaxException(expectedCloser, closer, "to close " + BlockTracker.describe(opener));
            }
            return new SequenceNode(opener, body);
        } finally {
            exitNesting();
            blocks.close();
        }
    }

    @Override
    public void closeBlock(Token opener, TokenType kind) {
        String expected = "END " + kind;
        Token end = peek();
        if (end.type() != TokenType.END) {
            throw new SyntaxException(expected, end, "to close " + BlockTracker.describe(opener));
        }
        advance();
        Token closed = peek();
        if (closed.type() != kind) {
            throw new SyntaxException(expected, closed, "to close " + BlockTracker.describe(opener));
        }
        advance();
    }

    @Override
    public boolean isTopLevel() {
        return blocks.isEmpty() && routine == null;
    }

    @Override
    public String currentRoutine() {
        return routine;
    }

    @Override
    public void beginRoutine(String name) {
        if (routine != null) {
            throw new IllegalStateException("Routine " + routine + " is still open");
        }
        routine = name;
    }

    @Override
    public void endRoutine() {
        routine = null;
    }

    @Override
    public void checkFanOut(int count, Token at) {
        int max = context.budget().maxFanOut();
        if (count > max) {
            throw new ResourceLimitExceededException(ResourceLimitExceededException.Limit.FAN_OUT, max,
                    "at line " + at.line() + ", column " + at.column());
        }
    }

    private void enterNesting(Token at) {
        depth++;
        int max = context.budget().maxDepth();
        if (depth > max) {
            throw new ResourceLimitExceededException(ResourceLimitExceededException.Limit.DEPTH, max,
                    "at line " + at.line() + ", column " + at.column());
        }
    }

    private void exitNesting() {
        depth--;
    }

    // --- Expressions ---

    @Override
    public Expression expression() {
        enterNesting(peek());
        try {
            return or();
        } finally {
            exitNesting();
        }
    }

    private Expression or() {
        Expression expr = and();
        while (match(TokenType.OR)) {
            Token operator = previous();
            expr = new BinaryExpr(operator, BinaryOperator.OR, expr, and());
        }
        return expr;
    }

    private Expression and() {
        Expression expr = not();
        while (match(TokenType.AND)) {
            Token operator = previous();
            expr = new BinaryExpr(operator, BinaryOperator.AND, expr, not());
        }
        return expr;
    }

    private Expression not() {
        if (match(TokenType.NOT)) {
            Token operator = previous();
            enterNesting(operator);
            try {
                return new UnaryExpr(operator, UnaryOperator.NOT, not());
            } finally {
                exitNesting();
            }
        }
        return comparison();
    }

    private Expression comparison() {
        Expression expr = additive();
        while (peek().type().isComparison()) {
            Token operator = advance();
            expr = new BinaryExpr(operator, BinaryOperator.fromToken(operator.type()), expr, additive());
        }
        return expr;
    }

    private Expression additive() {
        Expression expr = multiplicative();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token operator = previous();
            expr = new BinaryExpr(operator, BinaryOperator.fromToken(operator.type()), expr, multiplicative());
        }
        return expr;
    }

    private Expression multiplicative() {
        Expression expr = power();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.DIV, TokenType.MOD)) {
            Token operator = previous();
            expr = new BinaryExpr(operator, BinaryOperator.fromToken(operator.type()), expr, power());
        }
        return expr;
    }

    // Right-associative: a ^ b ^ c is a ^ (b ^ c).
    private Expression power() {
        List<Expression> operands = new ArrayList<>();
        List<Token> operators = new ArrayList<>();
        operands.add(unary());
        while (match(TokenType.CARET)) {
            operators.add(previous());
            operands.add(unary());
        }
        Expression expr = operands.get(operands.size() - 1);
        for (int i = operators.size() - 1; i >= 0; i--) {
            expr = new BinaryExpr(operators.get(i), BinaryOperator.POWER, operands.get(i), expr);
        }
        return expr;
    }

    private Expression unary() {
        if (match(TokenType.MINUS)) {
            Token operator = previous();
            enterNesting(operator);
            try {
                return new UnaryExpr(operator, UnaryOperator.NEGATE, unary());
            } finally {
                exitNesting();
            }
        }
        return primary();
    }

    private Expression primary() {
        Token token = peek();
        switch (token.type()) {
            case NUMBER -> {
                advance();
                return new Literal(token, token.value());
            }
            case TRUE, FALSE -> {
                advance();
                return new Literal(token, token.type() == TokenType.TRUE);
            }
            case IDENTIFIER -> {
                advance();
                Expression expr;
                if (match(TokenType.LEFT_PAREN)) {
                    expr = new ApplyExpr(token, token.text(), arguments(token));
                } else {
                    expr = new VariableRef(token, token.text());
                }
                return indices(expr);
            }
            case LEFT_PAREN -> {
                advance();
                Expression inner = expression();
                consume(TokenType.RIGHT_PAREN, "')'");
                return inner;
            }
            default -> throw new SyntaxException("an expression", token, null);
        }
    }

    @Override
    public Expression indices(Expression target) {
        Expression expr = target;
        while (match(TokenType.LEFT_BRACKET)) {
            Expression index = expression();
            consume(TokenType.RIGHT_BRACKET, "']'");
            expr = new IndexExpr(target.token(), expr, index);
        }
        return expr;
    }

    @Override
    public List<Expression> arguments(Token owner) {
        List<Expression> arguments = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                arguments.add(expression());
                checkFanOut(arguments.size(), owner);
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "')'");
        return arguments;
    }

    // --- Token navigation ---

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        return peek().type() == type;
    }

    @Override
    public Token advance() {
        if (isAtEnd()) {
            return peek();
        }
        current++;
        return previous();
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    @Override
    public Token peek() {
        return tokens.get(current);
    }

    @Override
    public Token previous() {
        return tokens.get(current - 1);
    }

    @Override
    public Token consume(TokenType type, String expected) {
        if (check(type)) {
            return advance();
        }
        throw new SyntaxException(expected, peek(), null);
    }
}
