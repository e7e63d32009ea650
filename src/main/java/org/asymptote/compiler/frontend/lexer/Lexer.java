package org.asymptote.compiler.frontend.lexer;

import org.asymptote.compiler.api.AnalysisContext;
import org.asymptote.compiler.api.LexicalException;
import org.asymptote.compiler.api.ResourceLimitExceededException;
import org.asymptote.compiler.model.Token;
import org.asymptote.compiler.model.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns pseudocode text into an ordered token sequence in a single left-to-right scan.
 * <p>
 * Whitespace, line breaks and comments ({@code ►} or {@code //} to end of line) separate
 * tokens and are never emitted. The assignment arrow is accepted as {@code ←}, {@code 🡨},
 * {@code ⟵}, {@code <-} and {@code :=}; all of them produce {@link TokenType#ASSIGN}.
 * Positions are tracked in code points so that supplementary characters count as one column.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private static final int LEFT_ARROW = 0x2190;
    private static final int LONG_LEFT_ARROW = 0x27F5;
    private static final int WIDE_HEADED_LEFT_ARROW = 0x1F868;
    private static final int COMMENT_MARKER = 0x25BA;
    private static final int LESS_EQUAL_SIGN = 0x2264;
    private static final int GREATER_EQUAL_SIGN = 0x2265;
    private static final int NOT_EQUAL_SIGN = 0x2260;

    private static final int CHECKPOINT_INTERVAL = 4096;

    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();
        for (TokenType type : TokenType.values()) {
            if (type.isKeyword()) {
                map.put(type.name(), type);
            }
        }
        KEYWORDS = Collections.unmodifiableMap(map);
    }

    private final int[] source;
    private final AnalysisContext context;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;
    private int steps = 0;

    /**
     * @param source  The pseudocode text.
     * @param context The request context supplying the token budget and cancellation.
     */
    public Lexer(String source, AnalysisContext context) {
        this.source = source.codePoints().toArray();
        this.context = context;
    }

    /**
     * Creates a lexer with default options, for tests and tools.
     */
    public Lexer(String source) {
        this(source, AnalysisContext.defaults());
    }

    /**
     * Scans the whole input.
     *
     * @return the tokens, terminated by one {@link TokenType#EOF} token.
     * @throws LexicalException               at the first unrecognized character.
     * @throws ResourceLimitExceededException if the token budget is exceeded.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            if (steps++ % CHECKPOINT_INTERVAL == 0) {
                context.checkpoint("lexing");
            }
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, line, column));
        LOG.debug("Lexed {} tokens from {} code points", tokens.size() - 1, source.length);
        return tokens;
    }

    private void scanToken() {
        int c = advance();
        switch (c) {
            case '(' -> addToken(TokenType.LEFT_PAREN);
            case ')' -> addToken(TokenType.RIGHT_PAREN);
            case '[' -> addToken(TokenType.LEFT_BRACKET);
            case ']' -> addToken(TokenType.RIGHT_BRACKET);
            case ',' -> addToken(TokenType.COMMA);
            case ';' -> addToken(TokenType.SEMICOLON);
            case '+' -> addToken(TokenType.PLUS);
            case '-' -> addToken(TokenType.MINUS);
            case '*' -> addToken(TokenType.STAR);
            case '^' -> addToken(TokenType.CARET);
            case '/' -> {
                if (match('/')) {
                    skipComment();
                } else {
                    addToken(TokenType.SLASH);
                }
            }
            case '<' -> {
                if (match('-')) {
                    addToken(TokenType.ASSIGN);
                } else if (match('=')) {
                    addToken(TokenType.LESS_EQUAL);
                } else if (match('>')) {
                    addToken(TokenType.NOT_EQUAL);
                } else {
                    addToken(TokenType.LESS);
                }
            }
            case '>' -> addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
            case '=' -> {
                match('=');
                addToken(TokenType.EQUAL);
            }
            case ':' -> {
                if (!match('=')) {
                    throw illegal(c);
                }
                addToken(TokenType.ASSIGN);
            }
            case '!' -> {
                if (!match('=')) {
                    throw illegal(c);
                }
                addToken(TokenType.NOT_EQUAL);
            }
            case LEFT_ARROW, LONG_LEFT_ARROW, WIDE_HEADED_LEFT_ARROW -> addToken(TokenType.ASSIGN);
            case LESS_EQUAL_SIGN -> addToken(TokenType.LESS_EQUAL);
            case GREATER_EQUAL_SIGN -> addToken(TokenType.GREATER_EQUAL);
            case NOT_EQUAL_SIGN -> addToken(TokenType.NOT_EQUAL);
            case COMMENT_MARKER -> skipComment();
            default -> {
                if (Character.isWhitespace(c) || Character.isSpaceChar(c)) {
                    return;
                }
                if (isDigit(c) || (c == '.' && isDigit(peek()))) {
                    number();
                } else if (isIdentifierStart(c)) {
                    identifier();
                } else {
                    throw illegal(c);
                }
            }
        }
    }

    private void skipComment() {
        while (!isAtEnd() && peek() != '\n') {
            advance();
        }
    }

    private void identifier() {
        while (isIdentifierPart(peek())) {
            advance();
        }
        String text = lexeme();
        TokenType type = KEYWORDS.getOrDefault(text.toUpperCase(Locale.ROOT), TokenType.IDENTIFIER);
        addToken(type);
    }

    private void number() {
        boolean real = source[start] == '.';
        while (isDigit(peek())) {
            advance();
        }
        if (!real && peek() == '.' && isDigit(peekNext())) {
            real = true;
            advance();
            while (isDigit(peek())) {
                advance();
            }
        }
        String text = lexeme();
        Object value;
        if (real || text.length() > 18) {
            value = Double.parseDouble(text);
        } else {
            value = Long.parseLong(text);
        }
        addToken(TokenType.NUMBER, value);
    }

    private LexicalException illegal(int c) {
        return new LexicalException(new String(Character.toChars(c)), startLine, startColumn);
    }

    // --- Character navigation ---

    private boolean isAtEnd() {
        return current >= source.length;
    }

    private int advance() {
        int c = source[current++];
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(int expected) {
        if (isAtEnd() || source[current] != expected) {
            return false;
        }
        advance();
        return true;
    }

    private int peek() {
        return isAtEnd() ? -1 : source[current];
    }

    private int peekNext() {
        return current + 1 >= source.length ? -1 : source[current + 1];
    }

    private String lexeme() {
        return new String(source, start, current - start);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object value) {
        int maxTokens = context.budget().maxTokens();
        if (tokens.size() >= maxTokens) {
            throw new ResourceLimitExceededException(ResourceLimitExceededException.Limit.TOKENS, maxTokens,
                    "at line " + startLine + ", column " + startColumn);
        }
        tokens.add(new Token(type, lexeme(), value, startLine, startColumn));
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(int c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
