package org.asymptote.compiler.frontend.lexer;

import org.asymptote.compiler.api.AnalysisContext;
import org.asymptote.compiler.api.AnalysisOptions;
import org.asymptote.compiler.api.LexicalException;
import org.asymptote.compiler.api.ResourceBudget;
import org.asymptote.compiler.api.ResourceLimitExceededException;
import org.asymptote.compiler.model.Token;
import org.asymptote.compiler.model.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class LexerTest {

    private static List<TokenType> types(String source) {
        return new Lexer(source).scanTokens().stream().map(Token::type).toList();
    }

    @Test
    void scansAssignmentWithEveryArrowEncoding() {
        for (String arrow : List.of("←", "🡨", "⟵", "<-", ":=")) {
            assertThat(types("x " + arrow + " 1"))
                    .as("arrow %s", arrow)
                    .containsExactly(TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.NUMBER, TokenType.EOF);
        }
    }

    @Test
    void keywordsAreCaseInsensitive() {
        assertThat(types("for i ← 1 To n Do end FOR"))
                .containsExactly(TokenType.FOR, TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.NUMBER,
                        TokenType.TO, TokenType.IDENTIFIER, TokenType.DO, TokenType.END, TokenType.FOR, TokenType.EOF);
    }

    @Test
    void skipsBothCommentStyles() {
        List<Token> tokens = new Lexer("x ← 1 ► set x\n// whole line\ny ← 2").scanTokens();

        assertThat(tokens).extracting(Token::text).containsExactly("x", "←", "1", "y", "←", "2", "");
        assertThat(tokens.get(3).line()).isEqualTo(3);
        assertThat(tokens.get(3).column()).isEqualTo(1);
    }

    @Test
    void recognizesComparisonOperators() {
        assertThat(types("a <= b ≤ c >= d ≥ e <> f != g ≠ h == i = j < k > l"))
                .filteredOn(TokenType::isComparison)
                .containsExactly(TokenType.LESS_EQUAL, TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL,
                        TokenType.GREATER_EQUAL, TokenType.NOT_EQUAL, TokenType.NOT_EQUAL, TokenType.NOT_EQUAL,
                        TokenType.EQUAL, TokenType.EQUAL, TokenType.LESS, TokenType.GREATER);
    }

    @Test
    void parsesIntegerAndRealLiterals() {
        List<Token> tokens = new Lexer("42 3.5 .25").scanTokens();

        assertThat(tokens.get(0).value()).isEqualTo(42L);
        assertThat(tokens.get(1).value()).isEqualTo(3.5);
        assertThat(tokens.get(2).value()).isEqualTo(0.25);
    }

    @Test
    void countsSupplementaryCharactersAsOneColumn() {
        List<Token> tokens = new Lexer("x 🡨 y").scanTokens();

        assertThat(tokens.get(2).column()).isEqualTo(5);
    }

    @Test
    void emptyInputYieldsOnlyEof() {
        assertThat(types("   \n\t ")).containsExactly(TokenType.EOF);
    }

    @Test
    void reportsTheFirstIllegalCharacterWithItsPosition() {
        assertThatThrownBy(() -> new Lexer("x ← 1\ny ← @ # 2").scanTokens())
                .isInstanceOfSatisfying(LexicalException.class, e -> {
                    assertThat(e.getOffendingCharacter()).isEqualTo("@");
                    assertThat(e.getLine()).isEqualTo(2);
                    assertThat(e.getColumn()).isEqualTo(5);
                });
    }

    @Test
    void loneColonIsIllegal() {
        assertThatThrownBy(() -> new Lexer("x : 1").scanTokens())
                .isInstanceOf(LexicalException.class)
                .hasMessageContaining("':'");
    }

    @Test
    void enforcesTheTokenBudget() {
        AnalysisContext context = AnalysisContext.start(
                AnalysisOptions.DEFAULT.withBudget(ResourceBudget.DEFAULT.withMaxTokens(3)));

        assertThatThrownBy(() -> new Lexer("a ← b + c", context).scanTokens())
                .isInstanceOfSatisfying(ResourceLimitExceededException.class,
                        e -> assertThat(e.getLimit()).isEqualTo(ResourceLimitExceededException.Limit.TOKENS));
    }
}
