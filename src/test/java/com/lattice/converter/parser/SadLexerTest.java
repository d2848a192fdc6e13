package com.lattice.converter.parser;

import com.lattice.converter.parser.SadToken.TokenType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SadLexer.
 */
class SadLexerTest {

    private final SadLexer lexer = new SadLexer();

    @ParameterizedTest
    @CsvSource({
            "1.0,     1.0",
            "42,      42.0",
            ".5,      0.5",
            "-2.5,    -2.5",
            "+3,      3.0",
            "1e-3,    0.001",
            "2.5E+2,  250.0",
            "7.,      7.0"
    })
    void testNumberForms(String text, double expected) {
        List<SadToken> tokens = lexer.tokenizeAll(text, 1);

        assertThat(tokens).hasSize(1);
        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.NUMBER);
        assertThat(tokens.get(0).getText()).isEqualTo(text);
        assertThat(tokens.get(0).getValue()).isEqualTo(expected);
    }

    @Test
    void testElementStatementTokens() {
        List<SadToken> tokens = lexer.tokenizeAll("QUAD Q1 = (L=1.0 K1=-0.2);\n", 1);

        assertThat(tokens).extracting(SadToken::getType).containsExactly(
                TokenType.ELEMENT_TYPE, TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.LPAREN,
                TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.NUMBER,
                TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.NUMBER,
                TokenType.RPAREN, TokenType.TERMINATOR);
        assertThat(tokens).extracting(SadToken::getText).containsExactly(
                "QUAD", "Q1", "=", "(", "L", "=", "1.0", "K1", "=", "-0.2", ")", ";");
    }

    @Test
    void testKeywordsAreCaseSensitive() {
        List<SadToken> tokens = lexer.tokenizeAll("DRIFT drift Drift", 1);

        assertThat(tokens).extracting(SadToken::getType).containsExactly(
                TokenType.ELEMENT_TYPE, TokenType.IDENTIFIER, TokenType.IDENTIFIER);
    }

    @Test
    void testEveryElementKeywordIsRetagged() {
        String line = "QUAD MARK CAVI BEAMBEAM APERT SOL DRIFT BEND SEXT OCT MULT MONI LINE MAP COORD";

        assertThat(lexer.tokenizeAll(line, 1))
                .hasSize(15)
                .allSatisfy(token -> assertThat(token.getType()).isEqualTo(TokenType.ELEMENT_TYPE));
    }

    @Test
    void testUnitAssignAndOperators() {
        List<SadToken> tokens = lexer.tokenizeAll("ANGLE=90 DEG X:=A*B/C+D-E", 1);

        assertThat(tokens).extracting(SadToken::getType).containsExactly(
                TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.NUMBER, TokenType.UNIT,
                TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.IDENTIFIER, TokenType.OPERATOR,
                TokenType.IDENTIFIER, TokenType.OPERATOR, TokenType.IDENTIFIER, TokenType.OPERATOR,
                TokenType.IDENTIFIER, TokenType.OPERATOR, TokenType.IDENTIFIER);
    }

    @Test
    void testIdentifierStartingWithDegIsNotAUnit() {
        List<SadToken> tokens = lexer.tokenizeAll("DEGREE", 1);

        assertThat(tokens).singleElement()
                .satisfies(token -> assertThat(token.getType()).isEqualTo(TokenType.IDENTIFIER));
    }

    @Test
    void testCommentsAndWhitespaceAreDropped() {
        List<SadToken> tokens = lexer.tokenizeAll("  D1 = (L=1) ! a drift @ with odd characters\r\n", 1);

        assertThat(tokens).extracting(SadToken::getText).containsExactly("D1", "=", "(", "L", "=", "1", ")");
    }

    @Test
    void testPositionsAreOneBased() {
        List<SadToken> tokens = lexer.tokenizeAll("  Q1=(L=1);", 7);

        SadToken name = tokens.get(0);
        assertThat(name.getLine()).isEqualTo(7);
        assertThat(name.getColumn()).isEqualTo(3);
        assertThat(tokens.get(tokens.size() - 1).getColumn()).isEqualTo(11);
    }

    @Test
    void testUnexpectedCharacterRaisesLexException() {
        assertThatThrownBy(() -> lexer.tokenizeAll("D1 = (L=1 @)", 12))
                .isInstanceOf(LexException.class)
                .hasMessageContaining("'@'")
                .hasMessageContaining("line 12")
                .satisfies(e -> {
                    LexException lex = (LexException) e;
                    assertThat(lex.getLine()).isEqualTo(12);
                    assertThat(lex.getColumn()).isEqualTo(11);
                    assertThat(lex.getCharacter()).isEqualTo('@');
                    assertThat(lex.getOffendingToken().getType()).isEqualTo(TokenType.ERROR);
                });
    }

    @Test
    void testTokensAreProducedLazily() {
        Iterator<SadToken> it = lexer.tokenize("D1 = (L=1); @", 1).iterator();

        assertThat(it.next().getText()).isEqualTo("D1");
        assertThat(it.next().getType()).isEqualTo(TokenType.EQUAL);

        // the bad character only surfaces once the iterator reaches it
        for (int i = 0; i < 6; i++) {
            it.next();
        }
        assertThatThrownBy(it::hasNext).isInstanceOf(LexException.class);
    }

    @Test
    void testIterationIsRestartable() {
        Iterable<SadToken> tokens = lexer.tokenize("MARK IP=();", 3);

        List<SadToken> first = new ArrayList<>();
        tokens.forEach(first::add);
        List<SadToken> second = new ArrayList<>();
        tokens.forEach(second::add);

        assertThat(first).hasSize(6).isEqualTo(second);
    }

    @Test
    void testTokensCompareAndPrintByContent() {
        SadToken first = lexer.tokenizeAll("Q1", 4).get(0);
        SadToken second = lexer.tokenizeAll("Q1", 4).get(0);

        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
        assertThat(first).isNotEqualTo(lexer.tokenizeAll("Q1", 5).get(0));
        assertThat(first.toString()).contains("IDENTIFIER").contains("Q1");
        assertThat(lexer.tokenizeAll("2.5", 1)).isEqualTo(lexer.tokenizeAll("2.5", 1));
    }

    @Test
    void testNonNumericTokenHasNoValue() {
        SadToken token = lexer.tokenizeAll("Q1", 1).get(0);

        assertThatThrownBy(token::getValue).isInstanceOf(IllegalStateException.class);
    }
}
