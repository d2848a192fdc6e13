package com.lattice.converter.parser;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.lattice.converter.model.ElementKind;
import com.lattice.converter.parser.SadToken.TokenType;

/**
 * Lexer for SAD lattice source, one physical line at a time.
 *
 * Rules are tried in priority order at each position. Comments and whitespace
 * are dropped; any character no rule accepts raises {@link LexException}.
 */
public class SadLexer {

    private static final List<Rule> RULES = List.of(
        new Rule("NUMBER", "[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?", TokenType.NUMBER),
        new Rule("ASSIGN", ":=", TokenType.ASSIGN),
        new Rule("EQUAL", "=", TokenType.EQUAL),
        new Rule("TERMINATOR", ";", TokenType.TERMINATOR),
        new Rule("COMMENT", "![^\\n]*", TokenType.COMMENT),
        new Rule("LPAREN", "\\(", TokenType.LPAREN),
        new Rule("RPAREN", "\\)", TokenType.RPAREN),
        new Rule("UNIT", "DEG(?![A-Za-z0-9_])", TokenType.UNIT),
        new Rule("IDENTIFIER", "[A-Za-z_][A-Za-z0-9_]*", TokenType.IDENTIFIER),
        new Rule("OPERATOR", "[+\\-*/]", TokenType.OPERATOR),
        new Rule("SKIP", "\\s+", null),
        new Rule("MISMATCH", ".", TokenType.ERROR)
    );

    private static final Pattern TOKEN_PATTERN = Pattern.compile(
        RULES.stream()
            .map(rule -> "(?<" + rule.group + ">" + rule.regex + ")")
            .collect(Collectors.joining("|")),
        Pattern.DOTALL
    );

    /**
     * Tokens of a single line. Each call to {@code iterator()} rescans the line,
     * and tokens are produced only as they are requested.
     *
     * @param line the line text, with or without its trailing newline
     * @param lineNumber physical line number used for token positions
     */
    public Iterable<SadToken> tokenize(String line, int lineNumber) {
        return () -> new LineIterator(line, lineNumber);
    }

    /**
     * Eagerly collects the tokens of a line.
     */
    public List<SadToken> tokenizeAll(String line, int lineNumber) {
        List<SadToken> tokens = new ArrayList<>();
        tokenize(line, lineNumber).forEach(tokens::add);
        return tokens;
    }

    private static final class Rule {
        private final String group;
        private final String regex;
        private final TokenType type;

        private Rule(String group, String regex, TokenType type) {
            this.group = group;
            this.regex = regex;
            this.type = type;
        }
    }

    private static final class LineIterator implements Iterator<SadToken> {
        private final Matcher matcher;
        private final int lineNumber;
        private SadToken pending;

        private LineIterator(String line, int lineNumber) {
            this.matcher = TOKEN_PATTERN.matcher(line);
            this.lineNumber = lineNumber;
        }

        @Override
        public boolean hasNext() {
            if (pending == null) {
                pending = advance();
            }
            return pending != null;
        }

        @Override
        public SadToken next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            SadToken token = pending;
            pending = null;
            return token;
        }

        private SadToken advance() {
            while (matcher.find()) {
                Rule rule = matchedRule();
                if (rule.type == null || rule.type == TokenType.COMMENT) {
                    continue;
                }

                String text = matcher.group();
                int column = matcher.start() + 1;

                if (rule.type == TokenType.ERROR) {
                    throw new LexException(SadToken.of(TokenType.ERROR, text, lineNumber, column));
                }
                if (rule.type == TokenType.IDENTIFIER && ElementKind.isKeyword(text)) {
                    return SadToken.of(TokenType.ELEMENT_TYPE, text, lineNumber, column);
                }
                return SadToken.of(rule.type, text, lineNumber, column);
            }
            return null;
        }

        private Rule matchedRule() {
            for (Rule rule : RULES) {
                if (matcher.start(rule.group) != -1) {
                    return rule;
                }
            }
            throw new IllegalStateException("No lexer rule matched '" + matcher.group() + "'");
        }
    }
}
