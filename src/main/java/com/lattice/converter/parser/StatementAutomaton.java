package com.lattice.converter.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.lattice.converter.model.BeamlineEntry;
import com.lattice.converter.model.ElementDefinition;
import com.lattice.converter.model.ElementKind;
import com.lattice.converter.model.ParseDiagnostics;
import com.lattice.converter.model.StatementResult;
import com.lattice.converter.parser.SadToken.TokenType;

/**
 * Turns the tokens of one terminated SAD statement into element definitions
 * and, for LINE statements, a beamline sequence.
 *
 * Recognized forms:
 * - {@code QUAD Q1=(L=1 K1=0.2) Q2=(L=1 K1=-0.2);} (keyword applies to every following body)
 * - {@code Q1 = QUAD(L=1 K1=0.2);}
 * - {@code LINE RING=(D1 Q1 -B1 D2);} (a leading minus marks a reversed entry)
 * - {@code ANGLE=90 DEG} inside a body stores the value in radians
 *
 * Tokens are consumed strictly in source order. Anything else is discarded; tokens
 * outside the per-state ignore list are reported as warnings.
 */
public class StatementAutomaton {
    private static final Logger log = LoggerFactory.getLogger(StatementAutomaton.class);

    private static final double DEGREES_TO_RADIANS = Math.PI / 180.0;

    enum State {
        IDLE,
        ELEMENT_BODY,
        LINE_BODY
    }

    /** Token kinds each state drops without a warning. */
    private static final Map<State, Set<TokenType>> IGNORABLE = Map.of(
            State.IDLE, EnumSet.of(TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.ASSIGN,
                    TokenType.NUMBER, TokenType.UNIT, TokenType.OPERATOR, TokenType.LPAREN),
            State.ELEMENT_BODY, EnumSet.noneOf(TokenType.class),
            State.LINE_BODY, EnumSet.noneOf(TokenType.class));

    public StatementResult process(List<SadToken> statement, ParseDiagnostics diagnostics) {
        return new StatementRun(statement, diagnostics).run();
    }

    /**
     * State of a single statement; discarded once the result is built.
     */
    private static final class StatementRun {
        private final Deque<SadToken> queue;
        private final ParseDiagnostics diagnostics;

        private final List<PendingElement> elements = new ArrayList<>();
        private final List<BeamlineEntry> beamline = new ArrayList<>();

        private State state = State.IDLE;
        private SadToken currentElementType;
        private boolean lineStatement;
        private boolean readingLines;
        private PendingElement openElement;
        private SadToken openName;

        private StatementRun(List<SadToken> statement, ParseDiagnostics diagnostics) {
            this.queue = new ArrayDeque<>(statement);
            this.diagnostics = diagnostics;
        }

        private StatementResult run() {
            while (!queue.isEmpty()) {
                SadToken token = queue.peekFirst();

                if (token.is(TokenType.TERMINATOR)) {
                    queue.pollFirst();
                    if (!queue.isEmpty()) {
                        log.debug("Dropping {} tokens after terminator at {}", queue.size(), token.position());
                        queue.clear();
                    }
                    break;
                }

                if (token.is(TokenType.ELEMENT_TYPE)) {
                    selectElementType(queue.pollFirst());
                    continue;
                }

                switch (state) {
                    case IDLE -> consumeIdle();
                    case ELEMENT_BODY -> consumeElementBody();
                    case LINE_BODY -> consumeLineBody();
                }
            }

            if (state != State.IDLE) {
                diagnostics.warn("Body of " + describeOpenBody() + " opened at " + openName.position()
                        + " is not closed before the end of the statement");
            }

            List<ElementDefinition> definitions = elements.stream()
                    .map(PendingElement::toDefinition)
                    .toList();
            return new StatementResult(definitions, beamline, lineStatement);
        }

        private void selectElementType(SadToken keyword) {
            currentElementType = keyword;
            if (ElementKind.fromKeyword(keyword.getText()) == ElementKind.LINE) {
                lineStatement = true;
                readingLines = true;
            }
        }

        private void consumeIdle() {
            if (matches(TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.LPAREN)) {
                SadToken name = queue.pollFirst();
                queue.pollFirst();
                queue.pollFirst();
                openBody(name);
                return;
            }

            if (matches(TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.ELEMENT_TYPE, TokenType.LPAREN)) {
                SadToken name = queue.pollFirst();
                queue.pollFirst();
                SadToken keyword = queue.pollFirst();
                selectElementType(keyword);
                // NAME = KEYWORD( names its own kind, even after a LINE body
                readingLines = ElementKind.fromKeyword(keyword.getText()) == ElementKind.LINE;
                queue.pollFirst();
                openBody(name);
                return;
            }

            discard(queue.pollFirst());
        }

        private void openBody(SadToken name) {
            openName = name;
            if (readingLines) {
                state = State.LINE_BODY;
                log.debug("Reading LINE {} at {}", name.getText(), name.position());
                return;
            }

            String rawKind = currentElementType != null ? currentElementType.getText() : ElementDefinition.NO_KIND;
            openElement = new PendingElement(ElementKind.fromKeyword(rawKind), rawKind, name.getText());
            elements.add(openElement);
            state = State.ELEMENT_BODY;
            log.debug("Reading {} {} at {}", rawKind, name.getText(), name.position());
        }

        private void consumeElementBody() {
            if (check(TokenType.RPAREN)) {
                queue.pollFirst();
                closeBody();
                return;
            }

            if (matches(TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.NUMBER)) {
                SadToken parameter = queue.pollFirst();
                queue.pollFirst();
                double value = queue.pollFirst().getValue();

                if (check(TokenType.UNIT)) {
                    queue.pollFirst();
                    value *= DEGREES_TO_RADIANS;
                }

                openElement.parameters.put(parameter.getText(), value);
                return;
            }

            discard(queue.pollFirst());
        }

        private void consumeLineBody() {
            if (check(TokenType.RPAREN)) {
                queue.pollFirst();
                closeBody();
                return;
            }

            SadToken token = queue.peekFirst();
            if (token.isOperator("-") && matches(TokenType.OPERATOR, TokenType.IDENTIFIER)) {
                queue.pollFirst();
                beamline.add(BeamlineEntry.reversed(queue.pollFirst().getText()));
                return;
            }

            if (check(TokenType.IDENTIFIER)) {
                beamline.add(BeamlineEntry.forward(queue.pollFirst().getText()));
                return;
            }

            discard(queue.pollFirst());
        }

        private void closeBody() {
            state = State.IDLE;
            openElement = null;
        }

        private void discard(SadToken token) {
            if (IGNORABLE.get(state).contains(token.getType())) {
                log.debug("Ignoring {} '{}' at {}", token.getType(), token.getText(), token.position());
                return;
            }

            String where = switch (state) {
                case IDLE -> "outside any element body";
                case ELEMENT_BODY, LINE_BODY -> "in body of " + describeOpenBody();
            };
            diagnostics.warn("Discarded " + token.getType() + " '" + token.getText() + "' " + where
                    + " at " + token.position());
        }

        private String describeOpenBody() {
            if (state == State.LINE_BODY) {
                return "LINE " + openName.getText();
            }
            return "element " + openName.getText();
        }

        private boolean check(TokenType type) {
            return !queue.isEmpty() && queue.peekFirst().is(type);
        }

        private boolean matches(TokenType... expected) {
            if (queue.size() < expected.length) {
                return false;
            }
            Iterator<SadToken> it = queue.iterator();
            for (TokenType type : expected) {
                if (!it.next().is(type)) {
                    return false;
                }
            }
            return true;
        }
    }

    /**
     * Element whose parameters are still being read.
     */
    private static final class PendingElement {
        private final ElementKind kind;
        private final String rawKind;
        private final String name;
        private final Map<String, Double> parameters = new LinkedHashMap<>();

        private PendingElement(ElementKind kind, String rawKind, String name) {
            this.kind = kind;
            this.rawKind = rawKind;
            this.name = name;
        }

        private ElementDefinition toDefinition() {
            return ElementDefinition.builder()
                    .kind(kind)
                    .rawKind(rawKind)
                    .name(name)
                    .parameters(parameters)
                    .build();
        }
    }
}
