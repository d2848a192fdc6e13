package com.lattice.converter.parser;

import com.lattice.converter.model.BeamlineEntry;
import com.lattice.converter.model.ElementDefinition;
import com.lattice.converter.model.ElementKind;
import com.lattice.converter.model.ParseDiagnostics;
import com.lattice.converter.model.StatementResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for StatementAutomaton.
 */
class StatementAutomatonTest {

    private final SadLexer lexer = new SadLexer();
    private final StatementAutomaton automaton = new StatementAutomaton();
    private final ParseDiagnostics diagnostics = new ParseDiagnostics();

    @Test
    void testKeywordAfterEqualsForm() {
        StatementResult result = process("Q1 = QUAD(L=1.0 K1=2.0);");

        assertThat(result.getElements()).singleElement().satisfies(q1 -> {
            assertThat(q1.getKind()).isEqualTo(ElementKind.QUAD);
            assertThat(q1.getName()).isEqualTo("Q1");
            assertThat(q1.getParameters()).containsExactlyInAnyOrderEntriesOf(
                    Map.of("L", 1.0, "K1", 2.0));
        });
        assertThat(result.isLineStatement()).isFalse();
        assertThat(result.getBeamline()).isEmpty();
        assertThat(diagnostics.getWarnings()).isEmpty();
    }

    @Test
    void testKeywordAppliesToEveryFollowingBody() {
        StatementResult result = process("DRIFT D1=(L=1.0) D2=(L=2.5) LD=(L=0.1);");

        assertThat(result.getElements()).extracting(ElementDefinition::getName).containsExactly("D1", "D2", "LD");
        assertThat(result.getElements()).allSatisfy(e -> assertThat(e.getKind()).isEqualTo(ElementKind.DRIFT));
        assertThat(result.getElements().get(1).parameter("L")).isEqualTo(2.5);
    }

    @Test
    void testKeywordCanChangeWithinStatement() {
        StatementResult result = process("DRIFT D1=(L=1) QUAD Q1=(L=0.2 K1=0.1);");

        assertThat(result.getElements()).extracting(ElementDefinition::getKind)
                .containsExactly(ElementKind.DRIFT, ElementKind.QUAD);
    }

    @Test
    void testDegreeUnitConvertsToRadians() {
        StatementResult result = process("B1 = BEND(ANGLE=90 DEG E1=0.5);");

        ElementDefinition bend = result.getElements().get(0);
        assertThat(bend.parameter("ANGLE")).isCloseTo(Math.PI / 2, within(1e-12));
        assertThat(bend.parameter("E1")).isEqualTo(0.5);
    }

    @Test
    void testRepeatedParameterKeepsLastValue() {
        StatementResult result = process("QUAD Q1=(K1=1 K1=3);");

        assertThat(result.getElements().get(0).parameter("K1")).isEqualTo(3.0);
    }

    @Test
    void testUnsetParameterReadsZero() {
        StatementResult result = process("MARK IP=();");

        ElementDefinition ip = result.getElements().get(0);
        assertThat(ip.getParameters()).isEmpty();
        assertThat(ip.parameter("L")).isZero();
        assertThat(ip.hasParameter("L")).isFalse();
    }

    @Test
    void testLineStatementProducesBeamlineOnly() {
        StatementResult result = process("RING = LINE(D1 Q1 D2);");

        assertThat(result.isLineStatement()).isTrue();
        assertThat(result.getElements()).isEmpty();
        assertThat(result.getBeamline()).containsExactly(
                BeamlineEntry.forward("D1"), BeamlineEntry.forward("Q1"), BeamlineEntry.forward("D2"));
    }

    @Test
    void testLeadingMinusMarksReversedEntry() {
        StatementResult result = process("LINE CELL=(QF -B1 QD);");

        assertThat(result.getBeamline()).containsExactly(
                BeamlineEntry.forward("QF"), BeamlineEntry.reversed("B1"), BeamlineEntry.forward("QD"));
        assertThat(diagnostics.getWarnings()).isEmpty();
    }

    @Test
    void testOtherOperatorsInLineAreReported() {
        StatementResult result = process("LINE ARC=(2*CELL D1);");

        assertThat(result.getBeamline()).extracting(BeamlineEntry::getElementName).containsExactly("CELL", "D1");
        assertThat(diagnostics.getWarnings()).hasSize(2);
        assertThat(diagnostics.getWarnings().get(0)).contains("NUMBER '2'").contains("LINE ARC");
        assertThat(diagnostics.getWarnings().get(1)).contains("OPERATOR '*'");
    }

    @Test
    void testMultipleLinesInOneStatementAreConcatenated() {
        StatementResult result = process("LINE A=(X Y) B=(Z);");

        assertThat(result.getBeamline()).extracting(BeamlineEntry::getElementName).containsExactly("X", "Y", "Z");
    }

    @Test
    void testKeywordFormAfterLineBodyDefinesElement() {
        StatementResult result = process("LINE R=(A B) Q1 = QUAD(L=1);");

        assertThat(result.isLineStatement()).isTrue();
        assertThat(result.getBeamline()).extracting(BeamlineEntry::getElementName).containsExactly("A", "B");
        assertThat(result.getElements()).singleElement().satisfies(q1 -> {
            assertThat(q1.getName()).isEqualTo("Q1");
            assertThat(q1.getKind()).isEqualTo(ElementKind.QUAD);
            assertThat(q1.parameter("L")).isEqualTo(1.0);
        });
        assertThat(diagnostics.getWarnings()).isEmpty();
    }

    @Test
    void testUnmatchedTokensInBodyAreReported() {
        StatementResult result = process("QUAD Q1=(L=1 K1=0.2 +3 TILT);");

        ElementDefinition q1 = result.getElements().get(0);
        assertThat(q1.getParameters()).containsOnlyKeys("L", "K1");
        assertThat(diagnostics.getWarnings())
                .hasSize(2)
                .allSatisfy(warning -> assertThat(warning).contains("element Q1"));
    }

    @Test
    void testTopLevelCommandsAreIgnoredSilently() {
        StatementResult result = process("USE RING;");

        assertThat(result.getElements()).isEmpty();
        assertThat(result.getBeamline()).isEmpty();
        assertThat(diagnostics.getWarnings()).isEmpty();
    }

    @Test
    void testUnknownTypeWordDoesNotCreateElement() {
        StatementResult result = process("Q1 = FOO(L=1);");

        assertThat(result.getElements()).isEmpty();
    }

    @Test
    void testBodyWithoutKeywordIsUnrecognized() {
        StatementResult result = process("X1=(L=2);");

        ElementDefinition x1 = result.getElements().get(0);
        assertThat(x1.getKind()).isEqualTo(ElementKind.UNRECOGNIZED);
        assertThat(x1.getRawKind()).isEqualTo(ElementDefinition.NO_KIND);
        assertThat(x1.isRecognized()).isFalse();
        assertThat(x1.parameter("L")).isEqualTo(2.0);
    }

    @Test
    void testUnclosedBodyIsKeptAndReported() {
        StatementResult result = process("DRIFT D1=(L=1;");

        assertThat(result.getElements()).singleElement()
                .satisfies(d1 -> assertThat(d1.parameter("L")).isEqualTo(1.0));
        assertThat(diagnostics.getWarnings()).singleElement()
                .satisfies(warning -> assertThat(warning).contains("element D1").contains("not closed"));
    }

    @Test
    void testMultiLineStatementMatchesSingleLine() {
        StatementResult split = process("Q2 = QUAD(\n L=2.0\n);");
        StatementResult single = process("Q2 = QUAD(L=2.0);");

        assertThat(split.getElements()).isEqualTo(single.getElements());
    }

    @Test
    void testTokensAfterTerminatorAreDiscarded() {
        List<SadToken> tokens = new ArrayList<>(lexer.tokenizeAll("DRIFT D1=(L=1);", 1));
        tokens.addAll(lexer.tokenizeAll("D2=(L=2)", 2));

        StatementResult result = automaton.process(tokens, diagnostics);

        assertThat(result.getElements()).extracting(ElementDefinition::getName).containsExactly("D1");
    }

    private StatementResult process(String source) {
        List<SadToken> tokens = new ArrayList<>();
        String[] lines = source.split("\n");
        for (int i = 0; i < lines.length; i++) {
            tokens.addAll(lexer.tokenizeAll(lines[i], i + 1));
        }
        return automaton.process(tokens, diagnostics);
    }
}
