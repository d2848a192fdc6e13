package com.lattice.converter.parser;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.lattice.converter.model.BeamlineEntry;
import com.lattice.converter.model.ElementDefinition;
import com.lattice.converter.model.LatticeModel;
import com.lattice.converter.model.ParseDiagnostics;
import com.lattice.converter.model.StatementResult;
import com.lattice.converter.parser.SadToken.TokenType;

/**
 * Builds a {@link LatticeModel} from SAD source text.
 *
 * Lines pass through a {@link SectionSkipFilter}, are lexed, and their tokens
 * collect in a pending buffer until a {@code ;} hands the whole statement to the
 * {@link StatementAutomaton}. Later element definitions replace earlier ones of
 * the same name, and the most recent non-empty LINE becomes the beamline.
 */
public class LatticeModelBuilder {
    private static final Logger log = LoggerFactory.getLogger(LatticeModelBuilder.class);

    private final SadLexer lexer;
    private final StatementAutomaton automaton;

    public LatticeModelBuilder() {
        this(new SadLexer(), new StatementAutomaton());
    }

    public LatticeModelBuilder(SadLexer lexer, StatementAutomaton automaton) {
        this.lexer = lexer;
        this.automaton = automaton;
    }

    /**
     * Parses a SAD file. A file that cannot be read is recorded as an error in
     * {@code diagnostics} and yields {@link LatticeModel#empty()}.
     *
     * @throws LexException if the source holds a character the lexer rejects
     */
    public LatticeModel build(Path source, Charset charset, ParseDiagnostics diagnostics) {
        String text;
        try {
            text = readSource(source, charset);
        } catch (FileAccessException e) {
            log.warn(e.getMessage());
            diagnostics.error(e.getMessage());
            return LatticeModel.empty();
        }

        log.info("Parsing SAD file: {}", source.getFileName());
        return build(text, diagnostics);
    }

    /**
     * Parses SAD source held in memory.
     *
     * @throws LexException if the source holds a character the lexer rejects
     */
    public LatticeModel build(String text, ParseDiagnostics diagnostics) {
        SectionSkipFilter filter = new SectionSkipFilter();
        List<SadToken> pending = new ArrayList<>();
        Map<String, ElementDefinition> elements = new LinkedHashMap<>();
        List<BeamlineEntry> beamline = new ArrayList<>();

        int lineNumber = 0;
        Iterator<String> lines = text.lines().iterator();
        while (lines.hasNext()) {
            String line = lines.next();
            lineNumber++;

            if (!filter.accept(line)) {
                continue;
            }

            for (SadToken token : lexer.tokenize(line, lineNumber)) {
                pending.add(token);
                if (!token.is(TokenType.TERMINATOR)) {
                    continue;
                }

                StatementResult result = automaton.process(pending, diagnostics);
                pending.clear();

                for (ElementDefinition element : result.getElements()) {
                    if (elements.put(element.getName(), element) != null) {
                        diagnostics.warn("Element " + element.getName() + " redefined at line " + lineNumber
                                + "; the later definition is kept");
                    }
                }
                if (result.hasBeamline()) {
                    beamline = new ArrayList<>(result.getBeamline());
                }
            }
        }

        if (!pending.isEmpty()) {
            diagnostics.warn("Statement starting at " + pending.get(0).position()
                    + " has no terminating ';' and was ignored");
        }
        if (filter.getDroppedLines() > 0) {
            diagnostics.info("Skipped " + filter.getDroppedLines() + " line(s) of MOMENTUM sections");
        }

        LatticeModel model = new LatticeModel(elements, beamline);
        for (BeamlineEntry entry : model.getUnresolvedEntries()) {
            diagnostics.warn("Beamline references undefined element " + entry.getElementName());
        }

        log.info("Parsed {} elements and {} beamline entries from {} lines",
                model.getElementCount(), model.getBeamline().size(), lineNumber);
        return model;
    }

    private String readSource(Path source, Charset charset) {
        try {
            return Files.readString(source, charset);
        } catch (IOException e) {
            throw new FileAccessException(source, e);
        }
    }
}
