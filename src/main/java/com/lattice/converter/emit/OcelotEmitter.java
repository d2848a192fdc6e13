package com.lattice.converter.emit;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.lattice.converter.model.BeamlineEntry;
import com.lattice.converter.model.ElementDefinition;
import com.lattice.converter.model.LatticeModel;
import com.lattice.converter.model.ParseDiagnostics;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders a {@link LatticeModel} as an OCELOT lattice script.
 *
 * Element lines come from {@link OcelotElementMapper}; the surrounding script is
 * the {@code templates/ocelot-lattice.ftl} FreeMarker template. A terminal
 * {@code END} marker is always appended to the lattice list.
 */
public class OcelotEmitter {
    private static final Logger log = LoggerFactory.getLogger(OcelotEmitter.class);

    static final String TEMPLATE_NAME = "ocelot-lattice.ftl";

    private final Configuration freemarkerConfig;
    private final OcelotElementMapper mapper;

    public OcelotEmitter() {
        this(new OcelotElementMapper());
    }

    public OcelotEmitter(OcelotElementMapper mapper) {
        this.freemarkerConfig = createFreemarkerConfig();
        this.mapper = mapper;
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    /**
     * @throws IOException if the template cannot be loaded
     */
    public EmitResult emit(LatticeModel model, ParseDiagnostics diagnostics) throws IOException {
        EmitResult.EmitResultBuilder result = EmitResult.builder();

        List<String> elementLines = new ArrayList<>();
        for (ElementDefinition element : model.getElements().values()) {
            Optional<String> line = mapper.map(element, diagnostics);
            if (line.isPresent()) {
                elementLines.add(line.get());
            } else {
                elementLines.add("# Unrecognized type " + element);
                result.unrecognizedElement(element.getRawKind() + " (" + element.getName() + ")");
            }
        }

        List<String> beamline = new ArrayList<>();
        for (BeamlineEntry entry : model.getBeamline()) {
            if (entry.isReversed()) {
                diagnostics.warn("Reversed beamline entry -" + entry.getElementName()
                        + " emitted in forward orientation");
            }
            beamline.add(entry.getElementName());
        }

        Map<String, Object> dataModel = Map.of(
                "elementLines", elementLines,
                "beamline", beamline);

        Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
        StringWriter out = new StringWriter();
        try {
            template.process(dataModel, out);
        } catch (TemplateException e) {
            throw new IllegalStateException("Template " + TEMPLATE_NAME + " failed to render", e);
        }

        log.debug("Rendered {} element lines and {} beamline entries", elementLines.size(), beamline.size());
        return result.text(out.toString()).build();
    }
}
