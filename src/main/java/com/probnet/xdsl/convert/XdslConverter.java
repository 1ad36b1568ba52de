package com.probnet.xdsl.convert;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.probnet.xdsl.emit.DiagramEmitter;
import com.probnet.xdsl.emit.DiagramModelSink;
import com.probnet.xdsl.emit.PyAgrumScriptSink;
import com.probnet.xdsl.extract.ExtractionResult;
import com.probnet.xdsl.extract.GraphExtractor;
import com.probnet.xdsl.graph.NetworkGraph;
import com.probnet.xdsl.io.XdslDocumentLoader;
import com.probnet.xdsl.io.XmlElement;
import com.probnet.xdsl.model.InfluenceDiagram;
import com.probnet.xdsl.validate.GraphValidator;
import com.probnet.xdsl.validate.ValidationReport;

/**
 * Entry point for converting XDSL documents.
 * <p>
 * This class handles:
 * <ul>
 * <li>Loading the markup with {@link XdslDocumentLoader}</li>
 * <li>Extracting and validating the intermediate {@link NetworkGraph}</li>
 * <li>Emitting a pyAgrum script or an {@link InfluenceDiagram} from it</li>
 * </ul>
 * <p>
 * Holds no per-document state: every call builds its own graph, so one
 * instance may serve several threads converting different documents.
 */
public final class XdslConverter {
    private static final Logger log = LogManager.getLogger(XdslConverter.class);

    private final boolean applyMauWeights;
    private final boolean includeComments;
    private final String diagramVariable;
    private final GraphValidator validator = new GraphValidator();
    private final DiagramEmitter emitter = new DiagramEmitter();

    public XdslConverter() {
        this(new ConversionOptions());
    }

    /** Options are read once; later changes to {@code options} have no effect. */
    public XdslConverter(ConversionOptions options) {
        this.applyMauWeights = options.isApplyMauWeights();
        this.includeComments = options.isIncludeComments();
        this.diagramVariable = options.getDiagramVariable();
    }

    /**
     * Loads, extracts and validates without emitting anything.
     *
     * @throws com.probnet.xdsl.io.MalformedDocumentException if the markup is not well-formed
     */
    public ValidationReport check(String xdsl) {
        return analyze(XdslDocumentLoader.load(xdsl)).report();
    }

    public ValidationReport checkFile(Path path) throws IOException {
        return analyze(XdslDocumentLoader.loadFile(path)).report();
    }

    /**
     * Loads, extracts and validates a document.
     *
     * @return the validated graph, ready for {@link #generateScript} or {@link #buildModel}
     * @throws com.probnet.xdsl.io.MalformedDocumentException       if the markup is not well-formed
     * @throws com.probnet.xdsl.validate.XdslValidationException if any validation issue was found
     */
    public NetworkGraph parse(String xdsl) {
        return parse(XdslDocumentLoader.load(xdsl));
    }

    public NetworkGraph parseFile(Path path) throws IOException {
        return parse(XdslDocumentLoader.loadFile(path));
    }

    private NetworkGraph parse(XmlElement root) {
        Analysis a = analyze(root);
        a.report().throwIfInvalid();
        log.info("Parsed network {}: {} nodes, {} arcs", a.graph().name(), a.graph().nodeCount(),
                a.graph().arcs().size());
        return a.graph();
    }

    private Analysis analyze(XmlElement root) {
        ExtractionResult extraction = new GraphExtractor(applyMauWeights).extract(root);
        ValidationReport report = validator.validate(extraction);
        if (!report.isEmpty())
            log.warn("Network {} has {} validation issue(s)", extraction.graph().name(), report.size());
        return new Analysis(extraction.graph(), report);
    }

    /** Renders a validated graph as a pyAgrum script. */
    public String generateScript(NetworkGraph graph) {
        return emitter.emit(graph, new PyAgrumScriptSink(diagramVariable, includeComments));
    }

    /** Builds a validated graph into an in-memory influence diagram. */
    public InfluenceDiagram buildModel(NetworkGraph graph) {
        return emitter.emit(graph, new DiagramModelSink());
    }

    /** Parse followed by the generation step of the selected mode. */
    public ConversionResult convert(String xdsl, OutputMode mode) {
        NetworkGraph graph = parse(xdsl);
        return switch (mode) {
            case SCRIPT -> ConversionResult.script(graph, generateScript(graph));
            case MODEL -> ConversionResult.model(graph, buildModel(graph));
        };
    }

    /** File pass-through: reads {@code in}, writes the script to {@code out}. */
    public void convertFile(Path in, Path out) throws IOException {
        String script = generateScript(parseFile(in));
        Files.writeString(out, script, StandardCharsets.UTF_8);
        log.info("Wrote pyAgrum script for {} to {}", in.getFileName(), out);
    }

    private record Analysis(NetworkGraph graph, ValidationReport report) {
    }
}
