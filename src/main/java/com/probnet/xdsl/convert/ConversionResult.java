package com.probnet.xdsl.convert;

import com.probnet.xdsl.graph.NetworkGraph;
import com.probnet.xdsl.model.InfluenceDiagram;

/**
 * Artifact of one conversion: the script or the model, depending on
 * {@link #mode()}, plus the validated graph it came from.
 */
public record ConversionResult(OutputMode mode, NetworkGraph graph, String script, InfluenceDiagram model) {

    static ConversionResult script(NetworkGraph graph, String script) {
        return new ConversionResult(OutputMode.SCRIPT, graph, script, null);
    }

    static ConversionResult model(NetworkGraph graph, InfluenceDiagram model) {
        return new ConversionResult(OutputMode.MODEL, graph, null, model);
    }
}
