package com.probnet.xdsl.emit;

import com.probnet.xdsl.Fixtures;
import com.probnet.xdsl.convert.XdslConverter;
import com.probnet.xdsl.graph.ArcRecord;
import com.probnet.xdsl.graph.NetworkGraph;
import com.probnet.xdsl.graph.NodeKind;
import com.probnet.xdsl.graph.NodeRecord;
import com.probnet.xdsl.model.InfluenceDiagram;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class DiagramEmitterTest {

    private final DiagramEmitter emitter = new DiagramEmitter();

    /** Records the directives it receives. */
    private static final class RecordingSink implements DiagramSink<List<String>> {
        private final List<String> calls = new ArrayList<>();

        @Override
        public void begin(NetworkGraph graph) {
            calls.add("begin " + graph.name());
        }

        @Override
        public void addNode(NodeRecord node) {
            calls.add("node " + node.id());
        }

        @Override
        public void addArc(ArcRecord arc) {
            calls.add("arc " + arc);
        }

        @Override
        public void fillTable(NodeRecord node, double[] values) {
            calls.add("table " + node.id() + " " + values.length);
        }

        @Override
        public List<String> finish() {
            calls.add("finish");
            return calls;
        }
    }

    @Test
    public void testDirectiveOrder() {
        NetworkGraph graph = new XdslConverter().parse(Fixtures.read("influence.xdsl"));
        List<String> calls = emitter.emit(graph, new RecordingSink());

        assertEquals(List.of(
                "begin Umbrella",
                "node Weather", "table Weather 2",
                "node Forecast", "arc Weather -> Forecast", "table Forecast 4",
                "node Umbrella", "arc Forecast -> Umbrella",
                "node Satisfaction", "arc Weather -> Satisfaction", "arc Umbrella -> Satisfaction",
                "table Satisfaction 4",
                "finish"), calls);
    }

    @Test
    public void testModelSinkFillsReindexedTables() {
        NetworkGraph graph = new XdslConverter().parse(Fixtures.read("multiparent.xdsl"));
        InfluenceDiagram diagram = emitter.emit(graph, new DiagramModelSink());

        assertEquals(3, diagram.size());
        assertEquals(List.of("Z", "X", "Y"), diagram.cpt("Z").names());
        // XDSL lists X outer, Y middle, Z inner
        assertEquals(0.6, diagram.cpt("Z").get(Map.of("X", "x1", "Y", "y0", "Z", "z1")), 0.0);
        assertEquals(0.3, diagram.cpt("Z").get(Map.of("X", "x0", "Y", "y2", "Z", "z0")), 0.0);
        assertEquals(0.5, diagram.cpt("Z").get(Map.of("X", "x1", "Y", "y1", "Z", "z0")), 0.0);
    }

    @Test(expected = IllegalStateException.class)
    public void testUnvalidatedCycleIsAnInternalError() {
        NetworkGraph graph = NetworkGraph.builder("bad")
                .addNode(new NodeRecord("A", NodeKind.DECISION, List.of("x"), List.of("B"), null))
                .addNode(new NodeRecord("B", NodeKind.DECISION, List.of("x"), List.of("A"), null))
                .build();
        emitter.emit(graph, new RecordingSink());
    }

    @Test(expected = IllegalStateException.class)
    public void testMissingTableIsAnInternalError() {
        NetworkGraph graph = NetworkGraph.builder("bad")
                .addNode(new NodeRecord("A", NodeKind.CHANCE, List.of("x"), List.of(), null))
                .build();
        emitter.emit(graph, new RecordingSink());
    }
}
