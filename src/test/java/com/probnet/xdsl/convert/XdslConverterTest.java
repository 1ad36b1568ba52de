package com.probnet.xdsl.convert;

import com.probnet.xdsl.Fixtures;
import com.probnet.xdsl.engine.TopologicalOrder;
import com.probnet.xdsl.graph.NetworkGraph;
import com.probnet.xdsl.io.MalformedDocumentException;
import com.probnet.xdsl.model.InfluenceDiagram;
import com.probnet.xdsl.validate.IssueKind;
import com.probnet.xdsl.validate.ValidationReport;
import com.probnet.xdsl.validate.XdslValidationException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.Assert.*;

public class XdslConverterTest {

    private static final List<String> VALID = List.of("simple.xdsl", "influence.xdsl", "multiparent.xdsl",
            "deterministic.xdsl", "unordered.xdsl");

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final XdslConverter converter = new XdslConverter();

    @Test
    public void testThreeNodeScenario() {
        NetworkGraph graph = converter.parse(Fixtures.read("simple.xdsl"));
        assertEquals(List.of("A", "B", "C"), TopologicalOrder.of(graph).ids());

        ConversionResult result = converter.convert(Fixtures.read("simple.xdsl"), OutputMode.MODEL);
        assertEquals(OutputMode.MODEL, result.mode());
        assertNull(result.script());

        InfluenceDiagram model = result.model();
        assertEquals(0.9, model.cpt("B").get(Map.of("A", "true", "B", "true")), 0.0);
        assertEquals(0.8, model.cpt("B").get(Map.of("A", "false", "B", "false")), 0.0);
        assertEquals(0.6, model.cpt("A").get(Map.of("A", "true")), 0.0);
        assertEquals(List.of("A"), model.parents("C"));
    }

    @Test
    public void testEveryCellSurvivesByLabel() {
        for (String name : VALID) {
            NetworkGraph graph = converter.parse(Fixtures.read(name));
            InfluenceDiagram model = converter.buildModel(graph);
            for (String id : graph.ids()) {
                if (!graph.node(id).kind().hasTable())
                    continue;
                double[] xdsl = graph.table(id).values();
                List<List<String>> axes = new ArrayList<>();
                List<String> names = new ArrayList<>(graph.node(id).parents());
                for (String p : names)
                    axes.add(graph.node(p).states());
                if (graph.node(id).kind().hasStates()) {
                    names.add(id);
                    axes.add(graph.node(id).states());
                }
                // walk the XDSL layout in order: last axis fastest
                int[] idx = new int[axes.size()];
                for (int flat = 0; flat < xdsl.length; flat++) {
                    Map<String, String> inst = new HashMap<>();
                    for (int a = 0; a < idx.length; a++)
                        inst.put(names.get(a), axes.get(a).get(idx[a]));
                    double actual = graph.node(id).kind().hasStates()
                            ? model.cpt(id).get(inst)
                            : model.utility(id).get(inst);
                    assertEquals(name + " " + id + " " + inst, xdsl[flat], actual, 0.0);
                    for (int a = idx.length - 1; a >= 0; a--) {
                        if (++idx[a] < axes.get(a).size())
                            break;
                        idx[a] = 0;
                    }
                }
            }
        }
    }

    @Test
    public void testOutputIsDeterministic() {
        for (String name : VALID) {
            String xdsl = Fixtures.read(name);
            assertEquals(name, converter.convert(xdsl, OutputMode.SCRIPT).script(),
                    new XdslConverter().convert(xdsl, OutputMode.SCRIPT).script());
        }
    }

    @Test
    public void testCyclicDocumentIsRejected() {
        try {
            converter.parse(Fixtures.read("cyclic.xdsl"));
            fail("Expected XdslValidationException");
        } catch (XdslValidationException e) {
            assertTrue(e.getReport().has(IssueKind.CYCLIC_GRAPH));
            assertEquals(1, e.getReport().size());
        }
    }

    @Test
    public void testSizeMismatchIsRejectedNamingNode() {
        try {
            converter.convert(Fixtures.read("size_mismatch.xdsl"), OutputMode.SCRIPT);
            fail("Expected XdslValidationException");
        } catch (XdslValidationException e) {
            assertEquals("WetGrass", e.getReport().issuesOf(IssueKind.TABLE_SIZE_MISMATCH).get(0).nodeId());
        }
    }

    @Test
    public void testCheckReturnsReportWithoutThrowing() {
        ValidationReport report = converter.check(Fixtures.read("dynamic.xdsl"));
        assertEquals(2, report.issuesOf(IssueKind.UNSUPPORTED_TEMPORAL_CONSTRUCT).size());
        assertEquals("Dynamic", report.document());
        assertTrue(converter.check(Fixtures.read("simple.xdsl")).isEmpty());
    }

    @Test(expected = MalformedDocumentException.class)
    public void testMalformedInput() {
        converter.parse("<smile><nodes></smile>");
    }

    @Test
    public void testOptions() {
        ConversionOptions options = new ConversionOptions();
        options.setApplyMauWeights(false);
        options.setIncludeComments(false);
        options.setDiagramVariable("id");
        XdslConverter custom = new XdslConverter(options);
        options.setDiagramVariable("changed");

        String script = custom.convert(Fixtures.read("influence.xdsl"), OutputMode.SCRIPT).script();
        assertTrue(script.contains("id = gum.InfluenceDiagram()"));
        assertTrue(script.contains("id.utility(\"Satisfaction\").fillWith([20.0, 70.0, 100.0, 0.0])"));
        assertFalse(script.contains("# "));
    }

    @Test
    public void testConvertFile() throws Exception {
        Path out = tmp.getRoot().toPath().resolve("simple.py");
        converter.convertFile(Fixtures.path("simple.xdsl"), out);

        String script = Files.readString(out, StandardCharsets.UTF_8);
        assertEquals(converter.convert(Fixtures.read("simple.xdsl"), OutputMode.SCRIPT).script(), script);
    }

    @Test
    public void testConcurrentConversions() throws Exception {
        List<String> expected = new ArrayList<>();
        for (String name : VALID)
            expected.add(converter.convert(Fixtures.read(name), OutputMode.SCRIPT).script());

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (int round = 0; round < 8; round++) {
                for (String name : VALID) {
                    String xdsl = Fixtures.read(name);
                    futures.add(pool.submit(() -> converter.convert(xdsl, OutputMode.SCRIPT).script()));
                }
            }
            for (int i = 0; i < futures.size(); i++)
                assertEquals(expected.get(i % VALID.size()), futures.get(i).get());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void testOutputModeFromString() {
        assertEquals(OutputMode.SCRIPT, OutputMode.fromString("script"));
        assertEquals(OutputMode.MODEL, OutputMode.fromString("MODEL"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownOutputMode() {
        OutputMode.fromString("pdf");
    }
}
