package com.probnet.xdsl.io;

import com.probnet.xdsl.Fixtures;
import com.probnet.xdsl.convert.XdslConverter;
import com.probnet.xdsl.graph.NetworkGraph;
import com.probnet.xdsl.graph.NodeKind;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class XdslWriterTest {

    private final XdslConverter converter = new XdslConverter();

    @Test
    public void testWrittenDocumentParsesBackToSameGraph() {
        NetworkGraph original = converter.parse(Fixtures.read("multiparent.xdsl"));
        NetworkGraph reparsed = converter.parse(XdslWriter.write(original));

        assertEquals(original.name(), reparsed.name());
        assertEquals(List.copyOf(original.ids()), List.copyOf(reparsed.ids()));
        for (String id : original.ids()) {
            assertEquals(original.node(id).states(), reparsed.node(id).states());
            assertEquals(original.node(id).parents(), reparsed.node(id).parents());
            assertEquals(original.table(id), reparsed.table(id));
        }
    }

    @Test
    public void testDecisionAndUtilityElements() {
        NetworkGraph graph = converter.parse(Fixtures.read("influence.xdsl"));
        String xml = XdslWriter.write(graph);

        assertTrue(xml.contains("<decision id=\"Umbrella\">"));
        assertTrue(xml.contains("<utility id=\"Satisfaction\">"));
        assertFalse("MAU weights are folded into the utility table", xml.contains("<mau"));

        NetworkGraph reparsed = converter.parse(xml);
        assertEquals(NodeKind.DECISION, reparsed.node("Umbrella").kind());
        assertArrayEquals(new double[] { 10, 50, 35, 0 }, reparsed.table("Satisfaction").values(), 1e-12);
    }

    @Test
    public void testDisplayInfoSurvives() {
        NetworkGraph graph = converter.parse(Fixtures.read("influence.xdsl"));
        NetworkGraph reparsed = converter.parse(XdslWriter.write(graph));

        assertEquals("Weather Outlook", reparsed.node("Weather").label());
        assertEquals("Prior belief about tomorrow", reparsed.node("Weather").display().getComment());
        assertArrayEquals(new int[] { 100, 40, 190, 90 }, reparsed.node("Weather").display().getPosition());
        assertEquals("Take umbrella?", reparsed.node("Umbrella").label());
        assertNull(reparsed.node("Forecast").display());
    }

    @Test
    public void testNoExtensionsWithoutDisplayInfo() {
        String xml = XdslWriter.write(converter.parse(Fixtures.read("simple.xdsl")));
        assertFalse(xml.contains("<extensions>"));
        assertTrue(xml.contains("<smile"));
        assertTrue(xml.contains("id=\"Simple\""));
    }
}
