package com.probnet.xdsl.io;

import com.probnet.xdsl.Fixtures;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.Assert.*;

public class XdslDocumentLoaderTest {

    @Test
    public void testLoadsTreeInDocumentOrder() {
        XmlElement root = XdslDocumentLoader.load(Fixtures.read("simple.xdsl"));

        assertEquals("smile", root.getName());
        assertEquals("Simple", root.attribute("id"));
        XmlElement nodes = root.child("nodes");
        assertNotNull(nodes);
        assertEquals(3, nodes.getChildren().size());
        assertEquals("A", nodes.getChildren().get(0).attribute("id"));
        assertEquals("C", nodes.getChildren().get(2).attribute("id"));

        XmlElement b = nodes.getChildren().get(1);
        assertEquals(2, b.children("state").size());
        assertEquals(List.of("A"), b.child("parents").tokens());
        assertEquals(List.of("0.9", "0.1", "0.2", "0.8"), b.child("probabilities").tokens());
    }

    @Test
    public void testLoadsFileHonoringDeclaredEncoding() throws Exception {
        XmlElement root = XdslDocumentLoader.loadFile(Fixtures.path("simple.xdsl"));
        assertEquals("Simple", root.attribute("id"));
    }

    @Test
    public void testLoadsLatin1Bytes() {
        String xml = "<?xml version=\"1.0\" encoding=\"ISO-8859-1\"?><smile id=\"Café\"><nodes/></smile>";
        XmlElement root = XdslDocumentLoader.load(new ByteArrayInputStream(xml.getBytes(StandardCharsets.ISO_8859_1)));
        assertEquals("Café", root.attribute("id"));
    }

    @Test
    public void testUnknownElementsPassThrough() {
        XmlElement root = XdslDocumentLoader.load("<smile><nodes><equation id=\"E\"/></nodes></smile>");
        assertEquals("equation", root.child("nodes").getChildren().get(0).getName());
    }

    @Test
    public void testCommentsAreDropped() {
        XmlElement root = XdslDocumentLoader.load(Fixtures.read("influence.xdsl"));
        assertEquals("Umbrella", root.attribute("id"));
        assertEquals(2, root.getChildren().size());
    }

    @Test
    public void testMalformedReportsPosition() {
        try {
            XdslDocumentLoader.load("<smile>\n<nodes>\n</smile>");
            fail("Expected MalformedDocumentException");
        } catch (MalformedDocumentException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("line 3"));
        }
    }

    @Test(expected = MalformedDocumentException.class)
    public void testEmptyInput() {
        XdslDocumentLoader.load("   ");
    }

    @Test(expected = MalformedDocumentException.class)
    public void testTruncatedInput() {
        XdslDocumentLoader.load("<smile id=\"x\"><nodes><cpt id=\"A\">");
    }

    @Test
    public void testExternalEntitiesAreNotResolved() {
        String xml = "<?xml version=\"1.0\"?><!DOCTYPE smile [<!ENTITY ext SYSTEM \"file:///etc/hostname\">]>"
                + "<smile id=\"x\"><nodes/></smile>";
        XmlElement root = XdslDocumentLoader.load(xml);
        assertEquals("x", root.attribute("id"));
    }
}
