package org.example.questionnaire.io;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;

import org.junit.jupiter.api.Test;

import org.example.questionnaire.model.CellRecord;
import org.example.questionnaire.validation.DiagramValidationException;
import org.example.questionnaire.validation.FindingCollector;
import org.example.questionnaire.validation.Severity;
import org.example.questionnaire.validation.ValidationLevel;

import static org.junit.jupiter.api.Assertions.*;

public class DrawioReaderTest {

    private static final String MODEL =
        "<mxGraphModel><root>"
        + "<mxCell id=\"0\"/>"
        + "<mxCell id=\"1\" parent=\"0\"/>"
        + "<mxCell id=\"a\" value=\"Start\" style=\"rounded=0;whiteSpace=wrap;\" vertex=\"1\" parent=\"1\">"
        + "<mxGeometry x=\"10\" y=\"20\" width=\"120\" height=\"60\" as=\"geometry\"/></mxCell>"
        + "<object id=\"d\" label=\"age &amp;gt; 5\" name=\"age\">"
        + "<mxCell style=\"rhombus;whiteSpace=wrap;\" vertex=\"1\" parent=\"1\">"
        + "<mxGeometry x=\"10\" y=\"120\" width=\"80\" height=\"80\" as=\"geometry\"/></mxCell></object>"
        + "<mxCell id=\"e\" value=\"\" style=\"edgeStyle=orthogonalEdgeStyle;\" edge=\"1\" parent=\"1\" source=\"a\" target=\"d\">"
        + "<mxGeometry relative=\"1\" as=\"geometry\"/></mxCell>"
        + "<mxCell id=\"bad\" vertex=\"1\" parent=\"1\"><mxGeometry x=\"ten\" width=\"5\" as=\"geometry\"/></mxCell>"
        + "<mxCell id=\"bare\" vertex=\"1\" parent=\"1\"/>"
        + "</root></mxGraphModel>";

    private final DrawioReader reader = new DrawioReader();

    private static List<DrawioReader.Page> read(String xml, FindingCollector findings) {
        return new DrawioReader().read(
            new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "test.drawio", findings);
    }

    private static CellRecord cell(DrawioReader.Page page, String id) {
        return page.cells().stream().filter(c -> id.equals(c.id())).findFirst().orElseThrow();
    }

    /** Compresses a page the way draw.io does: URL encoding, raw deflate, Base64. */
    private static String compress(String xml) {
        byte[] input = URLEncoder.encode(xml, StandardCharsets.UTF_8).getBytes(StandardCharsets.UTF_8);
        Deflater deflater = new Deflater(Deflater.BEST_COMPRESSION, true);
        deflater.setInput(input);
        deflater.finish();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[1024];
        while (!deflater.finished()) {
            out.write(buffer, 0, deflater.deflate(buffer));
        }
        deflater.end();
        return Base64.getEncoder().encodeToString(out.toByteArray());
    }

    @Test
    void readsPagesOfAnMxfile() {
        FindingCollector findings = new FindingCollector(ValidationLevel.NORMAL);
        List<DrawioReader.Page> pages = read(
            "<mxfile><diagram id=\"p1\" name=\"Cough\">" + MODEL + "</diagram>"
            + "<diagram name=\"Fever\">" + MODEL + "</diagram></mxfile>", findings);

        assertEquals(2, pages.size());
        assertEquals("p1", pages.get(0).id());
        assertEquals("Cough", pages.get(0).name());
        assertEquals("page-2", pages.get(1).id());
        assertEquals(7, pages.get(0).cells().size());
        assertTrue(findings.getFindings().isEmpty());
    }

    @Test
    void bareModelIsOnePage() {
        List<DrawioReader.Page> pages = read(MODEL, new FindingCollector(ValidationLevel.NORMAL));
        assertEquals(1, pages.size());
        assertEquals("page-1", pages.get(0).id());
    }

    @Test
    void cellAttributesAreRead() {
        DrawioReader.Page page = read(MODEL, new FindingCollector(ValidationLevel.NORMAL)).get(0);

        CellRecord a = cell(page, "a");
        assertTrue(a.isVertex());
        assertEquals("Start", a.rawLabel());
        assertEquals("1", a.parentId());
        assertEquals(120, a.geometry().width());
        assertEquals("0", a.style().get("rounded"));

        CellRecord e = cell(page, "e");
        assertTrue(e.isEdge());
        assertEquals("a", e.sourceId());
        assertEquals("d", e.targetId());
        assertTrue(e.geometry().isSane());

        assertFalse(cell(page, "0").isVertex());
    }

    @Test
    void objectWrapperAttributesWin() {
        DrawioReader.Page page = read(MODEL, new FindingCollector(ValidationLevel.NORMAL)).get(0);

        CellRecord d = cell(page, "d");
        assertEquals("age &gt; 5", d.rawLabel());
        assertEquals("age", d.attribute("name"));
        assertTrue(d.hasStyle("rhombus"));
        assertEquals("1", d.parentId());
    }

    @Test
    void unreadableGeometryIsKeptForTheBuilderToReport() {
        DrawioReader.Page page = read(MODEL, new FindingCollector(ValidationLevel.NORMAL)).get(0);

        assertTrue(Double.isNaN(cell(page, "bad").geometry().x()));
        assertFalse(cell(page, "bad").geometry().isSane());
        assertNull(cell(page, "bare").geometry());
    }

    @Test
    void compressedPagesAreInflated() {
        FindingCollector findings = new FindingCollector(ValidationLevel.NORMAL);
        List<DrawioReader.Page> pages = read(
            "<mxfile><diagram id=\"z\" name=\"Packed\">" + compress(MODEL) + "</diagram></mxfile>", findings);

        assertEquals(1, pages.size());
        assertEquals("age &gt; 5", cell(pages.get(0), "d").rawLabel());
    }

    @Test
    void emptyPageIsSkippedWithWarning() {
        FindingCollector findings = new FindingCollector(ValidationLevel.STRICT);
        List<DrawioReader.Page> pages = read(
            "<mxfile><diagram id=\"empty\"/><diagram id=\"full\">" + MODEL + "</diagram></mxfile>", findings);

        assertEquals(1, pages.size());
        assertEquals("full", pages.get(0).id());
        assertEquals(Severity.WARNING, findings.getFindings().get(0).severity());
        assertEquals("empty", findings.getFindings().get(0).location());
    }

    @Test
    void malformedXmlIsCritical() {
        FindingCollector lenient = new FindingCollector(ValidationLevel.LENIENT);
        DiagramValidationException e = assertThrows(DiagramValidationException.class,
            () -> read("<mxfile><diagram>", lenient));
        assertEquals(Severity.CRITICAL, e.getFinding().severity());
        assertEquals("test.drawio", e.getFinding().location());
    }

    @Test
    void unexpectedRootIsCritical() {
        DiagramValidationException e = assertThrows(DiagramValidationException.class,
            () -> read("<svg/>", new FindingCollector(ValidationLevel.LENIENT)));
        assertTrue(e.getFinding().message().contains("<svg>"));
    }

    @Test
    void undecodablePageIsCritical() {
        DiagramValidationException e = assertThrows(DiagramValidationException.class,
            () -> read("<mxfile><diagram id=\"x\">not base64 at all!</diagram></mxfile>",
                new FindingCollector(ValidationLevel.LENIENT)));
        assertEquals("x", e.getFinding().location());
    }

    @Test
    void doctypeIsRejected() {
        assertThrows(DiagramValidationException.class, () -> read(
            "<?xml version=\"1.0\"?><!DOCTYPE mxfile [<!ENTITY x \"y\">]><mxfile/>",
            new FindingCollector(ValidationLevel.LENIENT)));
    }

    @Test
    void inflateReversesDrawioCompression() throws Exception {
        assertEquals("<a b=\"c d\"/>", DrawioReader.inflate(compress("<a b=\"c d\"/>")));
    }

    @Test
    void inflatingStopsAtTheSizeLimit() throws Exception {
        String packed = compress("a".repeat(5000));
        assertThrows(DataFormatException.class, () -> DrawioReader.inflate(packed, 1000));
        assertEquals(5000, DrawioReader.inflate(packed, 5000).length());
    }
}
