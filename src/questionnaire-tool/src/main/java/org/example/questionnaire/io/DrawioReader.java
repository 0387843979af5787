package org.example.questionnaire.io;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import org.example.questionnaire.Logger;
import org.example.questionnaire.model.CellRecord;
import org.example.questionnaire.model.Geometry;
import org.example.questionnaire.style.StyleParser;
import org.example.questionnaire.validation.FindingCollector;

/**
 * Reads draw.io files into one cell list per page.
 *
 * Accepted layouts:
 *
 *   <mxfile><diagram id=".." name=".."><mxGraphModel>...</mxGraphModel></diagram>...</mxfile>
 *   <mxfile><diagram ...>base64(deflate(urlencode(xml)))</diagram></mxfile>
 *   <mxGraphModel>...</mxGraphModel>                       (single unnamed page)
 *
 * Cells wrapped in {@code <object>} or {@code <UserObject>} take the wrapper's
 * attributes (id, label and custom properties such as {@code name}). Anything
 * unreadable is a CRITICAL finding.
 */
public class DrawioReader {

    static final int MAX_INFLATED_BYTES = 32 * 1024 * 1024;

    public record Page(String id, String name, List<CellRecord> cells) {
        public Page {
            cells = List.copyOf(cells);
        }
    }

    public List<Page> read(Path file, FindingCollector findings) {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in, file.toString(), findings);
        } catch (IOException e) {
            findings.critical("Cannot read '" + file + "': " + e.getMessage(), file.toString(), e);
            return List.of();
        }
    }

    public List<Page> read(InputStream in, String source, FindingCollector findings) {
        Document doc;
        try {
            doc = newDocumentBuilder().parse(in);
        } catch (SAXException | IOException | ParserConfigurationException e) {
            findings.critical("Not a readable draw.io document: " + e.getMessage(), source, e);
            return List.of();
        }

        Element root = doc.getDocumentElement();
        List<Page> pages = new ArrayList<>();
        if ("mxGraphModel".equals(root.getTagName())) {
            pages.add(new Page("page-1", "page-1", readModel(root)));
        } else if ("mxfile".equals(root.getTagName())) {
            int index = 0;
            for (Element diagram : children(root, "diagram")) {
                index++;
                String id = attr(diagram, "id", "page-" + index);
                String name = attr(diagram, "name", id);
                Element model = pageModel(diagram, source, findings);
                if (model != null) pages.add(new Page(id, name, readModel(model)));
            }
        } else {
            findings.critical("Unexpected root element <" + root.getTagName() + ">, expected <mxfile> or <mxGraphModel>",
                source, null);
        }

        if (pages.isEmpty()) {
            findings.critical("Document contains no diagram pages", source, null);
        }
        Logger.debug("Read %d page(s) from %s", pages.size(), source);
        return pages;
    }

    private static DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setNamespaceAware(false);
        dbf.setValidating(false);
        dbf.setXIncludeAware(false);
        dbf.setExpandEntityReferences(false);
        dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        DocumentBuilder builder = dbf.newDocumentBuilder();
        // Parse errors surface as exceptions instead of being printed.
        builder.setErrorHandler(new ErrorHandler() {
            @Override
            public void warning(SAXParseException e) {
                Logger.debug("XML warning: %s", e.getMessage());
            }

            @Override
            public void error(SAXParseException e) throws SAXException {
                throw e;
            }

            @Override
            public void fatalError(SAXParseException e) throws SAXException {
                throw e;
            }
        });
        return builder;
    }

    // ── Pages ────────────────────────────────────────────────────────────────

    /** The page's model element, inflating it first when the page is stored compressed. */
    private Element pageModel(Element diagram, String source, FindingCollector findings) {
        List<Element> models = children(diagram, "mxGraphModel");
        if (!models.isEmpty()) return models.get(0);

        String packed = diagram.getTextContent().trim();
        if (packed.isEmpty()) {
            findings.warning("Page is empty", attr(diagram, "id", source));
            return null;
        }
        try {
            String xml = inflate(packed);
            Document doc = newDocumentBuilder().parse(new InputSource(new StringReader(xml)));
            return doc.getDocumentElement();
        } catch (IllegalArgumentException | DataFormatException | SAXException | IOException
                 | ParserConfigurationException e) {
            findings.critical("Compressed page cannot be decoded: " + e.getMessage(), attr(diagram, "id", source), e);
            return null;
        }
    }

    /** Base64, then raw deflate, then URL encoding; the way draw.io stores compressed pages. */
    static String inflate(String packed) throws DataFormatException {
        return inflate(packed, MAX_INFLATED_BYTES);
    }

    static String inflate(String packed, int limit) throws DataFormatException {
        byte[] deflated = Base64.getDecoder().decode(packed.replaceAll("\\s", ""));
        Inflater inflater = new Inflater(true);
        try {
            inflater.setInput(deflated);
            ByteArrayOutputStream out = new ByteArrayOutputStream(deflated.length * 4);
            byte[] buffer = new byte[4096];
            while (!inflater.finished()) {
                int n = inflater.inflate(buffer);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) break;
                out.write(buffer, 0, n);
                if (out.size() > limit) {
                    throw new DataFormatException("Page expands beyond " + limit + " bytes");
                }
            }
            return URLDecoder.decode(out.toString(StandardCharsets.UTF_8), StandardCharsets.UTF_8);
        } finally {
            inflater.end();
        }
    }

    // ── Cells ────────────────────────────────────────────────────────────────

    private List<CellRecord> readModel(Element model) {
        List<CellRecord> cells = new ArrayList<>();
        for (Element root : children(model, "root")) {
            for (Element el : children(root, null)) {
                CellRecord cell = readCell(el);
                if (cell != null) cells.add(cell);
            }
        }
        return cells;
    }

    private CellRecord readCell(Element el) {
        Element cell;
        Map<String, String> attributes = new LinkedHashMap<>();
        String tag = el.getTagName();
        if ("mxCell".equals(tag)) {
            cell = el;
            attributes.putAll(attributes(el));
        } else if ("object".equals(tag) || "UserObject".equals(tag)) {
            List<Element> inner = children(el, "mxCell");
            if (inner.isEmpty()) return null;
            cell = inner.get(0);
            attributes.putAll(attributes(cell));
            attributes.putAll(attributes(el));
        } else {
            return null;
        }

        String id = attributes.get("id");
        List<Element> geometries = children(cell, "mxGeometry");
        Geometry geometry = geometries.isEmpty() ? null : geometry(geometries.get(0));
        return new CellRecord(
            id,
            attributes,
            StyleParser.parse(attributes.get("style")),
            geometry,
            attributes.get("parent"),
            attributes.get("source"),
            attributes.get("target"));
    }

    /** Unparsable numbers become NaN, which the builder reports as malformed geometry. */
    private static Geometry geometry(Element g) {
        return new Geometry(number(g, "x"), number(g, "y"), number(g, "width"), number(g, "height"));
    }

    private static double number(Element el, String name) {
        String v = el.getAttribute(name);
        if (v.isEmpty()) return 0;
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    // ── DOM helpers ──────────────────────────────────────────────────────────

    private static List<Element> children(Element parent, String tagName) {
        List<Element> out = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node n = nodes.item(i);
            if (n.getNodeType() == Node.ELEMENT_NODE
                    && (tagName == null || tagName.equals(((Element) n).getTagName()))) {
                out.add((Element) n);
            }
        }
        return out;
    }

    private static Map<String, String> attributes(Element el) {
        Map<String, String> out = new LinkedHashMap<>();
        NamedNodeMap attrs = el.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Node a = attrs.item(i);
            out.put(a.getNodeName(), a.getNodeValue());
        }
        return out;
    }

    private static String attr(Element el, String name, String fallback) {
        String v = el.getAttribute(name);
        return v.isEmpty() ? fallback : v;
    }
}
