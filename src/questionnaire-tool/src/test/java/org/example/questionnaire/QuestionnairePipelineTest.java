package org.example.questionnaire;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import org.example.questionnaire.io.DiagramJson;
import org.example.questionnaire.io.DrawioReader;
import org.example.questionnaire.logic.LogicExpr;
import org.example.questionnaire.logic.Operation;
import org.example.questionnaire.model.CellRecord;
import org.example.questionnaire.model.Diagram;
import org.example.questionnaire.model.Edge;
import org.example.questionnaire.model.Node;
import org.example.questionnaire.model.NodeType;
import org.example.questionnaire.validation.DiagramValidationException;
import org.example.questionnaire.validation.FindingCollector;
import org.example.questionnaire.validation.Severity;
import org.example.questionnaire.validation.ValidationLevel;

import static org.example.questionnaire.logic.LogicExpr.and;
import static org.example.questionnaire.logic.LogicExpr.condition;
import static org.junit.jupiter.api.Assertions.*;

/** End to end on the cough questionnaire in {@code fixtures/cough.drawio}. */
public class QuestionnairePipelineTest {

    private static final String FIXTURE = "/fixtures/cough.drawio";

    @TempDir
    Path tempDir;

    private static DrawioReader.Page coughPage() throws IOException {
        try (InputStream in = QuestionnairePipelineTest.class.getResourceAsStream(FIXTURE)) {
            assertNotNull(in, "fixture missing");
            return new DrawioReader().read(in, FIXTURE, new FindingCollector(ValidationLevel.NORMAL)).get(0);
        }
    }

    private static ConversionResult convert(ValidationLevel level) throws IOException {
        DrawioReader.Page page = coughPage();
        return new QuestionnairePipeline(PipelineConfig.defaults().withLevel(level)).convert(page.id(), page.cells());
    }

    private static Map<String, Edge> edgesById(Diagram d) {
        return d.edges().stream().collect(Collectors.toMap(Edge::id, e -> e));
    }

    @Test
    void convertsTheCoughQuestionnaire() throws IOException {
        ConversionResult result = convert(ValidationLevel.STRICT);
        Diagram d = result.diagram();

        assertEquals("cough", result.pageId());
        assertTrue(result.converged());
        assertTrue(result.findings().isEmpty(), result.findings().toString());

        assertEquals(List.of("s", "n", "x", "y", "end"), List.copyOf(d.nodes().keySet()));

        Node s = d.node("s");
        assertEquals(NodeType.YES_NO, s.type());
        assertEquals(List.of("Yes", "No"), s.metadata().get(Node.CHOICES));

        Node n = d.node("n");
        assertEquals(NodeType.NUMERIC, n.type());
        assertEquals("Age in months", n.label());
        assertEquals("integer", n.metadataString(Node.SUBTYPE));
        assertEquals(new BigDecimal("60"), n.metadata().get(Node.MAX_VALUE));
        assertEquals("Count the months since birth", n.metadataString(Node.HELP_TEXT));

        Map<String, Edge> edges = edgesById(d);
        assertEquals(4, edges.size());
        assertEquals(condition("s", Operation.EQ, true), edges.get("e1").logic());
        assertEquals(condition("s", Operation.EQ, false), edges.get("e2").logic());
        assertEquals("x", edges.get("e3_e4").targetId());
        assertEquals(condition("n", Operation.GT, 5), edges.get("e3_e4").logic());
        assertEquals("y", edges.get("e3_e5").targetId());
        assertEquals(condition("n", Operation.LE, 5), edges.get("e3_e5").logic());
    }

    @Test
    void derivesDisplayLogicPerNode() throws IOException {
        Map<String, LogicExpr> logic = convert(ValidationLevel.NORMAL).nodeLogic();

        assertTrue(logic.get("s").isTrue());
        assertEquals(condition("s", Operation.EQ, true), logic.get("n"));
        assertEquals(and(condition("n", Operation.GT, 5), condition("s", Operation.EQ, true)), logic.get("x"));
        assertEquals(and(condition("n", Operation.LE, 5), condition("s", Operation.EQ, true)), logic.get("y"));
        assertEquals(condition("s", Operation.EQ, false), logic.get("end"));
    }

    @Test
    void keepsTheDiagramAsDrawn() throws IOException {
        Diagram built = convert(ValidationLevel.NORMAL).built();

        assertEquals(NodeType.SELECT_ONE, built.node("s").type());
        assertEquals(List.of("o1", "o2"), built.node("s").options());
        assertEquals(NodeType.DECISION_POINT, built.node("d").type());
        assertEquals("age > 5", built.node("d").label());
        assertTrue(built.groups().get("g").containedIds().containsAll(List.of("x", "y")));

        Edge intoGroup = edgesById(built).get("e4");
        assertEquals("x", intoGroup.targetId());
        assertEquals("No", edgesById(built).get("e5").label());
    }

    @Test
    void writesJsonDocument() throws IOException {
        JSONObject json = DiagramJson.toJson(convert(ValidationLevel.NORMAL));

        assertEquals("cough", json.getString("page"));
        assertTrue(json.getBoolean("converged"));
        assertTrue(json.getJSONArray("findings").isEmpty());

        JSONArray nodes = json.getJSONArray("nodes");
        assertEquals(5, nodes.length());
        JSONObject s = nodes.getJSONObject(0);
        assertEquals("yes_no", s.getString("type"));
        assertEquals("Yes", s.getJSONObject("metadata").getJSONArray("choices").getString(0));
        assertEquals("AND", s.getJSONObject("logic").getString("operation"));

        JSONObject x = nodes.getJSONObject(2);
        assertEquals("g", x.getString("group"));
        assertEquals(2, x.getJSONObject("logic").getJSONArray("children").length());

        JSONArray groups = json.getJSONArray("groups");
        assertEquals("Outcome", groups.getJSONObject(0).getString("label"));
    }

    @Test
    void errorsAbortUnlessLenient() {
        List<CellRecord> cells = new ArrayList<>(TestCells.layers());
        cells.add(TestCells.note("a", "1", "Start"));
        cells.add(TestCells.note("b", "nowhere", "Lost"));
        cells.add(TestCells.edge("e", "a", "b", ""));

        QuestionnairePipeline normal = new QuestionnairePipeline(PipelineConfig.defaults());
        assertThrows(DiagramValidationException.class, () -> normal.convert("p", cells));

        ConversionResult lenient = new QuestionnairePipeline(PipelineConfig.defaults().withLevel(ValidationLevel.LENIENT))
            .convert("p", cells);
        assertTrue(lenient.hasErrors());
        assertEquals(Severity.ERROR, lenient.findings().get(0).severity());
        assertEquals("Start\n\nLost", lenient.diagram().node("a").label());
    }

    @Test
    void declaredEntryNodeIsChecked() throws IOException {
        DrawioReader.Page page = coughPage();
        QuestionnairePipeline pipeline = new QuestionnairePipeline(
            PipelineConfig.defaults().withLevel(ValidationLevel.LENIENT).withEntryNode("o1"));

        ConversionResult result = pipeline.convert(page.id(), page.cells());
        assertTrue(result.findings().stream()
            .anyMatch(f -> f.severity() == Severity.ERROR && "o1".equals(f.location())));
    }

    @Test
    void convertsFilesPageByPage() throws IOException {
        Path file = tempDir.resolve("cough.drawio");
        try (InputStream in = getClass().getResourceAsStream(FIXTURE)) {
            Files.copy(in, file, StandardCopyOption.REPLACE_EXISTING);
        }
        QuestionnairePipeline pipeline = new QuestionnairePipeline(PipelineConfig.defaults());

        List<QuestionnaireTool.PageOutcome> all = QuestionnaireTool.convertFile(file, null, pipeline);
        assertEquals(1, all.size());
        assertFalse(all.get(0).failed());
        assertEquals("Cough", all.get(0).pageName());

        assertEquals(1, QuestionnaireTool.convertFile(file, "Cough", pipeline).size());
        assertEquals(1, QuestionnaireTool.convertFile(file, "cough", pipeline).size());
        assertTrue(QuestionnaireTool.convertFile(file, "Fever", pipeline).isEmpty());
    }

    @Test
    void unreadableFileIsOneFailedOutcome() throws IOException {
        Path file = tempDir.resolve("broken.drawio");
        Files.writeString(file, "<mxfile><diagram>", StandardCharsets.UTF_8);

        List<QuestionnaireTool.PageOutcome> outcomes =
            QuestionnaireTool.convertFile(file, null, new QuestionnairePipeline(PipelineConfig.defaults()));

        assertEquals(1, outcomes.size());
        assertTrue(outcomes.get(0).failed());
        assertEquals(Severity.CRITICAL, outcomes.get(0).failure().getFinding().severity());
    }

    @Test
    void configRejectsNonPositiveRoundLimit() {
        assertThrows(IllegalArgumentException.class,
            () -> new PipelineConfig(ValidationLevel.NORMAL, null, 0, null));
        assertEquals(ValidationLevel.NORMAL, new PipelineConfig(null, null, 3, null).level());
    }
}
