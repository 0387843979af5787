package org.example.questionnaire.io;

import java.util.Collection;
import java.util.Map;

import org.json.JSONArray;
import org.json.JSONObject;

import org.example.questionnaire.ConversionResult;
import org.example.questionnaire.logic.LogicExpr;
import org.example.questionnaire.model.Diagram;
import org.example.questionnaire.model.Edge;
import org.example.questionnaire.model.Group;
import org.example.questionnaire.model.Node;
import org.example.questionnaire.validation.Finding;

/** Output document of a converted page. */
public final class DiagramJson {

    private DiagramJson() {
    }

    public static JSONObject toJson(ConversionResult result) {
        JSONObject out = toJson(result.diagram(), result.nodeLogic());
        out.put("converged", result.converged());
        JSONArray findings = new JSONArray();
        for (Finding f : result.findings()) {
            JSONObject jf = new JSONObject();
            jf.put("severity", f.severity().name());
            jf.put("message", f.message());
            jf.put("location", f.location() == null ? JSONObject.NULL : f.location());
            findings.put(jf);
        }
        out.put("findings", findings);
        return out;
    }

    /** The graph alone; {@code nodeLogic} may be empty, e.g. for an unsimplified diagram. */
    public static JSONObject toJson(Diagram diagram, Map<String, LogicExpr> nodeLogic) {
        JSONObject out = new JSONObject();
        out.put("page", diagram.pageId());

        JSONArray nodes = new JSONArray();
        for (Node n : diagram.nodes().values()) {
            JSONObject jn = new JSONObject();
            jn.put("id", n.id());
            jn.put("type", n.type().wireName());
            jn.put("label", n.label());
            jn.put("group", n.groupId() == null ? JSONObject.NULL : n.groupId());
            jn.put("options", new JSONArray(n.options()));
            JSONObject metadata = new JSONObject();
            n.metadata().forEach((k, v) -> metadata.put(k, v instanceof Collection<?> c ? new JSONArray(c) : v));
            jn.put("metadata", metadata);
            jn.put("logic", LogicJson.toJsonOrNull(nodeLogic.get(n.id())));
            nodes.put(jn);
        }
        out.put("nodes", nodes);

        JSONArray edges = new JSONArray();
        for (Edge e : diagram.edges()) {
            JSONObject je = new JSONObject();
            je.put("id", e.id());
            je.put("source", e.sourceId());
            je.put("target", e.targetId());
            je.put("label", e.label());
            je.put("logic", LogicJson.toJsonOrNull(e.logic()));
            edges.put(je);
        }
        out.put("edges", edges);

        JSONArray groups = new JSONArray();
        for (Group g : diagram.groups().values()) {
            JSONObject jg = new JSONObject();
            jg.put("id", g.id());
            jg.put("label", g.label());
            jg.put("members", new JSONArray(g.containedIds()));
            groups.put(jg);
        }
        out.put("groups", groups);
        return out;
    }
}
