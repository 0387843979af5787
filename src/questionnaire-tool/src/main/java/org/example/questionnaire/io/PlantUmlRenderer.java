package org.example.questionnaire.io;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import net.sourceforge.plantuml.FileFormat;
import net.sourceforge.plantuml.FileFormatOption;
import net.sourceforge.plantuml.SourceStringReader;

import org.example.questionnaire.model.Diagram;
import org.example.questionnaire.model.Edge;
import org.example.questionnaire.model.Group;
import org.example.questionnaire.model.Node;

/**
 * Draws a diagram as PlantUML for debugging: one element per node, groups as
 * frames, edges labelled with their condition (or their drawn label while they
 * have none).
 */
public class PlantUmlRenderer {

    public String render(Diagram diagram) {
        StringBuilder sb = new StringBuilder();
        sb.append("@startuml\n");
        sb.append("skinparam shadowing false\n");
        sb.append("skinparam defaultTextAlignment center\n\n");

        Aliases aliases = new Aliases();
        diagram.nodes().keySet().forEach(id -> aliases.of("n", id));
        Set<String> drawn = new LinkedHashSet<>();
        for (Group g : diagram.groups().values()) {
            sb.append("frame \"").append(escape(g.label().isEmpty() ? g.id() : g.label()))
              .append("\" as ").append(aliases.of("g", g.id())).append(" {\n");
            for (String member : g.containedIds()) {
                Node n = diagram.node(member);
                if (n == null) continue;
                sb.append("  ").append(element(n, aliases)).append('\n');
                drawn.add(member);
            }
            sb.append("}\n");
        }
        for (Node n : diagram.nodes().values()) {
            if (!drawn.contains(n.id())) sb.append(element(n, aliases)).append('\n');
        }
        sb.append('\n');

        for (Edge e : diagram.edges()) {
            sb.append(aliases.of("n", e.sourceId())).append(" --> ").append(aliases.of("n", e.targetId()));
            String text = e.logic() != null ? e.logic().toString() : e.label();
            if (!text.isEmpty()) sb.append(" : ").append(escape(text));
            sb.append('\n');
        }
        sb.append("@enduml\n");
        return sb.toString();
    }

    /** Renders PlantUML source to PNG or SVG bytes. */
    public byte[] renderImage(String puml, FileFormat format) throws IOException {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            new SourceStringReader(puml).outputImage(baos, new FileFormatOption(format));
            return baos.toByteArray();
        }
    }

    private static String element(Node n, Aliases aliases) {
        String keyword = switch (n.type()) {
            case DECISION_POINT -> "hexagon";
            case NUMERIC, NUMERIC_INTEGER, NUMERIC_DECIMAL -> "card";
            case FLAG, CALCULATE, DIAGNOSIS -> "usecase";
            case NOTE, TEXT, HELP, HINT -> "file";
            case GOTO -> "circle";
            case SELECT_OPTION -> "label";
            default -> "rectangle";
        };
        String text = (n.label().isEmpty() ? n.id() : n.label()) + "\\n<" + n.type().wireName() + ">";
        return keyword + " \"" + escape(text) + "\" as " + aliases.of("n", n.id());
    }

    /** PlantUML names for ids; ids that sanitise to the same name are numbered. */
    private static final class Aliases {
        private final Map<String, String> byId = new HashMap<>();
        private final Set<String> taken = new HashSet<>();

        String of(String prefix, String id) {
            return byId.computeIfAbsent(prefix + ":" + id, k -> {
                String base = prefix + "_" + id.replaceAll("[^A-Za-z0-9_]", "_");
                String alias = base;
                for (int i = 2; !taken.add(alias); i++) {
                    alias = base + "_" + i;
                }
                return alias;
            });
        }
    }

    private static String escape(String s) {
        return s.replace("\"", "'").replace("\r", "").replace("\n", "\\n");
    }
}
