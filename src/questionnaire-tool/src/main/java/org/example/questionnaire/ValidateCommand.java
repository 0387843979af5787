package org.example.questionnaire;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import org.example.questionnaire.validation.Finding;
import org.example.questionnaire.validation.Severity;

import static org.example.questionnaire.FileUtils.expandInputs;

/**
 * Runs the full conversion of each page and reports what the checks found.
 *
 * Accepts one or more files or directories; directories are scanned
 * recursively for .drawio files. Every page is reported separately. With
 * {@code -f xml} the report is JUnit-compatible XML, one test suite per page,
 * so CI servers can show broken questionnaires like failing tests.
 *
 * Exit codes: 0 = no errors, -1 = any path not found, page aborted or errors present.
 */
@Command(
    name = "validate",
    mixinStandardHelpOptions = true,
    description = "Validate draw.io questionnaire file(s) or directory (recursive) and report findings"
)
public class ValidateCommand implements Callable<Integer> {

    private final QuestionnaireTool parent;

    @Parameters(
        paramLabel = "<path>",
        description = "One or more .drawio files or directories to scan recursively",
        arity = "1..*"
    )
    private List<Path> inputs;

    @Option(
        names = {"--format", "-f"},
        defaultValue = "text",
        description = "Output format: text (default) or xml (JUnit-compatible)"
    )
    private String format;

    @Option(names = {"--page"}, description = "Only validate the page with this id or name", paramLabel = "<page>")
    private String page;

    public ValidateCommand(QuestionnaireTool parent) {
        this.parent = parent;
    }

    @Override
    public Integer call() {
        String fmt = format.toLowerCase();
        if (!fmt.equals("text") && !fmt.equals("xml")) {
            System.err.println("[ERROR] --format must be: text or xml");
            return 2;
        }
        boolean xmlMode = fmt.equals("xml");

        QuestionnairePipeline pipeline;
        try {
            pipeline = new QuestionnairePipeline(parent.pipelineConfig());
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("[ERROR] " + e.getMessage());
            return 2;
        }

        int[] missing = {0};
        List<Path> files = expandInputs(inputs, missing);
        int totalErrors = missing[0];

        // Keyed by "file [page]", preserving order
        Map<String, List<String>> pageErrors   = new LinkedHashMap<>();
        Map<String, List<String>> pageWarnings = new LinkedHashMap<>();

        for (Path file : files) {
            for (QuestionnaireTool.PageOutcome outcome : QuestionnaireTool.convertFile(file, page, pipeline)) {
                String key = outcome.pageName() == null ? file.toString() : file + " [" + outcome.pageName() + "]";
                List<Finding> findings = outcome.failed()
                    ? outcome.failure().getFindings()
                    : outcome.result().findings();

                List<String> errors   = new ArrayList<>();
                List<String> warnings = new ArrayList<>();
                // pairs of [marker, message] for text output
                List<String[]> messages = new ArrayList<>();
                for (Finding f : findings) {
                    if (f.severity() == Severity.WARNING) {
                        warnings.add(f.toString());
                        messages.add(new String[]{"[!]", f.toString()});
                    } else {
                        errors.add(f.toString());
                        messages.add(new String[]{"[x]", f.toString()});
                    }
                }
                if (outcome.failed() && errors.isEmpty()) {
                    errors.add(outcome.failure().getMessage());
                    messages.add(new String[]{"[x]", outcome.failure().getMessage()});
                }
                pageErrors.put(key, errors);
                pageWarnings.put(key, warnings);

                if (!xmlMode) {
                    System.out.printf("%n%s%n  Validating: %s%n%s%n", "-".repeat(60), key, "-".repeat(60));
                    for (String[] m : messages) {
                        System.out.printf("  %s  %s%n", m[0], m[1]);
                    }
                    if (outcome.failed()) {
                        System.out.printf("%n  [x]  ABORTED at level %s: %d error(s), %d warning(s)%n",
                            pipeline.getConfig().level(), errors.size(), warnings.size());
                    } else if (!errors.isEmpty()) {
                        System.out.printf("%n  [x]  FAILED: %d error(s), %d warning(s)%n", errors.size(), warnings.size());
                    } else {
                        if (!warnings.isEmpty())
                            System.out.printf("  [!]  %d warning(s)%n", warnings.size());
                        System.out.printf("  [ok] OK - %d node(s), %d edge(s)%n",
                            outcome.result().diagram().nodes().size(), outcome.result().diagram().edges().size());
                    }
                }
                if (!errors.isEmpty()) totalErrors++;
            }
        }

        if (xmlMode) {
            try {
                writeJUnitXml(pageErrors, pageWarnings);
            } catch (XMLStreamException e) {
                System.err.println("Failed to write JUnit XML: " + e.getMessage());
            }
        }

        return totalErrors > 0 ? -1 : 0;
    }

    /**
     * Writes JUnit-compatible XML to stdout.
     *
     * Format:
     * <pre>
     * {@code
     * <testsuites>
     *   <testsuite name="path/to/file.drawio [Page-1]" tests="1" failures="N" errors="0" skipped="0">
     *     <testcase name="validate" classname="path/to/file.drawio [Page-1]" time="0">
     *       <!-- only present when N > 0 -->
     *       <failure message="N validation error(s)">
     *         ERROR: Edge source 'x' does not resolve to a node; edge dropped (element e3)
     *         ...
     *       </failure>
     *       <system-out>warnings, one per line</system-out>
     *     </testcase>
     *   </testsuite>
     * </testsuites>
     * }
     * </pre>
     */
    private void writeJUnitXml(Map<String, List<String>> pageErrors,
                               Map<String, List<String>> pageWarnings) throws XMLStreamException {
        XMLOutputFactory factory = XMLOutputFactory.newInstance();
        XMLStreamWriter xml = factory.createXMLStreamWriter(System.out, "UTF-8");

        xml.writeStartDocument("UTF-8", "1.0");
        xml.writeCharacters("\n");
        xml.writeStartElement("testsuites");
        xml.writeCharacters("\n");

        for (Map.Entry<String, List<String>> entry : pageErrors.entrySet()) {
            String name           = entry.getKey();
            List<String> errors   = entry.getValue();
            List<String> warnings = pageWarnings.getOrDefault(name, List.of());

            xml.writeCharacters("  ");
            xml.writeStartElement("testsuite");
            xml.writeAttribute("name",     name);
            xml.writeAttribute("tests",    "1");
            xml.writeAttribute("failures", errors.isEmpty() ? "0" : "1");
            xml.writeAttribute("errors",   "0");
            xml.writeAttribute("skipped",  "0");
            xml.writeCharacters("\n    ");

            xml.writeStartElement("testcase");
            xml.writeAttribute("name",      "validate");
            xml.writeAttribute("classname", name);
            xml.writeAttribute("time",      "0");

            if (!errors.isEmpty()) {
                xml.writeCharacters("\n      ");
                xml.writeStartElement("failure");
                xml.writeAttribute("message", errors.size() + " validation error(s)");
                xml.writeCharacters("\n" + String.join("\n", errors) + "\n      ");
                xml.writeEndElement(); // failure
                xml.writeCharacters("\n    ");
            }
            if (!warnings.isEmpty()) {
                if (errors.isEmpty()) xml.writeCharacters("\n      ");
                else xml.writeCharacters("  ");
                xml.writeStartElement("system-out");
                xml.writeCharacters(String.join("\n", warnings));
                xml.writeEndElement(); // system-out
                xml.writeCharacters("\n    ");
            }

            xml.writeEndElement(); // testcase
            xml.writeCharacters("\n  ");
            xml.writeEndElement(); // testsuite
            xml.writeCharacters("\n");
        }

        xml.writeEndElement(); // testsuites
        xml.writeEndDocument();
        xml.flush();
        System.out.println();
    }
}
