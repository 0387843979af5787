package org.example.questionnaire;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import net.sourceforge.plantuml.FileFormat;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import org.example.questionnaire.io.PlantUmlRenderer;
import org.example.questionnaire.model.Diagram;

import static org.example.questionnaire.FileUtils.baseName;
import static org.example.questionnaire.FileUtils.expandInputs;
import static org.example.questionnaire.FileUtils.safeName;

/**
 * Draws the logic graph of each page with PlantUML, to check by eye what the
 * simplifier made of a questionnaire. {@code --raw} draws the graph as built,
 * before simplification.
 */
@Command(
    name = "diagram",
    mixinStandardHelpOptions = true,
    description = "Render the logic graph of draw.io questionnaire page(s) as PlantUML, PNG or SVG"
)
public class DiagramCommand implements Callable<Integer> {

    private final QuestionnaireTool parent;

    @Parameters(
        paramLabel = "<path>",
        description = "One or more .drawio files or directories to scan recursively",
        arity = "1..*"
    )
    private List<Path> inputs;

    @Option(names = {"--format", "-f"}, description = "Output format: png, svg, puml (default: puml)",
        paramLabel = "<fmt>", defaultValue = "puml")
    private String format;

    @Option(names = {"--output", "-o"}, description = "Output directory (default: .)",
        paramLabel = "<dir>", defaultValue = ".")
    private Path outputDir;

    @Option(names = {"--page"}, description = "Only render the page with this id or name", paramLabel = "<page>")
    private String page;

    @Option(names = {"--raw"}, description = "Render the graph as drawn, before simplification")
    private boolean raw;

    private final PlantUmlRenderer renderer = new PlantUmlRenderer();

    public DiagramCommand(QuestionnaireTool parent) {
        this.parent = parent;
    }

    @Override
    public Integer call() {
        String fmt = format.toLowerCase();
        if (!fmt.equals("png") && !fmt.equals("svg") && !fmt.equals("puml")) {
            System.err.println("[ERROR] --format must be: png, svg, or puml");
            return 2;
        }

        QuestionnairePipeline pipeline;
        try {
            pipeline = new QuestionnairePipeline(parent.pipelineConfig());
            Files.createDirectories(outputDir);
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("[ERROR] " + e.getMessage());
            return 2;
        }

        int[] missing = {0};
        List<Path> files = expandInputs(inputs, missing);
        int totalErrors = missing[0];

        for (Path file : files) {
            for (QuestionnaireTool.PageOutcome outcome : QuestionnaireTool.convertFile(file, page, pipeline)) {
                if (outcome.failed()) {
                    System.err.printf("[ERROR] %s: %s%n", file, outcome.failure().getMessage());
                    totalErrors++;
                    continue;
                }
                Diagram diagram = raw ? outcome.result().built() : outcome.result().diagram();
                String name = baseName(file) + "_" + safeName(outcome.pageName());
                try {
                    writeDiagram(diagram, name, fmt);
                } catch (IOException e) {
                    Logger.error("Failed to render '" + name + "'", e);
                    totalErrors++;
                }
            }
        }
        return totalErrors > 0 ? -1 : 0;
    }

    private void writeDiagram(Diagram diagram, String name, String fmt) throws IOException {
        String puml = renderer.render(diagram);
        if (fmt.equals("puml")) {
            Path out = outputDir.resolve(name + ".puml");
            Files.writeString(out, puml, StandardCharsets.UTF_8);
            System.out.printf("  [OK]  %s%n", out);
        } else {
            FileFormat ff = fmt.equals("svg") ? FileFormat.SVG : FileFormat.PNG;
            Path out = outputDir.resolve(name + "." + fmt);
            Files.write(out, renderer.renderImage(puml, ff));
            System.out.printf("  [OK]  %s%n", out);
        }
    }
}
