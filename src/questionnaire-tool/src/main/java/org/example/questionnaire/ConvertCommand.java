package org.example.questionnaire;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.json.JSONObject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import org.example.questionnaire.io.DiagramJson;
import org.example.questionnaire.validation.Finding;

import static org.example.questionnaire.FileUtils.baseName;
import static org.example.questionnaire.FileUtils.expandInputs;
import static org.example.questionnaire.FileUtils.safeName;

/**
 * Converts draw.io questionnaires into JSON logic graphs, one document per page.
 *
 * Usage:
 *   convert <path>...              -- JSON on stdout
 *   convert <path>... -o out/      -- out/<file>_<page>.json per page
 *   convert <path> --page Triage   -- only the page with that id or name
 *
 * Exit codes: 0 = all pages converted, -1 = missing input or aborted page,
 * 2 = invalid options.
 */
@Command(
    name = "convert",
    mixinStandardHelpOptions = true,
    description = "Convert draw.io questionnaire file(s) or directories (recursive) into JSON logic graphs"
)
public class ConvertCommand implements Callable<Integer> {

    private final QuestionnaireTool parent;

    @Parameters(
        paramLabel = "<path>",
        description = "One or more .drawio files or directories to scan recursively",
        arity = "1..*"
    )
    private List<Path> inputs;

    @Option(names = {"--output", "-o"}, description = "Output directory (default: stdout)", paramLabel = "<dir>")
    private Path outputDir;

    @Option(names = {"--page"}, description = "Only convert the page with this id or name", paramLabel = "<page>")
    private String page;

    public ConvertCommand(QuestionnaireTool parent) {
        this.parent = parent;
    }

    @Override
    public Integer call() {
        QuestionnairePipeline pipeline;
        try {
            pipeline = new QuestionnairePipeline(parent.pipelineConfig());
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("[ERROR] " + e.getMessage());
            return 2;
        }

        int[] missing = {0};
        List<Path> files = expandInputs(inputs, missing);
        int failures = missing[0];

        if (outputDir != null) {
            try {
                Files.createDirectories(outputDir);
            } catch (IOException e) {
                System.err.println("[ERROR] Cannot create output directory: " + e.getMessage());
                return 2;
            }
        }

        for (Path file : files) {
            for (QuestionnaireTool.PageOutcome outcome : QuestionnaireTool.convertFile(file, page, pipeline)) {
                if (outcome.failed()) {
                    System.err.printf("[ERROR] %s%s: %s%n", file,
                        outcome.pageName() == null ? "" : " [" + outcome.pageName() + "]",
                        outcome.failure().getMessage());
                    failures++;
                    continue;
                }
                JSONObject json = DiagramJson.toJson(outcome.result());
                json.put("source", file.toString());
                json.put("name", outcome.pageName());
                if (!write(json, file, outcome)) failures++;
                for (Finding f : outcome.result().findings()) {
                    Logger.warn("%s [%s]: %s", file, outcome.pageName(), f);
                }
            }
        }
        return failures > 0 ? -1 : 0;
    }

    private boolean write(JSONObject json, Path file, QuestionnaireTool.PageOutcome outcome) {
        if (outputDir == null) {
            System.out.println(json.toString(2));
            return true;
        }
        Path out = outputDir.resolve(baseName(file) + "_" + safeName(outcome.pageName()) + ".json");
        try {
            Files.writeString(out, json.toString(2), StandardCharsets.UTF_8);
            System.out.printf("  [OK]  %s%n", out);
            return true;
        } catch (IOException e) {
            System.err.printf("[ERROR] Cannot write %s: %s%n", out, e.getMessage());
            return false;
        }
    }
}
