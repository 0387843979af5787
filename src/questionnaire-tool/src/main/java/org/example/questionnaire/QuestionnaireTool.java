package org.example.questionnaire;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import org.example.questionnaire.io.DrawioReader;
import org.example.questionnaire.logic.ExternalReferences;
import org.example.questionnaire.validation.DiagramValidationException;
import org.example.questionnaire.validation.FindingCollector;
import org.example.questionnaire.validation.ValidationLevel;

@Command(
    name = "questionnaire-tool",
    versionProvider = QuestionnaireTool.VersionProvider.class,
    description = "Convert draw.io questionnaire diagrams into logic graphs, validate and visualise them."
)
public class QuestionnaireTool implements Runnable {

    static class VersionProvider implements IVersionProvider {
        @Override
        public String[] getVersion() throws Exception {
            Properties props = new Properties();
            try (InputStream is = QuestionnaireTool.class.getResourceAsStream("/META-INF/questionnaire-tool-version.properties")) {
                if (is != null) {
                    props.load(is);
                    return new String[]{ props.getProperty("version", "unknown") };
                }
            }
            return new String[]{ "unknown" };
        }
    }

    /** One page of one input file, converted or aborted. */
    public record PageOutcome(Path file, String pageId, String pageName,
                              ConversionResult result, DiagramValidationException failure) {
        public boolean failed() {
            return failure != null;
        }
    }

    @Spec
    CommandSpec spec;

    @Option(names = {"--level", "-l"}, defaultValue = "NORMAL",
        description = "Validation level: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})", paramLabel = "<level>")
    private ValidationLevel level;

    @Option(names = {"--entry"}, description = "Id of the node the questionnaire starts at (default: inferred)",
        paramLabel = "<id>")
    private String entryNodeId;

    @Option(names = {"--max-passes"}, defaultValue = "25",
        description = "Maximum simplification rounds (default: ${DEFAULT-VALUE})", paramLabel = "<n>")
    private int maxPasses;

    @Option(names = {"--externals"}, description = "JSON file naming external numeric values and flags",
        paramLabel = "<file>")
    private Path externalsFile;

    @Option(names = {"--log-level"}, paramLabel = "<level>",
        description = "Console log level: ${COMPLETION-CANDIDATES} (default: the " + Logger.LEVEL_PROPERTY
            + " system property, else WARN)")
    void setLogLevel(Logger.Level logLevel) {
        Logger.setLevel(logLevel);
    }

    @Option(names = {"-v", "--version"}, versionHelp = true, description = "Print version information and exit")
    private boolean version;

    public static void main(String[] args) {
        QuestionnaireTool tool = new QuestionnaireTool();
        CommandLine cmd = new CommandLine(tool);
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        cmd.addSubcommand("convert", new ConvertCommand(tool));
        cmd.addSubcommand("validate", new ValidateCommand(tool));
        cmd.addSubcommand("diagram", new DiagramCommand(tool));
        cmd.addSubcommand("help", new CommandLine.HelpCommand());
        int exitCode = cmd.execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // No subcommand given: print usage including all registered subcommands
        spec.commandLine().usage(System.out);
    }

    public PipelineConfig pipelineConfig() throws IOException {
        ExternalReferences externals = externalsFile == null
            ? ExternalReferences.empty()
            : ExternalReferences.load(externalsFile);
        if (externalsFile != null) {
            Logger.info("Loaded %d numeric and %d flag reference(s) from %s",
                externals.numeric().size(), externals.flags().size(), externalsFile);
        }
        return new PipelineConfig(level, entryNodeId, maxPasses, externals);
    }

    /**
     * Reads {@code file} and converts every page, or only the page whose id or
     * name is {@code pageFilter}. An unreadable file yields one failed outcome.
     */
    public static List<PageOutcome> convertFile(Path file, String pageFilter, QuestionnairePipeline pipeline) {
        ValidationLevel lvl = pipeline.getConfig().level();
        List<PageOutcome> outcomes = new ArrayList<>();
        List<DrawioReader.Page> pages;
        try {
            pages = new DrawioReader().read(file, new FindingCollector(lvl));
        } catch (DiagramValidationException e) {
            outcomes.add(new PageOutcome(file, null, null, null, e));
            return outcomes;
        }

        for (DrawioReader.Page page : pages) {
            if (pageFilter != null && !pageFilter.equals(page.id()) && !pageFilter.equals(page.name())) continue;
            try {
                ConversionResult result = pipeline.convert(page.id(), page.cells(), new FindingCollector(lvl));
                outcomes.add(new PageOutcome(file, page.id(), page.name(), result, null));
            } catch (DiagramValidationException e) {
                outcomes.add(new PageOutcome(file, page.id(), page.name(), null, e));
            }
        }
        if (outcomes.isEmpty() && pageFilter != null) {
            Logger.warn("No page '%s' in %s", pageFilter, file);
        }
        return outcomes;
    }
}
