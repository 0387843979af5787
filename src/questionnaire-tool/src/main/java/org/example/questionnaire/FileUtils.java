package org.example.questionnaire;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class FileUtils {

    private static final List<String> DIAGRAM_EXTENSIONS = List.of(".drawio", ".xml");

    /**
     * Recursively collects all draw.io files under {@code dir}, sorted by path
     * so that files in parent directories come before those in subdirectories.
     */
    public static List<Path> collectDiagramFiles(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk
                .filter(p -> Files.isRegularFile(p) && isDiagramFile(p))
                .sorted(Comparator.comparingInt(Path::getNameCount)
                                  .thenComparing(Comparator.naturalOrder()))
                .collect(Collectors.toList());
        } catch (IOException e) {
            Logger.error("Failed to scan directory '%s': %s", dir, e.getMessage());
            return List.of();
        }
    }

    static boolean isDiagramFile(Path p) {
        String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
        return DIAGRAM_EXTENSIONS.stream().anyMatch(name::endsWith);
    }

    /**
     * Expands the command-line inputs into a de-duplicated file list. Missing
     * paths are reported and counted in {@code missing[0]}.
     */
    public static List<Path> expandInputs(Collection<Path> inputs, int[] missing) {
        Set<Path> uniqueFiles = new LinkedHashSet<>();
        for (Path input : inputs) {
            if (!Files.exists(input)) {
                System.err.printf("  [x]  Path not found: %s%n", input);
                missing[0]++;
                continue;
            }
            if (Files.isDirectory(input)) {
                List<Path> found = collectDiagramFiles(input);
                if (found.isEmpty()) {
                    System.err.printf("  [!]  No .drawio files found under: %s%n", input);
                } else {
                    Logger.info("Found %d diagram file(s) under: %s", found.size(), input);
                    uniqueFiles.addAll(found);
                }
            } else {
                uniqueFiles.add(input);
            }
        }
        return List.copyOf(uniqueFiles);
    }

    /** File name without its diagram extension, safe to use for output files. */
    public static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot > 0) name = name.substring(0, dot);
        return safeName(name);
    }

    public static String safeName(String name) {
        return name.replaceAll("[^A-Za-z0-9_\\-]", "_");
    }
}
