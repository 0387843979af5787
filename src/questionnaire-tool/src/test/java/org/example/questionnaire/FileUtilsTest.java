package org.example.questionnaire;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

public class FileUtilsTest {

    @TempDir
    Path dir;

    @Test
    void collectsDiagramFilesShallowFirst() throws IOException {
        Path nested = Files.createDirectories(dir.resolve("a/b"));
        Files.writeString(nested.resolve("deep.drawio"), "<mxfile/>");
        Files.writeString(dir.resolve("top.drawio"), "<mxfile/>");
        Files.writeString(dir.resolve("Export.XML"), "<mxfile/>");
        Files.writeString(dir.resolve("notes.txt"), "ignored");

        List<Path> files = FileUtils.collectDiagramFiles(dir);

        assertEquals(List.of(dir.resolve("Export.XML"), dir.resolve("top.drawio"), nested.resolve("deep.drawio")), files);
    }

    @Test
    void expandsInputsWithoutDuplicatesAndCountsMissing() throws IOException {
        Path file = Files.writeString(dir.resolve("cough.drawio"), "<mxfile/>");
        int[] missing = {0};

        List<Path> files = FileUtils.expandInputs(List.of(file, dir, dir.resolve("absent.drawio")), missing);

        assertEquals(List.of(file), files);
        assertEquals(1, missing[0]);
    }

    @Test
    void namesAreSafeForOutputFiles() {
        assertEquals("cough_v2", FileUtils.baseName(Path.of("in", "cough v2.drawio")));
        assertEquals("Danger_signs__1_", FileUtils.safeName("Danger signs (1)"));
        assertTrue(FileUtils.isDiagramFile(Path.of("x.DRAWIO")));
        assertFalse(FileUtils.isDiagramFile(Path.of("x.json")));
    }
}
