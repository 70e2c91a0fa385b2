package org.dxworks.styledmark;

import org.dxworks.styledmark.converter.ConversionException;
import org.dxworks.styledmark.model.Compound;
import org.dxworks.styledmark.model.StyledText;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AppTest {

    @TempDir
    Path tempDir;

    @Test
    void collectMarkdownFiles_FiltersByExtensionAndLength() throws IOException {
        Files.writeString(tempDir.resolve("a.md"), "a\n");
        Files.writeString(tempDir.resolve("notes.txt"), "x\n");
        Files.writeString(tempDir.resolve("long.md"), "1\n2\n3\n4\n");
        Files.createDirectories(tempDir.resolve("nested"));
        Files.writeString(tempDir.resolve("nested/b.MARKDOWN"), "b\n");

        List<Path> files = App.collectMarkdownFiles(tempDir, 3);

        assertEquals(List.of(tempDir.resolve("a.md"), tempDir.resolve("nested/b.MARKDOWN")), files);
    }

    @Test
    void collectMarkdownFiles_SingleFile() throws IOException {
        Path file = tempDir.resolve("single.mkd");
        Files.writeString(file, "x\n");

        assertEquals(List.of(file), App.collectMarkdownFiles(file, 100));
        assertTrue(App.collectMarkdownFiles(tempDir.resolve("missing.md"), 100).isEmpty());
    }

    @Test
    void convertFile_StripsByteOrderMark() throws IOException, ConversionException {
        Path file = tempDir.resolve("bom.md");
        Files.writeString(file, "\uFEFF**hello**\n", StandardCharsets.UTF_8);

        StyledText text = App.convertFile(file, StyledmarkConfig.defaults());

        assertEquals(1, text.lines.size());
        assertEquals(List.of(new Compound("hello", true, false, false, false)), text.lines.get(0).composite.compounds);
    }

    @Test
    void isMarkdown_KnownExtensions() {
        assertTrue(MarkdownFileDetector.isMarkdown(Path.of("README.md")));
        assertTrue(MarkdownFileDetector.isMarkdown(Path.of("docs/guide.Markdown")));
        assertTrue(MarkdownFileDetector.isMarkdown(Path.of("x.mdown")));
        assertFalse(MarkdownFileDetector.isMarkdown(Path.of("x.mdx")));
        assertFalse(MarkdownFileDetector.isMarkdown(Path.of("md")));
    }
}
