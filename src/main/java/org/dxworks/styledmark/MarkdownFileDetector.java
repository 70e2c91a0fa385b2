package org.dxworks.styledmark;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

public class MarkdownFileDetector {

    private static final List<String> MARKDOWN_EXTENSIONS = List.of(".md", ".markdown", ".mdown", ".mkd");

    public static boolean isMarkdown(Path filePath) {
        Path fileName = filePath.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        for (String extension : MARKDOWN_EXTENSIONS) {
            if (name.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }
}
