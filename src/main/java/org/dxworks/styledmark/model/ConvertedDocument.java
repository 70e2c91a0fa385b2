package org.dxworks.styledmark.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Output record for one converted markdown file.
 */
@JsonPropertyOrder({"kind", "filePath", "lines"})
public class ConvertedDocument {
    public final String kind = "document";
    public String filePath;
    public List<Line> lines;

    public ConvertedDocument(String filePath, StyledText text) {
        this.filePath = filePath;
        this.lines = text.lines;
    }
}
