package org.dxworks.styledmark.converter;

import org.commonmark.ext.footnotes.FootnotesExtension;
import org.commonmark.ext.front.matter.YamlFrontMatterExtension;
import org.commonmark.ext.gfm.strikethrough.StrikethroughExtension;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.node.Node;
import org.commonmark.parser.Parser;
import org.dxworks.styledmark.model.StyledText;

import java.util.List;
import java.util.Objects;

/**
 * Converts markdown into {@link StyledText}. Instances are immutable and can be shared between
 * threads; every conversion runs on its own emitter.
 */
public class MarkdownConverter {

    private final Parser parser;
    private final ConversionOptions options;

    public MarkdownConverter() {
        this(ConversionOptions.defaults());
    }

    public MarkdownConverter(ConversionOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        // Extension nodes the converter rejects are still parsed so they are reported instead of read as text
        this.parser = Parser.builder()
                .extensions(List.of(
                        StrikethroughExtension.create(),
                        TablesExtension.create(),
                        YamlFrontMatterExtension.create(),
                        FootnotesExtension.create()
                ))
                .build();
    }

    public ConversionOptions getOptions() {
        return options;
    }

    public Node parse(String markdown) {
        return parser.parse(markdown);
    }

    public StyledText convert(String markdown) throws ConversionException {
        return convert(parse(markdown));
    }

    public StyledText convert(Node root) throws ConversionException {
        Objects.requireNonNull(root, "root");
        Emitter emitter = new Emitter(options);
        emitter.emit(root);
        return emitter.finish();
    }

    public static StyledText toStyledText(Node root) throws ConversionException {
        return new MarkdownConverter().convert(root);
    }
}
