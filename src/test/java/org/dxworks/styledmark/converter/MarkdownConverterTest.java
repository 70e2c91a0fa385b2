package org.dxworks.styledmark.converter;

import org.commonmark.node.Code;
import org.commonmark.node.Emphasis;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.Link;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.StrongEmphasis;
import org.dxworks.styledmark.model.CompositeStyle;
import org.dxworks.styledmark.model.Compound;
import org.dxworks.styledmark.model.Line;
import org.dxworks.styledmark.model.StyledText;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.styledmark.converter.Trees.blankLine;
import static org.dxworks.styledmark.converter.Trees.document;
import static org.dxworks.styledmark.converter.Trees.heading;
import static org.dxworks.styledmark.converter.Trees.line;
import static org.dxworks.styledmark.converter.Trees.paragraph;
import static org.dxworks.styledmark.converter.Trees.paragraphLine;
import static org.dxworks.styledmark.converter.Trees.text;
import static org.dxworks.styledmark.converter.Trees.with;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MarkdownConverterTest {

    private final MarkdownConverter converter = new MarkdownConverter();

    @Test
    void convert_HeadingThenParagraph_SeparatedByBlankLine() throws ConversionException {
        StyledText text = MarkdownConverter.toStyledText(document(
                heading(1, text("Hi")),
                paragraph(text("body"))));

        assertEquals(List.of(
                line(CompositeStyle.header(1), Compound.plain("Hi")),
                blankLine(),
                paragraphLine("body")), text.lines);
    }

    @Test
    void convert_SecondLevelHeading_NotSpacedByDefault() throws ConversionException {
        StyledText text = converter.convert("## Title\nbody\n");

        assertEquals(List.of(
                line(CompositeStyle.header(2), Compound.plain("Title")),
                paragraphLine("body")), text.lines);
    }

    @Test
    void convert_HeaderSpacingOption_AppliesPerDepth() throws ConversionException {
        MarkdownConverter spaced = new MarkdownConverter(ConversionOptions.defaults()
                .withHeaderSpacing(1, false)
                .withHeaderSpacing(3, true));

        StyledText text = spaced.convert("# One\nfirst\n### Three\nsecond\n");

        assertEquals(List.of(
                line(CompositeStyle.header(1), Compound.plain("One")),
                paragraphLine("first"),
                blankLine(),
                line(CompositeStyle.header(3), Compound.plain("Three")),
                blankLine(),
                paragraphLine("second")), text.lines);
    }

    @Test
    void convert_ConsecutiveParagraphs_SeparatedByBlankLine() throws ConversionException {
        StyledText text = converter.convert("one\n\ntwo\n");

        assertEquals(List.of(paragraphLine("one"), blankLine(), paragraphLine("two")), text.lines);
    }

    @Test
    void convert_TextWithLineBreak_SplitsIntoTwoLines() throws ConversionException {
        StyledText text = MarkdownConverter.toStyledText(document(
                paragraph(with(new StrongEmphasis(), text("a\nb")))));

        Compound a = new Compound("a", true, false, false, false);
        Compound b = new Compound("b", true, false, false, false);
        assertEquals(List.of(
                line(CompositeStyle.paragraph(), a),
                line(CompositeStyle.paragraph(), b)), text.lines);
    }

    @Test
    void convert_CrLfAndEmptyFragments_KeepBlankLines() throws ConversionException {
        StyledText text = MarkdownConverter.toStyledText(document(paragraph(text("a\r\n\nb"))));

        assertEquals(List.of(paragraphLine("a"), blankLine(), paragraphLine("b")), text.lines);
    }

    @Test
    void convert_LoneCarriageReturn_StaysInText() throws ConversionException {
        StyledText text = MarkdownConverter.toStyledText(document(paragraph(text("a\rb"))));

        assertEquals(List.of(paragraphLine("a\rb")), text.lines);
    }

    @Test
    void convert_SoftLineBreak_StartsNewLineWithSameStyle() throws ConversionException {
        StyledText text = MarkdownConverter.toStyledText(document(
                heading(2, text("first"), new SoftLineBreak(), text("second"))));

        assertEquals(List.of(
                line(CompositeStyle.header(2), Compound.plain("first")),
                line(CompositeStyle.header(2), Compound.plain("second"))), text.lines);
    }

    @Test
    void convert_NestedStrong_StaysBold() throws ConversionException {
        StyledText nested = MarkdownConverter.toStyledText(document(paragraph(
                with(new StrongEmphasis(), with(new StrongEmphasis(), text("a"))))));
        StyledText single = MarkdownConverter.toStyledText(document(paragraph(
                with(new StrongEmphasis(), text("a")))));

        assertEquals(single, nested);
        assertEquals(new Compound("a", true, false, false, false), nested.lines.get(0).composite.compounds.get(0));
    }

    @Test
    void convert_EmphasisScopes_RestorePreviousStyle() throws ConversionException {
        StyledText text = MarkdownConverter.toStyledText(document(paragraph(
                with(new StrongEmphasis(),
                        text("a"),
                        with(new Emphasis(), text("b")),
                        text("c")),
                text("d"))));

        assertEquals(List.of(line(CompositeStyle.paragraph(),
                new Compound("a", true, false, false, false),
                new Compound("b", true, true, false, false),
                new Compound("c", true, false, false, false),
                Compound.plain("d"))), text.lines);
    }

    @Test
    void convert_ParsedInlineStyles() throws ConversionException {
        StyledText text = converter.convert("Some *italic*, **bold**, ~~gone~~ and `code`\n");

        assertEquals(List.of(line(CompositeStyle.paragraph(),
                Compound.plain("Some "),
                new Compound("italic", false, true, false, false),
                Compound.plain(", "),
                new Compound("bold", true, false, false, false),
                Compound.plain(", "),
                new Compound("gone", false, false, false, true),
                Compound.plain(" and "),
                new Compound("code", false, false, true, false))), text.lines);
    }

    @Test
    void convert_InlineCode_KeepsAmbientStyle() throws ConversionException {
        StyledText text = MarkdownConverter.toStyledText(document(paragraph(
                with(new Emphasis(), new Code("x")))));

        assertEquals(List.of(line(CompositeStyle.paragraph(), new Compound("x", false, true, true, false))),
                text.lines);
    }

    @Test
    void convert_CodeBlock_OneLinePerSourceLine() throws ConversionException {
        FencedCodeBlock code = new FencedCodeBlock();
        code.setLiteral("let x;\n\n**foo**\n");

        StyledText text = MarkdownConverter.toStyledText(document(paragraph(text("before")), code));

        assertEquals(List.of(
                paragraphLine("before"),
                blankLine(),
                line(CompositeStyle.code(), Compound.plain("let x;")),
                line(CompositeStyle.code()),
                line(CompositeStyle.code(), Compound.plain("**foo**"))), text.lines);
    }

    @Test
    void convert_IndentedCodeBlock_UsesCodeStyle() throws ConversionException {
        StyledText text = converter.convert("    int x = 1;\n");

        assertEquals(List.of(line(CompositeStyle.code(), Compound.plain("int x = 1;"))), text.lines);
    }

    @Test
    void convert_Link_InheritsStyleByDefault() throws ConversionException {
        StyledText text = MarkdownConverter.toStyledText(document(paragraph(
                with(new Emphasis(), with(new Link("https://example.com", null), text("site"))))));

        assertEquals(List.of(line(CompositeStyle.paragraph(), new Compound("site", false, true, false, false))),
                text.lines);
    }

    @Test
    void convert_Link_AppliesConfiguredOverrides() throws ConversionException {
        MarkdownConverter linkConverter = new MarkdownConverter(ConversionOptions.defaults()
                .withLinksStyle(LinkStyle.of(true, false, null)));

        StyledText text = linkConverter.convert("*see [the ~~site~~](https://example.com) now*\n");

        assertEquals(List.of(line(CompositeStyle.paragraph(),
                new Compound("see ", false, true, false, false),
                new Compound("the ", true, false, false, false),
                new Compound("site", true, false, false, true),
                new Compound(" now", false, true, false, false))), text.lines);
    }

    @Test
    void convert_HeadingInsideHeading_KeepsAllText() throws ConversionException {
        StyledText text = MarkdownConverter.toStyledText(document(
                heading(1, text("a"), heading(2, text("b")), text("c"))));

        assertEquals(List.of(
                line(CompositeStyle.header(1), Compound.plain("a")),
                line(CompositeStyle.header(2), Compound.plain("b")),
                paragraphLine("c")), text.lines);
    }

    @Test
    void convert_TextDirectlyUnderDocument_OpensParagraph() throws ConversionException {
        StyledText text = MarkdownConverter.toStyledText(document(text("loose")));

        assertEquals(List.of(paragraphLine("loose")), text.lines);
    }

    @Test
    void convert_EmptyDocument_HasNoLines() throws ConversionException {
        assertTrue(converter.convert("").lines.isEmpty());
    }

    @Test
    void convert_EmptyParagraph_EmitsNoLineButSpacesNextBlock() throws ConversionException {
        StyledText text = MarkdownConverter.toStyledText(document(paragraph(), paragraph(text("x"))));

        List<Line> expected = List.of(blankLine(), paragraphLine("x"));
        assertEquals(expected, text.lines);
    }
}
