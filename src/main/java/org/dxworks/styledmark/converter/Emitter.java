package org.dxworks.styledmark.converter;

import org.commonmark.node.Code;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.Heading;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.Text;
import org.dxworks.styledmark.converter.ContentModel.Flow;
import org.dxworks.styledmark.converter.ContentModel.Phrasing;
import org.dxworks.styledmark.model.Composite;
import org.dxworks.styledmark.model.CompositeStyle;
import org.dxworks.styledmark.model.Line;
import org.dxworks.styledmark.model.StyledText;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Walks a commonmark tree once and accumulates the lines of the converted document.
 * An emitter is single use: create one, feed it the root with {@link #emit(Node)}, then {@link #finish()}.
 */
class Emitter {

    private static final Pattern LINE_BREAK = Pattern.compile("\r?\n");

    private final ConversionOptions options;
    private final List<Line> lines = new ArrayList<>();
    // null until the first block is entered, which counts as flow without spacing
    private ContentModel current;

    Emitter(ConversionOptions options) {
        this.options = options;
    }

    void emit(Node root) throws ConversionException {
        node(root, InlineStyle.PLAIN);
    }

    StyledText finish() {
        if (current instanceof Phrasing phrasing && !phrasing.isEmpty()) {
            lines.add(phrasing.toLine());
        }
        current = null;
        return new StyledText(lines);
    }

    private void node(Node node, InlineStyle style) throws ConversionException {
        NodeKind kind = NodeKind.of(node);
        EmitAction action = switch (kind) {
            case DOCUMENT -> () -> children(node, style);
            case HEADING -> () -> heading((Heading) node, style);
            case PARAGRAPH -> () -> phrasing(CompositeStyle.paragraph(), true, () -> children(node, style));
            case FENCED_CODE_BLOCK -> () -> codeBlock(((FencedCodeBlock) node).getLiteral());
            case INDENTED_CODE_BLOCK -> () -> codeBlock(((IndentedCodeBlock) node).getLiteral());
            case TEXT -> () -> segment(((Text) node).getLiteral(), style, false);
            // commonmark keeps soft line endings out of the text literals
            case SOFT_LINE_BREAK -> () -> segment("\n", style, false);
            case INLINE_CODE -> () -> segment(((Code) node).getLiteral(), style, true);
            case STRONG_EMPHASIS -> () -> children(node, style.withBold());
            case EMPHASIS -> () -> children(node, style.withItalic());
            case STRIKETHROUGH -> () -> children(node, style.withStrikeout());
            case LINK -> () -> children(node, style.overriddenBy(options.getLinksStyle()));
            case BULLET_LIST -> () -> bulletList(node);
            case ORDERED_LIST -> () -> {
                throw new NumberedListsUnsupportedException();
            };
            case LIST_ITEM -> () -> {
                Node parent = node.getParent();
                throw new UnsupportedChildNodeException(kind, parent != null ? NodeKind.of(parent) : null);
            };
            case HARD_LINE_BREAK, IMAGE, BLOCK_QUOTE, THEMATIC_BREAK, HTML_BLOCK, HTML_INLINE,
                    LINK_REFERENCE_DEFINITION, TABLE, TABLE_HEAD, TABLE_BODY, TABLE_ROW, TABLE_CELL,
                    YAML_FRONT_MATTER, YAML_FRONT_MATTER_ENTRY, FOOTNOTE_DEFINITION, FOOTNOTE_REFERENCE,
                    INLINE_FOOTNOTE, CUSTOM_BLOCK, CUSTOM_INLINE -> () -> {
                throw new UnsupportedNodeException(kind);
            };
        };
        action.run();
    }

    /**
     * Emits the children of {@code parent} in order. A failing child is wrapped with the kind of
     * {@code parent}, which is how every ancestor ends up in the error chain.
     */
    private void children(Node parent, InlineStyle style) throws ConversionException {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNext()) {
            try {
                node(child, style);
            } catch (ConversionException e) {
                throw new WhileEmittingException(NodeKind.of(parent), e);
            }
        }
    }

    private void heading(Heading heading, InlineStyle style) throws ConversionException {
        int level = heading.getLevel();
        if (level < 1 || level > CompositeStyle.MAX_HEADER_DEPTH) {
            throw new UnsupportedNodeException(NodeKind.HEADING, "level " + level + " is out of range");
        }
        phrasing(CompositeStyle.header(level), options.headerSpacing(level), () -> children(heading, style));
    }

    private void codeBlock(String literal) throws ConversionException {
        // code keeps its text verbatim, whatever emphasis surrounds it
        phrasing(CompositeStyle.code(), true, () -> segment(literal, InlineStyle.PLAIN, false));
    }

    private void bulletList(Node list) throws ConversionException {
        phrasing(CompositeStyle.paragraph(), true, () -> {
            for (Node child = list.getFirstChild(); child != null; child = child.getNext()) {
                StyledText converted;
                try {
                    converted = convertItem(child);
                } catch (ConversionException e) {
                    throw new WhileEmittingException(NodeKind.BULLET_LIST, e);
                }
                lines.addAll(ListItemIndenter.indent(converted));
            }
        });
    }

    /**
     * Converts the content of one list item on its own, as if it were a whole document.
     */
    private StyledText convertItem(Node child) throws ConversionException {
        if (!(child instanceof ListItem item)) {
            throw new UnsupportedChildNodeException(NodeKind.of(child), NodeKind.BULLET_LIST);
        }
        Emitter itemEmitter = new Emitter(options);
        itemEmitter.children(item, InlineStyle.PLAIN);
        return itemEmitter.finish();
    }

    /**
     * Runs {@code body} while accumulating one line styled {@code style}. Whatever the body leaves
     * in the buffer is flushed on the way out, including when it fails, and the surrounding flow
     * then remembers {@code spacingAfter} for the next block.
     */
    private void phrasing(CompositeStyle style, boolean spacingAfter, EmitAction body) throws ConversionException {
        Flow outer;
        if (current instanceof Phrasing open) {
            // only reachable with blocks nested in inline content
            if (!open.isEmpty()) {
                lines.add(open.toLine());
            }
            outer = ContentModel.flow(false);
        } else {
            outer = current instanceof Flow flow ? flow : ContentModel.flow(false);
        }
        if (outer.spacing) {
            lines.add(Line.normal(new Composite(CompositeStyle.paragraph())));
        }

        current = ContentModel.phrasing(style);
        try {
            body.run();
        } finally {
            ContentModel exited = current;
            current = ContentModel.flow(spacingAfter);
            if (exited instanceof Phrasing phrasing && !phrasing.isEmpty()) {
                lines.add(phrasing.toLine());
            }
        }
    }

    /**
     * Appends {@code raw} to the line being built, starting a new line with the same style at
     * every line break. Empty fragments still end a line so blank lines survive.
     */
    private void segment(String raw, InlineStyle style, boolean code) {
        Phrasing phrasing = openPhrasing();
        String[] fragments = LINE_BREAK.split(raw, -1);
        for (int i = 0; i < fragments.length; i++) {
            if (i > 0) {
                lines.add(phrasing.toLine());
                phrasing = ContentModel.phrasing(phrasing.style);
                current = phrasing;
            }
            if (!fragments[i].isEmpty()) {
                phrasing.compounds.add(style.compound(fragments[i], code));
            }
        }
    }

    private Phrasing openPhrasing() {
        if (current instanceof Phrasing phrasing) {
            return phrasing;
        }
        // text outside of any block
        Phrasing phrasing = ContentModel.phrasing(CompositeStyle.paragraph());
        current = phrasing;
        return phrasing;
    }

    @FunctionalInterface
    private interface EmitAction {
        void run() throws ConversionException;
    }
}
