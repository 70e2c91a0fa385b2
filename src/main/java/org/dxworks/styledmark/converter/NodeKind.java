package org.dxworks.styledmark.converter;

import org.commonmark.ext.footnotes.FootnoteDefinition;
import org.commonmark.ext.footnotes.FootnoteReference;
import org.commonmark.ext.footnotes.InlineFootnote;
import org.commonmark.ext.front.matter.YamlFrontMatterBlock;
import org.commonmark.ext.front.matter.YamlFrontMatterNode;
import org.commonmark.ext.gfm.strikethrough.Strikethrough;
import org.commonmark.ext.gfm.tables.TableBlock;
import org.commonmark.ext.gfm.tables.TableBody;
import org.commonmark.ext.gfm.tables.TableCell;
import org.commonmark.ext.gfm.tables.TableHead;
import org.commonmark.ext.gfm.tables.TableRow;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.BulletList;
import org.commonmark.node.Code;
import org.commonmark.node.CustomBlock;
import org.commonmark.node.CustomNode;
import org.commonmark.node.Document;
import org.commonmark.node.Emphasis;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Heading;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.HtmlInline;
import org.commonmark.node.Image;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Link;
import org.commonmark.node.LinkReferenceDefinition;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.StrongEmphasis;
import org.commonmark.node.Text;
import org.commonmark.node.ThematicBreak;
import org.commonmark.node.Visitor;

import java.util.Objects;

/**
 * Symbolic names for every kind of source node, used to describe conversion failures.
 */
public enum NodeKind {
    DOCUMENT("document"),
    HEADING("heading"),
    PARAGRAPH("paragraph"),
    TEXT("text"),
    SOFT_LINE_BREAK("soft_line_break"),
    HARD_LINE_BREAK("hard_line_break"),
    EMPHASIS("emphasis"),
    STRONG_EMPHASIS("strong_emphasis"),
    STRIKETHROUGH("strikethrough"),
    INLINE_CODE("inline_code"),
    LINK("link"),
    IMAGE("image"),
    BULLET_LIST("bullet_list"),
    ORDERED_LIST("ordered_list"),
    LIST_ITEM("list_item"),
    FENCED_CODE_BLOCK("fenced_code_block"),
    INDENTED_CODE_BLOCK("indented_code_block"),
    BLOCK_QUOTE("block_quote"),
    THEMATIC_BREAK("thematic_break"),
    HTML_BLOCK("html_block"),
    HTML_INLINE("html_inline"),
    LINK_REFERENCE_DEFINITION("link_reference_definition"),
    TABLE("table"),
    TABLE_HEAD("table_head"),
    TABLE_BODY("table_body"),
    TABLE_ROW("table_row"),
    TABLE_CELL("table_cell"),
    YAML_FRONT_MATTER("yaml_front_matter"),
    YAML_FRONT_MATTER_ENTRY("yaml_front_matter_entry"),
    FOOTNOTE_DEFINITION("footnote_definition"),
    FOOTNOTE_REFERENCE("footnote_reference"),
    INLINE_FOOTNOTE("inline_footnote"),
    CUSTOM_BLOCK("custom_block"),
    CUSTOM_INLINE("custom_inline");

    private final String name;

    NodeKind(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }

    public static NodeKind of(Node node) {
        Objects.requireNonNull(node, "node");
        KindVisitor visitor = new KindVisitor();
        node.accept(visitor);
        return visitor.kind;
    }

    // Implements Visitor rather than AbstractVisitor so that a new core node type fails to compile here.
    // accept() dispatches on the node itself and never descends into children.
    private static class KindVisitor implements Visitor {
        private NodeKind kind;

        @Override
        public void visit(BlockQuote blockQuote) {
            kind = BLOCK_QUOTE;
        }

        @Override
        public void visit(BulletList bulletList) {
            kind = BULLET_LIST;
        }

        @Override
        public void visit(Code code) {
            kind = INLINE_CODE;
        }

        @Override
        public void visit(Document document) {
            kind = DOCUMENT;
        }

        @Override
        public void visit(Emphasis emphasis) {
            kind = EMPHASIS;
        }

        @Override
        public void visit(FencedCodeBlock fencedCodeBlock) {
            kind = FENCED_CODE_BLOCK;
        }

        @Override
        public void visit(HardLineBreak hardLineBreak) {
            kind = HARD_LINE_BREAK;
        }

        @Override
        public void visit(Heading heading) {
            kind = HEADING;
        }

        @Override
        public void visit(ThematicBreak thematicBreak) {
            kind = THEMATIC_BREAK;
        }

        @Override
        public void visit(HtmlInline htmlInline) {
            kind = HTML_INLINE;
        }

        @Override
        public void visit(HtmlBlock htmlBlock) {
            kind = HTML_BLOCK;
        }

        @Override
        public void visit(Image image) {
            kind = IMAGE;
        }

        @Override
        public void visit(IndentedCodeBlock indentedCodeBlock) {
            kind = INDENTED_CODE_BLOCK;
        }

        @Override
        public void visit(Link link) {
            kind = LINK;
        }

        @Override
        public void visit(ListItem listItem) {
            kind = LIST_ITEM;
        }

        @Override
        public void visit(OrderedList orderedList) {
            kind = ORDERED_LIST;
        }

        @Override
        public void visit(Paragraph paragraph) {
            kind = PARAGRAPH;
        }

        @Override
        public void visit(SoftLineBreak softLineBreak) {
            kind = SOFT_LINE_BREAK;
        }

        @Override
        public void visit(StrongEmphasis strongEmphasis) {
            kind = STRONG_EMPHASIS;
        }

        @Override
        public void visit(Text text) {
            kind = TEXT;
        }

        @Override
        public void visit(LinkReferenceDefinition linkReferenceDefinition) {
            kind = LINK_REFERENCE_DEFINITION;
        }

        @Override
        public void visit(CustomBlock customBlock) {
            if (customBlock instanceof TableBlock) {
                kind = TABLE;
            } else if (customBlock instanceof YamlFrontMatterBlock) {
                kind = YAML_FRONT_MATTER;
            } else if (customBlock instanceof FootnoteDefinition) {
                kind = FOOTNOTE_DEFINITION;
            } else {
                kind = CUSTOM_BLOCK;
            }
        }

        @Override
        public void visit(CustomNode customNode) {
            if (customNode instanceof Strikethrough) {
                kind = STRIKETHROUGH;
            } else if (customNode instanceof TableHead) {
                kind = TABLE_HEAD;
            } else if (customNode instanceof TableBody) {
                kind = TABLE_BODY;
            } else if (customNode instanceof TableRow) {
                kind = TABLE_ROW;
            } else if (customNode instanceof TableCell) {
                kind = TABLE_CELL;
            } else if (customNode instanceof YamlFrontMatterNode) {
                kind = YAML_FRONT_MATTER_ENTRY;
            } else if (customNode instanceof FootnoteReference) {
                kind = FOOTNOTE_REFERENCE;
            } else if (customNode instanceof InlineFootnote) {
                kind = INLINE_FOOTNOTE;
            } else {
                kind = CUSTOM_INLINE;
            }
        }
    }
}
