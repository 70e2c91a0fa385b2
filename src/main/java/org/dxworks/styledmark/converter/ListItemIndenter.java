package org.dxworks.styledmark.converter;

import org.dxworks.styledmark.model.Composite;
import org.dxworks.styledmark.model.CompositeStyle;
import org.dxworks.styledmark.model.Compound;
import org.dxworks.styledmark.model.Line;
import org.dxworks.styledmark.model.LineKind;
import org.dxworks.styledmark.model.StyleType;
import org.dxworks.styledmark.model.StyledText;

import java.util.List;

/**
 * Turns the separately converted content of one list item into the lines of that item:
 * the first paragraph becomes the bullet line, nested list items gain one indentation level
 * and every other block is shifted right.
 */
final class ListItemIndenter {

    static final String BLOCK_INDENT = "  ";

    private ListItemIndenter() {}

    static List<Line> indent(StyledText item) throws ListNestingTooDeepException {
        List<Line> lines = item.lines;

        Line first = lines.isEmpty() ? null : lines.get(0);
        if (isParagraph(first)) {
            first.composite.style = CompositeStyle.listItem(0);
        } else {
            // Items starting with a nested list or a code block still get their own (empty) bullet line
            lines.add(0, Line.normal(new Composite(CompositeStyle.listItem(0))));
        }

        for (Line line : lines.subList(1, lines.size())) {
            switch (line.kind) {
                case NORMAL -> indentNested(line.composite);
                case HORIZONTAL_RULE -> {
                    // rules span the whole width
                }
                case CODE_FENCE, TABLE_ROW, TABLE_RULE -> throw new UnsupportedOperationException(
                        "Indenting " + line.kind + " lines inside list items is not implemented");
            }
        }
        return lines;
    }

    private static void indentNested(Composite composite) throws ListNestingTooDeepException {
        if (composite.style.type == StyleType.LIST_ITEM) {
            int indent = composite.style.level;
            if (indent >= CompositeStyle.MAX_LIST_INDENT) {
                throw new ListNestingTooDeepException(CompositeStyle.MAX_LIST_INDENT);
            }
            composite.style = CompositeStyle.listItem(indent + 1);
        } else {
            composite.compounds.add(0, Compound.plain(BLOCK_INDENT));
        }
    }

    private static boolean isParagraph(Line line) {
        return line != null
                && line.kind == LineKind.NORMAL
                && line.composite.style.type == StyleType.PARAGRAPH;
    }
}
