package org.dxworks.styledmark.converter;

import org.dxworks.styledmark.model.Compound;

/**
 * Emphasis flags in effect for the text under the node being emitted. Values are immutable and
 * passed down the walk, so leaving an emphasis node needs no restoring.
 */
final class InlineStyle {
    static final InlineStyle PLAIN = new InlineStyle(false, false, false);

    final boolean bold;
    final boolean italic;
    final boolean strikeout;

    private InlineStyle(boolean bold, boolean italic, boolean strikeout) {
        this.bold = bold;
        this.italic = italic;
        this.strikeout = strikeout;
    }

    InlineStyle withBold() {
        return bold ? this : new InlineStyle(true, italic, strikeout);
    }

    InlineStyle withItalic() {
        return italic ? this : new InlineStyle(bold, true, strikeout);
    }

    InlineStyle withStrikeout() {
        return strikeout ? this : new InlineStyle(bold, italic, true);
    }

    InlineStyle overriddenBy(LinkStyle linkStyle) {
        return new InlineStyle(
                linkStyle.getBold() != null ? linkStyle.getBold() : bold,
                linkStyle.getItalic() != null ? linkStyle.getItalic() : italic,
                linkStyle.getStrikeout() != null ? linkStyle.getStrikeout() : strikeout);
    }

    Compound compound(String text, boolean code) {
        return new Compound(text, bold, italic, code, strikeout);
    }
}
