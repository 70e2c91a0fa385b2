package org.dxworks.styledmark.converter;

import java.util.Objects;

/**
 * Per-flag overrides applied to link contents. A null flag inherits the surrounding style.
 */
public final class LinkStyle {
    private static final LinkStyle INHERIT = new LinkStyle(null, null, null);

    private final Boolean bold;
    private final Boolean italic;
    private final Boolean strikeout;

    private LinkStyle(Boolean bold, Boolean italic, Boolean strikeout) {
        this.bold = bold;
        this.italic = italic;
        this.strikeout = strikeout;
    }

    public static LinkStyle inherit() {
        return INHERIT;
    }

    public static LinkStyle of(Boolean bold, Boolean italic, Boolean strikeout) {
        return new LinkStyle(bold, italic, strikeout);
    }

    public Boolean getBold() {
        return bold;
    }

    public Boolean getItalic() {
        return italic;
    }

    public Boolean getStrikeout() {
        return strikeout;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LinkStyle other)) return false;
        return Objects.equals(bold, other.bold)
                && Objects.equals(italic, other.italic)
                && Objects.equals(strikeout, other.strikeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bold, italic, strikeout);
    }

    @Override
    public String toString() {
        return "LinkStyle{bold=" + bold + ", italic=" + italic + ", strikeout=" + strikeout + "}";
    }
}
