package org.dxworks.styledmark.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A run of text sharing one set of inline styles. Never spans a line break.
 */
@JsonPropertyOrder({"text", "bold", "italic", "code", "strikeout"})
public final class Compound {
    public final String text;
    public final boolean bold;
    public final boolean italic;
    public final boolean code;
    public final boolean strikeout;

    public Compound(String text, boolean bold, boolean italic, boolean code, boolean strikeout) {
        this.text = Objects.requireNonNull(text, "text");
        this.bold = bold;
        this.italic = italic;
        this.code = code;
        this.strikeout = strikeout;
    }

    public static Compound plain(String text) {
        return new Compound(text, false, false, false, false);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Compound other)) return false;
        return bold == other.bold
                && italic == other.italic
                && code == other.code
                && strikeout == other.strikeout
                && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, bold, italic, code, strikeout);
    }

    @Override
    public String toString() {
        StringBuilder flags = new StringBuilder();
        if (bold) flags.append('b');
        if (italic) flags.append('i');
        if (code) flags.append('c');
        if (strikeout) flags.append('s');
        return flags.length() == 0 ? '"' + text + '"' : '"' + text + "\"[" + flags + ']';
    }
}
