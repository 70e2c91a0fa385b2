package org.dxworks.styledmark.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A converted document: the ordered lines handed to a terminal renderer.
 */
public class StyledText {
    public final List<Line> lines;

    public StyledText(List<Line> lines) {
        this.lines = new ArrayList<>(lines);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StyledText other)) return false;
        return lines.equals(other.lines);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lines);
    }

    @Override
    public String toString() {
        return "StyledText" + lines;
    }
}
