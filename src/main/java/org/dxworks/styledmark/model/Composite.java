package org.dxworks.styledmark.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A styled block: one style and the compounds laid out on its line.
 */
@JsonPropertyOrder({"style", "compounds"})
public class Composite {
    public CompositeStyle style;
    public final List<Compound> compounds;

    public Composite(CompositeStyle style, List<Compound> compounds) {
        this.style = Objects.requireNonNull(style, "style");
        this.compounds = new ArrayList<>(compounds);
    }

    public Composite(CompositeStyle style) {
        this(style, List.of());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Composite other)) return false;
        return style.equals(other.style) && compounds.equals(other.compounds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(style, compounds);
    }

    @Override
    public String toString() {
        return style + compounds.toString();
    }
}
