package org.dxworks.styledmark.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One line of a {@link StyledText}. Only the fields relevant to the line's kind are set:
 * {@code composite} for normal and code fence lines, {@code cells} for table rows and
 * {@code alignments} for table rules.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"kind", "composite", "cells", "alignments"})
public class Line {
    public final LineKind kind;
    public final Composite composite;
    public final List<Composite> cells;
    public final List<Alignment> alignments;

    private Line(LineKind kind, Composite composite, List<Composite> cells, List<Alignment> alignments) {
        this.kind = kind;
        this.composite = composite;
        this.cells = cells;
        this.alignments = alignments;
    }

    public static Line normal(Composite composite) {
        return new Line(LineKind.NORMAL, Objects.requireNonNull(composite, "composite"), null, null);
    }

    public static Line codeFence(Composite composite) {
        return new Line(LineKind.CODE_FENCE, Objects.requireNonNull(composite, "composite"), null, null);
    }

    public static Line horizontalRule() {
        return new Line(LineKind.HORIZONTAL_RULE, null, null, null);
    }

    public static Line tableRow(List<Composite> cells) {
        return new Line(LineKind.TABLE_ROW, null, new ArrayList<>(cells), null);
    }

    public static Line tableRule(List<Alignment> alignments) {
        return new Line(LineKind.TABLE_RULE, null, null, new ArrayList<>(alignments));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Line other)) return false;
        return kind == other.kind
                && Objects.equals(composite, other.composite)
                && Objects.equals(cells, other.cells)
                && Objects.equals(alignments, other.alignments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, composite, cells, alignments);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case NORMAL, CODE_FENCE -> kind + " " + composite;
            case TABLE_ROW -> kind + " " + cells;
            case TABLE_RULE -> kind + " " + alignments;
            case HORIZONTAL_RULE -> kind.toString();
        };
    }
}
