package org.dxworks.styledmark.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Block style of a {@link Composite}. The level is the header depth (1-6) for headers,
 * the indentation (0-255) for list items and 0 otherwise.
 */
@JsonPropertyOrder({"type", "level"})
public final class CompositeStyle {
    public static final int MAX_HEADER_DEPTH = 6;
    public static final int MAX_LIST_INDENT = 255;

    private static final CompositeStyle PARAGRAPH = new CompositeStyle(StyleType.PARAGRAPH, 0);
    private static final CompositeStyle CODE = new CompositeStyle(StyleType.CODE, 0);
    private static final CompositeStyle QUOTE = new CompositeStyle(StyleType.QUOTE, 0);

    public final StyleType type;
    public final int level;

    private CompositeStyle(StyleType type, int level) {
        this.type = type;
        this.level = level;
    }

    public static CompositeStyle paragraph() {
        return PARAGRAPH;
    }

    public static CompositeStyle header(int depth) {
        if (depth < 1 || depth > MAX_HEADER_DEPTH) {
            throw new IllegalArgumentException("Header depth must be between 1 and " + MAX_HEADER_DEPTH + ": " + depth);
        }
        return new CompositeStyle(StyleType.HEADER, depth);
    }

    public static CompositeStyle listItem(int indent) {
        if (indent < 0 || indent > MAX_LIST_INDENT) {
            throw new IllegalArgumentException("List indent must be between 0 and " + MAX_LIST_INDENT + ": " + indent);
        }
        return new CompositeStyle(StyleType.LIST_ITEM, indent);
    }

    public static CompositeStyle code() {
        return CODE;
    }

    public static CompositeStyle quote() {
        return QUOTE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompositeStyle other)) return false;
        return type == other.type && level == other.level;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, level);
    }

    @Override
    public String toString() {
        return switch (type) {
            case HEADER, LIST_ITEM -> type + "(" + level + ")";
            default -> type.toString();
        };
    }
}
