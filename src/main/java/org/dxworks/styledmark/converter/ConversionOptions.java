package org.dxworks.styledmark.converter;

import org.dxworks.styledmark.model.CompositeStyle;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable settings consulted while converting a document.
 */
public final class ConversionOptions {
    // Only top level headers are followed by a blank line unless configured otherwise
    private static final boolean[] DEFAULT_HEADER_SPACING = {true, false, false, false, false, false};

    private final boolean[] headerSpacing;
    private final LinkStyle linksStyle;

    private ConversionOptions(boolean[] headerSpacing, LinkStyle linksStyle) {
        this.headerSpacing = headerSpacing;
        this.linksStyle = linksStyle;
    }

    public static ConversionOptions defaults() {
        return new ConversionOptions(DEFAULT_HEADER_SPACING.clone(), LinkStyle.inherit());
    }

    /**
     * Whether a blank line separates a header of the given depth (1-6) from the next block.
     */
    public boolean headerSpacing(int depth) {
        return headerSpacing[checkDepth(depth) - 1];
    }

    public ConversionOptions withHeaderSpacing(int depth, boolean spacing) {
        boolean[] copy = headerSpacing.clone();
        copy[checkDepth(depth) - 1] = spacing;
        return new ConversionOptions(copy, linksStyle);
    }

    public LinkStyle getLinksStyle() {
        return linksStyle;
    }

    public ConversionOptions withLinksStyle(LinkStyle linksStyle) {
        return new ConversionOptions(headerSpacing, Objects.requireNonNull(linksStyle, "linksStyle"));
    }

    private static int checkDepth(int depth) {
        if (depth < 1 || depth > CompositeStyle.MAX_HEADER_DEPTH) {
            throw new IllegalArgumentException("Header depth must be between 1 and "
                    + CompositeStyle.MAX_HEADER_DEPTH + ": " + depth);
        }
        return depth;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConversionOptions other)) return false;
        return Arrays.equals(headerSpacing, other.headerSpacing) && linksStyle.equals(other.linksStyle);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(headerSpacing) + linksStyle.hashCode();
    }

    @Override
    public String toString() {
        return "ConversionOptions{headerSpacing=" + Arrays.toString(headerSpacing) + ", linksStyle=" + linksStyle + "}";
    }
}
