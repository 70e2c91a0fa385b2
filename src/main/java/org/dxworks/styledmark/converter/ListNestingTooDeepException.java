package org.dxworks.styledmark.converter;

public class ListNestingTooDeepException extends ConversionException {
    private final int maxIndent;

    public ListNestingTooDeepException(int maxIndent) {
        super("lists are nested too deeply, list item indentation cannot exceed " + maxIndent);
        this.maxIndent = maxIndent;
    }

    public int getMaxIndent() {
        return maxIndent;
    }
}
