package org.dxworks.styledmark.converter;

public class NumberedListsUnsupportedException extends ConversionException {

    public NumberedListsUnsupportedException() {
        super("numbered lists are not supported");
    }
}
