package org.dxworks.styledmark.model;

public enum StyleType {
    PARAGRAPH,
    HEADER,
    LIST_ITEM,
    CODE,
    QUOTE
}
