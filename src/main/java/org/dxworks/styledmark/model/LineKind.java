package org.dxworks.styledmark.model;

public enum LineKind {
    NORMAL,
    CODE_FENCE,
    HORIZONTAL_RULE,
    // Table lines are part of the renderer contract but no supported node produces them
    TABLE_ROW,
    TABLE_RULE
}
