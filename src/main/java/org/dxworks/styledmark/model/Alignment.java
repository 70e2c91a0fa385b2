package org.dxworks.styledmark.model;

public enum Alignment {
    UNSPECIFIED,
    LEFT,
    CENTER,
    RIGHT
}
