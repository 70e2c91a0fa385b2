package org.dxworks.styledmark.converter;

import java.util.Objects;

/**
 * Context frame added by an ancestor node while a failure propagates up the tree walk.
 */
public class WhileEmittingException extends ConversionException {
    private final NodeKind kind;

    public WhileEmittingException(NodeKind kind, ConversionException cause) {
        super("while emitting `" + kind.getName() + "`", Objects.requireNonNull(cause, "cause"));
        this.kind = kind;
    }

    public NodeKind getKind() {
        return kind;
    }

    @Override
    public synchronized ConversionException getCause() {
        return (ConversionException) super.getCause();
    }
}
