package org.dxworks.styledmark.converter;

public class UnsupportedNodeException extends ConversionException {
    private final NodeKind kind;

    public UnsupportedNodeException(NodeKind kind) {
        super("`" + kind.getName() + "` node is not supported");
        this.kind = kind;
    }

    public UnsupportedNodeException(NodeKind kind, String detail) {
        super("`" + kind.getName() + "` node is not supported: " + detail);
        this.kind = kind;
    }

    public NodeKind getKind() {
        return kind;
    }
}
