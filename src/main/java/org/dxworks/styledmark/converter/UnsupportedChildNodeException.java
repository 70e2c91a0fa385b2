package org.dxworks.styledmark.converter;

/**
 * A node kind that is supported in general but not under the parent it was found in.
 */
public class UnsupportedChildNodeException extends ConversionException {
    private final NodeKind kind;
    private final NodeKind parentKind;

    /**
     * @param parentKind kind of the parent the node was found in, or null when it is not known
     */
    public UnsupportedChildNodeException(NodeKind kind, NodeKind parentKind) {
        super(parentKind == null
                ? "`" + kind.getName() + "` node is not supported in this position"
                : "`" + kind.getName() + "` node is not supported inside `" + parentKind.getName() + "`");
        this.kind = kind;
        this.parentKind = parentKind;
    }

    public NodeKind getKind() {
        return kind;
    }

    public NodeKind getParentKind() {
        return parentKind;
    }
}
