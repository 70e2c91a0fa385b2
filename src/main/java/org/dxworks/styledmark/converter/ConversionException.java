package org.dxworks.styledmark.converter;

import java.util.ArrayList;
import java.util.List;

/**
 * Base of every failure raised while converting a document. Leaf failures are wrapped in one
 * {@link WhileEmittingException} per ancestor node as they propagate to the caller, so the
 * original failure is always the innermost cause.
 */
public abstract class ConversionException extends Exception {

    protected ConversionException(String message) {
        super(message);
    }

    protected ConversionException(String message, ConversionException cause) {
        super(message, cause);
    }

    /**
     * Follows the wrapping frames down to the failure that started the chain.
     */
    public ConversionException rootCause() {
        ConversionException current = this;
        while (current instanceof WhileEmittingException wrapper) {
            current = wrapper.getCause();
        }
        return current;
    }

    /**
     * Kinds of the nodes that were being emitted when the failure happened, root first.
     */
    public List<NodeKind> contextPath() {
        List<NodeKind> path = new ArrayList<>();
        ConversionException current = this;
        while (current instanceof WhileEmittingException wrapper) {
            path.add(wrapper.getKind());
            current = wrapper.getCause();
        }
        return path;
    }

    /**
     * Messages of the whole chain, outermost context first and the original failure last.
     */
    public List<String> describeChain() {
        List<String> messages = new ArrayList<>();
        ConversionException current = this;
        while (current != null) {
            messages.add(current.getMessage());
            current = current instanceof WhileEmittingException wrapper ? wrapper.getCause() : null;
        }
        return messages;
    }
}
