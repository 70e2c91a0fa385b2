package org.dxworks.styledmark.converter;

import org.dxworks.styledmark.model.Composite;
import org.dxworks.styledmark.model.CompositeStyle;
import org.dxworks.styledmark.model.Compound;
import org.dxworks.styledmark.model.Line;

import java.util.ArrayList;
import java.util.List;

/**
 * What the emitter is building at a given point of the walk: block structure ({@link Flow})
 * or the compounds of one line ({@link Phrasing}).
 */
abstract class ContentModel {

    static Flow flow(boolean spacing) {
        return new Flow(spacing);
    }

    static Phrasing phrasing(CompositeStyle style) {
        return new Phrasing(style);
    }

    static final class Flow extends ContentModel {
        // Whether the next block must be preceded by a blank line
        final boolean spacing;

        private Flow(boolean spacing) {
            this.spacing = spacing;
        }
    }

    static final class Phrasing extends ContentModel {
        final CompositeStyle style;
        final List<Compound> compounds = new ArrayList<>();

        private Phrasing(CompositeStyle style) {
            this.style = style;
        }

        boolean isEmpty() {
            return compounds.isEmpty();
        }

        Line toLine() {
            return Line.normal(new Composite(style, compounds));
        }
    }
}
