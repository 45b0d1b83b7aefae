/* @LICENSE@
 */
package org.xtrms.gbnf;

import java.util.Arrays;
import java.util.List;

/**
 * Matches every child, in order. Renders its children separated by a single
 * space.
 */
public final class Sequence extends Group {

    public Sequence(List<? extends Grammar> children, Quantifier quantifier) {
        super(children, quantifier);
    }

    public Sequence(List<? extends Grammar> children) {
        this(children, Quantifier.ONCE);
    }

    public Sequence(Grammar... children) {
        this(Arrays.asList(children), Quantifier.ONCE);
    }

    @Override
    String separator() {
        return " ";
    }

    @Override
    Group newGroup(List<? extends Grammar> children, Quantifier quantifier) {
        return new Sequence(children, quantifier);
    }

    @Override
    Grammar simplifyChildren(List<? extends Grammar> children,
            Quantifier quantifier) {
        return Simplifier.sequence(children, quantifier);
    }

    /*
     * juxtaposition binds tighter than anything but a suffix
     */
    @Override
    boolean severalNeedWrapping() {
        return !quantifier().isOnce();
    }
}
