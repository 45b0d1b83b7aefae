/* @LICENSE@
 */
package org.xtrms.gbnf;

import java.util.Arrays;
import java.util.List;

/**
 * Matches exactly one of its children. Renders its children separated by
 * <code>" | "</code>, always parenthesised when there are two or more.
 * <p>
 * Child order is kept as given and is significant for equality, even though
 * the choice itself is commutative.
 */
public final class Alternation extends Group {

    public Alternation(List<? extends Grammar> children, Quantifier quantifier) {
        super(children, quantifier);
    }

    public Alternation(List<? extends Grammar> children) {
        this(children, Quantifier.ONCE);
    }

    public Alternation(Grammar... children) {
        this(Arrays.asList(children), Quantifier.ONCE);
    }

    @Override
    String separator() {
        return " | ";
    }

    @Override
    Group newGroup(List<? extends Grammar> children, Quantifier quantifier) {
        return new Alternation(children, quantifier);
    }

    @Override
    Grammar simplifyChildren(List<? extends Grammar> children,
            Quantifier quantifier) {
        return Simplifier.alternation(children, quantifier);
    }

    @Override
    boolean severalNeedWrapping() {
        return true;
    }
}
