/* @LICENSE@
 */
package org.xtrms.gbnf;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An ordered list of child grammars repeated as a unit according to a
 * {@link Quantifier}. The two kinds differ in how the children combine:
 * {@link Sequence} matches all of them in order, {@link Alternation} exactly
 * one of them.
 * <p>
 * The child list is copied on construction and cannot be modified
 * afterwards.
 */
public abstract class Group extends Grammar {

    private final List<Grammar> children;
    private final Quantifier quantifier;

    Group(List<? extends Grammar> children, Quantifier quantifier) {
        Objects.requireNonNull(children, "children");
        for (Grammar child : children) {
            Objects.requireNonNull(child, "child");
        }
        this.children = Misc.<Grammar>frozenCopy(children);
        this.quantifier = Objects.requireNonNull(quantifier, "quantifier");
    }

    /**
     * @return the children (unmodifiable)
     */
    public final List<Grammar> children() {
        return children;
    }

    public final Quantifier quantifier() {
        return quantifier;
    }

    /**
     * @return the text placed between two rendered children.
     */
    abstract String separator();

    /**
     * Creates a group of the same kind as <code>this</code>.
     */
    abstract Group newGroup(List<? extends Grammar> children, Quantifier quantifier);

    /**
     * Runs the kind specific simplification pipeline over a child list, as
     * though it belonged to a group of this kind with the given quantifier.
     *
     * @return the replacement grammar, or <code>null</code> if nothing
     *         remains.
     */
    abstract Grammar simplifyChildren(List<? extends Grammar> children,
            Quantifier quantifier);

    /**
     * @return whether two or more children of this kind need parentheses.
     */
    abstract boolean severalNeedWrapping();

    /**
     * Whether the rendered group must be parenthesised to keep its meaning.
     * A single child is unwrapped through any chain of redundant
     * <code>(1, 1)</code> single-child groups; only a real nested group
     * needs the parentheses.
     */
    public final boolean needsWrapped() {
        int n = children.size();
        if (n < 1) {
            return false;
        }
        if (n == 1) {
            if (quantifier.isOnce()) {
                return false;
            }
            Grammar child = children.get(0);
            boolean wrap = child instanceof Group;
            while (wrap
                    && ((Group) child).quantifier.isOnce()
                    && ((Group) child).children.size() == 1) {
                child = ((Group) child).children.get(0);
                wrap = child instanceof Group;
            }
            return wrap;
        }
        return severalNeedWrapping();
    }

    @Override
    public final String render(boolean full, boolean wrap) {
        if (children.isEmpty()) {
            return null;
        }
        String suffix = quantifier.render();
        StringBuilder sb = new StringBuilder();
        boolean found = false;
        for (Grammar child : children) {
            String rendered = child.render(false, true);
            if (rendered != null) {
                if (found) {
                    sb.append(separator());
                }
                sb.append(rendered);
                found = true;
            }
        }
        if (!found) {
            return null;
        }
        if (needsWrapped() && (wrap || suffix != null)) {
            sb.insert(0, '(').append(')');
        }
        if (suffix != null) {
            sb.append(suffix);
        }
        return sb.toString();
    }

    @Override
    public final Grammar simplify() {
        return simplifyChildren(children, quantifier);
    }

    @Override
    public final Map<String, Object> attributes() {
        Map<String, Object> ret = new LinkedHashMap<String, Object>();
        ret.put("children", children);
        ret.put("quantifier", quantifier);
        return Collections.unmodifiableMap(ret);
    }

    @Override
    final boolean sameAttributes(Grammar other, boolean checkQuantifier) {
        Group g = (Group) other;
        if (checkQuantifier && !quantifier.equals(g.quantifier)) {
            return false;
        }
        return children.equals(g.children);
    }
}
