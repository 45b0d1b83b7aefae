/* @LICENSE@
 */
package org.xtrms.gbnf;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Stack;

import org.xtrms.gbnf.Grammar.Visitor.TraversalOrder;

/**
 * Base class of the grammar expression tree. The family of node types is
 * closed: {@link StringLiteral} and {@link CharRange} (terminals),
 * {@link Sequence} and {@link Alternation} (groups) and
 * {@link DerivationRule}. All nodes are immutable values; {@link #simplify()}
 * and {@link #copy()} always build new trees and never modify their input, so
 * a tree may be shared freely between threads.
 * <p>
 * <code>null</code> serves as the absence marker: {@link #render()} and
 * {@link #simplify()} return it when a subtree contributes nothing (an empty
 * literal, a group whose children all vanish, a rule with an empty body).
 */
public abstract class Grammar {

    Grammar() {} // no subclasses outside the package

    /**
     * Renders the grammar in its full form. Equivalent to
     * <code>render(true, true)</code>.
     *
     * @return the rendered expression, or <code>null</code> if it resolved
     *         to nothing.
     */
    public final String render() {
        return render(true, true);
    }

    /**
     * @param full
     *            for a {@link DerivationRule}, render the whole production
     *            rather than the bare symbol. Children are always rendered
     *            with <code>full == false</code>.
     * @param wrap
     *            parenthesise a group whose text would otherwise be ambiguous
     *            at this position. A group carrying a quantifier suffix is
     *            parenthesised regardless when it needs it.
     * @return the rendered expression, or <code>null</code> if it resolved
     *         to nothing.
     */
    public abstract String render(boolean full, boolean wrap);

    /**
     * Rewrites the grammar to a smaller, canonical equivalent.
     *
     * @return a new tree, or <code>null</code> if the grammar resolved to
     *         nothing.
     */
    public abstract Grammar simplify();

    /**
     * The constructor-derived attributes of this node, in declaration
     * order, for generic inspection and printing.
     *
     * @return an unmodifiable map
     */
    public abstract Map<String, Object> attributes();

    /**
     * @return an independent, structurally equal tree.
     */
    public final Grammar copy() {
        return new CopyVisitor().copy(this);
    }

    /**
     * Structural equality. The node kinds must match exactly and every
     * attribute must be equal.
     *
     * @param other
     *            the grammar to compare against
     * @param checkQuantifier
     *            when <code>false</code> and both nodes are groups, their own
     *            quantifiers are ignored (those of their children are not).
     * @return <code>true</code> if equal
     */
    public final boolean equals(Grammar other, boolean checkQuantifier) {
        if (this == other)
            return true;
        if (other == null || other.getClass() != getClass())
            return false;
        return sameAttributes(other, checkQuantifier);
    }

    /**
     * @param other
     *            a node of exactly the same class as <code>this</code>
     */
    abstract boolean sameAttributes(Grammar other, boolean checkQuantifier);

    @Override
    public final boolean equals(Object o) {
        return o instanceof Grammar && equals((Grammar) o, true);
    }

    @Override
    public final int hashCode() {
        return 31 * getClass().getName().hashCode() + attributes().hashCode();
    }

    /**
     * @return <code>Kind(name=value, ...)</code> on a single line.
     */
    @Override
    public final String toString() {
        return AttributePrinter.print(this, -1);
    }

    /**
     * @param indent
     *            the number of spaces per nesting level; groups print one
     *            attribute and one child per line.
     * @return a multi line rendition of the attributes
     */
    public final String toString(int indent) {
        return AttributePrinter.print(this, indent);
    }

    static abstract class Visitor {

        enum TraversalOrder {
            TOP_DOWN,
            BOTTOM_UP,
            SUBCLASS_DEFINED;
        }

        private final TraversalOrder order;

        protected Visitor(TraversalOrder order) {
            this.order = order;
        }

        /*
         * multi-dispatch:
         * - allows Visitor subclasses to deal with the exact granularity they want.
         * - "instanceof" dispatch is ugly but it's only in one place - here.
         */

        protected void visit(Grammar node) {
            if (node instanceof Group) {
                visit((Group) node);
            } else if (node instanceof DerivationRule) {
                visit((DerivationRule) node);
            } else if (node instanceof StringLiteral) {
                visit((StringLiteral) node);
            } else if (node instanceof CharRange) {
                visit((CharRange) node);
            } else {
                error(node);
            }
        }

        protected void visit(Group node) {
            if (order == TraversalOrder.BOTTOM_UP) {
                for (Grammar child : node.children()) {
                    visit(child);
                }
            }
            if (node instanceof Sequence) {
                visit((Sequence) node);
            } else if (node instanceof Alternation) {
                visit((Alternation) node);
            } else {
                error(node);
            }
            if (order == TraversalOrder.TOP_DOWN) {
                for (Grammar child : node.children()) {
                    visit(child);
                }
            }
        }

        protected void visit(DerivationRule node) {
            if (order == TraversalOrder.BOTTOM_UP) {
                visit(node.value());
            }
            visitRule(node);
            if (order == TraversalOrder.TOP_DOWN) {
                visit(node.value());
            }
        }

        protected void visit(Sequence node) {}
        protected void visit(Alternation node) {}
        protected void visitRule(DerivationRule node) {}

        protected void visit(StringLiteral node) {}
        protected void visit(CharRange node) {}

        private static void error(Grammar node) {
            assert false : "unknown node type " + node.getClass();
        }
    }

    static class CopyVisitor extends Visitor {

        protected final Stack<Grammar> kids = new Stack<Grammar>();

        CopyVisitor() {
            super(TraversalOrder.BOTTOM_UP);
        }

        protected final void push(Grammar node) {
            kids.push(node);
        }

        Grammar copy(Grammar node) {
            assert node != null;
            visit(node);
            assert kids.size() == 1;
            return kids.pop();
        }

        private List<Grammar> pop(int n) {
            List<Grammar> ret = new ArrayList<Grammar>(n);
            for (int i = 0; i < n; ++i) {
                ret.add(0, kids.pop());
            }
            return ret;
        }

        @Override
        protected void visit(StringLiteral node) {
            push(new StringLiteral(node.value()));
        }
        @Override
        protected void visit(CharRange node) {
            push(new CharRange(node.intervals(), node.isNegated()));
        }
        @Override
        protected void visit(Sequence node) {
            push(new Sequence(pop(node.children().size()), node.quantifier()));
        }
        @Override
        protected void visit(Alternation node) {
            push(new Alternation(pop(node.children().size()), node.quantifier()));
        }
        @Override
        protected void visitRule(DerivationRule node) {
            push(new DerivationRule(node.symbol(), kids.pop()));
        }
    }
}
