/* @LICENSE@
 */
package org.xtrms.gbnf;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The group simplification pipeline. Each entry point takes the children and
 * quantifier of a group, simplifies the children, and then applies rewrites
 * one at a time: whenever a rewrite changes the shape of the child list, the
 * whole pipeline is entered again with the rewritten list, until nothing
 * applies any more.
 * <p>
 * The rewrites, in the order they are attempted:
 * <ol>
 * <li>drop children which simplify to nothing (and, for alternations,
 * duplicate children);</li>
 * <li>quantifier distribution (sequences only);</li>
 * <li>single child unwrapping and optional hoisting;</li>
 * <li>flattening of adjacent default quantified groups of the same kind;</li>
 * <li>concatenation of adjacent literals (sequences only);</li>
 * <li>repeating-subsequence grouping (sequences only), see
 * {@link RepeatGrouper};</li>
 * <li>lifting redundant outer optionality.</li>
 * </ol>
 * Nothing here modifies its input; all results are new nodes.
 */
final class Simplifier {

    private static final Logger logger = Logger.getLogger("org.xtrms.gbnf");
    private static final Level level = Level.FINEST;

    private Simplifier() {}

    /**
     * Simplifies the children of a {@link Sequence}.
     *
     * @return the replacement grammar, or <code>null</code> if nothing
     *         remains.
     */
    static Grammar sequence(List<? extends Grammar> given, Quantifier q) {
        List<Grammar> kids = simplifyAll(given, false);
        if (kids.isEmpty()) {
            return null;
        }

        Grammar ret = distribute(kids, q);
        if (ret != null) {
            return ret;
        }

        if (kids.size() == 1) {
            ret = single(kids.get(0), q);
            if (ret != null) {
                return ret;
            }
        }

        List<Grammar> merged = mergeAdjacent(kids, Sequence.class);
        if (merged != null) {
            trace("merged adjacent sequences", kids, merged);
            return sequence(merged, q);
        }

        merged = mergeLiterals(kids);
        if (merged != null) {
            trace("merged adjacent literals", kids, merged);
            return sequence(merged, q);
        }

        List<Grammar> grouped = RepeatGrouper.group(kids);
        if (grouped != null) {
            trace("grouped repeating run", kids, grouped);
            return sequence(grouped, q);
        }

        if (q.lower() == 0 && allOptionalGroups(kids)) {
            trace("lifted optionality", q);
            return sequence(kids, q.withLower(1));
        }

        return new Sequence(kids, q);
    }

    /**
     * Simplifies the children of an {@link Alternation}.
     *
     * @return the replacement grammar, or <code>null</code> if nothing
     *         remains.
     */
    static Grammar alternation(List<? extends Grammar> given, Quantifier q) {
        List<Grammar> kids = simplifyAll(given, true);
        if (kids.isEmpty()) {
            return null;
        }

        if (kids.size() == 1) {
            Grammar ret = single(kids.get(0), q);
            if (ret != null) {
                return ret;
            }
            // a choice of one is a sequence of one
            return sequence(kids, q);
        }

        List<Grammar> merged = mergeAdjacent(kids, Alternation.class);
        if (merged != null) {
            trace("merged adjacent alternations", kids, merged);
            return alternation(merged, q);
        }

        if (q.lower() == 0 && allOptionalGroups(kids)) {
            trace("lifted optionality", q);
            return alternation(kids, q.withLower(1));
        }

        return new Alternation(kids, q);
    }

    /*
     * Simplify each child, dropping the ones which vanish. With dedupe the
     * first of several equal children is kept.
     */
    private static List<Grammar> simplifyAll(List<? extends Grammar> given,
            boolean dedupe) {
        List<Grammar> ret = new ArrayList<Grammar>(given.size());
        for (Grammar child : given) {
            Grammar simplified = child.simplify();
            if (simplified == null) {
                continue;
            }
            if (dedupe && ret.contains(simplified)) {
                continue;
            }
            ret.add(simplified);
        }
        return ret;
    }

    /*
     * X{0,a} X{0,b} ... X{0,n}, the whole repeated at most m times, is
     * X{0,(a+b+...+n)*m}. Every bound involved must be finite.
     */
    private static Grammar distribute(List<Grammar> kids, Quantifier q) {
        if (q.lower() > 1 || !q.isBounded()) {
            return null;
        }
        int sum = 0;
        Group first = null;
        for (Grammar kid : kids) {
            if (!(kid instanceof Group)) {
                return null;
            }
            Group g = (Group) kid;
            if (g.quantifier().lower() != 0 || !g.quantifier().isBounded()) {
                return null;
            }
            if (first == null) {
                first = g;
            } else if (!first.equals(g, false)) {
                return null;
            }
            sum += g.quantifier().upper();
        }
        Quantifier distributed = Quantifier.of(0, sum * q.upper());
        trace("distributed quantifier", distributed);
        return first.simplifyChildren(first.children(), distributed);
    }

    /*
     * (X) is X; (X?)? and (X)? are X?, simplified as the child's own kind.
     */
    private static Grammar single(Grammar kid, Quantifier q) {
        if (q.isOnce()) {
            return kid;
        }
        if (q.isOptional() && kid instanceof Group) {
            Group g = (Group) kid;
            if (g.quantifier().isOptional() || g.quantifier().isOnce()) {
                trace("hoisted optional child", g.quantifier());
                return g.simplifyChildren(g.children(), q);
            }
        }
        return null;
    }

    /**
     * Splices every run of two or more adjacent, default quantified groups of
     * the given kind into one group.
     *
     * @return the new child list, or <code>null</code> if there was no such
     *         run.
     */
    static List<Grammar> mergeAdjacent(List<Grammar> kids,
            Class<? extends Group> kind) {
        List<Grammar> ret = new ArrayList<Grammar>(kids.size());
        boolean changed = false;
        int i = 0;
        while (i < kids.size()) {
            int j = i;
            while (j < kids.size() && isDefault(kids.get(j), kind)) {
                ++j;
            }
            if (j - i >= 2) {
                List<Grammar> spliced = new ArrayList<Grammar>();
                for (int k = i; k < j; ++k) {
                    spliced.addAll(((Group) kids.get(k)).children());
                }
                ret.add(((Group) kids.get(i)).newGroup(spliced, Quantifier.ONCE));
                changed = true;
                i = j;
            } else {
                ret.add(kids.get(i));
                ++i;
            }
        }
        return changed ? ret : null;
    }

    private static boolean isDefault(Grammar g, Class<? extends Group> kind) {
        return g.getClass() == kind && ((Group) g).quantifier().isOnce();
    }

    /**
     * Concatenates every run of two or more adjacent literals.
     *
     * @return the new child list, or <code>null</code> if there was no such
     *         run.
     */
    static List<Grammar> mergeLiterals(List<Grammar> kids) {
        List<Grammar> ret = new ArrayList<Grammar>(kids.size());
        StringBuilder sb = new StringBuilder();
        boolean changed = false;
        int i = 0;
        while (i < kids.size()) {
            if (!(kids.get(i) instanceof StringLiteral)) {
                ret.add(kids.get(i++));
                continue;
            }
            Misc.clear(sb);
            int j = i;
            while (j < kids.size() && kids.get(j) instanceof StringLiteral) {
                sb.append(((StringLiteral) kids.get(j)).value());
                ++j;
            }
            if (j - i >= 2) {
                ret.add(new StringLiteral(sb));
                changed = true;
            } else {
                ret.add(kids.get(i));
            }
            i = j;
        }
        return changed ? ret : null;
    }

    private static boolean allOptionalGroups(List<Grammar> kids) {
        for (Grammar kid : kids) {
            if (!(kid instanceof Group)
                    || ((Group) kid).quantifier().lower() != 0) {
                return false;
            }
        }
        return true;
    }

    private static void trace(String what, Object detail) {
        if (logger.isLoggable(level)) {
            logger.log(level, what + ": " + detail);
        }
    }

    private static void trace(String what, List<Grammar> before,
            List<Grammar> after) {
        if (logger.isLoggable(level)) {
            logger.log(level, what + ": " + before.size() + " -> "
                + after.size() + " children " + after);
        }
    }
}
