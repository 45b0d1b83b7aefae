/* @LICENSE@
 */
package org.xtrms.gbnf;

/**
 * An immutable repetition range <code>(lower, upper)</code> attached to every
 * {@link Group}. The upper bound is either a positive count or unbounded
 * (represented by <code>null</code>).
 * <p>
 * Invariants: <code>lower &gt;= 0</code>; a bounded <code>upper</code> is
 * <code>&gt;= 1</code> and <code>&gt;= lower</code>. A group constrained to
 * match exactly zero times cannot be represented; asking for one throws
 * {@link ConstructionException}.
 */
public final class Quantifier {

    public static final Quantifier ONCE = new Quantifier(1, 1);
    public static final Quantifier OPTIONAL = new Quantifier(0, 1);
    public static final Quantifier ZERO_OR_MORE = new Quantifier(0, null);
    public static final Quantifier ONE_OR_MORE = new Quantifier(1, null);

    private final int lower;
    private final Integer upper;

    private Quantifier(int lower, Integer upper) {
        if (lower < 0) {
            throw new ConstructionException(
                "lower bound must be non-negative: " + tuple(lower, upper));
        }
        if (upper != null) {
            if (upper < 1) {
                throw new ConstructionException(
                    "upper bound must be positive or unbounded: "
                    + tuple(lower, upper));
            }
            if (lower > upper) {
                throw new ConstructionException(
                    "lower bound must not exceed upper bound: "
                    + tuple(lower, upper));
            }
        }
        this.lower = lower;
        this.upper = upper;
    }

    /**
     * @param lower
     *            minimum number of repetitions
     * @param upper
     *            maximum number of repetitions, or <code>null</code> for
     *            unbounded
     * @return the quantifier
     * @throws ConstructionException
     *             if the bounds are invalid
     */
    public static Quantifier of(int lower, Integer upper) {
        if (upper != null && upper == 1) {
            if (lower == 1) return ONCE;
            if (lower == 0) return OPTIONAL;
        }
        return new Quantifier(lower, upper);
    }

    /**
     * Shorthand for <code>(n, n)</code>.
     */
    public static Quantifier exactly(int n) {
        return of(n, n);
    }

    /**
     * Shorthand for <code>(n, unbounded)</code>.
     */
    public static Quantifier atLeast(int n) {
        return of(n, null);
    }

    public int lower() {
        return lower;
    }

    /**
     * @return the upper bound, or <code>null</code> if unbounded.
     */
    public Integer upper() {
        return upper;
    }

    public boolean isBounded() {
        return upper != null;
    }

    /**
     * @return <code>true</code> for the default <code>(1, 1)</code>.
     */
    public boolean isOnce() {
        return lower == 1 && upper != null && upper == 1;
    }

    /**
     * @return <code>true</code> for <code>(0, 1)</code>.
     */
    public boolean isOptional() {
        return lower == 0 && upper != null && upper == 1;
    }

    /**
     * @return a quantifier with the same upper bound and the given lower bound
     */
    Quantifier withLower(int newLower) {
        return of(newLower, upper);
    }

    /**
     * Renders the postfix operator for this quantifier. The
     * <code>{,m}</code> form is never produced since the consuming matchers
     * do not accept it; <code>(0, m)</code> renders as <code>{0,m}</code>.
     *
     * @return the suffix, or <code>null</code> for <code>(1, 1)</code>.
     */
    public String render() {
        if (isOnce()) {
            return null;
        }
        if (lower == 0) {
            if (upper == null) {
                return "*";
            }
            if (upper == 1) {
                return "?";
            }
        }
        if (upper == null) {
            if (lower == 1) {
                return "+";
            }
            return "{" + lower + ",}";
        }
        if (lower == upper) {
            return "{" + lower + "}";
        }
        return "{" + lower + "," + upper + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Quantifier))
            return false;
        final Quantifier q = (Quantifier) o;
        return lower == q.lower
            && (upper == null ? q.upper == null : upper.equals(q.upper));
    }

    @Override
    public int hashCode() { // per Bloch
        int result = 17;
        result = 37 * result + lower;
        result = 37 * result + (upper == null ? 0 : upper);
        return result;
    }

    @Override
    public String toString() {
        return tuple(lower, upper);
    }

    private static String tuple(int lower, Integer upper) {
        return "(" + lower + ", " + (upper == null ? "None" : upper) + ")";
    }
}
