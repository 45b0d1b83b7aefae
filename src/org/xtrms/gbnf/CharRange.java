/*
 * @LICENSE@
 */

package org.xtrms.gbnf;

import static org.xtrms.gbnf.Misc.Esc.LITERAL;
import static org.xtrms.gbnf.Misc.Esc.RANGE;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Terminal matching a single character drawn from a set of inclusive
 * {@link Interval}s, or any character outside that set when negated.
 * <p>
 * Whatever intervals are requested, the instance holds the normalized form:
 * non-empty, sorted ascending, pairwise disjoint and non-adjacent (each
 * {@link Interval} is a maximal contiguous run). The {@link Builder} does the
 * merging, so that <code>[a-c]</code> plus <code>[b-e]</code> becomes
 * <code>[a-e]</code>. Characters are Unicode code points.
 */
public final class CharRange extends Grammar {

    /**
     * An inclusive range of code points <code>[first, last]</code>.
     */
    public static final class Interval implements Comparable<Interval> {

        final int first;
        final int last;

        /**
         * Invariant: first &lt;= last. There is no representation for the
         * empty range.
         */
        private Interval(int first, int last) {
            this.first = first;
            this.last = last;
        }

        /**
         * @param first
         *            a single character (one code point), inclusive
         * @param last
         *            a single character (one code point), inclusive
         * @return the interval
         * @throws ConstructionException
         *             if either bound is not exactly one character, or if
         *             <code>last</code> precedes <code>first</code>
         */
        public static Interval of(String first, String last) {
            return of(singleCodePoint(first, "start"),
                singleCodePoint(last, "end"));
        }

        /**
         * @throws ConstructionException
         *             if either bound is not a valid code point, or if
         *             <code>last &lt; first</code>
         */
        public static Interval of(int first, int last) {
            if (!Character.isValidCodePoint(first)) {
                throw new ConstructionException(
                    "start is not a valid code point: " + first);
            }
            if (!Character.isValidCodePoint(last)) {
                throw new ConstructionException(
                    "end is not a valid code point: " + last);
            }
            if (last < first) {
                throw new ConstructionException(
                    "end must be greater than or equal to start: "
                    + pair(first, last));
            }
            return new Interval(first, last);
        }

        public int first() {
            return first;
        }

        public int last() {
            return last;
        }

        /**
         * Attempt to merge an {@link Interval} with the current instance.
         *
         * @param ci
         *            the {@link Interval} to attempt to merge; must not order
         *            before <code>this</code>
         * @return a new {@link Interval} representing the union of
         *         <code>this</code> and <code>ci</code> if they overlap or
         *         touch; otherwise <code>null</code>.
         */
        private Interval maybeMerge(Interval ci) {
            assert this.compareTo(ci) <= 0 : "arg must be ordered";
            if (this.contains(ci)) {
                return this;
            } else if (last + 1 >= ci.first) {
                return new Interval(first, ci.last);
            } else {
                return null;
            }
        }

        private boolean contains(Interval ci) {
            return first <= ci.first && ci.last <= last;
        }

        private int size() {
            return last - first + 1;
        }

        public int compareTo(Interval ci) {
            int ret = 0;
            if (first < ci.first) {
                ret = -1;
            } else if (first > ci.first) {
                ret = 1;
            } else if (last < ci.last) {
                ret = -1;
            } else if (last > ci.last) {
                ret = 1;
            }
            assert (ret == 0 ? this.equals(ci) : true);
            return ret;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (o == null || !(o instanceof Interval))
                return false;
            final Interval ci = (Interval) o;
            return first == ci.first && last == ci.last;
        }

        @Override
        public int hashCode() { // per Bloch
            int result = 17;
            result = 37 * result + first;
            result = 37 * result + last;
            return result;
        }

        /**
         * For debugging only.
         */
        @Override
        public String toString() {
            return pair(first, last);
        }

        private static String pair(int first, int last) {
            return "('" + LITERAL.esc(first) + "', '" + LITERAL.esc(last) + "')";
        }

        private static int singleCodePoint(String s, String what) {
            if (s == null || s.isEmpty()
                    || s.codePointCount(0, s.length()) != 1) {
                throw new ConstructionException(
                    what + " must be a single character: "
                    + (s == null ? null : '"' + LITERAL.esc(s) + '"'));
            }
            return s.codePointAt(0);
        }
    }

    /**
     * Allows clients to compose (immutable) {@link CharRange} instances
     * incrementally. Every addition keeps the interval list sorted and
     * maximally merged.
     */
    public static final class Builder {

        private final ArrayList<Interval> cil = new ArrayList<Interval>();

        private boolean negate = false;

        public Builder() {
        }

        /**
         * Creates a <code>Builder</code> initialized with the intervals and
         * negation of an existing {@link CharRange}.
         */
        public Builder(CharRange cr) {
            cil.addAll(cr.intervals);
            negate = cr.negate;
            assert this.isValid() : this;
        }

        private boolean isValid() {
            Interval ci = null;
            for (Interval ciNext : cil) {
                if (ci != null) {
                    if (!(ci.compareTo(ciNext) < 0 && ci.last + 1 < ciNext.first)) {
                        return false;
                    }
                }
                ci = ciNext;
            }
            return true;
        }

        /**
         * @return index - if non-negative, then the Interval at this index
         *         <i>equals</i> <code>ci</code>. If negative, then this is
         *         the insertion point (-(i+1)).
         */
        private int indexFor(Interval ci) {
            return Collections.binarySearch(cil, ci);
        }

        private static int insertionPoint(int index) {
            return index < 0 ? -(index + 1) : index;
        }

        /**
         * Attempt to merge the {@link Interval} at <code>ip</code> with the
         * one which follows it.
         *
         * @return <code>true</code> if the two were merged into one.
         */
        private boolean mergeAt(int ip) {
            if ((0 <= ip && ip < cil.size())
                    && (0 <= ip + 1 && ip + 1 < cil.size())) {
                Interval ciMerge = cil.get(ip).maybeMerge(cil.get(ip + 1));
                if (ciMerge != null) {
                    cil.set(ip, ciMerge);
                    cil.remove(ip + 1);
                    return true;
                }
            }
            return false;
        }

        /**
         * Adds the {@link Interval}, possibly causing {@link Interval}s
         * within the {@link Builder} to be merged.
         *
         * @return <code>this</code> instance (for invocation chaining).
         */
        public Builder add(Interval ci) {
            Objects.requireNonNull(ci, "interval");
            int ip = insertionPoint(indexFor(ci));
            cil.add(ip, ci);
            if (mergeAt(ip - 1))
                --ip; // merge left
            while (mergeAt(ip))
                ; // merge right
            assert this.isValid() : this;
            return this;
        }

        /**
         * Add a single code point.
         */
        public Builder add(int c) {
            return add(Interval.of(c, c));
        }

        /**
         * Add a range of code points. Note the range specified here is
         * inclusive.
         */
        public Builder add(int first, int last) {
            return add(Interval.of(first, last));
        }

        /**
         * Add an inclusive range given by two single-character strings.
         */
        public Builder add(String first, String last) {
            return add(Interval.of(first, last));
        }

        /**
         * Add every code point of a string.
         */
        public Builder addAll(CharSequence chars) {
            for (int i = 0; i < chars.length(); ) {
                int c = Character.codePointAt(chars, i);
                add(c);
                i += Character.charCount(c);
            }
            return this;
        }

        /**
         * Add the intervals of an existing {@link CharRange}, ignoring its
         * negation.
         */
        public Builder add(CharRange cr) {
            for (Interval ci : cr.intervals) {
                add(ci);
            }
            return this;
        }

        public Builder negate(boolean negate) {
            this.negate = negate;
            return this;
        }

        public boolean isEmpty() {
            return cil.isEmpty();
        }

        /**
         * @return the (immutable) {@link CharRange} this builder represents
         * @throws ConstructionException
         *             if no characters were added
         */
        public CharRange build() {
            if (cil.isEmpty()) {
                throw new ConstructionException("char ranges must not be empty");
            }
            return new CharRange(negate, Misc.<Interval>frozenCopy(cil));
        }

        @Override
        public String toString() {
            return "Builder" + cil + (negate ? " negated" : "");
        }
    }

    private final List<Interval> intervals;
    private final boolean negate;

    /**
     * @param intervals
     *            the requested intervals, in any order, possibly overlapping
     * @param negate
     *            match any character <em>not</em> in the intervals
     * @throws ConstructionException
     *             if <code>intervals</code> is empty
     */
    public CharRange(Collection<Interval> intervals, boolean negate) {
        this(negate, normalize(intervals));
    }

    public CharRange(Collection<Interval> intervals) {
        this(intervals, false);
    }

    /*
     * intervals already normalized and frozen
     */
    private CharRange(boolean negate, List<Interval> intervals) {
        assert !intervals.isEmpty();
        this.intervals = intervals;
        this.negate = negate;
    }

    private static List<Interval> normalize(Collection<Interval> intervals) {
        Objects.requireNonNull(intervals, "intervals");
        Builder b = new Builder();
        for (Interval ci : intervals) {
            b.add(ci);
        }
        return b.build().intervals;
    }

    /**
     * Convenience for a single inclusive range, e.g.
     * <code>CharRange.of("a", "z")</code>.
     */
    public static CharRange of(String first, String last) {
        return new Builder().add(first, last).build();
    }

    /**
     * Builds a range covering exactly the given characters; duplicates are
     * ignored.
     *
     * @throws ConstructionException
     *             if <code>chars</code> is empty
     */
    public static CharRange fromChars(CharSequence chars, boolean negate) {
        return new Builder().addAll(chars).negate(negate).build();
    }

    /**
     * Builds a range covering exactly the given code points; duplicates are
     * ignored.
     *
     * @throws ConstructionException
     *             if <code>codePoints</code> is empty or holds an invalid
     *             code point
     */
    public static CharRange fromCodePoints(int[] codePoints, boolean negate) {
        Builder b = new Builder().negate(negate);
        for (int c : codePoints) {
            b.add(c);
        }
        return b.build();
    }

    /**
     * @return the normalized intervals (unmodifiable)
     */
    public List<Interval> intervals() {
        return intervals;
    }

    public boolean isNegated() {
        return negate;
    }

    /**
     * Renders <code>[...]</code> (or <code>[^...]</code>). A run of one
     * character renders as that character, a run of two as both characters,
     * longer runs as <code>first-last</code>.
     */
    @Override
    public String render(boolean full, boolean wrap) {
        StringBuilder sb = new StringBuilder();
        sb.append('[');
        if (negate) {
            sb.append('^');
        }
        for (Interval ci : intervals) {
            RANGE.esc(sb, ci.first);
            if (ci.size() == 2) {
                RANGE.esc(sb, ci.last);
            } else if (ci.size() > 2) {
                sb.append('-');
                RANGE.esc(sb, ci.last);
            }
        }
        sb.append(']');
        return sb.toString();
    }

    /**
     * A positive range of exactly one character becomes a
     * {@link StringLiteral}; anything else is returned as an equal copy.
     */
    @Override
    public Grammar simplify() {
        if (!negate && intervals.size() == 1 && intervals.get(0).size() == 1) {
            return new StringLiteral(
                new String(Character.toChars(intervals.get(0).first)));
        }
        return new CharRange(negate, intervals);
    }

    @Override
    public Map<String, Object> attributes() {
        Map<String, Object> ret = new LinkedHashMap<String, Object>();
        ret.put("intervals", intervals);
        ret.put("negate", negate);
        return Collections.unmodifiableMap(ret);
    }

    @Override
    boolean sameAttributes(Grammar other, boolean checkQuantifier) {
        CharRange cr = (CharRange) other;
        return negate == cr.negate && intervals.equals(cr.intervals);
    }
}
