/* @LICENSE@
 */
package org.xtrms.gbnf;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds a run of identical consecutive chunks of a child list into a single
 * {@link Sequence} repeated exactly as many times, e.g.
 * <code>a b c b c b c d</code> becomes <code>a (b c){3} d</code>.
 * <p>
 * Every chunk size from half the list down to one is tried, at every start
 * offset which can still produce two whole chunks. Chunks are laid out
 * backwards from <code>size - offset</code>, and maximal runs of equal
 * chunks are scored by {@link Weight}. Only the single best run is folded;
 * the caller re-runs the pipeline to find further ones.
 */
final class RepeatGrouper {

    /**
     * Score of a candidate run, compared lexicographically: the number of
     * child slots the fold removes, then the chunk size, then the run length.
     */
    static final class Weight implements Comparable<Weight> {

        static final Weight NONE = new Weight(0, 0, 0);

        final int removed;
        final int chunkSize;
        final int count;

        Weight(int removed, int chunkSize, int count) {
            this.removed = removed;
            this.chunkSize = chunkSize;
            this.count = count;
        }

        static Weight of(int chunkSize, int count) {
            assert chunkSize > 0 && count > 1;
            return new Weight(chunkSize * count - 1, chunkSize, count);
        }

        public int compareTo(Weight w) {
            if (removed != w.removed) {
                return removed < w.removed ? -1 : 1;
            }
            if (chunkSize != w.chunkSize) {
                return chunkSize < w.chunkSize ? -1 : 1;
            }
            if (count != w.count) {
                return count < w.count ? -1 : 1;
            }
            return 0;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Weight))
                return false;
            return compareTo((Weight) o) == 0;
        }

        @Override
        public int hashCode() { // per Bloch
            int result = 17;
            result = 37 * result + removed;
            result = 37 * result + chunkSize;
            result = 37 * result + count;
            return result;
        }

        @Override
        public String toString() {
            return "(" + removed + ", " + chunkSize + ", " + count + ")";
        }
    }

    private final List<Grammar> kids;
    private final int n;

    private Weight best = Weight.NONE;
    private int bestStart = -1;

    private RepeatGrouper(List<Grammar> kids) {
        this.kids = kids;
        this.n = kids.size();
    }

    /**
     * @return the child list with the best run folded, or <code>null</code>
     *         if no chunk repeats.
     */
    static List<Grammar> group(List<Grammar> kids) {
        return new RepeatGrouper(kids).search();
    }

    /**
     * @return the score of the run {@link #group(List)} would fold, or
     *         {@link Weight#NONE}.
     */
    static Weight bestWeight(List<Grammar> kids) {
        RepeatGrouper rg = new RepeatGrouper(kids);
        rg.search();
        return rg.best;
    }

    private List<Grammar> search() {
        for (int size = n / 2; size >= 1; --size) {
            int maxOffset = Math.max(n - 2 * size, size - (1 + n % size));
            for (int offset = 0; offset <= maxOffset; ++offset) {
                scan(size, offset);
            }
        }
        if (best == Weight.NONE) {
            return null;
        }
        List<Grammar> ret = new ArrayList<Grammar>(n - best.removed);
        ret.addAll(kids.subList(0, bestStart));
        ret.add(new Sequence(
            kids.subList(bestStart, bestStart + best.chunkSize),
            Quantifier.exactly(best.count)));
        ret.addAll(kids.subList(bestStart + best.chunkSize * best.count, n));
        assert ret.size() == n - best.removed;
        return ret;
    }

    /*
     * Walks chunks [start, start + size) backwards from n - offset. runStart
     * is the lowest start of the current run of equal chunks.
     */
    private void scan(int size, int offset) {
        List<Grammar> cmp = null;
        int count = 0;
        int runStart = 0;
        for (int end = n - offset; end - size >= 0; end -= size) {
            int start = end - size;
            List<Grammar> chunk = kids.subList(start, end);
            if (cmp != null && cmp.equals(chunk)) {
                ++count;
                runStart = start;
                continue;
            }
            if (count > 1) {
                consider(runStart, size, count);
            }
            cmp = chunk;
            count = 1;
            runStart = start;
        }
        if (count > 1) {
            consider(runStart, size, count);
        }
    }

    private void consider(int start, int size, int count) {
        Weight w = Weight.of(size, count);
        if (w.compareTo(best) > 0) {
            best = w;
            bestStart = start;
        }
    }
}
