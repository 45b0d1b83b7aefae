/* @LICENSE@
 */
package org.xtrms.gbnf;

/**
 * A runtime exception thrown when a grammar node, a {@link Quantifier} or a
 * {@link CharRange.Interval} is constructed from values which violate its
 * invariants. Construction is the only place where grammar code fails;
 * rendering and simplification of a well formed tree never throw.
 */
public final class ConstructionException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public ConstructionException(String msg) {
        super(msg);
    }
}
