/* @LICENSE@
 */

package org.xtrms.gbnf;

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

import junit.framework.TestCase;

/**
 * Shared fixtures: shorthand constructors for the grammar nodes, and the
 * test logger.
 */
public abstract class AbstractGrammarTestCase extends TestCase {

    protected static final Logger logger = Logger.getLogger("org.xtrms.gbnf.test");
    protected static final Level level = Level.FINE;

    static {
        boolean assertsEnabled = false;
        assert assertsEnabled = true; // Intentional side effect!!!
        if (!assertsEnabled){
            throw new RuntimeException("Asserts must be enabled!!!");
        }
    }

    public AbstractGrammarTestCase(String name) {
        super(name);
    }

    protected void setUp() throws Exception {
        super.setUp();
        if (logger.isLoggable(level)) {
            logger.log(level, getClass().getSimpleName() + "." + getName());
        }
    }

    protected static StringLiteral lit(String s) {
        return new StringLiteral(s);
    }

    protected static CharRange range(String first, String last) {
        return CharRange.of(first, last);
    }

    protected static Sequence seq(Grammar... children) {
        return new Sequence(children);
    }

    protected static Sequence seq(Quantifier q, Grammar... children) {
        return new Sequence(Arrays.asList(children), q);
    }

    protected static Alternation alt(Grammar... children) {
        return new Alternation(children);
    }

    protected static Alternation alt(Quantifier q, Grammar... children) {
        return new Alternation(Arrays.asList(children), q);
    }

    /**
     * Shorthand for <code>Sequence([literal], (0, 1))</code>.
     */
    protected static Sequence opt(String s) {
        return seq(Quantifier.OPTIONAL, lit(s));
    }

    protected static Quantifier q(int lower, Integer upper) {
        return Quantifier.of(lower, upper);
    }
}
