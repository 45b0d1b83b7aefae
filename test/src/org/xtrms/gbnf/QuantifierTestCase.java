/* @LICENSE@
 */

package org.xtrms.gbnf;

import junit.framework.TestCase;

public class QuantifierTestCase extends TestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(QuantifierTestCase.class);
    }

    public QuantifierTestCase(String arg0) {
        super(arg0);
    }

    public void testRender() {
        assertNull(Quantifier.ONCE.render());
        assertEquals("?", Quantifier.OPTIONAL.render());
        assertEquals("*", Quantifier.ZERO_OR_MORE.render());
        assertEquals("+", Quantifier.ONE_OR_MORE.render());
        assertEquals("{3}", Quantifier.exactly(3).render());
        assertEquals("{2,}", Quantifier.atLeast(2).render());
        assertEquals("{2,4}", Quantifier.of(2, 4).render());
        assertEquals("{0,5}", Quantifier.of(0, 5).render());
    }

    public void testCanonicalInstances() {
        assertSame(Quantifier.ONCE, Quantifier.of(1, 1));
        assertSame(Quantifier.ONCE, Quantifier.exactly(1));
        assertSame(Quantifier.OPTIONAL, Quantifier.of(0, 1));
        assertEquals(Quantifier.ZERO_OR_MORE, Quantifier.atLeast(0));
        assertEquals(Quantifier.ONE_OR_MORE, Quantifier.atLeast(1));
    }

    public void testInvalid() {
        int[][] bad = { { -1, 1 }, { 0, 0 }, { 3, 2 }, { 1, -4 } };
        for (int[] b : bad) {
            try {
                Quantifier.of(b[0], b[1]);
                fail("accepted (" + b[0] + ", " + b[1] + ")");
            } catch (ConstructionException e) {
                assertTrue(e.getMessage(),
                    e.getMessage().contains("(" + b[0] + ", " + b[1] + ")"));
            }
        }
        try {
            Quantifier.atLeast(-1);
            fail();
        } catch (ConstructionException e) {
            // expected
        }
    }

    public void testPredicates() {
        assertTrue(Quantifier.ONCE.isOnce());
        assertFalse(Quantifier.ONCE.isOptional());
        assertTrue(Quantifier.OPTIONAL.isOptional());
        assertFalse(Quantifier.ZERO_OR_MORE.isBounded());
        assertNull(Quantifier.ZERO_OR_MORE.upper());
        assertTrue(Quantifier.of(2, 7).isBounded());
        assertEquals(2, Quantifier.of(2, 7).lower());
        assertEquals(Integer.valueOf(7), Quantifier.of(2, 7).upper());
    }

    public void testWithLower() {
        assertEquals(Quantifier.of(1, 5), Quantifier.of(0, 5).withLower(1));
        assertSame(Quantifier.ONCE, Quantifier.OPTIONAL.withLower(1));
        assertEquals(Quantifier.ONE_OR_MORE, Quantifier.ZERO_OR_MORE.withLower(1));
    }

    public void testEquality() {
        assertEquals(Quantifier.of(2, 4), Quantifier.of(2, 4));
        assertEquals(Quantifier.of(2, 4).hashCode(), Quantifier.of(2, 4).hashCode());
        assertFalse(Quantifier.atLeast(2).equals(Quantifier.exactly(2)));
        assertFalse(Quantifier.of(0, 2).equals(Quantifier.of(1, 2)));
    }

    public void testToString() {
        assertEquals("(0, None)", Quantifier.ZERO_OR_MORE.toString());
        assertEquals("(1, 2)", Quantifier.of(1, 2).toString());
    }
}
