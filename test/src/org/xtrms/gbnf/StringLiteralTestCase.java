/* @LICENSE@
 */

package org.xtrms.gbnf;

import static org.xtrms.gbnf.GrammarAssert.*;

public class StringLiteralTestCase extends AbstractGrammarTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(StringLiteralTestCase.class);
    }

    public StringLiteralTestCase(String arg0) {
        super(arg0);
    }

    public void testRender() {
        assertRenders("\"abc\"", lit("abc"));
        assertRenders("\"Hello, World!\"", lit("Hello, World!"));
        assertRenders("\"a-b[c]^d{1}|~\"", lit("a-b[c]^d{1}|~"));
    }

    public void testEscapes() {
        assertRenders("\"say \\\"hi\\\"\"", lit("say \"hi\""));
        assertRenders("\"C:\\\\tmp\"", lit("C:\\tmp"));
        assertRenders("\"\\n\\r\\t\"", lit("\n\r\t"));
        assertRenders("\"\\x01\\x7F\"", lit("\u0001\u007f"));
        assertRenders("\"caf\\xE9\"", lit("caf\u00e9"));
        assertRenders("\"\\x20AC\"", lit("\u20ac"));
    }

    public void testSupplementaryCharacterIsOneEscape() {
        assertRenders("\"\\x1F600\"", lit(new String(Character.toChars(0x1F600))));
    }

    public void testEmpty() {
        StringLiteral empty = lit("");
        assertTrue(empty.isEmpty());
        assertNull(empty.render());
        assertNull(empty.render(false, false));
        assertSimplifiesToNothing(empty);
    }

    public void testSimplify() {
        StringLiteral s = lit("abc");
        assertSimplifiesTo(lit("abc"), s);
        assertEquals("abc", s.value());
    }

    public void testNull() {
        try {
            new StringLiteral(null);
            fail();
        } catch (NullPointerException e) {
            // expected
        }
    }

    public void testAttributes() {
        assertEquals("{value=abc}", lit("abc").attributes().toString());
        assertEquals("StringLiteral(value=\"a\\\"b\")", lit("a\"b").toString());
    }
}
