/* @LICENSE@
 */

package org.xtrms.gbnf.test;

import static org.xtrms.gbnf.GrammarAssert.*;
import static org.xtrms.gbnf.Grammars.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.xtrms.gbnf.AbstractGrammarTestCase;
import org.xtrms.gbnf.DerivationRule;
import org.xtrms.gbnf.Grammar;
import org.xtrms.gbnf.Grammars;
import org.xtrms.gbnf.Quantifier;

public class GrammarsTestCase extends AbstractGrammarTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(GrammarsTestCase.class);
    }

    public GrammarsTestCase(String name) {
        super(name);
    }

    public void testFactories() {
        assertRenders("\"x\" [a-f]", Grammars.seq(literal("x"), Grammars.range("a", "f")));
        assertRenders("(\"x\" | \"y\")+",
            Grammars.alt(Quantifier.ONE_OR_MORE, literal("x"), literal("y")));
        assertRenders("(\"x\" \"y\"){2,}",
            Grammars.seq(Quantifier.atLeast(2), literal("x"), literal("y")));
        assertEquals("r", rule("R", literal("x")).symbol());
    }

    public void testRenderRules() {
        List<DerivationRule> rules = Arrays.asList(
            rule("root", Grammars.seq(rule("bool", literal("")), literal("!"))),
            rule("boolean", Grammars.alt(literal("true"), literal("false"))),
            rule("empty", literal("")),
            rule("digits", Grammars.seq(Quantifier.ONE_OR_MORE, Grammars.range("0", "9"))));
        assertEquals(
            "root ::= bool \"!\"\n"
            + "boolean ::= \"true\" | \"false\"\n"
            + "digits ::= [0-9]+\n",
            Grammars.render(rules));
    }

    public void testRenderNoRules() {
        assertEquals("", Grammars.render(Collections.<DerivationRule>emptyList()));
        assertEquals("", Grammars.render(Arrays.asList(rule("a", literal("")))));
    }

    public void testRulesOf() {
        DerivationRule digit = rule("digit", Grammars.range("0", "9"));
        DerivationRule otherDigit = rule("digit", Grammars.range("1", "9"));
        DerivationRule number = rule("number",
            Grammars.seq(Quantifier.ONE_OR_MORE, digit));
        Grammar g = Grammars.seq(number, Grammars.alt(literal("x"), otherDigit), digit);
        List<DerivationRule> rules = rulesOf(g);
        assertEquals(2, rules.size());
        assertSame(number, rules.get(0));
        assertSame(digit, rules.get(1));
        assertTrue(rulesOf(literal("x")).isEmpty());
    }
}
