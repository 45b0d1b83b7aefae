/* @LICENSE@
 */
package org.xtrms.gbnf;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.xtrms.gbnf.Grammar.Visitor.TraversalOrder;

/**
 * Static convenience methods for composing grammars and rendering whole rule
 * sets.
 *
 * <pre>
 * DerivationRule bool = Grammars.rule(&quot;bool&quot;,
 *     Grammars.alt(Grammars.literal(&quot;true&quot;), Grammars.literal(&quot;false&quot;)));
 * String text = Grammars.render(Grammars.rulesOf(bool.simplify()));
 * </pre>
 */
public final class Grammars {

    private Grammars() {} // never instantiated

    public static StringLiteral literal(CharSequence value) {
        return new StringLiteral(value);
    }

    public static Sequence seq(Grammar... children) {
        return new Sequence(children);
    }

    public static Sequence seq(Quantifier q, Grammar... children) {
        return new Sequence(Arrays.asList(children), q);
    }

    public static Alternation alt(Grammar... children) {
        return new Alternation(children);
    }

    public static Alternation alt(Quantifier q, Grammar... children) {
        return new Alternation(Arrays.asList(children), q);
    }

    /**
     * @see CharRange#of(String, String)
     */
    public static CharRange range(String first, String last) {
        return CharRange.of(first, last);
    }

    public static DerivationRule rule(String symbol, Grammar value) {
        return new DerivationRule(symbol, value);
    }

    /**
     * Renders each rule in full on its own line, each line terminated by
     * <code>\n</code>. Rules that render to nothing are skipped; a rule body
     * that is a single group is not parenthesised.
     *
     * @return the grammar text, empty if no rule rendered
     */
    public static String render(List<DerivationRule> rules) {
        StringBuilder sb = new StringBuilder();
        for (DerivationRule rule : rules) {
            String line = rule.render(true, false);
            if (line != null) {
                sb.append(line).append('\n');
            }
        }
        return sb.toString();
    }

    /**
     * Collects the distinct derivation rules reachable from a grammar, in
     * pre-order. When two rules share a symbol the first one found wins.
     */
    public static List<DerivationRule> rulesOf(Grammar g) {
        final Map<String, DerivationRule> rules =
            new LinkedHashMap<String, DerivationRule>();
        new Grammar.Visitor(TraversalOrder.TOP_DOWN) {
            @Override
            protected void visitRule(DerivationRule node) {
                if (!rules.containsKey(node.symbol())) {
                    rules.put(node.symbol(), node);
                }
            }
        }.visit(g);
        return new ArrayList<DerivationRule>(rules.values());
    }
}
