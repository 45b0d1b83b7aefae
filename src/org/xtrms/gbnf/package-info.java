/*
 * @LICENSE@
 */

/**
 * <h3><b>xtrms-gbnf</b> - composing, simplifying and rendering GBNF
 * grammars.</h3>
 * <p>
 * <h4>Motivation.</h4>
 * <p>
 * Constrained decoding matchers accept a grammar in a compact BNF dialect:
 * productions of the form <code>symbol ::= expression</code>, with quoted
 * literals, bracketed character classes, juxtaposition for sequences,
 * <code>|</code> for alternation and the postfix repetition operators
 * <code>? * + {n} {n,} {n,m}</code>. Such grammars are usually generated by
 * program, and the matcher's speed depends on their size, so this package
 * offers both a typed expression tree to build them with and a simplifier
 * which rewrites a tree into a smaller canonical form.
 * <p>
 * <h4>The expression tree.</h4>
 * <p>
 * {@link org.xtrms.gbnf.StringLiteral} and {@link org.xtrms.gbnf.CharRange}
 * are the terminals; {@link org.xtrms.gbnf.Sequence} and
 * {@link org.xtrms.gbnf.Alternation} group children under a
 * {@link org.xtrms.gbnf.Quantifier}; {@link org.xtrms.gbnf.DerivationRule}
 * names an expression. All nodes are immutable values with structural
 * equality. <code>null</code> is the absence marker returned by
 * <code>render()</code> and <code>simplify()</code> for a subtree which
 * contributes nothing. Invalid arguments raise
 * {@link org.xtrms.gbnf.ConstructionException}.
 * <p>
 * <h4>Simplification.</h4>
 * <p>
 * <code>simplify()</code> drops empty pieces, merges adjacent literals and
 * groups, removes redundant optionality, distributes repetition over
 * repeated optional groups and folds runs of repeating children into a
 * single repeated group, e.g.
 *
 * <pre>
 * Sequence([a-c], [0-9], [xy], [0-9], [xy])  -&gt;  [a-c] ([0-9] [xy]){2}
 * </pre>
 *
 * The rewrites are applied until none applies, so simplifying twice gives
 * the same tree as simplifying once.
 * <p>
 * <h4>Logging.</h4>
 * <p>
 * The package logs through the <code>java.util.logging</code> logger
 * <code>org.xtrms.gbnf</code>; each simplifier rewrite is logged at
 * <code>FINEST</code>.
 */
package org.xtrms.gbnf;
