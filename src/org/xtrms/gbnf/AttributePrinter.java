/* @LICENSE@
 */
package org.xtrms.gbnf;

import static org.xtrms.gbnf.Misc.Esc.LITERAL;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Prints a {@link Grammar} generically from its {@link Grammar#attributes()}
 * as <code>Kind(name=value, ...)</code>. With a non-negative indent, groups
 * and derivation rules spread their attributes, and groups their children,
 * one per line; terminals always stay on one line.
 */
final class AttributePrinter {

    private AttributePrinter() {}

    /**
     * @param indent
     *            spaces per nesting level, or negative for a single line
     */
    static String print(Grammar g, int indent) {
        boolean multiLine = indent >= 0
            && (g instanceof Group || g instanceof DerivationRule);
        String pad = multiLine ? spaces(indent) : "";
        StringBuilder sb = new StringBuilder();
        sb.append(g.getClass().getSimpleName()).append('(');
        int j = 0;
        Map<String, Object> attrs = g.attributes();
        for (Map.Entry<String, Object> e : attrs.entrySet()) {
            if (multiLine) {
                if (j > 0) {
                    sb.append(',');
                }
                sb.append('\n').append(pad);
            } else if (j > 0) {
                sb.append(", ");
            }
            sb.append(e.getKey()).append('=');
            String value = value(e.getValue(), multiLine ? indent : -1);
            sb.append(multiLine ? value.replace("\n", "\n" + pad) : value);
            if (multiLine && j == attrs.size() - 1) {
                sb.append('\n');
            }
            ++j;
        }
        sb.append(')');
        return sb.toString();
    }

    private static String value(Object o, int indent) {
        if (o == null) {
            return "null";
        }
        if (o instanceof Grammar) {
            return print((Grammar) o, indent);
        }
        if (o instanceof CharSequence) {
            return '"' + LITERAL.esc((CharSequence) o) + '"';
        }
        if (o instanceof List<?>) {
            return list((List<?>) o, indent);
        }
        // Quantifier, Interval, Boolean
        return o.toString();
    }

    private static String list(List<?> l, int indent) {
        StringBuilder sb = new StringBuilder();
        sb.append('[');
        if (indent < 0) {
            for (int i = 0; i < l.size(); ++i) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(value(l.get(i), indent));
            }
        } else if (!l.isEmpty()) {
            String pad = spaces(indent);
            for (int i = 0; i < l.size(); ++i) {
                if (i > 0) {
                    sb.append(',');
                }
                sb.append('\n').append(pad);
                sb.append(value(l.get(i), indent).replace("\n", "\n" + pad));
            }
            sb.append('\n');
        }
        sb.append(']');
        return sb.toString();
    }

    private static String spaces(int n) {
        char[] cs = new char[n];
        Arrays.fill(cs, ' ');
        return new String(cs);
    }
}
