/* @LICENSE@
 */
package org.xtrms.gbnf;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A named production <code>symbol ::= expression</code>. Used as the child of
 * a group it stands for a reference to the symbol and renders as the bare
 * symbol.
 * <p>
 * Symbols start with an ASCII letter, continue with ASCII letters, digits or
 * hyphens, and are case insensitive: they are stored in lower case.
 */
public final class DerivationRule extends Grammar {

    private static final Logger logger = Logger.getLogger("org.xtrms.gbnf");
    private static final Level level = Level.FINE;

    static final String SEPARATOR = " ::= ";

    private final String symbol;
    private final Grammar value;

    /**
     * @param symbol
     *            the non-terminal, in any case
     * @param value
     *            the grammar the symbol derives into
     * @throws ConstructionException
     *             if the symbol is empty or contains a character it may not
     */
    public DerivationRule(String symbol, Grammar value) {
        this.symbol = normalize(Objects.requireNonNull(symbol, "symbol"));
        this.value = Objects.requireNonNull(value, "value");
    }

    private static String normalize(String symbol) {
        if (symbol.isEmpty()) {
            throw new ConstructionException(
                "Derivation rule symbol cannot be empty");
        }
        if (!isAsciiLetter(symbol.charAt(0))) {
            throw new ConstructionException(
                "Derivation rule symbol must start with an alphabetic character"
                + " (a-z, A-Z): \"" + symbol + '"');
        }
        for (int i = 1; i < symbol.length(); ++i) {
            char c = symbol.charAt(i);
            if (!(isAsciiLetter(c) || ('0' <= c && c <= '9') || c == '-')) {
                throw new ConstructionException(
                    "Derivation rule symbol must contain only alphanumeric"
                    + " characters (a-z, A-Z, 0-9) and hyphens (-) after the"
                    + " first character: \"" + symbol + '"');
            }
        }
        String lower = symbol.toLowerCase(Locale.ROOT);
        if (!lower.equals(symbol) && logger.isLoggable(level)) {
            logger.log(level, "derivation rule symbol normalized: \""
                + symbol + "\" -> \"" + lower + '"');
        }
        return lower;
    }

    private static boolean isAsciiLetter(char c) {
        return ('a' <= c && c <= 'z') || ('A' <= c && c <= 'Z');
    }

    public String symbol() {
        return symbol;
    }

    public Grammar value() {
        return value;
    }

    /**
     * With <code>full == false</code> renders the bare symbol (a reference);
     * otherwise <code>symbol ::= value</code>, or <code>null</code> when the
     * value renders to nothing.
     */
    @Override
    public String render(boolean full, boolean wrap) {
        if (!full) {
            return symbol;
        }
        String rendered = value.render(false, wrap);
        if (rendered == null || rendered.isEmpty()) {
            return null;
        }
        return symbol + SEPARATOR + rendered;
    }

    @Override
    public DerivationRule simplify() {
        Grammar simplified = value.simplify();
        if (simplified == null) {
            return null;
        }
        return new DerivationRule(symbol, simplified);
    }

    @Override
    public Map<String, Object> attributes() {
        Map<String, Object> ret = new LinkedHashMap<String, Object>();
        ret.put("symbol", symbol);
        ret.put("value", value);
        return Collections.unmodifiableMap(ret);
    }

    @Override
    boolean sameAttributes(Grammar other, boolean checkQuantifier) {
        DerivationRule r = (DerivationRule) other;
        return symbol.equals(r.symbol) && value.equals(r.value);
    }
}
