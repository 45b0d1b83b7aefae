/*
 * @LICENSE@
 */

package org.xtrms.gbnf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * This class implements a bunch of possibly reusable, miscelaneous static
 * objects and methods.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    /*
     * idiom suppression for clearing StringBuilders
     */
    public static void clear(StringBuilder sb) {
        sb.delete(0, sb.length());
    }

    /*
     * immutable copy of a caller supplied list
     */
    static <T> List<T> frozenCopy(List<? extends T> list) {
        return Collections.unmodifiableList(new ArrayList<T>(list));
    }

    private static abstract class Escaper {
        abstract boolean esc(StringBuilder sb, int c);
    }

    private static final class MapEscaper extends Escaper {
        private final Map<Integer, String> map = new HashMap<Integer, String>();

        public boolean esc(StringBuilder sb, int c) {
            String s = map.get(c);
            if (s != null)
                sb.append(s);
            return s != null;
        }

        MapEscaper map(char c, String s) {
            map.put((int) c, s);
            return this;
        }

        MapEscaper backslash(String chars) {
            for (char c : chars.toCharArray()) {
                map(c, "\\" + c);
            }
            return this;
        }
    }

    private static final String PUNCTUATION = "!#$%&'()*+,-./:;<=>?@[]^_`{|}~";

    /**
     * Passes through characters which never need escaping: digits, ASCII
     * letters, space and the common punctuation.
     */
    private static final Escaper safeEscaper = new Escaper() {
        public boolean esc(StringBuilder sb, int c) {
            boolean ret = ('0' <= c && c <= '9')
                || ('a' <= c && c <= 'z')
                || ('A' <= c && c <= 'Z')
                || c == ' '
                || (c < 128 && PUNCTUATION.indexOf(c) >= 0);
            if (ret)
                sb.append((char) c);
            return ret;
        }
    };

    private static final MapEscaper namedEscaper =
            new MapEscaper().map('\n', "\\n").map('\r', "\\r").map('\t', "\\t");
    private static final MapEscaper literalEscaper =
            new MapEscaper().backslash("\"\\");
    private static final MapEscaper rangeEscaper =
            new MapEscaper().backslash("^-[]\\");

    /*
     * Always two digits minimum; code points above 0xFF come out wider.
     */
    private static final Escaper hexEscaper = new Escaper() {
        public boolean esc(StringBuilder sb, int c) {
            sb.append(String.format("\\x%02X", c));
            return true;
        }
    };

    /**
     * The escaping rules of the grammar notation. Each constant is a search
     * path of escapers; the first one that accepts a character writes it.
     */
    enum Esc {

        /**
         * Inside a double quoted string literal.
         */
        LITERAL(safeEscaper, namedEscaper, literalEscaper, hexEscaper),
        /**
         * Inside a bracketed character class, where <code>^ - [ ] \</code>
         * are meta characters even though they are safe elsewhere.
         */
        RANGE(rangeEscaper, safeEscaper, namedEscaper, hexEscaper);

        private final Escaper[] path;

        Esc(final Escaper... path) {
            this.path = path;
        }

        void esc(StringBuilder sb, int c) {
            for (Escaper e : path) {
                if (e.esc(sb, c))
                    return;
            }
            assert false : "no escaper accepted " + c;
        }

        String esc(int c) {
            StringBuilder sb = new StringBuilder();
            esc(sb, c);
            return sb.toString();
        }

        void esc(StringBuilder sb, CharSequence cs) {
            for (int i = 0; i < cs.length(); ) {
                int c = Character.codePointAt(cs, i);
                esc(sb, c);
                i += Character.charCount(c);
            }
        }

        String esc(CharSequence cs) {
            StringBuilder sb = new StringBuilder();
            esc(sb, cs);
            return sb.toString();
        }
    }
}
