/* @LICENSE@
 */
package org.xtrms.gbnf;

import static org.xtrms.gbnf.Misc.Esc.LITERAL;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Terminal matching an exact sequence of characters. The empty literal is
 * valid and means "nothing": it renders and simplifies to <code>null</code>.
 */
public final class StringLiteral extends Grammar {

    private final String value;

    public StringLiteral(CharSequence value) {
        this.value = Objects.requireNonNull(value, "value").toString();
    }

    public String value() {
        return value;
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }

    /**
     * Renders <code>"..."</code> with each character escaped for use inside
     * a quoted literal.
     */
    @Override
    public String render(boolean full, boolean wrap) {
        if (value.isEmpty()) {
            return null;
        }
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        LITERAL.esc(sb, value);
        sb.append('"');
        return sb.toString();
    }

    @Override
    public StringLiteral simplify() {
        if (value.isEmpty()) {
            return null;
        }
        return new StringLiteral(value);
    }

    @Override
    public Map<String, Object> attributes() {
        Map<String, Object> ret = new LinkedHashMap<String, Object>();
        ret.put("value", value);
        return Collections.unmodifiableMap(ret);
    }

    @Override
    boolean sameAttributes(Grammar other, boolean checkQuantifier) {
        return value.equals(((StringLiteral) other).value);
    }
}
