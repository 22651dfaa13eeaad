package org.dxworks.vbframe.builder;

import java.util.Locale;

final class Literals {

    private Literals() {
        // utility class
    }

    /**
     * Content of a VB string literal: surrounding quotes removed, doubled quotes collapsed.
     * Text that is not a quoted literal is returned unchanged.
     */
    static String unquote(String literal) {
        if (literal == null) {
            return null;
        }
        if (literal.length() >= 2 && literal.startsWith("\"") && literal.endsWith("\"")) {
            return literal.substring(1, literal.length() - 1).replace("\"\"", "\"");
        }
        return literal;
    }

    static String lower(String text) {
        return text == null ? null : text.toLowerCase(Locale.ROOT);
    }
}
