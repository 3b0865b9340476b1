/*
 * @LICENSE@
 */

package org.thompson.regex;

import java.util.BitSet;
import java.util.HashMap;
import java.util.Map;


/**
 * This class implements a bunch of possibly reusable, miscelaneous static
 * objects and methods.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");
    public static final String FS = System.getProperty("file.separator");

    /*
     * state sets print as {0,3,4}
     */
    static String stringFrom(BitSet states) {
        StringBuilder sb = new StringBuilder();
        sb.append('{');
        for (int i = states.nextSetBit(0); i >= 0; i = states.nextSetBit(i + 1)) {
            if (sb.length() > 1) sb.append(',');
            sb.append(i);
        }
        sb.append('}');
        return sb.toString();
    }

    private static final Map<Character, String> escapes =
            new HashMap<Character, String>();
    static {
        escapes.put('\\', "\\\\");
        escapes.put('"', "\\\"");
        escapes.put('\r', "\\r");
        escapes.put('\n', "\\n");
        escapes.put('\t', "\\t");
        escapes.put('\f', "\\f");
    }

    /**
     * Java lang escaper - escapes " and \, control chars, non-printable-ASCII
     * and beyond -> \\u codes. Used for symbols in log and toString output.
     */
    static String esc(char c) {
        StringBuilder sb = new StringBuilder();
        esc(sb, c);
        return sb.toString();
    }

    static void esc(StringBuilder sb, char c) {
        String s = escapes.get(c);
        if (s != null) {
            sb.append(s);
        } else if (c < 32 || 126 < c) {
            int mark = sb.length();
            sb.append(Integer.toHexString(c));
            while (sb.length() - mark < 4) {
                sb.insert(mark, "0");
            }
            sb.insert(mark, "\\u");
        } else {
            sb.append(c);
        }
    }

    static String esc(CharSequence cs) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < cs.length(); ++i) {
            esc(sb, cs.charAt(i));
        }
        return sb.toString();
    }
}
