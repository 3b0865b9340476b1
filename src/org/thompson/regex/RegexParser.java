/* @LICENSE@
 */

package org.thompson.regex;

import static org.thompson.regex.Misc.esc;
import static org.thompson.regex.Thompson.ALT;
import static org.thompson.regex.Thompson.CONCAT;
import static org.thompson.regex.Thompson.STAR;

import java.util.LinkedList;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.PatternSyntaxException;

/**
 * The regex front end: makes concatenation explicit, then converts infix to
 * postfix with a restricted shunting-yard algorithm. Operators, highest
 * precedence first: closure <code>*</code> (unary, postfix), concatenation
 * <code>.</code>, alternation <code>|</code>. Parentheses group. Everything
 * else is a literal symbol; there is no escape mechanism.
 * <p>
 * Syntax errors are reported as {@link PatternSyntaxException}s before any
 * automaton construction begins.
 */
final class RegexParser {

    private static final Logger logger = Logger.getLogger("org.thompson.regex");
    private static final Level level = Level.FINEST;

    static final char LPAREN = '(';
    static final char RPAREN = ')';

    private RegexParser() {
    } // never instantiated

    /**
     * Inserts the explicit concatenation operator between adjacent tokens
     * <code>a</code>, <code>b</code> unless <code>a</code> is <code>(</code>
     * or <code>|</code>, or <code>b</code> is <code>)</code>, <code>*</code>
     * or <code>|</code>.
     *
     * @throws PatternSyntaxException
     *             if the regex already contains the reserved <code>.</code>,
     *             or a surrogate <code>char</code>.
     */
    static String normalize(String regex) {
        StringBuilder sb = new StringBuilder(2 * regex.length());
        for (int i = 0; i < regex.length(); ++i) {
            char a = regex.charAt(i);
            if (a == CONCAT) {
                throw new PatternSyntaxException(
                    "'" + CONCAT + "' is reserved for concatenation", regex, i);
            }
            if (Character.isSurrogate(a)) {
                throw new PatternSyntaxException(
                    "symbols outside the Basic Multilingual Plane are not supported",
                    regex, i);
            }
            sb.append(a);
            if (i + 1 < regex.length() && concatenates(a, regex.charAt(i + 1))) {
                sb.append(CONCAT);
            }
        }
        String ret = sb.toString();
        logger.log(level, "normalized: " + esc(regex) + " -> " + esc(ret));
        return ret;
    }

    private static boolean concatenates(char a, char b) {
        return a != LPAREN && a != ALT
            && b != RPAREN && b != STAR && b != ALT;
    }

    /*
     * binding strength; '(' binds nothing so it is never popped by an operator
     */
    private static int precedence(char op) {
        switch (op) {
        case STAR:   return 3;
        case CONCAT: return 2;
        case ALT:    return 1;
        default:     return 0;
        }
    }

    private static boolean isOperator(char c) {
        return c == STAR || c == CONCAT || c == ALT;
    }

    /**
     * Converts a normalized infix regex to postfix. Operators of equal
     * precedence associate to the left: <code>a.a.b</code> becomes
     * <code>aa.b.</code>.
     *
     * @throws PatternSyntaxException
     *             on unbalanced parentheses, an empty group, an operator
     *             missing an operand, or two operands with no operator
     *             between them.
     */
    static String toPostfix(String regex) {

        final StringBuilder output = new StringBuilder(regex.length());
        final LinkedList<Integer> operators = new LinkedList<Integer>(); // indexes into regex
        boolean expectOperand = true;

        for (int i = 0; i < regex.length(); ++i) {
            final char c = regex.charAt(i);
            if (c == LPAREN) {
                if (!expectOperand) {
                    throw new PatternSyntaxException("missing operator before group", regex, i);
                }
                operators.addFirst(i);
            } else if (c == RPAREN) {
                if (expectOperand) {
                    throw new PatternSyntaxException(
                        i > 0 && regex.charAt(i - 1) == LPAREN
                            ? "empty group" : "missing operand", regex, i);
                }
                while (true) {
                    if (operators.isEmpty()) {
                        throw new PatternSyntaxException("unmatched ')'", regex, i);
                    }
                    char o = regex.charAt(operators.removeFirst());
                    if (o == LPAREN) break;
                    output.append(o);
                }
            } else if (isOperator(c)) {
                if (expectOperand) {
                    throw new PatternSyntaxException(
                        "operator '" + c + "' is missing an operand", regex, i);
                }
                while (!operators.isEmpty()
                        && precedence(regex.charAt(operators.getFirst())) >= precedence(c)) {
                    output.append(regex.charAt(operators.removeFirst()));
                }
                operators.addFirst(i);
                expectOperand = c != STAR;
                continue;
            } else {
                if (!expectOperand) {
                    throw new PatternSyntaxException("missing operator before '"
                            + esc(c) + "'", regex, i);
                }
                output.append(c);
            }
            expectOperand = c == LPAREN;
        }

        if (expectOperand && regex.length() > 0) {
            throw new PatternSyntaxException("missing operand", regex, regex.length());
        }
        while (!operators.isEmpty()) {
            int i = operators.removeFirst();
            if (regex.charAt(i) == LPAREN) {
                throw new PatternSyntaxException("unclosed group", regex, i);
            }
            output.append(regex.charAt(i));
        }

        String ret = output.toString();
        logger.log(level, "postfix: " + esc(regex) + " -> " + esc(ret));
        return ret;
    }
}
