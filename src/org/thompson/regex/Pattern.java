/*
 * @LICENSE@
 */

package org.thompson.regex;

import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.PatternSyntaxException;

/**
 * A compiled representation of a regular expression; analog to the
 * {@link java.util.regex.Pattern} class. Like the Pattern class of the standard
 * library, instances of this Pattern class are immutable and thread safe.
 * <p>
 * The accepted syntax is deliberately small:
 * <ul>
 * <li>any character other than <code>( ) | * .</code> is a literal symbol;</li>
 * <li>juxtaposition is concatenation (<code>ab</code>);</li>
 * <li><code>|</code> is alternation, <code>*</code> is zero-or-more;</li>
 * <li>parentheses group.</li>
 * </ul>
 * A symbol is a single UTF-16 <code>char</code>. Supplementary characters,
 * which take a surrogate pair, are rejected by {@link #normalize(String)};
 * input strings are matched one <code>char</code> at a time.
 * There are no character classes, anchors, bounded quantifiers or escapes,
 * and <code>.</code> is reserved for the explicit concatenation operator that
 * {@link #normalize(String)} inserts.
 * <p>
 * Compilation runs three stages, each available on its own:
 * {@link #normalize(String)}, {@link #toPostfix(String)} and
 * {@link #compilePostfix(String)}; the result is an {@link NFA} built by
 * Thompson's construction and matched by simulating all its states at once.
 */
public final class Pattern implements Acceptor {

    private static final Logger logger = Logger.getLogger("org.thompson.regex");
    private static final Level level = Level.FINEST;

    final String regex;
    final String postfix;
    final NFA nfa;

    private Pattern(String regex, String postfix, NFA nfa) {
        this.regex = regex;
        this.postfix = postfix;
        this.nfa = nfa;
    }

    /**
     * @param regex
     *            the regular expression to be compiled.
     * @return the pattern.
     * @throws PatternSyntaxException
     *             if the regex is malformed.
     * @throws ConstructionException
     *             if the regex is empty, which has no automaton.
     */
    public static Pattern compile(String regex) {
        logger.log(level, "regex: " + Misc.esc(regex));
        String postfix = toPostfix(normalize(regex));
        return new Pattern(regex, postfix, compilePostfix(postfix));
    }

    /**
     * Makes concatenation explicit: <code>a(a|b)*b</code> becomes
     * <code>a.(a|b)*.b</code>.
     */
    public static String normalize(String regex) {
        return RegexParser.normalize(regex);
    }

    /**
     * Converts a normalized regex to postfix: <code>a|b*</code> becomes
     * <code>ab*|</code>.
     */
    public static String toPostfix(String normalized) {
        return RegexParser.toPostfix(normalized);
    }

    /**
     * Builds the automaton for a postfix regex by Thompson's construction.
     *
     * @throws ConstructionException
     *             if the postfix stream is malformed.
     */
    public static NFA compilePostfix(String postfix) {
        return Thompson.compile(postfix);
    }

    public static boolean matches(String regex, CharSequence input) {
        return Pattern.compile(regex).accepts(input);
    }

    public boolean accepts(CharSequence input) {
        return nfa.accepts(input);
    }

    public Matcher matcher(CharSequence input) {
        return new Matcher(this, input);
    }

    public NFA nfa() {
        return nfa;
    }

    public String postfix() {
        return postfix;
    }

    public String pattern() {
        return regex;
    }

    @Override
    public String toString() {
        return regex;
    }
}
