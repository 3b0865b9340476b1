/* @LICENSE@
 */
package org.thompson.regex;

/**
 * The single capability shared by every automaton in this package: deciding
 * whether an input string belongs to the language it recognizes.
 * Implementations ({@link NFA}, {@link DFA}, {@link Pattern}) are immutable
 * once constructed and may be shared between threads; each call keeps its
 * working state private.
 */
public interface Acceptor {

    /**
     * @param input
     *            the string to test, one symbol per <code>char</code>.
     * @return <code>true</code> iff the whole of <code>input</code> is
     *         accepted.
     */
    boolean accepts(CharSequence input);
}
