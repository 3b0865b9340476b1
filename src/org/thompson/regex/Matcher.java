/*
 * @LICENSE@
 */
package org.thompson.regex;

import static org.thompson.regex.Misc.stringFrom;

import java.util.BitSet;

/**
 * Analog to the {@link java.util.regex.Matcher} class. Note that like the
 * analagous {@link java.util.regex.Matcher} class of the standard regex
 * package, instances of this class are <em>not</em> thread safe - it is the
 * responsibility of the client to ensure that the methods of an instance are
 * not re-entered. Any number of Matchers may share one {@link Pattern}: the
 * set of current states lives here, never in the automaton.
 */
public final class Matcher {

    private final Pattern pattern;
    private final NFA nfa;
    private CharSequence csq;

    private BitSet current;
    private int end;
    private boolean match;

    Matcher(Pattern pattern, CharSequence csq) {
        this.pattern = pattern;
        this.nfa = pattern.nfa;
        reset(csq);
    }

    public Pattern pattern() {
        return pattern;
    }

    public Matcher reset() {
        return reset(csq);
    }

    public Matcher reset(CharSequence csq) {
        this.csq = csq;
        current = nfa.start();
        end = -1;
        match = false;
        return this;
    }

    /**
     * Attempts to match the entire input.
     */
    public boolean matches() {
        reset();
        int i = 0;
        for (; i < csq.length() && !current.isEmpty(); ++i) {
            current = nfa.step(current, csq.charAt(i));
        }
        match = i == csq.length() && nfa.isAccepting(current);
        end = match ? i : -1;
        return match;
    }

    /**
     * Attempts to match a prefix of the input, which may be empty. On success
     * {@link #end()} is the length of the longest accepted prefix.
     */
    public boolean lookingAt() {
        reset();
        if (nfa.isAccepting(current)) end = 0;
        for (int i = 0; i < csq.length(); ++i) {
            current = nfa.step(current, csq.charAt(i));
            if (current.isEmpty()) break;
            if (nfa.isAccepting(current)) end = i + 1;
        }
        return match = end >= 0;
    }

    /**
     * @return the offset after the last character matched.
     * @throws IllegalStateException
     *             if no match has yet been attempted, or if the previous
     *             match operation failed.
     */
    public int end() {
        if (!match) {
            throw new IllegalStateException("no match");
        }
        return end;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("pattern: ").append(pattern)
          .append(" input: \"").append(Misc.esc(csq)).append('"')
          .append(" states: ").append(stringFrom(current))
          .append(match ? " match end: " + end : " no match");
        return sb.toString();
    }
}
