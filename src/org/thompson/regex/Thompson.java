/* @LICENSE@
 */
package org.thompson.regex;

import static org.thompson.regex.Misc.esc;
import static org.thompson.regex.RegexParser.LPAREN;
import static org.thompson.regex.RegexParser.RPAREN;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thompson's construction: evaluates a postfix regex with a stack of
 * {@link Fragment}s, composing them with the symbol, concatenation,
 * alternation and closure rules. Every state lives in a single arena owned by
 * the builder; a fragment is just the ids of its entry and exit states, so
 * composition only ever adds states and edges, and never copies a state.
 * <p>
 * A builder is single use: once {@link #toNFA(Fragment)} hands the arena to
 * an {@link NFA} the builder is spent.
 */
final class Thompson {

    private static final Logger logger = Logger.getLogger("org.thompson.regex");
    private static final Level level = Level.FINEST;

    static final char CONCAT = '.';
    static final char ALT = '|';
    static final char STAR = '*';

    /**
     * A partially built automaton with exactly one initial and exactly one
     * accepting state. Its states are the arena entries allocated while
     * building it.
     */
    static final class Fragment {

        final int initial;
        final int accept;

        private Fragment(int initial, int accept) {
            this.initial = initial;
            this.accept = accept;
        }

        @Override
        public String toString() {
            return "[" + initial + "->" + accept + "]";
        }
    }

    private final List<NFA.State> arena = new ArrayList<NFA.State>();
    private final Set<Character> alphabet = new LinkedHashSet<Character>();
    private boolean spent = false;

    private int newState() {
        if (spent) {
            throw new IllegalStateException("builder already produced an NFA");
        }
        int id = arena.size();
        arena.add(new NFA.State(id));
        return id;
    }

    private NFA.State get(int id) {
        return arena.get(id);
    }

    int size() {
        return arena.size();
    }

    /**
     * Two new states joined by a single <code>symbol</code> transition.
     */
    Fragment symbol(char symbol) {
        Fragment f = new Fragment(newState(), newState());
        get(f.initial).addTransition(symbol, f.accept);
        alphabet.add(symbol);
        return f;
    }

    /**
     * <code>a</code> followed by <code>b</code>: a's accepting state gets an
     * epsilon edge to b's initial state. No new states.
     */
    Fragment concat(Fragment a, Fragment b) {
        get(a.accept).addEpsilon(b.initial);
        return new Fragment(a.initial, b.accept);
    }

    /**
     * <code>a</code> or <code>b</code>: a new initial state fans out to both
     * operands, and both accepting states join at a new accepting state.
     */
    Fragment alternation(Fragment a, Fragment b) {
        int initial = newState();
        int accept = newState();
        get(initial).addEpsilon(a.initial);
        get(initial).addEpsilon(b.initial);
        get(a.accept).addEpsilon(accept);
        get(b.accept).addEpsilon(accept);
        return new Fragment(initial, accept);
    }

    /**
     * Zero or more repetitions of <code>a</code>: the new initial state may
     * bypass the operand; the operand's accepting state loops back to its own
     * initial state or exits.
     */
    Fragment closure(Fragment a) {
        int initial = newState();
        int accept = newState();
        get(initial).addEpsilon(a.initial);
        get(initial).addEpsilon(accept);
        get(a.accept).addEpsilon(a.initial);
        get(a.accept).addEpsilon(accept);
        return new Fragment(initial, accept);
    }

    /**
     * Hands the whole arena to a new NFA; <code>f</code> must be the one
     * fragment left, so it spans every state allocated by this builder.
     */
    NFA toNFA(Fragment f) {
        if (spent) {
            throw new IllegalStateException("builder already produced an NFA");
        }
        spent = true;
        BitSet accepting = new BitSet(arena.size());
        accepting.set(f.accept);
        return new NFA(arena, alphabet, f.initial, accepting);
    }

    /**
     * Builds an NFA from a postfix regex, as produced by
     * {@link RegexParser#toPostfix(String)}.
     *
     * @throws ConstructionException
     *             if an operator finds too few operands on the stack, or if the
     *             stream does not leave exactly one fragment behind.
     */
    static NFA compile(String postfix) {

        logger.log(level, "postfix: " + esc(postfix));

        final Thompson builder = new Thompson();
        final LinkedList<Fragment> stack = new LinkedList<Fragment>();

        for (int i = 0; i < postfix.length(); ++i) {
            final char c = postfix.charAt(i);
            Fragment a, b;
            switch (c) {
            case CONCAT:
                b = pop(stack, postfix, i);     // pushed last, popped first
                a = pop(stack, postfix, i);
                stack.addFirst(builder.concat(a, b));
                break;
            case ALT:
                b = pop(stack, postfix, i);
                a = pop(stack, postfix, i);
                stack.addFirst(builder.alternation(a, b));
                break;
            case STAR:
                a = pop(stack, postfix, i);
                stack.addFirst(builder.closure(a));
                break;
            case LPAREN:
            case RPAREN:
                throw new ConstructionException("parenthesis in postfix stream \""
                        + esc(postfix) + "\" at index " + i);
            default:
                stack.addFirst(builder.symbol(c));
            }
            if (logger.isLoggable(level)) {
                logger.log(level, "'" + esc(c) + "' stack: " + stack);
            }
        }

        if (stack.size() != 1) {
            throw new ConstructionException(stack.isEmpty()
                ? "empty postfix stream"
                : stack.size() + " fragments left on the stack by \""
                    + esc(postfix) + "\", expected 1");
        }
        logger.log(level, "states allocated: " + builder.size());
        return builder.toNFA(stack.removeFirst());
    }

    private static Fragment pop(LinkedList<Fragment> stack, String postfix, int i) {
        if (stack.isEmpty()) {
            throw new ConstructionException("stack underflow: operator '"
                    + esc(postfix.charAt(i)) + "' at index " + i + " of \""
                    + esc(postfix) + "\" is missing an operand");
        }
        return stack.removeFirst();
    }
}
