/*
 * @LICENSE@
 */

/**
 * NFA: Nondeterministic Finite Automata - plus some extras.
 */
package org.thompson.regex;

import static org.thompson.regex.Misc.LS;
import static org.thompson.regex.Misc.esc;
import static org.thompson.regex.Misc.stringFrom;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;


/**
 * A nondeterministic finite automaton with epsilon edges. The states form an
 * arena: a state's {@linkplain State#id id} is its index in the state list,
 * and all edges are expressed as ids. Instances are immutable and thread safe;
 * the epsilon-closure of every state is computed once, by the constructor.
 * <p>
 * NFAs are produced by {@link Pattern#compilePostfix(String)} and by
 * {@link AutomatonReader#readNFA(java.io.Reader)}.
 */
public final class NFA implements Acceptor {

    private static final Logger logger = Logger.getLogger("org.thompson.regex");
    private static final Level level = Level.FINER;

    /**
     * A node in the state graph: per-symbol transition sets plus an ordered
     * list of epsilon edges. Mutable while an automaton is under construction,
     * frozen by the {@link NFA} constructor.
     */
    static final class State {

        final int id;
        private final SortedMap<Character, BitSet> arcs =
            new TreeMap<Character, BitSet>();
        private final List<Integer> epsilons = new ArrayList<Integer>(2);
        private boolean frozen = false;

        State(int id) {
            this.id = id;
        }

        void addTransition(char symbol, int ns) {
            checkMutable();
            BitSet targets = arcs.get(symbol);
            if (targets == null) {
                arcs.put(symbol, targets = new BitSet());
            }
            targets.set(ns);
        }

        void addEpsilon(int ns) {
            checkMutable();
            epsilons.add(ns);
        }

        private void checkMutable() {
            if (frozen) {
                throw new IllegalStateException("state " + id + " is frozen");
            }
        }

        private void freeze() {
            frozen = true;
        }

        /*
         * null when there is no transition on symbol. Callers must not
         * modify the returned set.
         */
        BitSet targets(char symbol) {
            return arcs.get(symbol);
        }

        Set<Character> symbols() {
            return Collections.unmodifiableSet(arcs.keySet());
        }

        List<Integer> epsilons() {
            return Collections.unmodifiableList(epsilons);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append("state: ").append(id);
            for (Map.Entry<Character, BitSet> e : arcs.entrySet()) {
                sb.append(" '").append(esc(e.getKey())).append("'->")
                  .append(stringFrom(e.getValue()));
            }
            if (!epsilons.isEmpty()) {
                sb.append(" eps->").append(epsilons);
            }
            return sb.toString();
        }
    }

    private final List<State> states;
    private final Set<Character> alphabet;
    private final int initial;
    private final BitSet accepting;
    private final BitSet[] closures;

    /**
     * Takes ownership of <code>states</code>, freezes them, and computes the
     * epsilon-closures.
     *
     * @throws ConstructionException
     *             if the graph refers to a state outside the arena.
     */
    NFA(List<State> states, Set<Character> alphabet, int initial,
            BitSet accepting) {

        if (states.isEmpty()) {
            throw new ConstructionException("empty state set");
        }
        final int n = states.size();
        if (initial < 0 || initial >= n) {
            throw new ConstructionException("initial state out of range: "
                    + initial);
        }
        if (accepting.length() > n) {
            throw new ConstructionException("accepting state out of range: "
                    + stringFrom(accepting));
        }
        for (int i = 0; i < n; ++i) {
            State state = states.get(i);
            if (state.id != i) {
                throw new ConstructionException("state " + state.id
                        + " found at index " + i);
            }
            for (int ns : state.epsilons) {
                if (ns < 0 || ns >= n) {
                    throw new ConstructionException("epsilon edge " + i
                            + " -> " + ns + " leaves the state set");
                }
            }
            for (BitSet targets : state.arcs.values()) {
                if (targets.length() > n) {
                    throw new ConstructionException("transition from " + i
                            + " leaves the state set: " + stringFrom(targets));
                }
            }
        }

        this.states = Collections.unmodifiableList(new ArrayList<State>(states));
        for (State state : this.states) state.freeze();
        this.alphabet = Collections.unmodifiableSet(
            new LinkedHashSet<Character>(alphabet));
        this.initial = initial;
        this.accepting = (BitSet) accepting.clone();
        this.closures = EpsilonClosure.fixpoint(this.states);

        if (logger.isLoggable(level)) {
            logger.log(level, "nfa final: " + LS + toString());
        }
    }

    public boolean accepts(CharSequence input) {
        BitSet current = start();
        for (int i = 0; i < input.length(); ++i) {
            current = step(current, input.charAt(i));
            if (current.isEmpty()) return false;
        }
        return isAccepting(current);
    }

    /*
     * simulation primitives, shared with Matcher
     */
    BitSet start() {
        BitSet ret = new BitSet(states.size());
        ret.set(initial);
        return ret;
    }

    /**
     * One simulation step: the union, over every state in the closure of
     * <code>current</code>, of its targets on <code>symbol</code>.
     */
    BitSet step(BitSet current, char symbol) {
        BitSet next = new BitSet(states.size());
        BitSet closed = closure(current);
        for (int c = closed.nextSetBit(0); c >= 0; c = closed.nextSetBit(c + 1)) {
            BitSet targets = states.get(c).targets(symbol);
            if (targets != null) next.or(targets);
        }
        return next;
    }

    BitSet closure(BitSet set) {
        BitSet ret = new BitSet(states.size());
        for (int s = set.nextSetBit(0); s >= 0; s = set.nextSetBit(s + 1)) {
            ret.or(closures[s]);
        }
        return ret;
    }

    /*
     * the trailing closure lets an epsilon path into an accepting state count.
     */
    boolean isAccepting(BitSet current) {
        return closure(current).intersects(accepting);
    }

    State state(int id) {
        return states.get(id);
    }

    List<State> states() {
        return states;
    }

    /**
     * @return the number of states in this NFA.
     */
    public int size() {
        return states.size();
    }

    public int initialState() {
        return initial;
    }

    /**
     * @return a copy of the set of accepting state ids.
     */
    public BitSet acceptingStates() {
        return (BitSet) accepting.clone();
    }

    /**
     * @return the symbols this automaton was built over, in first-seen order.
     */
    public Set<Character> alphabet() {
        return alphabet;
    }

    /**
     * @param id
     *            a state id, <code>0 &lt;= id &lt; size()</code>.
     * @return a copy of the epsilon-closure of the state; always contains
     *         <code>id</code> itself.
     */
    public BitSet closure(int id) {
        return (BitSet) closures[id].clone();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("total states: ").append(states.size())
          .append(" initial: ").append(initial)
          .append(" accepting: ").append(stringFrom(accepting))
          .append(LS);
        for (State state : states) {
            sb.append("    ").append(state)
              .append(" closure: ").append(stringFrom(closures[state.id]))
              .append(LS);
        }
        return sb.toString();
    }
}
