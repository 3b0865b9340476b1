/* @LICENSE@
 */

package org.thompson.regex;

import static org.thompson.regex.Misc.LS;
import static org.thompson.regex.Misc.esc;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A deterministic finite automaton driven by a (partial) transition table.
 * A missing table entry rejects the input. Instances are immutable and thread
 * safe, and are built with a {@link Builder}.
 */
public final class DFA implements Acceptor {

    private static final Logger logger = Logger.getLogger("org.thompson.regex");
    private static final Level level = Level.FINEST;

    /**
     * Collects states, transitions, the start state and the accepting states
     * of a DFA. States are declared by label before they are used.
     */
    public static final class Builder {

        private final Map<String, Integer> ids = new LinkedHashMap<String, Integer>();
        private final List<SortedMap<Character, Integer>> table =
            new ArrayList<SortedMap<Character, Integer>>();
        private final Set<Character> alphabet = new LinkedHashSet<Character>();
        private final BitSet accepting = new BitSet();
        private Integer start = null;

        public Builder state(String label) {
            if (ids.containsKey(label)) {
                throw new ConstructionException("duplicate state: " + label);
            }
            ids.put(label, table.size());
            table.add(new TreeMap<Character, Integer>());
            return this;
        }

        public Builder symbol(char symbol) {
            alphabet.add(symbol);
            return this;
        }

        /**
         * @throws ConstructionException
         *             if either state is undeclared, or if <code>from</code>
         *             already has a different target on <code>symbol</code>.
         */
        public Builder transition(String from, char symbol, String to) {
            int s = id(from);
            int ns = id(to);
            Integer prior = table.get(s).get(symbol);
            if (prior != null && prior != ns) {
                throw new ConstructionException("nondeterministic transition: "
                        + from + " on '" + esc(symbol) + "'");
            }
            table.get(s).put(symbol, ns);
            alphabet.add(symbol);
            return this;
        }

        public Builder start(String label) {
            start = id(label);
            return this;
        }

        public Builder accept(String label) {
            accepting.set(id(label));
            return this;
        }

        private int id(String label) {
            Integer id = ids.get(label);
            if (id == null) {
                throw new ConstructionException("undeclared state: " + label);
            }
            return id;
        }

        public DFA build() {
            if (start == null) {
                throw new ConstructionException("no start state");
            }
            return new DFA(this);
        }
    }

    private final List<String> labels;
    private final List<Map<Character, Integer>> table;
    private final Set<Character> alphabet;
    private final int start;
    private final BitSet accepting;

    private DFA(Builder b) {
        this.labels = Collections.unmodifiableList(new ArrayList<String>(b.ids.keySet()));
        List<Map<Character, Integer>> table =
            new ArrayList<Map<Character, Integer>>(b.table.size());
        for (SortedMap<Character, Integer> row : b.table) {
            table.add(Collections.unmodifiableMap(new TreeMap<Character, Integer>(row)));
        }
        this.table = Collections.unmodifiableList(table);
        this.alphabet = Collections.unmodifiableSet(new LinkedHashSet<Character>(b.alphabet));
        this.start = b.start;
        this.accepting = (BitSet) b.accepting.clone();

        if (logger.isLoggable(level)) {
            logger.log(level, "dfa: " + LS + toString());
        }
    }

    public boolean accepts(CharSequence input) {
        int state = start;
        for (int i = 0; i < input.length(); ++i) {
            Integer ns = table.get(state).get(input.charAt(i));
            if (ns == null) return false;
            state = ns;
        }
        return accepting.get(state);
    }

    public int size() {
        return labels.size();
    }

    public Set<Character> alphabet() {
        return alphabet;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("total states: ").append(labels.size())
          .append(" start: ").append(labels.get(start)).append(LS);
        for (int s = 0; s < labels.size(); ++s) {
            sb.append("    state: ").append(labels.get(s));
            if (accepting.get(s)) sb.append(" (accept)");
            for (Map.Entry<Character, Integer> e : table.get(s).entrySet()) {
                sb.append(" '").append(esc(e.getKey())).append("'->")
                  .append(labels.get(e.getValue()));
            }
            sb.append(LS);
        }
        return sb.toString();
    }
}
