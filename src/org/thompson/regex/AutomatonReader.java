/* @LICENSE@
 */
package org.thompson.regex;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads {@linkplain AutomatonDescription automaton descriptions} from JSON and
 * turns them into {@link NFA}s or {@link DFA}s. Symbols are one character
 * strings; the reserved symbol {@value #EPSILON} denotes an epsilon edge and
 * may only appear in NFA descriptions.
 */
public final class AutomatonReader {

    private static final Logger logger = Logger.getLogger("org.thompson.regex");
    private static final Level level = Level.FINER;

    public static final String EPSILON = "EPS";

    private static final ObjectMapper mapper = new ObjectMapper();

    private AutomatonReader() {
    } // never instantiated

    public static AutomatonDescription read(Reader reader) throws IOException {
        return mapper.readValue(reader, AutomatonDescription.class);
    }

    public static AutomatonDescription read(InputStream is) throws IOException {
        return read(new InputStreamReader(is, StandardCharsets.UTF_8));
    }

    /**
     * @throws IOException
     *             on a read failure or malformed JSON.
     * @throws ConstructionException
     *             if the description is not a well formed automaton.
     */
    public static NFA readNFA(Reader reader) throws IOException {
        return toNFA(read(reader));
    }

    public static NFA readNFA(InputStream is) throws IOException {
        return toNFA(read(is));
    }

    public static DFA readDFA(Reader reader) throws IOException {
        return toDFA(read(reader));
    }

    public static DFA readDFA(InputStream is) throws IOException {
        return toDFA(read(is));
    }

    public static NFA toNFA(AutomatonDescription d) {
        final Map<String, Integer> ids = ids(d);
        final Set<Character> alphabet = alphabet(d);

        final List<NFA.State> states = new ArrayList<NFA.State>(ids.size());
        for (int i = 0; i < ids.size(); ++i) {
            states.add(new NFA.State(i));
        }
        for (AutomatonDescription.Transition t : transitions(d)) {
            checkTransition(t);
            NFA.State from = states.get(id(ids, t.getFrom()));
            int to = id(ids, t.getTo());
            if (EPSILON.equals(t.getSymbol())) {
                from.addEpsilon(to);
            } else {
                from.addTransition(symbol(alphabet, t), to);
            }
        }
        BitSet accepting = new BitSet(ids.size());
        for (String label : acceptingStates(d)) {
            accepting.set(id(ids, label));
        }
        logger.log(level, "nfa description: " + ids.size() + " states, alphabet " + alphabet);
        return new NFA(states, alphabet, id(ids, initialState(d)), accepting);
    }

    public static DFA toDFA(AutomatonDescription d) {
        final Map<String, Integer> ids = ids(d);
        final Set<Character> alphabet = alphabet(d);

        final DFA.Builder b = new DFA.Builder();
        for (String label : ids.keySet()) {
            b.state(label);
        }
        for (char c : alphabet) {
            b.symbol(c);
        }
        for (AutomatonDescription.Transition t : transitions(d)) {
            checkTransition(t);
            if (EPSILON.equals(t.getSymbol())) {
                throw new ConstructionException("epsilon edge in a DFA: " + t);
            }
            b.transition(t.getFrom(), symbol(alphabet, t), t.getTo());
        }
        for (String label : acceptingStates(d)) {
            b.accept(label);
        }
        logger.log(level, "dfa description: " + ids.size() + " states, alphabet " + alphabet);
        return b.start(initialState(d)).build();
    }

    /*
     * validation helpers; a null list in the JSON counts as missing
     */
    private static Map<String, Integer> ids(AutomatonDescription d) {
        if (d.getStates() == null || d.getStates().isEmpty()) {
            throw new ConstructionException("no states");
        }
        Map<String, Integer> ids = new LinkedHashMap<String, Integer>();
        for (String label : d.getStates()) {
            if (label == null) {
                throw new ConstructionException("null state id");
            }
            if (ids.put(label, ids.size()) != null) {
                throw new ConstructionException("duplicate state: " + label);
            }
        }
        return ids;
    }

    private static Set<Character> alphabet(AutomatonDescription d) {
        Set<Character> ret = new LinkedHashSet<Character>();
        if (d.getAlphabet() != null) {
            for (String s : d.getAlphabet()) {
                if (s == null || s.length() != 1) {
                    throw new ConstructionException(
                        "alphabet symbols must be single characters: " + s);
                }
                ret.add(s.charAt(0));
            }
        }
        return ret;
    }

    private static List<AutomatonDescription.Transition> transitions(AutomatonDescription d) {
        return d.getTransitions() != null
            ? d.getTransitions()
            : new ArrayList<AutomatonDescription.Transition>();
    }

    private static void checkTransition(AutomatonDescription.Transition t) {
        if (t == null) {
            throw new ConstructionException("null transition");
        }
    }

    private static List<String> acceptingStates(AutomatonDescription d) {
        return d.getAcceptingStates() != null
            ? d.getAcceptingStates()
            : new ArrayList<String>();
    }

    private static String initialState(AutomatonDescription d) {
        if (d.getInitialState() == null) {
            throw new ConstructionException("no initial state");
        }
        return d.getInitialState();
    }

    private static int id(Map<String, Integer> ids, String label) {
        Integer id = ids.get(label);
        if (id == null) {
            throw new ConstructionException("undeclared state: " + label);
        }
        return id;
    }

    private static char symbol(Set<Character> alphabet, AutomatonDescription.Transition t) {
        String s = t.getSymbol();
        if (s == null || s.length() != 1) {
            throw new ConstructionException("bad symbol in transition: " + t);
        }
        if (!alphabet.contains(s.charAt(0))) {
            throw new ConstructionException("symbol outside the alphabet: " + t);
        }
        return s.charAt(0);
    }
}
