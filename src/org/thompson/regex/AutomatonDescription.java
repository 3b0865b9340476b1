/* @LICENSE@
 */
package org.thompson.regex;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The JSON form of an automaton, as read by {@link AutomatonReader}:
 *
 * <pre>
 * {
 *   "states": ["s0", "s1"],
 *   "alphabet": ["a"],
 *   "transitions": [{"from": "s0", "to": "s1", "symbol": "a"},
 *                   {"from": "s1", "to": "s0", "symbol": "EPS"}],
 *   "initial_state": "s0",
 *   "accepting_states": ["s1"]
 * }
 * </pre>
 *
 * The symbol {@value AutomatonReader#EPSILON} marks an epsilon edge.
 */
public final class AutomatonDescription {

    public static final class Transition {

        @JsonProperty("from")
        private String from;

        @JsonProperty("to")
        private String to;

        @JsonProperty("symbol")
        private String symbol;

        public Transition() {}

        public Transition(String from, String to, String symbol) {
            this.from = from;
            this.to = to;
            this.symbol = symbol;
        }

        public String getFrom() { return from; }
        public String getTo() { return to; }
        public String getSymbol() { return symbol; }

        @Override
        public String toString() {
            return from + " -" + symbol + "-> " + to;
        }
    }

    @JsonProperty("states")
    private List<String> states = new ArrayList<String>();

    @JsonProperty("alphabet")
    private List<String> alphabet = new ArrayList<String>();

    @JsonProperty("transitions")
    private List<Transition> transitions = new ArrayList<Transition>();

    @JsonProperty("initial_state")
    private String initialState;

    @JsonProperty("accepting_states")
    private List<String> acceptingStates = new ArrayList<String>();

    public AutomatonDescription() {}

    public AutomatonDescription(List<String> states, List<String> alphabet,
            List<Transition> transitions, String initialState,
            List<String> acceptingStates) {
        this.states = states;
        this.alphabet = alphabet;
        this.transitions = transitions;
        this.initialState = initialState;
        this.acceptingStates = acceptingStates;
    }

    public List<String> getStates() { return states; }
    public List<String> getAlphabet() { return alphabet; }
    public List<Transition> getTransitions() { return transitions; }
    public String getInitialState() { return initialState; }
    public List<String> getAcceptingStates() { return acceptingStates; }
}
