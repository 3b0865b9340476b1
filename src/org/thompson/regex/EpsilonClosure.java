/* @LICENSE@
 */
package org.thompson.regex;

import static org.thompson.regex.Misc.stringFrom;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Epsilon-closure computation over an arena of {@link NFA.State}s. The
 * closure of a state is the set of states reachable from it using epsilon
 * edges only, including the state itself.
 * <p>
 * Two strategies are implemented; they must agree on every state graph:
 * <ul>
 * <li>{@link #fixpoint(List)} - eager work-list iteration, used by the NFA.
 * Closures only grow under set union, so the iteration terminates on cyclic
 * epsilon graphs (closure fragments always contain a cycle).</li>
 * <li>{@link #of(List, int)} - the per-state definition, closure(s) = {s}
 * union the closures of the epsilon targets of s, evaluated as an explicit
 * depth first search.</li>
 * </ul>
 */
final class EpsilonClosure {

    private static final Logger logger = Logger.getLogger("org.thompson.regex");
    private static final Level level = Level.FINEST;

    private EpsilonClosure() {
    } // never instantiated

    /**
     * Computes all closures at once.
     *
     * @return an array indexed by state id.
     */
    static BitSet[] fixpoint(List<NFA.State> states) {

        final int n = states.size();
        final List<List<Integer>> predecessors = predecessors(states);

        final BitSet[] closures = new BitSet[n];
        for (int s = 0; s < n; ++s) {
            closures[s] = new BitSet(n);
            closures[s].set(s);
        }

        /*
         * the BitSet mirrors queue membership so a state is never queued twice
         */
        final LinkedList<Integer> work = new LinkedList<Integer>();
        final BitSet queued = new BitSet(n);
        for (int s = 0; s < n; ++s) {
            work.add(s);
        }
        queued.set(0, n);

        int iterations = 0;
        final BitSet union = new BitSet(n);
        while (!work.isEmpty()) {
            final int s = work.removeFirst();
            queued.clear(s);
            ++iterations;

            union.clear();
            union.set(s);
            for (int t : states.get(s).epsilons()) {
                union.or(closures[t]);
            }
            if (!union.equals(closures[s])) {
                closures[s].or(union);
                for (int p : predecessors.get(s)) {
                    if (!queued.get(p)) {
                        queued.set(p);
                        work.addLast(p);
                    }
                }
            }
        }

        if (logger.isLoggable(level)) {
            StringBuilder sb = new StringBuilder();
            for (int s = 0; s < n; ++s) {
                sb.append(s).append(':').append(stringFrom(closures[s])).append(' ');
            }
            logger.log(level, "closures after " + iterations + " iterations: " + sb);
        }
        return closures;
    }

    /**
     * The closure of a single state, straight from the definition.
     */
    static BitSet of(List<NFA.State> states, int id) {
        final BitSet closure = new BitSet(states.size());
        final LinkedList<Integer> stack = new LinkedList<Integer>();
        stack.addFirst(id);
        closure.set(id);
        while (!stack.isEmpty()) {
            for (int t : states.get(stack.removeFirst()).epsilons()) {
                if (!closure.get(t)) {
                    closure.set(t);
                    stack.addFirst(t);
                }
            }
        }
        return closure;
    }

    /*
     * epsilon-predecessor adjacency, indexed by state id
     */
    private static List<List<Integer>> predecessors(List<NFA.State> states) {
        List<List<Integer>> ret = new ArrayList<List<Integer>>(states.size());
        for (int s = 0; s < states.size(); ++s) {
            ret.add(new ArrayList<Integer>(2));
        }
        for (NFA.State state : states) {
            for (int t : state.epsilons()) {
                ret.get(t).add(state.id);
            }
        }
        return ret;
    }
}
