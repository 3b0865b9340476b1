/* @LICENSE@
 */

package org.thompson.regex;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Random;

public class EpsilonClosureTestCase extends AbstractRxTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(EpsilonClosureTestCase.class);
    }

    public EpsilonClosureTestCase(String name) {
        super(name);
    }

    private static List<NFA.State> arena(int n) {
        List<NFA.State> states = new ArrayList<NFA.State>(n);
        for (int i = 0; i < n; ++i) {
            states.add(new NFA.State(i));
        }
        return states;
    }

    private static void assertStrategiesAgree(List<NFA.State> states) {
        BitSet[] closures = EpsilonClosure.fixpoint(states);
        for (int s = 0; s < states.size(); ++s) {
            assertEquals("state " + s, EpsilonClosure.of(states, s), closures[s]);
        }
    }

    public void testNoEdges() {
        List<NFA.State> states = arena(3);
        BitSet[] closures = EpsilonClosure.fixpoint(states);
        assertEquals(pos(0), closures[0]);
        assertEquals(pos(1), closures[1]);
        assertEquals(pos(2), closures[2]);
    }

    public void testChain() {
        List<NFA.State> states = arena(4);
        states.get(0).addEpsilon(1);
        states.get(1).addEpsilon(2);
        states.get(2).addTransition('a', 3);  // not an epsilon edge
        BitSet[] closures = EpsilonClosure.fixpoint(states);
        assertEquals(pos(0, 1, 2), closures[0]);
        assertEquals(pos(1, 2), closures[1]);
        assertEquals(pos(2), closures[2]);
        assertEquals(pos(3), closures[3]);
        assertStrategiesAgree(states);
    }

    /*
     * predecessors must be revisited when a successor's closure grows late:
     * 0 is processed before 3's edge is discovered to reach 4.
     */
    public void testLatePropagation() {
        List<NFA.State> states = arena(5);
        states.get(0).addEpsilon(3);
        states.get(3).addEpsilon(2);
        states.get(2).addEpsilon(1);
        states.get(1).addEpsilon(4);
        BitSet[] closures = EpsilonClosure.fixpoint(states);
        assertEquals(pos(0, 1, 2, 3, 4), closures[0]);
        assertEquals(pos(1, 2, 3, 4), closures[3]);
        assertStrategiesAgree(states);
    }

    public void testCycle() {
        List<NFA.State> states = arena(4);
        states.get(0).addEpsilon(1);
        states.get(1).addEpsilon(2);
        states.get(2).addEpsilon(0);
        states.get(2).addEpsilon(3);
        BitSet[] closures = EpsilonClosure.fixpoint(states);
        assertEquals(pos(0, 1, 2, 3), closures[0]);
        assertEquals(pos(0, 1, 2, 3), closures[1]);
        assertEquals(pos(0, 1, 2, 3), closures[2]);
        assertEquals(pos(3), closures[3]);
        assertStrategiesAgree(states);
    }

    public void testSelfLoop() {
        List<NFA.State> states = arena(2);
        states.get(0).addEpsilon(0);
        states.get(0).addEpsilon(1);
        BitSet[] closures = EpsilonClosure.fixpoint(states);
        assertEquals(pos(0, 1), closures[0]);
        assertStrategiesAgree(states);
    }

    public void testClosureFragmentCycle() {
        // the back edge of a* makes a cycle through the operand
        NFA nfa = Pattern.compilePostfix("a*");
        assertStrategiesAgree(nfa.states());
        for (int s = 0; s < nfa.size(); ++s) {
            assertTrue(nfa.closure(s).get(s));
        }
        assertTrue(nfa.closure(nfa.initialState()).intersects(nfa.acceptingStates()));
    }

    public void testNestedClosures() {
        NFA nfa = Pattern.compile("((a*)*|b*)*").nfa();
        assertStrategiesAgree(nfa.states());
        assertTrue(nfa.accepts(""));
        assertTrue(nfa.accepts("abba"));
    }

    public void testRandomGraphsAgree() {
        Random random = new Random(42);
        for (int round = 0; round < 50; ++round) {
            int n = 1 + random.nextInt(30);
            List<NFA.State> states = arena(n);
            int edges = random.nextInt(2 * n + 1);
            for (int e = 0; e < edges; ++e) {
                states.get(random.nextInt(n)).addEpsilon(random.nextInt(n));
            }
            assertStrategiesAgree(states);
        }
    }

    private static List<NFA.State> ring(int n) {
        List<NFA.State> states = arena(n);
        for (int i = 0; i < n; ++i) {
            states.get(i).addEpsilon((i + 1) % n);
        }
        return states;
    }

    public void testLongRingIsIterative() {
        int n = 20000;
        BitSet closure = EpsilonClosure.of(ring(n), 0);
        assertEquals(n, closure.cardinality());

        BitSet[] closures = EpsilonClosure.fixpoint(ring(500));
        for (BitSet c : closures) {
            assertEquals(500, c.cardinality());
        }
    }
}
