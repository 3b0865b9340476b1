/*
 * @LICENSE@
 */

/**
 * <h3>A Thompson construction regex compiler and NFA simulator.</h3>
 * <p>
 * <h4>Pipeline.</h4>
 * <p>
 * A regex over literal symbols, alternation <code>|</code>, closure
 * <code>*</code> and grouping parentheses is compiled in three stages:
 * <ol>
 * <li>{@linkplain Pattern#normalize(String) normalization} inserts the
 * explicit concatenation operator <code>.</code>;</li>
 * <li>{@linkplain Pattern#toPostfix(String) postfix conversion} reorders the
 * tokens with a restricted shunting-yard algorithm;</li>
 * <li>{@linkplain Pattern#compilePostfix(String) Thompson's construction}
 * evaluates the postfix stream with a stack of single-entry, single-exit
 * fragments, producing an {@link org.thompson.regex.NFA NFA}.</li>
 * </ol>
 * The NFA precomputes the epsilon-closure of each of its states when it is
 * constructed, and decides acceptance by tracking the set of all states the
 * input could have reached.
 * <p>
 * <h4>Automata from descriptions.</h4>
 * <p>
 * Automata may also be read from a JSON description with
 * {@link org.thompson.regex.AutomatonReader AutomatonReader}; deterministic
 * descriptions may be loaded as a table driven
 * {@link org.thompson.regex.DFA DFA}. Every automaton implements
 * {@link org.thompson.regex.Acceptor Acceptor}.
 * <p>
 * <h4>Logging.</h4>
 * <p>
 * Construction is traced at levels FINER and FINEST on the
 * <code>java.util.logging</code> logger named <code>org.thompson.regex</code>.
 * <p>
 * <h4>References:</h4>
 * <ul>
 * <li>For an introduction to the theory behind regular expression and their
 * implementation as automata, see the first chapters of the <a
 * href="http://en.wikipedia.org/wiki/Compilers:_Principles,_Techniques,_and_Tools">Dragon
 * Book.</a></li>
 * <li>Russ Cox's <a href="http://swtch.com/~rsc/regexp/regexp1.html">Regular
 * Expression Matching Can Be Simple And Fast</a> describes the construction
 * and the simulation implemented here.</li>
 * </ul>
 */
package org.thompson.regex;
