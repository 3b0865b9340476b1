/* @LICENSE@
 */
package org.thompson.regex;

/**
 * A runtime exception thrown when an automaton cannot be constructed: a
 * postfix stream which leaves zero or more than one fragment on the operand
 * stack, an operator applied to too few operands, or an automaton description
 * which does not describe a well formed automaton. No partially built
 * automaton is ever returned when this is thrown.
 */
public final class ConstructionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConstructionException(String msg) {
        super(msg);
    }

    public ConstructionException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
