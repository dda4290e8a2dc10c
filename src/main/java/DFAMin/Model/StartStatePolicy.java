package DFAMin.Model;

/**
 * What happens to the start designation when the start state is removed.
 */
public enum StartStatePolicy {
    /** The automaton is left without a start state until one is chosen explicitly. */
    UNSET,
    /** The first remaining state (in declaration order) becomes the start state. */
    FIRST_REMAINING
}
