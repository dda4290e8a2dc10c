package DFAMin.Completeness;

/**
 * Size and coverage figures of an automaton.
 * @param completenessPercent defined transitions over (states x symbols), in percent; 0 if either is empty
 */
public record Statistics(int stateCount,
                         int finalStateCount,
                         int transitionCount,
                         int alphabetSize,
                         double completenessPercent,
                         boolean isComplete) {
}
