package DFAMin.Model;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that an automaton can be run: it has states and a start state.
 * Completeness is not required here, see {@link DFAMin.Completeness.CompletenessAnalyzer}.
 */
public final class AutomatonValidator {
    public static final String NO_STATES = "DFA must have at least one state";
    public static final String NO_START_STATE = "DFA must have a start state";
    public static final String EMPTY_ALPHABET = "DFA must have a non-empty alphabet";

    private AutomatonValidator() {}

    public static List<String> validate(AutomatonModel model) {
        List<String> problems = new ArrayList<>(3);
        if (model.isEmpty()) {
            problems.add(NO_STATES);
        } else if (model.getStartState().isEmpty()) {
            problems.add(NO_START_STATE);
        }
        if (model.getAlphabet().isEmpty()) {
            problems.add(EMPTY_ALPHABET);
        }
        return problems;
    }

    public static boolean isValid(AutomatonModel model) {
        return validate(model).isEmpty();
    }

    public static void requireValid(AutomatonModel model) throws InvalidAutomatonException {
        List<String> problems = validate(model);
        if (!problems.isEmpty()) {
            throw new InvalidAutomatonException(problems);
        }
    }
}
