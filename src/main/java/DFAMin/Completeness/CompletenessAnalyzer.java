package DFAMin.Completeness;

import java.util.ArrayList;
import java.util.List;

import DFAMin.Model.AutomatonModel;
import DFAMin.Model.State;

public final class CompletenessAnalyzer {
    private CompletenessAnalyzer() {}

    /**
     * Every state has a transition for every alphabet symbol. Vacuously true without states or symbols.
     */
    public static boolean isComplete(AutomatonModel model) {
        final List<String> alphabet = model.getAlphabet();
        for (State s : model.getStates()) {
            for (String symbol : alphabet) {
                if (model.transitionFor(s.id(), symbol).isEmpty()) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * @return undefined (state, symbol) pairs, by state order then alphabet order
     */
    public static List<MissingTransition> missingTransitions(AutomatonModel model) {
        final List<String> alphabet = model.getAlphabet();
        final List<MissingTransition> missing = new ArrayList<>();
        for (State s : model.getStates()) {
            for (String symbol : alphabet) {
                if (model.transitionFor(s.id(), symbol).isEmpty()) {
                    missing.add(new MissingTransition(s.id(), symbol));
                }
            }
        }
        return missing;
    }

    public static Statistics statistics(AutomatonModel model) {
        final int stateCount = model.size();
        final int alphabetSize = model.getAlphabet().size();
        final int transitionCount = model.transitionCount();
        int finalStateCount = 0;
        for (State s : model.getStates()) {
            if (s.isFinal()) {
                finalStateCount++;
            }
        }
        final long totalPossible = (long) stateCount * alphabetSize;
        final double completeness = totalPossible > 0 ? transitionCount * 100.0 / totalPossible : 0;
        return new Statistics(stateCount, finalStateCount, transitionCount, alphabetSize, completeness,
            isComplete(model));
    }
}
