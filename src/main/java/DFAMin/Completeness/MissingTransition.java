package DFAMin.Completeness;

import DFAMin.Model.StateId;

public record MissingTransition(StateId state, String symbol) {

    @Override
    public String toString() {
        return "(" + state + ", " + symbol + ")";
    }
}
