package DFAMin.Simulation;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import DFAMin.Model.StateId;

/**
 * Verdict of one run. {@link Outcome#STUCK} (a crash on a missing transition) and {@link Outcome#REJECTED}
 * (input consumed in a non-final state) are both non-accepting but are reported separately.
 *
 * @param path visited states, starting with the start state
 * @param stuckAt index of the symbol without transition, or -1
 * @param reason human-readable explanation for NO_START_STATE and STUCK, otherwise null
 */
public record SimulationResult(Outcome outcome, List<StateId> path, int stuckAt, String reason) {

    public enum Outcome {
        ACCEPTED,
        REJECTED,
        STUCK,
        NO_START_STATE
    }

    static final String NO_START_STATE_REASON = "No start state defined";

    public SimulationResult {
        Objects.requireNonNull(outcome, "outcome");
        path = List.copyOf(path);
    }

    static SimulationResult noStartState() {
        return new SimulationResult(Outcome.NO_START_STATE, List.of(), -1, NO_START_STATE_REASON);
    }

    static SimulationResult stuck(List<StateId> path, int index, String symbol) {
        StateId last = path.get(path.size() - 1);
        return new SimulationResult(Outcome.STUCK, path, index,
            "No transition from " + last + " on symbol '" + symbol + "'");
    }

    static SimulationResult finished(List<StateId> path, boolean accepted) {
        return new SimulationResult(accepted ? Outcome.ACCEPTED : Outcome.REJECTED, path, -1, null);
    }

    public boolean accepted() {
        return outcome == Outcome.ACCEPTED;
    }

    public boolean isStuck() {
        return outcome == Outcome.STUCK;
    }

    /**
     * @return the state the run ended in, empty if there was no start state
     */
    public Optional<StateId> lastState() {
        return path.isEmpty() ? Optional.empty() : Optional.of(path.get(path.size() - 1));
    }
}
