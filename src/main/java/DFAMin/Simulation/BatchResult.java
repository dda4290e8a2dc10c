package DFAMin.Simulation;

import java.util.List;

import DFAMin.Model.StateId;

/**
 * One line of a batch run.
 * @param error reason for a crash or missing start state, null otherwise
 */
public record BatchResult(String input, boolean accepted, List<StateId> path, String error) {

    static BatchResult of(String input, SimulationResult result) {
        return new BatchResult(input, result.accepted(), result.path(), result.reason());
    }
}
