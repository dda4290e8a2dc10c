package DFAMin.Minimization;

import java.util.ArrayList;
import java.util.List;

import DFAMin.Model.StateId;

/**
 * One round of the refinement trace.
 * @param partitions blocks ordered by their first member's position in the automaton, members in state order
 */
public record MinimizationStep(String description, List<List<StateId>> partitions) {

    public MinimizationStep {
        List<List<StateId>> copy = new ArrayList<>(partitions.size());
        for (List<StateId> block : partitions) {
            copy.add(List.copyOf(block));
        }
        partitions = List.copyOf(copy);
    }

    public int blockCount() {
        return partitions.size();
    }

    @Override
    public String toString() {
        return description + ": " + partitions;
    }
}
