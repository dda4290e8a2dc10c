package DFAMin.Minimization;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import DFAMin.Model.AutomatonModel;
import DFAMin.Model.StateId;

/**
 * Minimized automaton together with the refinement trace that produced it.
 */
public class MinimizationResult {
    private final List<MinimizationStep> steps;
    private final AutomatonModel minimized;
    private final StateId sinkState;
    private final Map<StateId, StateId> representatives;
    private final int originalStateCount;

    MinimizationResult(List<MinimizationStep> steps, AutomatonModel minimized, StateId sinkState,
                       Map<StateId, StateId> representatives, int originalStateCount) {
        this.steps = List.copyOf(steps);
        this.minimized = minimized;
        this.sinkState = sinkState;
        this.representatives = Map.copyOf(representatives);
        this.originalStateCount = originalStateCount;
    }

    /**
     * Round 0 is the initial final/non-final split; the last step is the stable partition.
     */
    public List<MinimizationStep> getSteps() {
        return steps;
    }

    public AutomatonModel getMinimized() {
        return minimized;
    }

    /**
     * @return the synthetic sink added to complete the input, if one was needed
     */
    public Optional<StateId> getSinkState() {
        return Optional.ofNullable(sinkState);
    }

    /**
     * @return the state of the minimized automaton that {@code original} was merged into
     */
    public Optional<StateId> representativeOf(StateId original) {
        return Optional.ofNullable(representatives.get(original));
    }

    public int getOriginalStateCount() {
        return originalStateCount;
    }

    public int getMinimizedStateCount() {
        return minimized.size();
    }

    /**
     * Number of refinement rounds after the initial partition, including the one that reached the fixed point.
     */
    public int getRefinementRounds() {
        return Math.max(0, steps.size() - 1);
    }
}
