package DFAMin.Simulation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import DFAMin.Model.AutomatonModel;
import DFAMin.Model.StateId;

/**
 * Caller-held position of a step-by-step run, e.g. for an animated walk. Each forward step applies
 * {@link SimulationEngine#step} once.
 * <p>
 * Without a start state the cursor is finished from the outset, its path is empty and {@link #result()} reports
 * {@link SimulationResult.Outcome#NO_START_STATE}, as {@link SimulationEngine#simulate} does.
 */
public class SimulationCursor {
    private final AutomatonModel model;
    private final List<String> input;
    private final List<StateId> path = new ArrayList<>();
    private boolean stuck;

    public SimulationCursor(AutomatonModel model, List<String> input) {
        this.model = model;
        this.input = List.copyOf(input);
        model.getStartState().ifPresent(path::add);
    }

    public SimulationCursor(AutomatonModel model, String input) {
        this(model, SimulationEngine.symbols(input));
    }

    /**
     * Consume the next symbol.
     * @return the new current state, or empty if there is no transition (the cursor is then stuck)
     *   or the input is exhausted
     */
    public Optional<StateId> stepForward() {
        if (!hasStart() || stuck || isFinished()) {
            return Optional.empty();
        }
        Optional<StateId> next = SimulationEngine.step(model, getCurrentState(), input.get(getPosition()));
        if (next.isEmpty()) {
            stuck = true;
        } else {
            path.add(next.get());
        }
        return next;
    }

    /**
     * Undo the last step. Clears a stuck flag first if set.
     * @return false if already at the start
     */
    public boolean stepBack() {
        if (stuck) {
            stuck = false;
            return true;
        }
        if (path.size() <= 1) {
            return false;
        }
        path.remove(path.size() - 1);
        return true;
    }

    /**
     * @throws IllegalStateException if the automaton has no start state
     */
    public StateId getCurrentState() {
        if (!hasStart()) {
            throw new IllegalStateException(SimulationResult.NO_START_STATE_REASON);
        }
        return path.get(path.size() - 1);
    }

    /**
     * @return index of the next symbol to consume
     */
    public int getPosition() {
        return Math.max(0, path.size() - 1);
    }

    public boolean hasStart() {
        return !path.isEmpty();
    }

    public boolean isFinished() {
        return !hasStart() || (!stuck && getPosition() == input.size());
    }

    public boolean isStuck() {
        return stuck;
    }

    public List<StateId> getPath() {
        return List.copyOf(path);
    }

    /**
     * Verdict for the current position; only meaningful once finished or stuck.
     */
    public SimulationResult result() {
        if (!hasStart()) {
            return SimulationResult.noStartState();
        }
        if (stuck) {
            return SimulationResult.stuck(path, getPosition(), input.get(getPosition()));
        }
        if (!isFinished()) {
            throw new IllegalStateException("Run is not finished, at position " + getPosition() + " of " + input.size());
        }
        return SimulationResult.finished(path, model.isFinal(getCurrentState()));
    }
}
