package DFAMin.Simulation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import DFAMin.Model.AutomatonModel;
import DFAMin.Model.StateId;
import DFAMin.Model.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs input words through an {@link AutomatonModel}. Never mutates the automaton.
 */
public final class SimulationEngine {
    private static final Logger logger = LoggerFactory.getLogger(SimulationEngine.class);

    private SimulationEngine() {}

    /**
     * The transition function: successor of {@code current} on {@code symbol}, if defined.
     */
    public static Optional<StateId> step(AutomatonModel model, StateId current, String symbol) {
        return model.transitionFor(current, symbol).map(Transition::to);
    }

    public static SimulationResult simulate(AutomatonModel model, List<String> input) {
        Optional<StateId> start = model.getStartState();
        if (start.isEmpty()) {
            return SimulationResult.noStartState();
        }

        StateId current = start.get();
        List<StateId> path = new ArrayList<>(input.size() + 1);
        path.add(current);

        for (int i = 0; i < input.size(); i++) {
            String symbol = input.get(i);
            Optional<StateId> next = step(model, current, symbol);
            if (next.isEmpty()) {
                logger.debug("Stuck in {} at index {} on '{}'", current, i, symbol);
                return SimulationResult.stuck(path, i, symbol);
            }
            current = next.get();
            path.add(current);
        }
        return SimulationResult.finished(path, model.isFinal(current));
    }

    /**
     * Simulate a string, one symbol per code point.
     */
    public static SimulationResult simulate(AutomatonModel model, String input) {
        return simulate(model, symbols(input));
    }

    /**
     * Simulate each non-blank line, trimmed.
     */
    public static List<BatchResult> batch(AutomatonModel model, List<String> inputs) {
        List<BatchResult> results = new ArrayList<>(inputs.size());
        for (String line : inputs) {
            if (line == null || line.isBlank()) {
                continue;
            }
            String input = line.trim();
            results.add(BatchResult.of(input, simulate(model, input)));
        }
        return results;
    }

    static List<String> symbols(String input) {
        List<String> symbols = new ArrayList<>(input.length());
        input.codePoints().forEach(cp -> symbols.add(new String(Character.toChars(cp))));
        return symbols;
    }
}
