package DFAMin.Minimization;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import DFAMin.Completeness.CompletenessAnalyzer;
import DFAMin.Completeness.MissingTransition;
import DFAMin.Model.AutomatonModel;
import DFAMin.Model.State;
import DFAMin.Model.StateId;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moore's partition refinement.
 * <p>
 * Starting from the final / non-final split, each round groups states by (current block, block of the successor
 * for every symbol in alphabet order) until a round no longer splits any block. All states take part, reachable
 * or not. Blocks are numbered in order of their first member in the automaton's state order, which keeps the trace
 * reproducible.
 * <p>
 * The input is never modified. An incomplete input is completed on a copy with a single non-final sink state that
 * loops on every symbol.
 */
public final class MooreMinimizer {
    private static final Logger logger = LoggerFactory.getLogger(MooreMinimizer.class);

    static final String INITIAL_DESCRIPTION = "Initial partition: final / non-final states";
    static final String ROUND_DESCRIPTION = "Refinement round %d: split by transition signatures";
    static final String STABLE_SUFFIX = " (stable)";

    private static final int NON_FINAL = 0;
    private static final int FINAL = 1;

    private MooreMinimizer() {}

    public static MinimizationResult minimize(AutomatonModel input) {
        final AutomatonModel work = input.copy();
        final StateId sink = completeWithSink(work);

        final List<StateId> ids = work.getStateIds();
        final List<String> alphabet = work.getAlphabet();
        final int numStates = ids.size();
        final int numInputs = alphabet.size();

        if (numStates == 0) {
            return new MinimizationResult(List.of(), new AutomatonModel(alphabet), null, Map.of(), 0);
        }

        final Object2IntMap<StateId> index = new Object2IntOpenHashMap<>(numStates);
        for (int q = 0; q < numStates; q++) {
            index.put(ids.get(q), q);
        }

        // succ[q * numInputs + a] is the successor of q on the a-th symbol
        final int[] succ = new int[numStates * numInputs];
        for (int q = 0; q < numStates; q++) {
            for (int a = 0; a < numInputs; a++) {
                StateId to = work.transitionFor(ids.get(q), alphabet.get(a)).orElseThrow().to();
                succ[q * numInputs + a] = index.getInt(to);
            }
        }

        final List<MinimizationStep> steps = new ArrayList<>();

        int[] blockOf = new int[numStates];
        int numBlocks = initialPartition(work, ids, blockOf);
        steps.add(new MinimizationStep(INITIAL_DESCRIPTION, blocks(ids, blockOf, numBlocks)));
        logger.debug("Round 0: {} block(s)", numBlocks);

        int round = 0;
        while (true) {
            round++;
            final int[] refined = new int[numStates];
            final int refinedBlocks = refine(blockOf, succ, numInputs, refined);
            final boolean stable = refinedBlocks == numBlocks;
            String description = String.format(ROUND_DESCRIPTION, round) + (stable ? STABLE_SUFFIX : "");
            steps.add(new MinimizationStep(description, blocks(ids, refined, refinedBlocks)));
            logger.debug("Round {}: {} -> {} block(s)", round, numBlocks, refinedBlocks);

            blockOf = refined;
            // refinement only ever splits blocks, so an unchanged count means an unchanged partition
            if (stable) {
                break;
            }
            numBlocks = refinedBlocks;
        }

        final Map<StateId, StateId> representatives = new HashMap<>();
        final AutomatonModel minimized = buildQuotient(work, ids, alphabet, succ, blockOf, numBlocks, representatives);
        logger.debug("Minimized {} state(s) to {} in {} round(s)", input.size(), minimized.size(), round);

        return new MinimizationResult(steps, minimized, sink, representatives, input.size());
    }

    /**
     * Add a sink state absorbing every undefined transition.
     * @return the sink, or null if the automaton was already complete
     */
    static StateId completeWithSink(AutomatonModel model) {
        final List<MissingTransition> missing = CompletenessAnalyzer.missingTransitions(model);
        if (missing.isEmpty()) {
            return null;
        }
        final StateId sink = model.addState().id();
        for (MissingTransition m : missing) {
            model.setTransition(m.state(), sink, m.symbol());
        }
        for (String symbol : model.getAlphabet()) {
            model.setTransition(sink, sink, symbol);
        }
        logger.info("Automaton is not complete: added sink state {} for {} missing transition(s)", sink, missing.size());
        return sink;
    }

    private static int initialPartition(AutomatonModel model, List<StateId> ids, int[] blockOf) {
        final int[] blockForClass = {-1, -1};
        int numBlocks = 0;
        for (int q = 0; q < ids.size(); q++) {
            final int cls = model.isFinal(ids.get(q)) ? FINAL : NON_FINAL;
            if (blockForClass[cls] < 0) {
                blockForClass[cls] = numBlocks++;
            }
            blockOf[q] = blockForClass[cls];
        }
        return numBlocks;
    }

    /**
     * One refinement round.
     * @param refined receives the new block of every state
     * @return number of blocks after the round
     */
    private static int refine(int[] blockOf, int[] succ, int numInputs, int[] refined) {
        final Object2IntMap<IntList> signatures = new Object2IntOpenHashMap<>();
        signatures.defaultReturnValue(-1);

        for (int q = 0; q < blockOf.length; q++) {
            final IntList signature = new IntArrayList(numInputs + 1);
            signature.add(blockOf[q]);
            for (int a = 0; a < numInputs; a++) {
                signature.add(blockOf[succ[q * numInputs + a]]);
            }
            int block = signatures.getInt(signature);
            if (block < 0) {
                block = signatures.size();
                signatures.put(signature, block);
            }
            refined[q] = block;
        }
        return signatures.size();
    }

    private static List<List<StateId>> blocks(List<StateId> ids, int[] blockOf, int numBlocks) {
        final List<List<StateId>> blocks = new ArrayList<>(numBlocks);
        for (int b = 0; b < numBlocks; b++) {
            blocks.add(new ArrayList<>());
        }
        for (int q = 0; q < ids.size(); q++) {
            blocks.get(blockOf[q]).add(ids.get(q));
        }
        return blocks;
    }

    /**
     * One state per block, named after the block's first member.
     */
    private static AutomatonModel buildQuotient(AutomatonModel work, List<StateId> ids, List<String> alphabet,
                                                int[] succ, int[] blockOf, int numBlocks,
                                                Map<StateId, StateId> representatives) {
        final int numInputs = alphabet.size();
        final int[] repOfBlock = new int[numBlocks];
        final boolean[] seen = new boolean[numBlocks];
        for (int q = 0; q < ids.size(); q++) {
            final int b = blockOf[q];
            if (!seen[b]) {
                seen[b] = true;
                repOfBlock[b] = q;
            }
            representatives.put(ids.get(q), ids.get(repOfBlock[b]));
        }

        final AutomatonModel quotient = new AutomatonModel(alphabet);
        for (int b = 0; b < numBlocks; b++) {
            final StateId rep = ids.get(repOfBlock[b]);
            final State state = work.getState(rep).orElseThrow();
            quotient.addState(rep, state.isFinal());
        }
        quotient.clearStart();
        work.getStartState().ifPresent(start -> quotient.setStart(representatives.get(start)));

        for (int b = 0; b < numBlocks; b++) {
            final int rep = repOfBlock[b];
            for (int a = 0; a < numInputs; a++) {
                final int target = repOfBlock[blockOf[succ[rep * numInputs + a]]];
                quotient.setTransition(ids.get(rep), ids.get(target), alphabet.get(a));
            }
        }
        return quotient;
    }
}
