package DFAMin.Model;

import java.util.List;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.DFA;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.common.util.mapping.MutableMapping;

/**
 * Conversions between {@link AutomatonModel} and AutomataLib's DFAs.
 */
public final class AutomataLibAdapter {
    private AutomataLibAdapter() {}

    /**
     * Export to a {@link CompactDFA}. State {@code i} of the result is the {@code i}-th state of
     * {@link AutomatonModel#getStateIds()}. Missing transitions stay undefined.
     */
    public static CompactDFA<String> toCompactDFA(AutomatonModel model) {
        final Alphabet<String> alphabet = Alphabets.fromCollection(model.getAlphabet());
        final List<StateId> ids = model.getStateIds();
        final CompactDFA<String> dfa = new CompactDFA<>(alphabet, Math.max(ids.size(), 1));

        final Object2IntMap<StateId> index = new Object2IntOpenHashMap<>(ids.size());
        for (StateId id : ids) {
            final int state = dfa.addState(model.isFinal(id));
            index.put(id, state);
        }
        model.getStartState().ifPresent(start -> dfa.setInitialState(index.getInt(start)));

        for (Transition t : model.getTransitions()) {
            dfa.setTransition(index.getInt(t.from()), alphabet.getSymbolIndex(t.symbol()), index.getInt(t.to()));
        }
        return dfa;
    }

    /**
     * Import an AutomataLib DFA. States are named {@code q0, q1, ...} in the order of {@link DFA#getStates()}.
     */
    public static <S> AutomatonModel fromDFA(DFA<S, String> dfa, Alphabet<String> alphabet) {
        final AutomatonModel model = new AutomatonModel(alphabet);
        final MutableMapping<S, StateId> mapping = dfa.createStaticStateMapping();

        int n = 0;
        for (S s : dfa.getStates()) {
            mapping.put(s, model.addState(new StateId(AutomatonModel.ID_PREFIX + n++), dfa.isAccepting(s)).id());
        }
        model.clearStart();
        final S init = dfa.getInitialState();
        if (init != null) {
            model.setStart(mapping.get(init));
        }

        for (S s : dfa.getStates()) {
            for (String a : alphabet) {
                final S succ = dfa.getSuccessor(s, a);
                if (succ != null) {
                    model.setTransition(mapping.get(s), mapping.get(succ), a);
                }
            }
        }
        return model;
    }
}
