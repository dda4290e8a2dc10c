package DFAMin.Model;

import DFAMin.RandomDFA;
import DFAMin.Simulation.SimulationEngine;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.util.automaton.Automata;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class AutomataLibAdapterTest {
  @Test
  void testEmpty() {
    AutomatonModel model = new AutomatonModel(List.of("0", "1"));
    CompactDFA<String> dfa = AutomataLibAdapter.toCompactDFA(model);
    Assertions.assertEquals(0, dfa.size());
    Assertions.assertEquals(2, dfa.getInputAlphabet().size());
    Assertions.assertNull(dfa.getInitialState());
  }

  @Test
  void testExportKeepsLanguage() {
    AutomatonModel model = RandomDFA.getRandomAutomaton(7, 6);
    CompactDFA<String> dfa = AutomataLibAdapter.toCompactDFA(model);
    Assertions.assertEquals(model.size(), dfa.size());
    Assertions.assertEquals(0, (int) dfa.getInitialState());
    for (List<String> word : RandomDFA.allWords(model.getAlphabet(), 6)) {
      Assertions.assertEquals(SimulationEngine.simulate(model, word).accepted(), dfa.accepts(word), word.toString());
    }
  }

  @Test
  void testPartialExport() {
    AutomatonModel model = new AutomatonModel(List.of("a", "b"));
    StateId q0 = model.addState().id();
    StateId q1 = model.addState().id();
    model.setFinal(q1, true);
    model.setTransition(q0, q1, "a");
    CompactDFA<String> dfa = AutomataLibAdapter.toCompactDFA(model);
    Assertions.assertTrue(dfa.accepts(List.of("a")));
    Assertions.assertFalse(dfa.accepts(List.of("b")));
    Assertions.assertTrue(dfa.getSuccessor(0, dfa.getInputAlphabet().getSymbolIndex("b")) < 0); // undefined
  }

  @Test
  void testImport() {
    Alphabet<String> alphabet = Alphabets.fromCollection(List.of("x", "y"));
    CompactDFA<String> dfa = new CompactDFA<>(alphabet);
    int s0 = dfa.addInitialState(false);
    int s1 = dfa.addState(true);
    dfa.setTransition(s0, alphabet.getSymbolIndex("x"), s1);
    dfa.setTransition(s1, alphabet.getSymbolIndex("y"), s0);

    AutomatonModel model = AutomataLibAdapter.fromDFA(dfa, alphabet);
    Assertions.assertEquals(List.of(StateId.of("q0"), StateId.of("q1")), model.getStateIds());
    Assertions.assertTrue(model.isFinal(StateId.of("q1")));
    Assertions.assertEquals(StateId.of("q0"), model.getStartState().orElseThrow());
    Assertions.assertEquals(2, model.transitionCount());
    Assertions.assertTrue(model.transitionFor(StateId.of("q0"), "y").isEmpty());

    CompactDFA<String> back = AutomataLibAdapter.toCompactDFA(model);
    Assertions.assertTrue(Automata.testEquivalence(dfa, back, alphabet));
  }
}
