package DFAMin.Minimization;

import DFAMin.Model.AutomataLibAdapter;
import DFAMin.Model.AutomatonModel;
import DFAMin.Model.StateId;
import DFAMin.RandomDFA;
import DFAMin.Simulation.SimulationEngine;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.minimizer.HopcroftMinimizer;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

public class MooreMinimizerRandomTest {
  @Test
  void testAgainstHopcroft() {
    for (int size = 1; size < 12; size++) {
      for (int randomSeed = 0; randomSeed < 50; randomSeed++) {
        AutomatonModel model = RandomDFA.getRandomAutomaton(randomSeed, size);
        assertMinimal(model, size + "; " + randomSeed);
      }
    }
  }

  @Test
  void testLargerAlphabet() {
    Random r = new Random(42);
    List<String> alphabet = List.of("a", "b", "c", "d");
    for (int i = 0; i < 40; i++) {
      AutomatonModel model = RandomDFA.generateDFA(r, 20, alphabet, 0.3f);
      assertMinimal(model, "iteration " + i);
    }
  }

  @Test
  void testLanguagePreserved() {
    for (int randomSeed = 0; randomSeed < 30; randomSeed++) {
      AutomatonModel model = RandomDFA.getRandomAutomaton(randomSeed, 7);
      // make it partial, so that the sink is exercised as well
      model.removeTransition(model.getStateIds().get(randomSeed % 7), "0");
      AutomatonModel min = MooreMinimizer.minimize(model).getMinimized();
      for (List<String> word : RandomDFA.allWords(model.getAlphabet(), 7)) {
        Assertions.assertEquals(SimulationEngine.simulate(model, word).accepted(),
            SimulationEngine.simulate(min, word).accepted(), randomSeed + ": " + word);
      }
    }
  }

  @Test
  void testIdempotent() {
    for (int randomSeed = 0; randomSeed < 30; randomSeed++) {
      AutomatonModel model = RandomDFA.getRandomAutomaton(randomSeed, 9);
      AutomatonModel once = MooreMinimizer.minimize(model).getMinimized();
      MinimizationResult twice = MooreMinimizer.minimize(once);
      Assertions.assertEquals(once.size(), twice.getMinimizedStateCount());
      Assertions.assertTrue(twice.getMinimized().structurallyEquals(once));
      List<MinimizationStep> steps = twice.getSteps();
      Assertions.assertEquals(once.size(), steps.get(steps.size() - 1).blockCount());
    }
  }

  @Test
  void testRefinementPreservesBlocks() {
    for (int randomSeed = 0; randomSeed < 30; randomSeed++) {
      AutomatonModel model = RandomDFA.getRandomAutomaton(randomSeed, 10);
      List<MinimizationStep> steps = MooreMinimizer.minimize(model).getSteps();
      for (int i = 1; i < steps.size(); i++) {
        // every new block lies inside one block of the previous round
        for (List<StateId> block : steps.get(i).partitions()) {
          boolean contained = false;
          for (List<StateId> previous : steps.get(i - 1).partitions()) {
            contained |= previous.containsAll(block);
          }
          Assertions.assertTrue(contained, randomSeed + ": " + block);
        }
        Assertions.assertTrue(steps.get(i).blockCount() >= steps.get(i - 1).blockCount());
      }
      Assertions.assertEquals(steps.get(steps.size() - 1).partitions(), steps.get(steps.size() - 2).partitions());
      Assertions.assertTrue(steps.size() - 1 <= model.size());
    }
  }

  private static void assertMinimal(AutomatonModel model, String debug) {
    MinimizationResult result = MooreMinimizer.minimize(model);
    CompactDFA<String> dfa = AutomataLibAdapter.toCompactDFA(model);
    CompactDFA<String> moore = AutomataLibAdapter.toCompactDFA(result.getMinimized());
    CompactDFA<String> hopcroft = HopcroftMinimizer.minimizeDFA(dfa, dfa.getInputAlphabet());

    Assertions.assertTrue(result.getSinkState().isEmpty(), debug);
    Assertions.assertEquals(hopcroft.size(), moore.size(), debug);
    Assertions.assertTrue(Automata.testEquivalence(dfa, moore, dfa.getInputAlphabet()), debug);
  }
}
