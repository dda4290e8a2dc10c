package DFAMin.Simulation;

import DFAMin.Model.AutomatonModel;
import DFAMin.Model.StateId;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

class SimulationCursorTest {
  private static final StateId Q0 = StateId.of("q0");
  private static final StateId Q1 = StateId.of("q1");

  @Test
  void testWalk() {
    AutomatonModel model = SimulationEngineTest.endsInZero();
    SimulationCursor cursor = new SimulationCursor(model, "10");
    Assertions.assertEquals(Q0, cursor.getCurrentState());
    Assertions.assertEquals(0, cursor.getPosition());
    Assertions.assertFalse(cursor.isFinished());
    Assertions.assertThrows(IllegalStateException.class, cursor::result);

    Assertions.assertEquals(Optional.of(Q1), cursor.stepForward());
    Assertions.assertEquals(Optional.of(Q0), cursor.stepForward());
    Assertions.assertTrue(cursor.isFinished());
    Assertions.assertEquals(Optional.empty(), cursor.stepForward()); // exhausted
    Assertions.assertEquals(SimulationEngine.simulate(model, "10"), cursor.result());

    Assertions.assertTrue(cursor.stepBack());
    Assertions.assertEquals(Q1, cursor.getCurrentState());
    Assertions.assertTrue(cursor.stepBack());
    Assertions.assertFalse(cursor.stepBack());
    Assertions.assertEquals(List.of(Q0), cursor.getPath());
  }

  @Test
  void testCrash() {
    AutomatonModel model = SimulationEngineTest.endsInZero();
    model.removeTransition(Q1, "1");
    SimulationCursor cursor = new SimulationCursor(model, List.of("1", "1", "0"));
    cursor.stepForward();
    Assertions.assertEquals(Optional.empty(), cursor.stepForward());
    Assertions.assertTrue(cursor.isStuck());
    Assertions.assertFalse(cursor.isFinished());
    Assertions.assertEquals(SimulationEngine.simulate(model, "110"), cursor.result());
    Assertions.assertEquals(Optional.empty(), cursor.stepForward()); // stays stuck

    Assertions.assertTrue(cursor.stepBack()); // clears the crash only
    Assertions.assertFalse(cursor.isStuck());
    Assertions.assertEquals(Q1, cursor.getCurrentState());
  }

  @Test
  void testNoStartState() {
    AutomatonModel model = SimulationEngineTest.endsInZero();
    model.clearStart();
    SimulationCursor cursor = new SimulationCursor(model, "0");
    Assertions.assertFalse(cursor.hasStart());
    Assertions.assertTrue(cursor.isFinished());
    Assertions.assertFalse(cursor.isStuck());
    Assertions.assertEquals(0, cursor.getPosition());
    Assertions.assertEquals(List.of(), cursor.getPath());
    Assertions.assertEquals(Optional.empty(), cursor.stepForward());
    Assertions.assertFalse(cursor.stepBack());
    Assertions.assertThrows(IllegalStateException.class, cursor::getCurrentState);
    Assertions.assertEquals(SimulationResult.Outcome.NO_START_STATE, cursor.result().outcome());
    Assertions.assertEquals(SimulationEngine.simulate(model, "0"), cursor.result());
  }
}
