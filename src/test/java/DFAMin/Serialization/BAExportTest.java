package DFAMin.Serialization;

import DFAMin.Model.AutomatonModel;
import DFAMin.Model.AutomatonValidator;
import DFAMin.Model.InvalidAutomatonException;
import DFAMin.RandomDFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class BAExportTest {
  @Test
  void testWrite() throws IOException, InvalidAutomatonException {
    AutomatonModel model = RandomDFA.getRandomAutomaton(3, 4);
    ByteArrayOutputStream os = new ByteArrayOutputStream();
    BAExport.write(model, os);
    String ba = os.toString(StandardCharsets.UTF_8);
    Assertions.assertFalse(ba.isBlank());
    Assertions.assertTrue(ba.contains("->"));
    // one line per transition, plus the initial state and the final states
    Assertions.assertTrue(ba.lines().count() >= model.transitionCount() + 1);
  }

  @Test
  void testRejectsUnrunnable() {
    AutomatonModel model = RandomDFA.getRandomAutomaton(3, 4);
    model.clearStart();
    InvalidAutomatonException e = Assertions.assertThrows(InvalidAutomatonException.class,
        () -> BAExport.write(model, new ByteArrayOutputStream()));
    Assertions.assertEquals(List.of(AutomatonValidator.NO_START_STATE), e.getProblems());

    Assertions.assertThrows(InvalidAutomatonException.class,
        () -> BAExport.write(new AutomatonModel(), new ByteArrayOutputStream()));
  }
}
