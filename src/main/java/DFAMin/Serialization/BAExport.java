package DFAMin.Serialization;

import java.io.IOException;
import java.io.OutputStream;

import DFAMin.Model.AutomataLibAdapter;
import DFAMin.Model.AutomatonModel;
import DFAMin.Model.AutomatonValidator;
import DFAMin.Model.InvalidAutomatonException;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.serialization.ba.BAWriter;

/**
 * Writes automata in the BA format (<a href="https://languageinclusion.org/doku.php?id=tools">description</a>),
 * as read by RABIT and similar tools. State {@code i} in the output is the {@code i}-th state in declaration order.
 */
public final class BAExport {
    private BAExport() {}

    public static void write(AutomatonModel model, OutputStream os) throws IOException, InvalidAutomatonException {
        AutomatonValidator.requireValid(model);
        final CompactDFA<String> dfa = AutomataLibAdapter.toCompactDFA(model);
        final BAWriter<String> baWriter = new BAWriter<>();
        baWriter.writeModel(os, dfa, dfa.getInputAlphabet());
    }
}
