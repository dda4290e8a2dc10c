package DFAMin.Serialization;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import DFAMin.Minimization.MinimizationResult;
import DFAMin.Minimization.MinimizationStep;
import DFAMin.Model.AutomatonModel;
import DFAMin.Model.InvalidAutomatonException;
import DFAMin.Model.State;
import DFAMin.Model.StateId;
import DFAMin.Model.Transition;
import DFAMin.Serialization.AutomatonDocument.StateEntry;
import DFAMin.Serialization.AutomatonDocument.TransitionEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts automata to and from the JSON interchange document.
 * <p>
 * Decoding checks the whole document first and reports every problem at once; no model is built from an
 * invalid document.
 */
public final class AutomatonSerializer {
    private static final Logger logger = LoggerFactory.getLogger(AutomatonSerializer.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .enable(SerializationFeature.INDENT_OUTPUT);

    private AutomatonSerializer() {}

    public static AutomatonDocument encode(AutomatonModel model) {
        final StateId start = model.getStartState().orElse(null);
        final List<StateEntry> states = new ArrayList<>(model.size());
        for (State s : model.getStates()) {
            states.add(new StateEntry(s.id().value(), s.isFinal(), s.id().equals(start)));
        }
        final List<TransitionEntry> transitions = new ArrayList<>(model.transitionCount());
        for (Transition t : model.getTransitions()) {
            transitions.add(new TransitionEntry(t.from().value(), t.to().value(), t.symbol()));
        }
        return new AutomatonDocument(states, transitions, new ArrayList<>(model.getAlphabet()));
    }

    public static AutomatonModel decode(AutomatonDocument document) throws InvalidAutomatonException {
        final List<String> problems = validate(document);
        if (!problems.isEmpty()) {
            logger.debug("Rejected document: {}", problems);
            throw new InvalidAutomatonException(problems);
        }

        final Set<String> alphabet = new LinkedHashSet<>();
        if (document.getAlphabet() != null) {
            alphabet.addAll(document.getAlphabet());
        }
        // symbols are not pre-validated against the alphabet; unknown ones are appended
        for (TransitionEntry t : document.getTransitions()) {
            alphabet.add(t.getSymbol());
        }

        final AutomatonModel model = new AutomatonModel(alphabet);
        StateId start = null;
        for (StateEntry s : document.getStates()) {
            final StateId id = model.addState(new StateId(s.getId()), s.isFinal()).id();
            if (s.isStart()) {
                start = id;
            }
        }
        model.clearStart();
        if (start != null) {
            model.setStart(start);
        }
        for (TransitionEntry t : document.getTransitions()) {
            model.setTransition(new StateId(t.getFrom()), new StateId(t.getTo()), t.getSymbol());
        }
        return model;
    }

    static List<String> validate(AutomatonDocument document) {
        final List<String> problems = new ArrayList<>();
        if (document == null) {
            problems.add("Document is empty");
            return problems;
        }
        if (document.getStates() == null) {
            problems.add("Missing required key 'states'");
        }
        if (document.getTransitions() == null) {
            problems.add("Missing required key 'transitions'");
        }
        if (document.getAlphabet() != null) {
            final Set<String> symbols = new HashSet<>();
            for (String symbol : document.getAlphabet()) {
                if (symbol == null || symbol.isEmpty()) {
                    problems.add("Alphabet contains an empty symbol");
                } else if (!symbols.add(symbol)) {
                    problems.add("Alphabet contains duplicate symbol '" + symbol + "'");
                }
            }
        }
        if (!problems.isEmpty()) {
            return problems;
        }

        final Set<String> ids = new HashSet<>();
        final List<String> startIds = new ArrayList<>(1);
        for (int i = 0; i < document.getStates().size(); i++) {
            final StateEntry s = document.getStates().get(i);
            if (s == null || s.getId() == null || s.getId().isBlank()) {
                problems.add("State #" + i + " has no id");
                continue;
            }
            if (!ids.add(s.getId())) {
                problems.add("Duplicate state id '" + s.getId() + "'");
            }
            if (s.isStart()) {
                startIds.add(s.getId());
            }
        }
        if (startIds.size() > 1) {
            problems.add("More than one start state: " + String.join(", ", startIds));
        }

        final Set<String> pairs = new HashSet<>();
        for (int i = 0; i < document.getTransitions().size(); i++) {
            final TransitionEntry t = document.getTransitions().get(i);
            if (t == null) {
                problems.add("Transition #" + i + " is empty");
                continue;
            }
            if (t.getFrom() == null || !ids.contains(t.getFrom())) {
                problems.add("Transition #" + i + " references undeclared state '" + t.getFrom() + "'");
            }
            if (t.getTo() == null || !ids.contains(t.getTo())) {
                problems.add("Transition #" + i + " references undeclared state '" + t.getTo() + "'");
            }
            if (t.getSymbol() == null || t.getSymbol().isEmpty()) {
                problems.add("Transition #" + i + " has no symbol");
            } else if (t.getFrom() != null && !pairs.add(t.getFrom() + '\u0000' + t.getSymbol())) {
                problems.add("Duplicate transition from '" + t.getFrom() + "' on symbol '" + t.getSymbol() + "'");
            }
        }
        return problems;
    }

    public static MinimizationDocument encode(MinimizationResult result) {
        final List<MinimizationDocument.Step> steps = new ArrayList<>(result.getSteps().size());
        for (MinimizationStep step : result.getSteps()) {
            final List<List<String>> partitions = new ArrayList<>(step.blockCount());
            for (List<StateId> block : step.partitions()) {
                final List<String> ids = new ArrayList<>(block.size());
                for (StateId id : block) {
                    ids.add(id.value());
                }
                partitions.add(ids);
            }
            steps.add(new MinimizationDocument.Step(step.description(), partitions));
        }
        final String sink = result.getSinkState().map(StateId::value).orElse(null);
        return new MinimizationDocument(steps, encode(result.getMinimized()), sink);
    }

    public static String toJson(AutomatonModel model) {
        return write(encode(model));
    }

    public static String toJson(MinimizationResult result) {
        return write(encode(result));
    }

    public static AutomatonModel fromJson(String json) throws InvalidAutomatonException {
        final AutomatonDocument document;
        try {
            document = MAPPER.readValue(json, AutomatonDocument.class);
        } catch (JsonProcessingException e) {
            throw new InvalidAutomatonException("Malformed JSON: " + e.getOriginalMessage());
        }
        return decode(document);
    }

    public static AutomatonModel read(InputStream is) throws IOException, InvalidAutomatonException {
        final AutomatonDocument document;
        try {
            document = MAPPER.readValue(is, AutomatonDocument.class);
        } catch (JsonProcessingException e) {
            throw new InvalidAutomatonException("Malformed JSON: " + e.getOriginalMessage());
        }
        return decode(document);
    }

    private static String write(Object document) {
        try {
            return MAPPER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            // documents only hold strings, booleans and lists
            throw new IllegalStateException("Could not serialize " + document.getClass().getSimpleName(), e);
        }
    }
}
