package DFAMin.Serialization;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Interchange document exchanged with editors and importers.
 * <p>
 * Example:
 * <pre>
 * {
 *   "states": [ {"id": "q0", "isFinal": true, "isStart": true}, {"id": "q1", "isFinal": false, "isStart": false} ],
 *   "transitions": [ {"from": "q0", "to": "q1", "symbol": "1"} ],
 *   "alphabet": ["0", "1"]
 * }
 * </pre>
 * Presentation fields such as {@code x} and {@code y} are accepted and ignored.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AutomatonDocument {

    @JsonProperty("states")
    private List<StateEntry> states;

    @JsonProperty("transitions")
    private List<TransitionEntry> transitions;

    @JsonProperty("alphabet")
    private List<String> alphabet;

    public AutomatonDocument() {}

    public AutomatonDocument(List<StateEntry> states, List<TransitionEntry> transitions, List<String> alphabet) {
        this.states = states;
        this.transitions = transitions;
        this.alphabet = alphabet;
    }

    public List<StateEntry> getStates() { return states; }
    public void setStates(List<StateEntry> states) { this.states = states; }

    public List<TransitionEntry> getTransitions() { return transitions; }
    public void setTransitions(List<TransitionEntry> transitions) { this.transitions = transitions; }

    public List<String> getAlphabet() { return alphabet; }
    public void setAlphabet(List<String> alphabet) { this.alphabet = alphabet; }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StateEntry {
        @JsonProperty("id")
        private String id;

        @JsonProperty("isFinal")
        private boolean isFinal;

        @JsonProperty("isStart")
        private boolean isStart;

        public StateEntry() {}

        public StateEntry(String id, boolean isFinal, boolean isStart) {
            this.id = id;
            this.isFinal = isFinal;
            this.isStart = isStart;
        }

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        @JsonProperty("isFinal")
        public boolean isFinal() { return isFinal; }
        @JsonProperty("isFinal")
        public void setFinal(boolean isFinal) { this.isFinal = isFinal; }

        @JsonProperty("isStart")
        public boolean isStart() { return isStart; }
        @JsonProperty("isStart")
        public void setStart(boolean isStart) { this.isStart = isStart; }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TransitionEntry {
        @JsonProperty("from")
        private String from;

        @JsonProperty("to")
        private String to;

        @JsonProperty("symbol")
        private String symbol;

        public TransitionEntry() {}

        public TransitionEntry(String from, String to, String symbol) {
            this.from = from;
            this.to = to;
            this.symbol = symbol;
        }

        public String getFrom() { return from; }
        public void setFrom(String from) { this.from = from; }

        public String getTo() { return to; }
        public void setTo(String to) { this.to = to; }

        public String getSymbol() { return symbol; }
        public void setSymbol(String symbol) { this.symbol = symbol; }
    }
}
