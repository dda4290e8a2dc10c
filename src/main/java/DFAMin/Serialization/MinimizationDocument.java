package DFAMin.Serialization;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Minimization payload for presentation layers: the refinement trace plus the minimized automaton.
 * {@code sinkState} is only present when a sink had to be added to complete the input.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MinimizationDocument {

    @JsonProperty("steps")
    private List<Step> steps;

    @JsonProperty("minimized")
    private AutomatonDocument minimized;

    @JsonProperty("sinkState")
    private String sinkState;

    public MinimizationDocument() {}

    public MinimizationDocument(List<Step> steps, AutomatonDocument minimized, String sinkState) {
        this.steps = steps;
        this.minimized = minimized;
        this.sinkState = sinkState;
    }

    public List<Step> getSteps() { return steps; }
    public void setSteps(List<Step> steps) { this.steps = steps; }

    public AutomatonDocument getMinimized() { return minimized; }
    public void setMinimized(AutomatonDocument minimized) { this.minimized = minimized; }

    public String getSinkState() { return sinkState; }
    public void setSinkState(String sinkState) { this.sinkState = sinkState; }

    public static class Step {
        @JsonProperty("description")
        private String description;

        @JsonProperty("partitions")
        private List<List<String>> partitions;

        public Step() {}

        public Step(String description, List<List<String>> partitions) {
            this.description = description;
            this.partitions = partitions;
        }

        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }

        public List<List<String>> getPartitions() { return partitions; }
        public void setPartitions(List<List<String>> partitions) { this.partitions = partitions; }
    }
}
