package DFAMin.Model;

import java.util.List;

/**
 * Structural validation failure. Carries every problem found, not only the first one.
 */
public class InvalidAutomatonException extends Exception {
    private final List<String> problems;

    public InvalidAutomatonException(List<String> problems) {
        super(String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public InvalidAutomatonException(String problem) {
        this(List.of(problem));
    }

    public List<String> getProblems() {
        return problems;
    }
}
