package DFAMin.Model;

import java.util.Objects;

public record State(StateId id, boolean isFinal) {

    public State {
        Objects.requireNonNull(id, "id");
    }

    public State withFinal(boolean isFinal) {
        return isFinal == this.isFinal ? this : new State(id, isFinal);
    }

    @Override
    public String toString() {
        return isFinal ? "(" + id + ")" : id.toString();
    }
}
