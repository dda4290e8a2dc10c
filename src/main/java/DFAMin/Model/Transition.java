package DFAMin.Model;

import java.util.Objects;

public record Transition(StateId from, String symbol, StateId to) {

    public Transition {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(to, "to");
    }

    @Override
    public String toString() {
        return from + " --" + symbol + "--> " + to;
    }
}
