package DFAMin.Model;

import java.util.Objects;

/**
 * Identifier of a state, unique within one {@link AutomatonModel}.
 */
public record StateId(String value) {

    public StateId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("State id must not be blank");
        }
    }

    public static StateId of(String value) {
        return new StateId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
