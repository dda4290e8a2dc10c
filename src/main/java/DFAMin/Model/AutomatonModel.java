package DFAMin.Model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable deterministic automaton over string symbols.
 * <p>
 * States keep their declaration order, transitions keep the order in which their (source, symbol) pair was first
 * set, and the alphabet keeps insertion order. These orders are only used for deterministic iteration and reporting.
 * <p>
 * Instances are not thread-safe. Hand each concurrent reader its own {@link #copy()}.
 */
public class AutomatonModel {
    static final String ID_PREFIX = "q";

    private final Map<StateId, State> states = new LinkedHashMap<>();
    private final Map<TransitionKey, StateId> transitions = new LinkedHashMap<>();
    private final Set<String> alphabet = new LinkedHashSet<>();
    private StateId startState;
    private int idCounter;

    public AutomatonModel() {
    }

    public AutomatonModel(Collection<String> alphabet) {
        for (String symbol : alphabet) {
            addSymbol(symbol);
        }
    }

    /**
     * Add a state with a fresh identifier. The first state of an empty automaton becomes the start state.
     * @return the new, non-final state
     */
    public State addState() {
        StateId id;
        do {
            id = new StateId(ID_PREFIX + idCounter++);
        } while (states.containsKey(id));
        return insert(new State(id, false));
    }

    /**
     * Add a state with a caller-chosen identifier.
     * @throws IllegalArgumentException if the identifier is already taken
     */
    public State addState(StateId id, boolean isFinal) {
        Objects.requireNonNull(id, "id");
        if (states.containsKey(id)) {
            throw new IllegalArgumentException("Duplicate state id: " + id);
        }
        return insert(new State(id, isFinal));
    }

    private State insert(State state) {
        if (states.isEmpty() && startState == null) {
            startState = state.id();
        }
        states.put(state.id(), state);
        return state;
    }

    public void setFinal(StateId id, boolean isFinal) {
        State state = requireState(id);
        states.put(id, state.withFinal(isFinal));
    }

    public void setStart(StateId id) {
        requireState(id);
        startState = id;
    }

    public void clearStart() {
        startState = null;
    }

    /**
     * Set the transition for (from, symbol), replacing any existing destination.
     */
    public void setTransition(StateId from, StateId to, String symbol) {
        requireState(from);
        requireState(to);
        requireSymbol(symbol);
        transitions.put(new TransitionKey(from, symbol), to);
    }

    /**
     * @return whether a transition was removed
     */
    public boolean removeTransition(StateId from, String symbol) {
        return transitions.remove(new TransitionKey(from, symbol)) != null;
    }

    /**
     * Remove a state and every transition touching it. The start state becomes unset if it is removed.
     * @return false if the state was not present
     */
    public boolean removeState(StateId id) {
        return removeState(id, StartStatePolicy.UNSET);
    }

    public boolean removeState(StateId id, StartStatePolicy policy) {
        Objects.requireNonNull(policy, "policy");
        if (id == null || states.remove(id) == null) {
            return false;
        }
        transitions.entrySet().removeIf(e -> e.getKey().from().equals(id) || e.getValue().equals(id));
        if (id.equals(startState)) {
            startState = null;
            if (policy == StartStatePolicy.FIRST_REMAINING && !states.isEmpty()) {
                startState = states.keySet().iterator().next();
            }
        }
        return true;
    }

    public Optional<Transition> transitionFor(StateId from, String symbol) {
        StateId to = transitions.get(new TransitionKey(from, symbol));
        return to == null ? Optional.empty() : Optional.of(new Transition(from, symbol, to));
    }

    /**
     * Clear states, transitions and the start designation. The alphabet is kept.
     */
    public void reset() {
        states.clear();
        transitions.clear();
        startState = null;
        idCounter = 0;
    }

    /**
     * Append a symbol to the alphabet; no-op if it is already present.
     */
    public void addSymbol(String symbol) {
        Objects.requireNonNull(symbol, "symbol");
        if (symbol.isEmpty()) {
            throw new IllegalArgumentException("Alphabet symbols must not be empty");
        }
        alphabet.add(symbol);
    }

    /**
     * Replace the alphabet. Transitions on symbols that are no longer part of it are dropped.
     * A rejected alphabet leaves the automaton unchanged.
     */
    public void setAlphabet(List<String> symbols) {
        Objects.requireNonNull(symbols, "symbols");
        Set<String> distinct = new LinkedHashSet<>(symbols.size());
        for (String symbol : symbols) {
            Objects.requireNonNull(symbol, "symbol");
            if (symbol.isEmpty()) {
                throw new IllegalArgumentException("Alphabet symbols must not be empty");
            }
            if (!distinct.add(symbol)) {
                throw new IllegalArgumentException("Alphabet contains duplicate symbols: " + symbols);
            }
        }
        // nothing is touched until every symbol has been checked
        alphabet.clear();
        alphabet.addAll(distinct);
        transitions.keySet().removeIf(k -> !alphabet.contains(k.symbol()));
    }

    public List<String> getAlphabet() {
        return List.copyOf(alphabet);
    }

    public boolean hasSymbol(String symbol) {
        return alphabet.contains(symbol);
    }

    public List<State> getStates() {
        return List.copyOf(states.values());
    }

    public List<StateId> getStateIds() {
        return List.copyOf(states.keySet());
    }

    public Optional<State> getState(StateId id) {
        return Optional.ofNullable(states.get(id));
    }

    public boolean containsState(StateId id) {
        return states.containsKey(id);
    }

    public boolean isFinal(StateId id) {
        return requireState(id).isFinal();
    }

    public Optional<StateId> getStartState() {
        return Optional.ofNullable(startState);
    }

    public List<Transition> getTransitions() {
        List<Transition> result = new ArrayList<>(transitions.size());
        for (Map.Entry<TransitionKey, StateId> e : transitions.entrySet()) {
            result.add(new Transition(e.getKey().from(), e.getKey().symbol(), e.getValue()));
        }
        return Collections.unmodifiableList(result);
    }

    public int size() {
        return states.size();
    }

    public int transitionCount() {
        return transitions.size();
    }

    public boolean isEmpty() {
        return states.isEmpty();
    }

    /**
     * Deep snapshot, including the identifier counter.
     */
    public AutomatonModel copy() {
        AutomatonModel copy = new AutomatonModel(alphabet);
        copy.states.putAll(states);
        copy.transitions.putAll(transitions);
        copy.startState = startState;
        copy.idCounter = idCounter;
        return copy;
    }

    /**
     * Same states (ids, final flags and order), same transitions, alphabet and start state.
     * Transition order is not compared.
     */
    public boolean structurallyEquals(AutomatonModel other) {
        if (this == other) {
            return true;
        }
        if (other == null) {
            return false;
        }
        return new ArrayList<>(states.values()).equals(new ArrayList<>(other.states.values()))
            && transitions.equals(other.transitions)
            && new ArrayList<>(alphabet).equals(new ArrayList<>(other.alphabet))
            && Objects.equals(startState, other.startState);
    }

    private State requireState(StateId id) {
        State state = id == null ? null : states.get(id);
        if (state == null) {
            throw new IllegalArgumentException("Unknown state: " + id);
        }
        return state;
    }

    private void requireSymbol(String symbol) {
        if (!alphabet.contains(symbol)) {
            throw new IllegalArgumentException("Symbol '" + symbol + "' is not part of the alphabet " + alphabet);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("states=").append(states.values())
          .append(", start=").append(startState)
          .append(", alphabet=").append(alphabet)
          .append(", transitions=[");
        Iterator<Transition> it = getTransitions().iterator();
        while (it.hasNext()) {
            sb.append(it.next());
            if (it.hasNext()) {
                sb.append(", ");
            }
        }
        return sb.append(']').toString();
    }

    private record TransitionKey(StateId from, String symbol) { }
}
