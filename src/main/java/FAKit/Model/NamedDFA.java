package FAKit.Model;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.DFA;
import net.automatalib.automaton.fsa.impl.CompactDFA;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable DFA whose states carry names. The transition function may be partial.
 * <p>
 * Backed by a {@link CompactDFA}: state {@code i} of the compact automaton is {@code getStates().get(i)}.
 * Instances can only be obtained through {@link Builder}, which rejects unknown states and symbols as well as
 * nondeterministic transitions when they are declared.
 *
 * @param <I> - input symbol type
 */
public final class NamedDFA<I> {
    private final CompactDFA<I> automaton;
    // boxed view, undefined transitions come back as null
    private final DFA<Integer, I> view;
    private final List<String> states;
    private final Object2IntMap<String> stateIndex;
    private final int start;

    private NamedDFA(CompactDFA<I> automaton, List<String> states, Object2IntMap<String> stateIndex, int start) {
        this.automaton = automaton;
        this.view = automaton;
        this.states = Collections.unmodifiableList(states);
        this.stateIndex = stateIndex;
        this.start = start;
    }

    public static <I> Builder<I> builder(Collection<? extends I> alphabet) {
        return new Builder<>(alphabet);
    }

    /**
     * Copy an AutomataLib DFA, naming its states {@code prefix + n} in iteration order.
     * @param dfa - source automaton, must have an initial state
     * @param inputs - symbols to copy transitions for
     * @param prefix - state name prefix
     * @return named copy of dfa
     */
    public static <S, I> NamedDFA<I> fromAutomaton(DFA<S, I> dfa, Collection<? extends I> inputs, String prefix) {
        final S init = dfa.getInitialState();
        if (init == null) {
            throw new ValidationException("Automaton has no initial state");
        }
        final Map<S, String> names = new HashMap<>();
        final Builder<I> builder = builder(inputs);
        for (S s : dfa.getStates()) {
            final String name = prefix + names.size();
            names.put(s, name);
            builder.addState(name);
            if (dfa.isAccepting(s)) {
                builder.addAccepting(name);
            }
        }
        builder.withStart(names.get(init));
        for (S s : dfa.getStates()) {
            for (I i : inputs) {
                final S succ = dfa.getSuccessor(s, i);
                if (succ != null) {
                    builder.addTransition(names.get(s), i, names.get(succ));
                }
            }
        }
        return builder.build();
    }

    public int size() {
        return states.size();
    }

    public List<String> getStates() {
        return states;
    }

    public Alphabet<I> getInputAlphabet() {
        return automaton.getInputAlphabet();
    }

    public String getStart() {
        return states.get(start);
    }

    public boolean containsState(String state) {
        return stateIndex.containsKey(state);
    }

    public boolean isAccepting(String state) {
        return automaton.isAccepting(indexOf(state));
    }

    public Set<String> getAccepting() {
        final Set<String> accepting = new LinkedHashSet<>();
        for (int i = 0; i < states.size(); i++) {
            if (automaton.isAccepting(i)) {
                accepting.add(states.get(i));
            }
        }
        return Collections.unmodifiableSet(accepting);
    }

    /**
     * @return the successor's name, or null when the transition is undefined or the symbol is not in the alphabet.
     */
    public String getSuccessor(String state, I symbol) {
        if (!automaton.getInputAlphabet().containsSymbol(symbol)) {
            return null;
        }
        final Integer succ = view.getSuccessor(indexOf(state), symbol);
        return succ == null ? null : states.get(succ);
    }

    public boolean isTotal() {
        return firstMissingTransition() == null;
    }

    /**
     * @return "δ(state, symbol)" of the first undefined transition in state and alphabet order, or null if total.
     */
    public String firstMissingTransition() {
        for (int q = 0; q < states.size(); q++) {
            for (I a : automaton.getInputAlphabet()) {
                if (view.getSuccessor(q, a) == null) {
                    return "δ(" + states.get(q) + ", " + a + ")";
                }
            }
        }
        return null;
    }

    /**
     * @return a fresh, mutable AutomataLib copy; state indices match {@link #getStates()}.
     */
    public CompactDFA<I> toCompactDFA() {
        final Alphabet<I> alphabet = automaton.getInputAlphabet();
        final CompactDFA<I> copy = new CompactDFA<>(alphabet);
        for (int q = 0; q < states.size(); q++) {
            copy.addState(automaton.isAccepting(q));
        }
        copy.setInitialState(start);
        for (int q = 0; q < states.size(); q++) {
            for (I a : alphabet) {
                final Integer succ = view.getSuccessor(q, a);
                if (succ != null) {
                    copy.setTransition(q, alphabet.getSymbolIndex(a), succ);
                }
            }
        }
        return copy;
    }

    private int indexOf(String state) {
        if (!stateIndex.containsKey(state)) {
            throw new ValidationException("State '" + state + "' is not part of the state set");
        }
        return stateIndex.getInt(state);
    }

    @Override
    public String toString() {
        return "NamedDFA" + states + " start=" + getStart() + " accept=" + getAccepting();
    }

    /**
     * Collects a DFA definition and validates it on {@link #build()}.
     */
    public static final class Builder<I> {
        private final Set<I> alphabet;
        private final Set<String> states = new LinkedHashSet<>();
        private final Set<String> accepting = new LinkedHashSet<>();
        private final Map<String, Map<I, String>> transitions = new LinkedHashMap<>();
        private String start;

        private Builder(Collection<? extends I> alphabet) {
            this.alphabet = new LinkedHashSet<>(alphabet);
        }

        public Builder<I> addState(String state) {
            if (!states.add(state)) {
                throw new ValidationException("Duplicate state '" + state + "'");
            }
            return this;
        }

        public Builder<I> addStates(String... names) {
            for (String name : names) {
                addState(name);
            }
            return this;
        }

        public Builder<I> withStart(String state) {
            this.start = state;
            return this;
        }

        public Builder<I> addAccepting(String... names) {
            Collections.addAll(accepting, names);
            return this;
        }

        /**
         * Declare δ(from, symbol) = to. Declaring the same target twice is harmless.
         * @throws NondeterministicTransitionException if δ(from, symbol) already has another target
         */
        public Builder<I> addTransition(String from, I symbol, String to) {
            final Map<I, String> row = transitions.computeIfAbsent(from, k -> new LinkedHashMap<>());
            final String existing = row.putIfAbsent(symbol, to);
            if (existing != null && !existing.equals(to)) {
                throw new NondeterministicTransitionException(from, symbol, existing, to);
            }
            return this;
        }

        public NamedDFA<I> build() {
            if (start == null) {
                throw new ValidationException("Start state is not set");
            }
            if (!states.contains(start)) {
                throw new ValidationException("Start state '" + start + "' is not part of the state set");
            }
            for (String a : accepting) {
                if (!states.contains(a)) {
                    throw new ValidationException("Accepting state '" + a + "' is not part of the state set");
                }
            }
            for (Map.Entry<String, Map<I, String>> row : transitions.entrySet()) {
                for (Map.Entry<I, String> t : row.getValue().entrySet()) {
                    final String desc = "Transition (" + row.getKey() + ", " + t.getKey() + ") -> " + t.getValue();
                    if (!states.contains(row.getKey()) || !states.contains(t.getValue())) {
                        throw new ValidationException(desc + " references an unknown state");
                    }
                    if (!alphabet.contains(t.getKey())) {
                        throw new ValidationException(desc + " uses symbol '" + t.getKey() + "' outside the alphabet");
                    }
                }
            }

            final Alphabet<I> inputs = Alphabets.fromCollection(alphabet);
            final CompactDFA<I> automaton = new CompactDFA<>(inputs);
            final List<String> names = new ArrayList<>(states);
            final Object2IntMap<String> index = new Object2IntOpenHashMap<>(names.size());
            index.defaultReturnValue(-1);
            for (String name : names) {
                index.put(name, (int) automaton.addState(accepting.contains(name)));
            }
            final int init = index.getInt(start);
            automaton.setInitialState(init);
            for (Map.Entry<String, Map<I, String>> row : transitions.entrySet()) {
                final int from = index.getInt(row.getKey());
                for (Map.Entry<I, String> t : row.getValue().entrySet()) {
                    automaton.setTransition(from, inputs.getSymbolIndex(t.getKey()), index.getInt(t.getValue()));
                }
            }
            return new NamedDFA<>(automaton, names, index, init);
        }
    }
}
