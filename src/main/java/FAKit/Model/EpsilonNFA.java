package FAKit.Model;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.NFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * NFA with epsilon moves, one start state and exactly one accept state.
 * <p>
 * States are indices into an arena owned by a single compilation. Labeled moves live in a {@link CompactNFA},
 * epsilon moves in a separate successor list per state.
 *
 * @param <I> - input symbol type
 */
public final class EpsilonNFA<I> {
    public static final String EPSILON = "ε";

    private final CompactNFA<I> automaton;
    private final List<IntArrayList> epsilon;
    private final int start;
    private final int accept;

    private EpsilonNFA(CompactNFA<I> automaton, List<IntArrayList> epsilon, int start, int accept) {
        this.automaton = automaton;
        this.epsilon = epsilon;
        this.start = start;
        this.accept = accept;
    }

    public int size() {
        return automaton.size();
    }

    public int getStart() {
        return start;
    }

    public int getAccept() {
        return accept;
    }

    public Alphabet<I> getInputAlphabet() {
        return automaton.getInputAlphabet();
    }

    /**
     * @return labeled successors of state on symbol; empty when the symbol is not in the alphabet.
     */
    public Set<Integer> getTransitions(int state, I symbol) {
        if (!automaton.getInputAlphabet().containsSymbol(symbol)) {
            return Collections.emptySet();
        }
        final NFA<Integer, I> view = automaton;
        return Collections.unmodifiableSet(view.getSuccessors(state, symbol));
    }

    public IntList getEpsilonSuccessors(int state) {
        return IntLists.unmodifiable(epsilon.get(state));
    }

    public static String stateName(int state) {
        return "q" + state;
    }

    /**
     * One line per move, e.g. {@code q0 --[a]--> q1} or {@code q2 --[ε]--> q0}, ordered by source state.
     */
    public List<String> getTransitionListing() {
        final List<String> lines = new ArrayList<>();
        final NFA<Integer, I> view = automaton;
        for (int q = 0; q < size(); q++) {
            for (I a : automaton.getInputAlphabet()) {
                for (int t : new TreeSet<>(view.getSuccessors(q, a))) {
                    lines.add(stateName(q) + " --[" + a + "]--> " + stateName(t));
                }
            }
            for (int t : epsilon.get(q)) {
                lines.add(stateName(q) + " --[" + EPSILON + "]--> " + stateName(t));
            }
        }
        return lines;
    }

    @Override
    public String toString() {
        return "EpsilonNFA(" + size() + " states, start=" + stateName(start) + ", accept=" + stateName(accept) + ")";
    }

    /**
     * State arena for one construction. Indices are handed out sequentially from 0.
     */
    public static final class Builder<I> {
        private final CompactNFA<I> automaton;
        private final List<IntArrayList> epsilon = new ArrayList<>();
        private boolean built;

        public Builder(Alphabet<I> alphabet) {
            this.automaton = new CompactNFA<>(alphabet);
        }

        public int addState() {
            checkOpen();
            final int state = automaton.addState(false);
            epsilon.add(new IntArrayList());
            return state;
        }

        public void addTransition(int from, I symbol, int to) {
            checkOpen();
            automaton.addTransition(from, symbol, to);
        }

        public void addEpsilon(int from, int to) {
            checkOpen();
            epsilon.get(from).add(to);
        }

        public int size() {
            return automaton.size();
        }

        public EpsilonNFA<I> build(int start, int accept) {
            checkOpen();
            if (start < 0 || start >= size() || accept < 0 || accept >= size()) {
                throw new ValidationException("Start or accept state is not part of the state set");
            }
            built = true;
            automaton.setInitial(start, true);
            automaton.setAccepting(accept, true);
            return new EpsilonNFA<>(automaton, epsilon, start, accept);
        }

        private void checkOpen() {
            if (built) {
                throw new IllegalStateException("Automaton already built");
            }
        }
    }
}
