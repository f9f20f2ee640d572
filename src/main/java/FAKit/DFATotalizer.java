package FAKit;

import FAKit.Model.NamedDFA;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Completes a partial DFA with a non-accepting sink.
 */
public class DFATotalizer {
    public static final String DEAD_STATE = "DEAD";
    private static final String COLLISION_SUFFIX = "_X";

    /**
     * Dead state name that does not clash with any of states.
     */
    public static String deadStateName(Collection<String> states) {
        String dead = DEAD_STATE;
        while (states.contains(dead)) {
            dead += COLLISION_SUFFIX;
        }
        return dead;
    }

    /**
     * New DFA over the union of dfa's alphabet and inputs, with one extra dead state. Every undefined transition,
     * including all transitions of the dead state, leads to the dead state. The sink is added even if dfa is
     * already total.
     * @param dfa - DFA to complete, left untouched
     * @param inputs - additional symbols
     * @return total DFA
     */
    public static <I> NamedDFA<I> totalize(NamedDFA<I> dfa, Collection<? extends I> inputs) {
        final Set<I> alphabet = new LinkedHashSet<>(dfa.getInputAlphabet());
        alphabet.addAll(inputs);

        final String dead = deadStateName(dfa.getStates());
        final List<String> states = new ArrayList<>(dfa.getStates());
        states.add(dead);

        final NamedDFA.Builder<I> builder = NamedDFA.builder(alphabet);
        for (String s : states) {
            builder.addState(s);
        }
        builder.withStart(dfa.getStart());
        builder.addAccepting(dfa.getAccepting().toArray(new String[0]));

        for (String s : states) {
            for (I a : alphabet) {
                final String succ = s.equals(dead) ? null : dfa.getSuccessor(s, a);
                builder.addTransition(s, a, succ == null ? dead : succ);
            }
        }
        return builder.build();
    }
}
