package FAKit.Simulation;

import FAKit.Model.EpsilonNFA;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Subset simulation of an {@link EpsilonNFA}: the active set is kept epsilon-closed after every symbol.
 * Symbols without a matching move empty the active set; the run still consumes the whole input.
 */
public class NFASimulator {

    public static <I> boolean accepts(EpsilonNFA<I> nfa, List<? extends I> input) {
        BitSet current = initialStates(nfa);
        for (I symbol : input) {
            current = epsilonClosure(nfa, move(nfa, current, symbol));
        }
        return current.get(nfa.getAccept());
    }

    public static <I> NFATrace<I> trace(EpsilonNFA<I> nfa, List<? extends I> input) {
        final List<NFATrace.Step<I>> steps = new ArrayList<>(input.size() + 1);
        final BitSet start = new BitSet();
        start.set(nfa.getStart());
        BitSet current = epsilonClosure(nfa, start);
        steps.add(new NFATrace.Step<>(0, null, start, current));

        int index = 1;
        for (I symbol : input) {
            final BitSet moved = move(nfa, current, symbol);
            current = epsilonClosure(nfa, moved);
            steps.add(new NFATrace.Step<>(index++, symbol, moved, current));
        }
        return new NFATrace<>(current.get(nfa.getAccept()), steps);
    }

    public static <I> BitSet initialStates(EpsilonNFA<I> nfa) {
        final BitSet start = new BitSet();
        start.set(nfa.getStart());
        return epsilonClosure(nfa, start);
    }

    /**
     * Smallest superset of states closed under epsilon moves. The argument is not modified.
     */
    public static <I> BitSet epsilonClosure(EpsilonNFA<I> nfa, BitSet states) {
        final BitSet closure = (BitSet) states.clone();
        final IntArrayList stack = new IntArrayList();
        for (int i = states.nextSetBit(0); i >= 0; i = states.nextSetBit(i + 1)) {
            stack.push(i);
        }
        while (!stack.isEmpty()) {
            final int state = stack.popInt();
            for (int succ : nfa.getEpsilonSuccessors(state)) {
                if (!closure.get(succ)) {
                    closure.set(succ);
                    stack.push(succ);
                }
            }
        }
        return closure;
    }

    /**
     * Labeled successors of the active states on symbol, without closure.
     */
    public static <I> BitSet move(EpsilonNFA<I> nfa, BitSet current, I symbol) {
        final BitSet next = new BitSet(nfa.size());
        for (int i = current.nextSetBit(0); i >= 0; i = current.nextSetBit(i + 1)) {
            for (int succ : nfa.getTransitions(i, symbol)) {
                next.set(succ);
            }
        }
        return next;
    }
}
