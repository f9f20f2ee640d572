package FAKit;

import FAKit.Model.EquivalenceResult;
import FAKit.Model.EquivalenceResult.StatePair;
import FAKit.Model.NamedDFA;
import it.unimi.dsi.fastutil.ints.IntIntImmutablePair;
import it.unimi.dsi.fastutil.ints.IntIntPair;
import it.unimi.dsi.fastutil.longs.Long2IntMap;
import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2LongMap;
import it.unimi.dsi.fastutil.longs.Long2LongOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongSet;
import net.automatalib.automaton.fsa.DFA;
import net.automatalib.automaton.fsa.impl.CompactDFA;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Language equivalence of two DFAs, which may be partial and may use different alphabets.
 */
public class DFAEquivalence {

    public static <I> boolean equivalent(NamedDFA<I> first, NamedDFA<I> second) {
        return check(first, second).equivalent();
    }

    /**
     * Complete both automata over the union alphabet, then explore the product breadth-first from the pair of
     * start states. Stops at the first pair where exactly one side accepts. Both automata were validated when they
     * were built.
     * <p>
     * Bookkeeping is proportional to the reachable pairs, not to the full product.
     * @param first - first DFA, left untouched
     * @param second - second DFA, left untouched
     * @return verdict with the explored pairs, and on a difference, the distinguishing pair and a shortest word
     *     accepted by exactly one of the two
     */
    public static <I> EquivalenceResult<I> check(NamedDFA<I> first, NamedDFA<I> second) {
        final Set<I> union = new LinkedHashSet<>(first.getInputAlphabet());
        union.addAll(second.getInputAlphabet());
        final List<I> symbols = new ArrayList<>(union);

        final NamedDFA<I> total1 = DFATotalizer.totalize(first, union);
        final NamedDFA<I> total2 = DFATotalizer.totalize(second, union);
        final CompactDFA<I> a1 = total1.toCompactDFA();
        final CompactDFA<I> a2 = total2.toCompactDFA();
        final DFA<Integer, I> dfa1 = a1;
        final DFA<Integer, I> dfa2 = a2;

        final int n2 = a2.size();
        final LongSet visited = new LongOpenHashSet();
        // BFS tree, for reconstructing the counterexample
        final Long2LongMap parent = new Long2LongOpenHashMap();
        final Long2IntMap parentSymbol = new Long2IntOpenHashMap();

        final List<StatePair> explored = new ArrayList<>();
        final Deque<IntIntPair> queue = new ArrayDeque<>();
        final IntIntPair init = IntIntImmutablePair.of(dfa1.getInitialState(), dfa2.getInitialState());
        visited.add(key(init, n2));
        queue.add(init);

        while (!queue.isEmpty()) {
            final IntIntPair curr = queue.poll();
            final int q1 = curr.leftInt();
            final int q2 = curr.rightInt();
            final long currKey = key(curr, n2);
            final StatePair names = new StatePair(total1.getStates().get(q1), total2.getStates().get(q2));
            explored.add(names);

            if (a1.isAccepting(q1) != a2.isAccepting(q2)) {
                return new EquivalenceResult<>(false, explored, names,
                                               counterexample(currKey, parent, parentSymbol, symbols));
            }

            for (int a = 0; a < symbols.size(); a++) {
                final I sym = symbols.get(a);
                final IntIntPair succ = IntIntImmutablePair.of(dfa1.getSuccessor(q1, sym), dfa2.getSuccessor(q2, sym));
                final long succKey = key(succ, n2);
                if (visited.add(succKey)) {
                    parent.put(succKey, currKey);
                    parentSymbol.put(succKey, a);
                    queue.add(succ);
                }
            }
        }
        return new EquivalenceResult<>(true, explored, null, null);
    }

    private static long key(IntIntPair pair, int n2) {
        return (long) pair.leftInt() * n2 + pair.rightInt();
    }

    private static <I> List<I> counterexample(long key, Long2LongMap parent, Long2IntMap parentSymbol,
                                              List<I> symbols) {
        final List<I> word = new ArrayList<>();
        for (long k = key; parent.containsKey(k); k = parent.get(k)) {
            word.add(symbols.get(parentSymbol.get(k)));
        }
        Collections.reverse(word);
        return word;
    }
}
