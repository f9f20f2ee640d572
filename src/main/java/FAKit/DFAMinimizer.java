package FAKit;

import FAKit.Model.MinimizationResult;
import FAKit.Model.NamedDFA;
import FAKit.Model.ValidationException;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.DFA;
import net.automatalib.automaton.fsa.impl.CompactDFA;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Moore's partition refinement on a total DFA.
 */
public class DFAMinimizer {
    public static boolean DEBUG = false;
    public static final String STATE_PREFIX = "S";

    /**
     * Minimize a total DFA.
     * <p>
     * Starts from the partition [accepting, non-accepting] and splits every block by the signature of its members
     * (block index of the successor, per symbol in alphabet order) until a round splits nothing. Signatures of one
     * round are computed against the partition the round started with. Unreachable states are partitioned like
     * any other state.
     * @param dfa - total DFA, left untouched
     * @return minimal DFA with states S0, S1, ... and the mapping from original states
     * @throws ValidationException if dfa is not total
     */
    public static <I> MinimizationResult<I> minimize(NamedDFA<I> dfa) {
        final String missing = dfa.firstMissingTransition();
        if (missing != null) {
            throw new ValidationException("Minimization requires a total DFA, but " + missing + " is undefined");
        }

        final CompactDFA<I> automaton = dfa.toCompactDFA();
        final DFA<Integer, I> view = automaton;
        final Alphabet<I> alphabet = automaton.getInputAlphabet();
        final int n = automaton.size();
        final int k = alphabet.size();

        final int[][] succ = new int[n][k];
        for (int q = 0; q < n; q++) {
            for (int a = 0; a < k; a++) {
                succ[q][a] = view.getSuccessor(q, alphabet.getSymbol(a));
            }
        }

        List<IntArrayList> partition = initialPartition(automaton, n);
        final int[] blockOf = new int[n];
        boolean stable = false;
        int round = 0;
        while (!stable) {
            assignBlocks(partition, blockOf);
            stable = true;
            final List<IntArrayList> refined = new ArrayList<>(partition.size());
            for (IntArrayList block : partition) {
                final Map<IntArrayList, IntArrayList> splitter = new LinkedHashMap<>();
                for (int q : block) {
                    final IntArrayList signature = new IntArrayList(k);
                    for (int a = 0; a < k; a++) {
                        signature.add(blockOf[succ[q][a]]);
                    }
                    splitter.computeIfAbsent(signature, sig -> new IntArrayList()).add(q);
                }
                if (splitter.size() > 1) {
                    stable = false;
                }
                refined.addAll(splitter.values());
            }
            round++;
            if (DEBUG) {
                System.out.println("DEBUG: Refinement round " + round + ": " + partition.size() + " -> "
                                   + refined.size() + " blocks");
            }
            partition = refined;
        }
        assignBlocks(partition, blockOf);

        return extract(dfa, automaton, partition, blockOf, succ);
    }

    private static <I> List<IntArrayList> initialPartition(CompactDFA<I> automaton, int n) {
        final IntArrayList accepting = new IntArrayList();
        final IntArrayList rejecting = new IntArrayList();
        for (int q = 0; q < n; q++) {
            (automaton.isAccepting(q) ? accepting : rejecting).add(q);
        }
        final List<IntArrayList> partition = new ArrayList<>(2);
        if (!accepting.isEmpty()) {
            partition.add(accepting);
        }
        if (!rejecting.isEmpty()) {
            partition.add(rejecting);
        }
        return partition;
    }

    private static void assignBlocks(List<IntArrayList> partition, int[] blockOf) {
        for (int b = 0; b < partition.size(); b++) {
            for (int q : partition.get(b)) {
                blockOf[q] = b;
            }
        }
    }

    private static <I> MinimizationResult<I> extract(NamedDFA<I> dfa, CompactDFA<I> automaton,
                                                     List<IntArrayList> partition, int[] blockOf, int[][] succ) {
        final Alphabet<I> alphabet = automaton.getInputAlphabet();
        final List<String> original = dfa.getStates();

        final NamedDFA.Builder<I> builder = NamedDFA.builder(alphabet);
        for (int b = 0; b < partition.size(); b++) {
            builder.addState(STATE_PREFIX + b);
        }
        builder.withStart(STATE_PREFIX + blockOf[original.indexOf(dfa.getStart())]);

        for (int b = 0; b < partition.size(); b++) {
            final IntArrayList block = partition.get(b);
            // blocks never mix accepting and rejecting states
            if (automaton.isAccepting(block.getInt(0))) {
                builder.addAccepting(STATE_PREFIX + b);
            }
            // every member agrees on successor blocks, so any representative will do
            final int representative = block.getInt(0);
            for (int a = 0; a < alphabet.size(); a++) {
                builder.addTransition(STATE_PREFIX + b, alphabet.getSymbol(a),
                                      STATE_PREFIX + blockOf[succ[representative][a]]);
            }
        }

        final Map<String, String> mapping = new LinkedHashMap<>();
        for (int q = 0; q < original.size(); q++) {
            mapping.put(original.get(q), STATE_PREFIX + blockOf[q]);
        }
        return new MinimizationResult<>(builder.build(), mapping);
    }
}
