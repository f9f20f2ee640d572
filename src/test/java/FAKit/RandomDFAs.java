package FAKit;

import FAKit.Model.NamedDFA;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.common.util.random.RandomUtil;

import java.util.Random;

public class RandomDFAs {
    /**
     * Generate a random DFA in which every state is reachable.
     * <p>
     * Symbol 0 moves state q to q+1 (the last state loops), so the whole automaton is connected from state 0.
     * The remaining transitions point to uniformly chosen states.
     *
     * @param r
     *      random instance
     * @param size
     *      number of states
     * @param alphabetSize
     *      number of symbols, at least 1
     * @param acceptNum
     *      number of accepting states
     * @param partial
     *      if true, roughly a quarter of the non-chain transitions are left undefined
     * @return
     *      a random DFA over {@code 0 .. alphabetSize-1}
     */
    public static CompactDFA<Integer> generateDFA(Random r, int size, int alphabetSize, int acceptNum, boolean partial) {
        assert size > 0 && alphabetSize > 0;
        assert acceptNum >= 0 && acceptNum <= size;

        final Alphabet<Integer> alphabet = Alphabets.integers(0, alphabetSize - 1);
        final CompactDFA<Integer> result = new CompactDFA<>(alphabet);
        for (int i = 0; i < size; i++) {
            result.addState(false);
        }
        result.setInitialState(0);
        for (int f : RandomUtil.distinctIntegers(r, acceptNum, size)) {
            result.setAccepting(f, true);
        }

        for (int q = 0; q < size; q++) {
            result.setTransition(q, 0, Math.min(q + 1, size - 1));
            for (int a = 1; a < alphabetSize; a++) {
                if (!partial || r.nextInt(4) != 0) {
                    result.setTransition(q, a, r.nextInt(size));
                }
            }
        }
        return result;
    }

    public static NamedDFA<Integer> getRandomNamedDFA(int randomSeed, int size, boolean partial) {
        final Random random = new Random(randomSeed);
        final int acceptNum = 1 + random.nextInt(size);
        final CompactDFA<Integer> dfa = generateDFA(random, size, 2, acceptNum, partial);
        return NamedDFA.fromAutomaton(dfa, dfa.getInputAlphabet(), "q");
    }
}
