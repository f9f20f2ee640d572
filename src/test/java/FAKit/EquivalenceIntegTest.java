package FAKit;

import FAKit.Model.EquivalenceResult;
import FAKit.Model.NamedDFA;
import FAKit.Simulation.DFASimulator;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.util.automaton.Automata;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

@Tag("IntegTest")
public class EquivalenceIntegTest {
    private static final int SIZE = 6;
    private static final int AMOUNT = 200;

    @Test
    void testAgainstAutomataLib() {
        for (int seed = 0; seed < AMOUNT; seed++) {
            final NamedDFA<Integer> first = RandomDFAs.getRandomNamedDFA(seed, SIZE, false);
            final NamedDFA<Integer> second = RandomDFAs.getRandomNamedDFA(seed + AMOUNT, SIZE, false);
            final CompactDFA<Integer> a1 = first.toCompactDFA();
            final Alphabet<Integer> alphabet = a1.getInputAlphabet();

            final EquivalenceResult<Integer> result = DFAEquivalence.check(first, second);
            Assertions.assertEquals(Automata.testEquivalence(a1, second.toCompactDFA(), alphabet),
                                    result.equivalent());
            if (!result.equivalent()) {
                final List<Integer> word = result.counterexample();
                Assertions.assertNotEquals(DFASimulator.accepts(first, word), DFASimulator.accepts(second, word));
            }
        }
    }

    @Test
    void testSymmetry() {
        for (int seed = 0; seed < AMOUNT; seed++) {
            final NamedDFA<Integer> first = RandomDFAs.getRandomNamedDFA(seed, SIZE, true);
            final NamedDFA<Integer> second = RandomDFAs.getRandomNamedDFA(seed + AMOUNT, SIZE, true);
            final EquivalenceResult<Integer> forward = DFAEquivalence.check(first, second);
            final EquivalenceResult<Integer> backward = DFAEquivalence.check(second, first);
            Assertions.assertEquals(forward.equivalent(), backward.equivalent());
            if (!forward.equivalent()) {
                Assertions.assertEquals(forward.counterexample().size(), backward.counterexample().size());
            }
        }
    }

    @Test
    void testMinimizedAndTotalizedCopies() {
        for (int seed = 0; seed < AMOUNT; seed++) {
            final NamedDFA<Integer> partial = RandomDFAs.getRandomNamedDFA(seed, SIZE, true);
            final NamedDFA<Integer> total = DFATotalizer.totalize(partial, List.of());
            final NamedDFA<Integer> minimal = DFAMinimizer.minimize(total).dfa();
            Assertions.assertTrue(DFAEquivalence.equivalent(partial, total));
            Assertions.assertTrue(DFAEquivalence.equivalent(partial, minimal));
            Assertions.assertTrue(minimal.size() <= total.size());
        }
    }
}
