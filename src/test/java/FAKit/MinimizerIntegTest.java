package FAKit;

import FAKit.Model.MinimizationResult;
import FAKit.Model.NamedDFA;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.minimizer.HopcroftMinimizer;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

@Tag("IntegTest")
public class MinimizerIntegTest {
    private static final List<NamedDFA<Integer>> AUTOMATA;

    static {
        final int size = 20;
        final int amount = 300;
        AUTOMATA = new ArrayList<>(amount);
        for (int randomSeed = 0; randomSeed < amount; randomSeed++) {
            AUTOMATA.add(RandomDFAs.getRandomNamedDFA(randomSeed, size, false));
        }
    }

    @Test
    void testAgainstHopcroft() {
        for (NamedDFA<Integer> dfa : AUTOMATA) {
            final CompactDFA<Integer> compact = dfa.toCompactDFA();
            final Alphabet<Integer> alphabet = compact.getInputAlphabet();
            final CompactDFA<Integer> expected = HopcroftMinimizer.minimizeDFA(compact, alphabet);

            final MinimizationResult<Integer> result = DFAMinimizer.minimize(dfa);
            final CompactDFA<Integer> actual = result.dfa().toCompactDFA();

            Assertions.assertEquals(expected.size(), actual.size());
            Assertions.assertTrue(Automata.testEquivalence(compact, actual, alphabet));
        }
    }

    @Test
    void testIdempotent() {
        for (NamedDFA<Integer> dfa : AUTOMATA) {
            final NamedDFA<Integer> once = DFAMinimizer.minimize(dfa).dfa();
            final NamedDFA<Integer> twice = DFAMinimizer.minimize(once).dfa();
            Assertions.assertEquals(once.size(), twice.size());
            Assertions.assertTrue(DFAEquivalence.equivalent(once, twice));
        }
    }

    @Test
    void testMappingCoversEveryState() {
        for (NamedDFA<Integer> dfa : AUTOMATA) {
            final MinimizationResult<Integer> result = DFAMinimizer.minimize(dfa);
            Assertions.assertEquals(dfa.getStates(), new ArrayList<>(result.stateMapping().keySet()));
            for (String original : dfa.getStates()) {
                final String merged = result.stateMapping().get(original);
                Assertions.assertEquals(dfa.isAccepting(original), result.dfa().isAccepting(merged));
            }
            Assertions.assertEquals(result.stateMapping().get(dfa.getStart()), result.dfa().getStart());
        }
    }
}
