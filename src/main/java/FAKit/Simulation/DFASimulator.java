package FAKit.Simulation;

import FAKit.Model.NamedDFA;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs words through a {@link NamedDFA}. A symbol outside the alphabet, or a missing transition, rejects the word
 * rather than failing.
 */
public class DFASimulator {

    public static <I> boolean accepts(NamedDFA<I> dfa, List<? extends I> input) {
        return run(dfa, input).accepted();
    }

    public static <I> DFARun run(NamedDFA<I> dfa, List<? extends I> input) {
        final List<String> trace = new ArrayList<>(input.size() + 1);
        String current = dfa.getStart();
        trace.add(current);
        for (I symbol : input) {
            if (!dfa.getInputAlphabet().containsSymbol(symbol)) {
                return new DFARun(false, trace, "Symbol '" + symbol + "' not in alphabet");
            }
            final String next = dfa.getSuccessor(current, symbol);
            if (next == null) {
                return new DFARun(false, trace,
                                  "No transition defined for state '" + current + "' and symbol '" + symbol + "'");
            }
            current = next;
            trace.add(current);
        }
        return new DFARun(dfa.isAccepting(current), trace, null);
    }
}
