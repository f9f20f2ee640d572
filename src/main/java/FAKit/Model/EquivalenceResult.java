package FAKit.Model;

import java.util.List;

/**
 * Outcome of a product exploration of two DFAs.
 *
 * @param equivalent - verdict
 * @param visitedPairs - product states in the order they were examined
 * @param mismatch - first pair whose acceptance differs, null when equivalent
 * @param counterexample - a shortest word accepted by exactly one automaton, null when equivalent
 */
public record EquivalenceResult<I>(boolean equivalent, List<StatePair> visitedPairs, StatePair mismatch,
                                   List<I> counterexample) {

    public EquivalenceResult {
        visitedPairs = List.copyOf(visitedPairs);
        counterexample = counterexample == null ? null : List.copyOf(counterexample);
    }

    public record StatePair(String first, String second) {
        @Override
        public String toString() {
            return "(" + first + ", " + second + ")";
        }
    }
}
