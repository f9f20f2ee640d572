package FAKit.Simulation;

import FAKit.BitSetUtils;
import FAKit.Model.EpsilonNFA;

import java.util.BitSet;
import java.util.List;

/**
 * Step-by-step record of an NFA simulation. Step 0 holds the closure of the start state and has no symbol.
 */
public record NFATrace<I>(boolean accepted, List<Step<I>> steps) {

    public NFATrace {
        steps = List.copyOf(steps);
    }

    public BitSet finalStates() {
        return steps.get(steps.size() - 1).activeStates();
    }

    /**
     * The state sets are copied on the way in and on the way out.
     */
    public record Step<I>(int index, I symbol, BitSet moved, BitSet activeStates) {

        public Step {
            moved = (BitSet) moved.clone();
            activeStates = (BitSet) activeStates.clone();
        }

        @Override
        public BitSet moved() {
            return (BitSet) moved.clone();
        }

        @Override
        public BitSet activeStates() {
            return (BitSet) activeStates.clone();
        }

        public String describe() {
            if (symbol == null) {
                return "Initial state: " + EpsilonNFA.EPSILON + "-closure(" + BitSetUtils.toStateString(moved) + ") = "
                       + BitSetUtils.toStateString(activeStates);
            }
            return "Read '" + symbol + "': " + EpsilonNFA.EPSILON + "-closure(" + BitSetUtils.toStateString(moved)
                   + ") = " + BitSetUtils.toStateString(activeStates);
        }
    }
}
