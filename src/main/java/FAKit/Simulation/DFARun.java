package FAKit.Simulation;

import java.util.List;

/**
 * Outcome of running a word through a DFA.
 *
 * @param accepted - whether the whole word was read and the run ended in an accepting state
 * @param trace - visited states, starting with the start state
 * @param error - why the run stopped early, or null if the whole word was read
 */
public record DFARun(boolean accepted, List<String> trace, String error) {

    public DFARun {
        trace = List.copyOf(trace);
    }

    public String lastState() {
        return trace.get(trace.size() - 1);
    }
}
