package FAKit.Model;

/**
 * Thrown when a deterministic automaton is handed a second, different target for the same (state, symbol).
 */
public class NondeterministicTransitionException extends AutomatonException {
    private final String state;
    private final Object symbol;
    private final String existingTarget;
    private final String conflictingTarget;

    public NondeterministicTransitionException(String state, Object symbol, String existingTarget,
                                               String conflictingTarget) {
        super("Nondeterministic transition detected at δ(" + state + ", " + symbol + ") = {" + existingTarget + ", "
              + conflictingTarget + "}. A DFA allows only one target.");
        this.state = state;
        this.symbol = symbol;
        this.existingTarget = existingTarget;
        this.conflictingTarget = conflictingTarget;
    }

    public String getState() {
        return state;
    }

    public Object getSymbol() {
        return symbol;
    }

    public String getExistingTarget() {
        return existingTarget;
    }

    public String getConflictingTarget() {
        return conflictingTarget;
    }
}
