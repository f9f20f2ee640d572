package FAKit.Model;

// Thrown when an automaton definition breaks referential integrity, or when a total DFA is required but not given.
public class ValidationException extends AutomatonException {

    public ValidationException(String message) {
        super(message);
    }
}
