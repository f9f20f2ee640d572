package FAKit.Model;

/**
 * Thrown by the regex compiler for unbalanced parentheses, operators lacking operands, or a pattern that does not
 * reduce to exactly one expression.
 */
public class MalformedPatternException extends AutomatonException {

    public MalformedPatternException(String message) {
        super(message);
    }
}
