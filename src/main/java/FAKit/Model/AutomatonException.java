package FAKit.Model;

/**
 * Base class of every failure raised by the toolkit. Failures are thrown synchronously and never carry a
 * partial result.
 */
public class AutomatonException extends RuntimeException {

    public AutomatonException(String message) {
        super(message);
    }

    public AutomatonException(String message, Throwable cause) {
        super(message, cause);
    }
}
