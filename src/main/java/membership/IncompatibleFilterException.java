package membership;

/**
 * Raised when two filters cannot be combined, or when serialized filter data was
 * produced with a hash folding width this build does not use.
 */
public class IncompatibleFilterException extends RuntimeException {

    public IncompatibleFilterException(String message) {
        super(message);
    }
}
