package membership;

/**
 * Thrown by {@link Aggregate#add(Object)} when the insert could not be routed to any child.
 */
public class CapacityException extends RuntimeException {

    private final InsertResult.Status status;

    public CapacityException(InsertResult.Status status, String message) {
        super(message);
        if (status == InsertResult.Status.OK) {
            throw new IllegalArgumentException("OK is not a capacity failure");
        }
        this.status = status;
    }

    public InsertResult.Status status() {
        return status;
    }

    public boolean isUnderflow() { return status == InsertResult.Status.UNDERFLOW; }

    public boolean isOverflow() { return status == InsertResult.Status.OVERFLOW; }
}
