package membership;

import java.util.Objects;

/**
 * Outcome of {@link Aggregate#tryAdd(Object)}. Only {@link Status#OK} carries the
 * filter that stored the item; the other two ask the caller to grow the aggregate.
 */
public final class InsertResult {

    public enum Status {
        OK,
        // no child attached yet
        UNDERFLOW,
        // every child is full or above the false-positive threshold
        OVERFLOW
    }

    private static final InsertResult UNDERFLOW = new InsertResult(Status.UNDERFLOW, null);
    private static final InsertResult OVERFLOW = new InsertResult(Status.OVERFLOW, null);

    private final Status status;
    private final FilterComponent handler;

    private InsertResult(Status status, FilterComponent handler) {
        this.status = status;
        this.handler = handler;
    }

    public static InsertResult ok(FilterComponent handler) {
        return new InsertResult(Status.OK, Objects.requireNonNull(handler, "handler"));
    }

    public static InsertResult underflow() { return UNDERFLOW; }

    public static InsertResult overflow() { return OVERFLOW; }

    public Status status() { return status; }

    public boolean isOk() { return status == Status.OK; }

    public boolean needsGrowth() { return status != Status.OK; }

    public FilterComponent handler() {
        if (handler == null) {
            throw new IllegalStateException("No handler for an insert that ended with " + status);
        }
        return handler;
    }

    @Override
    public String toString() {
        return isOk() ? "OK(" + handler + ")" : status.name();
    }
}
