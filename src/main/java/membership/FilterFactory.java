package membership;

/**
 * Creates the next child of an {@link AutoGrowingAggregate}. Called on the inserting
 * thread, with the aggregate that is about to grow; implementations read its state
 * (child count, total inserts...) to size the new filter and must not modify it.
 */
@FunctionalInterface
public interface FilterFactory {

    FilterComponent create(AutoGrowingAggregate aggregate);
}
