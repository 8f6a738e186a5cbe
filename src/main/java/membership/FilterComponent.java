package membership;

/**
 * Capability set shared by a single {@link Filter} and the composites built from
 * filters ({@link Aggregate}, {@link AutoGrowingAggregate}).
 * Items are identified by their canonical string form, {@code String.valueOf(item)}.
 */
public interface FilterComponent {

    /**
     * Inserts an item.
     *
     * @return the filter that stored the item
     * @throws CapacityException when a composite has no child able to take the item
     */
    FilterComponent add(Object item);

    /** {@code false} means the item was certainly never added. */
    boolean has(Object item);

    boolean isFull();

    /** Number of insertions, duplicates included. */
    long count();

    double getFalsePositiveProbability();
}
