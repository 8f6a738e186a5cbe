package membership;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import scheduling.WeightedRoundRobin;
import utilities.BloomLogger;
import utilities.MathUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A filter made of other filters (plain {@link Filter}s or nested composites).
 * <p>
 * Inserts go to one child picked by weighted round-robin: the higher a child's
 * false-positive probability, the less often it is picked. Children that are full,
 * or whose probability exceeds {@link AggregateOptions#falseProbabilityThreshold()},
 * get no inserts at all. Queries are answered by polling every child.
 * <p>
 * Insert routing and the child list are guarded by the instance lock.
 */
public class Aggregate implements FilterComponent {

    private static final Comparator<FilterComponent> MOST_RELIABLE_FIRST =
            Comparator.comparingDouble(FilterComponent::getFalsePositiveProbability);

    private final List<FilterComponent> children = new ArrayList<>();
    private final WeightedRoundRobin scheduler;
    private final AggregateOptions options;

    public Aggregate() {
        this(AggregateOptions.defaults());
    }

    public Aggregate(AggregateOptions options) {
        this(options, new WeightedRoundRobin());
    }

    private Aggregate(AggregateOptions options, WeightedRoundRobin scheduler) {
        this.options = Objects.requireNonNull(options, "options");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /** Rebuilds an aggregate with a captured scheduler state and its children, in order. */
    public static Aggregate restore(AggregateOptions options,
                                    int schedulerIndex,
                                    int schedulerWeight,
                                    List<? extends FilterComponent> children) {
        Aggregate aggregate = new Aggregate(options, new WeightedRoundRobin(schedulerIndex, schedulerWeight));
        for (FilterComponent child : children) {
            aggregate.attach(child);
        }
        return aggregate;
    }

    /** Appends a child. Children need not share size or hash algorithms. */
    public synchronized Aggregate attach(FilterComponent filter) {
        children.add(Objects.requireNonNull(filter, "filter"));
        return this;
    }

    public synchronized List<FilterComponent> children() {
        return Collections.unmodifiableList(new ArrayList<>(children));
    }

    public synchronized int size() {
        return children.size();
    }

    public AggregateOptions options() { return options; }

    public synchronized int schedulerIndex() { return scheduler.index(); }

    public synchronized int schedulerWeight() { return scheduler.currentWeight(); }

    /**
     * Routes an item to one child.
     *
     * @return {@code OK} with the filter that stored the item, {@code UNDERFLOW} when no
     *         child is attached, {@code OVERFLOW} when no child can take more items
     */
    public synchronized InsertResult tryAdd(Object item) {
        if (children.isEmpty()) {
            BloomLogger.debug("No filter attached to aggregate");
            return InsertResult.underflow();
        }

        int[] weights = weights();
        int offset = MathUtils.sum(weights) > 0 ? scheduler.next(weights) : WeightedRoundRobin.NO_CANDIDATE;
        if (offset == WeightedRoundRobin.NO_CANDIDATE) {
            BloomLogger.debug("All " + children.size() + " attached filters are virtually full");
            return InsertResult.overflow();
        }

        FilterComponent child = children.get(offset);
        if (child instanceof Aggregate) {
            InsertResult nested = ((Aggregate) child).tryAdd(item);
            return nested.isOk() ? nested : InsertResult.overflow();
        }
        return InsertResult.ok(child.add(item));
    }

    /**
     * @throws CapacityException if {@link #tryAdd(Object)} did not place the item
     */
    @Override
    public FilterComponent add(Object item) {
        InsertResult result = tryAdd(item);
        if (result.isOk()) {
            return result.handler();
        }
        String message = switch (result.status()) {
            case UNDERFLOW -> "No filter attached to current aggregator";
            case OVERFLOW -> "All attached filters are virtually full";
            default -> throw new IllegalStateException("Unexpected status " + result.status());
        };
        throw new CapacityException(result.status(), message);
    }

    @Override
    public synchronized boolean has(Object item) {
        for (FilterComponent child : children) {
            if (child.has(item)) return true;
        }
        return false;
    }

    /**
     * Children that may hold the item, most reliable (lowest false-positive
     * probability) first. Empty if no child reports the item.
     */
    public synchronized List<FilterComponent> matches(Object item) {
        List<FilterComponent> positives = new ArrayList<>();
        for (FilterComponent child : children) {
            if (child.has(item)) positives.add(child);
        }
        positives.sort(MOST_RELIABLE_FIRST);
        return positives;
    }

    @Override
    public synchronized boolean isFull() {
        for (FilterComponent child : children) {
            if (!child.isFull()) return false;
        }
        return true;
    }

    @Override
    public synchronized long count() {
        long count = 0;
        for (FilterComponent child : children) {
            count += child.count();
        }
        return count;
    }

    /** Worst false-positive probability among the children. */
    @Override
    public synchronized double getFalsePositiveProbability() {
        double max = 0;
        for (FilterComponent child : children) {
            max = Math.max(max, child.getFalsePositiveProbability());
        }
        return max;
    }

    /**
     * Scheduling weight per child: {@code 100 - round(p * 100)}, or 0 when the child
     * is full or above the false-positive threshold.
     */
    public synchronized int[] weights() {
        IntArrayList weights = new IntArrayList(children.size());
        for (FilterComponent child : children) {
            double probability = child.getFalsePositiveProbability();
            int weight = (int) (100 - Math.round(probability * 100));

            if (probability > options.falseProbabilityThreshold()) weight = 0;
            if (child.isFull()) weight = 0;

            weights.add(weight);
        }
        return weights.toIntArray();
    }

    @Override
    public synchronized String toString() {
        return getClass().getSimpleName() + "{children=" + children.size()
                + ", count=" + count() + ", scheduler=" + scheduler + "}";
    }
}
