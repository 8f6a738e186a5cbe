package membership;

import utilities.BloomLogger;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate that never rejects an insert: whenever the wrapped {@link Aggregate} reports
 * underflow or overflow, a new child is obtained from the {@link FilterFactory},
 * attached, and the insert is retried. There is no bound on the number of children.
 */
public class AutoGrowingAggregate implements FilterComponent {

    private final Aggregate aggregate;
    private final FilterFactory factory;

    public AutoGrowingAggregate(FilterFactory factory) {
        this(factory, AggregateOptions.defaults());
    }

    public AutoGrowingAggregate(FilterFactory factory, AggregateOptions options) {
        this(factory, new Aggregate(options));
    }

    /** Wraps an existing aggregate, e.g. one read back by the codec. */
    public AutoGrowingAggregate(FilterFactory factory, Aggregate aggregate) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.aggregate = Objects.requireNonNull(aggregate, "aggregate");
    }

    @Override
    public synchronized FilterComponent add(Object item) {
        while (true) {
            InsertResult result = aggregate.tryAdd(item);
            if (result.isOk()) {
                return result.handler();
            }
            grow(result.status());
        }
    }

    private void grow(InsertResult.Status cause) {
        FilterComponent filter = factory.create(this);
        if (filter == null) {
            throw new IllegalStateException("Filter factory returned null");
        }
        // a child that starts ineligible would make the retry loop spin forever
        if (filter.isFull() || filter.getFalsePositiveProbability() > options().falseProbabilityThreshold()) {
            throw new IllegalStateException("Filter factory produced a filter that cannot take items: " + filter);
        }
        aggregate.attach(filter);
        BloomLogger.info("Aggregate grew to " + aggregate.size() + " filters after " + cause
                + " (" + aggregate.count() + " items so far)");
    }

    public AutoGrowingAggregate attach(FilterComponent filter) {
        aggregate.attach(filter);
        return this;
    }

    @Override
    public boolean has(Object item) {
        return aggregate.has(item);
    }

    /** @see Aggregate#matches(Object) */
    public List<FilterComponent> matches(Object item) {
        return aggregate.matches(item);
    }

    /** Always {@code false}: a new child is attached whenever the current ones are full. */
    @Override
    public boolean isFull() {
        return false;
    }

    @Override
    public long count() {
        return aggregate.count();
    }

    @Override
    public double getFalsePositiveProbability() {
        return aggregate.getFalsePositiveProbability();
    }

    public List<FilterComponent> children() {
        return aggregate.children();
    }

    public int size() {
        return aggregate.size();
    }

    public AggregateOptions options() {
        return aggregate.options();
    }

    /** The wrapped aggregate. */
    public Aggregate delegate() {
        return aggregate;
    }

    @Override
    public String toString() {
        return "AutoGrowingAggregate{" + aggregate + "}";
    }
}
