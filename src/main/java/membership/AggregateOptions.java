package membership;

// Immutable options shared by Aggregate and AutoGrowingAggregate.
public final class AggregateOptions {

    public static final double DEFAULT_FALSE_PROBABILITY_THRESHOLD = 1.0;

    private static final AggregateOptions DEFAULTS = builder().build();

    private final double falseProbabilityThreshold;

    private AggregateOptions(Builder builder) {
        this.falseProbabilityThreshold = builder.falseProbabilityThreshold;
        validate();
    }

    public static Builder builder() { return new Builder(); }

    public static AggregateOptions defaults() { return DEFAULTS; }

    private void validate() {
        if (!(falseProbabilityThreshold >= 0.0 && falseProbabilityThreshold <= 1.0)) {
            throw new IllegalArgumentException("falseProbabilityThreshold must be in [0,1]");
        }
    }

    /** Children whose false-positive probability is above this value stop receiving inserts. */
    public double falseProbabilityThreshold() { return falseProbabilityThreshold; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregateOptions)) return false;
        return Double.compare(falseProbabilityThreshold, ((AggregateOptions) o).falseProbabilityThreshold) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(falseProbabilityThreshold);
    }

    @Override
    public String toString() {
        return "AggregateOptions{falseProbabilityThreshold=" + falseProbabilityThreshold + "}";
    }

    public static final class Builder {
        private double falseProbabilityThreshold = DEFAULT_FALSE_PROBABILITY_THRESHOLD;

        private Builder() {
        }

        public Builder falseProbabilityThreshold(double falseProbabilityThreshold) {
            this.falseProbabilityThreshold = falseProbabilityThreshold;
            return this;
        }

        public AggregateOptions build() {
            return new AggregateOptions(this);
        }
    }
}
