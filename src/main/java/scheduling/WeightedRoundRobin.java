package scheduling;

import utilities.MathUtils;

/**
 * Weighted round-robin selection, after the LVS scheduler
 * (http://kb.linuxvirtualserver.org/wiki/Weighted_Round-Robin_Scheduling).
 * <p>
 * Over a scheduling window every index is picked with a frequency proportional to
 * its weight, and picks of heavy indexes are spread across the cycle instead of
 * being emitted back to back. The {@code (index, currentWeight)} pair survives
 * between calls, so consecutive calls continue the same cycle even when the
 * weight vector changes in between.
 * <p>
 * Not thread-safe; the owner serializes calls to {@link #next(int[])}.
 */
public final class WeightedRoundRobin {

    public static final int NO_CANDIDATE = -1;

    private int index;
    private int currentWeight;

    public WeightedRoundRobin() {
        this(-1, 0);
    }

    /** Restores a scheduler from a previously captured state. */
    public WeightedRoundRobin(int index, int currentWeight) {
        if (index < -1) throw new IllegalArgumentException("index must be >= -1");
        this.index = index;
        this.currentWeight = currentWeight;
    }

    /**
     * Picks the next index for the given weights.
     *
     * @param weights non-negative weight per candidate
     * @return the selected index, or {@link #NO_CANDIDATE} when the vector is empty
     *         or every weight is zero
     */
    public int next(int[] weights) {
        int n = weights.length;
        if (n == 0 || MathUtils.max(weights) == 0) return NO_CANDIDATE;

        while (true) {
            index = (index + 1) % n;
            if (index == 0) {
                currentWeight -= MathUtils.gcd(weights);
                if (currentWeight <= 0) {
                    currentWeight = MathUtils.max(weights);
                }
            }
            if (weights[index] >= currentWeight) return index;
        }
    }

    public int index() { return index; }

    public int currentWeight() { return currentWeight; }

    @Override
    public String toString() {
        return "WeightedRoundRobin{index=" + index + ", currentWeight=" + currentWeight + "}";
    }
}
