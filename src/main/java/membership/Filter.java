package membership;

import it.unimi.dsi.fastutil.ints.IntIterable;
import it.unimi.dsi.fastutil.ints.IntIterator;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.util.MathArrays;
import utilities.BloomLogger;
import utilities.MathUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.zip.CRC32;

/**
 * Bloom filter over a fixed-size bit array. Every configured {@link HashAlgorithm}
 * contributes one bit position per item: the CRC-32 of the item's digest, read as an
 * unsigned 32-bit value, modulo the filter size.
 * <p>
 * A filter never forgets: bits only go from 0 to 1. Meant for a single writer.
 */
public class Filter implements FilterComponent {

    /**
     * Width tag written next to serialized bits. Positions are folded through an unsigned
     * 32-bit checksum held in a 64-bit long, independent of the host word size.
     */
    public static final int WORD_WIDTH = Long.SIZE;

    private final int size;
    private final List<HashAlgorithm> hashes;
    private final BitSet bits;
    private long count;

    public Filter(int size, List<HashAlgorithm> hashes) {
        this(size, hashes, new BitSet(Math.max(size, 0)), 0L);
    }

    /** Same as {@link #Filter(int, List)} with algorithms given by identifier, e.g. {@code "sha256"}. */
    public Filter(int size, String... hashes) {
        this(size, HashAlgorithm.fromIdentifiers(Arrays.asList(hashes)));
    }

    private Filter(int size, List<HashAlgorithm> hashes, BitSet bits, long count) {
        if (size <= 0) {
            throw new IllegalArgumentException("Size cannot be negative or null");
        }
        if (hashes == null || hashes.isEmpty()) {
            throw new IllegalArgumentException("You must provide at least one hash algorithm");
        }
        for (HashAlgorithm hash : hashes) {
            if (hash == null) throw new IllegalArgumentException("Hash algorithm must not be null");
        }
        if (count < 0) {
            throw new IllegalArgumentException("Insert count cannot be negative");
        }
        this.size = size;
        this.hashes = Collections.unmodifiableList(new ArrayList<>(hashes));
        this.bits = bits;
        this.count = count;
    }

    /**
     * Rebuilds a filter from its persisted parts.
     *
     * @param bitfield packed bits, bit {@code i} at byte {@code i / 8}, least significant bit first
     */
    public static Filter restore(int size, List<HashAlgorithm> hashes, long count, byte[] bitfield) {
        Objects.requireNonNull(bitfield, "bitfield");
        if (bitfield.length != byteLength(size)) {
            throw new IllegalArgumentException("Bit field holds " + bitfield.length
                    + " bytes, a filter of " + size + " bits needs " + byteLength(size));
        }
        BitSet bits = BitSet.valueOf(bitfield);
        if (bits.length() > size) {
            throw new IllegalArgumentException("Bit field sets bit " + (bits.length() - 1) + " beyond size " + size);
        }
        return new Filter(size, hashes, bits, count);
    }

    // =========================================================
    // === Sizing ==============================================
    // =========================================================

    /**
     * Optimal number of bits for a target false-positive probability and capacity:
     * {@code -(n * ln p) / (ln 2)^2}.
     *
     * @throws IllegalArgumentException if the item count is negative or p is outside [0,1]
     * @throws ArithmeticException      if p is exactly 0 or 1, where the formula is undefined
     */
    public static double getOptimalSize(double probability, long itemsCount) {
        if (itemsCount < 0) {
            throw new IllegalArgumentException("Item count cannot be negative");
        }
        MathUtils.checkProbability(probability);
        if (probability == 0.0 || probability == 1.0) {
            throw new ArithmeticException("Unable to calculate size for false positive probability of " + probability);
        }
        return -(itemsCount * Math.log(probability)) / MathUtils.LN2_SQUARED;
    }

    /**
     * Optimal number of hash functions for a size (bits) and capacity:
     * {@code max((m / n) * ln 2, 1)}. With no items the result is infinite.
     */
    public static double getOptimalNumberOfHashFunctions(double size, long itemsCount) {
        if (size < 0) {
            throw new IllegalArgumentException("Size cannot be negative");
        }
        if (itemsCount < 0) {
            throw new IllegalArgumentException("Item count cannot be negative");
        }
        return Math.max((size / itemsCount) * MathUtils.LN2, 1);
    }

    public static Filter getOptimumFilter(double probability, long itemsCount) {
        return getOptimumFilter(probability, itemsCount, new Well19937c());
    }

    /**
     * Builds a filter sized for the target probability and capacity, with hash
     * algorithms drawn at random (without repetition) from the registry.
     */
    public static Filter getOptimumFilter(double probability, long itemsCount, RandomGenerator rng) {
        double optimalSize = getOptimalSize(probability, itemsCount);
        if (optimalSize > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Filter of " + optimalSize + " bits exceeds the maximum bit array size");
        }
        int size = (int) Math.ceil(optimalSize);

        HashAlgorithm[] registry = HashAlgorithm.values();
        long wanted = Math.round(getOptimalNumberOfHashFunctions(size, itemsCount));
        int k = (int) Math.min(wanted, registry.length);
        if (k < wanted) {
            BloomLogger.warning("Optimal filter needs " + wanted + " hash functions, only "
                    + registry.length + " are available");
        }

        int[] order = MathArrays.natural(registry.length);
        MathArrays.shuffle(order, rng);
        List<HashAlgorithm> picked = new ArrayList<>(k);
        for (int i = 0; i < k; i++) {
            picked.add(registry[order[i]]);
        }
        return new Filter(size, picked);
    }

    // =========================================================
    // === Membership ==========================================
    // =========================================================

    /**
     * Bit positions of an item, one per hash algorithm and in algorithm order.
     * Positions are computed while iterating; every iteration recomputes them.
     */
    public IntIterable hash(Object item) {
        final byte[] data = canonicalBytes(item);
        return new IntIterable() {
            @Override
            public IntIterator iterator() {
                return new PositionIterator(data);
            }
        };
    }

    @Override
    public Filter add(Object item) {
        IntIterator it = hash(item).iterator();
        while (it.hasNext()) {
            bits.set(it.nextInt());
        }
        count++;
        return this;
    }

    @Override
    public boolean has(Object item) {
        IntIterator it = hash(item).iterator();
        while (it.hasNext()) {
            if (!bits.get(it.nextInt())) return false;
        }
        return true;
    }

    /**
     * Number of the item's positions that are still unset. Zero means the item
     * is present (or a false positive).
     */
    public int distanceWith(Object item) {
        int distance = 0;
        IntIterator it = hash(item).iterator();
        while (it.hasNext()) {
            if (!bits.get(it.nextInt())) distance++;
        }
        return distance;
    }

    public boolean isSet(int position) {
        if (position < 0 || position >= size) {
            throw new IndexOutOfBoundsException("Position " + position + " outside [0," + size + ")");
        }
        return bits.get(position);
    }

    @Override
    public boolean isFull() {
        return bits.nextClearBit(0) >= size;
    }

    @Override
    public long count() {
        return count;
    }

    /** {@code (1 - e^(-k n / m))^k}. */
    @Override
    public double getFalsePositiveProbability() {
        double m = size;
        double n = count;
        int k = hashes.size();
        return Math.pow(1 - Math.exp(-k * n / m), k);
    }

    /**
     * Estimated number of distinct items the filter takes before reaching the given
     * false-positive probability.
     */
    public double estimateCapacity(double probability) {
        MathUtils.checkProbability(probability);
        if (probability == 1.0) return Double.POSITIVE_INFINITY;
        if (probability == 0.0) return 0.0;
        return -(size * MathUtils.LN2_SQUARED) / Math.log(probability);
    }

    public double estimateFillRate(double probability) {
        if (count == 0) return 0.0;
        return count / estimateCapacity(probability);
    }

    // =========================================================
    // === Set operations ======================================
    // =========================================================

    public Filter union(Filter other) {
        checkCompatible(other, "union");
        BitSet merged = (BitSet) bits.clone();
        merged.or(other.bits);
        return new Filter(size, hashes, merged, 0L);
    }

    public Filter intersect(Filter other) {
        checkCompatible(other, "intersection");
        BitSet merged = (BitSet) bits.clone();
        merged.and(other.bits);
        return new Filter(size, hashes, merged, 0L);
    }

    private void checkCompatible(Filter other, String operation) {
        Objects.requireNonNull(other, "other");
        if (!hashes.equals(other.hashes)) {
            throw new IncompatibleFilterException("Cannot compute " + operation
                    + " of bloom-filters with different sets of hash functions");
        }
        if (size != other.size) {
            throw new IncompatibleFilterException("Cannot compute " + operation
                    + " of bloom-filters with different sizes");
        }
    }

    // =========================================================
    // === Accessors / export ==================================
    // =========================================================

    public int getSize() { return size; }

    public List<HashAlgorithm> getHashes() { return hashes; }

    public int cardinality() { return bits.cardinality(); }

    /** Packed bits, {@code ceil(size / 8)} bytes, least significant bit first within each byte. */
    public byte[] toByteArray() {
        return Arrays.copyOf(bits.toByteArray(), byteLength(size));
    }

    /** Bit field as fixed-length lower-case hex, two characters per byte. */
    @Override
    public String toString() {
        return Hex.encodeHexString(toByteArray());
    }

    static int byteLength(int size) {
        return (int) ((size + 7L) / 8);
    }

    private static byte[] canonicalBytes(Object item) {
        return String.valueOf(item).getBytes(StandardCharsets.UTF_8);
    }

    private final class PositionIterator implements IntIterator {
        private final byte[] data;
        private int next = 0;

        PositionIterator(byte[] data) {
            this.data = data;
        }

        @Override
        public boolean hasNext() {
            return next < hashes.size();
        }

        @Override
        public int nextInt() {
            if (!hasNext()) throw new NoSuchElementException();
            CRC32 crc = new CRC32();
            crc.update(hashes.get(next++).digest(data));
            return (int) (crc.getValue() % size);
        }
    }
}
