package utilities;

import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import org.apache.commons.math3.util.ArithmeticUtils;

public final class  MathUtils {
    private MathUtils() {
        throw new AssertionError("MathUtils must not be instantiated");
    }

    public static final double LN2 = Math.log(2);
    public static final double LN2_SQUARED = LN2 * LN2;

    /**
     * Greatest common divisor of a set of non-negative integers.
     * Values are deduplicated and reduced in ascending order; the reduction stops
     * as soon as the running gcd reaches 1. Zeros do not contribute (gcd(0, b) = b),
     * and a set made only of zeros yields 0.
     */
    public static int gcd(int... values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("gcd requires at least one value");
        }
        IntSortedSet sorted = new IntRBTreeSet();
        for (int v : values) {
            if (v < 0) throw new IllegalArgumentException("gcd is defined here for non-negative values only: " + v);
            sorted.add(v);
        }

        IntIterator it = sorted.iterator();
        int a = it.nextInt();
        while (it.hasNext()) {
            int b = it.nextInt();
            // ArithmeticUtils.gcd guards the zero divisor: gcd(0, b) == b, gcd(0, 0) == 0
            a = ArithmeticUtils.gcd(a, b);
            if (a == 1) break;
        }
        return a;
    }

    public static int max(int[] values) {
        int max = Integer.MIN_VALUE;
        for (int v : values) {
            if (v > max) max = v;
        }
        return max;
    }

    public static long sum(int[] values) {
        long sum = 0;
        for (int v : values) sum += v;
        return sum;
    }

    // p must be a probability, i.e. in [0,1]
    public static void checkProbability(double probability) {
        if (!(probability >= 0.0 && probability <= 1.0)) {
            throw new IllegalArgumentException("False positive probability cannot be negative or greater than 1: " + probability);
        }
    }
}
