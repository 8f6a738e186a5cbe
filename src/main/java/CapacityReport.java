import membership.Filter;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.openjdk.jol.info.GraphLayout;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Compares the estimated capacity of optimum filters with what they actually hold.
 * For every target probability, a filter is sized for {@code --items} items and fed
 * consecutive integers until its false-positive probability reaches the target.
 * <p>
 * Output columns: target probability (hash count) : size - estimated capacity -
 * actual inserts : deviation of the estimate [: retained bytes].
 */
public final class CapacityReport {

    private CapacityReport() {}

    public static void main(String[] args) {
        Options options = Options.parse(args);
        for (Row row : run(options)) {
            System.out.println(row.format());
        }
    }

    public static List<Row> run(Options options) {
        RandomGenerator rng = new Well19937c(options.seed());
        List<Row> rows = new ArrayList<>();

        // integer steps avoid drifting away from the requested probabilities
        int from = (int) Math.round(options.from() * 100);
        int to = (int) Math.round(options.to() * 100);
        int step = Math.max(1, (int) Math.round(options.step() * 100));
        for (int percent = from; percent <= to; percent += step) {
            double p = percent / 100.0;
            Filter filter = Filter.getOptimumFilter(p, options.items(), rng);
            double capacity = filter.estimateCapacity(p);

            int inserted = 0;
            while (filter.getFalsePositiveProbability() < p) {
                filter.add(inserted++);
            }

            long retained = options.memory() ? GraphLayout.parseInstance(filter).totalSize() : -1L;
            rows.add(new Row(p, filter.getHashes().size(), filter.getSize(), capacity, inserted, retained));
        }
        return rows;
    }

    public record Row(double probability, int hashCount, int size, double estimatedCapacity, int inserted, long retainedBytes) {

        /** Relative error of the capacity estimate against the observed inserts, in percent. */
        public double deviation() {
            return inserted == 0 ? 0.0 : ((estimatedCapacity - inserted) / inserted) * 100;
        }

        public String format() {
            String line = String.format(Locale.ROOT, "%3d%% (%d) : %5d - %5d - %5d : %4d%%",
                    Math.round(probability * 100), hashCount, size, (long) estimatedCapacity, inserted, (long) deviation());
            return retainedBytes < 0 ? line : line + String.format(Locale.ROOT, " : %d B", retainedBytes);
        }
    }

    public record Options(long items, double from, double to, double step, long seed, boolean memory) {

        public Options {
            if (items <= 0) throw new IllegalArgumentException("--items must be positive");
            if (!(from > 0 && from < 1)) throw new IllegalArgumentException("--from must be in (0,1)");
            if (!(to > 0 && to < 1)) throw new IllegalArgumentException("--to must be in (0,1)");
            if (from > to) throw new IllegalArgumentException("--from must not exceed --to");
            if (step <= 0) throw new IllegalArgumentException("--step must be positive");
        }

        public static Options parse(String[] args) {
            long items = 1000;
            double from = 0.01;
            double to = 0.99;
            double step = 0.01;
            long seed = 42L;
            boolean memory = false;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (!arg.startsWith("--")) continue;
                String key;
                String value;
                int eq = arg.indexOf('=');
                if (eq >= 0) {
                    key = arg.substring(2, eq);
                    value = arg.substring(eq + 1);
                } else {
                    key = arg.substring(2);
                    if (i + 1 >= args.length) throw new IllegalArgumentException("Missing value for option --" + key);
                    value = args[++i];
                }

                switch (key) {
                    case "items", "n" -> items = Long.parseLong(value);
                    case "from" -> from = Double.parseDouble(value);
                    case "to" -> to = Double.parseDouble(value);
                    case "step" -> step = Double.parseDouble(value);
                    case "seed" -> seed = Long.parseLong(value);
                    case "memory", "mem" -> memory = Boolean.parseBoolean(value);
                    default -> throw new IllegalArgumentException("Unknown option --" + key);
                }
            }
            return new Options(items, from, to, step, seed, memory);
        }
    }
}
