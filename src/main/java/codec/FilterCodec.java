package codec;

import membership.Aggregate;
import membership.AggregateOptions;
import membership.AutoGrowingAggregate;
import membership.Filter;
import membership.FilterComponent;
import membership.FilterFactory;
import membership.HashAlgorithm;
import membership.IncompatibleFilterException;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import utilities.BloomLogger;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInput;
import java.io.DataInputStream;
import java.io.DataOutput;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Binary form of filters and composites.
 *
 * <pre>
 * component := tag body
 * tag       := 'F' (filter) | 'A' (aggregate) | 'G' (auto-growing aggregate)
 * F body    := int size, int hashCount, hashCount * UTF identifier, long insertCount,
 *              int wordWidth, int hexLength, hexLength * ASCII hex digit
 * A body    := int schedulerIndex, int schedulerWeight, double threshold,
 *              int childCount, childCount * component
 * G body    := A body
 * </pre>
 *
 * The hex digits encode the packed bit field: byte {@code i / 8} holds bit {@code i}
 * at position {@code i % 8}, least significant bit first.
 * Reading an auto-growing aggregate needs the {@link FilterFactory} it grows with.
 */
public final class FilterCodec {

    static final byte FILTER = 'F';
    static final byte AGGREGATE = 'A';
    static final byte AUTO_GROWING = 'G';

    private final FilterFactory factory;

    public FilterCodec() {
        this(null);
    }

    public FilterCodec(FilterFactory factory) {
        this.factory = factory;
    }

    // =========================================================
    // === Convenience =========================================
    // =========================================================

    public byte[] toBytes(FilterComponent component) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            write(component, out);
        }
        return bytes.toByteArray();
    }

    public FilterComponent fromBytes(byte[] data) throws IOException {
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(data))) {
            return read(in);
        }
    }

    public void save(FilterComponent component, Path file) throws IOException {
        try (OutputStream os = Files.newOutputStream(file);
             DataOutputStream out = new DataOutputStream(os)) {
            write(component, out);
        }
    }

    public FilterComponent load(Path file) throws IOException {
        try (InputStream is = Files.newInputStream(file);
             DataInputStream in = new DataInputStream(is)) {
            return read(in);
        }
    }

    // =========================================================
    // === Write ===============================================
    // =========================================================

    public void write(FilterComponent component, DataOutput out) throws IOException {
        if (component instanceof Filter) {
            out.writeByte(FILTER);
            writeFilter((Filter) component, out);
        } else if (component instanceof Aggregate) {
            out.writeByte(AGGREGATE);
            writeAggregate((Aggregate) component, out);
        } else if (component instanceof AutoGrowingAggregate) {
            out.writeByte(AUTO_GROWING);
            writeAggregate(((AutoGrowingAggregate) component).delegate(), out);
        } else {
            throw new IllegalArgumentException("Cannot serialize filter component of type "
                    + (component == null ? "null" : component.getClass().getName()));
        }
    }

    private void writeFilter(Filter filter, DataOutput out) throws IOException {
        out.writeInt(filter.getSize());
        List<HashAlgorithm> hashes = filter.getHashes();
        out.writeInt(hashes.size());
        for (HashAlgorithm hash : hashes) {
            out.writeUTF(hash.identifier());
        }
        out.writeLong(filter.count());
        out.writeInt(Filter.WORD_WIDTH);

        byte[] hex = filter.toString().getBytes(StandardCharsets.US_ASCII);
        out.writeInt(hex.length);
        out.write(hex);
    }

    private void writeAggregate(Aggregate aggregate, DataOutput out) throws IOException {
        // one consistent snapshot of scheduler state and children
        synchronized (aggregate) {
            out.writeInt(aggregate.schedulerIndex());
            out.writeInt(aggregate.schedulerWeight());
            out.writeDouble(aggregate.options().falseProbabilityThreshold());
            List<FilterComponent> children = aggregate.children();
            out.writeInt(children.size());
            for (FilterComponent child : children) {
                write(child, out);
            }
        }
    }

    // =========================================================
    // === Read ================================================
    // =========================================================

    public FilterComponent read(DataInput in) throws IOException {
        byte tag = in.readByte();
        switch (tag) {
            case FILTER:
                return readFilter(in);
            case AGGREGATE:
                return readAggregate(in);
            case AUTO_GROWING:
                if (factory == null) {
                    throw new IOException("Reading an auto-growing aggregate requires a filter factory");
                }
                return new AutoGrowingAggregate(factory, readAggregate(in));
            default:
                throw new IOException("Unknown filter component tag 0x" + Integer.toHexString(tag & 0xff));
        }
    }

    public Filter readFilter(DataInput in) throws IOException {
        int size = in.readInt();
        if (size <= 0) {
            throw new IOException("Invalid filter size " + size);
        }
        int hashCount = in.readInt();
        if (hashCount <= 0) {
            throw new IOException("Invalid hash algorithm count " + hashCount);
        }
        List<HashAlgorithm> hashes = new ArrayList<>(Math.min(hashCount, HashAlgorithm.values().length));
        for (int i = 0; i < hashCount; i++) {
            String identifier = in.readUTF();
            if (!HashAlgorithm.isSupported(identifier)) {
                throw new IOException("Hash algorithm " + identifier + " is not supported");
            }
            hashes.add(HashAlgorithm.fromIdentifier(identifier));
        }
        long count = in.readLong();
        int wordWidth = in.readInt();
        if (wordWidth != Filter.WORD_WIDTH) {
            BloomLogger.warning("Rejected filter serialized with word width " + wordWidth);
            throw new IncompatibleFilterException(String.format(
                    "Unable to import bloom-filter from %db architecture: current architecture is %db",
                    wordWidth, Filter.WORD_WIDTH));
        }

        int hexLength = in.readInt();
        int expected = 2 * (int) ((size + 7L) / 8);
        if (hexLength != expected) {
            throw new IOException("Bit field of " + hexLength + " hex digits, expected " + expected);
        }
        byte[] hex = new byte[hexLength];
        in.readFully(hex);

        try {
            byte[] bitfield = Hex.decodeHex(new String(hex, StandardCharsets.US_ASCII));
            return Filter.restore(size, hashes, count, bitfield);
        } catch (DecoderException e) {
            throw new IOException("Malformed bit field", e);
        } catch (IllegalArgumentException e) {
            throw new IOException("Inconsistent filter data: " + e.getMessage(), e);
        }
    }

    private Aggregate readAggregate(DataInput in) throws IOException {
        int index = in.readInt();
        int weight = in.readInt();
        double threshold = in.readDouble();
        int childCount = in.readInt();
        if (childCount < 0) {
            throw new IOException("Invalid child count " + childCount);
        }

        AggregateOptions options;
        try {
            options = AggregateOptions.builder().falseProbabilityThreshold(threshold).build();
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid aggregate options: " + e.getMessage(), e);
        }

        List<FilterComponent> children = new ArrayList<>();
        for (int i = 0; i < childCount; i++) {
            children.add(read(in));
        }
        try {
            return Aggregate.restore(options, index, weight, children);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid scheduler state: " + e.getMessage(), e);
        }
    }
}
