package membership;

import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.codec.digest.MessageDigestAlgorithms;
import org.apache.commons.codec.digest.MurmurHash3;
import org.apache.commons.codec.digest.XXHash32;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed registry of the digest algorithms a {@link Filter} can derive bit positions from.
 * The identifier is what gets written to serialized filters, so it must never change
 * for an existing constant.
 */
public enum HashAlgorithm {

    MD2("md2", MessageDigestAlgorithms.MD2),
    MD5("md5", MessageDigestAlgorithms.MD5),
    SHA1("sha1", MessageDigestAlgorithms.SHA_1),
    SHA224("sha224", MessageDigestAlgorithms.SHA_224),
    SHA256("sha256", MessageDigestAlgorithms.SHA_256),
    SHA384("sha384", MessageDigestAlgorithms.SHA_384),
    SHA512_224("sha512/224", MessageDigestAlgorithms.SHA_512_224),
    SHA512_256("sha512/256", MessageDigestAlgorithms.SHA_512_256),
    SHA512("sha512", MessageDigestAlgorithms.SHA_512),
    SHA3_224("sha3-224", MessageDigestAlgorithms.SHA3_224),
    SHA3_256("sha3-256", MessageDigestAlgorithms.SHA3_256),
    SHA3_384("sha3-384", MessageDigestAlgorithms.SHA3_384),
    SHA3_512("sha3-512", MessageDigestAlgorithms.SHA3_512),
    MURMUR3_32("murmur3a", null) {
        @Override
        public byte[] digest(byte[] data) {
            return ByteBuffer.allocate(Integer.BYTES).putInt(MurmurHash3.hash32x86(data)).array();
        }
    },
    MURMUR3_128("murmur3f", null) {
        @Override
        public byte[] digest(byte[] data) {
            long[] h = MurmurHash3.hash128x64(data);
            return ByteBuffer.allocate(2 * Long.BYTES).putLong(h[0]).putLong(h[1]).array();
        }
    },
    XXHASH32("xxh32", null) {
        @Override
        public byte[] digest(byte[] data) {
            XXHash32 xx = new XXHash32();
            xx.update(data, 0, data.length);
            return ByteBuffer.allocate(Integer.BYTES).putInt((int) xx.getValue()).array();
        }
    };

    private static final Map<String, HashAlgorithm> BY_IDENTIFIER = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(HashAlgorithm::identifier, Function.identity()));

    private final String identifier;
    private final String jcaName;

    HashAlgorithm(String identifier, String jcaName) {
        this.identifier = identifier;
        this.jcaName = jcaName;
    }

    public String identifier() {
        return identifier;
    }

    /** Digest of the given bytes; length depends on the algorithm. */
    public byte[] digest(byte[] data) {
        // DigestUtils.getDigest hands out a fresh MessageDigest per call
        return DigestUtils.getDigest(jcaName).digest(data);
    }

    public static HashAlgorithm fromIdentifier(String identifier) {
        if (identifier == null) {
            throw new IllegalArgumentException("Hash algorithm identifier must not be null");
        }
        HashAlgorithm algorithm = BY_IDENTIFIER.get(identifier.toLowerCase(Locale.ROOT));
        if (algorithm == null) {
            throw new IllegalArgumentException("Hash algorithm " + identifier + " is not supported");
        }
        return algorithm;
    }

    public static boolean isSupported(String identifier) {
        return identifier != null && BY_IDENTIFIER.containsKey(identifier.toLowerCase(Locale.ROOT));
    }

    public static List<HashAlgorithm> fromIdentifiers(List<String> identifiers) {
        return identifiers.stream().map(HashAlgorithm::fromIdentifier).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return identifier;
    }
}
