package com.qqsuccubus.faultlab.core.hash;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.qqsuccubus.faultlab.core.model.PartitionToken;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Computes ring tokens for raw keys on the client side.
 * <p>
 * Only the Murmur3 family is implemented: the key's UTF-8 bytes are hashed with MurmurHash3
 * x86 32-bit (seed 0) and the result is read as unsigned. Other partitioners yield
 * "not applicable" rather than a guessed value.
 * </p>
 * <p>
 * <b>Thread-safety:</b> Stateless; safe for concurrent use.
 * </p>
 */
public class TokenCodec {
    /**
     * Case-sensitive marker matched against the partitioner class name.
     */
    public static final String MURMUR3_MARKER = "Murmur3";

    private static final HashFunction MURMUR3_32 = Hashing.murmur3_32_fixed();

    /**
     * Computes the token of a key under the named partitioner.
     *
     * @param key             Raw key, may be empty
     * @param partitionerName Partitioner class name reported by the cluster
     * @return Token, or empty if the partitioner is not a Murmur3 variant
     */
    public Optional<PartitionToken> compute(String key, String partitionerName) {
        if (!isApplicable(partitionerName)) {
            return Optional.empty();
        }
        return Optional.of(PartitionToken.fromLocalHash(murmur3Unsigned(key.getBytes(StandardCharsets.UTF_8))));
    }

    /**
     * Whether this codec can hash keys for the given partitioner.
     */
    public boolean isApplicable(String partitionerName) {
        return partitionerName != null && partitionerName.contains(MURMUR3_MARKER);
    }

    /**
     * MurmurHash3 x86 32-bit of the bytes, as an unsigned value.
     *
     * @param data Input bytes
     * @return Hash in {@code [0, 2^32)}
     */
    public static long murmur3Unsigned(byte[] data) {
        return Integer.toUnsignedLong(MURMUR3_32.hashBytes(data).asInt());
    }
}
