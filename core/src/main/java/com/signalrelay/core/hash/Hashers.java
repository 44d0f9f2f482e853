package com.signalrelay.core.hash;

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Stable hash functions for key-to-backend affinity.
 * <p>
 * Murmur3 is non-cryptographic but fast and well distributed, which is all
 * that is needed to keep both peers of a room on the same backend.
 * </p>
 */
public final class Hashers {
    private Hashers() {
    }

    /**
     * Computes Murmur3 128-bit hash and returns the lower 64 bits as a long.
     *
     * @param data Input bytes
     * @return 64-bit hash value (signed long)
     */
    public static long murmur3Hash(byte[] data) {
        return Hashing.murmur3_128().hashBytes(data).asLong();
    }

    public static long murmur3Hash(String str) {
        return murmur3Hash(str.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Weighted rendezvous (HRW) score of {@code candidate} for {@code key}.
     * <p>
     * Uses the Gumbel trick: {@code log(weight) - log(-log(u))} where {@code u}
     * is the hash of key and candidate mapped into (0,1). The candidate with the
     * highest score owns the key; removing any other candidate never moves it.
     * </p>
     *
     * @param key       routing key (e.g. room id)
     * @param candidate stable candidate id
     * @param weight    candidate weight, must be positive
     * @return score, or negative infinity for non-positive weights
     */
    public static double rendezvousScore(String key, String candidate, int weight) {
        if (weight <= 0) {
            return Double.NEGATIVE_INFINITY;
        }
        long hash = murmur3Hash(key + "|" + candidate);
        // top 53 bits → uniform double in (0,1)
        double u = ((hash >>> 11) + 0.5d) / (double) (1L << 53);
        return Math.log(weight) - Math.log(-Math.log(u));
    }
}
