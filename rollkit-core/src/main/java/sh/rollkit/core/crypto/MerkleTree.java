// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.crypto;

import java.util.List;
import java.util.Objects;

/**
 * RFC 6962 simple Merkle tree, as used by CometBFT ({@code crypto/merkle}).
 * <p>
 * Leaves are hashed as {@code SHA256(0x00 || leaf)} and inner nodes as
 * {@code SHA256(0x01 || left || right)}. A list of {@code n > 1} items is split at
 * the largest power of two strictly less than {@code n}. The root of an empty list
 * is {@code SHA256("")}.
 *
 * @since 0.1.0
 */
public final class MerkleTree {

    private static final byte[] LEAF_PREFIX = {0x00};
    private static final byte[] INNER_PREFIX = {0x01};

    private MerkleTree() {
        // Utility class
    }

    /**
     * Computes the Merkle root of the given items.
     *
     * @param items the leaf contents, in order; elements must not be null
     * @return the 32-byte root
     */
    public static byte[] hashFromByteSlices(final List<byte[]> items) {
        Objects.requireNonNull(items, "items cannot be null");
        return hashRange(items, 0, items.size());
    }

    /**
     * @return {@code SHA256("")}, the root of an empty tree
     */
    public static byte[] emptyHash() {
        return Sha256.hash(new byte[0]);
    }

    static byte[] leafHash(final byte[] leaf) {
        return Sha256.hash(LEAF_PREFIX, leaf);
    }

    static byte[] innerHash(final byte[] left, final byte[] right) {
        return Sha256.hash(INNER_PREFIX, left, right);
    }

    /**
     * Largest power of two strictly less than {@code length}.
     */
    static int splitPoint(final int length) {
        if (length < 1) {
            throw new IllegalArgumentException("Trying to split a tree with size < 1: " + length);
        }
        int k = Integer.highestOneBit(length);
        if (k == length) {
            k >>= 1;
        }
        return k;
    }

    private static byte[] hashRange(final List<byte[]> items, final int from, final int to) {
        final int size = to - from;
        if (size == 0) {
            return emptyHash();
        }
        if (size == 1) {
            return leafHash(Objects.requireNonNull(items.get(from), "items cannot contain null values"));
        }
        final int k = splitPoint(size);
        final byte[] left = hashRange(items, from, from + k);
        final byte[] right = hashRange(items, from + k, to);
        return innerHash(left, right);
    }
}
