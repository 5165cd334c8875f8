// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.crypto;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * SHA-256 hashing utility.
 *
 * <p>
 * SHA-256 is the digest behind CometBFT's {@code tmhash}: header Merkle leaves,
 * the empty evidence hash and validator addresses all use it.
 *
 * <pre>{@code
 * byte[] digest = Sha256.hash(data);
 * byte[] inner = Sha256.hash(new byte[] {0x01}, left, right);
 * }</pre>
 *
 * <h2>ThreadLocal Memory Management</h2>
 *
 * <p>
 * Digest instances are cached per thread. In thread pool environments call
 * {@link #cleanup()} when a worker is returned to the pool or the application is
 * redeployed, otherwise the cached instance keeps the class loader reachable.
 *
 * @since 0.1.0
 */
public final class Sha256 {

    private static final String ALGORITHM = "SHA-256";

    private static final ThreadLocal<MessageDigest> DIGEST = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is required by Java spec, this should never happen
            throw new AssertionError("SHA-256 algorithm not available", e);
        }
    });

    private Sha256() {
        // Utility class
    }

    /**
     * Computes the SHA-256 hash of the input bytes.
     *
     * @param input the data to hash
     * @return 32-byte hash
     * @throws NullPointerException if input is null
     */
    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");

        final MessageDigest digest = DIGEST.get();
        digest.reset();
        return digest.digest(input);
    }

    /**
     * Computes the SHA-256 hash of multiple input arrays concatenated.
     *
     * @param inputs the data arrays to hash
     * @return 32-byte hash
     * @throws NullPointerException if inputs or any element is null
     */
    public static byte[] hash(final byte[]... inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");

        final MessageDigest digest = DIGEST.get();
        digest.reset();
        for (byte[] input : inputs) {
            Objects.requireNonNull(input, "input element cannot be null");
            digest.update(input);
        }
        return digest.digest();
    }

    /**
     * Removes the cached digest instance from the current thread.
     *
     * @see ThreadLocal#remove()
     */
    public static void cleanup() {
        DIGEST.remove();
    }
}
