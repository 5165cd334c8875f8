// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.crypto;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import sh.rollkit.core.DebugLogger;
import sh.rollkit.core.header.Header;
import sh.rollkit.core.types.HexBytes;
import sh.rollkit.primitives.Hex;

/**
 * Ed25519 signing key of a sequencer.
 *
 * <p>
 * A sequencer signs the CometBFT precommit vote sign-bytes of each header it
 * produces ({@link Header#makeCometBftVote()}), so the signature can be checked
 * by CometBFT light-client tooling as if it came from a single validator. The
 * header's proposer address is the CometBFT address of the public key
 * ({@link #address()}).
 *
 * <pre>{@code
 * Ed25519SequencerKey key = Ed25519SequencerKey.fromSeed(seed);
 * Header header = Header.builder()
 *         .height(5)
 *         .chainId("rollkit-test")
 *         .proposerAddress(key.address())
 *         .build();
 * HexBytes signature = key.sign(header);
 * SequencerSignatures.verify(header, key.publicKey(), signature);
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Ed25519SequencerKey {

    public static final int SEED_SIZE = Ed25519PrivateKeyParameters.KEY_SIZE;

    private final Ed25519PrivateKeyParameters privateKey;
    private final HexBytes publicKey;
    private final HexBytes address;

    private Ed25519SequencerKey(final Ed25519PrivateKeyParameters privateKey) {
        this.privateKey = privateKey;
        final Ed25519PublicKeyParameters pub = privateKey.generatePublicKey();
        this.publicKey = HexBytes.fromBytes(pub.getEncoded());
        this.address = SequencerSignatures.addressOf(publicKey);
    }

    /**
     * Creates a key from a 32-byte Ed25519 seed.
     *
     * <p>
     * <b>Security note:</b> the input array is zeroed once the key is created.
     *
     * @param seed the private seed
     * @return the key
     * @throws IllegalArgumentException if the seed is not 32 bytes
     */
    public static Ed25519SequencerKey fromSeed(final byte[] seed) {
        Objects.requireNonNull(seed, "seed cannot be null");
        if (seed.length != SEED_SIZE) {
            throw new IllegalArgumentException("Ed25519 seed must be " + SEED_SIZE + " bytes, got " + seed.length);
        }
        try {
            return new Ed25519SequencerKey(new Ed25519PrivateKeyParameters(seed, 0));
        } finally {
            Arrays.fill(seed, (byte) 0);
        }
    }

    /**
     * Creates a key from a hex-encoded seed (with or without 0x prefix).
     *
     * @param hexSeed the seed
     * @return the key
     */
    public static Ed25519SequencerKey fromHex(final String hexSeed) {
        Objects.requireNonNull(hexSeed, "hex seed cannot be null");
        return fromSeed(Hex.decode(hexSeed));
    }

    /**
     * Generates a fresh random key.
     *
     * @param random the randomness source
     * @return the key
     */
    public static Ed25519SequencerKey generate(final SecureRandom random) {
        Objects.requireNonNull(random, "random cannot be null");
        return new Ed25519SequencerKey(new Ed25519PrivateKeyParameters(random));
    }

    public HexBytes publicKey() {
        return publicKey;
    }

    /**
     * @return the CometBFT address of this key, the first 20 bytes of SHA-256 of the public key
     */
    public HexBytes address() {
        return address;
    }

    /**
     * Signs the CometBFT vote sign-bytes of a header.
     *
     * @param header the header to sign
     * @return the 64-byte signature
     */
    public HexBytes sign(final Header header) {
        Objects.requireNonNull(header, "header cannot be null");
        final byte[] signBytes = header.makeCometBftVote();
        DebugLogger.logVote("[SIGN] chainId=%s height=%s signer=%s",
                header.chainId(), Long.toUnsignedString(header.height()), address);
        return sign(signBytes);
    }

    /**
     * Signs an arbitrary message.
     *
     * @param message the message
     * @return the 64-byte signature
     */
    public HexBytes sign(final byte[] message) {
        Objects.requireNonNull(message, "message cannot be null");
        final Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, privateKey);
        signer.update(message, 0, message.length);
        return HexBytes.fromBytes(signer.generateSignature());
    }

    @Override
    public String toString() {
        return "Ed25519SequencerKey[address=" + address + "]";
    }
}
