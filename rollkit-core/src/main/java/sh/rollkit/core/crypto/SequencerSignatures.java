// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.crypto;

import java.util.Arrays;
import java.util.Objects;

import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import sh.rollkit.core.error.InvalidSignatureException;
import sh.rollkit.core.header.Header;
import sh.rollkit.core.types.HexBytes;

/**
 * Verification of sequencer signatures over headers.
 *
 * <p>
 * This is a single-signer check: the public key must hash to the header's
 * proposer address and the Ed25519 signature must cover the header's CometBFT
 * vote sign-bytes. There is no quorum or voting-power accounting.
 *
 * @since 0.1.0
 */
public final class SequencerSignatures {

    /** Length of a CometBFT address: truncated SHA-256 of the public key. */
    public static final int ADDRESS_SIZE = 20;

    private SequencerSignatures() {
        // Utility class
    }

    /**
     * Derives the CometBFT address of an Ed25519 public key.
     *
     * @param publicKey the 32-byte public key
     * @return the 20-byte address
     */
    public static HexBytes addressOf(final HexBytes publicKey) {
        Objects.requireNonNull(publicKey, "publicKey cannot be null");
        final byte[] digest = Sha256.hash(publicKey.toBytes());
        return HexBytes.fromBytes(Arrays.copyOf(digest, ADDRESS_SIZE));
    }

    /**
     * Verifies that {@code signature} is the proposer's signature over the header vote.
     *
     * @param header    the signed header
     * @param publicKey the sequencer's Ed25519 public key
     * @param signature the signature to check
     * @throws InvalidSignatureException if the key does not belong to the proposer or the
     *                                   signature is invalid
     */
    public static void verify(final Header header, final HexBytes publicKey, final HexBytes signature) {
        Objects.requireNonNull(header, "header cannot be null");
        Objects.requireNonNull(publicKey, "publicKey cannot be null");
        Objects.requireNonNull(signature, "signature cannot be null");

        if (publicKey.length() != Ed25519PublicKeyParameters.KEY_SIZE) {
            throw new InvalidSignatureException(
                    "invalid Ed25519 public key length: " + publicKey.length());
        }
        final HexBytes address = addressOf(publicKey);
        if (!address.equals(header.proposerAddress())) {
            throw new InvalidSignatureException(
                    "public key address (" + address + ") does not match proposer (" + header.proposerAddress() + ")");
        }

        final byte[] signBytes = header.makeCometBftVote();
        final Ed25519Signer verifier = new Ed25519Signer();
        try {
            verifier.init(false, new Ed25519PublicKeyParameters(publicKey.toBytes(), 0));
        } catch (IllegalArgumentException e) {
            throw new InvalidSignatureException("invalid Ed25519 public key", e);
        }
        verifier.update(signBytes, 0, signBytes.length);
        if (!verifier.verifySignature(signature.toBytes())) {
            throw new InvalidSignatureException(
                    "invalid signature for header at height " + Long.toUnsignedString(header.height()));
        }
    }
}
