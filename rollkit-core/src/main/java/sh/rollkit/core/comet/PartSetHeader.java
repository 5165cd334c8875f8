// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.comet;

import java.util.Objects;

import sh.rollkit.core.types.HexBytes;

/**
 * CometBFT part set header. Rollkit blocks are never split into parts, so this is
 * always {@link #EMPTY} for rollkit votes.
 *
 * @param total number of parts, unsigned 32-bit
 * @param hash  Merkle root of the parts
 * @since 0.1.0
 */
public record PartSetHeader(int total, HexBytes hash) {

    public static final PartSetHeader EMPTY = new PartSetHeader(0, HexBytes.EMPTY);

    public PartSetHeader {
        Objects.requireNonNull(hash, "hash");
    }

    public boolean isZero() {
        return total == 0 && hash.isEmpty();
    }
}
