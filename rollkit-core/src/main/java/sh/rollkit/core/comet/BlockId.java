// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.comet;

import java.util.Objects;

import sh.rollkit.core.types.HexBytes;

/**
 * CometBFT block identifier: the block hash plus its part set header.
 *
 * @param hash          the block (header) hash
 * @param partSetHeader the part set header
 * @since 0.1.0
 */
public record BlockId(HexBytes hash, PartSetHeader partSetHeader) {

    /** The zero block ID, used by votes for nil. */
    public static final BlockId EMPTY = new BlockId(HexBytes.EMPTY, PartSetHeader.EMPTY);

    public BlockId {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(partSetHeader, "partSetHeader");
    }

    /**
     * @return {@code true} if both the hash and the part set header are empty
     */
    public boolean isZero() {
        return hash.isEmpty() && partSetHeader.isZero();
    }
}
