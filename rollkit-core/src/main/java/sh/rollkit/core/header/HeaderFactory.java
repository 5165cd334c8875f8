// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.header;

import org.jspecify.annotations.Nullable;

/**
 * Type-level operations of a {@link VerifiableHeader}: creating a zero value,
 * testing for absence and decoding.
 *
 * @param <H> the concrete header type
 * @since 0.1.0
 */
public interface HeaderFactory<H extends VerifiableHeader<H>> {

    /**
     * @return a fresh header with every field at its zero value
     */
    H zero();

    /**
     * Tests whether a header reference is absent. Callers check this before invoking
     * anything on the header.
     *
     * @param header the header, possibly {@code null}
     * @return {@code true} if there is no header
     */
    default boolean isZero(@Nullable H header) {
        return header == null;
    }

    /**
     * Decodes a header from the bytes produced by {@link VerifiableHeader#marshalBinary()}.
     *
     * @param data the encoded header
     * @return the decoded header
     * @throws sh.rollkit.core.error.HeaderCodecException if the bytes are malformed
     */
    H unmarshalBinary(byte[] data);
}
