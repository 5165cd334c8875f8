// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.header;

import java.time.Instant;

import sh.rollkit.core.types.Hash;

/**
 * Operations a header type exposes to a generic header synchronization and
 * verification service.
 *
 * <p>
 * The service only ever sees headers through this interface and the matching
 * {@link HeaderFactory}; everything it needs to decode, order, link and accept
 * candidates is here.
 *
 * @param <H> the concrete header type
 * @since 0.1.0
 */
public interface VerifiableHeader<H extends VerifiableHeader<H>> {

    String chainId();

    /** @return the height, an unsigned 64-bit value */
    long height();

    Instant time();

    /** @return the hash that the next header links to */
    Hash hash();

    /** @return the hash of the previous header */
    Hash lastHeader();

    /**
     * Performs structural validation.
     *
     * @throws sh.rollkit.core.error.InvalidHeaderException if the header is malformed
     */
    void validate();

    /**
     * Verifies an untrusted header against this trusted one.
     *
     * @param untrusted the candidate header
     * @throws sh.rollkit.core.error.HeaderVerificationException if the candidate is not acceptable
     */
    void verify(H untrusted);

    /** @return the binary encoding, decodable by {@link HeaderFactory#unmarshalBinary(byte[])} */
    byte[] marshalBinary();
}
