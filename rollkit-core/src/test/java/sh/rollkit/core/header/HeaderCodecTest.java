// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.header;

import static org.junit.jupiter.api.Assertions.*;
import static sh.rollkit.core.header.HeaderFixtures.*;

import java.util.Arrays;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import sh.rollkit.core.error.HeaderCodecException;
import sh.rollkit.core.types.Hash;
import sh.rollkit.core.types.HexBytes;
import sh.rollkit.core.types.Version;
import sh.rollkit.primitives.Hex;

class HeaderCodecTest {

    @Test
    @DisplayName("Encoding matches the rollkit protobuf Header message")
    void encodesRollkitProtobuf() {
        assertEquals(SAMPLE_ENCODING, Hex.encodeNoPrefix(HeaderCodec.encode(sample())));
    }

    @Test
    void decodesRollkitProtobuf() {
        assertEquals(sample(), HeaderCodec.decode(Hex.decode(SAMPLE_ENCODING)));
    }

    @Test
    void emptyHeaderEncodesVersionOnly() {
        assertEquals("0a00", Hex.encodeNoPrefix(HeaderCodec.encode(Header.empty())));
    }

    @Test
    void headerWithoutLastHeaderHashSurvivesRoundTrip() {
        byte[] encoded = Hex.decode(GENESIS_ENCODING);

        Header decoded = HeaderCodec.decode(encoded);

        assertEquals(genesis(), decoded);
        assertTrue(decoded.lastHeaderHash().isEmpty());
        assertEquals(GENESIS_ENCODING, Hex.encodeNoPrefix(HeaderCodec.encode(decoded)));
        assertEquals(new Hash(GENESIS_HASH), decoded.hash());
        assertEquals(GENESIS_VOTE, Hex.encodeNoPrefix(decoded.makeCometBftVote()));
    }

    @Test
    void zeroHashIsNotAnAbsentHash() {
        String encoded = "0a00" + "2220" + "00".repeat(32);

        Header decoded = HeaderCodec.decode(Hex.decode(encoded));

        assertEquals(Hash.fromBytes(new byte[32]), decoded.lastHeaderHash());
        assertEquals(encoded, Hex.encodeNoPrefix(HeaderCodec.encode(decoded)));
    }

    @Test
    void roundTripKeepsUnsignedExtremes() {
        Header header = HeaderBuilder.from(sample())
                .height(-1L)
                .time(-1L)
                .version(new Version(-1L, Long.MIN_VALUE))
                .chainId("chain-é")
                .proposerAddress(new byte[] {0x01})
                .build();

        assertEquals(header, HeaderCodec.decode(HeaderCodec.encode(header)));
    }

    @Test
    void emptyInputDecodesToEmptyHeader() {
        assertEquals(Header.empty(), HeaderCodec.decode(new byte[0]));
    }

    @Test
    void absentHashesDecodeToEmpty() {
        Header decoded = HeaderCodec.decode(Hex.decode("1005"));

        assertEquals(5, decoded.height());
        assertEquals(Hash.EMPTY, decoded.dataHash());
        assertEquals(HexBytes.EMPTY, decoded.proposerAddress());
    }

    @Test
    void skipsUnknownFields() {
        byte[] withUnknown = Hex.decode(SAMPLE_ENCODING + "7801" + "8201026869");
        assertEquals(sample(), HeaderCodec.decode(withUnknown));
    }

    @Test
    void rejectsTruncatedInput() {
        byte[] encoded = HeaderCodec.encode(sample());
        byte[] truncated = Arrays.copyOf(encoded, encoded.length - 1);

        HeaderCodecException ex = assertThrows(HeaderCodecException.class, () -> HeaderCodec.decode(truncated));
        assertNotNull(ex.getCause());
    }

    @Test
    void rejectsHashOfWrongLength() {
        HeaderCodecException ex =
                assertThrows(HeaderCodecException.class, () -> HeaderCodec.decode(Hex.decode("2202abcd")));
        assertTrue(ex.getMessage().contains("last_header_hash"));
    }

    @Test
    void rejectsWrongWireType() {
        HeaderCodecException ex =
                assertThrows(HeaderCodecException.class, () -> HeaderCodec.decode(Hex.decode("120100")));
        assertTrue(ex.getMessage().contains("height"));
    }

    @Test
    void rejectsNullInput() {
        assertThrows(NullPointerException.class, () -> HeaderCodec.decode(null));
        assertThrows(NullPointerException.class, () -> HeaderCodec.encode(null));
    }
}
