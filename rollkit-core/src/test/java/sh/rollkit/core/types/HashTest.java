// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.types;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class HashTest {

    @Test
    void accepts32ByteHex() {
        Hash hash =
                new Hash(
                        "0x0123456789abcdef0123456789abcdef0123456789abcdef0123456789abcdef");
        assertEquals(32, hash.toBytes().length);
    }

    @Test
    void rejectsWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> new Hash("0x1234"));
    }

    @Test
    void fromBytesRequires32() {
        assertThrows(IllegalArgumentException.class, () -> Hash.fromBytes(new byte[10]));
        assertThrows(IllegalArgumentException.class, () -> Hash.fromBytes(null));
    }

    @Test
    void roundTripBytes() {
        byte[] bytes = new byte[32];
        Arrays.fill(bytes, (byte) 0xAB);
        Hash hash = Hash.fromBytes(bytes);
        assertArrayEquals(bytes, hash.toBytes());
    }

    @Test
    void equalityIsCaseInsensitiveOnInput() {
        Hash lower = new Hash("0x" + "ab".repeat(32));
        Hash upper = new Hash("0x" + "AB".repeat(32));
        assertEquals(lower, upper);
        assertEquals(lower.hashCode(), upper.hashCode());
    }

    @Test
    void emptyHashHasNoBytes() {
        assertArrayEquals(new byte[0], Hash.EMPTY.toBytes());
        assertTrue(Hash.EMPTY.isEmpty());
        assertEquals(Hash.EMPTY, new Hash("0x"));
        assertFalse(Hash.fromBytes(new byte[32]).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> new Hash(""));
    }

    @Test
    void serializesAsHexString() throws Exception {
        Hash hash = Hash.fromBytes(filled((byte) 0x11));
        assertEquals("\"0x" + "11".repeat(32) + "\"", new ObjectMapper().writeValueAsString(hash));
    }

    private static byte[] filled(byte value) {
        byte[] bytes = new byte[32];
        Arrays.fill(bytes, value);
        return bytes;
    }
}
