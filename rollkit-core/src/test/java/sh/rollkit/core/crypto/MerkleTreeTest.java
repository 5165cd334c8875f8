// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import sh.rollkit.primitives.Hex;

class MerkleTreeTest {

    @Test
    @DisplayName("CometBFT HashFromByteSlices vectors")
    void cometBftVectors() {
        assertRoot("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", List.of());
        assertRoot("6e340b9cffb37a989ca544e6bb780a2c78901d3fb33738768511a30617afa01d", List.of(new byte[0]));
        assertRoot("054edec1d0211f624fed0cbca9d4f9400b0e491c43742af2c5b0abebf0c990d8",
                List.of(new byte[] {1, 2, 3}));
        assertRoot("82e6cfce00453804379b53962939eaa7906b39904be0813fcadd31b100773c4b",
                List.of(new byte[] {1, 2, 3}, new byte[] {4, 5, 6}));
        assertRoot("f326493eceab4f2d9ffbc78c59432a0a005d6ea98392045c74df5d14a113be18",
                List.of(new byte[] {1, 2}, new byte[] {3, 4}, new byte[] {5, 6}, new byte[] {7, 8},
                        new byte[] {9, 10}));
    }

    @Test
    void innerNodeCombinesLeaves() {
        byte[] a = {1};
        byte[] b = {2};
        byte[] expected = MerkleTree.innerHash(MerkleTree.leafHash(a), MerkleTree.leafHash(b));
        assertArrayEquals(expected, MerkleTree.hashFromByteSlices(List.of(a, b)));
    }

    @Test
    void splitPointIsLargestPowerOfTwoBelowLength() {
        assertEquals(0, MerkleTree.splitPoint(1));
        assertEquals(1, MerkleTree.splitPoint(2));
        assertEquals(2, MerkleTree.splitPoint(3));
        assertEquals(2, MerkleTree.splitPoint(4));
        assertEquals(4, MerkleTree.splitPoint(5));
        assertEquals(4, MerkleTree.splitPoint(8));
        assertEquals(8, MerkleTree.splitPoint(9));
        assertEquals(8, MerkleTree.splitPoint(14));
        assertThrows(IllegalArgumentException.class, () -> MerkleTree.splitPoint(0));
    }

    @Test
    void rejectsNulls() {
        assertThrows(NullPointerException.class, () -> MerkleTree.hashFromByteSlices(null));
        assertThrows(NullPointerException.class,
                () -> MerkleTree.hashFromByteSlices(Collections.singletonList(null)));
    }

    private static void assertRoot(String expectedHex, List<byte[]> items) {
        assertEquals(expectedHex, Hex.encodeNoPrefix(MerkleTree.hashFromByteSlices(items)));
    }
}
