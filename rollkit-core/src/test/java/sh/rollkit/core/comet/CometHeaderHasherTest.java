// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.comet;

import static org.junit.jupiter.api.Assertions.*;
import static sh.rollkit.core.header.HeaderFixtures.*;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import sh.rollkit.core.crypto.MerkleTree;
import sh.rollkit.core.header.Header;
import sh.rollkit.core.header.HeaderBuilder;
import sh.rollkit.core.types.Hash;
import sh.rollkit.core.types.Version;
import sh.rollkit.primitives.Hex;

class CometHeaderHasherTest {

    @Test
    void matchesReferenceHash() {
        assertEquals(new Hash(SAMPLE_HASH), CometHeaderHasher.hash(sample()));
    }

    @Test
    void unsetHashesAreEmptyLeaves() {
        assertEquals(new Hash(GENESIS_HASH), CometHeaderHasher.hash(genesis()));
    }

    @Test
    void unsetLastHeaderHashIsOmittedFromLastBlockId() {
        Header genesis = genesis();
        List<byte[]> leaves = new ArrayList<>();
        leaves.add(Hex.decode("080b1001"));                                // version
        leaves.add(Hex.decode("0a0c" + Hex.encodeNoPrefix(CHAIN_ID.getBytes(StandardCharsets.UTF_8))));
        leaves.add(Hex.decode("0805"));                                    // height
        leaves.add(Hex.decode("0880e2cfaa0610959aef3a"));                  // time
        leaves.add(Hex.decode("1200"));                                    // last block ID
        for (int fill : new int[] {0x02, 0x03, 0x06, 0x06, 0x04, 0x05, 0x07}) {
            leaves.add(Hex.decode("0a20" + Hex.encodeNoPrefix(filled(32, fill))));
        }
        leaves.add(Hex.decode("0a20e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855"));
        leaves.add(Hex.decode("0a14" + "aa".repeat(20)));

        assertEquals(Hash.fromBytes(MerkleTree.hashFromByteSlices(leaves)), CometHeaderHasher.hash(genesis));
    }

    @Test
    void headerWithoutValidatorHashHasNoHash() {
        Header header = HeaderBuilder.from(sample()).validatorHash(Hash.EMPTY).build();

        assertEquals(Hash.EMPTY, CometHeaderHasher.hash(header));
        assertEquals(Hash.EMPTY, Header.empty().hash());
        assertEquals("2608021105000000000000002a0b0880e2cfaa0610959aef3a320c726f6c6c6b69742d74657374",
                Hex.encodeNoPrefix(header.makeCometBftVote()));
    }

    @Test
    void everyFieldAffectsTheHash() {
        Header base = sample();
        Hash hash = base.hash();
        List<Header> variants = List.of(
                HeaderBuilder.from(base).height(6).build(),
                HeaderBuilder.from(base).time(SAMPLE_TIME + 1).build(),
                HeaderBuilder.from(base).chainId("other").build(),
                HeaderBuilder.from(base).version(new Version(11, 2)).build(),
                HeaderBuilder.from(base).lastHeaderHash(hash(0x10)).build(),
                HeaderBuilder.from(base).lastCommitHash(hash(0x10)).build(),
                HeaderBuilder.from(base).dataHash(hash(0x10)).build(),
                HeaderBuilder.from(base).consensusHash(hash(0x10)).build(),
                HeaderBuilder.from(base).appHash(hash(0x10)).build(),
                HeaderBuilder.from(base).validatorHash(hash(0x10)).build(),
                HeaderBuilder.from(base).lastResultsHash(hash(0x10)).build(),
                HeaderBuilder.from(base).proposerAddress(PROPOSER_B).build());

        for (Header variant : variants) {
            assertNotEquals(hash, variant.hash(), variant::toString);
        }
    }

    @Test
    void isDeterministic() {
        assertEquals(sample().hash(), sample().hash());
    }
}
