// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.header;

import java.util.Arrays;

import sh.rollkit.core.types.Hash;
import sh.rollkit.core.types.HexBytes;
import sh.rollkit.core.types.Version;

/**
 * Shared headers for tests. Expected encodings of {@link #sample()} were computed
 * independently of this code base.
 */
public final class HeaderFixtures {

    public static final String CHAIN_ID = "rollkit-test";
    public static final long SAMPLE_TIME = 1_700_000_000_123_456_789L;
    public static final HexBytes PROPOSER_A = HexBytes.fromBytes(filled(20, 0xAA));
    public static final HexBytes PROPOSER_B = HexBytes.fromBytes(filled(20, 0xBB));

    public static final String SAMPLE_HASH =
            "0xd465db895bf38edb713277bd79f83a6211ebc871912653a563967531dd540d7b";

    public static final String SAMPLE_VOTE =
            "4c080211050000000000000022240a20d465db895bf38edb713277bd79f83a6211ebc871912653a563967531dd540d7b"
                    + "12002a0b0880e2cfaa0610959aef3a320c726f6c6c6b69742d74657374";

    public static final String SAMPLE_ENCODING =
            "0a04080b1001100518959a97ece39fe7cb17"
                    + "2220" + "01".repeat(32)
                    + "2a20" + "02".repeat(32)
                    + "3220" + "03".repeat(32)
                    + "3a20" + "04".repeat(32)
                    + "4220" + "05".repeat(32)
                    + "4a20" + "07".repeat(32)
                    + "5214" + "aa".repeat(20)
                    + "5a20" + "06".repeat(32)
                    + "620c726f6c6c6b69742d74657374";

    /** {@link #SAMPLE_ENCODING} without {@code last_header_hash}, as a genesis header is sent. */
    public static final String GENESIS_ENCODING = SAMPLE_ENCODING.replace("2220" + "01".repeat(32), "");

    public static final String GENESIS_HASH =
            "0x46c8dce4982933185c74bfdce40e175f12aa3b78d7dc509c63f9e48e7a1d579d";

    public static final String GENESIS_VOTE =
            "4c080211050000000000000022240a2046c8dce4982933185c74bfdce40e175f12aa3b78d7dc509c63f9e48e7a1d579d"
                    + "12002a0b0880e2cfaa0610959aef3a320c726f6c6c6b69742d74657374";

    private HeaderFixtures() {
    }

    /**
     * Header at height 5 on {@link #CHAIN_ID} proposed by {@link #PROPOSER_A}, with
     * every hash field set to a distinct repeated byte.
     */
    public static Header sample() {
        return Header.builder()
                .height(5)
                .time(SAMPLE_TIME)
                .chainId(CHAIN_ID)
                .version(new Version(11, 1))
                .lastHeaderHash(hash(0x01))
                .lastCommitHash(hash(0x02))
                .dataHash(hash(0x03))
                .consensusHash(hash(0x04))
                .appHash(hash(0x05))
                .validatorHash(hash(0x06))
                .lastResultsHash(hash(0x07))
                .proposerAddress(PROPOSER_A)
                .build();
    }

    /** The sample header with no predecessor. */
    public static Header genesis() {
        return HeaderBuilder.from(sample()).lastHeaderHash(Hash.EMPTY).build();
    }

    public static Hash hash(int fill) {
        return Hash.fromBytes(filled(32, fill));
    }

    public static byte[] filled(int length, int fill) {
        byte[] bytes = new byte[length];
        Arrays.fill(bytes, (byte) fill);
        return bytes;
    }
}
