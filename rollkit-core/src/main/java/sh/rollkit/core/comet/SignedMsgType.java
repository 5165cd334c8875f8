// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.comet;

/**
 * CometBFT {@code SignedMsgType}: the kind of consensus message being signed.
 *
 * @since 0.1.0
 */
public enum SignedMsgType {
    UNKNOWN(0),
    PREVOTE(1),
    PRECOMMIT(2),
    PROPOSAL(32);

    private final int code;

    SignedMsgType(final int code) {
        this.code = code;
    }

    /** @return the protobuf enum value */
    public int code() {
        return code;
    }
}
