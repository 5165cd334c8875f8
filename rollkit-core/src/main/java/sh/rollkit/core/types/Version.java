// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.types;

/**
 * Block protocol and application version pair carried by every header.
 * <p>
 * Both components are unsigned 64-bit values stored in a {@code long}.
 *
 * @param block the block protocol version
 * @param app   the application version
 * @since 0.1.0
 */
public record Version(long block, long app) {

    public static final Version ZERO = new Version(0, 0);

    @Override
    public String toString() {
        return "Version[block=" + Long.toUnsignedString(block) + ", app=" + Long.toUnsignedString(app) + "]";
    }
}
