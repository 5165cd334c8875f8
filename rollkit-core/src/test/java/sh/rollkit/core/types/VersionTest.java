// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.types;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class VersionTest {

    @Test
    void rendersComponentsAsUnsigned() {
        assertEquals("Version[block=18446744073709551615, app=1]", new Version(-1L, 1).toString());
    }
}
