// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.core.types;

import static org.junit.jupiter.api.Assertions.*;

import java.util.regex.Pattern;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Tests for {@link HexValidator}.
 */
class HexValidatorTest {

    @Test
    void matchesExactLengthInEitherCase() {
        Pattern pattern = HexValidator.fixedLength(4);
        assertTrue(pattern.matcher("0xdeadbeef").matches());
        assertTrue(pattern.matcher("0xDEADBEEF").matches());
        assertFalse(pattern.matcher("0xdeadbe").matches());
        assertFalse(pattern.matcher("0xdeadbeef00").matches());
        assertFalse(pattern.matcher("deadbeef").matches());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1})
    void rejectsNonPositiveLength(int length) {
        assertThrows(IllegalArgumentException.class, () -> HexValidator.fixedLength(length));
    }
}
