// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.core.model;

/**
 * Inclusive block window within which a proposal is valid.
 *
 * @param startBlock first valid block
 * @param endBlock   last valid block, not before {@code startBlock}
 * @since 0.1.0
 */
public record TimeBounds(long startBlock, long endBlock) {

    public TimeBounds {
        if (startBlock < 0) {
            throw new IllegalArgumentException("startBlock cannot be negative: " + startBlock);
        }
        if (endBlock < startBlock) {
            throw new IllegalArgumentException(
                    "endBlock (" + endBlock + ") must be >= startBlock (" + startBlock + ")");
        }
    }
}
