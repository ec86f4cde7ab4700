// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.coordinator;

import sh.txtracker.core.error.LogDecodingException;
import sh.txtracker.core.model.EvmResult;
import sh.txtracker.core.model.RawValue;

/**
 * Decodes a raw outcome value into an {@link EvmResult}.
 *
 * <p>Implementations live with the machine's value format and are supplied by
 * the embedding node. They are only ever called from the dispatcher thread.
 * Any exception a decoder throws is treated like a {@link LogDecodingException}:
 * the transaction is still recorded and ingestion continues.
 */
@FunctionalInterface
public interface EvmResultDecoder {

    /**
     * @param value the raw outcome of one transaction
     * @return the decoded outcome
     * @throws LogDecodingException if {@code value} is not a valid EVM result
     */
    EvmResult decode(RawValue value) throws LogDecodingException;
}
