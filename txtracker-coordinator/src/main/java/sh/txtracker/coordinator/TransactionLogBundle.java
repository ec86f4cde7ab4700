// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.coordinator;

import java.util.List;
import java.util.Objects;

import sh.txtracker.core.model.EthMessage;
import sh.txtracker.core.model.EvmLog;
import sh.txtracker.core.types.Hash;

/**
 * The logs of one non-reverted transaction, kept in the owning assertion's record.
 *
 * @param transactionHash the transaction's identifier
 * @param message         the decoded message
 * @param logs            logs in emission order (may be empty)
 */
public record TransactionLogBundle(Hash transactionHash, EthMessage message, List<EvmLog> logs) {

    public TransactionLogBundle {
        Objects.requireNonNull(transactionHash, "transactionHash cannot be null");
        Objects.requireNonNull(message, "message cannot be null");
        Objects.requireNonNull(logs, "logs cannot be null");
        logs = List.copyOf(logs);
    }
}
