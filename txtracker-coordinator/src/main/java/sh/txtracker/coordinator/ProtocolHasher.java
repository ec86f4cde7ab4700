// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.coordinator;

import sh.txtracker.core.model.EthMessage;
import sh.txtracker.core.model.ProposalResults;
import sh.txtracker.core.model.RawValue;
import sh.txtracker.core.types.Hash;

/**
 * The protocol's hash constructions, other than the log chain link itself
 * (see {@link sh.txtracker.core.crypto.HashChain}).
 *
 * @see KeccakProtocolHasher
 */
public interface ProtocolHasher {

    /**
     * Content hash of one log value; the input to the log chain.
     */
    Hash valueHash(RawValue value);

    /**
     * Commitment to a proposal's parameters, bound to the validators' signatures.
     *
     * @param instanceId the rollup instance the proposal belongs to
     * @param proposal   the signed proposal
     */
    Hash partialHash(Hash instanceId, ProposalResults proposal);

    /**
     * Identifier of a transaction, keyed by the rollup instance.
     *
     * @param instanceId the rollup instance
     * @param message    the decoded message
     */
    Hash messageHash(Hash instanceId, EthMessage message);
}
