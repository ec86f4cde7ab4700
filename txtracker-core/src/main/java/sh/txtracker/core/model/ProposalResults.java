// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.core.model;

import java.util.Objects;

import sh.txtracker.core.types.Hash;

/**
 * The parameters validators signed when they proposed an assertion.
 * Together with the rollup instance id they determine the proposal's partial hash.
 *
 * @param sequenceNumber    proposal round
 * @param beforeHash        machine state hash before execution
 * @param timeBounds        validity window
 * @param newInboxHash      inbox hash after the proposal's messages
 * @param originalInboxHash inbox hash before them
 * @param assertionDigest   digest of the assertion as it was proposed
 * @since 0.1.0
 */
public record ProposalResults(
        long sequenceNumber,
        Hash beforeHash,
        TimeBounds timeBounds,
        Hash newInboxHash,
        Hash originalInboxHash,
        Hash assertionDigest) {

    public ProposalResults {
        if (sequenceNumber < 0) {
            throw new IllegalArgumentException("sequenceNumber cannot be negative: " + sequenceNumber);
        }
        Objects.requireNonNull(beforeHash, "beforeHash cannot be null");
        Objects.requireNonNull(timeBounds, "timeBounds cannot be null");
        Objects.requireNonNull(newInboxHash, "newInboxHash cannot be null");
        Objects.requireNonNull(originalInboxHash, "originalInboxHash cannot be null");
        Objects.requireNonNull(assertionDigest, "assertionDigest cannot be null");
    }
}
