// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.core.error;

/**
 * Thrown when a finalized assertion contradicts a guarantee of the upstream
 * protocol, such as a re-asserted digest that differs from the executed one.
 * <p>
 * This signals a bug upstream, not bad input. It is never retried: the
 * dispatcher stops ingesting and rejects every later request.
 *
 * @since 0.1.0
 */
public final class ProtocolViolationException extends TrackerException {

    public ProtocolViolationException(final String message) {
        super(message);
    }
}
