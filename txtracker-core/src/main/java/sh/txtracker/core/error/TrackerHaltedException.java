// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.core.error;

/**
 * Thrown (through a failed future) for requests that reach a tracker that has
 * been closed or halted by a fatal ingestion error. When the halt was caused
 * by a {@link ProtocolViolationException}, it is available as the cause.
 *
 * @since 0.1.0
 */
public final class TrackerHaltedException extends TrackerException {

    public TrackerHaltedException(final String message) {
        super(message);
    }

    public TrackerHaltedException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
