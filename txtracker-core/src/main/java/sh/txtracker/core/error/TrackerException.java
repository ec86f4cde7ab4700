// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.core.error;

/**
 * Base runtime exception for all tracker failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * TrackerException
 * ├── {@link ProtocolViolationException} - upstream broke a protocol guarantee; fatal
 * ├── {@link LogDecodingException} - one outcome could not be decoded; recoverable
 * └── {@link TrackerHaltedException} - request rejected because the tracker stopped
 * </pre>
 *
 * @since 0.1.0
 */
public sealed class TrackerException extends RuntimeException
        permits ProtocolViolationException,
        LogDecodingException,
        TrackerHaltedException {

    public TrackerException(final String message) {
        super(message);
    }

    public TrackerException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
