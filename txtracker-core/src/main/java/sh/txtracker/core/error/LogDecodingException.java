// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.core.error;

import java.util.Optional;

import org.jspecify.annotations.Nullable;

import sh.txtracker.core.model.EthMessage;

/**
 * Thrown by an outcome decoder when a raw outcome value is not a valid EVM
 * result. Recoverable: the transaction is still recorded, without logs.
 * <p>
 * Decoders that managed to recover the originating message before failing
 * should attach it so the transaction stays addressable by its identifier.
 *
 * @since 0.1.0
 */
public final class LogDecodingException extends TrackerException {

    private final transient @Nullable EthMessage message;

    public LogDecodingException(final String message) {
        this(message, null, null);
    }

    public LogDecodingException(final String message, final Throwable cause) {
        this(message, null, cause);
    }

    public LogDecodingException(final String message, final @Nullable EthMessage decodedMessage,
            final @Nullable Throwable cause) {
        super(message, cause);
        this.message = decodedMessage;
    }

    /**
     * Returns the message decoded before the failure, if any.
     */
    public Optional<EthMessage> decodedMessage() {
        return Optional.ofNullable(message);
    }
}
