// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.core.model;

import java.util.List;
import java.util.Objects;

import sh.txtracker.core.types.HexData;

/**
 * Decoded outcome of one transaction. A closed sum type: the only variants are
 * {@link Stop}, {@link Return} and {@link Revert}.
 *
 * <p>Switch on {@link #kind()} for exhaustive handling:
 *
 * <pre>{@code
 * List<EvmLog> logs = switch (result.kind()) {
 *     case STOP, RETURN -> result.logs();
 *     case REVERT -> List.of();
 * };
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed interface EvmResult permits EvmResult.Stop, EvmResult.Return, EvmResult.Revert {

    enum Kind {
        STOP,
        RETURN,
        REVERT
    }

    Kind kind();

    EthMessage message();

    /**
     * Logs emitted by the transaction; always empty for {@link Revert}.
     */
    List<EvmLog> logs();

    /**
     * Execution halted normally without return data.
     */
    record Stop(EthMessage message, List<EvmLog> logs) implements EvmResult {
        public Stop {
            Objects.requireNonNull(message, "message cannot be null");
            Objects.requireNonNull(logs, "logs cannot be null");
            logs = List.copyOf(logs);
        }

        @Override
        public Kind kind() {
            return Kind.STOP;
        }
    }

    /**
     * Execution returned data.
     */
    record Return(EthMessage message, List<EvmLog> logs, HexData returnData) implements EvmResult {
        public Return {
            Objects.requireNonNull(message, "message cannot be null");
            Objects.requireNonNull(logs, "logs cannot be null");
            Objects.requireNonNull(returnData, "returnData cannot be null");
            logs = List.copyOf(logs);
        }

        @Override
        public Kind kind() {
            return Kind.RETURN;
        }
    }

    /**
     * Execution reverted. Reverted transactions emit no logs.
     */
    record Revert(EthMessage message, HexData revertData) implements EvmResult {
        public Revert {
            Objects.requireNonNull(message, "message cannot be null");
            Objects.requireNonNull(revertData, "revertData cannot be null");
        }

        @Override
        public Kind kind() {
            return Kind.REVERT;
        }

        @Override
        public List<EvmLog> logs() {
            return List.of();
        }
    }
}
