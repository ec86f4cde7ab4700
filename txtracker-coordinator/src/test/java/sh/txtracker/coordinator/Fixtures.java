// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.coordinator;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import sh.txtracker.core.error.LogDecodingException;
import sh.txtracker.core.model.EthMessage;
import sh.txtracker.core.model.EvmLog;
import sh.txtracker.core.model.EvmResult;
import sh.txtracker.core.model.FinalizedAssertion;
import sh.txtracker.core.model.ProposalResults;
import sh.txtracker.core.model.RawValue;
import sh.txtracker.core.model.TimeBounds;
import sh.txtracker.core.types.Address;
import sh.txtracker.core.types.Hash;
import sh.txtracker.core.types.HexData;

/**
 * Shared test data: addresses, topics, assertions and a map-backed decoder.
 */
final class Fixtures {

    static final Hash INSTANCE_ID = new Hash("0x" + "1d".repeat(32));
    static final Hash DIGEST = new Hash("0x" + "d1".repeat(32));
    static final Hash ON_CHAIN_TX = new Hash("0x" + "c0".repeat(32));
    static final List<HexData> SIGNATURES = List.of(new HexData("0x" + "51".repeat(65)), new HexData("0x" + "52".repeat(65)));

    static final Address CALLER = new Address("0x" + "ca".repeat(20));
    static final Address TOKEN = new Address("0x" + "70".repeat(20));
    static final Address OTHER = new Address("0x" + "07".repeat(20));

    static final Hash TRANSFER = new Hash("0xddf252ad1be2c89b69c2b068fc378daa952ba7f163c4a11628f55a4df523b3ef");
    static final Hash ALICE = new Hash("0x" + "00".repeat(12) + "a1".repeat(20));
    static final Hash BOB = new Hash("0x" + "00".repeat(12) + "b0".repeat(20));

    private Fixtures() {
    }

    static EthMessage message(long sequence) {
        return new EthMessage(CALLER, TOKEN, BigInteger.ZERO, HexData.fromBytes(longBytes(sequence)), sequence);
    }

    static Hash txHash(EthMessage message) {
        return KeccakProtocolHasher.INSTANCE.messageHash(INSTANCE_ID, message);
    }

    static Hash valueHash(RawValue value) {
        return KeccakProtocolHasher.INSTANCE.valueHash(value);
    }

    static EvmLog log(Address contract, Hash... topics) {
        return new EvmLog(contract, List.of(topics), HexData.fromBytes(new byte[] {0x2a}));
    }

    static EvmLog log(Address contract, long payload, Hash... topics) {
        return new EvmLog(contract, List.of(topics), HexData.fromBytes(longBytes(payload)));
    }

    static ProposalResults proposal(long sequence, Hash digest) {
        return new ProposalResults(sequence, Hash.ZERO, new TimeBounds(100, 200),
                new Hash("0x" + "1b".repeat(32)), new Hash("0x" + "0b".repeat(32)), digest);
    }

    static FinalizedAssertion assertion(long sequence, List<RawValue> logs, int newLogCount) {
        return new FinalizedAssertion(DIGEST, proposal(sequence, DIGEST), logs, newLogCount, SIGNATURES, ON_CHAIN_TX);
    }

    /**
     * Assertion whose logs are all new.
     */
    static FinalizedAssertion assertion(long sequence, RawValue... logs) {
        return assertion(sequence, List.of(logs), logs.length);
    }

    private static byte[] longBytes(long value) {
        return ByteBuffer.allocate(Long.BYTES).putLong(value).array();
    }

    /**
     * Decoder backed by registered outcomes. Values that were never registered
     * fail to decode.
     */
    static final class MapDecoder implements EvmResultDecoder {
        private final Map<RawValue, EvmResult> results = new ConcurrentHashMap<>();
        private final AtomicInteger counter = new AtomicInteger();

        RawValue stop(EthMessage message, EvmLog... logs) {
            return register(new EvmResult.Stop(message, List.of(logs)));
        }

        RawValue returned(EthMessage message, EvmLog... logs) {
            return register(new EvmResult.Return(message, List.of(logs), new HexData("0x01")));
        }

        RawValue revert(EthMessage message) {
            return register(new EvmResult.Revert(message, new HexData("0x08c379a0")));
        }

        /**
         * A raw value the decoder does not understand.
         */
        RawValue garbage() {
            return RawValue.of(ByteBuffer.allocate(5).put((byte) 0xEE).putInt(counter.incrementAndGet()).array());
        }

        private RawValue register(EvmResult result) {
            RawValue raw = RawValue.of(ByteBuffer.allocate(5).put((byte) 0xAA).putInt(counter.incrementAndGet()).array());
            results.put(raw, result);
            return raw;
        }

        @Override
        public EvmResult decode(RawValue value) throws LogDecodingException {
            EvmResult result = results.get(value);
            if (result == null) {
                throw new LogDecodingException("unrecognized outcome " + value.encoded().value());
            }
            return result;
        }
    }
}
