package io.horizen.drivechain.transaction;

import io.horizen.drivechain.serialization.MainchainBytesReader;
import io.horizen.drivechain.serialization.MainchainBytesWriter;
import io.horizen.drivechain.serialization.MainchainSerializer;
import io.horizen.drivechain.utils.Utils;

import java.util.ArrayList;
import java.util.List;

/**
 * MC transaction serializer.
 * Basic format:
 * - int32 version
 * - vector of inputs
 * - vector of outputs
 * - uint32 lock time
 * Extended format, used when at least one input has witness data:
 * - int32 version
 * - 0x00 marker (looks like an empty inputs vector, so transactions without inputs are not allowed)
 * - 0x01 flags
 * - vector of inputs
 * - vector of outputs
 * - witness stack of every input
 * - uint32 lock time
 */
public final class MainchainTransactionSerializer implements MainchainSerializer<MainchainTransaction> {
    private static final byte WITNESS_FLAG = 0x01;

    private static final MainchainTransactionSerializer serializer = new MainchainTransactionSerializer();

    private MainchainTransactionSerializer() {
        super();
    }

    public static MainchainTransactionSerializer getSerializer() {
        return serializer;
    }

    @Override
    public void serialize(MainchainTransaction transaction, MainchainBytesWriter writer) {
        serialize(transaction, writer, true);
    }

    public byte[] toBytesWithoutWitness(MainchainTransaction transaction) {
        MainchainBytesWriter writer = new MainchainBytesWriter();
        serialize(transaction, writer, false);
        return writer.toBytes();
    }

    private void serialize(MainchainTransaction transaction, MainchainBytesWriter writer, boolean allowWitness) {
        boolean withWitness = allowWitness && transaction.hasWitness();

        writer.putReversedInt(transaction.version());
        if (withWitness) {
            writer.put((byte) 0x00);
            writer.put(WITNESS_FLAG);
        }

        writer.putCompactSize(transaction.inputs().size());
        for (MainchainTxInput input : transaction.inputs()) {
            writer.putBytes(input.prevOut().txHash());
            writer.putReversedUnsignedInt(input.prevOut().index());
            writer.putVarBytes(input.scriptSig());
            writer.putReversedUnsignedInt(input.sequence());
        }

        writer.putCompactSize(transaction.outputs().size());
        for (MainchainTxOutput output : transaction.outputs()) {
            writer.putReversedLong(output.value());
            writer.putVarBytes(output.scriptPubKey());
        }

        if (withWitness) {
            for (MainchainTxInput input : transaction.inputs()) {
                writer.putCompactSize(input.witness().size());
                for (byte[] item : input.witness())
                    writer.putVarBytes(item);
            }
        }

        writer.putReversedUnsignedInt(transaction.lockTime());
    }

    @Override
    public MainchainTransaction parse(MainchainBytesReader reader) {
        int version = reader.readReversedInt("transaction version");

        byte flags = 0;
        List<RawInput> rawInputs = parseInputs(reader);
        if (rawInputs.isEmpty()) {
            // Empty inputs vector means the extended format marker.
            flags = reader.readByte("transaction flags");
            if (flags == 0)
                throw new IllegalArgumentException("Transaction without inputs");
            rawInputs = parseInputs(reader);
        }
        List<MainchainTxOutput> outputs = parseOutputs(reader);

        List<List<byte[]>> witnesses = new ArrayList<>();
        if ((flags & WITNESS_FLAG) != 0) {
            flags ^= WITNESS_FLAG;
            boolean anyWitness = false;
            for (int i = 0; i < rawInputs.size(); i++) {
                long stackSize = reader.readCompactSize("witness stack size");
                List<byte[]> stack = new ArrayList<>();
                for (long j = 0; j < stackSize; j++)
                    stack.add(reader.readVarBytes("witness item"));
                anyWitness |= !stack.isEmpty();
                witnesses.add(stack);
            }
            if (!anyWitness)
                throw new IllegalArgumentException("Superfluous witness record");
        }
        if (flags != 0)
            throw new IllegalArgumentException("Unknown transaction optional data");

        long lockTime = reader.readReversedUnsignedInt("transaction lock time");

        List<MainchainTxInput> inputs = new ArrayList<>(rawInputs.size());
        for (int i = 0; i < rawInputs.size(); i++) {
            RawInput raw = rawInputs.get(i);
            if (witnesses.isEmpty())
                inputs.add(new MainchainTxInput(raw.prevOut, raw.scriptSig, raw.sequence));
            else
                inputs.add(new MainchainTxInput(raw.prevOut, raw.scriptSig, raw.sequence, witnesses.get(i)));
        }
        return new MainchainTransaction(version, inputs, outputs, lockTime);
    }

    private List<RawInput> parseInputs(MainchainBytesReader reader) {
        long count = reader.readCompactSize("inputs count");
        List<RawInput> inputs = new ArrayList<>();
        for (long i = 0; i < count; i++) {
            byte[] prevTxHash = reader.readBytes(Utils.SHA256_LENGTH, "input prevout hash");
            long prevIndex = reader.readReversedUnsignedInt("input prevout index");
            byte[] scriptSig = reader.readVarBytes("input scriptSig");
            long sequence = reader.readReversedUnsignedInt("input sequence");
            inputs.add(new RawInput(new OutPoint(prevTxHash, prevIndex), scriptSig, sequence));
        }
        return inputs;
    }

    private List<MainchainTxOutput> parseOutputs(MainchainBytesReader reader) {
        long count = reader.readCompactSize("outputs count");
        List<MainchainTxOutput> outputs = new ArrayList<>();
        for (long i = 0; i < count; i++) {
            long value = reader.readReversedLong("output value");
            byte[] scriptPubKey = reader.readVarBytes("output scriptPubKey");
            outputs.add(new MainchainTxOutput(value, scriptPubKey));
        }
        return outputs;
    }

    private static final class RawInput {
        final OutPoint prevOut;
        final byte[] scriptSig;
        final long sequence;

        RawInput(OutPoint prevOut, byte[] scriptSig, long sequence) {
            this.prevOut = prevOut;
            this.scriptSig = scriptSig;
            this.sequence = sequence;
        }
    }
}
