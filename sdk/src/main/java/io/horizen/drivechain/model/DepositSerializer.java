package io.horizen.drivechain.model;

import io.horizen.drivechain.serialization.MainchainBytesReader;
import io.horizen.drivechain.serialization.MainchainBytesWriter;
import io.horizen.drivechain.transaction.MainchainTransaction;
import io.horizen.drivechain.transaction.MainchainTransactionSerializer;
import io.horizen.drivechain.utils.Utils;

/**
 * Fields order:
 * - uint8 sidechain number
 * - 20 bytes key id
 * - int64 user payout
 * - MC deposit transaction
 * - uint32 deposit output index
 */
public final class DepositSerializer implements SidechainObjectSerializer<Deposit> {
    private static final DepositSerializer serializer = new DepositSerializer();

    private DepositSerializer() {
        super();
    }

    public static DepositSerializer getSerializer() {
        return serializer;
    }

    @Override
    public SidechainObjectType objectType() {
        return SidechainObjectType.DepositOp;
    }

    @Override
    public void serialize(Deposit deposit, MainchainBytesWriter writer) {
        writer.put((byte) deposit.sidechainNumber());
        writer.putBytes(deposit.keyId());
        writer.putReversedLong(deposit.payoutAmount());
        MainchainTransactionSerializer.getSerializer().serialize(deposit.transaction(), writer);
        writer.putReversedUnsignedInt(deposit.outputIndex());
    }

    @Override
    public Deposit parse(MainchainBytesReader reader) {
        int sidechainNumber = reader.readByte("sidechain number") & 0xFF;
        byte[] keyId = reader.readBytes(Utils.HASH160_LENGTH, "key id");
        long payoutAmount = reader.readReversedLong("payout amount");
        MainchainTransaction transaction = MainchainTransactionSerializer.getSerializer().parse(reader);
        long outputIndex = reader.readReversedUnsignedInt("output index");

        return new Deposit(sidechainNumber, keyId, payoutAmount, transaction, outputIndex);
    }
}
