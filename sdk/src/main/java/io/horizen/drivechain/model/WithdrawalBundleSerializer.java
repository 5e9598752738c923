package io.horizen.drivechain.model;

import io.horizen.drivechain.serialization.MainchainBytesReader;
import io.horizen.drivechain.serialization.MainchainBytesWriter;
import io.horizen.drivechain.transaction.MainchainTransaction;
import io.horizen.drivechain.transaction.MainchainTransactionSerializer;

/**
 * Fields order:
 * - uint8 sidechain number
 * - MC transaction
 * - status byte
 */
public final class WithdrawalBundleSerializer implements SidechainObjectSerializer<WithdrawalBundle> {
    private static final WithdrawalBundleSerializer serializer = new WithdrawalBundleSerializer();

    private WithdrawalBundleSerializer() {
        super();
    }

    public static WithdrawalBundleSerializer getSerializer() {
        return serializer;
    }

    @Override
    public SidechainObjectType objectType() {
        return SidechainObjectType.WithdrawalBundleOp;
    }

    @Override
    public void serialize(WithdrawalBundle bundle, MainchainBytesWriter writer) {
        writer.put((byte) bundle.sidechainNumber());
        MainchainTransactionSerializer.getSerializer().serialize(bundle.transaction(), writer);
        writer.put(bundle.status().code());
    }

    @Override
    public WithdrawalBundle parse(MainchainBytesReader reader) {
        int sidechainNumber = reader.readByte("sidechain number") & 0xFF;
        MainchainTransaction transaction = MainchainTransactionSerializer.getSerializer().parse(reader);
        byte statusCode = reader.readByte("status");
        BundleStatus status = BundleStatus.fromCode(statusCode)
                .orElseThrow(() -> new IllegalArgumentException("Unknown bundle status " + statusCode));

        return new WithdrawalBundle(sidechainNumber, transaction, status);
    }
}
