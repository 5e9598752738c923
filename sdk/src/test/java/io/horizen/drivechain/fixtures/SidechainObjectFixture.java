package io.horizen.drivechain.fixtures;

import io.horizen.drivechain.model.BundleStatus;
import io.horizen.drivechain.model.Deposit;
import io.horizen.drivechain.model.WithdrawalBundle;
import io.horizen.drivechain.model.WithdrawalRequest;
import io.horizen.drivechain.model.WithdrawalStatus;
import io.horizen.drivechain.transaction.MainchainTransaction;
import io.horizen.drivechain.transaction.MainchainTxInput;
import io.horizen.drivechain.transaction.MainchainTxOutput;
import io.horizen.drivechain.transaction.OutPoint;
import io.horizen.drivechain.utils.BytesUtils;

import java.util.Arrays;
import java.util.Collections;

public class SidechainObjectFixture {

    // Segwit transaction: 1 input with 2 witness items, 1 P2WPKH output, lock time 100.
    public static final String SEGWIT_TX_HEX = "0200000000010111111111111111111111111111111111111111111111111111111111111111110100000000feffffff0150c300000000000016001422222222222222222222222222222222222222220203aabbcc04ddeeff0064000000";
    // The same transaction without witness data.
    public static final String SEGWIT_TX_BASE_HEX = "020000000111111111111111111111111111111111111111111111111111111111111111110100000000feffffff0150c3000000000000160014222222222222222222222222222222222222222264000000";
    public static final String SEGWIT_TX_ID = "8aab8bfd0cf7c3656a3c7eb191449228c9bd24b2cf92f3b4f9731f4b7805f6f2";
    public static final String SEGWIT_TX_WITNESS_ID = "567afb8777e4f5b5b0a5899eca7af2b3957fbbec5d111f954e28ed143586fccb";

    public static MainchainTransaction getSegwitTransaction() {
        byte[] prevTxHash = new byte[32];
        Arrays.fill(prevTxHash, (byte) 0x11);
        MainchainTxInput input = new MainchainTxInput(new OutPoint(prevTxHash, 1), new byte[0], 0xfffffffeL,
                Arrays.asList(BytesUtils.fromHexString("aabbcc"), BytesUtils.fromHexString("ddeeff00")));
        MainchainTxOutput output = new MainchainTxOutput(50000,
                BytesUtils.fromHexString("00142222222222222222222222222222222222222222"));
        return new MainchainTransaction(2, Collections.singletonList(input), Collections.singletonList(output), 100);
    }

    public static MainchainTransaction getLegacyTransaction() {
        return new MainchainTransaction(2,
                Collections.singletonList(new MainchainTxInput(getSegwitTransaction().inputs().get(0).prevOut(), new byte[0], 0xfffffffeL)),
                getSegwitTransaction().outputs(),
                100);
    }

    public static WithdrawalRequest getWithdrawalRequest(long fee) {
        return getWithdrawalRequest(0, "mSomeAddr", 100000000L, fee, WithdrawalStatus.Unspent);
    }

    public static WithdrawalRequest getWithdrawalRequest(int sidechain, String destination, long amount, long fee, WithdrawalStatus status) {
        return new WithdrawalRequest(sidechain, destination, amount, fee, status, new byte[32]);
    }

    public static WithdrawalBundle getWithdrawalBundle(int sidechain, int height) {
        return new WithdrawalBundle(sidechain, getSegwitTransaction(), BundleStatus.Created, height);
    }

    public static Deposit getDeposit() {
        byte[] keyId = new byte[20];
        Arrays.fill(keyId, (byte) 0x33);
        return new Deposit(1, keyId, 250000000L, getLegacyTransaction(), 0);
    }
}
