package io.horizen.drivechain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonView;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.horizen.drivechain.serialization.MainchainBytesWriter;
import io.horizen.drivechain.serialization.Views;
import io.horizen.drivechain.json.ReverseBytesSerializer;
import io.horizen.drivechain.transaction.MainchainTransaction;
import io.horizen.drivechain.transaction.MainchainTxInput;
import io.horizen.drivechain.transaction.MainchainTxOutput;
import io.horizen.drivechain.utils.BytesUtils;
import io.horizen.drivechain.utils.CoinsUtils;
import io.horizen.drivechain.utils.Utils;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

// Coins moved from MC into the sidechain by an output of the deposit transaction.
@JsonView(Views.Default.class)
public final class Deposit extends SidechainObject {

    @JsonProperty("keyId")
    @JsonSerialize(using = ReverseBytesSerializer.class)
    private final byte[] keyId;

    @JsonProperty("payout")
    private final long payoutAmount;

    @JsonProperty("transaction")
    private final MainchainTransaction transaction;

    @JsonProperty("n")
    private final long outputIndex;

    public Deposit(int sidechainNumber, byte[] keyId, long payoutAmount, MainchainTransaction transaction, long outputIndex) {
        super(sidechainNumber);
        if (keyId.length != Utils.HASH160_LENGTH)
            throw new IllegalArgumentException("Incorrect key id length " + keyId.length);
        if (!CoinsUtils.isValidMoneyRange(payoutAmount))
            throw new IllegalArgumentException("Deposit payout " + payoutAmount + " is out of range");
        if (outputIndex < 0 || outputIndex > 0xFFFFFFFFL)
            throw new IllegalArgumentException("Deposit output index " + outputIndex + " doesn't fit uint32");

        this.keyId = Arrays.copyOf(keyId, keyId.length);
        this.payoutAmount = payoutAmount;
        this.transaction = Objects.requireNonNull(transaction, "transaction");
        this.outputIndex = outputIndex;
    }

    @Override
    public SidechainObjectType objectType() {
        return SidechainObjectType.DepositOp;
    }

    public byte[] keyId() {
        return Arrays.copyOf(keyId, keyId.length);
    }

    public long payoutAmount() {
        return payoutAmount;
    }

    public MainchainTransaction transaction() {
        return transaction;
    }

    public long outputIndex() {
        return outputIndex;
    }

    // The deposited output, empty if the index points outside of the transaction outputs.
    public Optional<MainchainTxOutput> depositOutput() {
        if (outputIndex >= transaction.outputs().size())
            return Optional.empty();
        return Optional.of(transaction.outputs().get((int) outputIndex));
    }

    @Override
    public DepositSerializer serializer() {
        return DepositSerializer.getSerializer();
    }

    @Override
    void serializeFields(MainchainBytesWriter writer) {
        serializer().serialize(this, writer);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Deposit that = (Deposit) o;
        return sidechainNumber == that.sidechainNumber
                && payoutAmount == that.payoutAmount
                && outputIndex == that.outputIndex
                && Arrays.equals(keyId, that.keyId)
                && transaction.equals(that.transaction);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(sidechainNumber, payoutAmount, transaction, outputIndex);
        result = 31 * result + Arrays.hashCode(keyId);
        return result;
    }

    @Override
    public String toString() {
        StringBuilder str = new StringBuilder();
        str.append("sidechainop=").append((char) objectType().id()).append("\n");
        str.append("nSidechain=").append(sidechainNumber).append("\n");
        str.append("keyID=").append(BytesUtils.toMainchainHexString(keyId)).append("\n");
        str.append("payout=").append(CoinsUtils.formatMoney(payoutAmount)).append("\n");
        str.append("mainchaintxid=").append(BytesUtils.toMainchainHexString(transaction.hash())).append("\n");
        str.append("n=").append(outputIndex).append("\n");
        str.append("inputs:\n");
        for (MainchainTxInput input : transaction.inputs())
            str.append(input.prevOut()).append("\n");
        return str.toString();
    }
}
