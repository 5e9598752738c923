package io.horizen.drivechain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonView;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.horizen.drivechain.serialization.MainchainBytesWriter;
import io.horizen.drivechain.serialization.Views;
import io.horizen.drivechain.json.ReverseBytesSerializer;
import io.horizen.drivechain.utils.BytesUtils;
import io.horizen.drivechain.utils.CoinsUtils;
import io.horizen.drivechain.utils.Utils;

import java.util.Arrays;
import java.util.Objects;

// WT: user request to move coins from the sidechain back to a MC address.
@JsonView(Views.Default.class)
public final class WithdrawalRequest extends SidechainObject {

    @JsonProperty("destination")
    private final String destination;

    @JsonProperty("amount")
    private final long amount;

    @JsonProperty("mainchainFee")
    private final long mainchainFee;

    @JsonProperty("status")
    private final WithdrawalStatus status;

    @JsonProperty("blindedTxHash")
    @JsonSerialize(using = ReverseBytesSerializer.class)
    private final byte[] blindedTxHash;

    public WithdrawalRequest(int sidechainNumber,
                             String destination,
                             long amount,
                             long mainchainFee,
                             WithdrawalStatus status,
                             byte[] blindedTxHash) {
        super(sidechainNumber);
        if (!CoinsUtils.isValidMoneyRange(amount))
            throw new IllegalArgumentException("Withdrawal amount " + amount + " is out of range");
        if (!CoinsUtils.isValidMoneyRange(mainchainFee))
            throw new IllegalArgumentException("Withdrawal mainchain fee " + mainchainFee + " is out of range");
        if (blindedTxHash.length != Utils.SHA256_LENGTH)
            throw new IllegalArgumentException("Incorrect blinded transaction hash length " + blindedTxHash.length);

        this.destination = Objects.requireNonNull(destination, "destination");
        this.amount = amount;
        this.mainchainFee = mainchainFee;
        this.status = Objects.requireNonNull(status, "status");
        this.blindedTxHash = Arrays.copyOf(blindedTxHash, blindedTxHash.length);
    }

    @Override
    public SidechainObjectType objectType() {
        return SidechainObjectType.WithdrawalOp;
    }

    public String destination() {
        return destination;
    }

    public long amount() {
        return amount;
    }

    public long mainchainFee() {
        return mainchainFee;
    }

    public WithdrawalStatus status() {
        return status;
    }

    public String statusString() {
        return status.description();
    }

    public byte[] blindedTxHash() {
        return Arrays.copyOf(blindedTxHash, blindedTxHash.length);
    }

    public WithdrawalRequest withStatus(WithdrawalStatus newStatus) {
        if (!status.canTransitionTo(newStatus))
            throw new IllegalStateException(String.format("Withdrawal status can't change from %s to %s", status, newStatus));
        return new WithdrawalRequest(sidechainNumber, destination, amount, mainchainFee, newStatus, blindedTxHash);
    }

    @Override
    public WithdrawalRequestSerializer serializer() {
        return WithdrawalRequestSerializer.getSerializer();
    }

    @Override
    void serializeFields(MainchainBytesWriter writer) {
        serializer().serialize(this, writer);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WithdrawalRequest that = (WithdrawalRequest) o;
        return sidechainNumber == that.sidechainNumber
                && amount == that.amount
                && mainchainFee == that.mainchainFee
                && status == that.status
                && destination.equals(that.destination)
                && Arrays.equals(blindedTxHash, that.blindedTxHash);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(sidechainNumber, destination, amount, mainchainFee, status);
        result = 31 * result + Arrays.hashCode(blindedTxHash);
        return result;
    }

    @Override
    public String toString() {
        return "sidechainop=" + (char) objectType().id() + "\n" +
                "nSidechain=" + sidechainNumber + "\n" +
                "destination=" + destination + "\n" +
                "amount=" + CoinsUtils.formatMoney(amount) + "\n" +
                "mainchainFee=" + CoinsUtils.formatMoney(mainchainFee) + "\n" +
                "status=" + statusString() + "\n" +
                "hashBlindWTX=" + BytesUtils.toMainchainHexString(blindedTxHash) + "\n";
    }
}
