package io.horizen.drivechain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonView;
import io.horizen.drivechain.serialization.MainchainBytesWriter;
import io.horizen.drivechain.serialization.Views;
import io.horizen.drivechain.transaction.MainchainTransaction;

import java.util.Objects;

/**
 * WT^: MC transaction which pays out a set of withdrawal requests.
 * The MC height the bundle was observed at is tracked next to the object: it is not serialized and
 * doesn't take part in the object identity.
 */
@JsonView(Views.Default.class)
public final class WithdrawalBundle extends SidechainObject {

    @JsonProperty("transaction")
    private final MainchainTransaction transaction;

    @JsonProperty("status")
    private final BundleStatus status;

    @JsonProperty("height")
    private final int height;

    public WithdrawalBundle(int sidechainNumber, MainchainTransaction transaction, BundleStatus status) {
        this(sidechainNumber, transaction, status, 0);
    }

    public WithdrawalBundle(int sidechainNumber, MainchainTransaction transaction, BundleStatus status, int height) {
        super(sidechainNumber);
        if (height < 0)
            throw new IllegalArgumentException("Bundle height " + height + " is negative");
        this.transaction = Objects.requireNonNull(transaction, "transaction");
        this.status = Objects.requireNonNull(status, "status");
        this.height = height;
    }

    @Override
    public SidechainObjectType objectType() {
        return SidechainObjectType.WithdrawalBundleOp;
    }

    public MainchainTransaction transaction() {
        return transaction;
    }

    public BundleStatus status() {
        return status;
    }

    public String statusString() {
        return status.description();
    }

    public int height() {
        return height;
    }

    public WithdrawalBundle withStatus(BundleStatus newStatus) {
        if (!status.canTransitionTo(newStatus))
            throw new IllegalStateException(String.format("Bundle status can't change from %s to %s", status, newStatus));
        return new WithdrawalBundle(sidechainNumber, transaction, newStatus, height);
    }

    public WithdrawalBundle withHeight(int newHeight) {
        return new WithdrawalBundle(sidechainNumber, transaction, status, newHeight);
    }

    @Override
    public WithdrawalBundleSerializer serializer() {
        return WithdrawalBundleSerializer.getSerializer();
    }

    @Override
    void serializeFields(MainchainBytesWriter writer) {
        serializer().serialize(this, writer);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WithdrawalBundle that = (WithdrawalBundle) o;
        return sidechainNumber == that.sidechainNumber
                && status == that.status
                && transaction.equals(that.transaction);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sidechainNumber, transaction, status);
    }

    @Override
    public String toString() {
        return "sidechainop=" + (char) objectType().id() + "\n" +
                "nSidechain=" + sidechainNumber + "\n" +
                "wtprime=" + transaction + "\n" +
                "status=" + statusString() + "\n";
    }
}
