package io.horizen.drivechain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonView;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.horizen.drivechain.json.ReverseBytesSerializer;
import io.horizen.drivechain.serialization.MainchainBytesWriter;
import io.horizen.drivechain.serialization.MainchainSerializable;
import io.horizen.drivechain.serialization.Views;
import io.horizen.drivechain.utils.Utils;

/**
 * Base of the sidechain objects committed to MC: {@link WithdrawalRequest}, {@link WithdrawalBundle}
 * and {@link Deposit}. The hierarchy is closed, the constructor is visible to this package only.
 */
@JsonView(Views.Default.class)
public abstract class SidechainObject implements MainchainSerializable {
    public static final int MAX_SIDECHAIN_NUMBER = 0xFF;

    @JsonProperty("sidechain")
    protected final int sidechainNumber;

    SidechainObject(int sidechainNumber) {
        if (sidechainNumber < 0 || sidechainNumber > MAX_SIDECHAIN_NUMBER)
            throw new IllegalArgumentException("Sidechain number " + sidechainNumber + " is out of range");
        this.sidechainNumber = sidechainNumber;
    }

    @JsonProperty("type")
    public abstract SidechainObjectType objectType();

    public int sidechainNumber() {
        return sidechainNumber;
    }

    /**
     * Identity of the object: double SHA256 of the tag followed by the type specific fields.
     * Commitment header bytes are not included.
     */
    @JsonProperty("hash")
    @JsonSerialize(using = ReverseBytesSerializer.class)
    public byte[] hash() {
        return Utils.doubleSHA256Hash(SidechainObjectCodec.encode(this));
    }

    @Override
    public abstract SidechainObjectSerializer<? extends SidechainObject> serializer();

    // Type specific fields, without the tag.
    abstract void serializeFields(MainchainBytesWriter writer);

    @Override
    public byte[] bytes() {
        MainchainBytesWriter writer = new MainchainBytesWriter();
        serializeFields(writer);
        return writer.toBytes();
    }
}
