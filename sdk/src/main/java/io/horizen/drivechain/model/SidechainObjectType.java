package io.horizen.drivechain.model;

import java.util.Optional;

// Tag byte which prefixes every encoded sidechain object.
public enum SidechainObjectType {
    WithdrawalOp((byte)'W'),
    WithdrawalBundleOp((byte)'P'),
    DepositOp((byte)'D');

    private final byte id;

    SidechainObjectType(byte id) {
        this.id = id;
    }

    public byte id() {
        return id;
    }

    public static Optional<SidechainObjectType> fromId(byte id) {
        for (SidechainObjectType type : values()) {
            if (type.id == id)
                return Optional.of(type);
        }
        return Optional.empty();
    }
}
