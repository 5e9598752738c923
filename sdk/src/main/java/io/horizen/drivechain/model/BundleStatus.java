package io.horizen.drivechain.model;

import java.util.Optional;

// Withdrawal bundle lifecycle: Created -> Failed or Created -> Spent, both terminal.
public enum BundleStatus {
    Created((byte)'c', "Created"),
    Failed((byte)'f', "Failed"),
    Spent((byte)'o', "Spent");

    public static final String UNKNOWN_STATUS = "Unknown";

    private final byte code;
    private final String description;

    BundleStatus(byte code, String description) {
        this.code = code;
        this.description = description;
    }

    public byte code() {
        return code;
    }

    public String description() {
        return description;
    }

    public boolean canTransitionTo(BundleStatus next) {
        return next == this || this == Created;
    }

    public static Optional<BundleStatus> fromCode(byte code) {
        for (BundleStatus status : values()) {
            if (status.code == code)
                return Optional.of(status);
        }
        return Optional.empty();
    }

    public static String describe(byte code) {
        return fromCode(code).map(BundleStatus::description).orElse(UNKNOWN_STATUS);
    }
}
