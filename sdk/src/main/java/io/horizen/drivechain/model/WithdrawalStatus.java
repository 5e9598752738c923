package io.horizen.drivechain.model;

import java.util.Optional;

// Withdrawal request lifecycle: Unspent -> InBundle -> Spent, never backwards.
public enum WithdrawalStatus {
    Unspent((byte)'u', "Unspent"),
    InBundle((byte)'p', "Pending - in WT^"),
    Spent((byte)'s', "Spent");

    public static final String UNKNOWN_STATUS = "Unknown";

    private final byte code;
    private final String description;

    WithdrawalStatus(byte code, String description) {
        this.code = code;
        this.description = description;
    }

    public byte code() {
        return code;
    }

    public String description() {
        return description;
    }

    public boolean canTransitionTo(WithdrawalStatus next) {
        return next.ordinal() >= this.ordinal();
    }

    public static Optional<WithdrawalStatus> fromCode(byte code) {
        for (WithdrawalStatus status : values()) {
            if (status.code == code)
                return Optional.of(status);
        }
        return Optional.empty();
    }

    // Status bytes coming from old or foreign records are displayed, never rejected.
    public static String describe(byte code) {
        return fromCode(code).map(WithdrawalStatus::description).orElse(UNKNOWN_STATUS);
    }
}
