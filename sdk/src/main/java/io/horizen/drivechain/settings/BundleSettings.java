package io.horizen.drivechain.settings;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.horizen.drivechain.utils.CoinsUtils;

// Limits applied when choosing the withdrawal requests of a new bundle.
public final class BundleSettings {
    public static final String CONFIG_PATH = "drivechain.bundle";

    private final int maxWithdrawals;
    private final long maxAmount;

    public BundleSettings(int maxWithdrawals, long maxAmount) {
        if (maxWithdrawals <= 0)
            throw new IllegalArgumentException("Bundle max withdrawals should be greater than zero, got " + maxWithdrawals);
        if (!CoinsUtils.isValidMoneyRange(maxAmount))
            throw new IllegalArgumentException("Bundle max amount " + maxAmount + " is out of range");
        this.maxWithdrawals = maxWithdrawals;
        this.maxAmount = maxAmount;
    }

    public static BundleSettings load() {
        return fromConfig(ConfigFactory.load());
    }

    public static BundleSettings fromConfig(Config config) {
        Config bundleConfig = config.getConfig(CONFIG_PATH);
        return new BundleSettings(bundleConfig.getInt("maxWithdrawals"), bundleConfig.getLong("maxAmount"));
    }

    public int maxWithdrawals() {
        return maxWithdrawals;
    }

    public long maxAmount() {
        return maxAmount;
    }

    @Override
    public String toString() {
        return String.format("BundleSettings(maxWithdrawals = %d, maxAmount = %s)", maxWithdrawals, CoinsUtils.formatMoney(maxAmount));
    }
}
