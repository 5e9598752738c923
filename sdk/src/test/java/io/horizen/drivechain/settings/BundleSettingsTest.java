package io.horizen.drivechain.settings;

import com.typesafe.config.ConfigFactory;
import io.horizen.drivechain.utils.CoinsUtils;
import org.junit.Test;

import static org.junit.Assert.*;

public class BundleSettingsTest {

    @Test
    public void loadDefaults() {
        BundleSettings settings = BundleSettings.load();
        assertEquals(255, settings.maxWithdrawals());
        assertEquals(CoinsUtils.MAX_MONEY, settings.maxAmount());
    }

    @Test
    public void fromConfig() {
        BundleSettings settings = BundleSettings.fromConfig(ConfigFactory.parseString(
                "drivechain.bundle { maxWithdrawals = 10, maxAmount = 500000000 }"));
        assertEquals(10, settings.maxWithdrawals());
        assertEquals(500000000L, settings.maxAmount());
        assertEquals("BundleSettings(maxWithdrawals = 10, maxAmount = 5.00)", settings.toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidMaxWithdrawals() {
        BundleSettings.fromConfig(ConfigFactory.parseString(
                "drivechain.bundle { maxWithdrawals = 0, maxAmount = 500000000 }"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidMaxAmount() {
        new BundleSettings(1, -1);
    }
}
