package io.horizen.drivechain.transaction;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonView;
import io.horizen.drivechain.serialization.Views;
import io.horizen.drivechain.utils.BytesUtils;
import io.horizen.drivechain.utils.CoinsUtils;

import java.util.Arrays;
import java.util.Objects;

@JsonView(Views.Default.class)
public final class MainchainTxOutput {

    @JsonProperty("value")
    private final long value;

    @JsonProperty("scriptPubKey")
    private final byte[] scriptPubKey;

    public MainchainTxOutput(long value, byte[] scriptPubKey) {
        this.value = value;
        this.scriptPubKey = Arrays.copyOf(scriptPubKey, scriptPubKey.length);
    }

    public long value() {
        return value;
    }

    public byte[] scriptPubKey() {
        return Arrays.copyOf(scriptPubKey, scriptPubKey.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MainchainTxOutput that = (MainchainTxOutput) o;
        return value == that.value && Arrays.equals(scriptPubKey, that.scriptPubKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value) * 31 + Arrays.hashCode(scriptPubKey);
    }

    @Override
    public String toString() {
        String scriptHex = BytesUtils.toHexString(scriptPubKey);
        return String.format("CTxOut(nValue=%d.%08d, scriptPubKey=%s)",
                value / CoinsUtils.COIN, value % CoinsUtils.COIN, scriptHex.substring(0, Math.min(30, scriptHex.length())));
    }
}
