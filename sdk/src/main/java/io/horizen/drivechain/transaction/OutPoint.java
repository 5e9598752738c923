package io.horizen.drivechain.transaction;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonView;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.horizen.drivechain.json.ReverseBytesSerializer;
import io.horizen.drivechain.serialization.Views;
import io.horizen.drivechain.utils.BytesUtils;
import io.horizen.drivechain.utils.Utils;

import java.util.Arrays;
import java.util.Objects;

// Reference to an output of a previous MC transaction: txid in internal (LE) byte order and output index.
@JsonView(Views.Default.class)
public final class OutPoint {
    public static final long NULL_INDEX = 0xFFFFFFFFL;

    @JsonProperty("txid")
    @JsonSerialize(using = ReverseBytesSerializer.class)
    private final byte[] txHash;

    @JsonProperty("vout")
    private final long index;

    public OutPoint(byte[] txHash, long index) {
        if (txHash.length != Utils.SHA256_LENGTH)
            throw new IllegalArgumentException("Incorrect outpoint transaction hash length " + txHash.length);
        if (index < 0 || index > NULL_INDEX)
            throw new IllegalArgumentException("Outpoint index " + index + " doesn't fit uint32");
        this.txHash = Arrays.copyOf(txHash, txHash.length);
        this.index = index;
    }

    public byte[] txHash() {
        return Arrays.copyOf(txHash, txHash.length);
    }

    public long index() {
        return index;
    }

    @JsonIgnore
    public boolean isNull() {
        return index == NULL_INDEX && Arrays.equals(txHash, new byte[Utils.SHA256_LENGTH]);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OutPoint outPoint = (OutPoint) o;
        return index == outPoint.index && Arrays.equals(txHash, outPoint.txHash);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(index) + Arrays.hashCode(txHash);
    }

    @Override
    public String toString() {
        return String.format("COutPoint(%s, %d)", BytesUtils.toMainchainHexString(txHash).substring(0, 10), index);
    }
}
