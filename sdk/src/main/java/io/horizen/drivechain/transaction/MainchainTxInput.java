package io.horizen.drivechain.transaction;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonView;
import io.horizen.drivechain.serialization.Views;
import io.horizen.drivechain.utils.BytesUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

@JsonView(Views.Default.class)
public final class MainchainTxInput {
    public static final long SEQUENCE_FINAL = 0xFFFFFFFFL;

    @JsonProperty("prevout")
    private final OutPoint prevOut;

    @JsonProperty("scriptSig")
    private final byte[] scriptSig;

    @JsonProperty("sequence")
    private final long sequence;

    @JsonProperty("witness")
    private final List<byte[]> witness;

    public MainchainTxInput(OutPoint prevOut, byte[] scriptSig, long sequence) {
        this(prevOut, scriptSig, sequence, Collections.emptyList());
    }

    public MainchainTxInput(OutPoint prevOut, byte[] scriptSig, long sequence, List<byte[]> witness) {
        if (sequence < 0 || sequence > SEQUENCE_FINAL)
            throw new IllegalArgumentException("Input sequence " + sequence + " doesn't fit uint32");
        this.prevOut = Objects.requireNonNull(prevOut, "prevOut");
        this.scriptSig = Arrays.copyOf(scriptSig, scriptSig.length);
        this.sequence = sequence;
        List<byte[]> items = new ArrayList<>(witness.size());
        for (byte[] item : witness)
            items.add(Arrays.copyOf(item, item.length));
        this.witness = Collections.unmodifiableList(items);
    }

    public OutPoint prevOut() {
        return prevOut;
    }

    public byte[] scriptSig() {
        return Arrays.copyOf(scriptSig, scriptSig.length);
    }

    public long sequence() {
        return sequence;
    }

    public List<byte[]> witness() {
        return witness;
    }

    public boolean hasWitness() {
        return !witness.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MainchainTxInput that = (MainchainTxInput) o;
        if (sequence != that.sequence || !prevOut.equals(that.prevOut) || !Arrays.equals(scriptSig, that.scriptSig))
            return false;
        if (witness.size() != that.witness.size())
            return false;
        for (int i = 0; i < witness.size(); i++)
            if (!Arrays.equals(witness.get(i), that.witness.get(i)))
                return false;
        return true;
    }

    @Override
    public int hashCode() {
        return Objects.hash(prevOut, sequence) * 31 + Arrays.hashCode(scriptSig);
    }

    @Override
    public String toString() {
        StringBuilder str = new StringBuilder("CTxIn(");
        str.append(prevOut);
        String scriptHex = BytesUtils.toHexString(scriptSig);
        if (prevOut.isNull())
            str.append(", coinbase ").append(scriptHex);
        else
            str.append(", scriptSig=").append(scriptHex, 0, Math.min(24, scriptHex.length()));
        if (sequence != SEQUENCE_FINAL)
            str.append(", nSequence=").append(sequence);
        str.append(")");
        return str.toString();
    }
}
