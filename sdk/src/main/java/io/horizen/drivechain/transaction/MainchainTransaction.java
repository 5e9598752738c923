package io.horizen.drivechain.transaction;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonView;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.horizen.drivechain.json.ReverseBytesSerializer;
import io.horizen.drivechain.serialization.MainchainSerializable;
import io.horizen.drivechain.serialization.Views;
import io.horizen.drivechain.utils.BytesUtils;
import io.horizen.drivechain.utils.Utils;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.ArrayList;
import java.util.Objects;

/**
 * MC transaction as it is embedded into withdrawal bundles and deposits.
 * The representation is kept byte exact: serializing a parsed transaction gives back the original bytes.
 */
@JsonView(Views.Default.class)
public final class MainchainTransaction implements MainchainSerializable {

    @JsonProperty("version")
    private final int version;

    @JsonProperty("vin")
    private final List<MainchainTxInput> inputs;

    @JsonProperty("vout")
    private final List<MainchainTxOutput> outputs;

    @JsonProperty("locktime")
    private final long lockTime;

    public MainchainTransaction(int version, List<MainchainTxInput> inputs, List<MainchainTxOutput> outputs, long lockTime) {
        if (lockTime < 0 || lockTime > 0xFFFFFFFFL)
            throw new IllegalArgumentException("Lock time " + lockTime + " doesn't fit uint32");
        // Empty inputs vector is serialized as 0x00, the same byte as the extended format marker.
        if (Objects.requireNonNull(inputs, "inputs").isEmpty())
            throw new IllegalArgumentException("Transaction should have at least one input");
        this.version = version;
        this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        this.outputs = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(outputs, "outputs")));
        this.lockTime = lockTime;
    }

    public int version() {
        return version;
    }

    public List<MainchainTxInput> inputs() {
        return inputs;
    }

    public List<MainchainTxOutput> outputs() {
        return outputs;
    }

    public long lockTime() {
        return lockTime;
    }

    public boolean hasWitness() {
        for (MainchainTxInput input : inputs)
            if (input.hasWitness())
                return true;
        return false;
    }

    // Transaction id: hash of the serialization without witness data, internal byte order.
    public byte[] hash() {
        return Utils.doubleSHA256Hash(MainchainTransactionSerializer.getSerializer().toBytesWithoutWitness(this));
    }

    // Hash including witness data, equals to hash() for non-segwit transactions.
    public byte[] witnessHash() {
        return Utils.doubleSHA256Hash(bytes());
    }

    @JsonProperty("txid")
    @JsonSerialize(using = ReverseBytesSerializer.class)
    private byte[] txid() {
        return hash();
    }

    @Override
    public MainchainTransactionSerializer serializer() {
        return MainchainTransactionSerializer.getSerializer();
    }

    @Override
    public byte[] bytes() {
        return serializer().toBytes(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(bytes(), ((MainchainTransaction) o).bytes());
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes());
    }

    @Override
    public String toString() {
        StringBuilder str = new StringBuilder();
        str.append(String.format("CTransaction(hash=%s, ver=%d, vin.size=%d, vout.size=%d, nLockTime=%d)\n",
                BytesUtils.toMainchainHexString(hash()).substring(0, 10), version, inputs.size(), outputs.size(), lockTime));
        for (MainchainTxInput input : inputs)
            str.append("    ").append(input).append("\n");
        for (MainchainTxInput input : inputs) {
            StringBuilder witness = new StringBuilder();
            for (byte[] item : input.witness()) {
                if (witness.length() > 0)
                    witness.append(" ");
                witness.append(BytesUtils.toHexString(item));
            }
            str.append("    CScriptWitness(").append(witness).append(")\n");
        }
        for (MainchainTxOutput output : outputs)
            str.append("    ").append(output).append("\n");
        return str.toString();
    }
}
