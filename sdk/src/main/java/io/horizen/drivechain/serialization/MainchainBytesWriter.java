package io.horizen.drivechain.serialization;

import io.horizen.drivechain.utils.BytesUtils;
import io.horizen.drivechain.utils.CompactSize;

import java.io.ByteArrayOutputStream;

// Writes data in MC consensus serialization format: LE fixed width integers, CompactSize lengths.
public final class MainchainBytesWriter {
    private final ByteArrayOutputStream stream = new ByteArrayOutputStream();

    public MainchainBytesWriter put(byte value) {
        stream.write(value);
        return this;
    }

    public MainchainBytesWriter putBytes(byte[] bytes) {
        stream.writeBytes(bytes);
        return this;
    }

    public MainchainBytesWriter putReversedInt(int value) {
        return putBytes(BytesUtils.toReversedIntBytes(value));
    }

    public MainchainBytesWriter putReversedUnsignedInt(long value) {
        if (value < 0 || value > 0xFFFFFFFFL)
            throw new IllegalArgumentException("Value " + value + " doesn't fit uint32");
        return putReversedInt((int) value);
    }

    public MainchainBytesWriter putReversedLong(long value) {
        return putBytes(BytesUtils.toReversedLongBytes(value));
    }

    public MainchainBytesWriter putCompactSize(long value) {
        return putBytes(BytesUtils.toCompactSizeBytes(new CompactSize(value)));
    }

    public MainchainBytesWriter putVarBytes(byte[] bytes) {
        putCompactSize(bytes.length);
        return putBytes(bytes);
    }

    public byte[] toBytes() {
        return stream.toByteArray();
    }
}
