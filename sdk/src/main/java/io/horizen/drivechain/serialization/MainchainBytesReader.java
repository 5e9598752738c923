package io.horizen.drivechain.serialization;

import io.horizen.drivechain.utils.BytesUtils;
import io.horizen.drivechain.utils.CompactSize;

import java.util.Arrays;

/**
 * Sequential reader of MC consensus serialized data.
 * Every read is checked against the bytes actually remaining in the buffer, declared lengths included.
 * Violations are reported with {@link IllegalArgumentException}.
 */
public final class MainchainBytesReader {
    private final byte[] bytes;
    private int offset;

    public MainchainBytesReader(byte[] bytes) {
        this(bytes, 0);
    }

    public MainchainBytesReader(byte[] bytes, int offset) {
        if(offset < 0 || offset > bytes.length)
            throw new IllegalArgumentException("Offset is out of array bounds");
        this.bytes = bytes;
        this.offset = offset;
    }

    public int remaining() {
        return bytes.length - offset;
    }

    public byte readByte(String type) {
        if (remaining() < 1) {
            throw new IllegalArgumentException(String.format("Bytes remaining in buffer %d are not enough " +
                    "to parse one byte for %s", remaining(), type));
        }
        return bytes[offset++];
    }

    public byte[] readBytes(long needed, String type) {
        if (needed < 0 || needed > remaining()) {
            throw new IllegalArgumentException(String.format("Bytes remaining in buffer %d are not enough " +
                    "to parse %s of length %d.", remaining(), type, needed));
        }
        byte[] res = Arrays.copyOfRange(bytes, offset, offset + (int) needed);
        offset += (int) needed;
        return res;
    }

    public int readReversedInt(String type) {
        checkRemaining(Integer.BYTES, type);
        int value = BytesUtils.getReversedInt(bytes, offset);
        offset += Integer.BYTES;
        return value;
    }

    public long readReversedUnsignedInt(String type) {
        return readReversedInt(type) & 0xFFFFFFFFL;
    }

    public long readReversedLong(String type) {
        checkRemaining(Long.BYTES, type);
        long value = BytesUtils.getReversedLong(bytes, offset);
        offset += Long.BYTES;
        return value;
    }

    public long readCompactSize(String type) {
        CompactSize size;
        try {
            size = BytesUtils.getCompactSize(bytes, offset);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(String.format("Invalid CompactSize for %s: %s", type, e.getMessage()), e);
        }
        offset += size.size();
        return size.value();
    }

    // CompactSize length followed by the data itself, as MC serializes std::vector<unsigned char> and std::string.
    public byte[] readVarBytes(String type) {
        long length = readCompactSize(type + " length");
        return readBytes(length, type);
    }

    public void bufferShouldBeEmpty(String type) {
        if (remaining() != 0) {
            throw new IllegalArgumentException(String.format("There's more data in the buffer than required " +
                    "to parse %s: %d bytes left", type, remaining()));
        }
    }

    private void checkRemaining(int needed, String type) {
        if (needed > remaining()) {
            throw new IllegalArgumentException(String.format("Bytes remaining in buffer %d are not enough " +
                    "to parse %s of length %d.", remaining(), type, needed));
        }
    }
}
