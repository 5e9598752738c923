package io.horizen.drivechain.utils;

// Representation of Bitcoin CompactSize, which has different actual size depending on value: from 1 to 9 bytes.
public final class CompactSize {
    /**
     * The maximum size of a serialized object in bytes or number of elements
     * (for eg vectors) when the size is encoded as CompactSize.
     */
    public static final long MAX_SERIALIZED_COMPACT_SIZE = 0x02000000L;

    private final long value;
    private final int size;

    public CompactSize(long value) {
        this(value, getSize(value));
    }

    public CompactSize(long value, int size) {
        this.value = value;
        this.size = size;
    }

    public long value() {
        return value;
    }

    public int size() {
        return size;
    }

    public static int getSize(long value) {
        if(value >>> 32 != 0)
            return 9;
        if(value >>> 16 != 0)
            return 5;
        if(value >= 253)
            return 3;
        return 1;
    }
}
