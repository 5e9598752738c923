package io.horizen.drivechain.utils;

import com.google.common.io.BaseEncoding;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import com.google.common.primitives.Shorts;

import java.util.Arrays;

public final class BytesUtils {
    private BytesUtils() {}

    // Get Reversed Short value from byte array starting from an offset position without copying an array
    public static short getReversedShort(byte[] bytes, int offset) {
        checkBounds(bytes, offset, Short.BYTES);
        return Shorts.fromBytes(bytes[offset + 1],
                                bytes[offset]);
    }

    // Get Reversed Int value from byte array starting from an offset position without copying an array
    public static int getReversedInt(byte[] bytes, int offset) {
        checkBounds(bytes, offset, Integer.BYTES);
        return Ints.fromBytes(  bytes[offset + 3],
                                bytes[offset + 2],
                                bytes[offset + 1],
                                bytes[offset]);
    }

    // Get Reversed Long value from byte array starting from an offset position without copying an array
    public static long getReversedLong(byte[] bytes, int offset) {
        checkBounds(bytes, offset, Long.BYTES);
        return Longs.fromBytes( bytes[offset + 7],
                                bytes[offset + 6],
                                bytes[offset + 5],
                                bytes[offset + 4],
                                bytes[offset + 3],
                                bytes[offset + 2],
                                bytes[offset + 1],
                                bytes[offset]);
    }

    // Little endian representation of an int, as MC stores int32 and uint32 values.
    public static byte[] toReversedIntBytes(int value) {
        return reverseBytes(Ints.toByteArray(value));
    }

    // Little endian representation of a long, as MC stores CAmount values.
    public static byte[] toReversedLongBytes(long value) {
        return reverseBytes(Longs.toByteArray(value));
    }

    // Bitcoin `ReadCompactSize` method return value which length is from 1 to 9 bytes, starting from an offset position without copying an array.
    // Note: original "value" in bitcoin is stored in little endian (reversed).
    // Used in std::vectors serialization to store the length of the vector.
    public static CompactSize getCompactSize(byte[] bytes, int offset) {
        checkBounds(bytes, offset, 1);

        byte first = bytes[offset];
        int size;
        long value;
        switch(first) {
            case (byte)253:
                size = 3;
                value = getReversedShort(bytes, offset + 1) & 0xFFFF;
                if(value < 253)
                    throw new IllegalArgumentException("CompactSize: non-canonical value");
                break;

            case (byte)254:
                size = 5;
                value = getReversedInt(bytes, offset + 1) & 0xFFFFFFFFL;
                if(value < 0x10000L)
                    throw new IllegalArgumentException("CompactSize: non-canonical value");
                break;

            case (byte)255:
                size = 9;
                value = getReversedLong(bytes, offset + 1);
                if(Long.compareUnsigned(value, 0x100000000L) < 0)
                    throw new IllegalArgumentException("CompactSize: non-canonical value");
                break;

            default:
                size = 1;
                value = first & 0xFF;
        }
        if(Long.compareUnsigned(value, CompactSize.MAX_SERIALIZED_COMPACT_SIZE) > 0)
            throw new IllegalArgumentException("CompactSize: size too large");

        return new CompactSize(value, size);
    }

    // Get byte array representation of CompactSize value
    // Note: we write the data in LE as MC does.
    public static byte[] toCompactSizeBytes(CompactSize vi) {
        byte[] res = new byte[vi.size()];
        switch (vi.size()) {
            case 1:
                res[0] = (byte) (vi.value() & 255L);
                break;

            case 3:
                res[0] = (byte)253;
                res[1] = (byte) (vi.value() & 255L);
                res[2] = (byte) ((vi.value() >> 8) & 255L);
                break;

            case 5:
                res[0] = (byte)254;
                System.arraycopy(toReversedIntBytes((int) vi.value()), 0, res, 1, 4);
                break;

            case 9:
                res[0] = (byte)255;
                System.arraycopy(toReversedLongBytes(vi.value()), 0, res, 1, 8);
                break;

            default: throw new IllegalArgumentException("Incorrect size of CompactSize had been detected:" + vi.size());
        }
        return res;
    }

    // Get reversed copy of byte array
    public static byte[] reverseBytes(byte[] bytes) {
        byte[] res = new byte[bytes.length];
        for (int i = 0; i < bytes.length; i++)
            res[i] = bytes[bytes.length - 1 - i];
        return res;
    }

    // Get byte array from hex string;
    public static byte[] fromHexString(String hex) {
        return BaseEncoding.base16().lowerCase().decode(hex.toLowerCase());
    }

    // Get hex string representation of byte array
    public static String toHexString(byte[] bytes) {
        return BaseEncoding.base16().lowerCase().encode(bytes);
    }

    // MC uint256/uint160 values are displayed in reversed byte order.
    public static String toMainchainHexString(byte[] bytes) {
        return toHexString(reverseBytes(bytes));
    }

    public static byte[] fromMainchainHexString(String hex) {
        return reverseBytes(fromHexString(hex));
    }

    public static boolean startsWith(byte[] bytes, byte[] prefix) {
        return bytes.length >= prefix.length && Arrays.equals(bytes, 0, prefix.length, prefix, 0, prefix.length);
    }

    private static void checkBounds(byte[] bytes, int offset, int length) {
        if(offset < 0 || bytes.length < offset + length)
            throw new IllegalArgumentException("Value is out of array bounds");
    }
}
