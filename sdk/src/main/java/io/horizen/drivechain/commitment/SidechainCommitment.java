package io.horizen.drivechain.commitment;

import io.horizen.drivechain.model.SidechainObject;
import io.horizen.drivechain.model.SidechainObjectCodec;
import io.horizen.drivechain.utils.BytesUtils;

import java.util.Arrays;
import java.util.Optional;

/**
 * Data only MC output script which carries an encoded sidechain object:
 * OP_RETURN, 4 bytes of magic, then the tag and fields produced by {@link SidechainObjectCodec}.
 */
public final class SidechainCommitment {
    public static final byte OP_RETURN = (byte) 0x6a;

    private static final byte[] HEADER = new byte[] { OP_RETURN, (byte) 0xAC, (byte) 0xDC, (byte) 0xF6, (byte) 0x6F };

    public static final int HEADER_LENGTH = HEADER.length;

    private SidechainCommitment() {}

    public static byte[] header() {
        return Arrays.copyOf(HEADER, HEADER.length);
    }

    public static byte[] build(SidechainObject obj) {
        byte[] payload = SidechainObjectCodec.encode(obj);
        byte[] script = new byte[HEADER_LENGTH + payload.length];
        System.arraycopy(HEADER, 0, script, 0, HEADER_LENGTH);
        System.arraycopy(payload, 0, script, HEADER_LENGTH, payload.length);
        return script;
    }

    public static boolean isCommitment(byte[] script) {
        return BytesUtils.startsWith(script, HEADER);
    }

    /**
     * Returns the committed object, or empty if the script is not a sidechain commitment
     * or its payload is not a known sidechain object.
     * @throws io.horizen.drivechain.model.MalformedSidechainObjectException if the payload has a known tag but broken fields
     */
    public static Optional<SidechainObject> parse(byte[] script) {
        if (!isCommitment(script))
            return Optional.empty();
        return SidechainObjectCodec.decode(Arrays.copyOfRange(script, HEADER_LENGTH, script.length));
    }
}
