package io.horizen.drivechain.model;

import io.horizen.drivechain.serialization.MainchainBytesReader;
import io.horizen.drivechain.serialization.MainchainBytesWriter;
import io.horizen.drivechain.utils.Utils;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Fields order:
 * - uint8 sidechain number
 * - destination string (CompactSize length + UTF-8 bytes)
 * - int64 amount
 * - int64 mainchain fee
 * - status byte
 * - 32 bytes blinded transaction hash
 */
public final class WithdrawalRequestSerializer implements SidechainObjectSerializer<WithdrawalRequest> {
    private static final WithdrawalRequestSerializer serializer = new WithdrawalRequestSerializer();

    private WithdrawalRequestSerializer() {
        super();
    }

    public static WithdrawalRequestSerializer getSerializer() {
        return serializer;
    }

    @Override
    public SidechainObjectType objectType() {
        return SidechainObjectType.WithdrawalOp;
    }

    @Override
    public void serialize(WithdrawalRequest request, MainchainBytesWriter writer) {
        writer.put((byte) request.sidechainNumber());
        writer.putVarBytes(request.destination().getBytes(StandardCharsets.UTF_8));
        writer.putReversedLong(request.amount());
        writer.putReversedLong(request.mainchainFee());
        writer.put(request.status().code());
        writer.putBytes(request.blindedTxHash());
    }

    @Override
    public WithdrawalRequest parse(MainchainBytesReader reader) {
        int sidechainNumber = reader.readByte("sidechain number") & 0xFF;
        String destination = decodeString(reader.readVarBytes("destination"), "destination");
        long amount = reader.readReversedLong("amount");
        long mainchainFee = reader.readReversedLong("mainchain fee");
        byte statusCode = reader.readByte("status");
        WithdrawalStatus status = WithdrawalStatus.fromCode(statusCode)
                .orElseThrow(() -> new IllegalArgumentException("Unknown withdrawal status " + statusCode));
        byte[] blindedTxHash = reader.readBytes(Utils.SHA256_LENGTH, "blinded transaction hash");

        return new WithdrawalRequest(sidechainNumber, destination, amount, mainchainFee, status, blindedTxHash);
    }

    // Invalid UTF-8 is rejected instead of replaced, so parsed strings serialize back to the same bytes.
    private static String decodeString(byte[] bytes, String type) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException(type + " is not a valid UTF-8 string", e);
        }
    }
}
