package io.horizen.drivechain.model;

import io.horizen.drivechain.serialization.MainchainBytesReader;
import io.horizen.drivechain.serialization.MainchainBytesWriter;
import io.horizen.drivechain.utils.BytesUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Tag dispatched encoding of sidechain objects: one tag byte followed by the type specific fields.
 *
 * Decoding data which is empty or starts with an unknown tag is not an error, it just doesn't contain
 * a sidechain object. A known tag followed by data which can't be parsed is reported with
 * {@link MalformedSidechainObjectException}.
 */
public final class SidechainObjectCodec {
    private static final Logger log = LogManager.getLogger(SidechainObjectCodec.class);

    private static final Map<SidechainObjectType, SidechainObjectSerializer<? extends SidechainObject>> serializers;

    static {
        Map<SidechainObjectType, SidechainObjectSerializer<? extends SidechainObject>> map = new EnumMap<>(SidechainObjectType.class);
        register(map, WithdrawalRequestSerializer.getSerializer());
        register(map, WithdrawalBundleSerializer.getSerializer());
        register(map, DepositSerializer.getSerializer());
        serializers = Collections.unmodifiableMap(map);
    }

    private SidechainObjectCodec() {}

    private static void register(Map<SidechainObjectType, SidechainObjectSerializer<? extends SidechainObject>> map,
                                 SidechainObjectSerializer<? extends SidechainObject> serializer) {
        if (map.put(serializer.objectType(), serializer) != null)
            throw new IllegalArgumentException("Serializers types expected to be unique.");
    }

    public static byte[] encode(SidechainObject obj) {
        SidechainObjectSerializer<? extends SidechainObject> serializer = serializers.get(obj.objectType());
        // Type and serializer of an object can only disagree if the object model itself is broken.
        if (serializer == null || serializer != obj.serializer())
            throw new IllegalStateException(String.format("No serializer registered for %s of type %s",
                    obj.getClass().getSimpleName(), obj.objectType()));

        MainchainBytesWriter writer = new MainchainBytesWriter();
        writer.put(obj.objectType().id());
        obj.serializeFields(writer);
        return writer.toBytes();
    }

    public static Optional<SidechainObject> decode(byte[] bytes) {
        if (bytes.length == 0)
            return Optional.empty();

        Optional<SidechainObjectType> type = SidechainObjectType.fromId(bytes[0]);
        if (type.isEmpty()) {
            log.debug("Data with unknown sidechain object tag {} skipped", String.format("0x%02x", bytes[0]));
            return Optional.empty();
        }

        MainchainBytesReader reader = new MainchainBytesReader(bytes, 1);
        try {
            SidechainObject obj = serializers.get(type.get()).parse(reader);
            reader.bufferShouldBeEmpty(type.get().name());
            return Optional.of(obj);
        } catch (IllegalArgumentException e) {
            log.debug("Malformed {} data {}", type.get(), BytesUtils.toHexString(bytes));
            throw new MalformedSidechainObjectException(type.get(), e);
        }
    }
}
