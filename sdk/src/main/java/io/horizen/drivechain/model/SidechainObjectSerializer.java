package io.horizen.drivechain.model;

import io.horizen.drivechain.serialization.MainchainSerializer;

/**
 * Serializer of the type specific fields of a sidechain object.
 * The tag byte is not part of the fields, it's written and dispatched by {@link SidechainObjectCodec}.
 */
public interface SidechainObjectSerializer<T extends SidechainObject> extends MainchainSerializer<T> {

    SidechainObjectType objectType();
}
