package io.horizen.drivechain.serialization;

public interface MainchainSerializable {

    MainchainSerializer<? extends MainchainSerializable> serializer();

    byte[] bytes();
}
