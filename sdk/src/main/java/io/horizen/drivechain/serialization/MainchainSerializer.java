package io.horizen.drivechain.serialization;

public interface MainchainSerializer<T> {

    void serialize(T obj, MainchainBytesWriter writer);

    T parse(MainchainBytesReader reader);

    default byte[] toBytes(T obj) {
        MainchainBytesWriter writer = new MainchainBytesWriter();
        serialize(obj, writer);
        return writer.toBytes();
    }

    // Parses the whole byte array, trailing data is not allowed.
    default T parseBytes(byte[] bytes) {
        MainchainBytesReader reader = new MainchainBytesReader(bytes);
        T obj = parse(reader);
        reader.bufferShouldBeEmpty(obj.getClass().getSimpleName());
        return obj;
    }
}
