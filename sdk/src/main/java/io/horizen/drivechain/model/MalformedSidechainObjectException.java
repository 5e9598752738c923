package io.horizen.drivechain.model;

// Thrown when data carries a known sidechain object tag but its fields can't be parsed.
public class MalformedSidechainObjectException extends IllegalArgumentException {

    private final SidechainObjectType objectType;

    public MalformedSidechainObjectException(SidechainObjectType objectType, Throwable cause) {
        super(String.format("Malformed %s data: %s", objectType, cause.getMessage()), cause);
        this.objectType = objectType;
    }

    public SidechainObjectType objectType() {
        return objectType;
    }
}
