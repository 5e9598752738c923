package io.horizen.drivechain.serialization;

// Jackson views used to select the properties exposed in JSON representations.
public final class Views {
    private Views() {}

    public static class Default {}
}
