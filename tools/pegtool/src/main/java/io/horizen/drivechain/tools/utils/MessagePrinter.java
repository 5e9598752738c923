package io.horizen.drivechain.tools.utils;

public interface MessagePrinter {
    void print(String message);
}
