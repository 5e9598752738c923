package io.horizen.drivechain.utils;

import org.apache.logging.log4j.LogManager;
import org.bouncycastle.jce.provider.BouncyCastleProvider;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.Security;

public final class Utils
{
    static {
        // for Ripemd160 hash
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    private Utils() {}

    public static final int SHA256_LENGTH = 32;

    public static final int HASH160_LENGTH = 20;

    public static byte[] doubleSHA256Hash(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(bytes, 0, bytes.length);
            byte[] first = digest.digest();
            return digest.digest(first);
        } catch (NoSuchAlgorithmException e) {
            LogManager.getLogger().error("Unexpected exception: ", e);
            throw new RuntimeException(e);  // Cannot happen.
        }
    }

    // MC CKeyID of a public key.
    public static byte[] Ripemd160Sha256Hash(byte[] bytes) {
        try {
            MessageDigest digest1 = MessageDigest.getInstance("SHA-256");
            MessageDigest digest2 = MessageDigest.getInstance("RIPEMD160");

            digest1.update(bytes, 0, bytes.length);
            byte[] first = digest1.digest();

            digest2.update(first, 0, first.length);
            return digest2.digest();
        } catch (NoSuchAlgorithmException e) {
            LogManager.getLogger().error("Unexpected exception: ", e);
            throw new RuntimeException(e);  // Cannot happen.
        }
    }
}
