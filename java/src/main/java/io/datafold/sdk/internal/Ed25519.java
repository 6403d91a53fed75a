package io.datafold.sdk.internal;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;

/**
 * Bridges raw 32-byte Ed25519 keys to the JCA provider shipped with the JDK.
 */
public final class Ed25519 {

    public static final String ALGORITHM = "Ed25519";
    public static final int KEY_LENGTH = 32;
    public static final int SIGNATURE_LENGTH = 64;

    private static final byte[] X509_PREFIX = Hex.decode("302a300506032b6570032100");
    private static final byte[] PKCS8_PREFIX = Hex.decode("302e020100300506032b657004220420");

    private Ed25519() {
    }

    /**
     * Raw key pair as exchanged with key providers.
     */
    public record RawKeyPair(byte[] privateKey, byte[] publicKey) {

        public RawKeyPair {
            privateKey = privateKey.clone();
            publicKey = publicKey.clone();
        }

        @Override
        public byte[] privateKey() {
            return privateKey.clone();
        }

        @Override
        public byte[] publicKey() {
            return publicKey.clone();
        }
    }

    public static boolean isValidKeyLength(byte[] raw) {
        return raw != null && raw.length == KEY_LENGTH;
    }

    /**
     * A 32-byte key made only of zero bytes is rejected as a placeholder.
     */
    public static boolean isUsablePrivateKey(byte[] raw) {
        if (!isValidKeyLength(raw)) {
            return false;
        }
        for (byte b : raw) {
            if (b != 0) {
                return true;
            }
        }
        return false;
    }

    public static PublicKey publicKey(byte[] raw) throws GeneralSecurityException {
        if (!isValidKeyLength(raw)) {
            throw new GeneralSecurityException("Ed25519 public key must be " + KEY_LENGTH + " bytes");
        }
        KeyFactory factory = KeyFactory.getInstance(ALGORITHM);
        return factory.generatePublic(new X509EncodedKeySpec(concat(X509_PREFIX, raw)));
    }

    public static PrivateKey privateKey(byte[] raw) throws GeneralSecurityException {
        if (!isValidKeyLength(raw)) {
            throw new GeneralSecurityException("Ed25519 private key must be " + KEY_LENGTH + " bytes");
        }
        KeyFactory factory = KeyFactory.getInstance(ALGORITHM);
        return factory.generatePrivate(new PKCS8EncodedKeySpec(concat(PKCS8_PREFIX, raw)));
    }

    public static byte[] sign(PrivateKey key, byte[] payload) throws GeneralSecurityException {
        Signature signature = Signature.getInstance(ALGORITHM);
        signature.initSign(key);
        signature.update(payload);
        return signature.sign();
    }

    /**
     * Verifies a detached signature. Any malformed input yields {@code false}.
     */
    public static boolean verify(byte[] rawPublicKey, byte[] payload, byte[] signatureBytes) {
        if (signatureBytes == null || signatureBytes.length != SIGNATURE_LENGTH) {
            return false;
        }
        try {
            Signature signature = Signature.getInstance(ALGORITHM);
            signature.initVerify(publicKey(rawPublicKey));
            signature.update(payload);
            return signature.verify(signatureBytes);
        } catch (GeneralSecurityException | IllegalArgumentException ex) {
            return false;
        }
    }

    /**
     * Generates a fresh key pair and returns the raw 32-byte halves.
     */
    public static RawKeyPair generateKeyPair() throws GeneralSecurityException {
        KeyPairGenerator generator = KeyPairGenerator.getInstance(ALGORITHM);
        KeyPair pair = generator.generateKeyPair();
        byte[] encodedPrivate = pair.getPrivate().getEncoded();
        byte[] encodedPublic = pair.getPublic().getEncoded();
        return new RawKeyPair(
            Arrays.copyOfRange(encodedPrivate, encodedPrivate.length - KEY_LENGTH, encodedPrivate.length),
            Arrays.copyOfRange(encodedPublic, encodedPublic.length - KEY_LENGTH, encodedPublic.length)
        );
    }

    private static byte[] concat(byte[] prefix, byte[] raw) {
        byte[] out = new byte[prefix.length + raw.length];
        System.arraycopy(prefix, 0, out, 0, prefix.length);
        System.arraycopy(raw, 0, out, prefix.length, raw.length);
        return out;
    }
}
