package com.vaultpost.crypto;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Security;
import java.security.spec.MGF1ParameterSpec;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.RSAKeyGenParameterSpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.OAEPParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.PSource;
import javax.crypto.spec.SecretKeySpec;

import org.bouncycastle.jce.provider.BouncyCastleProvider;

/**
 * Stateless hybrid encryption primitives: RSA-OAEP (SHA-256, MGF1-SHA-256) wraps a
 * per-message AES-256 session key, AES-GCM encrypts the content.
 *
 * Every call draws a fresh session key and a fresh 96-bit IV from the shared
 * {@link SecureRandom}, so instances are safe to use from concurrent callers.
 *
 * <p>Empty content travels as an empty {@code encryptedContent} array with no GCM tag,
 * which keeps the envelope wire form fixed. That case is not authenticated: an envelope
 * whose content array has been stripped to {@code []} opens as {@code ""} without error.
 * Callers that must tell a genuine empty message from a truncated one have to check for
 * empty content themselves.
 */
public class HybridCipher {

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    public static final String ALGORITHM = "RSA-OAEP+AES-GCM";
    public static final int AES_KEY_SIZE = 256;
    public static final int IV_SIZE = 12;       // 96-bit IV
    public static final int TAG_SIZE = 128;     // 128-bit authentication tag
    public static final int SALT_SIZE = 16;

    private static final String PROVIDER = BouncyCastleProvider.PROVIDER_NAME;
    private static final String AES_ALGO = "AES/GCM/NoPadding";
    private static final String RSA_ALGO = "RSA/NONE/OAEPPadding";
    private static final String KDF_ALGO = "PBKDF2WithHmacSHA256";

    private static final OAEPParameterSpec OAEP_SHA256 = new OAEPParameterSpec(
            "SHA-256", "MGF1", MGF1ParameterSpec.SHA256, PSource.PSpecified.DEFAULT);

    private final SecureRandom random;

    public HybridCipher() {
        this(new SecureRandom());
    }

    public HybridCipher(SecureRandom random) {
        this.random = random;
    }

    // --- ASYMMETRIC: RSA-OAEP ---

    public KeyPair generateKeyPair(int keySize) throws GeneralSecurityException {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA", PROVIDER);
        generator.initialize(new RSAKeyGenParameterSpec(keySize, RSAKeyGenParameterSpec.F4), random);
        return generator.generateKeyPair();
    }

    /** SPKI (X.509 SubjectPublicKeyInfo) encoding, base64. */
    public String encodePublicKey(PublicKey publicKey) {
        return Base64.getEncoder().encodeToString(publicKey.getEncoded());
    }

    public PublicKey decodePublicKey(String base64Key) throws GeneralSecurityException {
        byte[] spki;
        try {
            spki = Base64.getDecoder().decode(base64Key.trim());
        } catch (IllegalArgumentException e) {
            throw new GeneralSecurityException("Public key is not valid base64", e);
        }
        return decodePublicKey(spki);
    }

    public PublicKey decodePublicKey(byte[] spki) throws GeneralSecurityException {
        return KeyFactory.getInstance("RSA", PROVIDER).generatePublic(new X509EncodedKeySpec(spki));
    }

    public PrivateKey decodePrivateKey(byte[] pkcs8) throws GeneralSecurityException {
        return KeyFactory.getInstance("RSA", PROVIDER).generatePrivate(new PKCS8EncodedKeySpec(pkcs8));
    }

    // --- HYBRID: envelope ---

    public EncryptedEnvelope encrypt(byte[] plaintext, PublicKey recipientKey) throws GeneralSecurityException {
        KeyGenerator keyGenerator = KeyGenerator.getInstance("AES", PROVIDER);
        keyGenerator.init(AES_KEY_SIZE, random);
        SecretKey sessionKey = keyGenerator.generateKey();

        byte[] iv = new byte[IV_SIZE];
        random.nextBytes(iv);

        // an empty plaintext is carried as an empty ciphertext, not as a bare GCM tag
        byte[] ciphertext = new byte[0];
        if (plaintext.length > 0) {
            Cipher aes = Cipher.getInstance(AES_ALGO, PROVIDER);
            aes.init(Cipher.ENCRYPT_MODE, sessionKey, new GCMParameterSpec(TAG_SIZE, iv));
            ciphertext = aes.doFinal(plaintext);
        }

        Cipher rsa = Cipher.getInstance(RSA_ALGO, PROVIDER);
        rsa.init(Cipher.ENCRYPT_MODE, recipientKey, OAEP_SHA256, random);
        byte[] wrappedKey = rsa.doFinal(sessionKey.getEncoded());

        return new EncryptedEnvelope(ciphertext, wrappedKey, iv);
    }

    public byte[] decrypt(EncryptedEnvelope envelope, PrivateKey recipientKey) throws GeneralSecurityException {
        if (envelope.iv() == null || envelope.iv().length != IV_SIZE) {
            throw new GeneralSecurityException("IV must be " + IV_SIZE + " bytes");
        }
        if (envelope.encryptedKey() == null || envelope.encryptedContent() == null) {
            throw new GeneralSecurityException("Envelope is incomplete");
        }

        Cipher rsa = Cipher.getInstance(RSA_ALGO, PROVIDER);
        rsa.init(Cipher.DECRYPT_MODE, recipientKey, OAEP_SHA256);
        byte[] rawSessionKey = rsa.doFinal(envelope.encryptedKey());
        if (rawSessionKey.length != AES_KEY_SIZE / 8) {
            throw new GeneralSecurityException("Unwrapped session key has unexpected length");
        }

        if (envelope.encryptedContent().length == 0) {
            return new byte[0];
        }

        Cipher aes = Cipher.getInstance(AES_ALGO, PROVIDER);
        aes.init(Cipher.DECRYPT_MODE, new SecretKeySpec(rawSessionKey, "AES"),
                new GCMParameterSpec(TAG_SIZE, envelope.iv()));
        return aes.doFinal(envelope.encryptedContent());
    }

    // --- SYMMETRIC: passphrase sealing for key backups ---

    public KeyBackupEnvelope sealWithPassphrase(byte[] data, char[] passphrase, int iterations)
            throws GeneralSecurityException {
        byte[] salt = new byte[SALT_SIZE];
        byte[] iv = new byte[IV_SIZE];
        random.nextBytes(salt);
        random.nextBytes(iv);

        Cipher aes = Cipher.getInstance(AES_ALGO, PROVIDER);
        aes.init(Cipher.ENCRYPT_MODE, deriveKey(passphrase, salt, iterations), new GCMParameterSpec(TAG_SIZE, iv));
        return new KeyBackupEnvelope(aes.doFinal(data), salt, iv);
    }

    public byte[] openWithPassphrase(KeyBackupEnvelope sealed, char[] passphrase, int iterations)
            throws GeneralSecurityException {
        if (sealed.iv() == null || sealed.iv().length != IV_SIZE || sealed.salt() == null
                || sealed.encryptedData() == null) {
            throw new GeneralSecurityException("Backup envelope is incomplete");
        }
        Cipher aes = Cipher.getInstance(AES_ALGO, PROVIDER);
        aes.init(Cipher.DECRYPT_MODE, deriveKey(passphrase, sealed.salt(), iterations),
                new GCMParameterSpec(TAG_SIZE, sealed.iv()));
        return aes.doFinal(sealed.encryptedData());
    }

    private SecretKey deriveKey(char[] passphrase, byte[] salt, int iterations) throws GeneralSecurityException {
        PBEKeySpec spec = new PBEKeySpec(passphrase, salt, iterations, AES_KEY_SIZE);
        try {
            byte[] derived = SecretKeyFactory.getInstance(KDF_ALGO).generateSecret(spec).getEncoded();
            return new SecretKeySpec(derived, "AES");
        } finally {
            spec.clearPassword();
        }
    }
}
