package com.vaultpost.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Key sizes and key-derivation cost.
 *
 * <pre>
 * vaultpost:
 *   crypto:
 *     rsa-key-size: 2048
 *     pbkdf2-iterations: 100000
 * </pre>
 */
@ConfigurationProperties(prefix = "vaultpost.crypto")
public class CryptoProperties {

    /** RSA modulus length in bits for generated key pairs. */
    private int rsaKeySize = 2048;

    /** PBKDF2-HMAC-SHA256 iteration count for key backups. */
    private int pbkdf2Iterations = 100_000;

    public int getRsaKeySize() { return rsaKeySize; }
    public void setRsaKeySize(int rsaKeySize) { this.rsaKeySize = rsaKeySize; }

    public int getPbkdf2Iterations() { return pbkdf2Iterations; }
    public void setPbkdf2Iterations(int pbkdf2Iterations) { this.pbkdf2Iterations = pbkdf2Iterations; }
}
