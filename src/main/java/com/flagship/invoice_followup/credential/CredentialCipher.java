package com.flagship.invoice_followup.credential;

import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * AES-256-GCM with a key derived as SHA-256 of the configured secret.
 *
 * Each call to {@link #encrypt} draws a fresh random IV. The caller's associated data
 * (the owner id) is authenticated but not stored, so a record copied to another owner
 * fails to decrypt.
 */
@Component
public class CredentialCipher {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    static final int GCM_TAG_LENGTH = 128; // bits
    static final int TAG_BYTES = GCM_TAG_LENGTH / 8;
    static final int IV_LENGTH = 12; // bytes

    private final SecretKeySpec key;
    private final SecureRandom secureRandom = new SecureRandom();

    public CredentialCipher(@Value("${credential.vault.secret:}") String secret) {
        this.key = secret == null || secret.isBlank() ? null : deriveKey(secret);
    }

    @PostConstruct
    void validateKey() {
        if (key == null) {
            throw new IllegalStateException(
                "credential.vault.secret is not set (CREDENTIAL_VAULT_SECRET). "
                    + "Cannot start without a key for credential storage.");
        }
    }

    public EncryptedPayload encrypt(byte[] plaintext, byte[] associatedData) {
        byte[] iv = new byte[IV_LENGTH];
        secureRandom.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            cipher.updateAAD(associatedData);
            byte[] sealed = cipher.doFinal(plaintext);
            // JCE appends the tag; it is stored in its own column.
            int split = sealed.length - TAG_BYTES;
            return new EncryptedPayload(
                Arrays.copyOfRange(sealed, 0, split),
                iv,
                Arrays.copyOfRange(sealed, split, sealed.length));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Encryption failed", e);
        }
    }

    /**
     * @throws GeneralSecurityException on a malformed IV or tag, or when authentication fails
     */
    public byte[] decrypt(EncryptedPayload payload, byte[] associatedData) throws GeneralSecurityException {
        if (payload.getIv() == null || payload.getIv().length != IV_LENGTH) {
            throw new GeneralSecurityException("Malformed IV");
        }
        if (payload.getAuthTag() == null || payload.getAuthTag().length != TAG_BYTES) {
            throw new GeneralSecurityException("Malformed authentication tag");
        }
        if (payload.getCiphertext() == null) {
            throw new GeneralSecurityException("Missing ciphertext");
        }

        byte[] sealed = new byte[payload.getCiphertext().length + TAG_BYTES];
        System.arraycopy(payload.getCiphertext(), 0, sealed, 0, payload.getCiphertext().length);
        System.arraycopy(payload.getAuthTag(), 0, sealed, payload.getCiphertext().length, TAG_BYTES);

        Cipher cipher = Cipher.getInstance(ALGORITHM);
        cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, payload.getIv()));
        cipher.updateAAD(associatedData);
        return cipher.doFinal(sealed);
    }

    private static SecretKeySpec deriveKey(String secret) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(secret.getBytes(StandardCharsets.UTF_8));
            return new SecretKeySpec(digest, "AES");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
