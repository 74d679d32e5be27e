package com.flagship.invoice_followup.credential;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class CredentialCipherTest {

    private static final byte[] AAD = "owner-1".getBytes(StandardCharsets.UTF_8);
    private static final byte[] SECRET_TOKENS = "{\"refresh_token\":\"r1\"}".getBytes(StandardCharsets.UTF_8);

    private final CredentialCipher cipher = new CredentialCipher("test-vault-secret");

    @Test
    @DisplayName("Encrypt then decrypt returns the plaintext; IV and tag have fixed sizes")
    void testEncryptDecrypt() throws GeneralSecurityException {
        EncryptedPayload payload = cipher.encrypt(SECRET_TOKENS, AAD);

        assertEquals(CredentialCipher.IV_LENGTH, payload.getIv().length);
        assertEquals(CredentialCipher.TAG_BYTES, payload.getAuthTag().length);
        assertFalse(Arrays.equals(SECRET_TOKENS, payload.getCiphertext()));
        assertArrayEquals(SECRET_TOKENS, cipher.decrypt(payload, AAD));
    }

    @Test
    @DisplayName("Every encryption uses a fresh IV")
    void testFreshIv() {
        EncryptedPayload a = cipher.encrypt(SECRET_TOKENS, AAD);
        EncryptedPayload b = cipher.encrypt(SECRET_TOKENS, AAD);

        assertFalse(Arrays.equals(a.getIv(), b.getIv()));
        assertFalse(Arrays.equals(a.getCiphertext(), b.getCiphertext()));
    }

    @Test
    @DisplayName("Tampered ciphertext, tag or associated data fails authentication")
    void testTamperingDetected() {
        EncryptedPayload payload = cipher.encrypt(SECRET_TOKENS, AAD);

        byte[] flipped = payload.getCiphertext().clone();
        flipped[0] ^= 0x01;
        assertThrows(GeneralSecurityException.class,
            () -> cipher.decrypt(new EncryptedPayload(flipped, payload.getIv(), payload.getAuthTag()), AAD));

        byte[] badTag = payload.getAuthTag().clone();
        badTag[badTag.length - 1] ^= 0x01;
        assertThrows(GeneralSecurityException.class,
            () -> cipher.decrypt(new EncryptedPayload(payload.getCiphertext(), payload.getIv(), badTag), AAD));

        assertThrows(GeneralSecurityException.class,
            () -> cipher.decrypt(payload, "owner-2".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("A different secret cannot decrypt")
    void testWrongKey() {
        EncryptedPayload payload = cipher.encrypt(SECRET_TOKENS, AAD);

        assertThrows(GeneralSecurityException.class,
            () -> new CredentialCipher("another-secret").decrypt(payload, AAD));
    }

    @Test
    @DisplayName("Malformed IV or tag is rejected before decryption")
    void testMalformedParts() {
        EncryptedPayload payload = cipher.encrypt(SECRET_TOKENS, AAD);

        assertThrows(GeneralSecurityException.class,
            () -> cipher.decrypt(new EncryptedPayload(payload.getCiphertext(), new byte[8], payload.getAuthTag()), AAD));
        assertThrows(GeneralSecurityException.class,
            () -> cipher.decrypt(new EncryptedPayload(payload.getCiphertext(), payload.getIv(), new byte[4]), AAD));
    }

    @Test
    @DisplayName("Missing secret refuses to start")
    void testMissingSecret() {
        assertThrows(IllegalStateException.class, () -> new CredentialCipher("  ").validateKey());
        assertDoesNotThrow(cipher::validateKey);
    }
}
