package com.flagship.invoice_followup.credential;

import lombok.Value;

/**
 * AES-GCM output stored as one unit: ciphertext, 12-byte IV and 16-byte tag.
 */
@Value
public class EncryptedPayload {
    byte[] ciphertext;
    byte[] iv;
    byte[] authTag;
}
