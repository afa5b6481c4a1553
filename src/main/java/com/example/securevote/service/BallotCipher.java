package com.example.securevote.service;

import com.example.securevote.config.VoteProperties;
import com.example.securevote.model.Result;
import com.example.securevote.model.VoteError;
import com.example.securevote.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;

/**
 * AES-256-GCM sealing of ballot choices. Sealed form is {@code iv(12) || ciphertext+tag}; a fresh
 * IV per ballot means equal choices never produce equal ciphertexts.
 */
@Component
@Slf4j
public class BallotCipher {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_BYTES = 12;
    private static final int TAG_BITS = 128;

    private final SecretKeySpec key;

    public BallotCipher(VoteProperties properties) {
        String encoded = properties.getBallotEncryptionKey();
        if (encoded == null || encoded.isBlank()) {
            throw new IllegalStateException("vote.ballot-encryption-key is not set");
        }
        byte[] raw = Base64.getDecoder().decode(encoded.trim());
        if (raw.length != 32) {
            throw new IllegalStateException("vote.ballot-encryption-key must decode to 32 bytes, got " + raw.length);
        }
        this.key = new SecretKeySpec(raw, "AES");
    }

    public byte[] seal(String choice) {
        byte[] iv = CryptoUtil.randomBytes(IV_BYTES);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            byte[] sealed = cipher.doFinal(choice.getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.allocate(IV_BYTES + sealed.length).put(iv).put(sealed).array();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM unavailable", e);
        }
    }

    /**
     * @return the plaintext choice, or MALFORMED_REQUEST when the input was not sealed with this key
     */
    public Result<String> open(byte[] sealed) {
        if (sealed == null || sealed.length <= IV_BYTES) {
            return Result.failure(VoteError.MALFORMED_REQUEST, "Sealed ballot too short");
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, sealed, 0, IV_BYTES));
            byte[] plain = cipher.doFinal(sealed, IV_BYTES, sealed.length - IV_BYTES);
            return Result.success(new String(plain, StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            log.debug("Ballot did not open with the configured key: {}", e.getMessage());
            return Result.failure(VoteError.MALFORMED_REQUEST, "Ballot could not be decrypted");
        }
    }
}
