package com.latchkey.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * HMAC key for confirmation and password-reset tokens. Accepts Base64 or a raw string.
 */
@Component
public class TokenSigningKeyProvider {

    public static final int MIN_KEY_BYTES = 32;
    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final SecretKey secretKey;

    public TokenSigningKeyProvider(@Value("${latchkey.token.secret}") String secretString) {
        byte[] keyBytes = decode(secretString);
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalStateException("latchkey.token.secret must be at least " + MIN_KEY_BYTES + " bytes");
        }
        this.secretKey = new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }

    static byte[] decode(String secretString) {
        if (secretString == null) {
            return new byte[0];
        }
        try {
            byte[] decoded = Base64.getDecoder().decode(secretString);
            if (decoded.length >= MIN_KEY_BYTES) {
                return decoded;
            }
        } catch (IllegalArgumentException ex) {
            // not Base64, fall through to the raw bytes
        }
        return secretString.getBytes(StandardCharsets.UTF_8);
    }
}
