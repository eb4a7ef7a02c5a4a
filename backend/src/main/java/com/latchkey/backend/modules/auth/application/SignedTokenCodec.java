package com.latchkey.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Map;
import java.util.UUID;

import com.latchkey.backend.modules.auth.application.TokenVerificationException.Reason;
import com.latchkey.backend.modules.auth.infrastructure.jwt.TokenSigningKeyProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.io.Encoders;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies signed, purpose-bound, expiring tokens that identify a user.
 *
 * <p>Tokens are never stored. A token stays valid until its own expiry even when a newer token
 * for the same purpose has been issued since.
 */
@Service
public class SignedTokenCodec {

    static final String PURPOSE_CLAIM = "purpose";

    private final TokenSigningKeyProvider keyProvider;
    private final Map<TokenPurpose, Duration> ttlByPurpose;
    private final Clock clock;

    public SignedTokenCodec(
            TokenSigningKeyProvider keyProvider,
            @Value("${latchkey.token.confirmation-ttl:PT10M}") Duration confirmationTtl,
            @Value("${latchkey.token.password-reset-ttl:PT10M}") Duration passwordResetTtl,
            Clock clock
    ) {
        this.keyProvider = keyProvider;
        this.ttlByPurpose = Map.of(
                TokenPurpose.CONFIRM_EMAIL, confirmationTtl,
                TokenPurpose.RESET_PASSWORD, passwordResetTtl
        );
        this.clock = clock;
    }

    public String issue(UUID subjectId, TokenPurpose purpose) {
        return issue(subjectId, purpose, ttlFor(purpose));
    }

    public String issue(UUID subjectId, TokenPurpose purpose, Duration ttl) {
        if (subjectId == null || purpose == null) {
            throw new IllegalArgumentException("subjectId and purpose are required");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        // iat and exp are whole seconds on the wire; exp rounds up so no token lives shorter than its ttl
        Instant now = clock.instant();
        Instant expiresAt = now.plus(ttl);
        if (expiresAt.getNano() != 0) {
            expiresAt = expiresAt.truncatedTo(ChronoUnit.SECONDS).plusSeconds(1);
        }
        return Jwts.builder()
                .subject(subjectId.toString())
                .claim(PURPOSE_CLAIM, purpose.claimValue())
                .issuedAt(Date.from(now.truncatedTo(ChronoUnit.SECONDS)))
                .expiration(Date.from(expiresAt))
                .signWith(keyProvider.getSecretKey(), SIG.HS256)
                .compact();
    }

    /**
     * @return the subject id the token was issued for
     * @throws TokenVerificationException when the token is tampered, malformed, minted for another
     *         purpose or past its expiry
     */
    public UUID verify(String token, TokenPurpose expectedPurpose) {
        if (token == null || token.isBlank()) {
            throw new TokenVerificationException(Reason.TAMPERED_OR_MALFORMED, "token is blank");
        }
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(keyProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException ex) {
            throw new TokenVerificationException(Reason.EXPIRED, "token expired", ex);
        } catch (JwtException | IllegalArgumentException ex) {
            throw new TokenVerificationException(Reason.TAMPERED_OR_MALFORMED, "token could not be verified", ex);
        }
        requireCanonicalSignature(token);

        Date expiration = claims.getExpiration();
        if (expiration == null) {
            throw new TokenVerificationException(Reason.TAMPERED_OR_MALFORMED, "token has no expiry");
        }
        if (!clock.instant().isBefore(expiration.toInstant())) {
            throw new TokenVerificationException(Reason.EXPIRED, "token expired");
        }
        if (!expectedPurpose.claimValue().equals(claims.get(PURPOSE_CLAIM, String.class))) {
            throw new TokenVerificationException(Reason.WRONG_PURPOSE, "token purpose mismatch");
        }
        String subject = claims.getSubject();
        if (subject == null) {
            throw new TokenVerificationException(Reason.TAMPERED_OR_MALFORMED, "token has no subject");
        }
        try {
            return UUID.fromString(subject);
        } catch (IllegalArgumentException ex) {
            throw new TokenVerificationException(Reason.TAMPERED_OR_MALFORMED, "token subject is not a user id", ex);
        }
    }

    public Duration ttlFor(TokenPurpose purpose) {
        return ttlByPurpose.get(purpose);
    }

    // Base64url leaves spare bits in the final character; reject alternate spellings of the same signature.
    private static void requireCanonicalSignature(String token) {
        String signature = token.substring(token.lastIndexOf('.') + 1);
        try {
            if (!Encoders.BASE64URL.encode(Decoders.BASE64URL.decode(signature)).equals(signature)) {
                throw new TokenVerificationException(Reason.TAMPERED_OR_MALFORMED, "token signature is not canonical");
            }
        } catch (JwtException ex) {
            throw new TokenVerificationException(Reason.TAMPERED_OR_MALFORMED, "token signature is not canonical", ex);
        }
    }
}
