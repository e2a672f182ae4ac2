package com.campusevents.service;

import com.campusevents.model.TicketPayload;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.DecodingException;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.io.Encoders;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Signs and verifies the ticket tokens printed into QR codes.
 *
 * A token is a compact HS256 JWS whose claims identify the ticket and carry an
 * expiry 24 hours after the event. Signing is deterministic: the same ticket
 * data always yields the same token, so tokens are never stored.
 */
@Service
public class TicketTokenService {

    private static final Logger logger = LoggerFactory.getLogger(TicketTokenService.class);

    public static final int CURRENT_VERSION = 1;
    static final int MIN_KEY_BYTES = 32;
    static final Duration VALIDITY_AFTER_EVENT = Duration.ofHours(24);

    static final String CLAIM_VERSION = "ver";
    static final String CLAIM_EVENT_ID = "eid";
    static final String CLAIM_TICKET_ID = "tid";
    static final String CLAIM_CODE = "code";
    // Not the registered "exp" claim: the parser would reject expired tokens before the version check
    static final String CLAIM_EXPIRY = "expiry";

    private final SecretKey key;
    private final Clock clock;

    @Autowired
    public TicketTokenService(@Value("${ticket.signing-key:}") String signingKey, Clock clock) {
        if (signingKey == null || signingKey.isBlank()) {
            throw new IllegalStateException("ticket.signing-key is not configured");
        }
        byte[] keyBytes = signingKey.getBytes(StandardCharsets.UTF_8);
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalStateException("ticket.signing-key must be at least " + MIN_KEY_BYTES
                    + " bytes (was " + keyBytes.length + ")");
        }
        this.key = Keys.hmacShaKeyFor(keyBytes);
        this.clock = clock;
    }

    public String sign(String eventId, String ticketId, String uniqueCode, Instant eventDate) {
        Instant expiry = eventDate.plus(VALIDITY_AFTER_EVENT).truncatedTo(ChronoUnit.MILLIS);
        return Jwts.builder()
                .claim(CLAIM_VERSION, CURRENT_VERSION)
                .claim(CLAIM_EVENT_ID, eventId)
                .claim(CLAIM_TICKET_ID, ticketId)
                .claim(CLAIM_CODE, uniqueCode)
                .claim(CLAIM_EXPIRY, expiry.toEpochMilli())
                .signWith(key, Jwts.SIG.HS256)
                .compact();
    }

    /**
     * Check a scanned token. Gates run in order: structure, signature, version,
     * expiry. Bad tokens are reported in the result, never thrown.
     */
    public TicketValidationResult verify(String token) {
        if (token == null || token.isBlank()) {
            return TicketValidationResult.malformed();
        }

        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(key)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (SignatureException e) {
            logger.warn("Rejected ticket token with invalid signature");
            return TicketValidationResult.signatureInvalid();
        } catch (JwtException | IllegalArgumentException e) {
            if (hasThreeSegments(token) && !hasCanonicalSignature(token)) {
                logger.warn("Rejected ticket token with undecodable signature");
                return TicketValidationResult.signatureInvalid();
            }
            logger.debug("Rejected malformed ticket token: {}", e.getMessage());
            return TicketValidationResult.malformed();
        }

        // The last base64url character carries unused bits the decoder ignores
        if (!hasCanonicalSignature(token)) {
            logger.warn("Rejected ticket token with non-canonical signature encoding");
            return TicketValidationResult.signatureInvalid();
        }

        Object version = claims.get(CLAIM_VERSION);
        Object expiryMillis = claims.get(CLAIM_EXPIRY);
        String eventId = claims.get(CLAIM_EVENT_ID, String.class);
        String ticketId = claims.get(CLAIM_TICKET_ID, String.class);
        String code = claims.get(CLAIM_CODE, String.class);
        if (!(version instanceof Number) || !(expiryMillis instanceof Number)
                || eventId == null || ticketId == null || code == null) {
            return TicketValidationResult.malformed();
        }

        int tokenVersion = ((Number) version).intValue();
        if (tokenVersion != CURRENT_VERSION) {
            return TicketValidationResult.unsupportedVersion(tokenVersion);
        }

        Instant expiry = Instant.ofEpochMilli(((Number) expiryMillis).longValue());
        if (clock.instant().isAfter(expiry)) {
            return TicketValidationResult.expired(expiry);
        }

        return TicketValidationResult.valid(new TicketPayload(tokenVersion, eventId, ticketId, code, expiry));
    }

    private static boolean hasThreeSegments(String token) {
        return token.split("\\.", -1).length == 3;
    }

    /**
     * True when the signature segment is exactly what the encoder would emit
     * for the bytes it decodes to.
     */
    private static boolean hasCanonicalSignature(String token) {
        String signature = token.substring(token.lastIndexOf('.') + 1);
        try {
            return Encoders.BASE64URL.encode(Decoders.BASE64URL.decode(signature)).equals(signature);
        } catch (DecodingException e) {
            logger.debug("Signature segment is not base64url: {}", e.getMessage());
            return false;
        }
    }
}
