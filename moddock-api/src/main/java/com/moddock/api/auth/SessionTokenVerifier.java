package com.moddock.api.auth;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Date;
import java.util.Optional;

/**
 * Verifies session cookies issued by the external identity provider.
 *
 * The provider signs sessions as HS256 JWTs with a shared secret; the
 * subject is the user's external identity id. Issuing sessions is the
 * provider's job, this side only validates them.
 */
@Service
public class SessionTokenVerifier {

    private static final Logger log = LoggerFactory.getLogger(SessionTokenVerifier.class);

    private final SecretKey signingKey;
    private final Clock clock;

    public SessionTokenVerifier(
            @Value("${moddock.session.secret}") String sessionSecret,
            Clock clock) {

        if (sessionSecret == null || sessionSecret.length() < 32) {
            throw new IllegalArgumentException("Session secret must be at least 32 characters");
        }

        this.signingKey = Keys.hmacShaKeyFor(sessionSecret.getBytes(StandardCharsets.UTF_8));
        this.clock = clock;
    }

    /**
     * Returns the external identity id carried by a valid session token, or
     * empty when the token is malformed, badly signed or expired.
     */
    public Optional<String> verify(String sessionToken) {
        if (sessionToken == null || sessionToken.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(sessionToken)
                    .getPayload();

            String subject = claims.getSubject();
            if (subject == null || subject.isBlank()) {
                log.debug("Session token without subject rejected");
                return Optional.empty();
            }
            return Optional.of(subject);
        } catch (ExpiredJwtException e) {
            log.debug("Expired session token rejected");
            return Optional.empty();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Invalid session token rejected: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
